package com.demo.chat.domain;

import lombok.Value;

@Value
public class LeaveOutcome {
    boolean left;
    boolean roomNowEmpty;
}
