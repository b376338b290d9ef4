package com.demo.chat.domain;

import lombok.Value;

@Value
public class JoinOutcome {
    Room room;
    boolean created;
    boolean joined;
}
