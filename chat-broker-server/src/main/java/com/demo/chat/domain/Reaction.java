package com.demo.chat.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Reaction {
    String emoji;
    String userId;
}
