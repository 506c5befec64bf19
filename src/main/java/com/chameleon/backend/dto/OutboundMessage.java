package com.chameleon.backend.dto;

import lombok.Value;

@Value
public class OutboundMessage {
    String type;
    Object data;
}
