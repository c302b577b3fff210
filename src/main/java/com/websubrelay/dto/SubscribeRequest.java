package com.websubrelay.dto;

import lombok.Data;

@Data
public class SubscribeRequest {
    private String sourceId;
}
