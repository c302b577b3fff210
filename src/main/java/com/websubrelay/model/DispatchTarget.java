package com.websubrelay.model;

public record DispatchTarget(String accountName, String target) {
}
