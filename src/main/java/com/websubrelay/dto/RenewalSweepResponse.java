package com.websubrelay.dto;

public record RenewalSweepResponse(int renewed) {
}
