package com.dealpick.deal.dto;

public record UnitPriceResponse(
    Double amount,
    String unit,
    String display
) {
}
