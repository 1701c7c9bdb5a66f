package com.dealpick.deal.dto;

public record StaplePriceResponse(
    String retailer,
    Double bestPrice,
    String display
) {
}
