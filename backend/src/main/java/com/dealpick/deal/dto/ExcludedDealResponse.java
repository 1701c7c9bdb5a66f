package com.dealpick.deal.dto;

public record ExcludedDealResponse(
    Object dealId,
    String retailer,
    String productName,
    String category,
    String reason
) {
}
