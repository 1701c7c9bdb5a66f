package com.dealpick.deal.dto;

import com.dealpick.deal.model.ScoreBreakdown;

public record ScoredDealResponse(
    int rank,
    Object dealId,
    String retailer,
    String productName,
    String brand,
    String category,
    String categoryGroup,
    Double priceAmount,
    String priceDisplay,
    Double savingsPercent,
    Double unitPriceAmount,
    String unitPriceUnit,
    String unitPriceDisplay,
    Integer quantityRequired,
    String format,
    boolean priority,
    int engagementScore,
    ScoreBreakdown breakdown
) {
}
