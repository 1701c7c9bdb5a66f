package com.dealpick.deal.model;

public record ScoreBreakdown(
    int viralPricing,
    int discountDepth,
    int categoryWeight,
    int premiumValue,
    int socialAppeal,
    int brandRecognition,
    int priorityBonus
) {

    public int total() {
        return viralPricing
            + discountDepth
            + categoryWeight
            + premiumValue
            + socialAppeal
            + brandRecognition
            + priorityBonus;
    }
}
