package com.dealpick.deal.model;

public record ExcludedDeal(DealRecord deal, ExclusionReason reason) {
}
