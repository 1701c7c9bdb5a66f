package com.dealpick.deal.model;

/**
 * A deal that survived exclusion, with its derived ranking fields. {@code deal} is the
 * multibuy-adjusted copy; the caller's record is never modified.
 */
public record ScoredDeal(
    DealRecord deal,
    int engagementScore,
    CategoryGroup categoryGroup,
    boolean priority,
    UnitPrice unitPrice,
    ScoreBreakdown breakdown
) {

    public DealPrice price() {
        return deal.price();
    }
}
