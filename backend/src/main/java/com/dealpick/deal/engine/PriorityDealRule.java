package com.dealpick.deal.engine;

import java.util.List;

/**
 * Auto-include rule for a staple: a deal qualifies when its category is listed, its price per
 * pound is at most {@code maxPricePerLb}, and its name contains a keyword but no exclude keyword.
 */
public record PriorityDealRule(
    String name,
    List<String> keywords,
    List<String> excludeKeywords,
    double maxPricePerLb,
    List<String> categories,
    int bonusScore
) {

    public PriorityDealRule {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        excludeKeywords = excludeKeywords == null ? List.of() : List.copyOf(excludeKeywords);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
