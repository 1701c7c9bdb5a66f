package com.dealpick.deal.engine;

import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.UnitPrice;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class PriorityDetector {

    private final DealRankingConfig config;
    private final UnitNormalizer unitNormalizer;

    public PriorityDetector(DealRankingConfig config, UnitNormalizer unitNormalizer) {
        this.config = config;
        this.unitNormalizer = unitNormalizer;
    }

    public Optional<PriorityDealRule> matchingRule(DealRecord deal) {
        UnitPrice unitPrice = unitNormalizer.computeUnitPrice(deal);
        if (!"lb".equals(unitPrice.unit()) || unitPrice.amount() == null) {
            return Optional.empty();
        }

        String productName = deal.productName() == null ? "" : deal.productName().toLowerCase(Locale.ROOT);
        String category = deal.category() == null ? "" : deal.category();

        for (PriorityDealRule rule : config.priorityRules()) {
            if (!rule.categories().contains(category)) {
                continue;
            }
            if (unitPrice.amount() > rule.maxPricePerLb()) {
                continue;
            }
            if (!containsAny(productName, rule.keywords())) {
                continue;
            }
            if (containsAny(productName, rule.excludeKeywords())) {
                continue;
            }
            return Optional.of(rule);
        }
        return Optional.empty();
    }

    public boolean isPriority(DealRecord deal) {
        return matchingRule(deal).isPresent();
    }

    public int bonusFor(DealRecord deal) {
        return matchingRule(deal).map(PriorityDealRule::bonusScore).orElse(0);
    }

    private boolean containsAny(String text, List<String> keywords) {
        return ExclusionFilter.containsAny(text, keywords);
    }
}
