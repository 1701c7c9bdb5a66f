package com.dealpick.deal.engine;

import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ScoreBreakdown;
import com.dealpick.deal.model.UnitPrice;
import java.util.List;
import java.util.Locale;

/**
 * Engagement heuristic: six component scores plus the priority bonus. Every component reads the
 * multibuy-adjusted deal.
 */
public class DealScorer {

    private static final int DEFAULT_CATEGORY_WEIGHT = 5;
    private static final int MAX_VIRAL_PRICING = 30;
    private static final int MAX_DISCOUNT_DEPTH = 20;
    private static final List<String> CHARM_PRICE_ENDINGS = List.of("0.99", "1.99", "2.49", "2.99", "4.99", "9.99");

    private final DealRankingConfig config;
    private final MultibuyPricing multibuyPricing;
    private final UnitNormalizer unitNormalizer;
    private final PriorityDetector priorityDetector;

    public DealScorer(
        DealRankingConfig config,
        MultibuyPricing multibuyPricing,
        UnitNormalizer unitNormalizer,
        PriorityDetector priorityDetector
    ) {
        this.config = config;
        this.multibuyPricing = multibuyPricing;
        this.unitNormalizer = unitNormalizer;
        this.priorityDetector = priorityDetector;
    }

    public ScoreBreakdown score(DealRecord deal) {
        DealRecord effective = multibuyPricing.apply(deal);
        return new ScoreBreakdown(
            viralPricing(effective),
            discountDepth(effective),
            categoryWeight(effective),
            premiumValue(effective),
            socialAppeal(effective),
            brandRecognition(effective),
            priorityDetector.bonusFor(effective)
        );
    }

    public int totalScore(DealRecord deal) {
        return score(deal).total();
    }

    /**
     * Comparable unit price when one resolves ($4.99 for 3lb scores as $1.66), otherwise the
     * package price.
     */
    double effectivePrice(DealRecord deal) {
        DealRecord effective = multibuyPricing.apply(deal);
        UnitPrice unitPrice = unitNormalizer.computeUnitPrice(effective);
        if (unitPrice.resolved()) {
            return unitPrice.amount();
        }
        Double amount = effective.price() == null ? null : effective.price().numericAmount();
        return amount == null ? 0.0 : amount;
    }

    int viralPricing(DealRecord deal) {
        int score = 0;
        double price = effectivePrice(deal);

        if (price < 1.00) {
            score += 30;
        } else if (price <= 2.99) {
            score += 20;
        } else if (price <= 4.99) {
            score += 10;
        }

        DealPrice dealPrice = deal.price();
        Double rawAmount = dealPrice == null ? null : dealPrice.numericAmount();
        if (rawAmount != null) {
            String twoDecimals = PriceFormat.twoDecimals(rawAmount);
            if (CHARM_PRICE_ENDINGS.stream().anyMatch(twoDecimals::endsWith)) {
                score += 8;
            }
        }

        if (dealPrice != null && dealPrice.multibuy()) {
            score += 15;
        }

        Double savingsPercent = dealPrice == null ? null : dealPrice.numericSavingsPercent();
        if (savingsPercent != null) {
            if (savingsPercent >= 50) {
                score += 12;
            } else if (savingsPercent >= 30) {
                score += 8;
            }
        }

        return Math.min(score, MAX_VIRAL_PRICING);
    }

    int discountDepth(DealRecord deal) {
        DealPrice price = deal.price();
        if (price == null) {
            return 0;
        }

        Double savingsPercent = price.numericSavingsPercent();
        if (savingsPercent != null) {
            return discountPoints(savingsPercent);
        }

        Double original = price.numericOriginalPrice();
        Double amount = price.numericAmount();
        if (original != null && amount != null && original > 0 && amount >= 0) {
            return discountPoints((original - amount) / original * 100.0);
        }

        return 0;
    }

    // 10% -> 2, 25% -> 7, 40% -> 13, 60% and up -> 20
    private int discountPoints(double savingsPercent) {
        double points = Math.rint((savingsPercent - 5) * 20 / 55);
        return (int) Math.max(0, Math.min(MAX_DISCOUNT_DEPTH, points));
    }

    int categoryWeight(DealRecord deal) {
        return config.categoryWeight(deal.category(), DEFAULT_CATEGORY_WEIGHT);
    }

    int premiumValue(DealRecord deal) {
        String combined = lower(deal.productName()) + " " + lower(deal.specialNotes()) + " " + lower(deal.brand());

        if (containsAny(combined, config.premiumKeywords())) {
            return 25;
        }
        if (containsAny(combined, config.popularSnackBrands())) {
            return 20;
        }
        if (combined.contains("organic")) {
            return 18;
        }
        Double savingsPercent = deal.price() == null ? null : deal.price().numericSavingsPercent();
        if (savingsPercent != null && savingsPercent >= 30) {
            return 15;
        }
        return 5;
    }

    int socialAppeal(DealRecord deal) {
        String combined = lower(deal.productName()) + " " + lower(deal.specialNotes());

        // order matters: party scores above kid and meal but is checked after them
        if (containsAny(combined, config.viralKeywords())) {
            return 20;
        }
        if (containsAny(combined, config.interestingKeywords())) {
            return 18;
        }
        if (containsAny(combined, config.kidKeywords())) {
            return 12;
        }
        if (containsAny(combined, config.mealKeywords())) {
            return 10;
        }
        if (containsAny(combined, config.partyKeywords())) {
            return 15;
        }
        return 5;
    }

    int brandRecognition(DealRecord deal) {
        String combined = lower(deal.productName()) + " " + lower(deal.brand());

        if (containsAny(combined, config.majorBrands())) {
            return 10;
        }
        if (containsAny(combined, config.regionalBrands())) {
            return 8;
        }
        return 5;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return ExclusionFilter.containsAny(text, keywords);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
