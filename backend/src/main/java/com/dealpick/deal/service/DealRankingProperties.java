package com.dealpick.deal.service;

import com.dealpick.deal.engine.DealRankingConfig;
import com.dealpick.deal.engine.PriorityDealRule;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "deals.ranking")
public class DealRankingProperties {

    private static final DealRankingConfig DEFAULTS = DealRankingConfig.defaults();

    /**
     * Deals returned when a request does not set topN
     */
    private int defaultTopN = 6;

    /**
     * Deals shown per retailer in the cross-retailer comparison
     */
    private int comparisonTopN = 3;

    private boolean dedupe = DEFAULTS.dedupe();

    private boolean balanceCategories = DEFAULTS.balanceCategories();

    private List<String> storeBrands = new ArrayList<>(DEFAULTS.storeBrands());

    private List<String> excludedCategories = new ArrayList<>(DEFAULTS.excludedCategories());

    private List<String> supplementKeywords = new ArrayList<>(DEFAULTS.supplementKeywords());

    private List<String> excludedProducts = new ArrayList<>(DEFAULTS.excludedProducts());

    /**
     * Checked in declaration order; the first matching rule supplies the bonus
     */
    private Map<String, PriorityRule> priorityDeals = defaultPriorityDeals();

    private List<String> premiumKeywords = new ArrayList<>(DEFAULTS.premiumKeywords());

    private List<String> viralKeywords = new ArrayList<>(DEFAULTS.viralKeywords());

    private List<String> majorBrands = new ArrayList<>(DEFAULTS.majorBrands());

    private List<String> popularSnackBrands = new ArrayList<>(DEFAULTS.popularSnackBrands());

    private List<String> interestingKeywords = new ArrayList<>(DEFAULTS.interestingKeywords());

    private List<String> kidKeywords = new ArrayList<>(DEFAULTS.kidKeywords());

    private List<String> mealKeywords = new ArrayList<>(DEFAULTS.mealKeywords());

    private List<String> partyKeywords = new ArrayList<>(DEFAULTS.partyKeywords());

    private List<String> regionalBrands = new ArrayList<>(DEFAULTS.regionalBrands());

    private Map<String, Integer> categoryWeights = new LinkedHashMap<>(DEFAULTS.categoryWeights());

    private List<Staple> staples = defaultStaples();

    public DealRankingConfig toConfig() {
        List<PriorityDealRule> rules = new ArrayList<>();
        priorityDeals.forEach((name, rule) -> rules.add(rule.toRule(name)));

        return DealRankingConfig.builder()
            .storeBrands(storeBrands)
            .excludedCategories(excludedCategories)
            .supplementKeywords(supplementKeywords)
            .excludedProducts(excludedProducts)
            .priorityRules(rules)
            .premiumKeywords(premiumKeywords)
            .viralKeywords(viralKeywords)
            .majorBrands(majorBrands)
            .popularSnackBrands(popularSnackBrands)
            .interestingKeywords(interestingKeywords)
            .kidKeywords(kidKeywords)
            .mealKeywords(mealKeywords)
            .partyKeywords(partyKeywords)
            .regionalBrands(regionalBrands)
            .categoryWeights(categoryWeights)
            .dedupe(dedupe)
            .balanceCategories(balanceCategories)
            .build();
    }

    private static Map<String, PriorityRule> defaultPriorityDeals() {
        Map<String, PriorityRule> rules = new LinkedHashMap<>();
        for (PriorityDealRule rule : DEFAULTS.priorityRules()) {
            PriorityRule bound = new PriorityRule();
            bound.setKeywords(new ArrayList<>(rule.keywords()));
            bound.setExcludeKeywords(new ArrayList<>(rule.excludeKeywords()));
            bound.setMaxPricePerLb(rule.maxPricePerLb());
            bound.setCategory(new ArrayList<>(rule.categories()));
            bound.setBonusScore(rule.bonusScore());
            rules.put(rule.name(), bound);
        }
        return rules;
    }

    private static List<Staple> defaultStaples() {
        List<Staple> staples = new ArrayList<>();
        staples.add(new Staple("Chicken (per lb)", List.of("chicken breast", "chicken thighs", "chicken thigh", "chicken"), true));
        staples.add(new Staple("Beef (per lb)", List.of("ground beef", "steak", "sirloin", "ribeye", "beef"), true));
        staples.add(new Staple("Apples", List.of("apple", "apples"), false));
        return staples;
    }

    @Getter
    @Setter
    public static class PriorityRule {

        private List<String> keywords = new ArrayList<>();

        private List<String> excludeKeywords = new ArrayList<>();

        private double maxPricePerLb;

        private List<String> category = new ArrayList<>();

        private int bonusScore;

        private PriorityDealRule toRule(String name) {
            return new PriorityDealRule(name, keywords, excludeKeywords, maxPricePerLb, category, bonusScore);
        }
    }

    @Getter
    @Setter
    public static class Staple {

        private String label;

        private List<String> keywords = new ArrayList<>();

        /**
         * Suffix the comparison price with /lb
         */
        private boolean perPound;

        public Staple() {
        }

        public Staple(String label, List<String> keywords, boolean perPound) {
            this.label = label;
            this.keywords = new ArrayList<>(keywords);
            this.perPound = perPound;
        }
    }
}
