package com.dealpick.deal.engine;

import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ExclusionReason;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a deal is kept. Checks run in a fixed order and the first failing check names
 * the reason.
 */
public class ExclusionFilter {

    private static final List<String> ALCOHOL_TOKENS = List.of("ALCOHOL", "BEER", "WINE", "SPIRITS");
    private static final List<String> HEALTH_TOKENS = List.of("HEALTH", "BEAUTY");
    private static final List<String> PROTEIN_TOKENS = List.of("MEAT", "DELI", "SEAFOOD");

    private final DealRankingConfig config;
    private final String retailerFilter;
    private final List<Pattern> storeBrandPatterns;

    public ExclusionFilter(DealRankingConfig config, String retailerFilter) {
        this.config = config;
        this.retailerFilter = retailerFilter;
        this.storeBrandPatterns = compileStoreBrandPatterns(config.storeBrands());
    }

    public Optional<ExclusionReason> reasonFor(DealRecord deal) {
        DealPrice price = deal.price();
        Double amount = price == null ? null : price.numericAmount();

        if (amount == null) {
            return Optional.of(ExclusionReason.MISSING_PRICE_AMOUNT);
        }
        if (amount < 0) {
            return Optional.of(ExclusionReason.INVALID_NEGATIVE_PRICE);
        }

        String category = deal.category() == null ? "" : deal.category();
        String categoryUpper = category.toUpperCase(Locale.ROOT);

        if (config.excludedCategories().contains(category) || containsAny(categoryUpper, ALCOHOL_TOKENS)) {
            return Optional.of(ExclusionReason.EXCLUDED_CATEGORY_ALCOHOL);
        }

        String productName = deal.productName() == null ? "" : deal.productName();
        String productLower = productName.toLowerCase(Locale.ROOT);

        if (containsAny(categoryUpper, HEALTH_TOKENS) && containsAny(productLower, config.supplementKeywords())) {
            return Optional.of(ExclusionReason.EXCLUDED_SUPPLEMENT);
        }

        if (isStoreBrand(productName, deal.brand())) {
            return Optional.of(ExclusionReason.EXCLUDED_STORE_BRAND);
        }

        if (containsAny(productLower, config.excludedProducts()) && containsAny(categoryUpper, PROTEIN_TOKENS)) {
            return Optional.of(ExclusionReason.EXCLUDED_PRODUCT_KEYWORD);
        }

        if (retailerFilter != null && !retailerFilter.isEmpty() && !retailerFilter.equals(deal.retailer())) {
            return Optional.of(ExclusionReason.FILTERED_OUT_BY_RETAILER);
        }

        return Optional.empty();
    }

    private boolean isStoreBrand(String productName, String rawBrand) {
        String brand = rawBrand == null ? "" : rawBrand;
        String brandLower = brand.toLowerCase(Locale.ROOT).trim();
        if (!brandLower.isEmpty()) {
            for (String storeBrand : config.storeBrands()) {
                if (brandLower.equals(storeBrand.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }

        String combined = (productName + " " + brand).toLowerCase(Locale.ROOT);
        for (Pattern pattern : storeBrandPatterns) {
            if (pattern.matcher(combined).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileStoreBrandPatterns(List<String> storeBrands) {
        List<Pattern> patterns = new ArrayList<>();
        for (String storeBrand : storeBrands) {
            String phrase = storeBrand == null ? "" : storeBrand.trim();
            if (phrase.isEmpty()) {
                continue;
            }
            // phrase may contain punctuation ("H-E-B"), so only its outer edges need a word boundary
            patterns.add(Pattern.compile(
                "(?<!\\w)" + Pattern.quote(phrase) + "(?!\\w)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS
            ));
        }
        return List.copyOf(patterns);
    }

    static boolean containsAny(String text, List<String> tokens) {
        for (String token : tokens) {
            if (text.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
