package com.dealpick.deal.engine;

import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.NormalizedUnit;
import com.dealpick.deal.model.UnitKind;
import com.dealpick.deal.model.UnitPrice;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class UnitNormalizer {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private static final Set<String> POUND_TOKENS = Set.of("lb", "lbs", "pound", "pounds");
    private static final Set<String> FLUID_OUNCE_TOKENS = Set.of("floz", "fl.oz", "fl-oz", "fl oz");
    private static final Set<String> COUNT_TOKENS = Set.of("count", "ct");
    private static final Set<String> EACH_TOKENS = Set.of("each", "ea");
    private static final Set<String> PACKAGE_TOKENS = Set.of("pack", "bag", "pkg");

    private final MultibuyPricing multibuyPricing;

    public UnitNormalizer(MultibuyPricing multibuyPricing) {
        this.multibuyPricing = multibuyPricing;
    }

    public NormalizedUnit normalize(String unit, String display) {
        String token = unit == null ? "" : unit.trim().toLowerCase(Locale.ROOT);

        if (token.isEmpty() && display != null) {
            String inferred = inferFromDisplay(display);
            if (inferred != null) {
                token = inferred;
            }
        }

        if (token.isEmpty()) {
            return NormalizedUnit.unknown();
        }

        if (POUND_TOKENS.contains(token)) {
            return new NormalizedUnit(UnitKind.LB, 1.0, UnitKind.LB);
        }

        Matcher prefix = NUMBER_PATTERN.matcher(token);
        if (prefix.lookingAt()) {
            double quantity = Double.parseDouble(prefix.group(1));
            String tail = token.substring(prefix.end()).trim().replace(" ", "");

            if (POUND_TOKENS.contains(tail)) {
                return new NormalizedUnit(UnitKind.LB, quantity, UnitKind.LB);
            }
            if ("oz".equals(tail)) {
                // ounces are weight; priced per pound
                return new NormalizedUnit(UnitKind.OZ, quantity, UnitKind.LB);
            }
            if (FLUID_OUNCE_TOKENS.contains(tail)) {
                return new NormalizedUnit(UnitKind.FLOZ, quantity, UnitKind.FLOZ);
            }
            if (COUNT_TOKENS.contains(tail)) {
                return new NormalizedUnit(UnitKind.COUNT, quantity, UnitKind.COUNT);
            }
        }

        if (token.contains("floz") || token.contains("fl oz")) {
            return new NormalizedUnit(UnitKind.FLOZ, firstNumber(token), UnitKind.FLOZ);
        }
        if (token.contains("count") || "ct".equals(token)) {
            return new NormalizedUnit(UnitKind.COUNT, firstNumber(token), UnitKind.COUNT);
        }
        if (EACH_TOKENS.contains(token) || PACKAGE_TOKENS.contains(token)) {
            return new NormalizedUnit(UnitKind.EACH, 1.0, UnitKind.EACH);
        }

        return NormalizedUnit.unknown();
    }

    public UnitPrice computeUnitPrice(DealRecord deal) {
        DealRecord effective = multibuyPricing.apply(deal);
        DealPrice price = effective.price();
        if (price == null) {
            return UnitPrice.unresolved();
        }

        Double amount = price.numericAmount();
        if (amount == null || amount.isNaN()) {
            return UnitPrice.unresolved();
        }

        NormalizedUnit normalized = normalize(price.unit(), price.display());
        UnitKind kind = normalized.kind();
        Double quantity = normalized.quantity();

        switch (normalized.canonicalKind()) {
            case LB -> {
                if (kind == UnitKind.LB && normalized.hasPositiveQuantity()) {
                    return perPound(amount / quantity);
                }
                if (kind == UnitKind.OZ && normalized.hasPositiveQuantity()) {
                    return perPound(amount / (quantity / 16.0));
                }
                if (kind == UnitKind.LB && (quantity == null || quantity == 0)) {
                    return perPound(amount);
                }
            }
            case FLOZ -> {
                if (normalized.hasPositiveQuantity()) {
                    double perFluidOunce = amount / quantity;
                    return new UnitPrice(perFluidOunce, "fl oz", formatMoney(perFluidOunce) + "/fl oz");
                }
                return UnitPrice.unresolved();
            }
            case EACH -> {
                double perItem = normalized.hasPositiveQuantity() ? amount / quantity : amount;
                return new UnitPrice(perItem, "each", formatMoney(perItem) + " ea");
            }
            case COUNT -> {
                if (normalized.hasPositiveQuantity()) {
                    double perCount = amount / quantity;
                    return new UnitPrice(perCount, "count", formatMoney(perCount) + "/count");
                }
            }
            default -> {
            }
        }

        return UnitPrice.unresolved();
    }

    private String inferFromDisplay(String display) {
        String text = display.toLowerCase(Locale.ROOT);
        if (text.contains("per lb") || text.contains("/lb") || text.contains("per pound")) {
            return "lb";
        }
        if (text.contains("per oz") || text.contains("/oz")) {
            return "oz";
        }
        if (text.contains("per fl oz") || text.contains("per floz") || text.contains("/fl oz")) {
            return "floz";
        }
        if (text.contains("each") && text.contains("per")) {
            return "each";
        }
        return null;
    }

    private Double firstNumber(String token) {
        Matcher matcher = NUMBER_PATTERN.matcher(token);
        return matcher.find() ? Double.parseDouble(matcher.group(1)) : null;
    }

    private UnitPrice perPound(double amount) {
        return new UnitPrice(amount, "lb", formatMoney(amount) + "/lb");
    }

    static String formatMoney(double amount) {
        return PriceFormat.money(amount);
    }
}
