package com.dealpick.deal.engine;

import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.MultibuyDetails;
import java.util.Locale;

/**
 * Rewrites "N for $X" promotions to their per-unit price so they rank against single-unit deals.
 */
public class MultibuyPricing {

    public DealRecord apply(DealRecord deal) {
        MultibuyTerms terms = extractTerms(deal);
        if (terms.perUnitCost() == null || terms.quantityRequired() == null) {
            return deal;
        }

        DealPrice price = deal.price();
        String unit = price.unit() == null || price.unit().isEmpty() ? "ea" : price.unit();
        String unitDisplay = isEachSpelling(unit) ? "ea" : unit;

        DealPrice adjustedPrice = price.toBuilder()
            .amount(terms.perUnitCost())
            .display(PriceFormat.money(terms.perUnitCost()) + " " + unitDisplay)
            .build();

        String format = deal.format();
        if (terms.format() != null && !terms.format().isEmpty() && (format == null || format.isEmpty())) {
            format = terms.format();
        }

        return deal.toBuilder()
            .price(adjustedPrice)
            .quantityRequired(terms.quantityRequired())
            .format(format)
            .multibuyTotalCost(terms.totalCost())
            .multibuyFormat(terms.format())
            .build();
    }

    public MultibuyTerms extractTerms(DealRecord deal) {
        DealPrice price = deal == null ? null : deal.price();
        if (price == null || !price.multibuy() || price.multibuyDetails() == null) {
            return MultibuyTerms.NONE;
        }

        MultibuyDetails details = price.multibuyDetails();
        return new MultibuyTerms(
            toDecimal(details.perUnitCost()),
            toInteger(details.quantityRequired()),
            toDecimal(details.totalCost()),
            details.format() == null ? null : String.valueOf(details.format())
        );
    }

    private boolean isEachSpelling(String unit) {
        String normalized = unit.toLowerCase(Locale.ROOT);
        return "ea".equals(normalized) || "each".equals(normalized);
    }

    static Double toDecimal(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException exception) {
                return null;
            }
        }
        return null;
    }

    static Integer toInteger(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double decimal = ((Number) value).doubleValue();
            if (Double.isNaN(decimal) || Double.isInfinite(decimal)) {
                return null;
            }
            return (int) decimal;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1 : 0;
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException exception) {
                return null;
            }
        }
        return null;
    }

    public record MultibuyTerms(Double perUnitCost, Integer quantityRequired, Double totalCost, String format) {

        static final MultibuyTerms NONE = new MultibuyTerms(null, null, null, null);
    }
}
