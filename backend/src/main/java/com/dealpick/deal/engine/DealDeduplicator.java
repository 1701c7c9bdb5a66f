package com.dealpick.deal.engine;

import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drops listings the extractor emitted more than once. The first occurrence wins.
 */
public class DealDeduplicator {

    private final boolean enabled;

    public DealDeduplicator(boolean enabled) {
        this.enabled = enabled;
    }

    public List<DealRecord> deduplicate(List<DealRecord> deals) {
        if (!enabled) {
            return deals;
        }

        Set<DedupKey> seen = new HashSet<>();
        List<DealRecord> unique = new ArrayList<>();
        for (DealRecord deal : deals) {
            if (seen.add(keyOf(deal))) {
                unique.add(deal);
            }
        }
        return unique;
    }

    DedupKey keyOf(DealRecord deal) {
        DealPrice price = deal.price();
        return new DedupKey(
            trim(deal.retailer()).toUpperCase(Locale.ROOT),
            trim(deal.productName()).toLowerCase(Locale.ROOT),
            trim(deal.category()).toUpperCase(Locale.ROOT),
            price == null ? "" : trim(price.display()),
            String.valueOf(price == null ? null : price.amount()),
            String.valueOf(price == null ? null : price.unit()),
            trim(deal.sizeQuantity()).toLowerCase(Locale.ROOT),
            String.valueOf(deal.page())
        );
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    record DedupKey(
        String retailer,
        String productName,
        String category,
        String priceDisplay,
        String priceAmount,
        String priceUnit,
        String sizeQuantity,
        String page
    ) {
    }
}
