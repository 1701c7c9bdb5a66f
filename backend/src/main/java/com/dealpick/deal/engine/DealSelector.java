package com.dealpick.deal.engine;

import com.dealpick.deal.model.CategoryGroup;
import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.ScoredDeal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the bounded top list: priority deals first, remaining slots shared across the three
 * category groups in proportion to their inventory.
 */
public class DealSelector {

    /**
     * Higher score, then priority, then higher savings percent, then lower unit price, then lower
     * package price. Smaller sorts first.
     */
    public static final Comparator<ScoredDeal> TIE_BREAK = Comparator
        .comparingInt((ScoredDeal deal) -> -deal.engagementScore())
        .thenComparingInt(deal -> deal.priority() ? -1 : 0)
        .thenComparingDouble(deal -> -savingsPercentOrDefault(deal))
        .thenComparingDouble(DealSelector::unitPriceOrInfinity)
        .thenComparingDouble(DealSelector::amountOrInfinity);

    public List<ScoredDeal> select(
        List<ScoredDeal> priorityDeals,
        List<ScoredDeal> otherDeals,
        int topN,
        boolean balance
    ) {
        List<ScoredDeal> rankedPriority = sorted(priorityDeals);
        List<ScoredDeal> rankedOthers = sorted(otherDeals);

        int remainingSlots = Math.max(0, topN - rankedPriority.size());
        if (remainingSlots <= 0) {
            return List.copyOf(rankedPriority.subList(0, Math.min(topN, rankedPriority.size())));
        }

        List<ScoredDeal> selected = new ArrayList<>(rankedPriority);
        if (!balance) {
            selected.addAll(rankedOthers.subList(0, Math.min(remainingSlots, rankedOthers.size())));
            return truncate(selected, topN);
        }

        Map<CategoryGroup, List<ScoredDeal>> buckets = groupByCategory(rankedOthers);
        Map<CategoryGroup, Integer> allocations = allocate(buckets, remainingSlots);

        List<ScoredDeal> added = new ArrayList<>();
        for (CategoryGroup group : CategoryGroup.values()) {
            added.addAll(buckets.get(group).subList(0, allocations.get(group)));
        }

        if (added.size() < remainingSlots) {
            Set<String> addedIds = new HashSet<>();
            for (ScoredDeal deal : added) {
                addedIds.add(idOf(deal));
            }
            for (ScoredDeal deal : rankedOthers) {
                if (added.size() >= remainingSlots) {
                    break;
                }
                if (addedIds.contains(idOf(deal))) {
                    continue;
                }
                added.add(deal);
            }
        }

        selected.addAll(added);
        selected.sort(TIE_BREAK);
        return truncate(selected, topN);
    }

    /**
     * Splits {@code remainingSlots} across the fixed buckets. Each bucket list must already be in
     * tie-break order.
     */
    public Map<CategoryGroup, Integer> allocate(Map<CategoryGroup, List<ScoredDeal>> buckets, int remainingSlots) {
        Map<CategoryGroup, Integer> available = new EnumMap<>(CategoryGroup.class);
        Map<CategoryGroup, Integer> allocations = new EnumMap<>(CategoryGroup.class);
        int totalAvailable = 0;
        for (CategoryGroup group : CategoryGroup.values()) {
            int size = buckets.getOrDefault(group, List.of()).size();
            available.put(group, size);
            allocations.put(group, 0);
            totalAvailable += size;
        }

        if (totalAvailable == 0) {
            return allocations;
        }

        for (CategoryGroup group : CategoryGroup.values()) {
            int size = available.get(group);
            if (size == 0) {
                continue;
            }
            // half-to-even, so 2.5 slots round to 2
            int base = (int) Math.rint(remainingSlots * ((double) size / totalAvailable));
            allocations.put(group, Math.min(base, size));
        }

        while (allocatedTotal(allocations) < remainingSlots) {
            CategoryGroup bestGroup = null;
            ScoredDeal bestNext = null;
            for (CategoryGroup group : CategoryGroup.values()) {
                int allocated = allocations.get(group);
                if (allocated < available.get(group)) {
                    ScoredDeal candidate = buckets.get(group).get(allocated);
                    if (bestNext == null || TIE_BREAK.compare(candidate, bestNext) < 0) {
                        bestNext = candidate;
                        bestGroup = group;
                    }
                }
            }
            if (bestGroup == null) {
                break;
            }
            allocations.merge(bestGroup, 1, Integer::sum);
        }

        while (allocatedTotal(allocations) > remainingSlots) {
            CategoryGroup worstGroup = null;
            ScoredDeal worstItem = null;
            for (CategoryGroup group : CategoryGroup.values()) {
                int allocated = allocations.get(group);
                if (allocated > 0) {
                    ScoredDeal item = buckets.get(group).get(allocated - 1);
                    if (worstItem == null || TIE_BREAK.compare(item, worstItem) > 0) {
                        worstItem = item;
                        worstGroup = group;
                    }
                }
            }
            if (worstGroup == null) {
                break;
            }
            allocations.merge(worstGroup, -1, Integer::sum);
        }

        return allocations;
    }

    private Map<CategoryGroup, List<ScoredDeal>> groupByCategory(List<ScoredDeal> rankedDeals) {
        Map<CategoryGroup, List<ScoredDeal>> buckets = new EnumMap<>(CategoryGroup.class);
        for (CategoryGroup group : CategoryGroup.values()) {
            buckets.put(group, new ArrayList<>());
        }
        for (ScoredDeal deal : rankedDeals) {
            buckets.get(deal.categoryGroup()).add(deal);
        }
        return buckets;
    }

    private int allocatedTotal(Map<CategoryGroup, Integer> allocations) {
        return allocations.values().stream().mapToInt(Integer::intValue).sum();
    }

    private List<ScoredDeal> sorted(List<ScoredDeal> deals) {
        List<ScoredDeal> copy = new ArrayList<>(deals);
        copy.sort(TIE_BREAK);
        return copy;
    }

    private List<ScoredDeal> truncate(List<ScoredDeal> deals, int topN) {
        return List.copyOf(deals.subList(0, Math.min(topN, deals.size())));
    }

    private static String idOf(ScoredDeal deal) {
        return String.valueOf(deal.deal().dealId());
    }

    private static double savingsPercentOrDefault(ScoredDeal deal) {
        DealPrice price = deal.price();
        Double savingsPercent = price == null ? null : price.numericSavingsPercent();
        return savingsPercent == null ? -1.0 : savingsPercent;
    }

    private static double unitPriceOrInfinity(ScoredDeal deal) {
        Double amount = deal.unitPrice() == null ? null : deal.unitPrice().amount();
        return amount == null ? Double.POSITIVE_INFINITY : amount;
    }

    private static double amountOrInfinity(ScoredDeal deal) {
        DealPrice price = deal.price();
        Double amount = price == null ? null : price.numericAmount();
        return amount == null ? Double.POSITIVE_INFINITY : amount;
    }
}
