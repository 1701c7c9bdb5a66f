package com.dealpick.deal.model;

import java.util.Locale;

public enum CategoryGroup {
    MEAT_SEAFOOD("Meat/Seafood"),
    PRODUCE("Produce"),
    SNACKS_OTHER("Snacks/Other");

    private final String label;

    CategoryGroup(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CategoryGroup of(String category) {
        String normalized = category == null ? "" : category.toUpperCase(Locale.ROOT);
        if (normalized.contains("MEAT") || normalized.contains("SEAFOOD") || normalized.contains("DELI")) {
            return MEAT_SEAFOOD;
        }
        if (normalized.contains("PRODUCE")) {
            return PRODUCE;
        }
        return SNACKS_OTHER;
    }
}
