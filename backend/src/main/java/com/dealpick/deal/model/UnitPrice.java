package com.dealpick.deal.model;

public record UnitPrice(Double amount, String unit, String display) {

    private static final UnitPrice UNRESOLVED = new UnitPrice(null, null, null);

    public static UnitPrice unresolved() {
        return UNRESOLVED;
    }

    public boolean resolved() {
        return amount != null && unit != null;
    }
}
