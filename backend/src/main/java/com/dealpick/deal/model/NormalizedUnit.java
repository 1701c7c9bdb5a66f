package com.dealpick.deal.model;

/**
 * Parsed package unit. {@code quantity} is expressed in {@code kind} (ounces for OZ), while
 * {@code canonicalKind} is the basis prices are compared on.
 */
public record NormalizedUnit(UnitKind kind, Double quantity, UnitKind canonicalKind) {

    public static NormalizedUnit unknown() {
        return new NormalizedUnit(UnitKind.UNKNOWN, null, UnitKind.UNKNOWN);
    }

    public boolean hasPositiveQuantity() {
        return quantity != null && quantity > 0;
    }
}
