package com.dealpick.deal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw multibuy terms as extracted from the flyer. Values keep whatever JSON type the extractor
 * produced; they are coerced field by field when the multibuy price is applied.
 */
public record MultibuyDetails(
    Object perUnitCost,
    Object quantityRequired,
    Object totalCost,
    Object format
) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MultibuyDetails fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new MultibuyDetails(
            scalar(node.get("per_unit_cost")),
            scalar(node.get("quantity_required")),
            scalar(node.get("total_cost")),
            scalar(node.get("format"))
        );
    }

    private static Object scalar(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        return value.toString();
    }
}
