package com.dealpick.deal.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExclusionReason {
    MISSING_PRICE_AMOUNT("missing_price_amount"),
    INVALID_NEGATIVE_PRICE("invalid_negative_price"),
    EXCLUDED_CATEGORY_ALCOHOL("excluded_category_alcohol"),
    EXCLUDED_SUPPLEMENT("excluded_supplement"),
    EXCLUDED_STORE_BRAND("excluded_store_brand"),
    EXCLUDED_PRODUCT_KEYWORD("excluded_product_keyword"),
    FILTERED_OUT_BY_RETAILER("filtered_out_by_retailer");

    private final String code;

    ExclusionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
