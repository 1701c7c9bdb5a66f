package com.dealpick.deal.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collection;
import java.util.Map;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DealPrice(
    Object amount,

    String unit,

    String display,

    @JsonProperty("is_multibuy")
    Object isMultibuy,

    @JsonProperty("multibuy_details")
    MultibuyDetails multibuyDetails,

    @JsonProperty("original_price")
    Object originalPrice,

    @JsonProperty("savings_amount")
    Object savingsAmount,

    @JsonProperty("savings_percent")
    Object savingsPercent
) {

    /**
     * Amount as a number, or {@code null} when it is missing or not numeric.
     */
    @JsonIgnore
    public Double numericAmount() {
        return numeric(amount);
    }

    @JsonIgnore
    public Double numericOriginalPrice() {
        return numeric(originalPrice);
    }

    @JsonIgnore
    public Double numericSavingsPercent() {
        return numeric(savingsPercent);
    }

    /**
     * Truthiness of {@code is_multibuy}: null, false, zero and empty text, arrays or objects are not multibuy.
     */
    @JsonIgnore
    public boolean multibuy() {
        if (isMultibuy == null) {
            return false;
        }
        if (isMultibuy instanceof Boolean flag) {
            return flag;
        }
        if (isMultibuy instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (isMultibuy instanceof String text) {
            return !text.isEmpty();
        }
        if (isMultibuy instanceof Collection<?> items) {
            return !items.isEmpty();
        }
        if (isMultibuy instanceof Map<?, ?> fields) {
            return !fields.isEmpty();
        }
        return true;
    }

    // text such as "50%" or "30" is treated as absent
    private static Double numeric(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }
}
