package com.dealpick.deal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * One retailer's promotional listing for the current flyer cycle, in the extractor's snake_case
 * JSON shape. The last four components are only set on multibuy-adjusted copies.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DealRecord(
    @JsonProperty("deal_id")
    Object dealId,

    Object page,

    String retailer,

    @JsonProperty("product_name")
    String productName,

    String brand,

    String category,

    DealPrice price,

    @JsonProperty("size_quantity")
    String sizeQuantity,

    @JsonProperty("container_type")
    String containerType,

    Map<String, Object> conditions,

    @JsonProperty("promotion_type")
    String promotionType,

    @JsonProperty("promotion_group_id")
    String promotionGroupId,

    @JsonProperty("special_notes")
    String specialNotes,

    @JsonProperty("extraction_confidence")
    String extractionConfidence,

    @JsonProperty("uncertainty_flags")
    List<String> uncertaintyFlags,

    @JsonProperty("quantity_required")
    Integer quantityRequired,

    String format,

    @JsonProperty("multibuy_total_cost")
    Double multibuyTotalCost,

    @JsonProperty("multibuy_format")
    String multibuyFormat
) {
}
