package com.dealpick.deal.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record RetailerComparisonRequest(
    @NotNull
    JsonNode deals,

    @Min(1) @Max(100)
    Integer topN
) {
}
