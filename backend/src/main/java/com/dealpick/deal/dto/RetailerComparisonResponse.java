package com.dealpick.deal.dto;

import java.util.List;

public record RetailerComparisonResponse(
    List<String> retailers,
    List<RetailerTopDealsResponse> sections,
    List<StapleComparisonRowResponse> staples,
    String summary
) {
}
