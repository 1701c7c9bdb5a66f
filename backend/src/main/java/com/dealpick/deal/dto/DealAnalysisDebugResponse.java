package com.dealpick.deal.dto;

import java.util.List;

public record DealAnalysisDebugResponse(
    String retailer,
    int topN,
    List<ScoredDealResponse> deals,
    List<ExcludedDealResponse> excluded
) {
}
