package com.dealpick.deal.dto;

import java.util.List;

public record DealAnalysisResponse(
    String retailer,
    int topN,
    List<ScoredDealResponse> deals
) {
}
