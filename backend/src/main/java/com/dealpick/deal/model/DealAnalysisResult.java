package com.dealpick.deal.model;

import java.util.List;

public record DealAnalysisResult(List<ScoredDeal> topDeals, List<ExcludedDeal> excluded) {
}
