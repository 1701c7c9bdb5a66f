package com.dealpick.deal.dto;

import java.util.List;

public record RetailerTopDealsResponse(
    String retailer,
    List<ScoredDealResponse> deals
) {
}
