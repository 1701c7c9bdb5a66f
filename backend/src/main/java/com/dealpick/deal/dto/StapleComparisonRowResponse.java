package com.dealpick.deal.dto;

import java.util.List;

public record StapleComparisonRowResponse(
    String label,
    List<StaplePriceResponse> prices
) {
}
