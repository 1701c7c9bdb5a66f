package com.dealpick.deal.service;

import com.dealpick.deal.dto.ExcludedDealResponse;
import com.dealpick.deal.dto.ScoredDealResponse;
import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ExcludedDeal;
import com.dealpick.deal.model.ScoredDeal;
import java.util.ArrayList;
import java.util.List;

final class ScoredDealMapper {

    private ScoredDealMapper() {
    }

    static List<ScoredDealResponse> toResponses(List<ScoredDeal> deals) {
        List<ScoredDealResponse> responses = new ArrayList<>();
        for (int i = 0; i < deals.size(); i++) {
            responses.add(toResponse(i + 1, deals.get(i)));
        }
        return responses;
    }

    static List<ExcludedDealResponse> toExcludedResponses(List<ExcludedDeal> excluded) {
        return excluded.stream()
            .map(item -> new ExcludedDealResponse(
                item.deal().dealId(),
                item.deal().retailer(),
                item.deal().productName(),
                item.deal().category(),
                item.reason().code()
            ))
            .toList();
    }

    private static ScoredDealResponse toResponse(int rank, ScoredDeal scored) {
        DealRecord deal = scored.deal();
        DealPrice price = deal.price();
        return new ScoredDealResponse(
            rank,
            deal.dealId(),
            deal.retailer(),
            deal.productName(),
            deal.brand(),
            deal.category(),
            scored.categoryGroup().label(),
            price == null ? null : price.numericAmount(),
            price == null ? null : price.display(),
            price == null ? null : price.numericSavingsPercent(),
            scored.unitPrice().amount(),
            scored.unitPrice().unit(),
            scored.unitPrice().display(),
            deal.quantityRequired(),
            deal.format(),
            scored.priority(),
            scored.engagementScore(),
            scored.breakdown()
        );
    }
}
