package com.dealpick.deal.service;

import com.dealpick.deal.dto.RetailerComparisonRequest;
import com.dealpick.deal.dto.RetailerComparisonResponse;
import com.dealpick.deal.dto.RetailerTopDealsResponse;
import com.dealpick.deal.dto.StapleComparisonRowResponse;
import com.dealpick.deal.dto.StaplePriceResponse;
import com.dealpick.deal.engine.DealAnalyzer;
import com.dealpick.deal.engine.PriceFormat;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ScoredDeal;
import com.dealpick.deal.model.UnitPrice;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Side-by-side view of several retailers: each retailer's own top deals plus the cheapest price
 * found for a few staples.
 */
@Service
public class RetailerComparisonService {

    private static final Logger log = LoggerFactory.getLogger(RetailerComparisonService.class);

    private static final String UNKNOWN_RETAILER = "Unknown";
    private static final Set<String> COMPARABLE_UNITS = Set.of("lb", "fl oz");

    private final DealRankingProperties rankingProperties;
    private final DealAnalysisService dealAnalysisService;
    private final DealJsonReader dealJsonReader;
    private final DealReportFormatter reportFormatter;

    public RetailerComparisonService(
        DealRankingProperties rankingProperties,
        DealAnalysisService dealAnalysisService,
        DealJsonReader dealJsonReader,
        DealReportFormatter reportFormatter
    ) {
        this.rankingProperties = rankingProperties;
        this.dealAnalysisService = dealAnalysisService;
        this.dealJsonReader = dealJsonReader;
        this.reportFormatter = reportFormatter;
    }

    public RetailerComparisonResponse compare(RetailerComparisonRequest request) {
        List<DealRecord> deals = dealJsonReader.readDeals(request.deals());
        int topN = DealAnalysisService.resolveTopN(request.topN(), rankingProperties.getComparisonTopN());

        Map<String, List<DealRecord>> dealsByRetailer = groupByRetailer(deals);
        List<String> retailers = new ArrayList<>(dealsByRetailer.keySet());

        Map<String, List<ScoredDeal>> topByRetailer = new LinkedHashMap<>();
        List<RetailerTopDealsResponse> sections = new ArrayList<>();
        for (String retailer : retailers) {
            // deals without a retailer would never pass a retailer filter
            DealAnalyzer analyzer = dealAnalysisService.analyzerFor(UNKNOWN_RETAILER.equals(retailer) ? null : retailer);
            List<ScoredDeal> top = analyzer.analyze(dealsByRetailer.get(retailer), topN, null);
            topByRetailer.put(retailer, top);
            sections.add(new RetailerTopDealsResponse(retailer, ScoredDealMapper.toResponses(top)));
        }

        DealAnalyzer pricingAnalyzer = dealAnalysisService.analyzerFor(null);
        List<StapleComparisonRowResponse> staples = new ArrayList<>();
        for (DealRankingProperties.Staple staple : rankingProperties.getStaples()) {
            List<StaplePriceResponse> prices = new ArrayList<>();
            for (String retailer : retailers) {
                Double best = bestPriceForKeywords(pricingAnalyzer, dealsByRetailer.get(retailer), staple.getKeywords());
                prices.add(new StaplePriceResponse(retailer, best, formatStaplePrice(best, staple.isPerPound())));
            }
            staples.add(new StapleComparisonRowResponse(staple.getLabel(), prices));
        }

        log.info("Compared retailers (retailers={}, input={}, topN={})", retailers, deals.size(), topN);

        return new RetailerComparisonResponse(
            retailers,
            sections,
            staples,
            reportFormatter.formatComparison(topByRetailer)
        );
    }

    Double bestPriceForKeywords(DealAnalyzer analyzer, List<DealRecord> deals, List<String> keywords) {
        Double best = null;
        for (DealRecord deal : deals) {
            String name = deal.productName() == null ? "" : deal.productName().toLowerCase(Locale.ROOT);
            if (keywords.stream().noneMatch(name::contains)) {
                continue;
            }

            UnitPrice unitPrice = analyzer.computeUnitPrice(deal);
            Double amount;
            if (unitPrice.amount() != null && COMPARABLE_UNITS.contains(unitPrice.unit())) {
                amount = unitPrice.amount();
            } else {
                amount = deal.price() == null ? null : deal.price().numericAmount();
            }

            if (amount != null && (best == null || amount < best)) {
                best = amount;
            }
        }
        return best;
    }

    private Map<String, List<DealRecord>> groupByRetailer(List<DealRecord> deals) {
        Set<String> retailers = new TreeSet<>();
        for (DealRecord deal : deals) {
            retailers.add(retailerOf(deal));
        }

        Map<String, List<DealRecord>> grouped = new LinkedHashMap<>();
        for (String retailer : retailers) {
            grouped.put(retailer, new ArrayList<>());
        }
        for (DealRecord deal : deals) {
            grouped.get(retailerOf(deal)).add(deal);
        }
        return grouped;
    }

    private String retailerOf(DealRecord deal) {
        return deal.retailer() == null || deal.retailer().isEmpty() ? UNKNOWN_RETAILER : deal.retailer();
    }

    private String formatStaplePrice(Double price, boolean perPound) {
        if (price == null) {
            return null;
        }
        return PriceFormat.money(price) + (perPound ? "/lb" : "");
    }
}
