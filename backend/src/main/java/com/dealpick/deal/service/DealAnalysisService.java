package com.dealpick.deal.service;

import com.dealpick.deal.dto.AnalyzeDealsRequest;
import com.dealpick.deal.dto.DealAnalysisDebugResponse;
import com.dealpick.deal.dto.DealAnalysisResponse;
import com.dealpick.deal.dto.UnitPriceResponse;
import com.dealpick.deal.engine.DealAnalyzer;
import com.dealpick.deal.model.DealAnalysisResult;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ScoredDeal;
import com.dealpick.deal.model.UnitPrice;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class DealAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(DealAnalysisService.class);

    private final DealRankingProperties rankingProperties;
    private final DealJsonReader dealJsonReader;
    private final DealReportFormatter reportFormatter;

    public DealAnalysisService(
        DealRankingProperties rankingProperties,
        DealJsonReader dealJsonReader,
        DealReportFormatter reportFormatter
    ) {
        this.rankingProperties = rankingProperties;
        this.dealJsonReader = dealJsonReader;
        this.reportFormatter = reportFormatter;
    }

    public DealAnalysisResponse analyze(AnalyzeDealsRequest request) {
        List<DealRecord> deals = dealJsonReader.readDeals(request.deals());
        int topN = resolveTopN(request.topN(), rankingProperties.getDefaultTopN());
        String retailer = normalizeRetailer(request.retailer());

        List<ScoredDeal> top = analyzerFor(retailer).analyze(deals, topN, request.balanceCategories());
        log.info("Analyzed deals (retailer={}, input={}, topN={}, selected={})", retailer, deals.size(), topN, top.size());

        return new DealAnalysisResponse(retailer, topN, ScoredDealMapper.toResponses(top));
    }

    public DealAnalysisDebugResponse analyzeWithExclusions(AnalyzeDealsRequest request) {
        List<DealRecord> deals = dealJsonReader.readDeals(request.deals());
        int topN = resolveTopN(request.topN(), rankingProperties.getDefaultTopN());
        String retailer = normalizeRetailer(request.retailer());

        DealAnalysisResult result = analyzerFor(retailer).analyzeWithExclusions(deals, topN, request.balanceCategories());
        log.info(
            "Analyzed deals with exclusions (retailer={}, input={}, topN={}, selected={}, excluded={})",
            retailer,
            deals.size(),
            topN,
            result.topDeals().size(),
            result.excluded().size()
        );

        return new DealAnalysisDebugResponse(
            retailer,
            topN,
            ScoredDealMapper.toResponses(result.topDeals()),
            ScoredDealMapper.toExcludedResponses(result.excluded())
        );
    }

    public String report(AnalyzeDealsRequest request) {
        List<DealRecord> deals = dealJsonReader.readDeals(request.deals());
        int topN = resolveTopN(request.topN(), rankingProperties.getDefaultTopN());
        String retailer = normalizeRetailer(request.retailer());
        boolean showDetails = request.showDetails() == null || request.showDetails();

        List<ScoredDeal> top = analyzerFor(retailer).analyze(deals, topN, request.balanceCategories());
        return reportFormatter.format(top, showDetails);
    }

    public UnitPriceResponse computeUnitPrice(JsonNode dealNode) {
        DealRecord deal = dealJsonReader.readDeal(dealNode);
        UnitPrice unitPrice = analyzerFor(null).computeUnitPrice(deal);
        return new UnitPriceResponse(unitPrice.amount(), unitPrice.unit(), unitPrice.display());
    }

    public DealAnalyzer analyzerFor(String retailer) {
        return new DealAnalyzer(rankingProperties.toConfig(), retailer);
    }

    static int resolveTopN(Integer requested, int fallback) {
        int topN = requested == null ? fallback : requested;
        if (topN < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "topN must be at least 1");
        }
        return topN;
    }

    private String normalizeRetailer(String retailer) {
        return retailer == null || retailer.isBlank() ? null : retailer.trim();
    }
}
