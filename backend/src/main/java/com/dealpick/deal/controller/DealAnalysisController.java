package com.dealpick.deal.controller;

import com.dealpick.deal.dto.AnalyzeDealsRequest;
import com.dealpick.deal.dto.DealAnalysisDebugResponse;
import com.dealpick.deal.dto.DealAnalysisResponse;
import com.dealpick.deal.dto.RetailerComparisonRequest;
import com.dealpick.deal.dto.RetailerComparisonResponse;
import com.dealpick.deal.dto.UnitPriceResponse;
import com.dealpick.deal.service.DealAnalysisService;
import com.dealpick.deal.service.RetailerComparisonService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/deals")
public class DealAnalysisController {

    private final DealAnalysisService dealAnalysisService;
    private final RetailerComparisonService retailerComparisonService;

    public DealAnalysisController(
        DealAnalysisService dealAnalysisService,
        RetailerComparisonService retailerComparisonService
    ) {
        this.dealAnalysisService = dealAnalysisService;
        this.retailerComparisonService = retailerComparisonService;
    }

    @PostMapping("/analyze")
    public DealAnalysisResponse analyze(@Valid @RequestBody AnalyzeDealsRequest request) {
        return dealAnalysisService.analyze(request);
    }

    @PostMapping("/analyze/debug")
    public DealAnalysisDebugResponse analyzeWithExclusions(@Valid @RequestBody AnalyzeDealsRequest request) {
        return dealAnalysisService.analyzeWithExclusions(request);
    }

    @PostMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String report(@Valid @RequestBody AnalyzeDealsRequest request) {
        return dealAnalysisService.report(request);
    }

    @PostMapping("/comparison")
    public RetailerComparisonResponse compare(@Valid @RequestBody RetailerComparisonRequest request) {
        return retailerComparisonService.compare(request);
    }

    @PostMapping("/unit-price")
    public UnitPriceResponse computeUnitPrice(@RequestBody JsonNode deal) {
        return dealAnalysisService.computeUnitPrice(deal);
    }
}
