package com.dealpick.deal.engine;

import com.dealpick.deal.model.CategoryGroup;
import com.dealpick.deal.model.DealAnalysisResult;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ExcludedDeal;
import com.dealpick.deal.model.ExclusionReason;
import com.dealpick.deal.model.ScoreBreakdown;
import com.dealpick.deal.model.ScoredDeal;
import com.dealpick.deal.model.UnitPrice;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks one batch of flyer deals: dedupe, apply multibuy pricing, exclude, score, then select a
 * category-balanced top list. Holds only immutable configuration, so one instance may serve
 * several threads.
 */
public class DealAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DealAnalyzer.class);

    private final DealRankingConfig config;
    private final String retailerFilter;
    private final MultibuyPricing multibuyPricing;
    private final UnitNormalizer unitNormalizer;
    private final DealDeduplicator deduplicator;
    private final ExclusionFilter exclusionFilter;
    private final PriorityDetector priorityDetector;
    private final DealScorer scorer;
    private final DealSelector selector;

    public DealAnalyzer(DealRankingConfig config) {
        this(config, null);
    }

    public DealAnalyzer(DealRankingConfig config, String retailerFilter) {
        this.config = config;
        this.retailerFilter = retailerFilter;
        this.multibuyPricing = new MultibuyPricing();
        this.unitNormalizer = new UnitNormalizer(multibuyPricing);
        this.deduplicator = new DealDeduplicator(config.dedupe());
        this.exclusionFilter = new ExclusionFilter(config, retailerFilter);
        this.priorityDetector = new PriorityDetector(config, unitNormalizer);
        this.scorer = new DealScorer(config, multibuyPricing, unitNormalizer, priorityDetector);
        this.selector = new DealSelector();
    }

    public List<ScoredDeal> analyze(List<DealRecord> deals, int topN, Boolean balanceOverride) {
        return run(deals, topN, balanceOverride).topDeals();
    }

    public DealAnalysisResult analyzeWithExclusions(List<DealRecord> deals, int topN, Boolean balanceOverride) {
        return run(deals, topN, balanceOverride);
    }

    public UnitPrice computeUnitPrice(DealRecord deal) {
        return unitNormalizer.computeUnitPrice(deal);
    }

    public Optional<ExclusionReason> exclusionReason(DealRecord deal) {
        return exclusionFilter.reasonFor(multibuyPricing.apply(deal));
    }

    public ScoredDeal score(DealRecord deal) {
        DealRecord effective = multibuyPricing.apply(deal);
        ScoreBreakdown breakdown = scorer.score(effective);
        return new ScoredDeal(
            effective,
            breakdown.total(),
            CategoryGroup.of(effective.category()),
            priorityDetector.isPriority(effective),
            unitNormalizer.computeUnitPrice(effective),
            breakdown
        );
    }

    public String retailerFilter() {
        return retailerFilter;
    }

    private DealAnalysisResult run(List<DealRecord> deals, int topN, Boolean balanceOverride) {
        validate(deals, topN);
        boolean balance = balanceOverride == null ? config.balanceCategories() : balanceOverride;

        List<DealRecord> unique = deduplicator.deduplicate(deals);

        List<ScoredDeal> priorityDeals = new ArrayList<>();
        List<ScoredDeal> otherDeals = new ArrayList<>();
        List<ExcludedDeal> excluded = new ArrayList<>();

        for (DealRecord deal : unique) {
            DealRecord effective = multibuyPricing.apply(deal);
            Optional<ExclusionReason> reason = exclusionFilter.reasonFor(effective);
            if (reason.isPresent()) {
                log.debug("Excluded deal (id={}, product={}, reason={})",
                    deal.dealId(), deal.productName(), reason.get().code());
                excluded.add(new ExcludedDeal(deal, reason.get()));
                continue;
            }

            ScoredDeal scored = score(effective);
            if (scored.priority()) {
                priorityDeals.add(scored);
            } else {
                otherDeals.add(scored);
            }
        }

        List<ScoredDeal> top = selector.select(priorityDeals, otherDeals, topN, balance);

        log.debug(
            "Deal analysis finished (retailerFilter={}, input={}, unique={}, excluded={}, priority={}, selected={})",
            retailerFilter,
            deals.size(),
            unique.size(),
            excluded.size(),
            priorityDeals.size(),
            top.size()
        );

        return new DealAnalysisResult(top, List.copyOf(excluded));
    }

    private void validate(List<DealRecord> deals, int topN) {
        if (deals == null) {
            throw new IllegalArgumentException("Deals must not be null");
        }
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative: " + topN);
        }
        for (int i = 0; i < deals.size(); i++) {
            if (deals.get(i) == null) {
                throw new IllegalArgumentException("Deal at index " + i + " is null");
            }
        }
    }
}
