package com.dealpick.deal.engine;

import static com.dealpick.deal.DealFixtures.deal;
import static com.dealpick.deal.DealFixtures.multibuy;
import static com.dealpick.deal.DealFixtures.withSavings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dealpick.deal.model.CategoryGroup;
import com.dealpick.deal.model.DealAnalysisResult;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ExcludedDeal;
import com.dealpick.deal.model.ExclusionReason;
import com.dealpick.deal.model.ScoredDeal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DealAnalyzerTest {

    private final DealAnalyzer analyzer = new DealAnalyzer(DealRankingConfig.defaults());

    @Test
    void analyze_should_rank_priority_chicken_by_unit_price() {
        List<DealRecord> deals = List.of(
            deal("c3", "HEB", "Chicken Breast", "MEAT", 2.99, "lb"),
            deal("c1", "HEB", "Chicken Breast", "MEAT", 1.99, "lb"),
            deal("c2", "HEB", "Chicken Breast", "MEAT", 2.49, "lb")
        );

        List<ScoredDeal> top = analyzer.analyze(deals, 6, null);

        assertThat(top).extracting(deal -> deal.deal().dealId()).containsExactly("c1", "c2", "c3");
        assertThat(top).allSatisfy(deal -> {
            assertThat(deal.priority()).isTrue();
            assertThat(deal.engagementScore()).isEqualTo(98);
            assertThat(deal.categoryGroup()).isEqualTo(CategoryGroup.MEAT_SEAFOOD);
        });
    }

    @Test
    void analyze_should_score_example_deal() {
        DealRecord chicken = withSavings(deal("1", "HEB", "Chicken Breast", "MEAT", 0.99, "lb"), 55);

        List<ScoredDeal> top = analyzer.analyze(List.of(chicken), 6, null);

        assertThat(top).singleElement().satisfies(deal -> {
            assertThat(deal.engagementScore()).isEqualTo(128);
            assertThat(deal.unitPrice().display()).isEqualTo("$0.99/lb");
        });
    }

    @Test
    void analyze_should_rank_multibuy_at_per_unit_price_without_touching_input() {
        DealRecord water = multibuy("mb", "Sparkling Water", 2.50, 2);
        List<DealRecord> deals = List.of(water);

        List<ScoredDeal> top = analyzer.analyze(deals, 6, null);

        assertThat(top).singleElement().satisfies(deal -> {
            assertThat(deal.price().amount()).isEqualTo(2.50);
            assertThat(deal.price().display()).isEqualTo("$2.50 ea");
            assertThat(deal.deal().quantityRequired()).isEqualTo(2);
            assertThat(deal.unitPrice().display()).isEqualTo("$2.50 ea");
        });
        assertThat(water.price().amount()).isEqualTo(5.00);
        assertThat(water.quantityRequired()).isNull();
    }

    @Test
    void analyzeWithExclusions_should_report_reasons_with_original_deals() {
        DealRecord kept = deal("1", "HEB", "Honeycrisp Apples", "PRODUCE", 1.49, "lb");
        DealRecord wine = deal("2", "HEB", "Cabernet", "ALCOHOL", 9.99, "each");
        DealRecord storeBrand = deal("3", "HEB", "Hill Country Fare Butter", "DAIRY_EGGS", 3.49, "each");
        DealRecord noPrice = deal("4", "HEB", "Mystery Box", "PANTRY", null, "each");

        DealAnalysisResult result = analyzer.analyzeWithExclusions(List.of(kept, wine, storeBrand, noPrice), 6, null);

        assertThat(result.topDeals()).extracting(deal -> deal.deal().dealId()).containsExactly("1");
        assertThat(result.excluded())
            .extracting(ExcludedDeal::reason)
            .containsExactly(
                ExclusionReason.EXCLUDED_CATEGORY_ALCOHOL,
                ExclusionReason.EXCLUDED_STORE_BRAND,
                ExclusionReason.MISSING_PRICE_AMOUNT
            );
        assertThat(result.excluded().get(0).deal()).isSameAs(wine);
    }

    @Test
    void analyze_should_drop_duplicates_before_scoring() {
        DealRecord first = deal("a", "HEB", "Strawberries", "PRODUCE", 2.99, "each");
        DealRecord copy = deal("b", "HEB", "Strawberries", "PRODUCE", 2.99, "each");

        assertThat(analyzer.analyze(List.of(first, copy), 6, null))
            .extracting(deal -> deal.deal().dealId())
            .containsExactly("a");

        DealAnalyzer noDedupe = new DealAnalyzer(DealRankingConfig.defaults().toBuilder().dedupe(false).build());
        assertThat(noDedupe.analyze(List.of(first, copy), 6, null)).hasSize(2);
    }

    @Test
    void analyze_should_apply_retailer_filter() {
        DealAnalyzer hebOnly = new DealAnalyzer(DealRankingConfig.defaults(), "HEB");
        List<DealRecord> deals = List.of(
            deal("1", "HEB", "Strawberries", "PRODUCE", 2.99, "each"),
            deal("2", "Aldi", "Blueberries", "PRODUCE", 2.49, "each")
        );

        DealAnalysisResult result = hebOnly.analyzeWithExclusions(deals, 6, null);

        assertThat(result.topDeals()).extracting(deal -> deal.deal().dealId()).containsExactly("1");
        assertThat(result.excluded()).singleElement()
            .satisfies(excluded -> assertThat(excluded.reason()).isEqualTo(ExclusionReason.FILTERED_OUT_BY_RETAILER));
        assertThat(hebOnly.retailerFilter()).isEqualTo("HEB");
    }

    @Test
    void analyze_should_balance_categories_unless_overridden() {
        List<DealRecord> deals = new ArrayList<>();
        deals.add(withSavings(deal("s1", "HEB", "Doritos Party Size", "SNACKS", 0.99, "each"), 60));
        deals.add(withSavings(deal("s2", "HEB", "Cheetos Party Size", "SNACKS", 0.99, "each"), 60));
        deals.add(withSavings(deal("s3", "HEB", "Fritos Party Size", "SNACKS", 0.99, "each"), 60));
        deals.add(deal("p1", "HEB", "Bananas", "PRODUCE", 0.59, "lb"));

        List<ScoredDeal> balanced = analyzer.analyze(deals, 3, null);
        List<ScoredDeal> straight = analyzer.analyze(deals, 3, false);

        assertThat(balanced).extracting(deal -> deal.categoryGroup())
            .contains(CategoryGroup.PRODUCE);
        assertThat(straight).extracting(deal -> deal.categoryGroup())
            .containsOnly(CategoryGroup.SNACKS_OTHER);
    }

    @Test
    void analyze_should_be_idempotent() {
        List<DealRecord> deals = List.of(
            deal("c1", "HEB", "Chicken Breast", "MEAT", 1.99, "lb"),
            withSavings(deal("s1", "HEB", "Doritos Party Size", "SNACKS", 0.99, "each"), 60),
            deal("p1", "HEB", "Bananas", "PRODUCE", 0.59, "lb"),
            deal("p2", "HEB", "Honeycrisp Apples", "PRODUCE", 1.49, "lb"),
            multibuy("mb", "Sparkling Water", 2.50, 2),
            deal("w1", "HEB", "Cabernet", "ALCOHOL", 9.99, "each")
        );

        List<ScoredDeal> first = analyzer.analyze(deals, 4, null);
        List<ScoredDeal> second = analyzer.analyze(deals, 4, null);

        assertThat(second).containsExactlyElementsOf(first);
        assertThat(analyzer.analyzeWithExclusions(deals, 4, null))
            .isEqualTo(analyzer.analyzeWithExclusions(deals, 4, null));
    }

    @Test
    void analyze_should_return_empty_for_empty_input_or_zero_top_n() {
        assertThat(analyzer.analyze(List.of(), 6, null)).isEmpty();
        assertThat(analyzer.analyze(List.of(deal("1", "HEB", "Strawberries", "PRODUCE", 2.99, "each")), 0, null))
            .isEmpty();
    }

    @Test
    void analyze_should_reject_invalid_arguments() {
        assertThatThrownBy(() -> analyzer.analyze(null, 6, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.analyze(List.of(), -1, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("topN");
        assertThatThrownBy(() -> analyzer.analyze(Arrays.asList(deal("1", "HEB", "Kale", "PRODUCE", 1.0, "each"), null), 6, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index 1");
    }

    @Test
    void exclusionReason_should_evaluate_single_deal() {
        assertThat(analyzer.exclusionReason(deal("1", "HEB", "Beef Franks", "MEAT", 3.99, "each")))
            .contains(ExclusionReason.EXCLUDED_PRODUCT_KEYWORD);
        assertThat(analyzer.exclusionReason(deal("2", "HEB", "Strawberries", "PRODUCE", 2.99, "each"))).isEmpty();
    }

    @Test
    void computeUnitPrice_should_delegate_to_normalizer() {
        assertThat(analyzer.computeUnitPrice(deal("1", "HEB", "Potatoes", "PRODUCE", 4.99, "3lb")).display())
            .isEqualTo("$1.66/lb");
    }
}
