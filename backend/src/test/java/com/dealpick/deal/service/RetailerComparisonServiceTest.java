package com.dealpick.deal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.dealpick.deal.dto.RetailerComparisonRequest;
import com.dealpick.deal.dto.RetailerComparisonResponse;
import com.dealpick.deal.dto.RetailerTopDealsResponse;
import com.dealpick.deal.dto.StapleComparisonRowResponse;
import com.dealpick.deal.dto.StaplePriceResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetailerComparisonServiceTest {

    private static final String FLYERS = """
        [
          {"deal_id": "c1", "retailer": "HEB", "product_name": "Chicken Breast", "category": "MEAT",
           "price": {"amount": 1.99, "unit": "lb", "display": "$1.99/lb"}},
          {"deal_id": "b1", "retailer": "HEB", "product_name": "Ground Beef 80/20", "category": "MEAT",
           "price": {"amount": 4.99, "unit": "lb", "display": "$4.99/lb"}},
          {"deal_id": "a1", "retailer": "HEB", "product_name": "Honeycrisp Apples", "category": "PRODUCE",
           "price": {"amount": 1.49, "unit": "lb", "display": "$1.49/lb"}},
          {"deal_id": "c2", "retailer": "Aldi", "product_name": "Chicken Thighs", "category": "MEAT",
           "price": {"amount": 5.97, "unit": "3lb", "display": "$5.97"}},
          {"deal_id": "a2", "retailer": "Aldi", "product_name": "Gala Apples", "category": "PRODUCE",
           "price": {"amount": 3.99, "unit": "each", "display": "$3.99"}},
          {"deal_id": "u1", "product_name": "Bananas", "category": "PRODUCE",
           "price": {"amount": 0.59, "unit": "lb", "display": "$0.59/lb"}}
        ]
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private DealRankingProperties rankingProperties;

    private RetailerComparisonService comparisonService;

    @BeforeEach
    void setUp() {
        rankingProperties = new DealRankingProperties();
        DealJsonReader reader = new DealJsonReader(objectMapper);
        DealReportFormatter formatter = new DealReportFormatter();
        DealAnalysisService analysisService = new DealAnalysisService(rankingProperties, reader, formatter);
        comparisonService = new RetailerComparisonService(rankingProperties, analysisService, reader, formatter);
    }

    @Test
    void compare_should_rank_each_retailer_separately_in_name_order() throws JsonProcessingException {
        RetailerComparisonResponse response = comparisonService.compare(request(null));

        assertThat(response.retailers()).containsExactly("Aldi", "HEB", "Unknown");
        assertThat(response.sections()).extracting(RetailerTopDealsResponse::retailer)
            .containsExactly("Aldi", "HEB", "Unknown");
        assertThat(section(response, "Aldi").deals()).hasSize(2);
        assertThat(section(response, "HEB").deals()).hasSize(3);
        assertThat(section(response, "Unknown").deals()).singleElement()
            .satisfies(deal -> assertThat(deal.productName()).isEqualTo("Bananas"));
    }

    @Test
    void compare_should_limit_sections_to_requested_or_configured_top_n() throws JsonProcessingException {
        assertThat(comparisonService.compare(request(1)).sections())
            .allSatisfy(section -> assertThat(section.deals()).hasSizeLessThanOrEqualTo(1));

        rankingProperties.setComparisonTopN(2);
        assertThat(section(comparisonService.compare(request(null)), "HEB").deals()).hasSize(2);
    }

    @Test
    void compare_should_find_cheapest_staple_price_per_retailer() throws JsonProcessingException {
        RetailerComparisonResponse response = comparisonService.compare(request(null));

        assertThat(response.staples()).extracting(StapleComparisonRowResponse::label)
            .containsExactly("Chicken (per lb)", "Beef (per lb)", "Apples");

        StaplePriceResponse aldiChicken = price(response, "Chicken (per lb)", "Aldi");
        assertThat(aldiChicken.bestPrice()).isCloseTo(1.99, within(0.0001));
        assertThat(aldiChicken.display()).isEqualTo("$1.99/lb");

        assertThat(price(response, "Beef (per lb)", "HEB").display()).isEqualTo("$4.99/lb");
        assertThat(price(response, "Beef (per lb)", "Aldi").bestPrice()).isNull();
        assertThat(price(response, "Beef (per lb)", "Aldi").display()).isNull();

        // per-each prices are not comparable, so the package price is used
        assertThat(price(response, "Apples", "Aldi").display()).isEqualTo("$3.99");
        assertThat(price(response, "Apples", "HEB").display()).isEqualTo("$1.49");
    }

    @Test
    void compare_should_include_text_summary() throws JsonProcessingException {
        RetailerComparisonResponse response = comparisonService.compare(request(null));

        assertThat(response.summary()).startsWith("🔄 MULTI-RETAILER COMPARISON\n");
        assertThat(response.summary()).contains("📍 Aldi\n", "📍 HEB\n", "📍 Unknown\n");
        assertThat(response.summary()).contains("Bananas - $0.59/lb");
    }

    private RetailerComparisonRequest request(Integer topN) throws JsonProcessingException {
        return new RetailerComparisonRequest(objectMapper.readTree(FLYERS), topN);
    }

    private RetailerTopDealsResponse section(RetailerComparisonResponse response, String retailer) {
        return response.sections().stream()
            .filter(section -> section.retailer().equals(retailer))
            .findFirst()
            .orElseThrow();
    }

    private StaplePriceResponse price(RetailerComparisonResponse response, String label, String retailer) {
        List<StaplePriceResponse> prices = response.staples().stream()
            .filter(row -> row.label().equals(label))
            .findFirst()
            .orElseThrow()
            .prices();
        return prices.stream().filter(price -> price.retailer().equals(retailer)).findFirst().orElseThrow();
    }
}
