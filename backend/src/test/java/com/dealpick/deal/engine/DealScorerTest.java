package com.dealpick.deal.engine;

import static com.dealpick.deal.DealFixtures.deal;
import static com.dealpick.deal.DealFixtures.multibuy;
import static com.dealpick.deal.DealFixtures.withSavings;
import static org.assertj.core.api.Assertions.assertThat;

import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ScoreBreakdown;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DealScorerTest {

    private final DealScorer scorer = scorerFor(DealRankingConfig.defaults());

    private static DealScorer scorerFor(DealRankingConfig config) {
        MultibuyPricing multibuyPricing = new MultibuyPricing();
        UnitNormalizer unitNormalizer = new UnitNormalizer(multibuyPricing);
        return new DealScorer(config, multibuyPricing, unitNormalizer, new PriorityDetector(config, unitNormalizer));
    }

    @Test
    void score_should_sum_components_for_cheap_discounted_chicken() {
        DealRecord chicken = withSavings(deal("1", "HEB", "Chicken Breast", "MEAT", 0.99, "lb"), 55);

        ScoreBreakdown breakdown = scorer.score(chicken);

        assertThat(breakdown).isEqualTo(new ScoreBreakdown(30, 18, 25, 15, 5, 5, 30));
        assertThat(breakdown.total()).isEqualTo(128);
        assertThat(scorer.totalScore(chicken)).isEqualTo(128);
    }

    @Test
    void score_should_reward_viral_snacks() {
        DealRecord doritos = withSavings(deal("1", "HEB", "Doritos Party Size", "SNACKS", 0.99, "each"), 60);

        assertThat(scorer.score(doritos)).isEqualTo(new ScoreBreakdown(30, 20, 20, 20, 20, 10, 0));
        assertThat(scorer.totalScore(doritos)).isEqualTo(120);
    }

    @Test
    void viralPricing_should_use_unit_price_and_charm_ending() {
        // $4.99 for 3lb is $1.66/lb, and .99 is a charm ending
        assertThat(scorer.viralPricing(deal("1", "HEB", "Russet Potatoes", "PRODUCE", 4.99, "3lb"))).isEqualTo(28);
        assertThat(scorer.viralPricing(deal("2", "HEB", "Ribeye", "MEAT", 12.00, "lb"))).isZero();
        assertThat(scorer.viralPricing(deal("3", "HEB", "Cereal", "PANTRY", 3.50, "each"))).isEqualTo(10);
    }

    @Test
    void viralPricing_should_cap_multibuy_deals() {
        assertThat(scorer.viralPricing(multibuy("mb", "Sparkling Water", 2.50, 2))).isEqualTo(30);
    }

    @Test
    void discountDepth_should_scale_savings_and_clamp() {
        assertThat(scorer.discountDepth(withSavings(deal("1", "HEB", "Item", "PANTRY", 1.00, "each"), 70))).isEqualTo(20);
        assertThat(scorer.discountDepth(withSavings(deal("2", "HEB", "Item", "PANTRY", 1.00, "each"), 3))).isZero();
        assertThat(scorer.discountDepth(withSavings(deal("3", "HEB", "Item", "PANTRY", 1.00, "each"), 25))).isEqualTo(7);
        assertThat(scorer.discountDepth(deal("4", "HEB", "Item", "PANTRY", 1.00, "each"))).isZero();
    }

    @Test
    void discountDepth_should_infer_savings_from_original_price() {
        DealRecord deal = DealRecord.builder()
            .productName("Coffee")
            .category("PANTRY")
            .price(DealPrice.builder().amount(2.00).originalPrice(4.00).build())
            .build();

        assertThat(scorer.discountDepth(deal)).isEqualTo(16);
    }

    @Test
    void score_should_ignore_savings_given_as_text() {
        DealRecord deal = DealRecord.builder()
            .productName("Kale")
            .category("PRODUCE")
            .price(DealPrice.builder().amount(3.50).unit("each").savingsPercent("30").originalPrice("$7.00").build())
            .build();

        assertThat(scorer.discountDepth(deal)).isZero();
        assertThat(scorer.viralPricing(deal)).isEqualTo(10);
        assertThat(scorer.premiumValue(deal)).isEqualTo(5);
    }

    @Test
    void viralPricing_should_treat_falsy_multibuy_flag_as_single_item() {
        DealRecord deal = DealRecord.builder()
            .productName("Kale")
            .category("PRODUCE")
            .price(DealPrice.builder().amount(3.50).unit("each").isMultibuy(0).build())
            .build();

        assertThat(scorer.viralPricing(deal)).isEqualTo(10);
    }

    @Test
    void categoryWeight_should_fall_back_for_unknown_categories() {
        assertThat(scorer.categoryWeight(deal("1", "HEB", "Kibble", "PET", 9.99, "each"))).isEqualTo(5);
        assertThat(scorer.categoryWeight(deal("2", "HEB", "Sourdough", "BAKERY", 3.99, "each"))).isEqualTo(12);
        assertThat(scorer.categoryWeight(deal("3", "HEB", "Mystery", "GARDEN", 3.99, "each"))).isEqualTo(5);
        assertThat(scorer.categoryWeight(deal("4", "HEB", "Mystery", null, 3.99, "each"))).isEqualTo(5);
    }

    @Test
    void categoryWeight_should_read_configured_weights() {
        DealScorer custom = scorerFor(DealRankingConfig.defaults().toBuilder()
            .categoryWeights(Map.of("GARDEN", 22))
            .build());

        assertThat(custom.categoryWeight(deal("1", "HEB", "Potting Soil", "GARDEN", 4.99, "each"))).isEqualTo(22);
    }

    @Test
    void premiumValue_should_check_keyword_tiers_in_order() {
        assertThat(scorer.premiumValue(deal("1", "HEB", "Organic Strawberries", "PRODUCE", 3.99, "each"))).isEqualTo(25);
        assertThat(scorer.premiumValue(deal("2", "HEB", "Doritos Nacho Cheese", "SNACKS", 3.99, "each"))).isEqualTo(20);
        assertThat(scorer.premiumValue(withSavings(deal("3", "HEB", "Paper Towels", "HOUSEHOLD", 3.99, "each"), 35)))
            .isEqualTo(15);
        assertThat(scorer.premiumValue(deal("4", "HEB", "Paper Towels", "HOUSEHOLD", 3.99, "each"))).isEqualTo(5);
    }

    @Test
    void socialAppeal_should_return_first_matching_tier() {
        assertThat(scorer.socialAppeal(deal("1", "HEB", "Jumbo Pretzels", "SNACKS", 3.99, "each"))).isEqualTo(20);
        assertThat(scorer.socialAppeal(deal("2", "HEB", "Gourmet Dumplings", "FROZEN", 3.99, "each"))).isEqualTo(18);
        assertThat(scorer.socialAppeal(deal("3", "HEB", "Mac and Cheese Party Tray", "DELI", 3.99, "each"))).isEqualTo(12);
        assertThat(scorer.socialAppeal(deal("4", "HEB", "Dinner Party Platter", "DELI", 3.99, "each"))).isEqualTo(10);
        assertThat(scorer.socialAppeal(deal("5", "HEB", "Entertaining Cheese Board", "DELI", 3.99, "each"))).isEqualTo(15);
        assertThat(scorer.socialAppeal(deal("6", "HEB", "Paper Towels", "HOUSEHOLD", 3.99, "each"))).isEqualTo(5);
    }

    @Test
    void socialAppeal_should_read_special_notes() {
        DealRecord deal = deal("1", "HEB", "Paper Towels", "HOUSEHOLD", 3.99, "each").toBuilder()
            .specialNotes("Trending on TikTok")
            .build();

        assertThat(scorer.socialAppeal(deal)).isEqualTo(20);
    }

    @Test
    void brandRecognition_should_prefer_major_over_regional() {
        assertThat(scorer.brandRecognition(deal("1", "HEB", "Tillamook Cheddar", "DAIRY_EGGS", 3.99, "each"))).isEqualTo(10);
        assertThat(scorer.brandRecognition(deal("2", "HEB", "Boar's Head Turkey", "DELI", 3.99, "each"))).isEqualTo(8);
        assertThat(scorer.brandRecognition(deal("3", "HEB", "Paper Towels", "HOUSEHOLD", 3.99, "each"))).isEqualTo(5);
    }

    @Test
    void score_should_include_priority_bonus_only_for_qualifying_deals() {
        assertThat(scorer.score(deal("1", "HEB", "Chicken Breast", "MEAT", 1.99, "lb")).priorityBonus()).isEqualTo(30);
        assertThat(scorer.score(deal("2", "HEB", "Chicken Breast", "MEAT", 3.49, "lb")).priorityBonus()).isZero();
    }
}
