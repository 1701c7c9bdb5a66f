package com.dealpick.deal.service;

import com.dealpick.deal.model.DealPrice;
import com.dealpick.deal.model.DealRecord;
import com.dealpick.deal.model.ScoreBreakdown;
import com.dealpick.deal.model.ScoredDeal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class DealReportFormatter {

    private static final String RULE = "=".repeat(60);
    private static final Set<String> PLACEHOLDER_VALUES = Set.of("null", "None");

    public String format(List<ScoredDeal> deals, boolean showDetails) {
        if (deals.isEmpty()) {
            return "❌ No deals found matching criteria\n";
        }

        String retailer = valueOrDefault(deals.get(0).deal().retailer(), "Unknown");
        StringBuilder output = new StringBuilder();
        output.append("🏆 TOP ").append(deals.size()).append(" DEALS - ").append(retailer).append('\n');
        output.append(RULE).append("\n\n");

        for (int i = 0; i < deals.size(); i++) {
            appendDeal(output, i + 1, deals.get(i), showDetails);
        }

        return output.toString();
    }

    public String formatComparison(Map<String, List<ScoredDeal>> topDealsByRetailer) {
        StringBuilder output = new StringBuilder();
        output.append("🔄 MULTI-RETAILER COMPARISON\n");
        output.append(RULE).append("\n\n");

        topDealsByRetailer.forEach((retailer, deals) -> {
            if (deals.isEmpty()) {
                return;
            }
            output.append("📍 ").append(retailer).append('\n');
            for (int i = 0; i < deals.size(); i++) {
                DealRecord deal = deals.get(i).deal();
                String display = deal.price() == null ? "" : valueOrDefault(deal.price().display(), "");
                output.append("  ").append(i + 1).append(". ")
                    .append(valueOrDefault(deal.productName(), ""))
                    .append(" - ").append(display).append('\n');
            }
            output.append('\n');
        });

        return output.toString();
    }

    private void appendDeal(StringBuilder output, int rank, ScoredDeal scored, boolean showDetails) {
        DealRecord deal = scored.deal();
        DealPrice price = deal.price();

        String trophy = switch (rank) {
            case 1 -> "🥇 ";
            case 2 -> "🥈 ";
            case 3 -> "🥉 ";
            default -> "";
        };
        String priorityIndicator = scored.priority() ? "⭐ " : "";
        String product = valueOrDefault(deal.productName(), "Unknown Product");
        String priceDisplay = price == null || isBlank(price.display()) ? "Price N/A" : price.display();

        output.append(rank).append(". ").append(trophy).append(priorityIndicator).append(product).append('\n');
        output.append("   💰 ").append(priceDisplay);

        String unitPriceDisplay = scored.unitPrice().display();
        if (!isBlank(unitPriceDisplay) && !priceDisplay.contains(unitPriceDisplay)) {
            output.append("  (≈ ").append(unitPriceDisplay).append(')');
        }

        List<String> details = new ArrayList<>();
        if (isPresent(deal.sizeQuantity())) {
            details.add("Size: " + deal.sizeQuantity());
        }
        String unit = price == null ? null : price.unit();
        if (!isBlank(unit) && !priceDisplay.contains(unit)) {
            details.add("Unit: " + unit);
        }
        String format = isBlank(deal.format()) ? deal.containerType() : deal.format();
        if (isPresent(format)) {
            details.add("Format: " + format);
        }
        if (deal.quantityRequired() != null && deal.quantityRequired() != 0) {
            details.add("Qty Required: " + deal.quantityRequired());
        }
        if (!details.isEmpty()) {
            output.append(" | ").append(String.join(" | ", details));
        }
        output.append('\n');

        if (showDetails) {
            output.append("   📊 Score: ").append(scored.engagementScore()).append(" pts | 📂 ")
                .append(valueOrDefault(deal.category(), "N/A"));
            if (scored.priority()) {
                output.append(" | ⭐ PRIORITY DEAL");
            }
            output.append('\n');

            ScoreBreakdown breakdown = scored.breakdown();
            output.append("   📈 Breakdown: Price=").append(breakdown.viralPricing())
                .append(" | Discount=").append(breakdown.discountDepth())
                .append(" | Category=").append(breakdown.categoryWeight())
                .append(" | Premium=").append(breakdown.premiumValue())
                .append(" | Social=").append(breakdown.socialAppeal())
                .append(" | Brand=").append(breakdown.brandRecognition());
            if (breakdown.priorityBonus() > 0) {
                output.append(" | Priority=").append(breakdown.priorityBonus());
            }
            output.append('\n');
        }

        output.append('\n');
    }

    private boolean isPresent(String value) {
        return !isBlank(value) && !PLACEHOLDER_VALUES.contains(value);
    }

    private boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    private String valueOrDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
