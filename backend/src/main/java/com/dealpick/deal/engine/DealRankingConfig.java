package com.dealpick.deal.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Immutable keyword lists, weights and toggles for one analyzer. Collections are copied on
 * construction so a config can be shared between analyzers running on different threads.
 */
@Builder(toBuilder = true)
public record DealRankingConfig(
    List<String> storeBrands,
    List<String> excludedCategories,
    List<String> supplementKeywords,
    List<String> excludedProducts,
    List<PriorityDealRule> priorityRules,
    List<String> premiumKeywords,
    List<String> viralKeywords,
    List<String> majorBrands,
    List<String> popularSnackBrands,
    List<String> interestingKeywords,
    List<String> kidKeywords,
    List<String> mealKeywords,
    List<String> partyKeywords,
    List<String> regionalBrands,
    Map<String, Integer> categoryWeights,
    boolean dedupe,
    boolean balanceCategories
) {

    public DealRankingConfig {
        storeBrands = copy(storeBrands);
        excludedCategories = copy(excludedCategories);
        supplementKeywords = copy(supplementKeywords);
        excludedProducts = copy(excludedProducts);
        priorityRules = priorityRules == null ? List.of() : List.copyOf(priorityRules);
        premiumKeywords = copy(premiumKeywords);
        viralKeywords = copy(viralKeywords);
        majorBrands = copy(majorBrands);
        popularSnackBrands = copy(popularSnackBrands);
        interestingKeywords = copy(interestingKeywords);
        kidKeywords = copy(kidKeywords);
        mealKeywords = copy(mealKeywords);
        partyKeywords = copy(partyKeywords);
        regionalBrands = copy(regionalBrands);
        categoryWeights = categoryWeights == null ? Map.of() : Map.copyOf(categoryWeights);
    }

    public int categoryWeight(String category, int fallback) {
        return categoryWeights.getOrDefault(category == null ? "" : category, fallback);
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    public static DealRankingConfig defaults() {
        return DealRankingConfig.builder()
            .storeBrands(List.of(
                // Amazon / Whole Foods
                "Amazon Grocery", "Amazon Kitchen", "Amazon Fresh",
                "365 Brand", "365 by Whole Foods", "365 Everyday Value",
                // national chains
                "Kirkland", "Great Value", "Market Pantry", "Simple Truth",
                "O Organics", "Kroger", "Target", "Safeway SELECT",
                // Smart & Final
                "First Street",
                // HEB
                "H-E-B", "Hill Country Fare", "Central Market", "Higher Harvest", "HEB",
                // Sprouts
                "Sprouts", "Real Root by Sprouts", "Sprouts Farmers Market",
                // regional
                "Albertsons", "Vons", "Pavilions", "Ralphs", "Food Lion"
            ))
            .excludedCategories(List.of("Beer, Wine & Spirits", "ALCOHOL", "BEVERAGES_ALCOHOL"))
            .supplementKeywords(List.of(
                "supplement", "vitamin", "pill", "capsule",
                "tablet", "probiotic", "greens powder", "protein powder",
                "multivitamin", "omega-3", "turmeric", "ashwagandha",
                "collagen", "magnesium", "zinc", "elderberry"
            ))
            .excludedProducts(List.of(
                "hot dog", "hotdog", "hot dogs", "hotdogs",
                "franks", "wiener", "wieners"
            ))
            .priorityRules(List.of(
                new PriorityDealRule(
                    "chicken_breast",
                    List.of("chicken breast", "chicken thigh", "chicken thighs"),
                    List.of("boneless skinless chicken breast meal", "rotisserie"),
                    3.00,
                    List.of("MEAT", "Meat", "Meat & Seafood"),
                    30
                ),
                new PriorityDealRule(
                    "steak",
                    List.of("steak", "ribeye", "sirloin", "ny strip", "t-bone",
                        "porterhouse", "flank", "skirt", "filet"),
                    List.of("salisbury", "patties", "burger"),
                    10.00,
                    List.of("MEAT", "Meat", "Meat & Seafood"),
                    25
                ),
                new PriorityDealRule(
                    "ground_beef",
                    List.of("ground beef", "ground chuck", "hamburger"),
                    List.of("patties", "burger patty", "ground turkey"),
                    6.00,
                    List.of("MEAT", "Meat", "Meat & Seafood"),
                    20
                )
            ))
            .premiumKeywords(List.of(
                // meat
                "ribeye", "prime rib", "flank steak", "sirloin", "filet mignon",
                "ny strip", "porterhouse", "wagyu", "angus", "grass-fed",
                "organic chicken", "air-chilled", "heritage pork",
                // seafood
                "salmon", "atlantic salmon", "king salmon", "sockeye",
                "shrimp", "jumbo shrimp", "scallops", "crab", "lobster",
                "halibut", "sea bass", "ahi tuna", "swordfish",
                // produce
                "honeycrisp", "cotton candy grape", "dekopon", "sumo citrus",
                "organic", "heirloom", "persimmon", "dragon fruit",
                "artisan", "specialty mushroom", "truffle"
            ))
            .viralKeywords(List.of(
                "cotton candy", "party pack", "family size", "jumbo", "giant",
                "mega", "ultimate", "variety pack", "assorted", "party size",
                "super bowl", "game day", "tailgate", "celebration",
                "viral", "tiktok", "trending"
            ))
            .majorBrands(List.of(
                // snacks
                "doritos", "lays", "cheetos", "fritos", "ruffles", "tostitos",
                "pringles", "kettle", "popchips", "smartfood", "pirates booty",
                // beverages
                "coca-cola", "coke", "pepsi", "sprite", "mountain dew",
                "dr pepper", "7up", "canada dry", "schweppes", "crush",
                "capri sun", "gatorade", "powerade", "vitamin water",
                // candy
                "hershey", "reese's", "kit kat", "m&m", "snickers", "twix",
                "milky way", "skittles", "starburst", "sour patch", "haribo",
                // frozen
                "ben & jerry", "breyer", "haagen-dazs", "talenti", "outshine",
                "drumstick", "klondike", "good humor", "magnum",
                // dairy
                "dannon", "chobani", "yoplait", "fage", "siggi", "oikos",
                "tillamook", "kerrygold", "organic valley", "horizon",
                // meat
                "tyson", "perdue", "foster farms", "applegate", "hormel",
                "oscar mayer", "hillshire farm", "jimmy dean", "butterball",
                // pantry
                "kraft", "philadelphia", "velveeta", "barilla", "prego",
                "ragu", "newman's own", "rao's", "classico", "bertolli",
                "general mills", "kellogg", "quaker", "post", "nabisco",
                "oreo", "chips ahoy", "ritz", "triscuit", "wheat thins",
                "dave's killer bread", "artesano", "bimbo",
                // natural
                "annie's", "stonyfield", "nature's path", "kashi",
                "amy's", "dr praeger", "gardein", "beyond meat"
            ))
            .popularSnackBrands(List.of("doritos", "hershey", "outshine", "ben & jerry", "reese's"))
            .interestingKeywords(List.of(
                "cotton candy", "dekopon", "sumo", "dumpling", "truffle",
                "artisan", "heritage", "heirloom", "specialty", "gourmet"
            ))
            .kidKeywords(List.of(
                "chicken nugget", "drumstick", "popsicle", "fruit bar",
                "cookie", "mac and cheese", "pizza", "lunchable"
            ))
            .mealKeywords(List.of("entrée", "meal", "dinner", "ready to eat", "prepared"))
            .partyKeywords(List.of("party", "entertaining", "celebration", "game day"))
            .regionalBrands(List.of("boar's head", "tillamook", "kerrygold", "dave's killer"))
            .categoryWeights(defaultCategoryWeights())
            .dedupe(true)
            .balanceCategories(true)
            .build();
    }

    private static Map<String, Integer> defaultCategoryWeights() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        putWeight(weights, 25, "MEAT", "Meat", "Meat & Seafood", "SEAFOOD", "Seafood");
        putWeight(weights, 20, "DELI", "Deli");
        putWeight(weights, 25, "PRODUCE", "Produce", "Fresh Produce", "Organic Produce");
        putWeight(weights, 20, "SNACKS", "Snacks", "BEVERAGES", "Beverages", "Drinks");
        putWeight(weights, 15, "FROZEN", "Frozen", "Frozen Foods");
        putWeight(weights, 18, "Ice Cream");
        putWeight(weights, 15, "PREPARED_FOODS", "Prepared Foods", "Ready to Eat");
        putWeight(weights, 12, "DAIRY_EGGS", "Dairy", "Dairy & Eggs");
        putWeight(weights, 12, "BAKERY", "Bakery", "Fresh Bakery");
        putWeight(weights, 10, "Commercial Bakery");
        putWeight(weights, 10, "PANTRY", "Pantry", "Grocery");
        putWeight(weights, 8, "Canned Goods");
        putWeight(weights, 5, "HOUSEHOLD", "Household", "Cleaning", "Paper Products");
        putWeight(weights, 5, "HEALTH_BEAUTY", "Health & Beauty", "Personal Care");
        putWeight(weights, 5, "PET", "Pet", "Pet Supplies");
        return weights;
    }

    private static void putWeight(Map<String, Integer> weights, int weight, String... categories) {
        for (String category : categories) {
            weights.put(category, weight);
        }
    }
}
