package com.tradeintel.common.intelligence;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps free-text catalyst descriptions onto a fixed set of catalyst categories by keyword.
 * Categories are tried in declaration order and the first match wins; unmatched text is
 * {@value #OTHER}. Keywords match on word boundaries, so "ai" does not match "gain".
 */
public final class CatalystClassifier {

    public static final String OTHER = "other";

    private static final Map<String, Pattern> CATEGORIES = new LinkedHashMap<>();

    static {
        register("earnings", "earnings", "eps", "revenue", "quarterly", "annual report", "guidance", "beat", "miss");
        register("fda_approval", "fda", "approval", "drug", "clinical trial", "phase", "therapeutic");
        register("government_contract", "government", "contract", "dod", "pentagon", "defense", "federal", "military");
        register("merger_acquisition", "merger", "acquisition", "buyout", "takeover", "m&a", "consolidation");
        register("product_launch", "launch", "product", "release", "unveil", "announcement", "new product");
        register("analyst_upgrade", "upgrade", "buy rating", "outperform", "price target raised");
        register("analyst_downgrade", "downgrade", "sell rating", "underperform", "price target lowered");
        register("insider_buying", "insider buying", "insider purchase", "ceo bought", "director bought");
        register("insider_selling", "insider selling", "insider sale", "ceo sold", "director sold");
        register("technical_breakout", "breakout", "resistance", "support", "technical", "chart pattern", "golden cross");
        register("momentum_surge", "momentum", "surge", "spike", "volume spike", "unusual volume", "flow");
        register("sector_rotation", "sector", "rotation", "industry trend", "sector momentum");
        register("macro_event", "fed", "fomc", "interest rate", "inflation", "cpi", "jobs report", "gdp");
        register("ai_news", "ai", "artificial intelligence", "machine learning", "nvidia", "gpu", "data center");
        register("quantum_news", "quantum", "qubit", "ionq", "rigetti", "quantum computing");
        register("crypto_news", "crypto", "bitcoin", "ethereum", "blockchain", "defi", "nft");
    }

    private CatalystClassifier() {}

    /** @return the category of {@code text}, {@value #OTHER} when nothing matches, null for blank input */
    public static String classify(String text) {
        if (text == null || text.isBlank()) return null;
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> e : CATEGORIES.entrySet()) {
            if (e.getValue().matcher(lower).find()) return e.getKey();
        }
        return OTHER;
    }

    /**
     * Canonical form of a stored catalyst type: lower case with spaces and hyphens as
     * underscores ({@code "FDA Approval"} → {@code "fda_approval"}).
     */
    public static String normalize(String catalystType) {
        if (catalystType == null || catalystType.isBlank()) return null;
        return catalystType.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }

    public static List<String> categories() {
        return List.copyOf(CATEGORIES.keySet());
    }

    private static void register(String category, String... keywords) {
        String alternation = Arrays.stream(keywords)
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        CATEGORIES.put(category, Pattern.compile("(?<![a-z0-9])(?:" + alternation + ")(?![a-z0-9])"));
    }
}
