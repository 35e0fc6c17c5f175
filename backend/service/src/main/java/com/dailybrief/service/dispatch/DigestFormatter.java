package com.dailybrief.service.dispatch;

import com.dailybrief.core.model.NewsItem;
import com.dailybrief.core.model.RunResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a digest as chat markdown: header, per-category counts, one block per item, footer.
 */
public class DigestFormatter {
    private static final String DEFAULT_EMOJI = "📰";
    private static final String DEFAULT_NAME = "General";
    private static final Map<String, String> EMOJI = Map.of(
            "ai_research", "🔬",
            "ai_funding", "💰",
            "ai_compute", "⚡",
            "ai_data", "📊",
            "ai_product", "🚀",
            "general", DEFAULT_EMOJI
    );
    private static final Map<String, String> NAMES = Map.of(
            "ai_research", "Lab & company R&D",
            "ai_funding", "Funding",
            "ai_compute", "Compute market",
            "ai_data", "Data labeling",
            "ai_product", "AI products",
            "general", DEFAULT_NAME
    );

    private final String headline;
    private final String footer;

    public DigestFormatter() {
        this("🤖 AI Daily Brief", "🤖 *Generated automatically by the daily brief pipeline*");
    }

    public DigestFormatter(String headline, String footer) {
        this.headline = headline;
        this.footer = footer;
    }

    public String title(RunResult result) {
        return headline + " | " + result.runLabel();
    }

    public String render(RunResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("## " + headline);
        lines.add("### 📅 " + result.runLabel());
        lines.add("");
        lines.add("---");
        lines.add("📈 **Top " + result.size() + " stories today**");
        lines.add("");
        lines.add(String.join(" | ", categoryCounts(result.items())));
        lines.add("");
        lines.add("---");
        lines.add("");
        for (NewsItem item : result.items()) {
            lines.add("#### " + emoji(item.category()) + " **" + item.title() + "**");
            if (!item.summaryText().isBlank()) {
                lines.add("> " + item.summaryText());
            }
            lines.add("> 📍 **" + item.sourceName() + "** | 🔗 [Read more](" + item.url() + ")");
            lines.add("");
        }
        lines.add("---");
        lines.add("");
        lines.add(footer);
        return String.join("\n", lines);
    }

    private static List<String> categoryCounts(List<NewsItem> items) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (NewsItem item : items) {
            counts.merge(item.category(), 1, Integer::sum);
        }
        List<String> parts = new ArrayList<>();
        counts.forEach((category, count) -> parts.add(emoji(category) + " " + NAMES.getOrDefault(category, category) + ": " + count));
        return parts;
    }

    private static String emoji(String category) {
        return EMOJI.getOrDefault(category, DEFAULT_EMOJI);
    }
}
