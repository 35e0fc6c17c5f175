package com.dailybrief.service.dispatch;

import com.dailybrief.core.model.NewsItem;
import com.dailybrief.core.model.RunResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestFormatterTest {
    private static final Instant NOW = Instant.parse("2026-10-19T01:00:00Z");

    private final DigestFormatter formatter = new DigestFormatter();

    @Test
    void titleCarriesRunLabel() {
        assertEquals("🤖 AI Daily Brief | 2026.10.19", formatter.title(new RunResult(List.of(), "2026.10.19")));
    }

    @Test
    void rendersHeaderCountsAndOneBlockPerItemInOrder() {
        RunResult result = new RunResult(List.of(
                new NewsItem("OpenAI launches GPT-5", "A new model.", "https://x.com/gpt5", "OpenAI Blog", NOW, "ai_research", 7.0),
                new NewsItem("Startup raises $50M", "", "https://x.com/raise", "TechCrunch", NOW, "ai_funding", 4.0),
                new NewsItem("DeepMind paper", "World models.", "https://x.com/dm", "DeepMind", NOW, "ai_research", 4.0)
        ), "2026.10.19");

        String markdown = formatter.render(result);
        List<String> lines = markdown.lines().toList();

        assertEquals("## 🤖 AI Daily Brief", lines.get(0));
        assertEquals("### 📅 2026.10.19", lines.get(1));
        assertTrue(markdown.contains("📈 **Top 3 stories today**"));
        assertTrue(markdown.contains("🔬 Lab & company R&D: 2 | 💰 Funding: 1"));
        assertTrue(markdown.contains("#### 🔬 **OpenAI launches GPT-5**\n> A new model.\n> 📍 **OpenAI Blog** | 🔗 [Read more](https://x.com/gpt5)"));
        assertTrue(markdown.contains("#### 💰 **Startup raises $50M**\n> 📍 **TechCrunch**"));
        assertTrue(markdown.indexOf("GPT-5") < markdown.indexOf("raises") && markdown.indexOf("raises") < markdown.indexOf("DeepMind paper"));
        assertTrue(markdown.endsWith("🤖 *Generated automatically by the daily brief pipeline*"));
    }

    @Test
    void unknownCategoriesUseGenericEmojiAndRawName() {
        RunResult result = new RunResult(List.of(
                new NewsItem("Robot news", "", "https://x.com/r", "Robots Weekly", NOW, "robotics", 1.0)
        ), "2026.10.19");

        String markdown = formatter.render(result);

        assertTrue(markdown.contains("📰 robotics: 1"));
        assertTrue(markdown.contains("#### 📰 **Robot news**"));
        assertFalse(markdown.contains("> \n"));
    }

    @Test
    void customHeadlineAndFooter() {
        DigestFormatter custom = new DigestFormatter("Morning Brief", "-- bot");

        String markdown = custom.render(new RunResult(List.of(), "2026.10.19"));

        assertTrue(markdown.startsWith("## Morning Brief\n"));
        assertTrue(markdown.endsWith("-- bot"));
        assertEquals("Morning Brief | 2026.10.19", custom.title(new RunResult(List.of(), "2026.10.19")));
    }
}
