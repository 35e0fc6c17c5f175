package com.dailybrief.service.config;

import com.dailybrief.collectors.scoring.ScoringRules;
import com.dailybrief.core.model.SourceDescriptor;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsSourcesPerCategoryInFileOrder() throws Exception {
        Path file = write("""
                {
                  "dingtalk_webhook": "https://oapi.dingtalk.com/robot/send?access_token=t",
                  "news_sources": {
                    "ai_research": [
                      {"name": "OpenAI Blog", "url": "https://openai.com/blog/rss.xml", "keywords": ["gpt"]},
                      {"name": "DeepMind", "url": "https://deepmind.google/blog/rss.xml"}
                    ],
                    "ai_compute": [
                      {"name": "NVIDIA", "url": "https://blogs.nvidia.com/feed/"}
                    ]
                  },
                  "unknown_top_level": true
                }
                """);

        DigestConfig config = ConfigLoader.load(file, Map.of());
        List<SourceDescriptor> sources = ConfigLoader.sources(config);

        assertEquals(List.of("OpenAI Blog", "DeepMind", "NVIDIA"), sources.stream().map(SourceDescriptor::name).toList());
        assertEquals(List.of("ai_research", "ai_research", "ai_compute"),
                sources.stream().map(SourceDescriptor::category).toList());
        assertEquals(List.of("gpt"), sources.get(0).keywords());
        assertTrue(sources.get(1).keywords().isEmpty());
    }

    @Test
    void omittedSettingsFallBackToDefaults() throws Exception {
        DigestConfig config = ConfigLoader.load(write(minimal("")), Map.of());

        RunSettings settings = ConfigLoader.settings(config);

        assertEquals(10, settings.maxNews());
        assertEquals(Duration.ofHours(24), settings.fetch().lookback());
        assertEquals(250, settings.fetch().summaryMaxLength());
        assertEquals("...", settings.fetch().summarySuffix());
        assertEquals(Path.of("sent_urls.json"), settings.seenFile());
        assertEquals(ZoneId.of("Asia/Shanghai"), settings.zone());
        assertEquals(ZoneId.of("Asia/Shanghai"), settings.fetch().feedZone());
        assertEquals(ScoringRules.defaults(), settings.scoring());
        assertFalse(config.summarizer().enabled());
    }

    @Test
    void explicitSettingsAndScoringAreApplied() throws Exception {
        DigestConfig config = ConfigLoader.load(write(minimal("""
                ,
                "settings": {
                  "max_news": 3, "lookback_hours": 48, "fetch_concurrency": 8,
                  "request_timeout_seconds": 5, "seen_file": "state/seen.json", "zone": "UTC"
                },
                "scoring": {
                  "base": 0.5,
                  "term_groups": [{"weight": 4, "terms": ["Robotics"]}]
                }
                """)), Map.of());

        RunSettings settings = ConfigLoader.settings(config);

        assertEquals(3, settings.maxNews());
        assertEquals(Duration.ofHours(48), settings.fetch().lookback());
        assertEquals(8, settings.fetch().concurrency());
        assertEquals(Duration.ofSeconds(5), settings.fetch().requestTimeout());
        assertEquals(Path.of("state/seen.json"), settings.seenFile());
        assertEquals(ZoneId.of("UTC"), settings.zone());
        assertEquals(ZoneId.of("UTC"), settings.fetch().feedZone());
        assertEquals(0.5, settings.scoring().base());
        assertEquals(2.0, settings.scoring().sourceKeywordWeight());
        assertEquals(List.of(new ScoringRules.TermGroup(4, List.of("Robotics"))), settings.scoring().termGroups());
    }

    @Test
    void environmentOverridesWebhooksAndSummarizerKey() throws Exception {
        Path file = write("""
                {
                  "wechat_webhook": "https://qyapi.weixin.qq.com/cgi-bin/webhook/send?key=file",
                  "news_sources": {"general": [{"name": "a", "url": "https://a.example/feed"}]},
                  "summarizer": {"enabled": true, "endpoint": "https://llm.example/v1/chat/completions", "api_key": "from-file"}
                }
                """);

        DigestConfig config = ConfigLoader.load(file, Map.of(
                "DINGTALK_WEBHOOK", "https://oapi.dingtalk.com/robot/send?access_token=env",
                "DINGTALK_SECRET", "SECenv",
                "WECHAT_WEBHOOK", " ",
                "SUMMARIZER_API_KEY", "from-env"
        ));

        assertEquals("https://oapi.dingtalk.com/robot/send?access_token=env", config.dingtalkWebhook());
        assertEquals("SECenv", config.dingtalkSecret());
        assertEquals("https://qyapi.weixin.qq.com/cgi-bin/webhook/send?key=file", config.wechatWebhook());
        assertEquals("from-env", config.summarizer().apiKey());
    }

    @Test
    void webhookMayComeFromEnvironmentAlone() throws Exception {
        Path file = write("""
                {"news_sources": {"general": [{"name": "a", "url": "https://a.example/feed"}]}}
                """);

        DigestConfig config = ConfigLoader.load(file, Map.of("WECHAT_WEBHOOK", "https://qyapi.weixin.qq.com/x"));

        assertEquals("https://qyapi.weixin.qq.com/x", config.wechatWebhook());
        assertNull(config.dingtalkWebhook());
    }

    @Test
    void missingWebhookFailsWithPathInMessage() throws Exception {
        Path file = write("""
                {"news_sources": {"general": [{"name": "a", "url": "https://a.example/feed"}]}}
                """);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file, Map.of()));

        assertTrue(ex.getMessage().startsWith("No webhook configured in " + file));
    }

    @Test
    void emptyOrIncompleteSourcesAreRejected() throws Exception {
        Path empty = write("""
                {"wechat_webhook": "https://w.example", "news_sources": {}}
                """);
        Path noUrl = write("""
                {"wechat_webhook": "https://w.example", "news_sources": {"ai_data": [{"name": "x"}]}}
                """);

        assertTrue(assertThrows(IllegalStateException.class, () -> ConfigLoader.load(empty, Map.of()))
                .getMessage().contains("news_sources is empty"));
        assertTrue(assertThrows(IllegalStateException.class, () -> ConfigLoader.load(noUrl, Map.of()))
                .getMessage().contains("'ai_data' needs name and url"));
    }

    @Test
    void invalidSettingsAreReportedAsConfigErrors() throws Exception {
        Path badMax = write(minimal("""
                , "settings": {"max_news": 0}
                """));
        Path badZone = write(minimal("""
                , "settings": {"zone": "Mars/Olympus"}
                """));

        assertTrue(assertThrows(IllegalStateException.class, () -> ConfigLoader.load(badMax, Map.of()))
                .getMessage().startsWith("Invalid settings in"));
        assertTrue(assertThrows(IllegalStateException.class, () -> ConfigLoader.load(badZone, Map.of()))
                .getMessage().startsWith("Invalid settings in"));
    }

    @Test
    void missingOrMalformedFileFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-invalid-");
        Path malformed = dir.resolve("config.json");
        Files.writeString(malformed, "{not-json");
        Path missing = dir.resolve("absent.json");

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(malformed, Map.of()));
        IllegalStateException absent = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(missing, Map.of()));

        assertTrue(invalid.getMessage().contains("config.json"));
        assertTrue(absent.getMessage().startsWith("Failed loading config from"));
        assertTrue(absent.getMessage().contains("absent.json"));
    }

    private static String minimal(String extra) {
        return """
                {
                  "wechat_webhook": "https://qyapi.weixin.qq.com/cgi-bin/webhook/send?key=k",
                  "news_sources": {"general": [{"name": "a", "url": "https://a.example/feed"}]}
                """ + extra + "}";
    }

    private static Path write(String json) throws Exception {
        Path file = Files.createTempDirectory("config-loader-").resolve("config.json");
        Files.writeString(file, json);
        return file;
    }
}
