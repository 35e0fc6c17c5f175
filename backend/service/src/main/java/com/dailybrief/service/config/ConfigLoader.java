package com.dailybrief.service.config;

import com.dailybrief.collectors.config.FetchSettings;
import com.dailybrief.collectors.scoring.ScoringRules;
import com.dailybrief.core.model.SourceDescriptor;
import com.dailybrief.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One-shot loader for {@code config.json}. Every failure is an {@link IllegalStateException} whose message
 * names the file or the offending setting.
 */
public final class ConfigLoader {
    static final String DEFAULT_ZONE = "Asia/Shanghai";

    private ConfigLoader() {
    }

    public static DigestConfig load(Path path) {
        return load(path, System.getenv());
    }

    public static DigestConfig load(Path path, Map<String, String> environment) {
        DigestConfig raw = read(path);
        DigestConfig config = raw.withWebhooks(
                override(environment, "DINGTALK_WEBHOOK", raw.dingtalkWebhook()),
                override(environment, "DINGTALK_SECRET", raw.dingtalkSecret()),
                override(environment, "WECHAT_WEBHOOK", raw.wechatWebhook())
        );
        String summarizerKey = environment.get("SUMMARIZER_API_KEY");
        if (summarizerKey != null && !summarizerKey.isBlank()) {
            config = config.withSummarizer(config.summarizer().withApiKey(summarizerKey));
        }
        validate(config, path);
        return config;
    }

    /**
     * Flattens {@code news_sources} into descriptors in file order, each tagged with its category.
     */
    public static List<SourceDescriptor> sources(DigestConfig config) {
        List<SourceDescriptor> sources = new ArrayList<>();
        config.newsSources().forEach((category, entries) -> {
            if (entries == null) {
                return;
            }
            for (DigestConfig.SourceEntry entry : entries) {
                sources.add(new SourceDescriptor(entry.name(), entry.url(), null, entry.keywords()).withCategory(category));
            }
        });
        return List.copyOf(sources);
    }

    public static RunSettings settings(DigestConfig config) {
        DigestConfig.Settings s = config.settings();
        ZoneId zone = ZoneId.of(s.zone() == null ? DEFAULT_ZONE : s.zone());
        FetchSettings defaults = FetchSettings.defaults();
        FetchSettings fetch = new FetchSettings(
                s.lookbackHours() == null ? defaults.lookback() : Duration.ofHours(s.lookbackHours()),
                orDefault(s.maxEntriesPerSource(), defaults.maxEntriesPerSource()),
                orDefault(s.summaryMaxLength(), defaults.summaryMaxLength()),
                s.summarySuffix() == null ? defaults.summarySuffix() : s.summarySuffix(),
                orDefault(s.fetchConcurrency(), defaults.concurrency()),
                s.requestTimeoutSeconds() == null ? defaults.requestTimeout() : Duration.ofSeconds(s.requestTimeoutSeconds()),
                s.userAgent(),
                zone
        );
        return new RunSettings(
                orDefault(s.maxNews(), 10),
                fetch,
                scoring(config.scoring()),
                Path.of(s.seenFile() == null ? "sent_urls.json" : s.seenFile()),
                Path.of(s.journalFile() == null ? "logs/events.jsonl" : s.journalFile()),
                zone
        );
    }

    static ScoringRules scoring(DigestConfig.ScoringSection section) {
        ScoringRules defaults = ScoringRules.defaults();
        if (section == null) {
            return defaults;
        }
        List<ScoringRules.TermGroup> groups = section.termGroups() == null
                ? defaults.termGroups()
                : section.termGroups().stream()
                        .map(group -> new ScoringRules.TermGroup(group.weight(), group.terms() == null ? List.of() : group.terms()))
                        .toList();
        return new ScoringRules(
                section.base() == null ? defaults.base() : section.base(),
                section.sourceKeywordWeight() == null ? defaults.sourceKeywordWeight() : section.sourceKeywordWeight(),
                groups
        );
    }

    private static void validate(DigestConfig config, Path path) {
        if (isBlank(config.dingtalkWebhook()) && isBlank(config.wechatWebhook())) {
            throw new IllegalStateException("No webhook configured in " + path
                    + ": set dingtalk_webhook or wechat_webhook");
        }
        if (config.newsSources().isEmpty()) {
            throw new IllegalStateException("news_sources is empty in " + path);
        }
        config.newsSources().forEach((category, entries) -> {
            if (entries == null) {
                return;
            }
            for (DigestConfig.SourceEntry entry : entries) {
                if (entry == null || isBlank(entry.name()) || isBlank(entry.url())) {
                    throw new IllegalStateException("Source in category '" + category + "' needs name and url in " + path);
                }
            }
        });
        try {
            settings(config);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new IllegalStateException("Invalid settings in " + path + ": " + e.getMessage(), e);
        }
    }

    private static DigestConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            DigestConfig config = JsonUtils.objectMapper().readValue(in, DigestConfig.class);
            if (config == null) {
                throw new IllegalStateException("Failed loading config from " + path + ": empty document");
            }
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static String override(Map<String, String> environment, String key, String fallback) {
        String value = environment.get(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
