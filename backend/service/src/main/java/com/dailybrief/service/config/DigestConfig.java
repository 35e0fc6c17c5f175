package com.dailybrief.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parsed {@code config.json}. Field names follow the file format; defaults for omitted settings are
 * applied by {@link ConfigLoader}, not here.
 */
public record DigestConfig(
        @JsonProperty("dingtalk_webhook") String dingtalkWebhook,
        @JsonProperty("dingtalk_secret") String dingtalkSecret,
        @JsonProperty("wechat_webhook") String wechatWebhook,
        @JsonProperty("news_sources") Map<String, List<SourceEntry>> newsSources,
        @JsonProperty("settings") Settings settings,
        @JsonProperty("scoring") ScoringSection scoring,
        @JsonProperty("summarizer") SummarizerSection summarizer
) {
    public DigestConfig {
        newsSources = newsSources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(newsSources));
        settings = settings == null ? Settings.empty() : settings;
        summarizer = summarizer == null ? SummarizerSection.disabled() : summarizer;
    }

    public DigestConfig withWebhooks(String dingtalk, String secret, String wechat) {
        return new DigestConfig(dingtalk, secret, wechat, newsSources, settings, scoring, summarizer);
    }

    public DigestConfig withSummarizer(SummarizerSection replacement) {
        return new DigestConfig(dingtalkWebhook, dingtalkSecret, wechatWebhook, newsSources, settings, scoring, replacement);
    }

    public record SourceEntry(
            @JsonProperty("name") String name,
            @JsonProperty("url") String url,
            @JsonProperty("keywords") List<String> keywords
    ) {
    }

    public record Settings(
            @JsonProperty("max_news") Integer maxNews,
            @JsonProperty("lookback_hours") Integer lookbackHours,
            @JsonProperty("max_entries_per_source") Integer maxEntriesPerSource,
            @JsonProperty("summary_max_length") Integer summaryMaxLength,
            @JsonProperty("summary_suffix") String summarySuffix,
            @JsonProperty("fetch_concurrency") Integer fetchConcurrency,
            @JsonProperty("request_timeout_seconds") Integer requestTimeoutSeconds,
            @JsonProperty("user_agent") String userAgent,
            @JsonProperty("seen_file") String seenFile,
            @JsonProperty("journal_file") String journalFile,
            @JsonProperty("zone") String zone
    ) {
        static Settings empty() {
            return new Settings(null, null, null, null, null, null, null, null, null, null, null);
        }
    }

    public record ScoringSection(
            @JsonProperty("base") Double base,
            @JsonProperty("source_keyword_weight") Double sourceKeywordWeight,
            @JsonProperty("term_groups") List<TermGroupEntry> termGroups
    ) {
    }

    public record TermGroupEntry(
            @JsonProperty("weight") double weight,
            @JsonProperty("terms") List<String> terms
    ) {
    }

    public record SummarizerSection(
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("endpoint") String endpoint,
            @JsonProperty("api_key") String apiKey,
            @JsonProperty("model") String model,
            @JsonProperty("max_length") Integer maxLength,
            @JsonProperty("delay_millis") Long delayMillis
    ) {
        static SummarizerSection disabled() {
            return new SummarizerSection(false, null, null, null, null, null);
        }

        public SummarizerSection withApiKey(String key) {
            return new SummarizerSection(enabled, endpoint, key, model, maxLength, delayMillis);
        }
    }
}
