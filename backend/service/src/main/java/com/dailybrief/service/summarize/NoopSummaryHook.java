package com.dailybrief.service.summarize;

import com.dailybrief.core.model.NewsItem;

public final class NoopSummaryHook implements SummaryHook {
    @Override
    public String summarize(NewsItem item) {
        return item.summaryText();
    }

    @Override
    public boolean remote() {
        return false;
    }
}
