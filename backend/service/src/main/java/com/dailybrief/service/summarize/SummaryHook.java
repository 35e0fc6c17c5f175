package com.dailybrief.service.summarize;

import com.dailybrief.core.model.NewsItem;

/**
 * Optional rewrite of an item's summary before dispatch. Returns the replacement text, or the item's
 * current summary when it has nothing better. Must not throw.
 */
public interface SummaryHook {
    String summarize(NewsItem item);

    /**
     * Whether calls hit an external service, in which case the controller spaces them out.
     */
    default boolean remote() {
        return true;
    }
}
