package com.dailybrief.collectors.rank;

import com.dailybrief.core.model.NewsItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Orders merged items by score, highest first, and keeps the top {@code maxNews}.
 *
 * <p>{@link List#sort} is stable, so equal scores keep merge order. Given the same input order the output
 * is always identical.
 */
public class RankSelector {
    private final int maxNews;

    public RankSelector(int maxNews) {
        if (maxNews < 1) {
            throw new IllegalArgumentException("maxNews must be >= 1");
        }
        this.maxNews = maxNews;
    }

    public List<NewsItem> select(List<NewsItem> merged) {
        List<NewsItem> distinct = distinctByUrl(merged);
        distinct.sort(Comparator.comparingDouble(NewsItem::score).reversed());
        if (distinct.size() <= maxNews) {
            return List.copyOf(distinct);
        }
        return List.copyOf(distinct.subList(0, maxNews));
    }

    // The same article syndicated by two feeds: first in merge order wins.
    private static List<NewsItem> distinctByUrl(List<NewsItem> merged) {
        Set<String> urls = new HashSet<>();
        List<NewsItem> distinct = new ArrayList<>(merged.size());
        for (NewsItem item : merged) {
            if (urls.add(item.url())) {
                distinct.add(item);
            }
        }
        return distinct;
    }
}
