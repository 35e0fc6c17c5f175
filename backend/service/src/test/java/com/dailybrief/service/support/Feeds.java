package com.dailybrief.service.support;

import java.time.Instant;

/**
 * Builds small RSS documents for pipeline tests.
 */
public final class Feeds {
    private Feeds() {
    }

    public static String rss(Item... items) {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?><rss version=\"2.0\"><channel><title>stub</title>");
        for (Item item : items) {
            xml.append("<item><title>").append(item.title()).append("</title>")
                    .append("<link>").append(item.link()).append("</link>")
                    .append("<description>").append(item.description()).append("</description>");
            if (item.published() != null) {
                xml.append("<pubDate>").append(item.published()).append("</pubDate>");
            }
            xml.append("</item>");
        }
        return xml.append("</channel></rss>").toString();
    }

    public static Item item(String title, String link, Instant published) {
        return new Item(title, link, "About " + title, published);
    }

    public record Item(String title, String link, String description, Instant published) {
    }
}
