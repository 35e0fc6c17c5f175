package com.dailybrief.collectors.rss;

import com.dailybrief.core.model.FeedEntry;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads RSS 2.0, RSS 1.0 (RDF) and Atom documents into {@link FeedEntry} values.
 *
 * <p>DTDs and external entities are refused. At most {@code maxEntries} entries are read from a document;
 * an entry whose fields cannot be extracted is skipped without affecting its neighbours.
 */
public final class FeedParser {
    private static final Logger LOGGER = Logger.getLogger(FeedParser.class.getName());
    private static final DateTimeFormatter RFC_822_ZONE_NAME =
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss zzz", Locale.ENGLISH);
    private static final DateTimeFormatter RFC_822_NO_SECONDS =
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm Z", Locale.ENGLISH);
    private static final DateTimeFormatter RFC_822_SHORT_YEAR_ZONE_NAME =
            DateTimeFormatter.ofPattern("EEE, d MMM yy HH:mm:ss zzz", Locale.ENGLISH);
    private static final DateTimeFormatter RFC_822_SHORT_YEAR_OFFSET =
            DateTimeFormatter.ofPattern("EEE, d MMM yy HH:mm:ss Z", Locale.ENGLISH);
    private static final DateTimeFormatter ISO_COMPACT_OFFSET = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HHMM", "Z")
            .toFormatter(Locale.ROOT);
    private static final DateTimeFormatter LOCAL_SPACED = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT);
    // Two-digit year patterns run before RFC_1123_DATE_TIME, which parses leniently and reads "26" as year 26.
    private static final List<BiFunction<String, ZoneId, Instant>> DATE_PARSERS = List.of(
            (v, zone) -> Instant.parse(v),
            (v, zone) -> OffsetDateTime.parse(v).toInstant(),
            (v, zone) -> OffsetDateTime.parse(v, ISO_COMPACT_OFFSET).toInstant(),
            (v, zone) -> LocalDateTime.parse(v).atZone(zone).toInstant(),
            (v, zone) -> LocalDateTime.parse(v, LOCAL_SPACED).atZone(zone).toInstant(),
            (v, zone) -> ZonedDateTime.parse(v, RFC_822_SHORT_YEAR_ZONE_NAME).toInstant(),
            (v, zone) -> ZonedDateTime.parse(v, RFC_822_SHORT_YEAR_OFFSET).toInstant(),
            (v, zone) -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            (v, zone) -> ZonedDateTime.parse(v, RFC_822_ZONE_NAME).toInstant(),
            (v, zone) -> ZonedDateTime.parse(v, RFC_822_NO_SECONDS).toInstant()
    );

    private FeedParser() {
    }

    /**
     * @param zone zone for dates that carry no offset
     */
    public static ParseOutcome parse(byte[] document, int maxEntries, ZoneId zone) {
        try {
            Document parsed = newBuilder().parse(new ByteArrayInputStream(document));
            Element root = parsed.getDocumentElement();
            if (root == null) {
                return ParseOutcome.invalid("document has no root element");
            }
            String rootName = localName(root);
            if ("rss".equals(rootName) || "rdf".equals(rootName)) {
                return ParseOutcome.parsed(readEntries(parsed, "item", maxEntries, item -> readRssItem(item, zone)));
            }
            if ("feed".equals(rootName)) {
                return ParseOutcome.parsed(readEntries(parsed, "entry", maxEntries, entry -> readAtomEntry(entry, zone)));
            }
            return ParseOutcome.invalid("unsupported root element <" + root.getTagName() + ">");
        } catch (Exception e) {
            return ParseOutcome.invalid(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    static Optional<Instant> parseDate(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        DateTimeParseException last = null;
        for (BiFunction<String, ZoneId, Instant> parser : DATE_PARSERS) {
            try {
                return Optional.of(parser.apply(trimmed, zone));
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        LOGGER.warning("Unreadable feed date '" + trimmed + "', entry treated as undated");
        LOGGER.log(Level.FINE, "Last date parse failure", last);
        return Optional.empty();
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                LOGGER.log(Level.FINE, "Feed XML warning", exception);
            }

            @Override
            public void error(SAXParseException exception) throws SAXParseException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXParseException {
                throw exception;
            }
        });
        return builder;
    }

    private static List<FeedEntry> readEntries(
            Document document,
            String tagName,
            int maxEntries,
            Function<Element, FeedEntry> reader
    ) {
        NodeList nodes = document.getElementsByTagName(tagName);
        int limit = Math.min(nodes.getLength(), Math.max(0, maxEntries));
        List<FeedEntry> entries = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Node node = nodes.item(i);
            if (!(node instanceof Element element)) {
                continue;
            }
            try {
                entries.add(reader.apply(element));
            } catch (RuntimeException e) {
                LOGGER.log(Level.FINE, "Skipping unreadable <" + tagName + "> #" + i, e);
            }
        }
        return entries;
    }

    private static FeedEntry readRssItem(Element item, ZoneId zone) {
        String summary = childText(item, "description")
                .or(() -> childText(item, "content:encoded"))
                .orElse("");
        return new FeedEntry(
                childText(item, "title").orElse(""),
                childText(item, "link").or(() -> rssGuidLink(item)).orElse(""),
                summary,
                childText(item, "pubDate").or(() -> childText(item, "dc:date")).flatMap(v -> parseDate(v, zone)),
                childText(item, "atom:updated").flatMap(v -> parseDate(v, zone))
        );
    }

    private static FeedEntry readAtomEntry(Element entry, ZoneId zone) {
        String summary = childText(entry, "summary")
                .or(() -> childText(entry, "content"))
                .orElse("");
        return new FeedEntry(
                childText(entry, "title").orElse(""),
                atomLink(entry).orElse(""),
                summary,
                childText(entry, "published").flatMap(v -> parseDate(v, zone)),
                childText(entry, "updated").flatMap(v -> parseDate(v, zone))
        );
    }

    // <guid isPermaLink="true"> is the only guid usable as a link.
    private static Optional<String> rssGuidLink(Element item) {
        return firstChild(item, "guid")
                .filter(guid -> !"false".equalsIgnoreCase(guid.getAttribute("isPermaLink")))
                .map(guid -> guid.getTextContent() == null ? "" : guid.getTextContent().trim())
                .filter(value -> !value.isEmpty());
    }

    private static Optional<String> atomLink(Element entry) {
        String fallback = null;
        for (Node child = entry.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (!(child instanceof Element link) || !"link".equals(link.getTagName())) {
                continue;
            }
            String href = link.getAttribute("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = link.getAttribute("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                return Optional.of(href);
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static Optional<String> childText(Element parent, String tagName) {
        return firstChild(parent, tagName)
                .map(Node::getTextContent)
                .map(String::trim)
                .filter(text -> !text.isEmpty());
    }

    private static Optional<Element> firstChild(Element parent, String tagName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && tagName.equals(element.getTagName())) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    private static String localName(Element element) {
        String tag = element.getTagName();
        int colon = tag.indexOf(':');
        return (colon >= 0 ? tag.substring(colon + 1) : tag).toLowerCase(Locale.ROOT);
    }

    public record ParseOutcome(List<FeedEntry> entries, boolean invalid, String error) {
        public ParseOutcome {
            entries = entries == null ? List.of() : List.copyOf(entries);
        }

        static ParseOutcome parsed(List<FeedEntry> entries) {
            return new ParseOutcome(entries, false, null);
        }

        static ParseOutcome invalid(String error) {
            return new ParseOutcome(List.of(), true, error);
        }
    }
}
