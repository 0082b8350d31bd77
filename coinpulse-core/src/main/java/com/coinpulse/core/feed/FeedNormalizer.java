package com.coinpulse.core.feed;

import com.coinpulse.core.model.NormalizedArticle;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jsoup.parser.Parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns RSS/Atom payloads into {@link NormalizedArticle}s.
 *
 * Each field is optional in the source: a missing title becomes "No title",
 * anything else missing becomes an empty string. Titles and descriptions are
 * HTML-entity decoded after XML parsing, since feeds often double-encode.
 * Links and publication dates are taken verbatim (trimmed) from the item's own
 * {@code <link>} and {@code <pubDate>} elements; dates are not reformatted.
 */
public class FeedNormalizer {

    public List<NormalizedArticle> parse(byte[] xml, String sourceDomain, int maxItems) throws FeedParseException {
        if (maxItems <= 0) {
            return List.of();
        }
        if (xml == null || xml.length == 0) {
            throw new FeedParseException("Empty feed payload");
        }

        Document document;
        SyndFeed feed;
        try {
            document = newBuilder().build(new XmlReader(new ByteArrayInputStream(xml)));
            feed = new SyndFeedInput().build(document);
        } catch (JDOMException | FeedException | IOException | IllegalArgumentException e) {
            throw new FeedParseException("Malformed feed from " + sourceDomain + ": " + e.getMessage(), e);
        }

        List<Element> items = itemElements(document.getRootElement());
        List<SyndEntry> entries = feed.getEntries();
        List<NormalizedArticle> articles = new ArrayList<>();
        for (int i = 0; i < entries.size() && articles.size() < maxItems; i++) {
            Element item = i < items.size() ? items.get(i) : null;
            articles.add(toArticle(entries.get(i), item, sourceDomain));
        }
        return articles;
    }

    private NormalizedArticle toArticle(SyndEntry entry, Element item, String sourceDomain) {
        String title = entry.getTitle() != null
            ? decode(entry.getTitle())
            : NormalizedArticle.NO_TITLE;

        SyndContent description = entry.getDescription();
        String text = description != null && description.getValue() != null
            ? decode(description.getValue())
            : "";

        return new NormalizedArticle(
            title,
            link(item),
            text,
            childText(item, "pubDate", "published", "updated"),
            sourceDomain != null ? sourceDomain : ""
        );
    }

    static String decode(String raw) {
        return Parser.unescapeEntities(raw.trim(), false).trim();
    }

    private static SAXBuilder newBuilder() {
        SAXBuilder builder = new SAXBuilder();
        builder.setExpandEntities(false);
        builder.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        return builder;
    }

    // RSS 2.0 keeps items under <channel>, RSS 1.0 under the root, Atom uses <entry> under the root
    private static List<Element> itemElements(Element root) {
        List<Element> items = new ArrayList<>();
        for (Element child : root.getChildren()) {
            if ("channel".equals(child.getName())) {
                for (Element nested : child.getChildren()) {
                    if ("item".equals(nested.getName())) {
                        items.add(nested);
                    }
                }
            } else if ("item".equals(child.getName()) || "entry".equals(child.getName())) {
                items.add(child);
            }
        }
        return items;
    }

    private static String link(Element item) {
        if (item == null) {
            return "";
        }
        for (Element child : item.getChildren()) {
            if (!"link".equals(child.getName())) continue;
            String text = child.getTextTrim();
            if (!text.isEmpty()) {
                return text;
            }
            // Atom: <link href="..."/>
            String href = child.getAttributeValue("href");
            if (href != null && !href.isBlank()) {
                return href.trim();
            }
        }
        return "";
    }

    private static String childText(Element item, String... names) {
        if (item == null) {
            return "";
        }
        for (String name : names) {
            for (Element child : item.getChildren()) {
                if (name.equals(child.getName())) {
                    return child.getTextTrim();
                }
            }
        }
        return "";
    }
}
