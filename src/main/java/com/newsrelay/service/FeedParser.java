package com.newsrelay.service;

import com.newsrelay.exception.FeedParseException;
import com.newsrelay.model.EntryResult;
import com.newsrelay.model.Item;
import com.newsrelay.model.ParsedFeed;
import com.newsrelay.model.ParsedFeed.FeedFormat;
import com.newsrelay.util.DigestUtils;
import com.newsrelay.util.FeedText;
import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.feed.atom.Entry;
import com.rometools.rome.feed.atom.Feed;
import com.rometools.rome.feed.atom.Link;
import com.rometools.rome.feed.module.DCModule;
import com.rometools.rome.feed.rss.Channel;
import com.rometools.rome.feed.rss.Enclosure;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.WireFeedInput;
import com.rometools.rome.io.XmlReader;
import com.rometools.rome.io.impl.DateParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw RSS / Atom / RDF payloads into {@link Item}s.
 * <p>
 * Well-formed documents go through Rome. When Rome rejects the document, each
 * {@code <item>} / {@code <entry>} element is cut out of the raw text and parsed
 * on its own, so one broken entry cannot take its siblings down with it.
 */
@Service
@Slf4j
public class FeedParser {

    private static final Pattern ROOT_PROBE = Pattern.compile(
            "<(?:[\\w.-]+:)?(rss|feed|RDF|channel|item|entry)(?=[\\s>/])", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTRY_START = Pattern.compile(
            "<((?:[\\w.-]+:)?(item|entry))(?=[\\s>/])[^>]*>", Pattern.CASE_INSENSITIVE);

    public ParsedFeed parse(byte[] raw) {
        return parse(raw, null);
    }

    public ParsedFeed parse(byte[] raw, String source) {
        if (raw == null || raw.length == 0) {
            throw new FeedParseException("Empty feed payload");
        }
        String text = decode(raw);

        ParsedFeed parsed;
        try {
            WireFeed wireFeed = new WireFeedInput().build(new StringReader(text));
            parsed = fromWireFeed(wireFeed);
        } catch (FeedException | IllegalArgumentException e) {
            log.warn("Feed is not well-formed ({}), recovering entries one by one", e.getMessage());
            parsed = recover(text);
        }

        List<EntryResult> entries = parsed.entries().stream()
                .map(r -> r.isParsed() && source != null ? EntryResult.parsed(r.item().withSource(source)) : r)
                .toList();
        ParsedFeed result = new ParsedFeed(parsed.format(), parsed.recovered(), entries);
        log.info("Parsed {} {} entries ({} skipped){}", result.items().size(), result.format(),
                result.skippedCount(), source != null ? " from " + source : "");
        return result;
    }

    private String decode(byte[] raw) {
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(raw))) {
            StringWriter writer = new StringWriter(raw.length);
            reader.transferTo(writer);
            return writer.toString();
        } catch (IOException e) {
            throw new FeedParseException("Unreadable feed payload: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Well-formed documents (Rome)
    // ---------------------------------------------------------------------

    private ParsedFeed fromWireFeed(WireFeed wireFeed) {
        List<EntryResult> results = new ArrayList<>();
        if (wireFeed instanceof Feed atom) {
            for (Entry entry : atom.getEntries()) {
                results.add(safely(() -> mapAtomEntry(entry)));
            }
            return new ParsedFeed(FeedFormat.ATOM, false, results);
        }
        if (wireFeed instanceof Channel channel) {
            boolean rdf = channel.getFeedType() != null && channel.getFeedType().startsWith("rss_1.0")
                    || "rss_0.9".equals(channel.getFeedType());
            for (com.rometools.rome.feed.rss.Item item : channel.getItems()) {
                results.add(safely(() -> mapRssItem(item, rdf)));
            }
            return new ParsedFeed(rdf ? FeedFormat.RDF : FeedFormat.RSS, false, results);
        }
        throw new FeedParseException("Unsupported feed type: " + wireFeed.getFeedType());
    }

    private EntryResult mapRssItem(com.rometools.rome.feed.rss.Item item, boolean rdf) {
        String guid = item.getGuid() != null ? item.getGuid().getValue() : null;
        String canonicalId = FeedText.firstNonBlank(guid, rdf ? item.getUri() : null);

        String descriptionHtml = item.getDescription() != null ? item.getDescription().getValue() : null;
        String contentHtml = item.getContent() != null ? item.getContent().getValue() : null;
        String bodyHtml = FeedText.firstNonBlank(descriptionHtml, contentHtml);

        Date date = item.getPubDate();
        if (date == null && item.getModule(DCModule.URI) instanceof DCModule dc) {
            date = dc.getDate();
        }

        String imageUrl = null;
        for (Enclosure enclosure : item.getEnclosures()) {
            if (enclosure.getType() != null && enclosure.getType().startsWith("image/")
                    || FeedText.looksLikeImage(enclosure.getUrl())) {
                imageUrl = enclosure.getUrl();
                break;
            }
        }
        if (imageUrl == null) {
            imageUrl = mediaImage(item.getForeignMarkup());
        }

        return build(canonicalId, item.getTitle(), item.getLink(), bodyHtml, contentHtml,
                toInstant(date), "", imageUrl);
    }

    private EntryResult mapAtomEntry(Entry entry) {
        String link = null;
        for (Link alternate : entry.getAlternateLinks()) {
            if (!FeedText.isBlank(alternate.getHref())) {
                link = alternate.getHref();
                break;
            }
        }
        String imageUrl = null;
        for (Link other : entry.getOtherLinks()) {
            if (link == null && !FeedText.isBlank(other.getHref()) && !"self".equals(other.getRel())) {
                link = other.getHref();
            }
            if (imageUrl == null && "enclosure".equals(other.getRel())
                    && (other.getType() != null && other.getType().startsWith("image/")
                        || FeedText.looksLikeImage(other.getHref()))) {
                imageUrl = other.getHref();
            }
        }

        String summaryHtml = entry.getSummary() != null ? entry.getSummary().getValue() : null;
        String contentHtml = entry.getContents().isEmpty() ? null : entry.getContents().get(0).getValue();
        Date date = entry.getPublished() != null ? entry.getPublished() : entry.getUpdated();
        if (imageUrl == null) {
            imageUrl = mediaImage(entry.getForeignMarkup());
        }

        return build(entry.getId(), entry.getTitle(), link, FeedText.firstNonBlank(summaryHtml, contentHtml),
                contentHtml, toInstant(date), "", imageUrl);
    }

    private String mediaImage(List<org.jdom2.Element> foreignMarkup) {
        if (foreignMarkup == null) {
            return null;
        }
        for (org.jdom2.Element element : foreignMarkup) {
            String name = element.getName();
            if ("content".equals(name) || "thumbnail".equals(name)) {
                String url = element.getAttributeValue("url");
                String medium = element.getAttributeValue("medium");
                String type = element.getAttributeValue("type");
                if (!FeedText.isBlank(url) && ("image".equals(medium)
                        || type != null && type.startsWith("image/")
                        || "thumbnail".equals(name)
                        || FeedText.looksLikeImage(url))) {
                    return url;
                }
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Malformed documents: entry-by-entry recovery
    // ---------------------------------------------------------------------

    private ParsedFeed recover(String text) {
        Matcher probe = ROOT_PROBE.matcher(text);
        if (!probe.find()) {
            throw new FeedParseException("No RSS, Atom or RDF element found in payload");
        }

        List<EntryResult> results = new ArrayList<>();
        List<int[]> starts = new ArrayList<>();
        List<String> names = new ArrayList<>();
        Matcher start = ENTRY_START.matcher(text);
        while (start.find()) {
            starts.add(new int[]{start.start(), start.end()});
            names.add(start.group(1));
        }

        for (int i = 0; i < starts.size(); i++) {
            int from = starts.get(i)[0];
            int tagEnd = starts.get(i)[1];
            int until = i + 1 < starts.size() ? starts.get(i + 1)[0] : text.length();
            String name = names.get(i);
            String fragment = cutFragment(text, name, from, tagEnd, until);
            if (fragment == null) {
                log.warn("Skipping entry #{}: unclosed <{}> element", i + 1, name);
                results.add(EntryResult.skipped("unclosed <" + name + "> element"));
                continue;
            }
            results.add(parseFragment(fragment, i + 1));
        }

        FeedFormat format = detectFormat(text, names);
        if (results.isEmpty()) {
            log.warn("Malformed {} document holds no recognisable entries", format);
        }
        return new ParsedFeed(format, true, results);
    }

    private String cutFragment(String text, String name, int from, int tagEnd, int until) {
        if (text.charAt(tagEnd - 2) == '/') {
            return text.substring(from, tagEnd);
        }
        String segment = text.substring(from, until);
        int close = segment.lastIndexOf("</" + name);
        if (close < 0) {
            return null;
        }
        int closeEnd = segment.indexOf('>', close);
        return closeEnd < 0 ? null : segment.substring(0, closeEnd + 1);
    }

    private FeedFormat detectFormat(String text, List<String> entryNames) {
        if (Pattern.compile("<(?:[\\w.-]+:)?RDF[\\s>]").matcher(text).find()) {
            return FeedFormat.RDF;
        }
        boolean atom = entryNames.isEmpty()
                ? Pattern.compile("<(?:[\\w.-]+:)?feed[\\s>]").matcher(text).find()
                : localName(entryNames.get(0)).equalsIgnoreCase("entry");
        return atom ? FeedFormat.ATOM : FeedFormat.RSS;
    }

    private EntryResult parseFragment(String fragment, int position) {
        org.w3c.dom.Element element;
        try {
            element = newDocumentBuilder().parse(new InputSource(new StringReader(fragment))).getDocumentElement();
        } catch (SAXException | IOException | ParserConfigurationException e) {
            log.warn("Skipping malformed entry #{}: {}", position, e.getMessage());
            return EntryResult.skipped("malformed entry: " + e.getMessage());
        }
        EntryResult result = safely(() -> "entry".equalsIgnoreCase(localName(element.getNodeName()))
                ? mapAtomElement(element)
                : mapRssElement(element));
        if (!result.isParsed()) {
            log.warn("Skipping entry #{}: {}", position, result.skipReason());
        }
        return result;
    }

    private EntryResult mapRssElement(org.w3c.dom.Element item) {
        String id = FeedText.firstNonBlank(childText(item, "guid"), attribute(item, "rdf:about"));
        String descriptionHtml = FeedText.firstNonBlank(
                childText(item, "description"), childText(item, "summary"), childText(item, "encoded"));
        String contentHtml = FeedText.firstNonBlank(childText(item, "encoded"), childText(item, "content"));
        String dateText = FeedText.firstNonBlank(childText(item, "pubDate"), childText(item, "date"));

        String imageUrl = null;
        for (org.w3c.dom.Element child : children(item)) {
            String local = localName(child.getNodeName());
            if ("enclosure".equals(local)) {
                String type = child.getAttribute("type");
                if (type.startsWith("image/") || FeedText.looksLikeImage(child.getAttribute("url"))) {
                    imageUrl = child.getAttribute("url");
                    break;
                }
            } else if ("content".equals(local) || "thumbnail".equals(local)) {
                String url = child.getAttribute("url");
                if (!url.isBlank() && ("image".equals(child.getAttribute("medium"))
                        || child.getAttribute("type").startsWith("image/")
                        || "thumbnail".equals(local) || FeedText.looksLikeImage(url))) {
                    imageUrl = url;
                    break;
                }
            }
        }

        return build(id, childText(item, "title"), childText(item, "link"), descriptionHtml, contentHtml,
                parseDate(dateText), dateText, imageUrl);
    }

    private EntryResult mapAtomElement(org.w3c.dom.Element entry) {
        String alternate = null;
        String anyLink = null;
        String imageUrl = null;
        for (org.w3c.dom.Element child : children(entry)) {
            if (!"link".equals(localName(child.getNodeName()))) {
                continue;
            }
            String href = child.getAttribute("href").trim();
            String rel = child.getAttribute("rel");
            if (href.isEmpty()) {
                continue;
            }
            if ((rel.isEmpty() || "alternate".equals(rel)) && alternate == null) {
                alternate = href;
            } else if ("enclosure".equals(rel) && imageUrl == null
                    && (child.getAttribute("type").startsWith("image/") || FeedText.looksLikeImage(href))) {
                imageUrl = href;
            } else if (!"self".equals(rel) && anyLink == null) {
                anyLink = href;
            }
        }
        String summaryHtml = FeedText.firstNonBlank(childText(entry, "summary"), childText(entry, "content"));
        String contentHtml = childText(entry, "content");
        String dateText = FeedText.firstNonBlank(childText(entry, "published"), childText(entry, "updated"));

        return build(childText(entry, "id"), childText(entry, "title"), FeedText.firstNonBlank(alternate, anyLink),
                summaryHtml, contentHtml, parseDate(dateText), dateText, imageUrl);
    }

    // ---------------------------------------------------------------------
    // Shared field fallback chain
    // ---------------------------------------------------------------------

    /**
     * @param dateText raw date text, used for the id hash only when the date could not be parsed
     */
    private EntryResult build(String canonicalId, String rawTitle, String rawLink, String bodyHtml,
                              String contentHtml, Instant publishedAt, String dateText, String imageUrl) {
        String title = FeedText.toPlainText(rawTitle);
        String summary = FeedText.toPlainText(bodyHtml);

        String link = FeedText.firstNonBlank(rawLink);
        if (link.isEmpty()) {
            link = FeedText.firstNonBlank(FeedText.firstLink(bodyHtml), FeedText.firstLink(contentHtml));
        }
        if (title.isEmpty() && link.isEmpty() && summary.isEmpty()) {
            return EntryResult.skipped("entry has no title, link or summary");
        }

        if (FeedText.isBlank(imageUrl)) {
            imageUrl = FeedText.firstNonBlank(FeedText.firstImage(bodyHtml), FeedText.firstImage(contentHtml));
            if (imageUrl.isEmpty() && FeedText.looksLikeImage(link)) {
                imageUrl = link;
            }
        }

        String id = FeedText.firstNonBlank(canonicalId);
        if (id.isEmpty()) {
            String dateKey = publishedAt != null ? publishedAt.toString() : FeedText.firstNonBlank(dateText);
            if (!title.isEmpty() || !dateKey.isEmpty()) {
                id = "sha256:" + DigestUtils.sha256Hex(title + "|" + dateKey);
            } else if (!link.isEmpty()) {
                id = link;
            } else {
                id = "sha256:" + DigestUtils.sha256Hex(summary);
            }
        }

        return EntryResult.parsed(new Item(id, title, link.isEmpty() ? null : link, summary, publishedAt,
                FeedText.isBlank(imageUrl) ? null : imageUrl.trim(), null));
    }

    private EntryResult safely(EntryMapper mapper) {
        try {
            return mapper.map();
        } catch (RuntimeException e) {
            log.warn("Skipping entry that could not be mapped: {}", e.getMessage());
            return EntryResult.skipped("unmappable entry: " + e.getMessage());
        }
    }

    @FunctionalInterface
    private interface EntryMapper {
        EntryResult map();
    }

    // ---------------------------------------------------------------------
    // DOM helpers
    // ---------------------------------------------------------------------

    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setExpandEntityReferences(false);
        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(STRICT_ERRORS);
        return builder;
    }

    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private static List<org.w3c.dom.Element> children(org.w3c.dom.Element parent) {
        List<org.w3c.dom.Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                elements.add((org.w3c.dom.Element) nodes.item(i));
            }
        }
        return elements;
    }

    /** Text of the first direct child with the given local name that has any text. */
    private static String childText(org.w3c.dom.Element parent, String localName) {
        for (org.w3c.dom.Element child : children(parent)) {
            if (localName.equals(localName(child.getNodeName()))) {
                String text = child.getTextContent();
                if (!FeedText.isBlank(text)) {
                    return text.trim();
                }
            }
        }
        return null;
    }

    private static String attribute(org.w3c.dom.Element element, String name) {
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    private static String localName(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }

    private static Instant parseDate(String text) {
        if (FeedText.isBlank(text)) {
            return null;
        }
        return toInstant(DateParser.parseDate(text.trim(), Locale.US));
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
