package com.websubrelay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the Atom documents the hub pushes. Namespace prefixes are dropped by
 * the XML tree model, so {@code yt:videoId} is read as {@code videoId}.
 */
@Component
public class FeedParser {

    private final XmlMapper xmlMapper;

    public FeedParser() {
        XMLInputFactory inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        this.xmlMapper = new XmlMapper(new XmlFactory(inputFactory));
    }

    public List<FeedEntry> parse(String xml) throws FeedParseException {
        JsonNode feed;
        try {
            feed = xmlMapper.readTree(xml);
        } catch (IOException e) {
            throw new FeedParseException("Malformed feed document: " + e.getMessage(), e);
        }
        if (feed == null || !feed.isObject()) {
            // e.g. <feed/>: a well-formed document without entries
            return List.of();
        }

        JsonNode entryNode = feed.path("entry");
        List<JsonNode> entries = new ArrayList<>();
        if (entryNode.isArray()) {
            entryNode.forEach(entries::add);
        } else if (entryNode.isObject()) {
            entries.add(entryNode);
        }

        List<FeedEntry> result = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            result.add(new FeedEntry(
                    itemId(entry),
                    sourceId(entry),
                    text(entry.path("title")),
                    text(entry.path("published")),
                    text(entry.path("updated"))));
        }
        return result;
    }

    private String itemId(JsonNode entry) {
        String videoId = text(entry.path("videoId"));
        if (videoId != null) {
            return videoId;
        }
        // yt:video:<id>
        return lastSegment(text(entry.path("id")), ':');
    }

    private String sourceId(JsonNode entry) {
        String channelId = text(entry.path("channelId"));
        if (channelId != null) {
            return channelId;
        }
        // https://www.youtube.com/channel/<id>
        return lastSegment(text(entry.path("author").path("uri")), '/');
    }

    /**
     * Text content of an element; elements that also carry attributes are
     * mapped to an object whose text sits under the empty key.
     */
    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return node.isEmpty() ? null : text(node.get(0));
        }
        String value = node.isObject() ? node.path("").asText(null) : node.asText(null);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static String lastSegment(String value, char separator) {
        if (value == null) {
            return null;
        }
        String segment = value.substring(value.lastIndexOf(separator) + 1).trim();
        return segment.isEmpty() ? null : segment;
    }
}
