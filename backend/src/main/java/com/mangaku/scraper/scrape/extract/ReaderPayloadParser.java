package com.mangaku.scraper.scrape.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the mirror descriptors out of the {@code ts_reader.run({...});} call embedded in
 * reader pages. Anything unexpected yields no sources rather than an error.
 */
@Component
public class ReaderPayloadParser {
    private static final Logger log = LoggerFactory.getLogger(ReaderPayloadParser.class);
    private static final Pattern READER_CALL = Pattern.compile("ts_reader\\.run\\((\\{.*?\\})\\);", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ReaderPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<JsonNode> parseSources(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Matcher matcher = READER_CALL.matcher(html);
        if (!matcher.find()) {
            log.debug("Reader payload anchor not found");
            return List.of();
        }
        String payload = matcher.group(1).replace("\\/", "/");
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Reader payload is not valid JSON: {}", e.getOriginalMessage());
            return List.of();
        }
        JsonNode sources = root.path("sources");
        if (!sources.isArray()) {
            log.warn("Reader payload has no sources array");
            return List.of();
        }
        List<JsonNode> descriptors = new ArrayList<>();
        sources.forEach(descriptors::add);
        return descriptors;
    }
}
