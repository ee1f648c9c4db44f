package com.tallyInsight.reportChat.report.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads export files from the classpath.
 */
public class ExportFileLoader {

    private static final Logger log = LoggerFactory.getLogger(ExportFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ExportFileLoader() {}

    /**
     * @param resourcePath Classpath location, e.g. "data/balanceSheet.json"
     * @return File content
     * @throws IOException if the resource is missing or unreadable
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = ExportFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static JsonNode loadAsJsonNode(String resourcePath) throws IOException {
        return objectMapper.readTree(loadAsString(resourcePath));
    }

    /**
     * Like {@link #loadAsJsonNode(String)} but logs and returns null on failure.
     */
    public static JsonNode loadAsJsonNodeOrNull(String resourcePath) {
        try {
            return loadAsJsonNode(resourcePath);
        } catch (IOException e) {
            log.warn("Failed to load export file from classpath: {}", resourcePath, e);
            return null;
        }
    }
}
