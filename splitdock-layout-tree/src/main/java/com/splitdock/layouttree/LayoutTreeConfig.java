package com.splitdock.layouttree;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitdock.layouttree.document.LayoutDocument;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of layout documents.
 * JSON excludes null values when serializing; unknown properties are ignored when reading.
 * Documents may nest up to {@value #MAX_NESTING_DEPTH} JSON levels (the document object plus one level per
 * tree level); deeper input or output fails.
 */
public final class LayoutTreeConfig {

    /** Maximum JSON nesting depth read or written. */
    public static final int MAX_NESTING_DEPTH = 2000;

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
            .build();

    private static final ObjectMapper MAPPER = new ObjectMapper(JSON_FACTORY)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private LayoutTreeConfig() {
    }

    /**
     * Deserializes a layout document from a JSON string.
     *
     * @param json the JSON string (e.g. from the layout file)
     * @return the parsed {@link LayoutDocument}
     * @throws UncheckedIOException   on malformed JSON or attribute values of the wrong shape
     * @throws LayoutFormatException  when the JSON root is not an object or {@code version} is not a string
     */
    public static LayoutDocument fromJson(String json) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (tree == null || !tree.isObject()) {
            throw new LayoutFormatException("Layout JSON root is not an object");
        }
        JsonNode version = tree.get("version");
        if (version != null && !version.isNull() && !version.isTextual()) {
            throw new LayoutFormatException("Layout version must be a string, got " + version.getNodeType());
        }
        try {
            return MAPPER.treeToValue(tree, LayoutDocument.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes the layout document to a compact JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(LayoutDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Serializes the layout document to a pretty-printed JSON string (nulls excluded). This is the
     * form written to layout files.
     */
    public static String toJsonPretty(LayoutDocument document) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
