/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the JSON index list, e.g. {@code [{"name":"by_email","fields":"email"}]}.
 *
 * <p>Shape rules: the list must be an array of objects, each with {@code name} and {@code fields};
 * {@code fields} is a string (normalized to a one-element list) or an array of strings.
 * Errors name the offending position, e.g. {@code cache.indexes[2].fields}.</p>
 */
public final class IndexDefinitions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IndexDefinitions() {}

    public static List<IndexDefinition> parse(String json, String path) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CacheConfigurationException(path, "Index list is not valid JSON", e);
        }
        return parse(root, path);
    }

    public static List<IndexDefinition> parse(JsonNode root, String path) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        if (!root.isArray()) {
            throw new CacheConfigurationException(path, "Cache config indexes must be object[]");
        }

        List<IndexDefinition> out = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            String at = path + "[" + i + "]";
            JsonNode node = root.get(i);
            if (!node.isObject()) {
                throw new CacheConfigurationException(at, "Cache config indexes must be object");
            }

            List<String> missing = new ArrayList<>(2);
            if (!node.hasNonNull("fields")) missing.add("fields");
            if (!node.hasNonNull("name")) missing.add("name");
            if (!missing.isEmpty()) {
                throw new CacheConfigurationException(at, "Missing " + missing);
            }

            JsonNode name = node.get("name");
            if (!name.isTextual() || name.asText().isBlank()) {
                throw new CacheConfigurationException(at + ".name", "Cache config index name must be a non-empty string");
            }

            out.add(new IndexDefinition(name.asText(), parseFields(node.get("fields"), at + ".fields")));
        }
        return out;
    }

    private static List<String> parseFields(JsonNode fields, String at) {
        if (fields.isTextual()) {
            if (fields.asText().isBlank()) {
                throw new CacheConfigurationException(at, "Cache config index fields must be str | str[]");
            }
            return List.of(fields.asText());
        }
        if (!fields.isArray() || fields.isEmpty()) {
            throw new CacheConfigurationException(at, "Cache config index fields must be str | str[]");
        }
        List<String> out = new ArrayList<>(fields.size());
        for (JsonNode f : fields) {
            if (!f.isTextual() || f.asText().isBlank()) {
                throw new CacheConfigurationException(at, "Cache config index fields must be str | str[]");
            }
            out.add(f.asText());
        }
        return out;
    }
}
