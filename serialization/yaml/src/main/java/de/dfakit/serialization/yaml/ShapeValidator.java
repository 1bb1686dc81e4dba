/* Copyright (C) 2023 The DFAKit Authors
 * This file is part of DFAKit.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dfakit.serialization.yaml;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.databind.JsonNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks that a parsed document has the five specification fields with the expected nested types. Each violation
 * is reported once, tagged with the path of the offending field, e.g. {@code Field 'transitions -> q0 -> 1': Input
 * should be a valid string}.
 * <p>
 * Scalars of any YAML type are accepted as strings, so {@code [0, 1]} and {@code ["0", "1"]} describe the same
 * alphabet.
 */
final class ShapeValidator {

    static final String ALPHABET = "alphabet";
    static final String STATES = "states";
    static final String INITIAL_STATE = "initial_state";
    static final String ACCEPTING_STATES = "accepting_states";
    static final String TRANSITIONS = "transitions";

    static final String ROOT = "<root>";

    private static final String FIELD_REQUIRED = "Field required";
    private static final String NOT_A_LIST = "Input should be a valid list";
    private static final String NOT_A_STRING = "Input should be a valid string";
    private static final String NOT_A_DICTIONARY = "Input should be a valid dictionary";

    private final List<String> errors = new ArrayList<>();

    /**
     * Validates the document.
     *
     * @param root
     *         the document root, {@code null} for an empty document
     *
     * @return the extracted fields, or {@code null} if any shape violation was found; the violations are then
     *         available via {@link #getErrors()}
     */
    @Nullable RawSpecification validate(@Nullable JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            // an empty document misses every field
            for (String field : new String[] {ALPHABET, STATES, INITIAL_STATE, ACCEPTING_STATES, TRANSITIONS}) {
                report(field, FIELD_REQUIRED);
            }
            return null;
        }
        if (!root.isObject()) {
            report(ROOT, NOT_A_DICTIONARY);
            return null;
        }

        List<String> alphabet = stringList(root, ALPHABET);
        List<String> states = stringList(root, STATES);
        String initialState = string(root, INITIAL_STATE);
        List<String> acceptingStates = stringList(root, ACCEPTING_STATES);
        Map<String, Map<String, String>> transitions = transitions(root);

        if (!errors.isEmpty()) {
            return null;
        }

        return new RawSpecification(alphabet, states, initialState, acceptingStates, transitions);
    }

    List<String> getErrors() {
        return errors;
    }

    private @Nullable List<String> stringList(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null) {
            report(field, FIELD_REQUIRED);
            return null;
        }
        if (!node.isArray()) {
            report(field, NOT_A_LIST);
            return null;
        }

        List<String> result = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (isScalar(item)) {
                result.add(item.asText());
            } else {
                report(field + " -> " + i, NOT_A_STRING);
            }
        }
        return result;
    }

    private @Nullable String string(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null) {
            report(field, FIELD_REQUIRED);
            return null;
        }
        if (!isScalar(node)) {
            report(field, NOT_A_STRING);
            return null;
        }
        return node.asText();
    }

    private @Nullable Map<String, Map<String, String>> transitions(JsonNode root) {
        JsonNode node = root.get(TRANSITIONS);
        if (node == null) {
            report(TRANSITIONS, FIELD_REQUIRED);
            return null;
        }
        if (!node.isObject()) {
            report(TRANSITIONS, NOT_A_DICTIONARY);
            return null;
        }

        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        Iterator<Entry<String, JsonNode>> sources = node.fields();
        while (sources.hasNext()) {
            Entry<String, JsonNode> source = sources.next();
            String sourcePath = TRANSITIONS + " -> " + source.getKey();

            if (!source.getValue().isObject()) {
                report(sourcePath, NOT_A_DICTIONARY);
                continue;
            }

            Map<String, String> row = new LinkedHashMap<>();
            Iterator<Entry<String, JsonNode>> edges = source.getValue().fields();
            while (edges.hasNext()) {
                Entry<String, JsonNode> edge = edges.next();
                if (isScalar(edge.getValue())) {
                    row.put(edge.getKey(), edge.getValue().asText());
                } else {
                    report(sourcePath + " -> " + edge.getKey(), NOT_A_STRING);
                }
            }
            result.put(source.getKey(), row);
        }
        return result;
    }

    private static boolean isScalar(JsonNode node) {
        return node.isValueNode() && !node.isNull();
    }

    private void report(String path, String message) {
        errors.add("Field '" + path + "': " + message);
    }
}
