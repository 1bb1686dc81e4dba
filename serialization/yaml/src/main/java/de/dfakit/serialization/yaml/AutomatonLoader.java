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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.CharStreams;
import de.dfakit.api.Automaton;
import de.dfakit.api.LoadResult;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Loads automata from their YAML specification:
 * <pre>
 * alphabet: ['0', '1']
 * states: [q0, q1]
 * initial_state: q0
 * accepting_states: [q1]
 * transitions:
 *   q0: {'0': q0, '1': q1}
 *   q1: {'0': q0, '1': q1}
 * </pre>
 * Every scalar is read as the text it is written as: {@code 01} stays {@code "01"} and {@code true} stays
 * {@code "true"}, whether it appears as a key, a value or a list entry.
 * <p>
 * Validation runs in two tiers. The shape check verifies that all fields are present and have the expected types;
 * if it fails, only its errors are reported. Otherwise the semantic check collects every unresolved reference and,
 * if all references resolve, every missing transition.
 * <p>
 * Loading is deterministic: the same text always yields the same errors in the same order. Instances are stateless
 * and may be shared.
 */
public class AutomatonLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Loads an automaton from its specification text.
     *
     * @param text
     *         the YAML specification
     *
     * @return the loaded automaton or the list of errors
     */
    public LoadResult load(String text) {
        @Nullable Object document;
        try {
            document = newYaml().load(text);
        } catch (YAMLException e) {
            LOGGER.debug("Rejecting unparsable specification", e);
            return LoadResult.failure(Collections.singletonList(
                    "YAML parsing error: " + e.getMessage().replace('\n', ' ')));
        }
        @Nullable JsonNode root = document == null ? null : MAPPER.valueToTree(document);

        ShapeValidator shape = new ShapeValidator();
        RawSpecification spec = shape.validate(root);
        if (spec == null) {
            LOGGER.debug("Specification has {} shape error(s)", shape.getErrors().size());
            return LoadResult.failure(shape.getErrors());
        }

        SemanticValidator semantic = new SemanticValidator();
        Automaton automaton = semantic.validate(spec);
        if (automaton == null) {
            LOGGER.debug("Specification has {} semantic error(s)", semantic.getErrors().size());
            return LoadResult.failure(semantic.getErrors());
        }

        LOGGER.debug("Loaded automaton with {} states over {}", automaton.size(), automaton.getAlphabet());
        return LoadResult.success(automaton);
    }

    /**
     * Loads an automaton from a UTF-8 encoded stream. The stream is read completely but not closed.
     *
     * @throws IOException
     *         if reading from the stream fails
     */
    public LoadResult load(InputStream in) throws IOException {
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        return load(CharStreams.toString(reader));
    }

    // Yaml instances are not thread-safe
    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        return new Yaml(new SafeConstructor(options),
                        new Representer(new DumperOptions()),
                        new DumperOptions(),
                        options,
                        new PlainScalarResolver());
    }

    /**
     * Resolves every untagged scalar to a string. Without implicit resolvers, numbers, booleans and nulls are never
     * recognized.
     */
    private static final class PlainScalarResolver extends Resolver {

        @Override
        protected void addImplicitResolvers() {
            // none
        }
    }
}
