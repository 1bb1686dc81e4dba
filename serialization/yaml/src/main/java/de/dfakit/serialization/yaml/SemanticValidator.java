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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import de.dfakit.api.Automaton;
import de.dfakit.api.State;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks the references of a well-shaped specification and wires the {@link Automaton}. Unlike the shape check, all
 * violations are collected. Errors appear in the order of the specification's fields and, within a field, in
 * document order.
 */
final class SemanticValidator {

    private final List<String> errors = new ArrayList<>();

    /**
     * Validates the specification.
     *
     * @return the automaton, or {@code null} if any violation was found
     */
    @Nullable Automaton validate(RawSpecification spec) {
        List<Character> symbols = checkAlphabet(spec.alphabet);

        // first occurrence wins, duplicates are reported
        Map<String, Integer> stateIndices = new LinkedHashMap<>();
        for (String name : spec.states) {
            if (stateIndices.containsKey(name)) {
                errors.add("State '" + name + "' is declared more than once.");
            } else {
                stateIndices.put(name, stateIndices.size());
            }
        }

        if (!stateIndices.containsKey(spec.initialState)) {
            errors.add("Initial state '" + spec.initialState + "' not in states.");
        }

        Set<String> accepting = new HashSet<>();
        for (String name : spec.acceptingStates) {
            if (stateIndices.containsKey(name)) {
                accepting.add(name);
            } else {
                errors.add("Accepting state '" + name + "' not in states.");
            }
        }

        Map<String, Map<Character, Integer>> transitions = new LinkedHashMap<>();
        for (Entry<String, Map<String, String>> source : spec.transitions.entrySet()) {
            String name = source.getKey();
            if (!stateIndices.containsKey(name)) {
                errors.add("State '" + name + "' in transition function not in states.");
                continue;
            }
            Map<Character, Integer> row = transitions.computeIfAbsent(name, k -> new LinkedHashMap<>());

            for (Entry<String, String> edge : source.getValue().entrySet()) {
                String symbol = edge.getKey();
                String dest = edge.getValue();
                if (!spec.alphabet.contains(symbol)) {
                    errors.add("Symbol '" + symbol + "' in transition function of state '" + name +
                               "' not in alphabet.");
                    continue;
                }
                if (!stateIndices.containsKey(dest)) {
                    errors.add("State '" + dest + "' in transition function not in states.");
                    continue;
                }
                if (symbol.length() == 1) {
                    row.put(symbol.charAt(0), stateIndices.get(dest));
                }
            }
        }

        // totality is only meaningful once every reference resolved
        if (errors.isEmpty()) {
            for (String name : stateIndices.keySet()) {
                Map<Character, Integer> row = transitions.getOrDefault(name, Collections.emptyMap());
                for (Character symbol : symbols) {
                    if (!row.containsKey(symbol)) {
                        errors.add("State '" + name + "' missing transition for symbol '" + symbol + "'.");
                    }
                }
            }
        }

        if (!errors.isEmpty()) {
            return null;
        }

        Alphabet<Character> alphabet = Alphabets.fromList(symbols);
        List<State> states = new ArrayList<>(stateIndices.size());
        for (String name : stateIndices.keySet()) {
            states.add(new State(name,
                                 accepting.contains(name),
                                 transitions.getOrDefault(name, Collections.emptyMap())));
        }

        return new Automaton(alphabet, states, stateIndices.get(spec.initialState));
    }

    List<String> getErrors() {
        return errors;
    }

    private List<Character> checkAlphabet(List<String> declared) {
        List<Character> symbols = new ArrayList<>(declared.size());
        for (String symbol : declared) {
            if (symbol.length() != 1) {
                errors.add("Symbol '" + symbol + "' is not a single character.");
            } else if (symbols.contains(symbol.charAt(0))) {
                errors.add("Symbol '" + symbol + "' is declared more than once.");
            } else {
                symbols.add(symbol.charAt(0));
            }
        }
        return symbols;
    }
}
