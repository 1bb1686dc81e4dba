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
package de.dfakit.examples;

import de.dfakit.api.Automaton;
import de.dfakit.serialization.yaml.AutomatonLoader;

/**
 * Specifications of small automata over {@code {0, 1}} that are used throughout the tests.
 */
public final class ExampleAutomata {

    /**
     * All strings ending in {@code 1}. Minimal, two states.
     */
    public static final String ENDS_IN_ONE = String.join("\n",
            "alphabet: ['0', '1']",
            "states: [q0, q1]",
            "initial_state: q0",
            "accepting_states: [q1]",
            "transitions:",
            "  q0: {'0': q0, '1': q1}",
            "  q1: {'0': q0, '1': q1}");

    /**
     * All strings containing the substring {@code 11}. The accepting sink is split into two equivalent states, so
     * the minimal automaton has three states instead of four.
     */
    public static final String CONTAINS_ONE_ONE = String.join("\n",
            "alphabet: ['0', '1']",
            "states: [p0, p1, p2, p3]",
            "initial_state: p0",
            "accepting_states: [p2, p3]",
            "transitions:",
            "  p0: {'0': p0, '1': p1}",
            "  p1: {'0': p0, '1': p2}",
            "  p2: {'0': p3, '1': p2}",
            "  p3: {'0': p2, '1': p3}");

    /**
     * Strings with an even number of {@code 0}s, written with the symbols declared in reverse order.
     */
    public static final String EVEN_ZEROS = String.join("\n",
            "alphabet: ['1', '0']",
            "states: [even, odd]",
            "initial_state: even",
            "accepting_states: [even]",
            "transitions:",
            "  even: {'1': even, '0': odd}",
            "  odd: {'1': odd, '0': even}");

    /**
     * The same language as {@link #ENDS_IN_ONE}, with a redundant copy of the accepting state.
     */
    public static final String ENDS_IN_ONE_REDUNDANT = String.join("\n",
            "alphabet: ['0', '1']",
            "states: [a, b, c]",
            "initial_state: a",
            "accepting_states: [b, c]",
            "transitions:",
            "  a: {'0': a, '1': b}",
            "  b: {'0': a, '1': c}",
            "  c: {'0': a, '1': b}");

    /**
     * {@link #ENDS_IN_ONE} with the accepting flags of both states swapped: all strings that are empty or end in
     * {@code 0}.
     */
    public static final String ENDS_IN_ONE_SWAPPED = String.join("\n",
            "alphabet: ['0', '1']",
            "states: [q0, q1]",
            "initial_state: q0",
            "accepting_states: [q0]",
            "transitions:",
            "  q0: {'0': q0, '1': q1}",
            "  q1: {'0': q0, '1': q1}");

    /**
     * The empty language over {@code {0, 1}}.
     */
    public static final String EMPTY_LANGUAGE = String.join("\n",
            "alphabet: ['0', '1']",
            "states: [sink]",
            "initial_state: sink",
            "accepting_states: []",
            "transitions:",
            "  sink: {'0': sink, '1': sink}");

    /**
     * All strings over {@code {a, b, c}}; used to provoke alphabet mismatches.
     */
    public static final String UNIVERSAL_ABC = String.join("\n",
            "alphabet: [a, b, c]",
            "states: [all]",
            "initial_state: all",
            "accepting_states: [all]",
            "transitions:",
            "  all: {a: all, b: all, c: all}");

    private static final AutomatonLoader LOADER = new AutomatonLoader();

    private ExampleAutomata() {
        // prevent instantiation
    }

    /**
     * Loads a specification that is known to be valid.
     *
     * @throws IllegalStateException
     *         if the specification does not load
     */
    public static Automaton load(String specification) {
        return LOADER.load(specification).getAutomaton();
    }

    public static Automaton endsInOne() {
        return load(ENDS_IN_ONE);
    }

    public static Automaton containsOneOne() {
        return load(CONTAINS_ONE_ONE);
    }

    public static Automaton evenZeros() {
        return load(EVEN_ZEROS);
    }
}
