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
package de.dfakit.algorithm.algebra;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import de.dfakit.api.Automaton;
import de.dfakit.api.State;
import de.dfakit.exception.AlphabetMismatchException;
import net.automatalib.words.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boolean operations on the languages of {@link Automaton}s.
 * <p>
 * Every operation builds a fresh automaton and leaves its operands untouched. Results are not minimized: the union
 * of automata with {@code n} and {@code m} states has {@code n * m} states, intersection and symmetric difference are
 * composed of complement and union and grow accordingly (the symmetric difference of two {@code n}-state automata
 * has {@code n^4} states). Use the minimization module to determine the size of the canonical automaton.
 * <p>
 * Binary operations require both operands to be defined over the same set of symbols; the order in which the
 * symbols were declared may differ.
 */
public final class DFAOperations {

    private static final Logger LOGGER = LoggerFactory.getLogger(DFAOperations.class);

    private static final String NOT_LOADED = "Automaton not loaded. Load it successfully first.";

    private DFAOperations() {
        // prevent instantiation
    }

    /**
     * Computes an automaton for the complement of the language of the given automaton. The result has the same
     * states (by name and index) and transitions, with every accepting flag flipped.
     */
    public static Automaton complement(Automaton automaton) {
        Preconditions.checkNotNull(automaton, NOT_LOADED);

        List<State> states = new ArrayList<>(automaton.size());
        for (State state : automaton.getStates()) {
            states.add(new State(state.getName(), !state.isAccepting(), state.getTransitions()));
        }

        return new Automaton(automaton.getAlphabet(), states, automaton.getInitialStateIndex());
    }

    /**
     * Computes an automaton for the union of the languages of the given automata, using the product construction.
     * The product state of {@code p} and {@code q} is named {@code p_q} and accepts if {@code p} or {@code q}
     * accepts.
     *
     * @throws AlphabetMismatchException
     *         if the automata are defined over different alphabets
     */
    public static Automaton union(Automaton first, Automaton second) {
        checkOperands(first, second);

        final Alphabet<Character> alphabet = first.getAlphabet();
        final int n = first.size();
        final int m = second.size();

        List<String> names = productNames(first, second);
        List<State> states = new ArrayList<>(n * m);
        for (int p = 0; p < n; p++) {
            State left = first.getState(p);
            for (int q = 0; q < m; q++) {
                State right = second.getState(q);

                Map<Character, Integer> transitions = new LinkedHashMap<>();
                for (Character symbol : alphabet) {
                    int pSucc = first.getSuccessor(p, symbol);
                    int qSucc = second.getSuccessor(q, symbol);
                    transitions.put(symbol, pSucc * m + qSucc);
                }

                states.add(new State(names.get(p * m + q), left.isAccepting() || right.isAccepting(), transitions));
            }
        }

        int initial = first.getInitialStateIndex() * m + second.getInitialStateIndex();
        Automaton result = new Automaton(alphabet, states, initial);
        LOGGER.debug("Union of automata with {} and {} states has {} states", n, m, result.size());
        return result;
    }

    /**
     * Computes an automaton for the intersection of the languages of the given automata as the complement of the
     * union of the complements (De Morgan).
     *
     * @throws AlphabetMismatchException
     *         if the automata are defined over different alphabets
     */
    public static Automaton intersect(Automaton first, Automaton second) {
        checkOperands(first, second);
        return complement(union(complement(first), complement(second)));
    }

    /**
     * Computes an automaton for the symmetric difference of the languages of the given automata: the words accepted
     * by exactly one of them. It is built as the intersection of the union with the complement of the intersection.
     * The language is empty if and only if both automata accept the same language.
     *
     * @throws AlphabetMismatchException
     *         if the automata are defined over different alphabets
     */
    public static Automaton symmetricDifference(Automaton first, Automaton second) {
        checkOperands(first, second);
        Automaton result = intersect(union(first, second), complement(intersect(first, second)));
        LOGGER.debug("Symmetric difference of automata with {} and {} states has {} states",
                     first.size(),
                     second.size(),
                     result.size());
        return result;
    }

    private static void checkOperands(Automaton first, Automaton second) {
        Preconditions.checkNotNull(first, NOT_LOADED);
        Preconditions.checkNotNull(second, NOT_LOADED);
        if (!first.hasSameAlphabet(second)) {
            throw new AlphabetMismatchException(first.getAlphabet(), second.getAlphabet());
        }
    }

    // product names are p_q; a name that is already taken gets primes appended until it is unique
    private static List<String> productNames(Automaton first, Automaton second) {
        final int n = first.size();
        final int m = second.size();

        List<String> names = new ArrayList<>(n * m);
        Set<String> used = new HashSet<>();
        for (State left : first.getStates()) {
            for (State right : second.getStates()) {
                String name = left.getName() + '_' + right.getName();
                while (!used.add(name)) {
                    name = name + '\'';
                }
                names.add(name);
            }
        }
        return names;
    }
}
