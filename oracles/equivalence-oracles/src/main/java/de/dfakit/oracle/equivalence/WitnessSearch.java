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
package de.dfakit.oracle.equivalence;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Map;

import com.google.common.base.Preconditions;
import de.dfakit.api.Automaton;
import de.dfakit.api.State;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Breadth-first search for words that lead an {@link Automaton} into an accepting (or rejecting) state.
 * <p>
 * Successors are explored in the order of each state's transition map, i.e. the order in which the transitions were
 * declared. The returned word is therefore of minimal length, but among words of equal length it is not necessarily
 * the lexicographically smallest.
 */
public final class WitnessSearch {

    private WitnessSearch() {
        // prevent instantiation
    }

    /**
     * Searches for a word accepted by the given automaton.
     *
     * @see #findExample(Automaton, boolean)
     */
    public static @Nullable Word<Character> findExample(Automaton automaton) {
        return findExample(automaton, true);
    }

    /**
     * Searches for a word that leads the given automaton into a state whose acceptance equals {@code accepting}.
     *
     * @param automaton
     *         the automaton to search
     * @param accepting
     *         whether an accepted ({@code true}) or a rejected ({@code false}) word is requested
     *
     * @return a shortest such word, or {@code null} if no reachable state has the requested acceptance
     */
    public static @Nullable Word<Character> findExample(Automaton automaton, boolean accepting) {
        Preconditions.checkNotNull(automaton, "Automaton not loaded. Load it successfully first.");

        final BitSet visited = new BitSet(automaton.size());
        final Deque<Pair<Integer, Word<Character>>> queue = new ArrayDeque<>();
        queue.add(Pair.of(automaton.getInitialStateIndex(), Word.<Character>epsilon()));

        while (!queue.isEmpty()) {
            final Pair<Integer, Word<Character>> item = queue.poll();
            final int stateIndex = item.getFirst();
            if (visited.get(stateIndex)) {
                continue;
            }
            visited.set(stateIndex);

            final State state = automaton.getState(stateIndex);
            if (state.isAccepting() == accepting) {
                return item.getSecond();
            }

            for (Map.Entry<Character, Integer> transition : state.getTransitions().entrySet()) {
                if (!visited.get(transition.getValue())) {
                    queue.add(Pair.of(transition.getValue(), item.getSecond().append(transition.getKey())));
                }
            }
        }

        return null;
    }

    /**
     * Like {@link #findExample(Automaton, boolean)}, but returns the word as a string of its symbols.
     */
    public static @Nullable String findExampleString(Automaton automaton, boolean accepting) {
        Word<Character> word = findExample(automaton, accepting);
        return word == null ? null : asString(word);
    }

    /**
     * Concatenates the symbols of a word.
     */
    public static String asString(Word<Character> word) {
        StringBuilder sb = new StringBuilder(word.length());
        for (Character symbol : word) {
            sb.append(symbol.charValue());
        }
        return sb.toString();
    }
}
