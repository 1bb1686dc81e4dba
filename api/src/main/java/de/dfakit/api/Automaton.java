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
package de.dfakit.api;

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.automatalib.words.Alphabet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A complete deterministic finite automaton over single-character symbols.
 * <p>
 * The automaton owns an indexed list of {@link State}s; transitions are stored as indices into this list. Instances
 * are immutable: loading and all operations on automata build fresh instances and never modify existing ones.
 * Consequently, instances may be shared freely between threads.
 */
public final class Automaton {

    private final Alphabet<Character> alphabet;
    private final ImmutableList<State> states;
    private final ImmutableMap<String, Integer> stateIndices;
    private final int initialState;

    /**
     * Constructor.
     *
     * @param alphabet
     *         the input alphabet
     * @param states
     *         the states of the automaton, each with exactly one transition per alphabet symbol
     * @param initialState
     *         the index of the initial state in {@code states}
     *
     * @throws IllegalArgumentException
     *         if the states do not form a complete automaton over {@code alphabet} or if state names are not unique
     */
    public Automaton(Alphabet<Character> alphabet, List<State> states, int initialState) {
        Preconditions.checkElementIndex(initialState, states.size(), "initial state");

        final ImmutableMap.Builder<String, Integer> indices = ImmutableMap.builderWithExpectedSize(states.size());
        for (int i = 0; i < states.size(); i++) {
            State state = states.get(i);
            Map<Character, Integer> transitions = state.getTransitions();

            Preconditions.checkArgument(transitions.size() == alphabet.size() && alphabet.containsAll(transitions.keySet()),
                                        "State '%s' does not have exactly one transition per symbol of %s",
                                        state.getName(),
                                        alphabet);
            for (Integer succ : transitions.values()) {
                Preconditions.checkElementIndex(succ, states.size(), "successor of state " + state.getName());
            }
            indices.put(state.getName(), i);
        }

        this.alphabet = alphabet;
        this.states = ImmutableList.copyOf(states);
        // fails on duplicate names
        this.stateIndices = indices.build();
        this.initialState = initialState;
    }

    public Alphabet<Character> getAlphabet() {
        return alphabet;
    }

    public ImmutableList<State> getStates() {
        return states;
    }

    public State getState(int index) {
        return states.get(index);
    }

    /**
     * Looks up a state by its name.
     *
     * @param name
     *         the state name
     *
     * @return the index of the state, or {@code -1} if no state carries this name
     */
    public int getStateIndex(String name) {
        Integer idx = stateIndices.get(name);
        return idx == null ? -1 : idx;
    }

    public int getInitialStateIndex() {
        return initialState;
    }

    public State getInitialState() {
        return states.get(initialState);
    }

    public int size() {
        return states.size();
    }

    /**
     * Returns the index of the state reached from state {@code stateIndex} by reading {@code symbol}.
     *
     * @throws IllegalArgumentException
     *         if {@code symbol} is not part of the alphabet
     */
    public int getSuccessor(int stateIndex, char symbol) {
        Integer succ = states.get(stateIndex).getSuccessor(symbol);
        Preconditions.checkArgument(succ != null, "Symbol '%s' not in alphabet.", symbol);
        return succ;
    }

    /**
     * Runs the given input on this automaton. Evaluation stops at the first character that is not part of the
     * alphabet, in which case the result carries a single error naming that character.
     *
     * @param input
     *         the input string, one symbol per character
     *
     * @return the acceptance result
     */
    public AcceptanceResult accepts(String input) {
        int current = initialState;

        int i = 0;
        while (i < input.length()) {
            int codePoint = input.codePointAt(i);
            // symbols are single UTF-16 chars, so a supplementary code point is never one
            if (Character.isSupplementaryCodePoint(codePoint) || !alphabet.contains((char) codePoint)) {
                return AcceptanceResult.failure("Symbol '" + new String(Character.toChars(codePoint)) +
                                                "' not in alphabet.");
            }
            current = getSuccessor(current, (char) codePoint);
            i += Character.charCount(codePoint);
        }

        return AcceptanceResult.of(states.get(current).isAccepting());
    }

    /**
     * Checks whether this automaton and the given one are defined over the same set of symbols. The order in which
     * the symbols were declared does not matter.
     */
    public boolean hasSameAlphabet(Automaton other) {
        return alphabet.size() == other.alphabet.size() && alphabet.containsAll(other.alphabet);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton that = (Automaton) o;
        return initialState == that.initialState && states.equals(that.states) &&
               ImmutableList.copyOf(alphabet).equals(ImmutableList.copyOf(that.alphabet));
    }

    @Override
    public int hashCode() {
        return 31 * states.hashCode() + initialState;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("alphabet", alphabet)
                          .add("initial", getInitialState().getName())
                          .add("states", states.size())
                          .toString();
    }
}
