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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import de.dfakit.api.Automaton;
import de.dfakit.api.State;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.random.RandomAutomata;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;

/**
 * Converts between {@link Automaton}s and AutomataLib's {@link CompactDFA}s, so that tests can check results against
 * AutomataLib's own implementations of the same operations.
 */
public final class AutomataLibAdapter {

    private AutomataLibAdapter() {
        // prevent instantiation
    }

    /**
     * Renders an AutomataLib DFA as a YAML specification. State {@code i} of the DFA's state collection is named
     * {@code s<i>}.
     */
    public static <S> String toSpecification(DFA<S, Character> dfa, Alphabet<Character> alphabet) {
        List<S> states = new ArrayList<>(dfa.getStates());
        StringBuilder sb = new StringBuilder();

        sb.append("alphabet: [");
        appendJoined(sb, alphabet, true);
        sb.append("]\nstates: [");
        List<String> names = new ArrayList<>(states.size());
        for (int i = 0; i < states.size(); i++) {
            names.add("s" + i);
        }
        appendJoined(sb, names, false);
        sb.append("]\ninitial_state: s").append(states.indexOf(dfa.getInitialState()));
        sb.append("\naccepting_states: [");
        List<String> accepting = new ArrayList<>();
        for (int i = 0; i < states.size(); i++) {
            if (dfa.isAccepting(states.get(i))) {
                accepting.add("s" + i);
            }
        }
        appendJoined(sb, accepting, false);
        sb.append("]\ntransitions:\n");
        for (int i = 0; i < states.size(); i++) {
            sb.append("  s").append(i).append(": {");
            boolean first = true;
            for (Character symbol : alphabet) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                S succ = dfa.getSuccessor(states.get(i), symbol);
                sb.append('\'').append(symbol).append("': s").append(states.indexOf(succ));
            }
            sb.append("}\n");
        }
        return sb.toString();
    }

    /**
     * Loads an AutomataLib DFA as an {@link Automaton}.
     */
    public static <S> Automaton fromDFA(DFA<S, Character> dfa, Alphabet<Character> alphabet) {
        return ExampleAutomata.load(toSpecification(dfa, alphabet));
    }

    /**
     * Copies an {@link Automaton} into a fresh {@link CompactDFA} with the same state numbering.
     */
    public static CompactDFA<Character> toCompactDFA(Automaton automaton) {
        Alphabet<Character> alphabet = automaton.getAlphabet();
        CompactDFA<Character> result = new CompactDFA<>(alphabet);

        List<Integer> ids = new ArrayList<>(automaton.size());
        for (State state : automaton.getStates()) {
            ids.add(result.addState(state.isAccepting()));
        }
        for (int i = 0; i < automaton.size(); i++) {
            for (Character symbol : alphabet) {
                Integer succ = ids.get(automaton.getSuccessor(i, symbol));
                result.setTransition(ids.get(i), symbol, succ);
            }
        }
        result.setInitialState(ids.get(automaton.getInitialStateIndex()));

        return result;
    }

    /**
     * Creates a random complete DFA, as AutomataLib generates them.
     */
    public static Automaton randomAutomaton(Random random, int numStates, Alphabet<Character> alphabet) {
        CompactDFA<Character> dfa = new RandomAutomata(random).randomDFA(numStates, alphabet);
        return fromDFA(dfa, alphabet);
    }

    /**
     * Generates random strings over the given alphabet, including the empty string.
     */
    public static List<String> randomStrings(Random random, Alphabet<Character> alphabet, int count, int maxLength) {
        List<String> result = new ArrayList<>(count + 1);
        result.add("");
        for (int i = 0; i < count; i++) {
            int length = random.nextInt(maxLength + 1);
            StringBuilder sb = new StringBuilder(length);
            for (int j = 0; j < length; j++) {
                sb.append(alphabet.getSymbol(random.nextInt(alphabet.size())));
            }
            result.add(sb.toString());
        }
        return result;
    }

    public static Word<Character> toWord(String input) {
        List<Character> symbols = new ArrayList<>(input.length());
        for (int i = 0; i < input.length(); i++) {
            symbols.add(input.charAt(i));
        }
        return Word.fromList(symbols);
    }

    private static void appendJoined(StringBuilder sb, Iterable<?> items, boolean quote) {
        boolean first = true;
        for (Object item : items) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            if (quote) {
                sb.append('\'').append(item).append('\'');
            } else {
                sb.append(item);
            }
        }
    }
}
