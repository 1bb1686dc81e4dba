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
package de.dfakit.algorithm.minimization;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import de.dfakit.algorithm.algebra.DFAOperations;
import de.dfakit.api.Automaton;
import de.dfakit.examples.AutomataLibAdapter;
import de.dfakit.examples.ExampleAutomata;
import net.automatalib.util.automata.fsa.DFAs;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;
import org.testng.Assert;
import org.testng.annotations.Test;

public class HopcroftMinimizationTest {

    private static final Alphabet<Character> TERNARY = Alphabets.fromList(Arrays.asList('a', 'b', 'c'));

    @Test
    public void testMinimalAutomaton() {
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(ExampleAutomata.endsInOne()), 2);
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(ExampleAutomata.evenZeros()), 2);
    }

    @Test
    public void testRedundantStatesAreMerged() {
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(ExampleAutomata.containsOneOne()), 3);
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(ExampleAutomata.load(ExampleAutomata.ENDS_IN_ONE_REDUNDANT)),
                            2);
    }

    @Test
    public void testUniformAcceptanceIsOneClass() {
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(ExampleAutomata.load(ExampleAutomata.EMPTY_LANGUAGE)),
                            1);
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(ExampleAutomata.load(ExampleAutomata.UNIVERSAL_ABC)),
                            1);

        Automaton complete = DFAOperations.union(ExampleAutomata.containsOneOne(),
                                                 DFAOperations.complement(ExampleAutomata.containsOneOne()));
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(complete), 1);
    }

    @Test
    public void testUnionShrinks() {
        Automaton union = DFAOperations.union(ExampleAutomata.endsInOne(), ExampleAutomata.containsOneOne());

        Assert.assertEquals(union.size(), 8);
        // ends in 1 (no 11 yet), contains 11, neither
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(union), 3);
    }

    @Test
    public void testUnreachableStatesAreIgnored() {
        Automaton dfa = ExampleAutomata.load(String.join("\n",
                "alphabet: ['0', '1']",
                "states: [q0, q1, island]",
                "initial_state: q0",
                "accepting_states: [q1]",
                "transitions:",
                "  q0: {'0': q0, '1': q1}",
                "  q1: {'0': q0, '1': q1}",
                "  island: {'0': q1, '1': q1}"));

        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(dfa), 2);
    }

    @Test
    public void testOnlyUnreachableStatesAccept() {
        // the initial partition is taken over reachable states only
        Automaton dfa = ExampleAutomata.load(String.join("\n",
                "alphabet: ['0', '1']",
                "states: [q0, island]",
                "initial_state: q0",
                "accepting_states: [island]",
                "transitions:",
                "  q0: {'0': q0, '1': q0}",
                "  island: {'0': q0, '1': island}"));

        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(dfa), 1);
        Assert.assertEquals(HopcroftMinimization.countEquivalenceClasses(ExampleAutomata.load(
                ExampleAutomata.EMPTY_LANGUAGE)), 1);
    }

    @Test
    public void testAgainstReferenceImplementations() {
        Random random = new Random(4711);
        for (int i = 0; i < 30; i++) {
            Automaton a = AutomataLibAdapter.randomAutomaton(random, 6, TERNARY);
            Automaton b = AutomataLibAdapter.randomAutomaton(random, 4, TERNARY);

            for (Automaton dfa : Arrays.asList(a,
                                               DFAOperations.union(a, b),
                                               DFAOperations.intersect(a, b),
                                               DFAOperations.symmetricDifference(a, b))) {
                int classes = HopcroftMinimization.countEquivalenceClasses(dfa);

                Assert.assertTrue(classes <= dfa.size());
                Assert.assertEquals(classes, mooreClasses(dfa));
                Assert.assertEquals(classes,
                                    DFAs.minimize(AutomataLibAdapter.toCompactDFA(dfa), dfa.getAlphabet()).size());
            }
        }
    }

    @Test
    public void testAutomatonIsNotModified() {
        Automaton dfa = ExampleAutomata.containsOneOne();
        HopcroftMinimization.countEquivalenceClasses(dfa);
        Assert.assertEquals(dfa, ExampleAutomata.containsOneOne());
    }

    @Test(expectedExceptions = NullPointerException.class)
    public void testUnloadedAutomaton() {
        HopcroftMinimization.countEquivalenceClasses(null);
    }

    /**
     * Naive fixed-point refinement: states are repeatedly re-labeled by their current class and the classes of their
     * successors until the number of classes stabilizes.
     */
    private static int mooreClasses(Automaton dfa) {
        List<Integer> reachable = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(dfa.getInitialStateIndex());
        seen.add(dfa.getInitialStateIndex());
        while (!queue.isEmpty()) {
            int s = queue.poll();
            reachable.add(s);
            for (Integer succ : dfa.getState(s).getTransitions().values()) {
                if (seen.add(succ)) {
                    queue.add(succ);
                }
            }
        }

        Map<Integer, Integer> classOf = new HashMap<>();
        for (Integer s : reachable) {
            classOf.put(s, dfa.getState(s).isAccepting() ? 1 : 0);
        }
        int count = new HashSet<>(classOf.values()).size();

        while (true) {
            Map<List<Integer>, Integer> signatures = new HashMap<>();
            Map<Integer, Integer> next = new HashMap<>();
            for (Integer s : reachable) {
                List<Integer> signature = new ArrayList<>();
                signature.add(classOf.get(s));
                for (Character symbol : dfa.getAlphabet()) {
                    signature.add(classOf.get(dfa.getSuccessor(s, symbol)));
                }
                Integer id = signatures.computeIfAbsent(signature, k -> signatures.size());
                next.put(s, id);
            }
            classOf = next;
            if (signatures.size() == count) {
                return count;
            }
            count = signatures.size();
        }
    }
}
