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
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import de.dfakit.api.Automaton;
import net.automatalib.words.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the size of the minimal automaton equivalent to a given {@link Automaton}, i.e. the number of its
 * Myhill-Nerode equivalence classes, using Hopcroft's partition refinement.
 * <p>
 * States that cannot be reached from the initial state are not part of the minimal automaton and are discarded before
 * refinement. The given automaton is not modified and no minimized automaton is built.
 */
public final class HopcroftMinimization {

    private static final Logger LOGGER = LoggerFactory.getLogger(HopcroftMinimization.class);

    private HopcroftMinimization() {
        // prevent instantiation
    }

    /**
     * Counts the equivalence classes of the reachable states of the given automaton.
     * <p>
     * The refinement starts from the partition into accepting and rejecting states. A worklist holds the blocks that
     * still have to be used as splitters; whenever a block is split and it is not pending already, only the smaller
     * half is added, which bounds the total work by {@code O(k n log n)} for {@code n} states and {@code k}
     * symbols.
     *
     * @param automaton
     *         the automaton
     *
     * @return the number of states of the minimal automaton accepting the same language, at least {@code 1}
     */
    public static int countEquivalenceClasses(Automaton automaton) {
        Preconditions.checkNotNull(automaton, "Automaton not loaded. Load it successfully first.");

        final Alphabet<Character> alphabet = automaton.getAlphabet();
        final int[] reachable = reachableStates(automaton);
        final int n = reachable.length;
        final int k = alphabet.size();

        // local numbering: i refers to reachable[i]
        final int[] local = new int[automaton.size()];
        Arrays.fill(local, -1);
        for (int i = 0; i < n; i++) {
            local[reachable[i]] = i;
        }

        final Set<Integer> accepting = new HashSet<>();
        final Set<Integer> rejecting = new HashSet<>();
        for (int i = 0; i < n; i++) {
            if (automaton.getState(reachable[i]).isAccepting()) {
                accepting.add(i);
            } else {
                rejecting.add(i);
            }
        }

        if (accepting.isEmpty() || rejecting.isEmpty()) {
            LOGGER.debug("All {} reachable states agree on acceptance, one class", n);
            return 1;
        }

        // reverse.get(c).get(t) lists all states with a c-transition to t
        final List<ListMultimap<Integer, Integer>> reverse = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            ListMultimap<Integer, Integer> predecessors = ArrayListMultimap.create();
            char symbol = alphabet.getSymbol(c);
            for (int i = 0; i < n; i++) {
                predecessors.put(local[automaton.getSuccessor(reachable[i], symbol)], i);
            }
            reverse.add(predecessors);
        }

        final List<Set<Integer>> blocks = new ArrayList<>();
        final int[] blockOf = new int[n];
        addBlock(blocks, blockOf, accepting);
        addBlock(blocks, blockOf, rejecting);

        final Deque<Integer> worklist = new ArrayDeque<>();
        final BitSet pending = new BitSet();
        enqueue(worklist, pending, accepting.size() <= rejecting.size() ? 0 : 1);

        while (!worklist.isEmpty()) {
            final int splitter = worklist.poll();
            pending.clear(splitter);

            // the splitter itself may be split while its predecessors are processed
            final List<Integer> splitterStates = new ArrayList<>(blocks.get(splitter));

            for (int c = 0; c < k; c++) {
                final ListMultimap<Integer, Integer> predecessors = reverse.get(c);

                final Map<Integer, Set<Integer>> touched = new LinkedHashMap<>();
                for (Integer target : splitterStates) {
                    for (Integer pred : predecessors.get(target)) {
                        touched.computeIfAbsent(blockOf[pred], b -> new HashSet<>()).add(pred);
                    }
                }

                for (Map.Entry<Integer, Set<Integer>> e : touched.entrySet()) {
                    final int id = e.getKey();
                    final Set<Integer> inside = e.getValue();
                    final Set<Integer> members = blocks.get(id);

                    if (inside.size() == members.size()) {
                        continue;
                    }

                    // the intersection keeps the id, the remainder becomes a new block
                    members.removeAll(inside);
                    final int fresh = addBlock(blocks, blockOf, members);
                    blocks.set(id, inside);

                    if (pending.get(id)) {
                        enqueue(worklist, pending, fresh);
                    } else {
                        enqueue(worklist, pending, inside.size() <= members.size() ? id : fresh);
                    }
                }
            }
        }

        LOGGER.debug("Partition refinement of {} reachable states ({} in total) yields {} classes",
                     n,
                     automaton.size(),
                     blocks.size());
        return blocks.size();
    }

    private static int addBlock(List<Set<Integer>> blocks, int[] blockOf, Set<Integer> members) {
        final int id = blocks.size();
        blocks.add(members);
        for (Integer state : members) {
            blockOf[state] = id;
        }
        return id;
    }

    private static void enqueue(Deque<Integer> worklist, BitSet pending, int block) {
        worklist.add(block);
        pending.set(block);
    }

    // breadth-first, in order of discovery
    private static int[] reachableStates(Automaton automaton) {
        final BitSet visited = new BitSet(automaton.size());
        final int[] order = new int[automaton.size()];
        int head = 0;
        int tail = 0;

        order[tail++] = automaton.getInitialStateIndex();
        visited.set(automaton.getInitialStateIndex());

        while (head < tail) {
            final int state = order[head++];
            for (Integer succ : automaton.getState(state).getTransitions().values()) {
                if (!visited.get(succ)) {
                    visited.set(succ);
                    order[tail++] = succ;
                }
            }
        }

        return Arrays.copyOf(order, tail);
    }
}
