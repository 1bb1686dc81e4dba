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
package de.dfakit.api.oracle;

import de.dfakit.api.Automaton;
import de.dfakit.api.query.Counterexample;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An equivalence oracle decides whether a hypothesis accepts the same language as a fixed reference automaton.
 */
public interface EquivalenceOracle {

    /**
     * Searches for a word on which the hypothesis and the reference disagree.
     *
     * @param hypothesis
     *         the automaton to check, defined over the reference's alphabet
     *
     * @return a counterexample, or {@code null} if both automata accept the same language
     */
    @Nullable Counterexample findCounterExample(Automaton hypothesis);
}
