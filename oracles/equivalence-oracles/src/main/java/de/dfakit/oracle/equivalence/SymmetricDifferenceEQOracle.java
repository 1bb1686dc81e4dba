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

import com.google.common.base.Preconditions;
import de.dfakit.algorithm.algebra.DFAOperations;
import de.dfakit.api.Automaton;
import de.dfakit.api.oracle.EquivalenceOracle;
import de.dfakit.api.query.Counterexample;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact equivalence oracle: builds the symmetric difference of hypothesis and reference and searches it for an
 * accepted word. Any such word is accepted by exactly one of the two automata.
 * <p>
 * The symmetric difference of automata with {@code n} and {@code m} states has {@code (n * m)^2} states; callers are
 * responsible for bounding the size of their inputs.
 */
public class SymmetricDifferenceEQOracle implements EquivalenceOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymmetricDifferenceEQOracle.class);

    private final Automaton reference;

    public SymmetricDifferenceEQOracle(Automaton reference) {
        this.reference = Preconditions.checkNotNull(reference, "Reference automaton not loaded.");
    }

    @Override
    public @Nullable Counterexample findCounterExample(Automaton hypothesis) {
        Automaton difference = DFAOperations.symmetricDifference(hypothesis, reference);
        Word<Character> witness = WitnessSearch.findExample(difference, true);

        if (witness == null) {
            LOGGER.debug("No counterexample: hypothesis is equivalent to the reference");
            return null;
        }

        boolean output = reference.accepts(WitnessSearch.asString(witness)).isAccepted();
        LOGGER.debug("Found counterexample '{}' of length {}", witness, witness.length());
        return new Counterexample(witness, output);
    }

    public Automaton getReference() {
        return reference;
    }
}
