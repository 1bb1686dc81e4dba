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
package de.dfakit.grading;

import java.util.Collections;
import java.util.OptionalInt;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import de.dfakit.algorithm.minimization.HopcroftMinimization;
import de.dfakit.api.AcceptanceResult;
import de.dfakit.api.Automaton;
import de.dfakit.api.LoadResult;
import de.dfakit.api.oracle.EquivalenceOracle;
import de.dfakit.api.query.Counterexample;
import de.dfakit.exception.LimitException;
import de.dfakit.oracle.equivalence.SymmetricDifferenceEQOracle;
import de.dfakit.serialization.yaml.AutomatonLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for grading exercises on automata given as YAML text.
 * <p>
 * Learner input is never trusted: anything wrong with a submission is reported in the returned result. Broken
 * reference data is a configuration problem and is thrown as an exception.
 */
public class AutomatonGrader {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonGrader.class);

    private final AutomatonLoader loader;
    private final GraderSettings settings;

    public AutomatonGrader() {
        this(new AutomatonLoader(), new GraderSettings());
    }

    public AutomatonGrader(GraderSettings settings) {
        this(new AutomatonLoader(), settings);
    }

    public AutomatonGrader(AutomatonLoader loader, GraderSettings settings) {
        this.loader = Preconditions.checkNotNull(loader);
        this.settings = Preconditions.checkNotNull(settings);
    }

    /**
     * Loads an automaton and runs it on the given input.
     *
     * @param specText
     *         the YAML description of the automaton
     * @param input
     *         the string to run
     *
     * @return the acceptance verdict, or the load errors of the automaton
     */
    public AcceptanceResult check(String specText, String input) {
        try {
            LoadResult result = loader.load(specText);
            if (!result.isSuccess()) {
                return AcceptanceResult.failure(result.getErrors());
            }
            return result.getAutomaton().accepts(input);
        } catch (RuntimeException e) {
            LOGGER.error("Checking input '{}' failed", input, e);
            return AcceptanceResult.failure("Server error: " + e.getMessage());
        }
    }

    /**
     * Compares a submitted automaton against a reference solution.
     *
     * @param submissionText
     *         the YAML description of the submitted automaton
     * @param referenceText
     *         the YAML description of the reference automaton
     *
     * @return the verdict, with a distinguishing example if the languages differ
     *
     * @throws IllegalStateException
     *         if the reference cannot be loaded
     * @throws LimitException
     *         if the equivalence check would exceed {@link GraderSettings#getMaxProductStates()}
     */
    public EquivalenceResult compare(String submissionText, String referenceText) {
        LoadResult referenceResult = loader.load(referenceText);
        if (!referenceResult.isSuccess()) {
            throw new IllegalStateException("Reference automaton does not load: " + referenceResult.getErrors());
        }
        LoadResult submissionResult = loader.load(submissionText);
        if (!submissionResult.isSuccess()) {
            LOGGER.debug("Submission rejected with {} load error(s)", submissionResult.getErrors().size());
            return EquivalenceResult.failure(submissionResult.getErrors());
        }

        Automaton reference = referenceResult.getAutomaton();
        Automaton submission = submissionResult.getAutomaton();

        if (!submission.hasSameAlphabet(reference)) {
            return EquivalenceResult.failure(Collections.singletonList(
                    "Alphabet " + ImmutableList.copyOf(submission.getAlphabet()) +
                    " does not match the expected alphabet " + ImmutableList.copyOf(reference.getAlphabet()) + "."));
        }

        long pairs = LongMath.saturatedMultiply(submission.size(), reference.size());
        long productStates = LongMath.saturatedMultiply(pairs, pairs);
        if (productStates > settings.getMaxProductStates()) {
            throw new LimitException(settings.getMaxProductStates(), productStates);
        }

        EquivalenceOracle oracle = new SymmetricDifferenceEQOracle(reference);
        Counterexample ce = oracle.findCounterExample(submission);
        if (ce == null) {
            return EquivalenceResult.equivalent();
        }
        LOGGER.debug("Submission differs from the reference on '{}'", ce.getInputString());
        return EquivalenceResult.counterexample(ce.getInputString());
    }

    /**
     * Computes the number of states of the minimal automaton accepting the same language.
     *
     * @param specText
     *         the YAML description of the automaton
     *
     * @return the minimal number of states, or an empty result if the automaton does not load
     */
    public OptionalInt countMinimalStates(String specText) {
        LoadResult result = loader.load(specText);
        if (!result.isSuccess()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(HopcroftMinimization.countEquivalenceClasses(result.getAutomaton()));
    }

    public GraderSettings getSettings() {
        return settings;
    }
}
