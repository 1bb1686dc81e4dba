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

import java.util.Arrays;
import java.util.Random;

import de.dfakit.api.Automaton;
import de.dfakit.api.oracle.EquivalenceOracle;
import de.dfakit.api.query.Counterexample;
import de.dfakit.examples.AutomataLibAdapter;
import de.dfakit.examples.ExampleAutomata;
import de.dfakit.exception.AlphabetMismatchException;
import net.automatalib.util.automata.Automata;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.testng.Assert;
import org.testng.annotations.Test;

public class SymmetricDifferenceEQOracleTest {

    private static final Alphabet<Character> BINARY = Alphabets.fromList(Arrays.asList('0', '1'));

    @Test
    public void testEquivalentAutomata() {
        EquivalenceOracle oracle = new SymmetricDifferenceEQOracle(ExampleAutomata.endsInOne());

        Assert.assertNull(oracle.findCounterExample(ExampleAutomata.endsInOne()));
        Assert.assertNull(oracle.findCounterExample(ExampleAutomata.load(ExampleAutomata.ENDS_IN_ONE_REDUNDANT)));
    }

    @Test
    public void testCounterexample() {
        EquivalenceOracle oracle = new SymmetricDifferenceEQOracle(ExampleAutomata.endsInOne());

        // differs on the empty word
        Counterexample ce = oracle.findCounterExample(ExampleAutomata.load(ExampleAutomata.ENDS_IN_ONE_SWAPPED));
        Assert.assertNotNull(ce);
        Assert.assertEquals(ce.getInput(), Word.epsilon());
        Assert.assertFalse(ce.getOutput());

        ce = oracle.findCounterExample(ExampleAutomata.containsOneOne());
        Assert.assertNotNull(ce);
        Assert.assertEquals(ce.getInputString(), "1");
        Assert.assertTrue(ce.getOutput());
    }

    @Test
    public void testAgainstAutomataLib() {
        Random random = new Random(17);
        for (int i = 0; i < 40; i++) {
            Automaton reference = AutomataLibAdapter.randomAutomaton(random, 4, BINARY);
            Automaton hypothesis = AutomataLibAdapter.randomAutomaton(random, 3, BINARY);

            Counterexample ce = new SymmetricDifferenceEQOracle(reference).findCounterExample(hypothesis);
            Word<Character> separating = Automata.testEquivalence(AutomataLibAdapter.toCompactDFA(reference),
                                                                  AutomataLibAdapter.toCompactDFA(hypothesis),
                                                                  BINARY);

            Assert.assertEquals(ce == null, separating == null);
            if (ce != null) {
                String input = ce.getInputString();
                Assert.assertEquals(reference.accepts(input).isAccepted(), ce.getOutput());
                Assert.assertNotEquals(hypothesis.accepts(input).isAccepted(), ce.getOutput());
                Assert.assertEquals(ce.getInput().length(), separating.length());
            }
        }
    }

    @Test(expectedExceptions = AlphabetMismatchException.class)
    public void testAlphabetMismatch() {
        new SymmetricDifferenceEQOracle(ExampleAutomata.endsInOne()).findCounterExample(ExampleAutomata.load(
                ExampleAutomata.UNIVERSAL_ABC));
    }
}
