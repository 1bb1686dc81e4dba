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

import java.util.Arrays;
import java.util.Collections;

import com.google.common.collect.ImmutableMap;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomatonTest {

    private static final Alphabet<Character> BINARY = Alphabets.fromList(Arrays.asList('0', '1'));

    // accepts all strings ending in 1
    private static Automaton endsInOne() {
        State q0 = new State("q0", false, ImmutableMap.of('0', 0, '1', 1));
        State q1 = new State("q1", true, ImmutableMap.of('0', 0, '1', 1));
        return new Automaton(BINARY, Arrays.asList(q0, q1), 0);
    }

    @Test
    public void testAcceptance() {
        Automaton dfa = endsInOne();

        Assert.assertEquals(dfa.accepts("1"), AcceptanceResult.of(true));
        Assert.assertEquals(dfa.accepts("10"), AcceptanceResult.of(false));
        Assert.assertEquals(dfa.accepts("0101"), AcceptanceResult.of(true));
        Assert.assertFalse(dfa.accepts("").isAccepted());
        Assert.assertTrue(dfa.accepts("").isSuccess());
    }

    @Test
    public void testUnknownSymbolStopsEvaluation() {
        AcceptanceResult result = endsInOne().accepts("1a2");

        Assert.assertFalse(result.isSuccess());
        Assert.assertFalse(result.isAccepted());
        Assert.assertEquals(result.getErrors(), Collections.singletonList("Symbol 'a' not in alphabet."));
    }

    @Test
    public void testSupplementaryCharacterIsOneUnknownSymbol() {
        AcceptanceResult result = endsInOne().accepts("1\uD83D\uDE00");

        Assert.assertFalse(result.isSuccess());
        Assert.assertEquals(result.getErrors(), Collections.singletonList("Symbol '\uD83D\uDE00' not in alphabet."));
    }

    @Test
    public void testLookup() {
        Automaton dfa = endsInOne();

        Assert.assertEquals(dfa.size(), 2);
        Assert.assertEquals(dfa.getStateIndex("q1"), 1);
        Assert.assertEquals(dfa.getStateIndex("q2"), -1);
        Assert.assertEquals(dfa.getInitialState().getName(), "q0");
        Assert.assertEquals(dfa.getSuccessor(0, '1'), 1);
    }

    @Test
    public void testAlphabetComparisonIgnoresOrder() {
        Alphabet<Character> reversed = Alphabets.fromList(Arrays.asList('1', '0'));
        State q = new State("q", true, ImmutableMap.of('1', 0, '0', 0));
        Automaton other = new Automaton(reversed, Collections.singletonList(q), 0);

        Assert.assertTrue(endsInOne().hasSameAlphabet(other));

        Alphabet<Character> unary = Alphabets.fromList(Collections.singletonList('0'));
        State u = new State("u", true, ImmutableMap.of('0', 0));
        Assert.assertFalse(endsInOne().hasSameAlphabet(new Automaton(unary, Collections.singletonList(u), 0)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testIncompleteTransitionFunction() {
        State q0 = new State("q0", false, ImmutableMap.of('0', 0));
        new Automaton(BINARY, Collections.singletonList(q0), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicateStateNames() {
        State q0 = new State("q", false, ImmutableMap.of('0', 0, '1', 1));
        State q1 = new State("q", true, ImmutableMap.of('0', 0, '1', 1));
        new Automaton(BINARY, Arrays.asList(q0, q1), 0);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testInitialStateOutOfRange() {
        State q0 = new State("q0", false, ImmutableMap.of('0', 0, '1', 0));
        new Automaton(BINARY, Collections.singletonList(q0), 3);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testFailedLoadHasNoAutomaton() {
        LoadResult.failure(Collections.singletonList("broken")).getAutomaton();
    }
}
