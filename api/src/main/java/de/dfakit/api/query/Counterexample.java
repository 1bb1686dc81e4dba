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
package de.dfakit.api.query;

import java.util.Objects;

import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A word on which a hypothesis and its reference disagree, together with the reference's verdict.
 */
public final class Counterexample {

    private final Word<Character> input;
    private final boolean output;

    /**
     * Constructor.
     *
     * @param input
     *         the distinguishing word
     * @param output
     *         whether the reference accepts {@code input}; the hypothesis does the opposite
     */
    public Counterexample(Word<Character> input, boolean output) {
        this.input = input;
        this.output = output;
    }

    public Word<Character> getInput() {
        return input;
    }

    public boolean getOutput() {
        return output;
    }

    /**
     * Returns the input as a string of its symbols.
     */
    public String getInputString() {
        StringBuilder sb = new StringBuilder(input.length());
        for (Character symbol : input) {
            sb.append(symbol.charValue());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Counterexample)) {
            return false;
        }
        Counterexample that = (Counterexample) o;
        return output == that.output && input.equals(that.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, output);
    }

    @Override
    public String toString() {
        return "Counterexample[" + input + " / " + output + ']';
    }
}
