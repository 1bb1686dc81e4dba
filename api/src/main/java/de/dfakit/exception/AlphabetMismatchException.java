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
package de.dfakit.exception;

import java.util.Collection;

/**
 * Thrown when two automata over different alphabets are combined. This signals a misuse by the caller: input data
 * cannot cause it, since callers are expected to compare alphabets before combining automata.
 */
public class AlphabetMismatchException extends IllegalArgumentException {

    /**
     * Constructor.
     *
     * @param first
     *         the alphabet of the first operand
     * @param second
     *         the alphabet of the second operand
     */
    public AlphabetMismatchException(Collection<Character> first, Collection<Character> second) {
        super("Alphabets of both automata must be the same: " + first + " vs. " + second);
    }

}
