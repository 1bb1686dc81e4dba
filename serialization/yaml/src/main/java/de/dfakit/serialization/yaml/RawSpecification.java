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
package de.dfakit.serialization.yaml;

import java.util.List;
import java.util.Map;

/**
 * The five fields of a specification after the shape check, still as plain strings. Lists and maps keep document
 * order.
 */
final class RawSpecification {

    final List<String> alphabet;
    final List<String> states;
    final String initialState;
    final List<String> acceptingStates;
    final Map<String, Map<String, String>> transitions;

    RawSpecification(List<String> alphabet,
                     List<String> states,
                     String initialState,
                     List<String> acceptingStates,
                     Map<String, Map<String, String>> transitions) {
        this.alphabet = alphabet;
        this.states = states;
        this.initialState = initialState;
        this.acceptingStates = acceptingStates;
        this.transitions = transitions;
    }
}
