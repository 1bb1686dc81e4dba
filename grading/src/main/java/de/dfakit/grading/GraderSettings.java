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

import com.google.common.base.Preconditions;

/**
 * Settings of an {@link AutomatonGrader}.
 */
public final class GraderSettings {

    /**
     * The default bound on the number of states of the automaton built for an equivalence check.
     */
    public static final long DEFAULT_MAX_PRODUCT_STATES = 1_000_000L;

    private final long maxProductStates;

    public GraderSettings() {
        this(DEFAULT_MAX_PRODUCT_STATES);
    }

    /**
     * Constructor.
     *
     * @param maxProductStates
     *         the maximum number of states of the symmetric difference automaton. A submission with {@code n} states
     *         compared to a reference with {@code m} states needs {@code (n * m)^2} states.
     */
    public GraderSettings(long maxProductStates) {
        Preconditions.checkArgument(maxProductStates > 0, "maxProductStates must be positive: %s", maxProductStates);
        this.maxProductStates = maxProductStates;
    }

    public long getMaxProductStates() {
        return maxProductStates;
    }
}
