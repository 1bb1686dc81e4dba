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

import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A state of an {@link Automaton}. Transitions refer to their destination by the index of that state in the owning
 * automaton's state list, so states never reference each other directly.
 * <p>
 * The transition map keeps the order in which the transitions were declared.
 */
public final class State {

    private final String name;
    private final boolean accepting;
    private final ImmutableMap<Character, Integer> transitions;

    /**
     * Constructor.
     *
     * @param name
     *         the name of the state, unique within its automaton
     * @param accepting
     *         whether the state is accepting
     * @param transitions
     *         the transition function of this state, mapping each symbol to a destination state index
     */
    public State(String name, boolean accepting, Map<Character, Integer> transitions) {
        this.name = Objects.requireNonNull(name);
        this.accepting = accepting;
        this.transitions = ImmutableMap.copyOf(transitions);
    }

    public String getName() {
        return name;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public ImmutableMap<Character, Integer> getTransitions() {
        return transitions;
    }

    /**
     * Returns the index of the successor state for the given symbol.
     *
     * @param symbol
     *         the input symbol
     *
     * @return the successor index, or {@code null} if this state has no transition for {@code symbol}
     */
    public @Nullable Integer getSuccessor(char symbol) {
        return transitions.get(symbol);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof State)) {
            return false;
        }
        State that = (State) o;
        return accepting == that.accepting && name.equals(that.name) && transitions.equals(that.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, accepting, transitions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("accepting", accepting)
                          .add("transitions", transitions)
                          .toString();
    }
}
