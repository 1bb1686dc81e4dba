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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of loading an automaton specification: either a loaded {@link Automaton} or a non-empty, ordered list
 * of error messages, never both.
 */
public final class LoadResult {

    private final @Nullable Automaton automaton;
    private final ImmutableList<String> errors;

    private LoadResult(@Nullable Automaton automaton, ImmutableList<String> errors) {
        this.automaton = automaton;
        this.errors = errors;
    }

    public static LoadResult success(Automaton automaton) {
        return new LoadResult(automaton, ImmutableList.of());
    }

    public static LoadResult failure(List<String> errors) {
        Preconditions.checkArgument(!errors.isEmpty(), "a failed result needs an error message");
        return new LoadResult(null, ImmutableList.copyOf(errors));
    }

    public boolean isSuccess() {
        return automaton != null;
    }

    public ImmutableList<String> getErrors() {
        return errors;
    }

    /**
     * Returns the loaded automaton.
     *
     * @throws IllegalStateException
     *         if loading failed
     */
    public Automaton getAutomaton() {
        Preconditions.checkState(automaton != null, "Automaton not loaded: %s", errors);
        return automaton;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("success", isSuccess())
                          .add("errors", errors)
                          .toString();
    }
}
