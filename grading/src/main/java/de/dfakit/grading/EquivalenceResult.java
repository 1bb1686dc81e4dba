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

import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The verdict on a submitted automaton. {@link #isSuccess()} holds if the submission accepts the same language as the
 * reference. Otherwise the result carries either a distinguishing example (accepted by exactly one of the two
 * automata) or the errors that prevented the comparison.
 */
public final class EquivalenceResult {

    private static final EquivalenceResult EQUIVALENT = new EquivalenceResult(true, null, ImmutableList.of());

    private final boolean success;
    private final @Nullable String example;
    private final ImmutableList<String> errors;

    private EquivalenceResult(boolean success, @Nullable String example, ImmutableList<String> errors) {
        this.success = success;
        this.example = example;
        this.errors = errors;
    }

    public static EquivalenceResult equivalent() {
        return EQUIVALENT;
    }

    public static EquivalenceResult counterexample(String example) {
        return new EquivalenceResult(false, example, ImmutableList.of());
    }

    public static EquivalenceResult failure(List<String> errors) {
        return new EquivalenceResult(false, null, ImmutableList.copyOf(errors));
    }

    public boolean isSuccess() {
        return success;
    }

    public @Nullable String getExample() {
        return example;
    }

    public ImmutableList<String> getErrors() {
        return errors;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EquivalenceResult)) {
            return false;
        }
        EquivalenceResult that = (EquivalenceResult) o;
        return success == that.success && Objects.equals(example, that.example) && errors.equals(that.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, example, errors);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("success", success)
                          .add("example", example)
                          .add("errors", errors)
                          .toString();
    }
}
