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
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of running a string on an automaton. {@link #isAccepted()} is only meaningful if {@link #isSuccess()}
 * holds; a failed result carries at least one error message and is never accepted.
 */
public final class AcceptanceResult {

    private static final AcceptanceResult ACCEPTED = new AcceptanceResult(true, true, ImmutableList.of());
    private static final AcceptanceResult REJECTED = new AcceptanceResult(true, false, ImmutableList.of());

    private final boolean success;
    private final boolean accepted;
    private final ImmutableList<String> errors;

    private AcceptanceResult(boolean success, boolean accepted, ImmutableList<String> errors) {
        this.success = success;
        this.accepted = accepted;
        this.errors = errors;
    }

    public static AcceptanceResult of(boolean accepted) {
        return accepted ? ACCEPTED : REJECTED;
    }

    public static AcceptanceResult failure(String error) {
        return failure(ImmutableList.of(error));
    }

    public static AcceptanceResult failure(List<String> errors) {
        Preconditions.checkArgument(!errors.isEmpty(), "a failed result needs an error message");
        return new AcceptanceResult(false, false, ImmutableList.copyOf(errors));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isAccepted() {
        return accepted;
    }

    public ImmutableList<String> getErrors() {
        return errors;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AcceptanceResult)) {
            return false;
        }
        AcceptanceResult that = (AcceptanceResult) o;
        return success == that.success && accepted == that.accepted && errors.equals(that.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, accepted, errors);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("success", success)
                          .add("accepted", accepted)
                          .add("errors", errors)
                          .toString();
    }
}
