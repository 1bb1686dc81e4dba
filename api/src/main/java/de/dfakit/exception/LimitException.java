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

// Thrown when a product construction is requested whose state count would exceed the configured bound.
public class LimitException extends RuntimeException {

    private final long limit;
    private final long requested;

    /**
     * Constructor.
     *
     * @param limit
     *         the configured maximum number of states
     * @param requested
     *         the number of states the rejected construction would have produced
     */
    public LimitException(long limit, long requested) {
        super("Product construction would create " + requested + " states, the limit is " + limit);
        this.limit = limit;
        this.requested = requested;
    }

    public long getLimit() {
        return limit;
    }

    public long getRequested() {
        return requested;
    }

}
