package me.golemcore.context.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Raised when an implementation context would hold as many entries as the
 * budget allows or more. Nothing is materialized when this is thrown.
 */
public class EntryBoundsException extends ContextEngineException {

    private static final long serialVersionUID = 1L;

    private final int requested;
    private final int limit;

    public EntryBoundsException(int requested, int limit) {
        super("Implementation context resolves to " + requested
                + " entries, must stay below the limit of " + limit);
        this.requested = requested;
        this.limit = limit;
    }

    public int getRequested() {
        return requested;
    }

    public int getLimit() {
        return limit;
    }
}
