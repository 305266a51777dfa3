package me.golemcore.context.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, full-content context materialized for one implementation LLM call.
 *
 * <p>
 * {@code entryIds} holds the requested ids followed by every resolved parent
 * and derivation source, in resolution order. The allocation stays outstanding
 * until {@code contextId} is released.
 */
@Data
@Builder
public class ImplementationContext {

    private String contextId;

    @Builder.Default
    private List<String> requestedIds = new ArrayList<>();

    @Builder.Default
    private List<String> entryIds = new ArrayList<>();

    @Builder.Default
    private List<ImplementationEntryView> entries = new ArrayList<>();

    private int entryCount;
    private int totalTokens;
    private Instant allocatedAt;
}
