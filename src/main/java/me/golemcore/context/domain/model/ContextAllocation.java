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
 * Bookkeeping record of one outstanding implementation context handed out by
 * the budget allocator. The allocator forgets the record on release.
 */
@Data
@Builder
public class ContextAllocation {

    private String contextId;

    @Builder.Default
    private List<String> entryIds = new ArrayList<>();

    private Instant allocatedAt;

    public ContextAllocation copy() {
        return ContextAllocation.builder()
                .contextId(contextId)
                .entryIds(entryIds != null ? new ArrayList<>(entryIds) : new ArrayList<>())
                .allocatedAt(allocatedAt)
                .build();
    }
}
