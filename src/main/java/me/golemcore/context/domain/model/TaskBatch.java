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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Group of tasks sharing one implementation context.
 *
 * <p>
 * {@code uniqueEntryIds} is the deduplicated dependency closure of every task
 * in the batch. {@code exceedsLimit} marks a single task whose own closure is
 * already over the context budget; such a batch cannot be executed as is.
 */
@Data
@Builder
public class TaskBatch {

    private String batchId;

    @Builder.Default
    private List<TaskSpec> tasks = new ArrayList<>();

    @Builder.Default
    private Set<String> uniqueEntryIds = new LinkedHashSet<>();

    private boolean exceedsLimit;

    public int getEntryCount() {
        return uniqueEntryIds.size();
    }
}
