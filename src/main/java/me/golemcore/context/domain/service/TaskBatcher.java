package me.golemcore.context.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.model.TaskBatch;
import me.golemcore.context.domain.model.TaskSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Groups tasks into batches whose combined dependency closure fits one
 * implementation context.
 *
 * <p>
 * Tasks are taken in order (optionally highest priority first) and appended to
 * the current batch while the union of their resolved closures stays below the
 * budget. A task whose own closure is already too large is emitted alone with
 * {@code exceedsLimit} set.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskBatcher {

    private final ContextBudgetAllocator budgetAllocator;
    private final AtomicInteger batchCounter = new AtomicInteger();

    public List<TaskBatch> createBatches(List<TaskSpec> tasks) {
        return createBatches(tasks, false);
    }

    /**
     * @throws me.golemcore.context.domain.exception.EntryNotFoundException
     *             if a task requires an entry the store does not hold
     */
    public List<TaskBatch> createBatches(List<TaskSpec> tasks, boolean sortByPriority) {
        List<TaskBatch> batches = new ArrayList<>();
        if (tasks == null || tasks.isEmpty()) {
            return batches;
        }

        List<TaskSpec> ordered = new ArrayList<>(tasks);
        if (sortByPriority) {
            ordered.sort(Comparator.comparingInt(TaskSpec::getPriority).reversed());
        }

        List<TaskSpec> currentTasks = new ArrayList<>();
        Set<String> currentEntries = new LinkedHashSet<>();

        for (TaskSpec task : ordered) {
            Set<String> taskEntries = new LinkedHashSet<>(budgetAllocator.resolveClosure(task.getRequiredEntryIds()));

            if (!budgetAllocator.isWithinBounds(taskEntries.size())) {
                log.warn("[TaskBatcher] Task {} alone needs {} entries, limit {}",
                        task.getId(), taskEntries.size(), budgetAllocator.getMaxEntries());
                if (!currentTasks.isEmpty()) {
                    batches.add(newBatch(currentTasks, currentEntries, false));
                    currentTasks = new ArrayList<>();
                    currentEntries = new LinkedHashSet<>();
                }
                batches.add(newBatch(List.of(task), taskEntries, true));
                continue;
            }

            Set<String> combined = new LinkedHashSet<>(currentEntries);
            combined.addAll(taskEntries);
            if (budgetAllocator.isWithinBounds(combined.size())) {
                currentTasks.add(task);
                currentEntries = combined;
                continue;
            }

            batches.add(newBatch(currentTasks, currentEntries, false));
            currentTasks = new ArrayList<>(List.of(task));
            currentEntries = taskEntries;
        }

        if (!currentTasks.isEmpty()) {
            batches.add(newBatch(currentTasks, currentEntries, false));
        }

        log.info("[TaskBatcher] Created {} batches for {} tasks", batches.size(), tasks.size());
        return batches;
    }

    private TaskBatch newBatch(List<TaskSpec> tasks, Set<String> entryIds, boolean exceedsLimit) {
        return TaskBatch.builder()
                .batchId(String.format("batch_%04d", batchCounter.incrementAndGet()))
                .tasks(new ArrayList<>(tasks))
                .uniqueEntryIds(new LinkedHashSet<>(entryIds))
                .exceedsLimit(exceedsLimit)
                .build();
    }
}
