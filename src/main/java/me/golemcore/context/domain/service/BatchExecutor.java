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
import me.golemcore.context.domain.model.BatchResult;
import me.golemcore.context.domain.model.TaskBatch;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs task batches inside implementation contexts.
 *
 * <p>
 * Each batch requests its context from the {@link ContextBudgetAllocator},
 * invokes the handler and releases the context afterwards whatever the
 * outcome. Handler and allocation failures are captured in the
 * {@link BatchResult} instead of propagating.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchExecutor {

    private final ContextBudgetAllocator budgetAllocator;

    public BatchResult executeBatch(TaskBatch batch, BatchHandler handler) {
        long startNanos = System.nanoTime();
        BatchResult result = BatchResult.builder()
                .batchId(batch.getBatchId())
                .entryCount(batch.getEntryCount())
                .build();

        try {
            budgetAllocator.withContext(batch.getUniqueEntryIds(), context -> {
                result.setTotalTokens(context.getTotalTokens());
                Map<String, Object> taskResults = handler.handle(context, batch.getTasks());
                result.setTaskResults(taskResults != null ? new LinkedHashMap<>(taskResults) : new LinkedHashMap<>());
                return null;
            });
            result.setSuccess(true);
        } catch (RuntimeException e) {
            log.warn("[BatchExecutor] Batch {} failed: {}", batch.getBatchId(), e.getMessage());
            result.setSuccess(false);
            result.setError(e.getMessage());
        }

        result.setDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        log.debug("[BatchExecutor] Batch {} finished (success={}, {} tasks, {}ms)",
                batch.getBatchId(), result.isSuccess(), batch.getTasks().size(), result.getDuration().toMillis());
        return result;
    }

    /**
     * Execute batches in order. With {@code continueOnError=false} execution
     * stops after the first failed batch.
     */
    public List<BatchResult> executeAll(List<TaskBatch> batches, BatchHandler handler, boolean continueOnError) {
        List<BatchResult> results = new ArrayList<>();
        for (TaskBatch batch : batches) {
            BatchResult result = executeBatch(batch, handler);
            results.add(result);
            if (!result.isSuccess() && !continueOnError) {
                log.info("[BatchExecutor] Stopping after failed batch {}", batch.getBatchId());
                break;
            }
        }
        return results;
    }

    /**
     * Merge task results of all batches, keyed by task id.
     */
    public Map<String, Object> collectTaskResults(List<BatchResult> batchResults) {
        Map<String, Object> all = new LinkedHashMap<>();
        for (BatchResult batchResult : batchResults) {
            all.putAll(batchResult.getTaskResults());
        }
        return all;
    }
}
