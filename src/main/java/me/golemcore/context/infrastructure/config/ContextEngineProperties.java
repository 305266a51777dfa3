package me.golemcore.context.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration of the context engine, bound from {@code context.*} in
 * application.properties.
 *
 * <ul>
 * <li>{@link SweeperProperties} - TTL expiration sweeping</li>
 * <li>{@link BudgetProperties} - implementation-LLM context bounds</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "context")
@Data
public class ContextEngineProperties {

    private SweeperProperties sweeper = new SweeperProperties();
    private BudgetProperties budget = new BudgetProperties();

    @Data
    public static class SweeperProperties {
        private boolean enabled = true;
        private long intervalMs = 60_000L;
        private int batchSize = 100;
    }

    @Data
    public static class BudgetProperties {
        /**
         * Exclusive upper bound: a resolved closure must be smaller than this.
         */
        private int maxImplementationEntries = 200;
        private int charsPerToken = 4;
        private long leakThresholdMs = 600_000L;
    }
}
