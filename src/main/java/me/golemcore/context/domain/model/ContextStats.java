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

import java.util.EnumMap;
import java.util.Map;

/**
 * Store statistics over live (non-expired) entries.
 *
 * <p>
 * {@code expiredPending} counts rows that are already expired but still
 * physically present because the sweeper has not reached them yet.
 */
@Data
@Builder
public class ContextStats {

    private int total;

    @Builder.Default
    private Map<EntryType, Integer> byType = new EnumMap<>(EntryType.class);

    private int compressed;
    private int indexed;
    private int expiredPending;
}
