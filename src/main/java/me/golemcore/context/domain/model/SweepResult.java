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

import java.time.Duration;

/**
 * Outcome of one expiration sweep.
 *
 * <p>
 * {@code skipped} is set when the sweep did not run because another sweep
 * was in progress or the sweeper was paused.
 */
@Data
@Builder
public class SweepResult {

    private int scanned;
    private int removed;
    private int failed;
    private int batches;
    private boolean skipped;
    private Duration duration;

    public static SweepResult skippedSweep() {
        return SweepResult.builder()
                .skipped(true)
                .duration(Duration.ZERO)
                .build();
    }
}
