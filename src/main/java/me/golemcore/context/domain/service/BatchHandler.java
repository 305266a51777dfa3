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

import me.golemcore.context.domain.model.ImplementationContext;
import me.golemcore.context.domain.model.TaskSpec;

import java.util.List;
import java.util.Map;

/**
 * Work performed for one batch of tasks inside an implementation context.
 * Returns results keyed by task id.
 */
@FunctionalInterface
public interface BatchHandler {

    Map<String, Object> handle(ImplementationContext context, List<TaskSpec> tasks);
}
