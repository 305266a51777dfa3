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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Category of a context entry.
 *
 * <p>
 * Each variant has a lowercase wire code used in snapshots:
 * <ul>
 * <li>{@link #FILE} - file content from the codebase</li>
 * <li>{@link #COMMAND} - command invocation, disposable after execution</li>
 * <li>{@link #COMMAND_RESULT} - retained output of a command</li>
 * <li>{@link #TASK} - task description for the implementation LLM</li>
 * <li>{@link #TASK_RESULT} - result reported by a task</li>
 * <li>{@link #SEARCH_RESULT} - result of a search or grep operation</li>
 * <li>{@link #SUMMARY} - compressed summary of other entries</li>
 * <li>{@link #CONTEXT_REQUEST} - worker request for additional context</li>
 * </ul>
 */
public enum EntryType {
    FILE("file"),
    COMMAND("command"),
    COMMAND_RESULT("command_result"),
    TASK("task"),
    TASK_RESULT("task_result"),
    SEARCH_RESULT("search_result"),
    SUMMARY("summary"),
    CONTEXT_REQUEST("context_request");

    private final String code;

    EntryType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve an entry type from its wire code or constant name, ignoring case.
     *
     * @param value
     *            code such as {@code command_result} or name such as
     *            {@code COMMAND_RESULT}
     * @return the matching type
     * @throws IllegalArgumentException
     *             if the value matches no type
     */
    @JsonCreator
    public static EntryType fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (EntryType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        String valid = Arrays.stream(values())
                .map(EntryType::getCode)
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Invalid entry type '" + value + "'. Must be one of: " + valid);
    }

    @Override
    public String toString() {
        return code;
    }
}
