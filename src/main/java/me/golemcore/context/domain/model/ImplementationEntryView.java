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
 * Full view of an entry for an implementation LLM. {@code content} is present
 * unless the entry has been compressed.
 */
@Data
@Builder
public class ImplementationEntryView {

    private String id;
    private EntryType entryType;
    private String source;
    private String summary;
    private String content;
    private Instant createdAt;

    @Builder.Default
    private List<String> references = new ArrayList<>();

    private String parentId;

    @Builder.Default
    private List<String> derivedFrom = new ArrayList<>();

    private boolean compressed;
}
