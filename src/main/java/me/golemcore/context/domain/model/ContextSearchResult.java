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
import java.util.List;

/**
 * Search result returned by the context store.
 *
 * <p>
 * Carries the summary view of the matching entry. {@code content} stays
 * {@code null} unless the caller explicitly asked for full content.
 */
@Data
@Builder
public class ContextSearchResult {

    private String entryId;
    private EntryType entryType;
    private String source;
    private String summary;
    private String content;
    private double score;

    @Builder.Default
    private List<String> references = new ArrayList<>();

    private String parentId;
    private boolean compressed;
}
