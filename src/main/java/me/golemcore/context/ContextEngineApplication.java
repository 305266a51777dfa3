package me.golemcore.context;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the context engine.
 *
 * <p>
 * The engine keeps a shared store of context entries produced by pipeline
 * steps and serves two views of it to LLM calls.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Context Store</b> - validated entries with TTL, compression and
 * snapshot checkpointing</li>
 * <li><b>Search</b> - TF-IDF cosine ranking over entry content</li>
 * <li><b>Relationships</b> - acyclic parent and derivation graphs</li>
 * <li><b>Budgeting</b> - summary-only working context and bounded
 * full-content implementation contexts</li>
 * <li><b>Expiration</b> - background sweeping of expired entries</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code context.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextEngineApplication.class, args);
    }

}
