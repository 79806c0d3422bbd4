package me.golemcore.brain;

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
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Tiered memory for a developer assistant.
 *
 * <h2>Tiers</h2>
 * <ul>
 * <li><b>Working memory</b> - the last conversations, their entities and file
 * co-modifications, evicted oldest first</li>
 * <li><b>Knowledge graph</b> - long-lived patterns with typed relationships,
 * ranked search and confidence decay</li>
 * <li><b>Context intelligence</b> - daily git metrics, file hotspots, velocity
 * and insights</li>
 * </ul>
 *
 * <p>
 * Callers use {@link me.golemcore.brain.domain.component.BrainComponent}. All
 * configuration lives under the {@code brain.*} prefix in
 * {@code application.properties}. Every tier opens its own embedded database,
 * so no shared data source is configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class BrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrainApplication.class, args);
    }

}
