package me.golemcore.scheduler.port.outbound;

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

import me.golemcore.scheduler.domain.component.ToolCapability;

import java.util.Optional;
import java.util.Set;

/**
 * Port for resolving tool names to executable capabilities.
 */
public interface ToolRegistryPort {

    /**
     * Resolves an enabled tool by name.
     *
     * @return the capability, or empty when the name is unknown or disabled
     */
    Optional<ToolCapability> resolve(String toolName);

    /**
     * Whether the tool exists but is switched off by governance.
     */
    boolean isDisabled(String toolName);

    /**
     * Names of all enabled tools, used for "did you mean" suggestions.
     */
    Set<String> getToolNames();
}
