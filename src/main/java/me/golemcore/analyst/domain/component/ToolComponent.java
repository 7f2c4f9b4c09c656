package me.golemcore.analyst.domain.component;

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

import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.model.ToolResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An investigation tool the planner can invoke. Tools expose their JSON Schema
 * definition for the catalog and implement the execution logic. Arguments are
 * validated against the schema by the registry before {@link #execute} is
 * called.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for the planner catalog.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters and returns the result.
     * Runtime failures are reported as a failed {@link ToolResult}, not thrown.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Checks whether the tool is enabled and may appear in the catalog.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Upper bound for one execution, or null to use the executor default.
     */
    default Duration getExecutionTimeout() {
        return null;
    }
}
