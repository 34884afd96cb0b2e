package me.golemcore.courseqa.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.component.CourseTool;
import me.golemcore.courseqa.domain.model.SourceCitation;
import me.golemcore.courseqa.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry that routes tool calls from the LLM to {@link CourseTool}s by name
 * and aggregates the citations they record.
 *
 * <p>
 * Not thread-safe. A dispatcher and the tools registered in it belong to one
 * in-flight query; concurrent queries must each use their own instance or their
 * citations get mixed up.
 *
 * <p>
 * Citations are never cleared implicitly: callers read
 * {@link #getLastSources()} once the answer is ready and then call
 * {@link #resetSources()}.
 */
@Slf4j
public class ToolDispatcher {

    private final Map<String, CourseTool> toolRegistry = new LinkedHashMap<>();

    /**
     * Registers a tool under its declared name. A tool registered under an
     * existing name replaces the previous one.
     */
    public void register(CourseTool tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool must declare a name: " + tool.getClass().getName());
        }
        CourseTool previous = toolRegistry.put(name, tool);
        if (previous != null) {
            log.debug("[Tools] Replaced tool registration: {}", name);
        }
    }

    /**
     * Returns one definition per registered tool, in registration order.
     */
    public List<ToolDefinition> getToolDefinitions() {
        return toolRegistry.values().stream()
                .map(CourseTool::getDefinition)
                .toList();
    }

    /**
     * Executes the named tool. An unknown name is not an error: the returned text
     * tells the LLM the tool does not exist. Exceptions thrown by the tool
     * propagate to the caller.
     */
    public String execute(String name, Map<String, Object> arguments) {
        CourseTool tool = toolRegistry.get(name);
        if (tool == null) {
            log.warn("[Tools] Unknown tool requested: {}", name);
            return "Tool '" + name + "' not found";
        }
        return tool.execute(arguments != null ? arguments : Map.of());
    }

    /**
     * Returns citations recorded by the registered tools, in registration order.
     * Tools that were not invoked since the last reset contribute nothing.
     */
    public List<SourceCitation> getLastSources() {
        List<SourceCitation> sources = new ArrayList<>();
        for (CourseTool tool : toolRegistry.values()) {
            sources.addAll(tool.getLastSources());
        }
        return sources;
    }

    /**
     * Clears the citations of every registered tool.
     */
    public void resetSources() {
        toolRegistry.values().forEach(CourseTool::resetSources);
    }
}
