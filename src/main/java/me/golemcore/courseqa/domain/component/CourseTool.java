package me.golemcore.courseqa.domain.component;

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

import me.golemcore.courseqa.domain.model.SourceCitation;
import me.golemcore.courseqa.domain.model.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * Retrieval tool the LLM can invoke while answering a course question. Tools
 * expose their JSON Schema definition to the LLM and implement the execution
 * logic.
 *
 * <p>
 * Instances are stateful: {@link #execute} records the passages it returned so
 * the caller can cite them afterwards. An instance therefore belongs to a
 * single in-flight query and must not be shared between concurrent queries.
 */
public interface CourseTool {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool and returns text for the LLM. Failures are thrown, not
     * encoded in the returned text; the tool loop turns them into error results.
     *
     * @param parameters
     *            arguments keyed by parameter name
     * @return text handed back to the LLM as the tool result
     */
    String execute(Map<String, Object> parameters);

    /**
     * Returns the citations recorded by the most recent {@link #execute} call.
     */
    List<SourceCitation> getLastSources();

    /**
     * Forgets recorded citations.
     */
    void resetSources();

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
