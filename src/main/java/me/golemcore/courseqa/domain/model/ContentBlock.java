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

package me.golemcore.courseqa.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One block of message content. The set of block kinds is closed: plain text,
 * a tool-use request issued by the LLM, or the result of executing such a
 * request.
 */
public sealed interface ContentBlock permits ContentBlock.Text, ContentBlock.ToolUse, ContentBlock.ToolResult {

    /**
     * Plain text produced by the user or the assistant.
     */
    record Text(String text) implements ContentBlock {
    }

    /**
     * A tool invocation requested by the LLM.
     *
     * @param id
     *            correlation id echoed back in the matching {@link ToolResult}
     * @param name
     *            registered tool name
     * @param input
     *            arguments keyed by parameter name
     */
    record ToolUse(String id, String name, Map<String, Object> input) implements ContentBlock {

        public ToolUse {
            input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
        }
    }

    /**
     * Outcome of a tool invocation, sent back to the LLM.
     *
     * @param toolUseId
     *            id of the {@link ToolUse} block this result answers
     * @param content
     *            tool output or error description
     * @param error
     *            whether the tool failed while executing
     */
    record ToolResult(String toolUseId, String content, boolean error) implements ContentBlock {

        public static ToolResult success(String toolUseId, String content) {
            return new ToolResult(toolUseId, content, false);
        }

        public static ToolResult failure(String toolUseId, String content) {
            return new ToolResult(toolUseId, content, true);
        }
    }
}
