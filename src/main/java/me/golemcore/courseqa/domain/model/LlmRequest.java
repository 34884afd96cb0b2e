package me.golemcore.courseqa.domain.model;

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
 * Request sent to the LLM provider: system prompt, conversation so far, and the
 * tools the model may call on this particular request.
 */
@Data
@Builder
public class LlmRequest {

    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    /**
     * Tool choice mode. Only meaningful when {@link #tools} is non-empty.
     */
    @Builder.Default
    private ToolChoice toolChoice = ToolChoice.NONE;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }

    public enum ToolChoice {
        /** Tools are not offered on this request. */
        NONE,
        /** The model decides whether to call a tool. */
        AUTO
    }
}
