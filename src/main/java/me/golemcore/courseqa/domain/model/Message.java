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
 * A single conversation turn exchanged with the LLM. Content is an ordered list
 * of {@link ContentBlock}s so that an assistant turn can carry text and tool
 * requests together, and a user turn can carry several tool results at once.
 *
 * <p>
 * Messages live only for the duration of one query; nothing here is persisted.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role; // user, assistant

    @Builder.Default
    private List<ContentBlock> content = new ArrayList<>();

    /**
     * Creates a user message holding a single text block.
     */
    public static Message user(String text) {
        return Message.builder()
                .role(ROLE_USER)
                .content(List.of(new ContentBlock.Text(text)))
                .build();
    }

    /**
     * Creates an assistant message echoing the blocks the LLM returned.
     */
    public static Message assistant(List<ContentBlock> blocks) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .content(blocks != null ? List.copyOf(blocks) : List.of())
                .build();
    }

    /**
     * Creates the user message that returns tool results to the LLM.
     */
    public static Message toolResults(List<ContentBlock.ToolResult> results) {
        return Message.builder()
                .role(ROLE_USER)
                .content(List.copyOf(results))
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this message carries at least one tool result block.
     */
    public boolean hasToolResults() {
        return content != null && content.stream().anyMatch(ContentBlock.ToolResult.class::isInstance);
    }
}
