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
import java.util.Optional;

/**
 * Response returned by the LLM provider. Content blocks are either text or
 * tool-use requests; the stop reason tells whether the model is done or waits
 * for tool output.
 */
@Data
@Builder
public class LlmResponse {

    @Builder.Default
    private StopReason stopReason = StopReason.TERMINAL;

    @Builder.Default
    private List<ContentBlock> content = new ArrayList<>();

    private String model;

    public boolean isToolUse() {
        return stopReason == StopReason.TOOL_USE;
    }

    /**
     * Returns the tool-use blocks in the order the model issued them.
     */
    public List<ContentBlock.ToolUse> getToolUses() {
        List<ContentBlock.ToolUse> toolUses = new ArrayList<>();
        if (content == null) {
            return toolUses;
        }
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.ToolUse toolUse) {
                toolUses.add(toolUse);
            }
        }
        return toolUses;
    }

    /**
     * Returns the text of the first text block, if any.
     */
    public Optional<String> getFirstText() {
        if (content == null) {
            return Optional.empty();
        }
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.Text text) {
                return Optional.ofNullable(text.text());
            }
        }
        return Optional.empty();
    }
}
