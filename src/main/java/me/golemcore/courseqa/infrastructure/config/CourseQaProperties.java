package me.golemcore.courseqa.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the course Q&A assistant, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code courseqa.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - generation backend (Anthropic via langchain4j)</li>
 * <li>{@link ToolLoopProperties} - tool round budget</li>
 * <li>{@link CatalogProperties} - retrieval service endpoint</li>
 * <li>{@link HistoryProperties} - conversation history retention</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link PromptsProperties} - system prompt resource</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "courseqa")
@Data
public class CourseQaProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private CatalogProperties catalog = new CatalogProperties();
    private HistoryProperties history = new HistoryProperties();
    private HttpProperties http = new HttpProperties();
    private PromptsProperties prompts = new PromptsProperties();

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String model = "claude-sonnet-4-20250514";
        private String baseUrl;
        private double temperature = 0.0;
        private int maxTokens = 800;
        private int timeoutSeconds = 60;
    }

    @Data
    public static class ToolLoopProperties {
        /**
         * Maximum number of tool execution rounds per query. The request after
         * the last round never offers tools.
         */
        private int maxRounds = 2;
    }

    @Data
    public static class CatalogProperties {
        private String url = "http://localhost:8000";
        private String apiKey;
        private int timeoutSeconds = 10;
        private int maxResults = 5;
    }

    @Data
    public static class HistoryProperties {
        private int maxExchanges = 2;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class PromptsProperties {
        private String systemPrompt = "prompts/system-prompt.md";
    }
}
