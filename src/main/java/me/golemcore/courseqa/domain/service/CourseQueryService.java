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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.QueryAnswer;
import me.golemcore.courseqa.domain.model.SourceCitation;
import me.golemcore.courseqa.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.courseqa.port.outbound.ConversationHistoryPort;
import me.golemcore.courseqa.tools.ToolDispatcherFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers course questions: wraps the question in the query prompt, loads the
 * session history, runs the tool loop with a dispatcher owned by this query,
 * then collects the citations and records the exchange.
 *
 * <p>
 * LLM failures propagate to the caller; nothing is recorded for a failed query.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourseQueryService {

    static final String QUERY_PROMPT = "Answer this question about course materials: ";

    private final ToolLoopSystem toolLoopSystem;
    private final ToolDispatcherFactory dispatcherFactory;
    private final ConversationHistoryPort historyPort;

    /**
     * Starts a conversation whose exchanges are fed back as history.
     */
    public String startSession() {
        return historyPort.createSession();
    }

    public void endSession(String sessionId) {
        historyPort.clearSession(sessionId);
    }

    /**
     * Answers one question.
     *
     * @param question
     *            the user's question
     * @param sessionId
     *            conversation to read history from and record into, or
     *            {@code null} for a one-off question
     */
    public QueryAnswer query(String question, String sessionId) {
        String history = sessionId != null ? historyPort.getHistory(sessionId).orElse(null) : null;
        ToolDispatcher dispatcher = dispatcherFactory.create();

        log.debug("[Query] session={}, history={}", sessionId, history != null);
        String answer = toolLoopSystem.generate(QUERY_PROMPT + question, history,
                dispatcher.getToolDefinitions(), dispatcher);

        List<SourceCitation> sources = dispatcher.getLastSources();
        dispatcher.resetSources();

        if (sessionId != null) {
            historyPort.addExchange(sessionId, question, answer);
        }
        log.debug("[Query] answered with {} source(s)", sources.size());
        return new QueryAnswer(answer, sources);
    }
}
