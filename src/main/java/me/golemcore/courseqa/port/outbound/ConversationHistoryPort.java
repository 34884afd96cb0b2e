package me.golemcore.courseqa.port.outbound;

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

import java.util.Optional;

/**
 * Port for conversation sessions. Keeps a bounded window of recent exchanges
 * per session and renders it as plain text for the system prompt.
 */
public interface ConversationHistoryPort {

    /**
     * Starts a new session and returns its id.
     */
    String createSession();

    /**
     * Records one question/answer exchange.
     */
    void addExchange(String sessionId, String userMessage, String assistantMessage);

    /**
     * Returns the formatted history of a session, or empty when the session is
     * unknown or has no exchanges yet.
     */
    Optional<String> getHistory(String sessionId);

    /**
     * Drops a session and its history.
     */
    void clearSession(String sessionId);
}
