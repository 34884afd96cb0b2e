package me.golemcore.courseqa.adapter.outbound.history;

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
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.ConversationHistoryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Keeps conversation history in memory, bounded to the last
 * {@code courseqa.history.max-exchanges} exchanges per session. Lost on
 * restart.
 */
@Component
@Slf4j
public class InMemoryConversationHistoryAdapter implements ConversationHistoryPort {

    private static final String SESSION_PREFIX = "session_";

    private final int maxExchanges;
    private final Map<String, Deque<Exchange>> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger sessionCounter = new AtomicInteger();

    public InMemoryConversationHistoryAdapter(CourseQaProperties properties) {
        int configured = properties.getHistory().getMaxExchanges();
        if (configured < 0) {
            throw new IllegalArgumentException("courseqa.history.max-exchanges must not be negative: " + configured);
        }
        this.maxExchanges = configured;
    }

    @Override
    public String createSession() {
        String sessionId = SESSION_PREFIX + sessionCounter.incrementAndGet();
        sessions.put(sessionId, new ArrayDeque<>());
        log.debug("[History] Created {}", sessionId);
        return sessionId;
    }

    @Override
    public void addExchange(String sessionId, String userMessage, String assistantMessage) {
        Deque<Exchange> exchanges = sessions.computeIfAbsent(sessionId, id -> new ArrayDeque<>());
        synchronized (exchanges) {
            exchanges.addLast(new Exchange(userMessage, assistantMessage));
            while (exchanges.size() > maxExchanges) {
                exchanges.removeFirst();
            }
        }
    }

    @Override
    public Optional<String> getHistory(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Deque<Exchange> exchanges = sessions.get(sessionId);
        if (exchanges == null) {
            return Optional.empty();
        }
        synchronized (exchanges) {
            if (exchanges.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(exchanges.stream()
                    .map(Exchange::render)
                    .collect(Collectors.joining("\n")));
        }
    }

    @Override
    public void clearSession(String sessionId) {
        if (sessionId != null && sessions.remove(sessionId) != null) {
            log.debug("[History] Cleared {}", sessionId);
        }
    }

    private record Exchange(String user, String assistant) {

        String render() {
            return "User: " + user + "\nAssistant: " + assistant;
        }
    }
}
