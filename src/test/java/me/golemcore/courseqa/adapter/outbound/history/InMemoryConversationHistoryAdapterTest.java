package me.golemcore.courseqa.adapter.outbound.history;

import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryConversationHistoryAdapterTest {

    private CourseQaProperties properties;
    private InMemoryConversationHistoryAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new CourseQaProperties();
        adapter = new InMemoryConversationHistoryAdapter(properties);
    }

    @Test
    void shouldCreateSequentialSessionIds() {
        assertEquals("session_1", adapter.createSession());
        assertEquals("session_2", adapter.createSession());
    }

    @Test
    void shouldHaveNoHistoryForNewOrUnknownSession() {
        String session = adapter.createSession();

        assertEquals(Optional.empty(), adapter.getHistory(session));
        assertEquals(Optional.empty(), adapter.getHistory("session_99"));
        assertEquals(Optional.empty(), adapter.getHistory(null));
    }

    @Test
    void shouldRenderExchanges() {
        String session = adapter.createSession();
        adapter.addExchange(session, "What is MCP?", "A protocol.");
        adapter.addExchange(session, "Who teaches it?", "Jane Doe.");

        assertEquals(Optional.of("User: What is MCP?\nAssistant: A protocol.\n"
                + "User: Who teaches it?\nAssistant: Jane Doe."), adapter.getHistory(session));
    }

    @Test
    void shouldKeepOnlyLatestExchanges() {
        String session = adapter.createSession();
        adapter.addExchange(session, "q1", "a1");
        adapter.addExchange(session, "q2", "a2");
        adapter.addExchange(session, "q3", "a3");

        String history = adapter.getHistory(session).orElseThrow();

        assertEquals("User: q2\nAssistant: a2\nUser: q3\nAssistant: a3", history);
    }

    @Test
    void shouldHonourConfiguredLimit() {
        properties.getHistory().setMaxExchanges(1);
        InMemoryConversationHistoryAdapter single = new InMemoryConversationHistoryAdapter(properties);
        String session = single.createSession();
        single.addExchange(session, "q1", "a1");
        single.addExchange(session, "q2", "a2");

        assertEquals(Optional.of("User: q2\nAssistant: a2"), single.getHistory(session));
    }

    @Test
    void shouldRejectNegativeLimit() {
        properties.getHistory().setMaxExchanges(-1);

        assertThrows(IllegalArgumentException.class, () -> new InMemoryConversationHistoryAdapter(properties));
    }

    @Test
    void shouldAcceptExchangesForUncreatedSession() {
        adapter.addExchange("external", "q", "a");

        assertEquals(Optional.of("User: q\nAssistant: a"), adapter.getHistory("external"));
    }

    @Test
    void shouldIsolateAndClearSessions() {
        String first = adapter.createSession();
        String second = adapter.createSession();
        adapter.addExchange(first, "q", "a");

        assertNotEquals(first, second);
        assertTrue(adapter.getHistory(second).isEmpty());

        adapter.clearSession(first);

        assertTrue(adapter.getHistory(first).isEmpty());
    }
}
