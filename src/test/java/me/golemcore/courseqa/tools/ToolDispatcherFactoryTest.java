package me.golemcore.courseqa.tools;

import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.service.ToolDispatcher;
import me.golemcore.courseqa.port.outbound.CourseCatalogPort;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.mockito.Mockito.mock;

class ToolDispatcherFactoryTest {

    private final ToolDispatcherFactory factory = new ToolDispatcherFactory(mock(CourseCatalogPort.class));

    @Test
    void shouldRegisterSearchThenOutline() {
        List<String> names = factory.create().getToolDefinitions().stream()
                .map(ToolDefinition::getName)
                .toList();

        assertEquals(List.of("search_course_content", "get_course_outline"), names);
    }

    @Test
    void shouldCreateIndependentDispatchers() {
        ToolDispatcher first = factory.create();
        ToolDispatcher second = factory.create();

        assertNotSame(first, second);
    }
}
