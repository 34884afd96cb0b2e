package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public SystemPrompt systemPrompt(CourseQaProperties properties) {
        String location = properties.getPrompts().getSystemPrompt();
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("System prompt resource not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            return new SystemPrompt(new String(is.readAllBytes(), StandardCharsets.UTF_8).strip());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read system prompt: " + location, e);
        }
    }

    @Bean
    public ToolRoundExecutor toolRoundExecutor() {
        return new ToolRoundExecutor();
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolRoundExecutor toolRoundExecutor,
            SystemPrompt systemPrompt, CourseQaProperties properties) {
        return new DefaultToolLoopSystem(llmPort, toolRoundExecutor, systemPrompt,
                properties.getToolLoop().getMaxRounds());
    }
}
