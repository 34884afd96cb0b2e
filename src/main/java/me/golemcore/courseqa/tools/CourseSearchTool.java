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

package me.golemcore.courseqa.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.component.CourseTool;
import me.golemcore.courseqa.domain.model.SearchResults;
import me.golemcore.courseqa.domain.model.SourceCitation;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.port.outbound.CourseCatalogException;
import me.golemcore.courseqa.port.outbound.CourseCatalogPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tool for semantic search over course content.
 *
 * <p>
 * Delegates to {@link CourseCatalogPort#search} with optional course and lesson
 * filters, then renders every hit as a {@code [Course - Lesson N]} header
 * followed by the chunk text. Each rendered hit is also recorded as a
 * {@link SourceCitation}.
 *
 * <p>
 * Search exceptions are not caught here; the tool loop reports them to the LLM
 * as an error result. A failed lesson link lookup only drops that citation's
 * url.
 */
@Slf4j
public class CourseSearchTool implements CourseTool {

    public static final String NAME = "search_course_content";

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COURSE_NAME = "course_name";
    private static final String PARAM_LESSON_NUMBER = "lesson_number";
    private static final String UNKNOWN_COURSE = "unknown";

    private final CourseCatalogPort catalog;
    private final List<SourceCitation> lastSources = new ArrayList<>();

    public CourseSearchTool(CourseCatalogPort catalog) {
        this.catalog = catalog;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search course materials with smart course name matching and lesson filtering")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "What to search for in the course content"),
                                PARAM_COURSE_NAME, Map.of(
                                        "type", "string",
                                        "description",
                                        "Course title (partial matches work, e.g. 'MCP', 'Introduction')"),
                                PARAM_LESSON_NUMBER, Map.of(
                                        "type", "integer",
                                        "description", "Specific lesson number to search within (e.g. 1, 2, 3)")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public String execute(Map<String, Object> parameters) {
        lastSources.clear();

        String query = ToolArguments.requireString(parameters, PARAM_QUERY);
        String courseName = ToolArguments.optionalString(parameters, PARAM_COURSE_NAME);
        Integer lessonNumber = ToolArguments.optionalInteger(parameters, PARAM_LESSON_NUMBER);

        log.debug("[Search] query='{}', course={}, lesson={}", query, courseName, lessonNumber);
        SearchResults results = catalog.search(query, courseName, lessonNumber);

        if (results.hasError()) {
            return results.error();
        }

        if (results.isEmpty()) {
            StringBuilder sb = new StringBuilder("No relevant content found");
            if (courseName != null) {
                sb.append(" in course '").append(courseName).append('\'');
            }
            if (lessonNumber != null) {
                sb.append(" in lesson ").append(lessonNumber);
            }
            return sb.append('.').toString();
        }

        return formatResults(results);
    }

    private String formatResults(SearchResults results) {
        List<String> formatted = new ArrayList<>(results.size());
        List<SourceCitation> sources = new ArrayList<>(results.size());

        for (int i = 0; i < results.size(); i++) {
            String document = results.documents().get(i);
            Map<String, Object> meta = results.metadata().get(i);

            Object rawTitle = meta.get("course_title");
            String courseTitle = rawTitle != null ? rawTitle.toString() : UNKNOWN_COURSE;
            Integer lessonNumber = ToolArguments.toInteger(meta.get("lesson_number"));

            String label = lessonNumber != null ? courseTitle + " - Lesson " + lessonNumber : courseTitle;
            String url = rawTitle != null && lessonNumber != null ? lessonLink(courseTitle, lessonNumber) : null;

            sources.add(new SourceCitation(label, url));
            formatted.add("[" + label + "]\n" + document);
        }

        lastSources.addAll(sources);
        return String.join("\n\n", formatted);
    }

    private String lessonLink(String courseTitle, int lessonNumber) {
        try {
            return catalog.getLessonLink(courseTitle, lessonNumber).orElse(null);
        } catch (CourseCatalogException e) {
            log.warn("[Search] Lesson link lookup failed for '{}' lesson {}: {}", courseTitle, lessonNumber,
                    e.getMessage());
            return null;
        }
    }

    @Override
    public List<SourceCitation> getLastSources() {
        return List.copyOf(lastSources);
    }

    @Override
    public void resetSources() {
        lastSources.clear();
    }
}
