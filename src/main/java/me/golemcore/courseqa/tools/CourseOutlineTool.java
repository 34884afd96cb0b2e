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
import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.SourceCitation;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.port.outbound.CourseCatalogPort;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool returning the outline of a course: title, link, instructor and the
 * numbered lesson list.
 *
 * <p>
 * The course name may be partial; it is resolved to the canonical title
 * through {@link CourseCatalogPort#resolveCourseName}. Outlines are structural
 * answers and produce no source citations.
 */
@Slf4j
public class CourseOutlineTool implements CourseTool {

    public static final String NAME = "get_course_outline";

    private static final String PARAM_COURSE_NAME = "course_name";

    private final CourseCatalogPort catalog;

    public CourseOutlineTool(CourseCatalogPort catalog) {
        this.catalog = catalog;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the outline of a course: title, course link, instructor "
                        + "and the complete list of lessons with their numbers and titles")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COURSE_NAME, Map.of(
                                        "type", "string",
                                        "description",
                                        "Course title (partial matches work, e.g. 'MCP', 'Introduction')")),
                        "required", List.of(PARAM_COURSE_NAME)))
                .build();
    }

    @Override
    public String execute(Map<String, Object> parameters) {
        String courseName = ToolArguments.requireString(parameters, PARAM_COURSE_NAME);

        Optional<CourseOutline> outline = catalog.resolveCourseName(courseName)
                .flatMap(catalog::getCourseOutline);
        if (outline.isEmpty()) {
            log.debug("[Outline] No course matches '{}'", courseName);
            return "No course found matching '" + courseName + "'";
        }
        return formatOutline(outline.get());
    }

    private String formatOutline(CourseOutline outline) {
        StringBuilder sb = new StringBuilder();
        sb.append("Course: ").append(outline.getTitle()).append('\n');
        if (outline.getLink() != null && !outline.getLink().isBlank()) {
            sb.append("Course Link: ").append(outline.getLink()).append('\n');
        }
        if (outline.getInstructor() != null && !outline.getInstructor().isBlank()) {
            sb.append("Instructor: ").append(outline.getInstructor()).append('\n');
        }
        sb.append('\n');

        List<CourseOutline.Lesson> lessons = outline.getLessons() != null ? outline.getLessons() : List.of();
        for (CourseOutline.Lesson lesson : lessons) {
            sb.append("Lesson");
            if (lesson.getNumber() != null) {
                sb.append(' ').append(lesson.getNumber());
            }
            sb.append(": ").append(lesson.getTitle()).append('\n');
        }
        sb.append("Lessons: ").append(lessons.size()).append(" total");
        return sb.toString();
    }

    @Override
    public List<SourceCitation> getLastSources() {
        return List.of();
    }

    @Override
    public void resetSources() {
        // Outlines never record citations
    }
}
