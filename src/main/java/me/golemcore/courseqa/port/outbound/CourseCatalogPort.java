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

import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.SearchResults;

import java.util.Optional;

/**
 * Port for the course retrieval backend: semantic search over lesson content
 * plus course and lesson metadata lookups.
 */
public interface CourseCatalogPort {

    /**
     * Searches course content.
     *
     * @param query
     *            what to search for
     * @param courseName
     *            optional course filter; partial names are resolved by the
     *            backend
     * @param lessonNumber
     *            optional lesson filter
     * @return matching chunks, an empty result, or a result carrying an error
     */
    SearchResults search(String query, String courseName, Integer lessonNumber);

    /**
     * Resolves a partial or fuzzy course name to the canonical course title.
     */
    Optional<String> resolveCourseName(String courseName);

    /**
     * Returns the link of a lesson, if the catalog stores one.
     */
    Optional<String> getLessonLink(String courseTitle, int lessonNumber);

    /**
     * Returns the stored outline of a course by its canonical title.
     */
    Optional<CourseOutline> getCourseOutline(String courseTitle);
}
