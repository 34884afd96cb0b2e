package me.golemcore.courseqa.adapter.outbound.catalog;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.SearchResults;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.CourseCatalogException;
import me.golemcore.courseqa.port.outbound.CourseCatalogPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Course catalog adapter that talks to the retrieval service REST API over
 * HTTP.
 *
 * <p>
 * The retrieval service owns the vector store (embeddings, similarity search,
 * course metadata). This adapter only shapes requests and responses.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /search - Semantic search with optional course/lesson filters
 * <li>GET /courses/resolve?name= - Resolve a partial course name
 * <li>GET /courses/lesson-link?course=&amp;lesson= - Lesson link lookup
 * <li>GET /courses/outline?title= - Course outline
 * </ul>
 * A 404 means "not found" and maps to an empty result.
 *
 * <p>
 * Search never throws: transport and HTTP failures come back as a
 * {@link SearchResults} carrying a {@code "Search error: ..."} message, so the
 * LLM sees them as tool output. The metadata lookups throw
 * {@link CourseCatalogException} instead.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code courseqa.catalog.url} - Retrieval service base URL
 * <li>{@code courseqa.catalog.api-key} - Optional bearer token
 * <li>{@code courseqa.catalog.timeout-seconds} - HTTP call timeout
 * <li>{@code courseqa.catalog.max-results} - Search result limit
 * </ul>
 */
@Component
@Slf4j
public class HttpCourseCatalogAdapter implements CourseCatalogPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int HTTP_NOT_FOUND = 404;

    private final CourseQaProperties.CatalogProperties catalog;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpCourseCatalogAdapter(CourseQaProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.catalog = properties.getCatalog();
        this.objectMapper = objectMapper;

        // Dedicated client with catalog-specific timeout
        int timeoutSeconds = catalog.getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public SearchResults search(String query, String courseName, Integer lessonNumber) {
        try {
            String courseTitle = null;
            if (courseName != null) {
                Optional<String> resolved = resolveCourseName(courseName);
                if (resolved.isEmpty()) {
                    return SearchResults.empty("No course found matching '" + courseName + "'");
                }
                courseTitle = resolved.get();
            }

            String body = objectMapper.writeValueAsString(
                    new SearchRequest(query, courseTitle, lessonNumber, catalog.getMaxResults()));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint("search").build())
                    .post(RequestBody.create(body, JSON));
            addApiKeyHeader(requestBuilder);

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    log.warn("[Catalog] Search failed: HTTP {}", response.code());
                    return SearchResults.empty("Search error: HTTP " + response.code());
                }

                SearchResponse parsed = objectMapper.readValue(responseBody.string(), SearchResponse.class);
                SearchResults results = SearchResults.of(parsed.documents(), parsed.metadata(), parsed.distances());
                log.debug("[Catalog] Search '{}' returned {} hit(s)", query, results.size());
                return results;
            }
        } catch (IOException | CourseCatalogException | IllegalArgumentException e) {
            log.warn("[Catalog] Search error: {}", e.getMessage());
            return SearchResults.empty("Search error: " + e.getMessage());
        }
    }

    @Override
    public Optional<String> resolveCourseName(String courseName) {
        HttpUrl url = endpoint("courses/resolve")
                .addQueryParameter("name", courseName)
                .build();
        return getJson(url).flatMap(node -> textField(node, "title"));
    }

    @Override
    public Optional<String> getLessonLink(String courseTitle, int lessonNumber) {
        HttpUrl url = endpoint("courses/lesson-link")
                .addQueryParameter("course", courseTitle)
                .addQueryParameter("lesson", String.valueOf(lessonNumber))
                .build();
        return getJson(url).flatMap(node -> textField(node, "link"));
    }

    @Override
    public Optional<CourseOutline> getCourseOutline(String courseTitle) {
        HttpUrl url = endpoint("courses/outline")
                .addQueryParameter("title", courseTitle)
                .build();
        return getJson(url).map(node -> objectMapper.convertValue(node, CourseOutline.class));
    }

    private Optional<JsonNode> getJson(HttpUrl url) {
        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        addApiKeyHeader(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (response.code() == HTTP_NOT_FOUND) {
                return Optional.empty();
            }
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new CourseCatalogException(
                        "Catalog request failed: HTTP " + response.code() + " for " + url.encodedPath());
            }
            JsonNode node = objectMapper.readTree(responseBody.string());
            return node == null || node.isNull() ? Optional.empty() : Optional.of(node);
        } catch (IOException e) {
            throw new CourseCatalogException("Catalog request failed for " + url.encodedPath() + ": "
                    + e.getMessage(), e);
        }
    }

    private static Optional<String> textField(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? Optional.of(value.asText()) : Optional.empty();
    }

    private HttpUrl.Builder endpoint(String path) {
        HttpUrl base = HttpUrl.parse(catalog.getUrl());
        if (base == null) {
            throw new CourseCatalogException("Invalid catalog URL: " + catalog.getUrl());
        }
        return base.newBuilder().addPathSegments(path);
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = catalog.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    // Request/response DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SearchRequest(String query,
            @JsonProperty("course_title") String courseTitle,
            @JsonProperty("lesson_number") Integer lessonNumber,
            int limit) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<String> documents, List<Map<String, Object>> metadata, List<Double> distances) {
    }
}
