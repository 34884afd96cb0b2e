package me.golemcore.courseqa.domain.model;

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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a semantic search over course content. The three lists are
 * parallel: entry {@code i} of each describes the same retrieved chunk.
 *
 * @param documents
 *            chunk texts, best match first
 * @param metadata
 *            per-chunk metadata ({@code course_title}, {@code lesson_number},
 *            ...)
 * @param distances
 *            similarity distances, lower is closer
 * @param error
 *            error reported by the retrieval backend, or {@code null}
 */
public record SearchResults(List<String> documents, List<Map<String, Object>> metadata, List<Double> distances,
        String error) {

    public SearchResults {
        documents = documents != null ? List.copyOf(documents) : List.of();
        metadata = metadata != null ? copyMetadata(metadata) : List.of();
        distances = distances != null ? List.copyOf(distances) : List.of();
        if (documents.size() != metadata.size() || documents.size() != distances.size()) {
            throw new IllegalArgumentException("Search result lists differ in length: documents="
                    + documents.size() + ", metadata=" + metadata.size() + ", distances=" + distances.size());
        }
    }

    public static SearchResults of(List<String> documents, List<Map<String, Object>> metadata,
            List<Double> distances) {
        return new SearchResults(documents, metadata, distances, null);
    }

    /**
     * Creates an empty result carrying an error message.
     */
    public static SearchResults empty(String error) {
        return new SearchResults(List.of(), List.of(), List.of(), error);
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    public boolean hasError() {
        return error != null;
    }

    public int size() {
        return documents.size();
    }

    // Metadata values may legitimately be null, which List.copyOf/Map.copyOf reject
    private static List<Map<String, Object>> copyMetadata(List<Map<String, Object>> metadata) {
        return metadata.stream()
                .map(m -> m != null ? Collections.unmodifiableMap(new HashMap<>(m)) : Map.<String, Object>of())
                .toList();
    }
}
