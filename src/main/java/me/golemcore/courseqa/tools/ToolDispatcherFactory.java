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

import lombok.RequiredArgsConstructor;
import me.golemcore.courseqa.domain.service.ToolDispatcher;
import me.golemcore.courseqa.port.outbound.CourseCatalogPort;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link ToolDispatcher} with fresh tool instances. Tools record
 * citations in instance state, so each query gets its own set.
 */
@Component
@RequiredArgsConstructor
public class ToolDispatcherFactory {

    private final CourseCatalogPort catalog;

    public ToolDispatcher create() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        dispatcher.register(new CourseSearchTool(catalog));
        dispatcher.register(new CourseOutlineTool(catalog));
        return dispatcher;
    }
}
