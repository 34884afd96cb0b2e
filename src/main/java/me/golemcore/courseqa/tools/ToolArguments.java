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

import java.math.BigDecimal;
import java.util.Map;

/**
 * Coercion helpers for tool arguments decoded from LLM JSON. Numbers may arrive
 * as Integer, Long, Double or numeric strings depending on the provider.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireString(Map<String, Object> parameters, String name) {
        String value = optionalString(parameters, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value;
    }

    static String optionalString(Map<String, Object> parameters, String name) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        String str = value.toString();
        return str.isBlank() ? null : str;
    }

    static Integer optionalInteger(Map<String, Object> parameters, String name) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(name);
        if (value instanceof String str && str.isBlank()) {
            return null;
        }
        Integer number = toInteger(value);
        if (value != null && number == null) {
            throw new IllegalArgumentException("Parameter " + name + " must be an integer, got: " + value);
        }
        return number;
    }

    /**
     * Converts integral numbers and numeric strings within int range. Fractions,
     * overflowing values and non-numeric input yield {@code null}.
     */
    static Integer toInteger(Object value) {
        if (value instanceof Integer integer) {
            return integer;
        }
        if (!(value instanceof Number) && !(value instanceof String)) {
            return null;
        }
        try {
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }
}
