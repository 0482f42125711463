package me.golemcore.codeshell.domain.system.toolloop;

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

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema that tool
 * definitions use: {@code type}, {@code properties}, {@code required},
 * {@code enum}, {@code items} and {@code additionalProperties=false}.
 */
@Component
public class ToolSchemaValidator {

    /**
     * @return human-readable violations, empty when the arguments are valid
     */
    public List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> errors = new ArrayList<>();
        if (arguments == null) {
            errors.add("arguments must be an object");
            return errors;
        }
        if (schema == null || schema.isEmpty()) {
            return errors;
        }
        validateObject("", schema, arguments, errors);
        return errors;
    }

    @SuppressWarnings("unchecked")
    private void validateObject(String path, Map<String, Object> schema, Map<String, Object> value,
            List<String> errors) {
        Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> props
                ? (Map<String, Object>) props
                : Map.of();

        Object required = schema.get("required");
        if (required instanceof Collection<?> names) {
            for (Object name : names) {
                Object present = value.get(String.valueOf(name));
                if (present == null) {
                    errors.add("missing required field '" + path + name + "'");
                }
            }
        }

        if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
            for (String key : value.keySet()) {
                if (!properties.containsKey(key)) {
                    errors.add("unexpected field '" + path + key + "'");
                }
            }
        }

        for (Map.Entry<String, Object> entry : value.entrySet()) {
            Object fieldSchema = properties.get(entry.getKey());
            if (fieldSchema instanceof Map<?, ?> map && entry.getValue() != null) {
                validateValue(path + entry.getKey(), (Map<String, Object>) map, entry.getValue(), errors);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void validateValue(String path, Map<String, Object> schema, Object value, List<String> errors) {
        Object type = schema.get("type");
        if (type instanceof String expected && !matchesType(expected, value)) {
            errors.add("field '" + path + "' must be " + expected + " but was " + describe(value));
            return;
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof Collection<?> options && !options.contains(value)) {
            errors.add("field '" + path + "' must be one of " + options + " but was '" + value + "'");
        }

        if (value instanceof Map<?, ?> nested && schema.containsKey("properties")) {
            validateObject(path + ".", schema, (Map<String, Object>) nested, errors);
        }

        if (value instanceof List<?> list && schema.get("items") instanceof Map<?, ?> itemSchema) {
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                if (item != null) {
                    validateValue(path + "[" + i + "]", (Map<String, Object>) itemSchema, item, errors);
                }
            }
        }
    }

    private boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "integer" -> isInteger(value);
        case "number" -> value instanceof Number;
        case "object" -> value instanceof Map;
        case "array" -> value instanceof List;
        default -> true;
        };
    }

    private boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private String describe(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof List) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }
}
