package me.golemcore.analyst.domain.service;

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

import me.golemcore.analyst.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates tool arguments against the subset of JSON Schema used by tool
 * definitions: {@code type}, {@code properties}, {@code required},
 * {@code enum}, {@code minLength}, {@code pattern}, {@code minimum},
 * {@code maximum} and {@code additionalProperties}.
 */
@Component
public class ToolArgumentValidator {

    private static final String TYPE = "type";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";
    private static final String TYPE_NUMBER = "number";
    private static final String TYPE_BOOLEAN = "boolean";
    private static final String TYPE_OBJECT = "object";
    private static final String TYPE_ARRAY = "array";
    private static final String ADDITIONAL_PROPERTIES = "additionalProperties";

    /**
     * Returns human-readable violations, empty when the arguments are valid.
     */
    public List<String> validate(ToolDefinition definition, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        Map<String, Object> schema = definition != null ? definition.getInputSchema() : null;
        if (schema == null) {
            return violations;
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        Map<String, Object> properties = asMap(schema.get("properties"));
        for (String required : asStringList(schema.get("required"))) {
            if (args.get(required) == null) {
                violations.add("missing required argument '" + required + "'");
            }
        }

        if (Boolean.FALSE.equals(schema.get(ADDITIONAL_PROPERTIES))) {
            for (String key : args.keySet()) {
                if (!properties.containsKey(key)) {
                    violations.add("unexpected argument '" + key + "'");
                }
            }
        }

        for (Map.Entry<String, Object> entry : args.entrySet()) {
            Map<String, Object> propertySchema = asMap(properties.get(entry.getKey()));
            if (propertySchema.isEmpty() || entry.getValue() == null) {
                continue;
            }
            validateValue(entry.getKey(), entry.getValue(), propertySchema, violations);
        }
        return violations;
    }

    private void validateValue(String name, Object value, Map<String, Object> schema, List<String> violations) {
        String type = schema.get(TYPE) instanceof String t ? t : null;
        if (type != null && !matchesType(type, value)) {
            violations.add("argument '" + name + "' must be of type " + type);
            return;
        }

        List<Object> allowed = asList(schema.get("enum"));
        if (!allowed.isEmpty() && !allowed.contains(value)) {
            violations.add("argument '" + name + "' must be one of " + allowed);
        }

        if (value instanceof String text) {
            validateString(name, text, schema, violations);
        } else if (value instanceof Number number) {
            validateRange(name, number.doubleValue(), schema, violations);
        } else if (value instanceof Map<?, ?> map && schema.get(ADDITIONAL_PROPERTIES) instanceof Map<?, ?>) {
            Map<String, Object> valueSchema = asMap(schema.get(ADDITIONAL_PROPERTIES));
            for (Map.Entry<?, ?> nested : map.entrySet()) {
                if (nested.getValue() != null) {
                    validateValue(name + "." + nested.getKey(), nested.getValue(), valueSchema, violations);
                }
            }
        }
    }

    private void validateString(String name, String text, Map<String, Object> schema, List<String> violations) {
        if (schema.get("minLength") instanceof Number min && text.strip().length() < min.intValue()) {
            violations.add("argument '" + name + "' must not be shorter than " + min.intValue() + " characters");
        }
        if (schema.get("pattern") instanceof String regex) {
            try {
                if (!Pattern.compile(regex).matcher(text).find()) {
                    violations.add("argument '" + name + "' does not match " + regex);
                }
            } catch (PatternSyntaxException e) {
                violations.add("argument '" + name + "' has an invalid pattern in its schema");
            }
        }
    }

    private void validateRange(String name, double value, Map<String, Object> schema, List<String> violations) {
        if (schema.get("minimum") instanceof Number min && value < min.doubleValue()) {
            violations.add("argument '" + name + "' must be >= " + min);
        }
        if (schema.get("maximum") instanceof Number max && value > max.doubleValue()) {
            violations.add("argument '" + name + "' must be <= " + max);
        }
    }

    private boolean matchesType(String type, Object value) {
        return switch (type) {
        case TYPE_STRING -> value instanceof String;
        case TYPE_INTEGER -> value instanceof Number n && isWhole(n);
        case TYPE_NUMBER -> value instanceof Number;
        case TYPE_BOOLEAN -> value instanceof Boolean;
        case TYPE_OBJECT -> value instanceof Map;
        case TYPE_ARRAY -> value instanceof Collection;
        default -> true;
        };
    }

    private boolean isWhole(Number number) {
        double d = number.doubleValue();
        return !Double.isInfinite(d) && d == Math.rint(d);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return value instanceof List<?> list ? (List<Object>) list : List.of();
    }

    private static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        for (Object item : asList(value)) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
