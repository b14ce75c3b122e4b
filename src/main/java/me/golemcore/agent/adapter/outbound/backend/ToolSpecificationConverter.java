package me.golemcore.agent.adapter.outbound.backend;

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

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import me.golemcore.agent.domain.model.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * Maps {@link ToolDefinition} JSON Schemas onto langchain4j tool
 * specifications. Unknown parameter types fall back to string.
 */
final class ToolSpecificationConverter {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_DESCRIPTION = "description";

    private ToolSpecificationConverter() {
    }

    static List<ToolSpecification> convert(List<ToolDefinition> definitions) {
        return definitions.stream()
                .map(ToolSpecificationConverter::convert)
                .toList();
    }

    @SuppressWarnings("unchecked")
    static ToolSpecification convert(ToolDefinition definition) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(definition.getName())
                .description(definition.getDescription());

        Map<String, Object> schema = definition.getInputSchema();
        if (schema != null && schema.get(KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder parameters = JsonObjectSchema.builder();
            addProperties(parameters, (Map<String, Object>) properties);
            Object required = schema.get("required");
            if (required instanceof List<?> names && !names.isEmpty()) {
                parameters.required((List<String>) names);
            }
            builder.parameters(parameters.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static void addProperties(JsonObjectSchema.Builder builder, Map<String, Object> properties) {
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            if (entry.getValue() instanceof Map<?, ?> property) {
                builder.addProperty(entry.getKey(), toElement((Map<String, Object>) property));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static JsonSchemaElement toElement(Map<String, Object> property) {
        String description = property.get(KEY_DESCRIPTION) instanceof String text && !text.isBlank() ? text : null;

        if (property.get("enum") instanceof List<?> values && !values.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(values.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        String type = property.get("type") instanceof String value ? value : "string";
        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder array = JsonArraySchema.builder().description(description);
            if (property.get("items") instanceof Map<?, ?> items) {
                array.items(toElement((Map<String, Object>) items));
            }
            yield array.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder object = JsonObjectSchema.builder().description(description);
            if (property.get(KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                addProperties(object, (Map<String, Object>) nested);
            }
            yield object.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }
}
