/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.agentloop.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.victools.jsonschema.generator.MemberScope;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.generator.TypeScope;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.phonepe.agentloop.core.errors.AgentLoopException;
import com.phonepe.agentloop.core.errors.ErrorType;
import lombok.experimental.UtilityClass;

/**
 * Mapper construction, schema generation and serialization helpers
 */
@UtilityClass
public class JsonUtils {

    public static JsonMapper createMapper() {
        final var mapper = new JsonMapper();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);
        return mapper;
    }

    private static class JacksonTitleModule extends JacksonModule {
        @Override
        public void applyToConfigBuilder(SchemaGeneratorConfigBuilder builder) {
            super.applyToConfigBuilder(builder);

            builder.forTypesInGeneral().withDescriptionResolver(super::resolveDescriptionForType);
            builder.forFields().withDescriptionResolver(super::resolveDescription)
                    .withRequiredCheck(x -> true); //Tool arguments are always sent in full
            builder.forMethods().withDescriptionResolver(super::resolveDescription);
        }

        @Override
        protected String resolveDescription(MemberScope<?, ?> member) {
            return null;
        }

        @Override
        protected String resolveDescriptionForType(TypeScope scope) {
            return null;
        }
    }

    /**
     * Generates the input schema for a tool whose arguments bind to the given class
     *
     * @param clazz Argument class
     * @return Draft 2020-12 schema without the version indicator
     */
    public static JsonNode schema(final Class<?> clazz) {
        final var configBuilder = new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12,
                                                                   OptionPreset.PLAIN_JSON);
        final var config = configBuilder
                .without(Option.EXTRA_OPEN_API_FORMAT_VALUES)
                .without(Option.FLATTENED_ENUMS_FROM_TOSTRING)
                .without(Option.SCHEMA_VERSION_INDICATOR)
                .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT)
                .with(Option.STRICT_TYPE_INFO)
                .with(Option.INLINE_ALL_SCHEMAS)
                .with(new JacksonTitleModule())
                .build();
        return new SchemaGenerator(config).generateSchema(clazz);
    }

    /**
     * An object schema with no properties. Used for tools that take no arguments.
     */
    public static JsonNode emptyObjectSchema(final ObjectMapper mapper) {
        final var schema = mapper.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        schema.put("additionalProperties", false);
        return schema;
    }

    public static String toJson(final ObjectMapper mapper, final Object value) {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            throw new AgentLoopException(ErrorType.SERIALIZATION_ERROR, e, e.getOriginalMessage());
        }
    }
}
