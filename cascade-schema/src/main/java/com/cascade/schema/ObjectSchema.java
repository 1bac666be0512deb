package com.cascade.schema;

import com.cascade.dom.json.DomJson;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema for an object node: named properties, each required or optional, plus an optional schema for keys that
 * are not declared (dictionary-style objects).
 */
public final class ObjectSchema extends SchemaNode {

    private final Map<String, SchemaProperty> properties;
    private final SchemaNode additionalProperties;

    private ObjectSchema(Builder builder) {
        super(builder.description, builder.defaultValue);
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.additionalProperties = builder.additionalProperties;
    }

    @Override
    public SchemaKind getKind() {
        return SchemaKind.OBJECT;
    }

    public Collection<SchemaProperty> getProperties() {
        return properties.values();
    }

    public SchemaProperty getProperty(String name) {
        return properties.get(name);
    }

    /** Schema applied to undeclared keys, or null when undeclared keys are unexpected. */
    public SchemaNode getAdditionalProperties() {
        return additionalProperties;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, SchemaProperty> properties = new LinkedHashMap<>();
        private SchemaNode additionalProperties;
        private String description;
        private JsonNode defaultValue;

        private Builder() {
        }

        public Builder required(String name, SchemaNode schema) {
            return property(new SchemaProperty(name, schema, true));
        }

        public Builder optional(String name, SchemaNode schema) {
            return property(new SchemaProperty(name, schema, false));
        }

        public Builder property(SchemaProperty property) {
            if (properties.putIfAbsent(property.name(), property) != null) {
                throw new IllegalArgumentException("Duplicate schema property: " + property.name());
            }
            return this;
        }

        public Builder additionalProperties(SchemaNode schema) {
            this.additionalProperties = schema;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder defaultValue(Object value) {
            this.defaultValue = value == null ? null : DomJson.mapper().valueToTree(value);
            return this;
        }

        public ObjectSchema build() {
            return new ObjectSchema(this);
        }
    }
}
