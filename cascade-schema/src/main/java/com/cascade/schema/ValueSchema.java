package com.cascade.schema;

import com.cascade.dom.json.DomJson;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Schema for a scalar. Range bounds apply to numbers, the pattern to strings (searched, not fully matched) and
 * allowed values compare case-insensitively against the value's text.
 */
public final class ValueSchema extends SchemaNode {

    private final ValueType type;
    private final BigDecimal minimum;
    private final BigDecimal maximum;
    private final Pattern pattern;
    private final List<String> allowedValues;
    private final boolean nullable;

    private ValueSchema(Builder builder) {
        super(builder.description, builder.defaultValue);
        this.type = builder.type;
        this.minimum = builder.minimum;
        this.maximum = builder.maximum;
        this.pattern = builder.pattern;
        this.allowedValues = List.copyOf(builder.allowedValues);
        this.nullable = builder.nullable;
    }

    @Override
    public SchemaKind getKind() {
        return SchemaKind.VALUE;
    }

    public ValueType getType() {
        return type;
    }

    public BigDecimal getMinimum() {
        return minimum;
    }

    public BigDecimal getMaximum() {
        return maximum;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<String> getAllowedValues() {
        return allowedValues;
    }

    public boolean isNullable() {
        return nullable;
    }

    public static Builder builder(ValueType type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final ValueType type;
        private BigDecimal minimum;
        private BigDecimal maximum;
        private Pattern pattern;
        private final List<String> allowedValues = new ArrayList<>();
        private boolean nullable;
        private String description;
        private JsonNode defaultValue;

        private Builder(ValueType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder min(Number minimum) {
            this.minimum = minimum == null ? null : new BigDecimal(minimum.toString());
            return this;
        }

        public Builder max(Number maximum) {
            this.maximum = maximum == null ? null : new BigDecimal(maximum.toString());
            return this;
        }

        public Builder range(Number minimum, Number maximum) {
            return min(minimum).max(maximum);
        }

        public Builder pattern(String regex) {
            this.pattern = regex == null ? null : Pattern.compile(regex);
            return this;
        }

        public Builder allowed(String... values) {
            return allowed(Arrays.asList(values));
        }

        public Builder allowed(List<String> values) {
            allowedValues.addAll(values);
            return this;
        }

        public Builder nullable() {
            this.nullable = true;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
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

        public ValueSchema build() {
            if (minimum != null && maximum != null && minimum.compareTo(maximum) > 0) {
                throw new IllegalArgumentException("Schema minimum " + minimum + " exceeds maximum " + maximum);
            }
            return new ValueSchema(this);
        }
    }
}
