package com.gentoro.tracedmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit, JSON-Schema-like description of a tool's input or output.
 *
 * <p>Supports the subset needed by the tools: primitive types, nested objects with required
 * properties, arrays, numeric bounds, a minimum string length and closed objects ({@code
 * additionalProperties: false}). {@link #validate(JsonNode)} checks a value against it; {@link
 * #toJsonSchema()} and {@link #toSchemaMap()} render it for {@code tools/list}.
 */
public final class ToolSchema {
  public enum Type {
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER,
    OBJECT,
    ARRAY;

    String jsonName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final ToolSchema items;
  private final List<ToolSchema> properties;
  private final Number minimum;
  private final Number maximum;
  private final Integer minLength;
  private final Object defaultValue;
  private final boolean additionalProperties;

  private ToolSchema(Builder b) {
    this.name = b.name;
    this.description = b.description;
    this.required = b.required;
    this.type = Objects.requireNonNull(b.type, "type");
    this.items = b.items;
    this.properties =
        b.properties == null ? Collections.emptyList() : List.copyOf(b.properties);
    this.minimum = b.minimum;
    this.maximum = b.maximum;
    this.minLength = b.minLength;
    this.defaultValue = b.defaultValue;
    this.additionalProperties = b.additionalProperties;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public ToolSchema getItems() {
    return items;
  }

  public List<ToolSchema> getProperties() {
    return properties;
  }

  public Object getDefaultValue() {
    return defaultValue;
  }

  /** Validate {@code value}; returns human readable violations, empty when valid. */
  public List<String> validate(JsonNode value) {
    List<String> violations = new ArrayList<>();
    validate(value, name == null ? "$" : name, violations);
    return violations;
  }

  private void validate(JsonNode value, String path, List<String> violations) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      violations.add(path + ": value is required");
      return;
    }
    switch (type) {
      case STRING -> {
        if (!value.isTextual()) {
          violations.add(path + ": expected string");
        } else if (minLength != null && value.asText().trim().length() < minLength) {
          violations.add(path + ": must contain at least " + minLength + " character(s)");
        }
      }
      case BOOLEAN -> {
        if (!value.isBoolean()) violations.add(path + ": expected boolean");
      }
      case INTEGER -> {
        if (!value.isIntegralNumber()
            && !(value.isNumber() && value.canConvertToExactIntegral())) {
          violations.add(path + ": expected integer");
        } else {
          checkBounds(value.asDouble(), path, violations);
        }
      }
      case NUMBER -> {
        if (!value.isNumber()) {
          violations.add(path + ": expected number");
        } else {
          checkBounds(value.asDouble(), path, violations);
        }
      }
      case ARRAY -> {
        if (!value.isArray()) {
          violations.add(path + ": expected array");
        } else if (items != null) {
          for (int i = 0; i < value.size(); i++) {
            items.validate(value.get(i), path + "[" + i + "]", violations);
          }
        }
      }
      case OBJECT -> validateObject(value, path, violations);
    }
  }

  private void validateObject(JsonNode value, String path, List<String> violations) {
    if (!value.isObject()) {
      violations.add(path + ": expected object");
      return;
    }
    for (ToolSchema property : properties) {
      JsonNode child = value.get(property.name);
      if (child == null || child.isNull()) {
        if (property.required) {
          violations.add(path + "." + property.name + ": required property is missing");
        }
        continue;
      }
      property.validate(child, path + "." + property.name, violations);
    }
    if (!additionalProperties) {
      Iterator<String> names = value.fieldNames();
      while (names.hasNext()) {
        String field = names.next();
        if (properties.stream().noneMatch(p -> p.name.equals(field))) {
          violations.add(path + "." + field + ": unknown property");
        }
      }
    }
  }

  private void checkBounds(double v, String path, List<String> violations) {
    if (minimum != null && v < minimum.doubleValue()) {
      violations.add(path + ": must be >= " + minimum);
    }
    if (maximum != null && v > maximum.doubleValue()) {
      violations.add(path + ": must be <= " + maximum);
    }
  }

  /** Render as a JSON Schema document, as advertised for tool outputs. */
  public Map<String, Object> toSchemaMap() {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("type", type.jsonName());
    if (description != null) node.put("description", description);
    if (minimum != null) node.put("minimum", minimum);
    if (maximum != null) node.put("maximum", maximum);
    if (minLength != null) node.put("minLength", minLength);
    if (defaultValue != null) node.put("default", defaultValue);
    if (type == Type.ARRAY && items != null) {
      node.put("items", items.toSchemaMap());
    }
    if (type == Type.OBJECT) {
      node.put("properties", propertyMap());
      List<String> required = requiredNames();
      if (!required.isEmpty()) node.put("required", required);
      node.put("additionalProperties", additionalProperties);
    }
    return node;
  }

  /** Render an object schema as the MCP {@code inputSchema} of a tool. */
  public McpSchema.JsonSchema toJsonSchema() {
    if (type != Type.OBJECT) {
      throw new IllegalStateException("Only object schemas describe tool input: " + type);
    }
    List<String> required = requiredNames();
    return new McpSchema.JsonSchema(
        type.jsonName(),
        propertyMap(),
        required.isEmpty() ? null : required,
        additionalProperties,
        null,
        null);
  }

  private Map<String, Object> propertyMap() {
    Map<String, Object> props = new LinkedHashMap<>();
    for (ToolSchema p : properties) {
      props.put(p.name, p.toSchemaMap());
    }
    return props;
  }

  private List<String> requiredNames() {
    List<String> required = new ArrayList<>();
    for (ToolSchema p : properties) {
      if (p.required) required.add(p.name);
    }
    return required;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String name;
    private String description;
    private boolean required;
    private Type type;
    private ToolSchema items;
    private List<ToolSchema> properties;
    private Number minimum;
    private Number maximum;
    private Integer minLength;
    private Object defaultValue;
    private boolean additionalProperties = true;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder items(ToolSchema items) {
      this.items = items;
      return this;
    }

    public Builder property(ToolSchema property) {
      if (this.properties == null) {
        this.properties = new ArrayList<>();
      }
      this.properties.add(property);
      return this;
    }

    public Builder minimum(Number minimum) {
      this.minimum = minimum;
      return this;
    }

    public Builder maximum(Number maximum) {
      this.maximum = maximum;
      return this;
    }

    public Builder minLength(int minLength) {
      this.minLength = minLength;
      return this;
    }

    public Builder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public Builder additionalProperties(boolean additionalProperties) {
      this.additionalProperties = additionalProperties;
      return this;
    }

    public ToolSchema build() {
      return new ToolSchema(this);
    }
  }
}
