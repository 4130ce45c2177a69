package com.gentoro.tracedmcp.tools;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolSchemaTest {
  private static final ToolSchema FORECAST_INPUT =
      ToolSchema.builder()
          .type(ToolSchema.Type.OBJECT)
          .additionalProperties(false)
          .property(
              ToolSchema.builder()
                  .name("location")
                  .type(ToolSchema.Type.STRING)
                  .minLength(1)
                  .required(true)
                  .build())
          .property(
              ToolSchema.builder()
                  .name("days")
                  .type(ToolSchema.Type.INTEGER)
                  .minimum(1)
                  .defaultValue(3)
                  .build())
          .property(
              ToolSchema.builder()
                  .name("tags")
                  .type(ToolSchema.Type.ARRAY)
                  .items(ToolSchema.builder().type(ToolSchema.Type.STRING).build())
                  .build())
          .build();

  private static JsonNode json(String text) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(text);
  }

  @Test
  void acceptsValidArguments() throws Exception {
    assertEquals(List.of(), FORECAST_INPUT.validate(json("{\"location\":\"Paris\"}")));
    assertEquals(
        List.of(),
        FORECAST_INPUT.validate(json("{\"location\":\"Paris\",\"days\":5,\"tags\":[\"a\"]}")));
    assertEquals(List.of(), FORECAST_INPUT.validate(json("{\"location\":\"Oslo\",\"days\":2.0}")));
  }

  @Test
  void reportsEveryViolation() throws Exception {
    List<String> violations =
        FORECAST_INPUT.validate(json("{\"days\":0,\"tags\":[1],\"unit\":\"C\"}"));

    assertEquals(4, violations.size(), violations.toString());
    assertTrue(violations.contains("$.location: required property is missing"));
    assertTrue(violations.contains("$.days: must be >= 1"));
    assertTrue(violations.contains("$.tags[0]: expected string"));
    assertTrue(violations.contains("$.unit: unknown property"));
  }

  @Test
  void checksTypes() throws Exception {
    assertEquals(
        List.of("$.days: expected integer"),
        FORECAST_INPUT.validate(json("{\"location\":\"Rome\",\"days\":\"three\"}")));
    assertEquals(
        List.of("$.location: must contain at least 1 character(s)"),
        FORECAST_INPUT.validate(json("{\"location\":\"  \"}")));
    assertEquals(List.of("$: expected object"), FORECAST_INPUT.validate(json("[]")));
    assertEquals(List.of("$: value is required"), FORECAST_INPUT.validate(null));
  }

  @Test
  void rendersToolInputSchema() {
    McpSchema.JsonSchema schema = FORECAST_INPUT.toJsonSchema();

    assertEquals("object", schema.type());
    assertEquals(false, schema.additionalProperties());
    assertEquals(List.of("location"), schema.required());
    JsonNode days = JacksonUtility.getJsonMapper().valueToTree(schema.properties().get("days"));
    assertEquals("integer", days.get("type").asText());
    assertEquals(1, days.get("minimum").asInt());
    assertEquals(3, days.get("default").asInt());
    JsonNode tags = JacksonUtility.getJsonMapper().valueToTree(schema.properties().get("tags"));
    assertEquals("string", tags.get("items").get("type").asText());
  }

  @Test
  void rendersSchemaMap() {
    Map<String, Object> schema = FORECAST_INPUT.toSchemaMap();

    assertEquals("object", schema.get("type"));
    assertEquals(false, schema.get("additionalProperties"));
    assertEquals(List.of("location"), schema.get("required"));
  }

  @Test
  void onlyObjectSchemasDescribeToolInput() {
    ToolSchema text = ToolSchema.builder().type(ToolSchema.Type.STRING).build();

    assertThrows(IllegalStateException.class, text::toJsonSchema);
  }
}
