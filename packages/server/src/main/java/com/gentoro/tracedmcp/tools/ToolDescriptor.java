package com.gentoro.tracedmcp.tools;

import io.modelcontextprotocol.spec.McpSchema;
import java.util.Objects;

/**
 * Name, description and input/output schemas of a tool. The input schema validates calls; {@link
 * #definition()} is the MCP form advertised by {@code tools/list}.
 */
public final class ToolDescriptor {
  private final String name;
  private final String description;
  private final ToolSchema inputSchema;
  private final ToolSchema outputSchema;

  public ToolDescriptor(
      String name, String description, ToolSchema inputSchema, ToolSchema outputSchema) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = Objects.requireNonNull(description, "description");
    this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema");
    this.outputSchema = outputSchema; // may be null
    if (inputSchema.getType() != ToolSchema.Type.OBJECT) {
      throw new IllegalArgumentException("Tool input schema must be an object: " + name);
    }
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public ToolSchema inputSchema() {
    return inputSchema;
  }

  public ToolSchema outputSchema() {
    return outputSchema;
  }

  public McpSchema.Tool definition() {
    McpSchema.Tool.Builder tool =
        McpSchema.Tool.builder()
            .name(name)
            .description(description)
            .inputSchema(inputSchema.toJsonSchema());
    if (outputSchema != null) tool.outputSchema(outputSchema.toSchemaMap());
    return tool.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private ToolSchema inputSchema;
    private ToolSchema outputSchema;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder inputSchema(ToolSchema inputSchema) {
      this.inputSchema = inputSchema;
      return this;
    }

    public Builder outputSchema(ToolSchema outputSchema) {
      this.outputSchema = outputSchema;
      return this;
    }

    public ToolDescriptor build() {
      return new ToolDescriptor(name, description, inputSchema, outputSchema);
    }
  }
}
