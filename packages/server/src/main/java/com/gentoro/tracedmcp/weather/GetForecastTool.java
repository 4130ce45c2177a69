package com.gentoro.tracedmcp.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tracedmcp.tools.Tool;
import com.gentoro.tracedmcp.tools.ToolDescriptor;
import com.gentoro.tracedmcp.tools.ToolInvocation;
import com.gentoro.tracedmcp.tools.ToolSchema;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import java.util.List;
import java.util.Objects;

/**
 * {@code get_forecast(location, days)}: daily forecast. {@code days} defaults to 3, must be at
 * least 1, and anything above {@value #MAX_DAYS} is capped.
 */
public class GetForecastTool implements Tool {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(GetForecastTool.class);

  public static final String NAME = "get_forecast";
  public static final int DEFAULT_DAYS = 3;
  public static final int MAX_DAYS = 7;

  private static final ToolDescriptor DESCRIPTOR =
      ToolDescriptor.builder()
          .name(NAME)
          .description("Get weather forecast for the specified location and number of days")
          .inputSchema(
              ToolSchema.builder()
                  .type(ToolSchema.Type.OBJECT)
                  .additionalProperties(false)
                  .property(WeatherTools.locationProperty("City name for forecast"))
                  .property(
                      ToolSchema.builder()
                          .name("days")
                          .description("Number of days to forecast (1-7)")
                          .type(ToolSchema.Type.INTEGER)
                          .minimum(1)
                          .defaultValue(DEFAULT_DAYS)
                          .build())
                  .build())
          .outputSchema(
              ToolSchema.builder()
                  .type(ToolSchema.Type.OBJECT)
                  .description("Weather forecast for the specified days")
                  .property(
                      ToolSchema.builder()
                          .name("items")
                          .type(ToolSchema.Type.ARRAY)
                          .required(true)
                          .items(
                              ToolSchema.builder()
                                  .type(ToolSchema.Type.OBJECT)
                                  .property(GetWeatherTool.intField("day", "Day offset, from 1"))
                                  .property(GetWeatherTool.intField("high", "High in Celsius"))
                                  .property(GetWeatherTool.intField("low", "Low in Celsius"))
                                  .property(GetWeatherTool.stringField("condition"))
                                  .property(
                                      GetWeatherTool.intField(
                                          "precipitation_chance", "Chance of rain in percent"))
                                  .build())
                          .build())
                  .build())
          .build();

  private final WeatherDataSource dataSource;

  public GetForecastTool(WeatherDataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public JsonNode execute(ToolInvocation invocation) {
    String location = invocation.requireString("location").trim();
    long requested = invocation.longOrDefault("days", DEFAULT_DAYS);
    int days = (int) Math.max(1L, Math.min(requested, MAX_DAYS));
    invocation.attribute(WeatherTools.ATTR_LOCATION, location);
    invocation.attribute(WeatherTools.ATTR_DAYS, days);

    List<ForecastDay> items = dataSource.forecast(location, days);
    log.debug("Generated {}-day forecast for '{}'", items.size(), location);

    ObjectNode result = JacksonUtility.getJsonMapper().createObjectNode();
    result.set("items", JacksonUtility.getJsonMapper().valueToTree(items));
    return result;
  }
}
