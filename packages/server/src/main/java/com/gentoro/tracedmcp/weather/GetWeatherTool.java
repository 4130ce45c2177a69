package com.gentoro.tracedmcp.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tracedmcp.tools.Tool;
import com.gentoro.tracedmcp.tools.ToolDescriptor;
import com.gentoro.tracedmcp.tools.ToolInvocation;
import com.gentoro.tracedmcp.tools.ToolSchema;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import java.util.Objects;

/** {@code get_weather(location)}: current conditions for a city. */
public class GetWeatherTool implements Tool {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(GetWeatherTool.class);

  public static final String NAME = "get_weather";

  private static final ToolDescriptor DESCRIPTOR =
      ToolDescriptor.builder()
          .name(NAME)
          .description("Get current weather for a specified location")
          .inputSchema(
              ToolSchema.builder()
                  .type(ToolSchema.Type.OBJECT)
                  .additionalProperties(false)
                  .property(WeatherTools.locationProperty("City name to get weather for"))
                  .build())
          .outputSchema(
              ToolSchema.builder()
                  .type(ToolSchema.Type.OBJECT)
                  .description("Current weather information")
                  .property(stringField("location"))
                  .property(intField("temperature", "Temperature in degrees Celsius"))
                  .property(stringField("condition"))
                  .property(intField("humidity", "Relative humidity in percent"))
                  .property(intField("wind_speed", "Wind speed in km/h"))
                  .build())
          .build();

  private final WeatherDataSource dataSource;

  public GetWeatherTool(WeatherDataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public JsonNode execute(ToolInvocation invocation) {
    String location = invocation.requireString("location").trim();
    invocation.attribute(WeatherTools.ATTR_LOCATION, location);

    CurrentWeather weather = dataSource.current(location);
    log.debug("Generated weather for '{}': {}", location, weather);
    return JacksonUtility.getJsonMapper().valueToTree(weather);
  }

  static ToolSchema stringField(String name) {
    return ToolSchema.builder().name(name).type(ToolSchema.Type.STRING).required(true).build();
  }

  static ToolSchema intField(String name, String description) {
    return ToolSchema.builder()
        .name(name)
        .description(description)
        .type(ToolSchema.Type.INTEGER)
        .required(true)
        .build();
  }
}
