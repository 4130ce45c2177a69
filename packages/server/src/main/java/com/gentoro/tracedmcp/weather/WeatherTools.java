package com.gentoro.tracedmcp.weather;

import com.gentoro.tracedmcp.tools.ToolRegistry;
import com.gentoro.tracedmcp.tools.ToolSchema;

/** Registers the weather tools. */
public final class WeatherTools {
  public static final String ATTR_LOCATION = "weather.location";
  public static final String ATTR_DAYS = "weather.days";

  private WeatherTools() {}

  public static ToolRegistry registerAll(ToolRegistry registry, WeatherDataSource dataSource) {
    return registry
        .register(new GetWeatherTool(dataSource))
        .register(new GetForecastTool(dataSource));
  }

  static ToolSchema locationProperty(String description) {
    return ToolSchema.builder()
        .name("location")
        .description(description)
        .type(ToolSchema.Type.STRING)
        .minLength(1)
        .required(true)
        .build();
  }
}
