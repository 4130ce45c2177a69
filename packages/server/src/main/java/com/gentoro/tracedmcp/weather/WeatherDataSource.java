package com.gentoro.tracedmcp.weather;

import java.util.List;

/** Where weather readings come from. Implementations may throw on lookup failures. */
public interface WeatherDataSource {
  CurrentWeather current(String location);

  /** One entry per day, starting at day 1. {@code days} is already within [1, 7]. */
  List<ForecastDay> forecast(String location, int days);
}
