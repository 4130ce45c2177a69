package com.gentoro.tracedmcp.weather;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/** Simulated readings, uniformly drawn from fixed plausible ranges. */
public class RandomWeatherDataSource implements WeatherDataSource {
  static final List<String> CURRENT_CONDITIONS =
      List.of("Sunny", "Cloudy", "Rainy", "Partly Cloudy");
  static final List<String> FORECAST_CONDITIONS = List.of("Sunny", "Cloudy", "Rainy", "Stormy");

  private final Supplier<Random> random;

  public RandomWeatherDataSource() {
    this(ThreadLocalRandom::current);
  }

  public RandomWeatherDataSource(Supplier<Random> random) {
    this.random = random;
  }

  @Override
  public CurrentWeather current(String location) {
    Random rnd = random.get();
    return new CurrentWeather(
        location,
        between(rnd, 15, 30),
        pick(rnd, CURRENT_CONDITIONS),
        between(rnd, 40, 80),
        between(rnd, 5, 25));
  }

  @Override
  public List<ForecastDay> forecast(String location, int days) {
    Random rnd = random.get();
    List<ForecastDay> items = new ArrayList<>(days);
    for (int day = 1; day <= days; day++) {
      items.add(
          new ForecastDay(
              day,
              between(rnd, 20, 35),
              between(rnd, 10, 20),
              pick(rnd, FORECAST_CONDITIONS),
              between(rnd, 0, 100)));
    }
    return items;
  }

  // inclusive on both ends
  private static int between(Random rnd, int min, int max) {
    return min + rnd.nextInt(max - min + 1);
  }

  private static String pick(Random rnd, List<String> values) {
    return values.get(rnd.nextInt(values.size()));
  }
}
