package com.gentoro.tracedmcp.weather;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CurrentWeather(
    @JsonProperty("location") String location,
    @JsonProperty("temperature") int temperature,
    @JsonProperty("condition") String condition,
    @JsonProperty("humidity") int humidity,
    @JsonProperty("wind_speed") int windSpeed) {}
