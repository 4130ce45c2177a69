package com.gentoro.tracedmcp.weather;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ForecastDay(
    @JsonProperty("day") int day,
    @JsonProperty("high") int high,
    @JsonProperty("low") int low,
    @JsonProperty("condition") String condition,
    @JsonProperty("precipitation_chance") int precipitationChance) {}
