package com.ospicorp.weatherapi.forecast;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

// latitude, longitude and timezone are part of the upstream payload but unused downstream
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastResponse(
    Double latitude,
    Double longitude,
    String timezone,
    Hourly hourly
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Hourly(
      List<String> time,
      @JsonProperty("temperature_2m") List<Double> temperature2m
  ) {}
}
