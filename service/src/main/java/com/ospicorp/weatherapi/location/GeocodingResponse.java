package com.ospicorp.weatherapi.location;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GeocodingResponse(List<Result> results) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(Double latitude, Double longitude) {}
}
