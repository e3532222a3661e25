package com.ospicorp.weatherapi.weather;

import com.ospicorp.weatherapi.forecast.WeatherDisplay;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@Tag(name = "Weather")
public class WeatherController {

  private final WeatherService weatherService;

  public WeatherController(WeatherService weatherService) {
    this.weatherService = weatherService;
  }

  @GetMapping("/weather")
  @Operation(summary = "Hourly forecast for a place",
      description = "Resolves the place name (cached geocoding) and returns its hourly temperature forecast.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = WeatherDisplay.class))),
      @ApiResponse(responseCode = "400", description = "Missing or blank city",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown place",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "502", description = "Upstream failure or unexpected upstream payload",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "City cache unavailable or query not accepted",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "504", description = "Lookup deadline exceeded",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public WeatherDisplay weather(@RequestParam @NotBlank
      @Parameter(description = "Free-text place name", example = "Paris") String city) {
    return weatherService.lookup(city);
  }
}
