package com.ospicorp.weatherapi.forecast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.weatherapi.error.ErrorKind;
import com.ospicorp.weatherapi.error.WeatherLookupException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Turns a raw hourly forecast body into display entries. Temperatures are always
 * Celsius; the upstream unit metadata is not consulted.
 */
@Component
public class ForecastTransformer {

  /** Layout of upstream hourly time entries: minutes precision, no zone, no seconds. */
  public static final String UPSTREAM_TIME_LAYOUT = "uuuu-MM-dd'T'HH:mm";

  static final String TEMPERATURE_UNIT = "°C";

  private static final DateTimeFormatter UPSTREAM_TIME = DateTimeFormatter
      .ofPattern(UPSTREAM_TIME_LAYOUT, Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("EEE HH:mm", Locale.ENGLISH);

  private final ObjectMapper mapper;

  public ForecastTransformer(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public WeatherDisplay transform(String cityName, byte[] rawBody) {
    ForecastResponse.Hourly hourly = parseHourly(rawBody);
    List<String> times = hourly.time();
    List<Double> temperatures = hourly.temperature2m();

    if (temperatures.size() < times.size()) {
      throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE,
          "Forecast has " + times.size() + " time entries but only "
              + temperatures.size() + " temperatures");
    }

    List<DisplayForecastEntry> entries = new ArrayList<>(times.size());
    for (int i = 0; i < times.size(); i++) {
      LocalDateTime at = parseTime(times.get(i), i);
      Double temperature = temperatures.get(i);
      if (temperature == null) {
        throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE,
            "Forecast temperature at index " + i + " is null");
      }
      if (!Double.isFinite(temperature)) {
        throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE,
            "Forecast temperature at index " + i + " is not finite");
      }
      entries.add(new DisplayForecastEntry(LABEL.format(at), formatTemperature(temperature)));
    }
    return new WeatherDisplay(cityName, Collections.unmodifiableList(entries));
  }

  /** One decimal, half-up on the decimal representation, fixed Celsius suffix. */
  static String formatTemperature(double celsius) {
    return BigDecimal.valueOf(celsius).setScale(1, RoundingMode.HALF_UP).toPlainString()
        + TEMPERATURE_UNIT;
  }

  private ForecastResponse.Hourly parseHourly(byte[] rawBody) {
    if (rawBody == null || rawBody.length == 0) {
      throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE, "Forecast response body is empty");
    }
    ForecastResponse response;
    try {
      response = mapper.readValue(rawBody, ForecastResponse.class);
    } catch (IOException ex) {
      throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE,
          "Error decoding forecast response: " + ex.getMessage(), ex);
    }
    if (response == null || response.hourly() == null
        || response.hourly().time() == null || response.hourly().temperature2m() == null) {
      throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE,
          "Forecast response is missing hourly time/temperature_2m arrays");
    }
    return response.hourly();
  }

  private static LocalDateTime parseTime(String value, int index) {
    if (value == null) {
      throw new WeatherLookupException(ErrorKind.TIME_PARSE_ERROR,
          "Forecast time at index " + index + " is null");
    }
    try {
      return LocalDateTime.parse(value, UPSTREAM_TIME);
    } catch (DateTimeParseException ex) {
      throw new WeatherLookupException(ErrorKind.TIME_PARSE_ERROR,
          "Forecast time '" + value + "' at index " + index + " does not match "
              + UPSTREAM_TIME_LAYOUT, ex);
    }
  }
}
