package com.ospicorp.weatherapi.forecast;

import com.ospicorp.weatherapi.error.ErrorKind;
import com.ospicorp.weatherapi.error.WeatherLookupException;
import com.ospicorp.weatherapi.location.Coordinate;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

@Component
public class ForecastClient {

  private final RestTemplate restTemplate;
  private final String baseUrl;

  public ForecastClient(RestTemplate restTemplate,
      @Value("${weather.forecast.base-url:https://api.open-meteo.com/v1/forecast}") String baseUrl) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl;
  }

  /**
   * Requests the hourly 2m temperature series for a coordinate and returns the body
   * unparsed.
   */
  public byte[] fetchForecast(Coordinate coordinate) {
    URI uri = URI.create(String.format(Locale.ROOT,
        "%s?latitude=%.6f&longitude=%.6f&hourly=temperature_2m",
        baseUrl, coordinate.latitude(), coordinate.longitude()));
    try {
      return restTemplate.execute(uri, HttpMethod.GET, null, response -> {
        try {
          return StreamUtils.copyToByteArray(response.getBody());
        } catch (IOException ex) {
          throw new WeatherLookupException(ErrorKind.READ_ERROR,
              "Error reading forecast response body", ex);
        }
      });
    } catch (RestClientResponseException ex) {
      throw new WeatherLookupException(ErrorKind.UPSTREAM_UNAVAILABLE,
          "Forecast API answered " + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw new WeatherLookupException(ErrorKind.UPSTREAM_UNAVAILABLE,
          "Error making request to forecast API: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      throw new WeatherLookupException(ErrorKind.UPSTREAM_UNAVAILABLE,
          "Forecast request failed: " + ex.getMessage(), ex);
    }
  }
}
