package com.ospicorp.weatherapi.location;

import com.ospicorp.weatherapi.error.ErrorKind;
import com.ospicorp.weatherapi.error.WeatherLookupException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Free-text place search against the Open-Meteo geocoding endpoint. Only the first
 * (most relevant) candidate is ever requested.
 */
@Component
public class GeocodingClient {

  private static final Logger log = LoggerFactory.getLogger(GeocodingClient.class);

  private final RestTemplate restTemplate;
  private final String baseUrl;

  public GeocodingClient(RestTemplate restTemplate,
      @Value("${weather.geocoding.base-url:https://geocoding-api.open-meteo.com/v1/search}") String baseUrl) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl;
  }

  /**
   * @return the first candidate's coordinate, or empty when the service knows no such place
   */
  public Optional<Coordinate> search(String name) {
    String encoded = URLEncoder.encode(name, StandardCharsets.UTF_8);
    URI uri = URI.create(String.format("%s?name=%s&count=1&language=en&format=json", baseUrl, encoded));

    GeocodingResponse response;
    try {
      response = restTemplate.getForObject(uri, GeocodingResponse.class);
    } catch (RestClientResponseException ex) {
      throw new WeatherLookupException(ErrorKind.UPSTREAM_UNAVAILABLE,
          "Geocoding API answered " + ex.getStatusCode().value() + " for '" + name + "'", ex);
    } catch (ResourceAccessException ex) {
      throw new WeatherLookupException(ErrorKind.UPSTREAM_UNAVAILABLE,
          "Error making request to geocoding API: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE,
          "Error decoding geocoding response for '" + name + "'", ex);
    }

    if (response == null || response.results() == null || response.results().isEmpty()) {
      log.info("Geocoding returned no results for '{}'", name);
      return Optional.empty();
    }
    GeocodingResponse.Result first = response.results().get(0);
    if (first == null || first.latitude() == null || first.longitude() == null) {
      throw new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE,
          "Geocoding result for '" + name + "' has no coordinates");
    }
    return Optional.of(new Coordinate(first.latitude(), first.longitude()));
  }
}
