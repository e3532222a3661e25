package com.ospicorp.weatherapi.weather;

import com.ospicorp.weatherapi.error.ErrorKind;
import com.ospicorp.weatherapi.error.WeatherLookupException;
import com.ospicorp.weatherapi.forecast.ForecastClient;
import com.ospicorp.weatherapi.forecast.ForecastTransformer;
import com.ospicorp.weatherapi.forecast.WeatherDisplay;
import com.ospicorp.weatherapi.location.Coordinate;
import com.ospicorp.weatherapi.location.LocationResolver;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * One weather query: resolve the name, fetch the forecast, reshape it. The steps run
 * strictly in sequence; the query as a whole is bounded by {@code weather.query-timeout}.
 */
@Service
public class WeatherService {

  private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

  private final LocationResolver locationResolver;
  private final ForecastClient forecastClient;
  private final ForecastTransformer forecastTransformer;
  private final AsyncTaskExecutor queryExecutor;
  private final Duration queryTimeout;

  public WeatherService(LocationResolver locationResolver, ForecastClient forecastClient,
      ForecastTransformer forecastTransformer,
      @Qualifier("weatherQueryExecutor") AsyncTaskExecutor queryExecutor,
      @Value("${weather.query-timeout:20s}") Duration queryTimeout) {
    this.locationResolver = locationResolver;
    this.forecastClient = forecastClient;
    this.forecastTransformer = forecastTransformer;
    this.queryExecutor = queryExecutor;
    this.queryTimeout = queryTimeout;
  }

  public WeatherDisplay lookup(String city) {
    if (!StringUtils.hasText(city)) {
      throw new IllegalArgumentException("city must be provided");
    }

    Future<WeatherDisplay> query;
    try {
      query = queryExecutor.submit(() -> runQuery(city));
    } catch (TaskRejectedException ex) {
      throw new WeatherLookupException(ErrorKind.QUERY_REJECTED,
          "Weather lookup for '" + city + "' was not accepted by the query executor", ex);
    }
    try {
      return query.get(queryTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      query.cancel(true);
      throw new WeatherLookupException(ErrorKind.DEADLINE_EXCEEDED,
          "Weather lookup for '" + city + "' exceeded " + queryTimeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      query.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for weather lookup", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Weather lookup for '" + city + "' failed", cause);
    }
  }

  WeatherDisplay runQuery(String city) {
    Coordinate coordinate = locationResolver.resolve(city);
    byte[] rawForecast = forecastClient.fetchForecast(coordinate);
    if (log.isDebugEnabled()) {
      log.debug("Forecast body for '{}': {}", city, new String(rawForecast, StandardCharsets.UTF_8));
    }
    WeatherDisplay display = forecastTransformer.transform(city, rawForecast);
    log.info("Resolved weather for '{}' at {},{} with {} hourly entries", city,
        coordinate.latitude(), coordinate.longitude(), display.forecasts().size());
    return display;
  }
}
