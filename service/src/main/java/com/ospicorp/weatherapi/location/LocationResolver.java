package com.ospicorp.weatherapi.location;

import com.ospicorp.weatherapi.error.ErrorKind;
import com.ospicorp.weatherapi.error.WeatherLookupException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Resolves place names to coordinates. The cities table acts as a permanent cache in
 * front of the geocoder: hits are served from the table, misses go to the geocoder and
 * the answer is written back.
 */
@Service
public class LocationResolver {

  private static final Logger log = LoggerFactory.getLogger(LocationResolver.class);

  private final CityDao cityDao;
  private final GeocodingClient geocodingClient;
  private final boolean failOnWriteError;

  public LocationResolver(CityDao cityDao, GeocodingClient geocodingClient,
      @Value("${weather.location.fail-on-write-error:true}") boolean failOnWriteError) {
    this.cityDao = cityDao;
    this.geocodingClient = geocodingClient;
    this.failOnWriteError = failOnWriteError;
  }

  public Coordinate resolve(String name) {
    Optional<Coordinate> cached = lookupCached(name);
    if (cached.isPresent()) {
      log.debug("City cache hit for '{}'", name);
      return cached.get();
    }

    log.debug("City cache miss for '{}', asking geocoder", name);
    Coordinate coordinate = geocodingClient.search(name)
        .orElseThrow(() -> new WeatherLookupException(ErrorKind.NOT_FOUND,
            "No location found for '" + name + "'"));

    writeBack(new NamedLocation(name, coordinate));
    return coordinate;
  }

  private Optional<Coordinate> lookupCached(String name) {
    try {
      return cityDao.findByName(name);
    } catch (DataAccessException ex) {
      throw new WeatherLookupException(ErrorKind.STORE_READ_ERROR,
          "Failed to read cached location for '" + name + "'", ex);
    }
  }

  private void writeBack(NamedLocation location) {
    try {
      if (cityDao.insertIfAbsent(location)) {
        log.info("Cached location '{}' at {},{}", location.name(),
            location.coordinate().latitude(), location.coordinate().longitude());
      } else {
        log.debug("Location '{}' was cached concurrently; keeping existing row", location.name());
      }
    } catch (DataAccessException ex) {
      if (failOnWriteError) {
        throw new WeatherLookupException(ErrorKind.STORE_WRITE_ERROR,
            "Failed to cache location for '" + location.name() + "'", ex);
      }
      log.warn("Failed to cache location for '{}', serving uncached result: {}",
          location.name(), ex.getMessage());
    }
  }
}
