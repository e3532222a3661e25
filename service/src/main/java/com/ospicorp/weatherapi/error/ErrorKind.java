package com.ospicorp.weatherapi.error;

import java.util.Locale;

/**
 * Failure categories a weather lookup can end in. Callers branch on these values;
 * the web layer maps each one to an HTTP status.
 */
public enum ErrorKind {
  /** The geocoder returned no candidates for the requested name. */
  NOT_FOUND,
  /** Transport failure or non-2xx answer from an upstream service. */
  UPSTREAM_UNAVAILABLE,
  /** The forecast body could not be read to the end. */
  READ_ERROR,
  /** An upstream body does not match the expected schema. */
  MALFORMED_RESPONSE,
  /** A forecast time entry does not follow the expected layout. */
  TIME_PARSE_ERROR,
  /** The cities lookup itself failed; distinct from a cache miss. */
  STORE_READ_ERROR,
  /**
   * Write-back of a freshly geocoded location failed. Aborts the resolution unless
   * {@code weather.location.fail-on-write-error} is false.
   */
  STORE_WRITE_ERROR,
  /** The query did not complete within the configured deadline. */
  DEADLINE_EXCEEDED,
  /** The query executor refused the query, e.g. while shutting down. */
  QUERY_REJECTED;

  public String slug() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
