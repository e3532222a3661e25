package com.ospicorp.weatherapi.error;

public class WeatherLookupException extends RuntimeException {
  private final ErrorKind kind;

  public WeatherLookupException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public WeatherLookupException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
