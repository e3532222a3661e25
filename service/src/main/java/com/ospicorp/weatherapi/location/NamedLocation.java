package com.ospicorp.weatherapi.location;

// Row of the cities table; name is the natural key
public record NamedLocation(String name, Coordinate coordinate) {}
