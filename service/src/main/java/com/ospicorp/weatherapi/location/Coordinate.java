package com.ospicorp.weatherapi.location;

public record Coordinate(double latitude, double longitude) {}
