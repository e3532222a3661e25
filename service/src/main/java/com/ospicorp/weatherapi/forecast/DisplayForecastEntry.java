package com.ospicorp.weatherapi.forecast;

public record DisplayForecastEntry(String label, String temperatureLabel) {}
