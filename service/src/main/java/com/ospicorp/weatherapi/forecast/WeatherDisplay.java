package com.ospicorp.weatherapi.forecast;

import java.util.List;

public record WeatherDisplay(String city, List<DisplayForecastEntry> forecasts) {}
