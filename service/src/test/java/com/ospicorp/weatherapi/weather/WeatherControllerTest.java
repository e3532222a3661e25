package com.ospicorp.weatherapi.weather;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.weatherapi.error.ErrorKind;
import com.ospicorp.weatherapi.error.WeatherLookupException;
import com.ospicorp.weatherapi.forecast.DisplayForecastEntry;
import com.ospicorp.weatherapi.forecast.WeatherDisplay;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WeatherController.class)
class WeatherControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private WeatherService weatherService;

  @Test
  void returnsForecastJson() throws Exception {
    when(weatherService.lookup("Paris")).thenReturn(new WeatherDisplay("Paris",
        List.of(new DisplayForecastEntry("Mon 14:00", "18.5°C"))));

    mockMvc.perform(get("/weather").param("city", "Paris"))
        .andExpect(status().isOk())
        .andExpect(header().exists("X-Request-Id"))
        .andExpect(jsonPath("$.city").value("Paris"))
        .andExpect(jsonPath("$.forecasts.length()").value(1))
        .andExpect(jsonPath("$.forecasts[0].label").value("Mon 14:00"))
        .andExpect(jsonPath("$.forecasts[0].temperatureLabel").value(startsWith("18.5")));
  }

  @Test
  void unknownPlaceIsNotFoundProblem() throws Exception {
    when(weatherService.lookup("Atlantis"))
        .thenThrow(new WeatherLookupException(ErrorKind.NOT_FOUND, "No location found for 'Atlantis'"));

    mockMvc.perform(get("/weather").param("city", "Atlantis"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value(404))
        .andExpect(jsonPath("$.errorKind").value("NOT_FOUND"))
        .andExpect(jsonPath("$.detail").value("No location found for 'Atlantis'"))
        .andExpect(jsonPath("$.path").value("/weather"));
  }

  @Test
  void upstreamFailuresMapToBadGateway() throws Exception {
    when(weatherService.lookup("Paris"))
        .thenThrow(new WeatherLookupException(ErrorKind.MALFORMED_RESPONSE, "bad body"));

    mockMvc.perform(get("/weather").param("city", "Paris"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.errorKind").value("MALFORMED_RESPONSE"))
        .andExpect(jsonPath("$.type").value("https://docs.weather-api.dev/problems/malformed-response"));
  }

  @Test
  void storeFailuresMapToServiceUnavailable() throws Exception {
    when(weatherService.lookup("Paris"))
        .thenThrow(new WeatherLookupException(ErrorKind.STORE_WRITE_ERROR, "insert failed"));

    mockMvc.perform(get("/weather").param("city", "Paris"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.errorKind").value("STORE_WRITE_ERROR"));
  }

  @Test
  void deadlineMapsToGatewayTimeout() throws Exception {
    when(weatherService.lookup("Paris"))
        .thenThrow(new WeatherLookupException(ErrorKind.DEADLINE_EXCEEDED, "too slow"));

    mockMvc.perform(get("/weather").param("city", "Paris"))
        .andExpect(status().isGatewayTimeout());
  }

  @Test
  void missingCityIsBadRequest() throws Exception {
    mockMvc.perform(get("/weather"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value(400));
  }

  @Test
  void blankCityIsBadRequest() throws Exception {
    mockMvc.perform(get("/weather").param("city", " "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value(400));

    verify(weatherService, never()).lookup(any());
  }

  @Test
  void rejectedQueryIsServiceUnavailable() throws Exception {
    when(weatherService.lookup("Paris"))
        .thenThrow(new WeatherLookupException(ErrorKind.QUERY_REJECTED, "executor shut down"));

    mockMvc.perform(get("/weather").param("city", "Paris"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.errorKind").value("QUERY_REJECTED"));
  }
}
