package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.exception.BackendUnavailableException;

import java.util.Optional;

/** Current-weather lookup by city name. */
public interface WeatherClient {

    /**
     * @param city spoken city name
     * @return current conditions, or empty when the service does not know the city
     * @throws BackendUnavailableException on network errors, timeouts or error responses
     */
    Optional<WeatherReport> currentWeather(String city);
}
