package com.phillippitts.heynova.service.action;

/**
 * Current conditions for one city.
 *
 * @param city        city name as reported by the weather service
 * @param description short condition text, e.g. "light rain"
 * @param temperature temperature in degrees Celsius
 */
public record WeatherReport(String city, String description, double temperature) {

    /** e.g. "It is 18 degrees with light rain in Paris." */
    public String toSentence() {
        return "It is " + Math.round(temperature) + " degrees with " + description + " in " + city + ".";
    }
}
