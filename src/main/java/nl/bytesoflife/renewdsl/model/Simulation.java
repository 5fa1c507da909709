package nl.bytesoflife.renewdsl.model;

import java.util.List;

/**
 * Simulation request. {@code duration} and {@code timestep} keep the composed
 * number-and-unit text in plain decimal, e.g. {@code "1.0year"} or
 * {@code "10000000.0hour"}.
 */
public record Simulation(WeatherSource weather, String duration, String timestep, List<String> outputs) {

    public static final List<String> DEFAULT_OUTPUTS = List.of("generation", "capacity_factor");

    public Simulation {
        outputs = outputs == null ? DEFAULT_OUTPUTS : List.copyOf(outputs);
    }

    @Override
    public String toString() {
        return "Simulation{duration=" + duration + ", timestep=" + timestep + "}";
    }
}
