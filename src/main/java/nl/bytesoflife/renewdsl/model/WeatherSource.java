package nl.bytesoflife.renewdsl.model;

import java.util.List;
import java.util.stream.Collectors;

public record WeatherSource(String provider, List<String> args) {

    public WeatherSource {
        args = args == null ? List.of() : List.copyOf(args);
    }

    @Override
    public String toString() {
        return provider + args.stream().map(a -> "'" + a + "'").collect(Collectors.joining(", ", "(", ")"));
    }
}
