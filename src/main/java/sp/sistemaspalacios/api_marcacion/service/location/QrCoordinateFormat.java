package sp.sistemaspalacios.api_marcacion.service.location;

import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formatos de QR reconocidos, en orden de prioridad. Cada formato extrae
 * un par lat,lng y lo descarta si está fuera de rango.
 */
public enum QrCoordinateFormat {

    // empresa|area|codigo|lat,lng|establecimiento|...
    PIPE_RECORD("^[^|]*\\|[^|]*\\|[^|]*\\|" + QrCoordinateFormat.PAIR + "\\|"),

    // lat,lng|...
    LEADING_PAIR("^" + QrCoordinateFormat.PAIR + "\\|"),

    // {"lat": x, "lng": y}
    INLINE_OBJECT("\"lat\"\\s*:\\s*(-?\\d+\\.?\\d*)[^}]*\"lng\"\\s*:\\s*(-?\\d+\\.?\\d*)"),

    // lat,lng
    BARE_PAIR("^" + QrCoordinateFormat.PAIR + "$");

    private static final String PAIR = "(-?\\d+\\.?\\d*),\\s*(-?\\d+\\.?\\d*)";

    private final Pattern pattern;

    QrCoordinateFormat(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    public Optional<Coordinate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }

        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }

        double latitude;
        double longitude;
        try {
            latitude = Double.parseDouble(matcher.group(1));
            longitude = Double.parseDouble(matcher.group(2));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        if (!Coordinate.isValid(latitude, longitude)) {
            return Optional.empty();
        }
        return Optional.of(Coordinate.of(latitude, longitude));
    }
}
