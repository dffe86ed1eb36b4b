package sp.sistemaspalacios.api_marcacion.dto.location;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Par latitud/longitud en grados decimales. Inmutable; solo se construye
 * con valores dentro de rango.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Coordinate {

    double latitude;
    double longitude;

    public static Coordinate of(double latitude, double longitude) {
        if (!isValidLatitude(latitude)) {
            throw new IllegalArgumentException("Latitud fuera de rango: " + latitude);
        }
        if (!isValidLongitude(longitude)) {
            throw new IllegalArgumentException("Longitud fuera de rango: " + longitude);
        }
        return new Coordinate(latitude, longitude);
    }

    public static boolean isValid(double latitude, double longitude) {
        return isValidLatitude(latitude) && isValidLongitude(longitude);
    }

    private static boolean isValidLatitude(double latitude) {
        return latitude >= -90.0 && latitude <= 90.0;
    }

    private static boolean isValidLongitude(double longitude) {
        return longitude >= -180.0 && longitude <= 180.0;
    }

    /** Formato "lat, lng" con que se guarda la geolocación de la marcación. */
    public String toLocationString() {
        return latitude + ", " + longitude;
    }
}
