package sp.sistemaspalacios.api_marcacion.service.location;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;
import sp.sistemaspalacios.api_marcacion.dto.location.LocationInfo;

import java.util.Locale;

@Service
public class LocationDescriber {

    public LocationInfo describe(Coordinate coordinate) {
        double latitude = coordinate.getLatitude();
        double longitude = coordinate.getLongitude();

        String latHemisphere = latitude >= 0 ? "Norte" : "Sur";
        String lngHemisphere = longitude >= 0 ? "Este" : "Oeste";

        return new LocationInfo(
                String.format(Locale.US, "%.6f° %s", Math.abs(latitude), latHemisphere),
                String.format(Locale.US, "%.6f° %s", Math.abs(longitude), lngHemisphere),
                String.format(Locale.US, "%.6f, %.6f", latitude, longitude),
                latHemisphere + "-" + lngHemisphere
        );
    }
}
