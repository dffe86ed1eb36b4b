package sp.sistemaspalacios.api_marcacion.service.location;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;

@Service
public class DistanceCalculator {

    public static final double EARTH_RADIUS_METERS = 6_371_000;

    /** Distancia ortodrómica (Haversine) en metros. */
    public double distanceMeters(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double dLat = lat2 - lat1;
        double dLng = Math.toRadians(to.getLongitude()) - Math.toRadians(from.getLongitude());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLng / 2) * Math.sin(dLng / 2);

        // a puede pasar de 1 por redondeo en puntos antípodas
        a = Math.min(1.0, Math.max(0.0, a));

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }
}
