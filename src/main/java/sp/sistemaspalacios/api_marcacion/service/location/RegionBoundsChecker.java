package sp.sistemaspalacios.api_marcacion.service.location;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.config.GeofenceProperties;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegionBoundsChecker {

    private final GeofenceProperties geofenceProperties;

    /**
     * Contención inclusiva en el rectángulo configurado. Si el chequeo falla
     * por un error interno se devuelve {@code region.fail-open}.
     */
    public boolean isWithinRegion(Coordinate coordinate) {
        GeofenceProperties.Region region = geofenceProperties.getRegion();
        try {
            validateBounds(region);

            boolean within = coordinate.getLatitude() >= region.getSouth()
                    && coordinate.getLatitude() <= region.getNorth()
                    && coordinate.getLongitude() >= region.getWest()
                    && coordinate.getLongitude() <= region.getEast();

            if (!within) {
                log.warn("⚠️ Coordenadas fuera de la región permitida: {}, {}",
                        coordinate.getLatitude(), coordinate.getLongitude());
            }
            return within;

        } catch (RuntimeException e) {
            log.error("❌ Error verificando región (fail-open={}): {}", region.isFailOpen(), e.getMessage(), e);
            return region.isFailOpen();
        }
    }

    private static void validateBounds(GeofenceProperties.Region region) {
        if (region.getSouth() > region.getNorth() || region.getWest() > region.getEast()) {
            throw new IllegalStateException(String.format(
                    "Límites de región mal configurados: sur=%s norte=%s oeste=%s este=%s",
                    region.getSouth(), region.getNorth(), region.getWest(), region.getEast()));
        }
    }
}
