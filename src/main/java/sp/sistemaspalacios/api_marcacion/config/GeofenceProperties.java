package sp.sistemaspalacios.api_marcacion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parámetros de la geocerca: tolerancia de distancia, precisión GPS máxima
 * y rectángulo de la región permitida. Se ajustan desde application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "attendance.geofence")
public class GeofenceProperties {

    // Distancia máxima al punto de marcación (m)
    private double toleranceMeters = 700.0;

    // Precisión GPS máxima aceptada (m)
    private double maxAccuracyMeters = 600.0;

    private Region region = new Region();

    @Getter
    @Setter
    public static class Region {
        // Límites aproximados de Perú
        private double south = -18.5;
        private double north = 0.5;
        private double west = -81.5;
        private double east = -68.0;

        // Ante un error interno del chequeo, se considera dentro de la región
        private boolean failOpen = true;
    }
}
