package sp.sistemaspalacios.api_marcacion.service.location;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.config.GeofenceProperties;
import sp.sistemaspalacios.api_marcacion.dto.location.AccuracyGrade;
import sp.sistemaspalacios.api_marcacion.dto.location.AccuracyTier;

import java.util.Locale;

@Service
@RequiredArgsConstructor
public class AccuracyGrader {

    private static final double EXCELLENT_MAX_METERS = 5.0;
    private static final double GOOD_MAX_METERS = 20.0;

    private final GeofenceProperties geofenceProperties;

    /**
     * Clasifica la precisión reportada por el dispositivo. Los límites
     * superiores de cada nivel son inclusivos; solo POOR se rechaza.
     */
    public AccuracyGrade grade(Double accuracyMeters) {
        if (accuracyMeters == null) {
            return new AccuracyGrade(AccuracyTier.UNKNOWN, true, "Precisión no reportada");
        }

        double maxAccuracy = geofenceProperties.getMaxAccuracyMeters();
        String value = format(accuracyMeters);

        if (accuracyMeters <= EXCELLENT_MAX_METERS) {
            return new AccuracyGrade(AccuracyTier.EXCELLENT, true, "Excelente precisión GPS: ±" + value + "m");
        }
        if (accuracyMeters <= GOOD_MAX_METERS) {
            return new AccuracyGrade(AccuracyTier.GOOD, true, "Buena precisión GPS: ±" + value + "m");
        }
        if (accuracyMeters <= maxAccuracy) {
            return new AccuracyGrade(AccuracyTier.ACCEPTABLE, true, "Precisión GPS aceptable: ±" + value + "m");
        }
        return new AccuracyGrade(AccuracyTier.POOR, false,
                String.format("Precisión GPS insuficiente: ±%sm (requiere <= %sm)", value, format(maxAccuracy)));
    }

    private static String format(double meters) {
        return String.format(Locale.US, "%.1f", meters);
    }
}
