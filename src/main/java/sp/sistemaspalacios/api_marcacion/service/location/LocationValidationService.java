package sp.sistemaspalacios.api_marcacion.service.location;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.config.GeofenceProperties;
import sp.sistemaspalacios.api_marcacion.dto.location.AccuracyGrade;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;
import sp.sistemaspalacios.api_marcacion.dto.location.ValidationReport;

import java.util.Locale;
import java.util.Optional;

/**
 * Combina extracción de coordenadas del QR, distancia, precisión GPS y región
 * en un único {@link ValidationReport}. No modifica estado persistido.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationValidationService {

    public static final String INVALID_QR_COORDINATES = "INVALID_QR_COORDINATES";
    public static final String OUTSIDE_REGION = "OUTSIDE_REGION";
    public static final String POOR_ACCURACY = "POOR_ACCURACY";
    public static final String DISTANCE_EXCEEDED = "DISTANCE_EXCEEDED";

    static final String QR_ISSUE = "El código QR no contiene coordenadas válidas de ubicación";
    static final String REGION_ISSUE = "Ubicación fuera de la región permitida";
    static final String VALID = "Validación exitosa";

    private final CoordinateExtractor coordinateExtractor;
    private final DistanceCalculator distanceCalculator;
    private final AccuracyGrader accuracyGrader;
    private final RegionBoundsChecker regionBoundsChecker;
    private final GeofenceProperties geofenceProperties;

    public ValidationReport buildReport(Coordinate userCoordinates, String qrCode, Double accuracyMeters) {
        double tolerance = geofenceProperties.getToleranceMeters();

        Optional<Coordinate> qrCoordinates = coordinateExtractor.extract(qrCode);
        boolean qrValid = qrCoordinates.isPresent();

        // Sin coordenadas en el QR la distancia no se evalúa
        Double distance = null;
        boolean withinTolerance = false;
        if (qrValid) {
            double rawDistance = distanceCalculator.distanceMeters(userCoordinates, qrCoordinates.get());
            withinTolerance = rawDistance <= tolerance;
            distance = Math.round(rawDistance * 10.0) / 10.0;
        }

        AccuracyGrade accuracy = accuracyGrader.grade(accuracyMeters);
        boolean withinRegion = regionBoundsChecker.isWithinRegion(userCoordinates);

        boolean overallValid = qrValid && withinRegion && accuracy.isAccepted() && withinTolerance;

        ValidationReport.ValidationReportBuilder report = ValidationReport.builder()
                .distanceMeters(distance)
                .toleranceMeters(tolerance)
                .withinTolerance(withinTolerance)
                .qrValid(qrValid)
                .qrCoordinates(qrCoordinates.orElse(null))
                .userCoordinates(userCoordinates)
                .accuracyTier(accuracy.getTier())
                .accuracyAccepted(accuracy.isAccepted())
                .accuracyMessage(accuracy.getMessage())
                .withinRegion(withinRegion)
                .overallValid(overallValid);

        // Orden de prioridad: QR, región, precisión, distancia
        if (!qrValid) {
            report.primaryIssue(QR_ISSUE).errorCode(INVALID_QR_COORDINATES);
        } else if (!withinRegion) {
            report.primaryIssue(REGION_ISSUE).errorCode(OUTSIDE_REGION);
        } else if (!accuracy.isAccepted()) {
            report.primaryIssue(accuracy.getMessage()).errorCode(POOR_ACCURACY);
        } else if (!withinTolerance) {
            report.primaryIssue(String.format(Locale.US,
                            "Muy lejos del punto de marcación. Distancia: %.1fm (máximo: %.0fm)", distance, tolerance))
                    .errorCode(DISTANCE_EXCEEDED);
        } else {
            report.primaryIssue(VALID);
        }

        ValidationReport result = report.build();
        if (result.isOverallValid()) {
            log.info("✅ Validación GPS exitosa - Distancia: {}m <= {}m", distance, tolerance);
        } else {
            log.warn("❌ Validación GPS falló: {}", result.getPrimaryIssue());
        }
        return result;
    }
}
