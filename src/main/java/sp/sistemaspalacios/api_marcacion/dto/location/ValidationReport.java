package sp.sistemaspalacios.api_marcacion.dto.location;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Resultado de validar una posición contra el punto de marcación del QR.
 * {@code overallValid} es verdadero solo si las cuatro verificaciones pasan;
 * {@code primaryIssue} explica el problema más prioritario.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationReport {

    // null cuando el QR no trae coordenadas: la distancia no se evaluó
    Double distanceMeters;
    double toleranceMeters;
    boolean withinTolerance;

    boolean qrValid;
    Coordinate qrCoordinates;
    Coordinate userCoordinates;

    AccuracyTier accuracyTier;
    boolean accuracyAccepted;
    String accuracyMessage;

    boolean withinRegion;

    boolean overallValid;
    String primaryIssue;
    String errorCode;
}
