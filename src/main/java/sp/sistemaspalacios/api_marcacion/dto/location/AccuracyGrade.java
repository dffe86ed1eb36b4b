package sp.sistemaspalacios.api_marcacion.dto.location;

import lombok.Value;

@Value
public class AccuracyGrade {
    AccuracyTier tier;
    boolean accepted;
    String message;
}
