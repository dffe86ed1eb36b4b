package sp.sistemaspalacios.api_marcacion.dto.location;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QrPayload {
    String raw;
    boolean valid;
    QrFormat format;
    String company;
    String area;
    String code;
    String establishmentId;
    Coordinate coordinates;
    String message;
    String errorCode;

    public boolean hasCoordinates() {
        return coordinates != null;
    }
}
