package sp.sistemaspalacios.api_marcacion.dto.location;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LocationInfo {
    private String latitudeFormatted;
    private String longitudeFormatted;
    private String coordinatesString;
    private String hemisphere;
}
