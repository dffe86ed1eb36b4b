package sp.sistemaspalacios.api_marcacion.dto.attendance;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_marcacion.dto.location.ValidationReport;
import sp.sistemaspalacios.api_marcacion.entity.attendance.MarcationType;

import java.time.LocalDate;
import java.time.LocalTime;

@Value
@Builder
public class MarkingResult {
    MarcationType marcationType;
    LocalDate date;
    LocalTime time;
    String location;
    String message;
    ValidationReport report;
}
