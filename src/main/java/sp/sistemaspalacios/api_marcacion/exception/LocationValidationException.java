package sp.sistemaspalacios.api_marcacion.exception;

import lombok.Getter;
import sp.sistemaspalacios.api_marcacion.dto.location.ValidationReport;

@Getter
public class LocationValidationException extends RuntimeException {

    private final ValidationReport report;

    public LocationValidationException(ValidationReport report) {
        super(report.getPrimaryIssue());
        this.report = report;
    }
}
