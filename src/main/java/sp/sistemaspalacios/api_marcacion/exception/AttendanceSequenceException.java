package sp.sistemaspalacios.api_marcacion.exception;

import lombok.Getter;

import java.time.LocalTime;

/**
 * Marcación duplicada o fuera de orden. Es un error de negocio: el registro
 * del día queda intacto.
 */
@Getter
public class AttendanceSequenceException extends RuntimeException {

    private final SequenceViolation violation;
    private final LocalTime previousTime;

    public AttendanceSequenceException(SequenceViolation violation, LocalTime previousTime) {
        super(violation.format(previousTime));
        this.violation = violation;
        this.previousTime = previousTime;
    }

    public AttendanceSequenceException(SequenceViolation violation) {
        this(violation, null);
    }
}
