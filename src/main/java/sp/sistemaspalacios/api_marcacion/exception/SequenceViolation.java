package sp.sistemaspalacios.api_marcacion.exception;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Motivos por los que una marcación no respeta el orden del día.
 * Las plantillas con %s reciben la hora registrada previamente.
 */
public enum SequenceViolation {
    ALREADY_ENTERED("Ya marcó ingreso hoy a las %s"),
    NOT_ENTERED("Debe marcar su Ingreso antes de realizar otra marcación"),
    DUPLICATE_BREAK_START("Ya marcó inicio de refrigerio hoy a las %s"),
    BREAK_NOT_STARTED("Debe marcar inicio de refrigerio primero"),
    DUPLICATE_BREAK_END("Ya marcó salida de refrigerio hoy a las %s"),
    BREAK_NOT_FINISHED("Debe terminar su refrigerio antes de marcar la salida"),
    DUPLICATE_EXIT("Ya marcó su salida hoy a las %s"),
    ALREADY_EXITED("Ya marcó su salida hoy a las %s, no puede registrar refrigerio");

    private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final String template;

    SequenceViolation(String template) {
        this.template = template;
    }

    public String format(LocalTime previousTime) {
        if (!template.contains("%s")) {
            return template;
        }
        return String.format(template, previousTime == null ? "--:--:--" : previousTime.format(HH_MM_SS));
    }
}
