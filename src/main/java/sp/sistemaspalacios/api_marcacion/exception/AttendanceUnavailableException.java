package sp.sistemaspalacios.api_marcacion.exception;

/**
 * Falla transitoria de almacenamiento o de espera del candado. No se
 * confirmó ningún cambio, por lo que el cliente puede reintentar.
 */
public class AttendanceUnavailableException extends RuntimeException {

    public AttendanceUnavailableException(String message) {
        super(message);
    }

    public AttendanceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
