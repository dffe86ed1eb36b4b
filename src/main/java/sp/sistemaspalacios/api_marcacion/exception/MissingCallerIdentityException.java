package sp.sistemaspalacios.api_marcacion.exception;

public class MissingCallerIdentityException extends RuntimeException {

    public MissingCallerIdentityException(String message) {
        super(message);
    }
}
