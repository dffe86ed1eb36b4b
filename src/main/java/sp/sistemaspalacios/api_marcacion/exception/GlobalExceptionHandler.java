package sp.sistemaspalacios.api_marcacion.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Traduce las excepciones de la marcación a respuestas con código de error,
 * distinguiendo errores de entrada, de ubicación, de negocio y transitorios.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .distinct()
                .collect(Collectors.joining("; "));
        log.warn("❌ Solicitud inválida: {}", message);
        return build(HttpStatus.BAD_REQUEST, message, "INVALID_REQUEST");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("❌ Cuerpo de solicitud ilegible: {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, "Datos de la solicitud inválidos: " + ex.getMostSpecificCause().getMessage(),
                "INVALID_REQUEST");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("❌ Error de validación: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_REQUEST");
    }

    @ExceptionHandler(LocationValidationException.class)
    public ResponseEntity<Map<String, Object>> handleLocation(LocationValidationException ex) {
        ResponseEntity<Map<String, Object>> response =
                build(HttpStatus.BAD_REQUEST, ex.getMessage(), "LOCATION_VALIDATION_FAILED");
        response.getBody().put("locationReport", ex.getReport());
        return response;
    }

    @ExceptionHandler(MissingCallerIdentityException.class)
    public ResponseEntity<Map<String, Object>> handleMissingIdentity(MissingCallerIdentityException ex) {
        log.warn("🔒 {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, ex.getMessage(), "UNAUTHENTICATED");
    }

    @ExceptionHandler(AttendanceSequenceException.class)
    public ResponseEntity<Map<String, Object>> handleSequence(AttendanceSequenceException ex) {
        log.warn("❌ Marcación rechazada ({}): {}", ex.getViolation(), ex.getMessage());
        ResponseEntity<Map<String, Object>> response =
                build(HttpStatus.CONFLICT, ex.getMessage(), "BUSINESS_LOGIC_ERROR");
        response.getBody().put("violation", ex.getViolation());
        return response;
    }

    @ExceptionHandler(AttendanceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(AttendanceUnavailableException ex) {
        ResponseEntity<Map<String, Object>> response =
                build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "RETRYABLE_ERROR");
        response.getBody().put("retryable", true);
        return response;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        // Excepciones propias de Spring MVC (405, 415, 404...) conservan su estado
        if (ex instanceof ErrorResponse) {
            HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
            log.warn("❌ {}: {}", status, ex.getMessage());
            return build(status, ex.getMessage(), String.valueOf(status.value()));
        }
        log.error("❌ Error interno: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Error interno del servidor", "INTERNAL_SERVER_ERROR");
    }

    private static ResponseEntity<Map<String, Object>> build(HttpStatus status, String message, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
