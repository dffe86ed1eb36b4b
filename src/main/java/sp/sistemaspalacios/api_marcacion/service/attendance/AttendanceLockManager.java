package sp.sistemaspalacios.api_marcacion.service.attendance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_marcacion.config.MarkingProperties;
import sp.sistemaspalacios.api_marcacion.exception.AttendanceUnavailableException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializa las marcaciones de un mismo (usuario, fecha) dentro de la
 * instancia. Usa un arreglo fijo de candados: dos claves distintas pueden
 * compartir candado, lo que solo las serializa entre sí.
 */
@Slf4j
@Component
public class AttendanceLockManager {

    private static final int STRIPES = 256;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];
    private final Duration timeout;

    public AttendanceLockManager(MarkingProperties markingProperties) {
        this.timeout = markingProperties.getLockTimeout();
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String userEmail, LocalDate date, Supplier<T> action) {
        String key = userEmail.toLowerCase(Locale.ROOT) + "|" + date;
        ReentrantLock lock = locks[Math.floorMod(key.hashCode(), STRIPES)];

        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AttendanceUnavailableException("Marcación interrumpida, intente nuevamente", e);
        }

        if (!acquired) {
            log.warn("⏳ No se obtuvo el candado de marcación para {} en {} ms", key, timeout.toMillis());
            throw new AttendanceUnavailableException("Hay otra marcación en curso, intente nuevamente");
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
