package sp.sistemaspalacios.api_marcacion.service.attendance;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_marcacion.config.MarkingProperties;
import sp.sistemaspalacios.api_marcacion.exception.AttendanceUnavailableException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AttendanceLockManagerTest {

    private static final LocalDate DATE = LocalDate.of(2026, 10, 19);

    private AttendanceLockManager lockManager(Duration timeout) {
        MarkingProperties properties = new MarkingProperties();
        properties.setLockTimeout(timeout);
        return new AttendanceLockManager(properties);
    }

    @Test
    void should_ReturnActionResult_When_LockFree() {
        AttendanceLockManager manager = lockManager(Duration.ofSeconds(1));

        assertEquals("ok", manager.withLock("ana@empresa.pe", DATE, () -> "ok"));
    }

    @Test
    void should_ReleaseLock_When_ActionFails() {
        AttendanceLockManager manager = lockManager(Duration.ofMillis(100));

        assertThrows(IllegalStateException.class, () -> manager.withLock("ana@empresa.pe", DATE, () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals("again", manager.withLock("ana@empresa.pe", DATE, () -> "again"));
    }

    @Test
    void should_TimeOut_When_SameUserAndDayBusy() throws Exception {
        AttendanceLockManager manager = lockManager(Duration.ofMillis(100));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<String> holder = executor.submit(() -> manager.withLock("ana@empresa.pe", DATE, () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "first";
            }));

            assertTrue(held.await(5, TimeUnit.SECONDS));

            // El email se normaliza, así que la variante en mayúsculas comparte candado
            assertThrows(AttendanceUnavailableException.class,
                    () -> manager.withLock("ANA@empresa.pe", DATE, () -> "second"));

            release.countDown();
            assertEquals("first", holder.get(5, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
