package sp.sistemaspalacios.api_marcacion.service.system;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.dto.location.QrPayload;
import sp.sistemaspalacios.api_marcacion.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_marcacion.service.location.QrPayloadParser;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    // QR de prueba con coordenadas del centro de Lima
    private static final String PROBE_QR = "-12.0464,-77.0428";

    private final AttendanceRecordRepository repository;
    private final QrPayloadParser qrPayloadParser;
    private final Clock clock;

    public Map<String, Object> check() {
        Map<String, Object> database = new LinkedHashMap<>();
        boolean databaseUp;
        long start = System.nanoTime();
        try {
            repository.count();
            databaseUp = true;
            database.put("status", "connected");
            database.put("latencyMs", (System.nanoTime() - start) / 1_000_000.0);
        } catch (Exception e) {
            log.error("❌ Error probando conexión a la base de datos: {}", e.getMessage(), e);
            databaseUp = false;
            database.put("status", "disconnected");
        }

        QrPayload probe = qrPayloadParser.parse(PROBE_QR);
        String locationStatus = probe.isValid() ? "available" : "error";

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", databaseUp && probe.isValid() ? "healthy" : "degraded");
        health.put("timestamp", LocalDateTime.now(clock));
        health.put("database", database);
        health.put("services", Map.of("locationService", locationStatus));
        return health;
    }
}
