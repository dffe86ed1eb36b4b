package sp.sistemaspalacios.api_marcacion.controller.system;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sp.sistemaspalacios.api_marcacion.config.GeofenceProperties;
import sp.sistemaspalacios.api_marcacion.config.MarkingProperties;
import sp.sistemaspalacios.api_marcacion.service.system.HealthService;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SystemController {

    private final GeofenceProperties geofenceProperties;
    private final MarkingProperties markingProperties;
    private final HealthService healthService;

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> getSystemConfig() {
        GeofenceProperties.Region region = geofenceProperties.getRegion();

        Map<String, Object> bounds = new HashMap<>();
        bounds.put("south", region.getSouth());
        bounds.put("north", region.getNorth());
        bounds.put("west", region.getWest());
        bounds.put("east", region.getEast());

        Map<String, Object> gps = new HashMap<>();
        gps.put("maxDistanceMeters", geofenceProperties.getToleranceMeters());
        gps.put("maxAccuracyMeters", geofenceProperties.getMaxAccuracyMeters());
        gps.put("regionBounds", bounds);

        Map<String, Object> config = new HashMap<>();
        config.put("gpsSettings", gps);
        config.put("timezone", markingProperties.getTimezone());

        return ResponseEntity.ok(config);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = healthService.check();
        HttpStatus status = "healthy".equals(health.get("status")) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }
}
