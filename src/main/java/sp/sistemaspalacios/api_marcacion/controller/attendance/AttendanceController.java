package sp.sistemaspalacios.api_marcacion.controller.attendance;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_marcacion.dto.attendance.CallerIdentity;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingRequest;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingResult;
import sp.sistemaspalacios.api_marcacion.dto.attendance.TodayAttendanceDTO;
import sp.sistemaspalacios.api_marcacion.dto.location.ValidationReport;
import sp.sistemaspalacios.api_marcacion.service.attendance.AttendanceMarkingService;

import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class AttendanceController {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final AttendanceMarkingService markingService;

    /**
     * Registrar marcación con validación GPS completa
     * POST /api/attendance/mark
     */
    @PostMapping("/mark")
    public ResponseEntity<Map<String, Object>> markAttendance(
            @Valid @RequestBody MarkingRequest request,
            CallerIdentity caller
    ) {
        MarkingResult result = markingService.mark(caller, request);
        ValidationReport report = result.getReport();

        Map<String, Object> locationInfo = new HashMap<>();
        locationInfo.put("distanceToQr", report.getDistanceMeters());
        locationInfo.put("gpsAccuracy", request.getAccuracy() == null
                ? "no reportada"
                : String.format(Locale.US, "±%.1fm", request.getAccuracy()));
        locationInfo.put("coordinates", String.format(Locale.US, "%.6f, %.6f",
                request.getLatitude(), request.getLongitude()));
        locationInfo.put("validationPassed", true);

        Map<String, Object> data = new HashMap<>();
        data.put("marcationType", result.getMarcationType());
        data.put("date", result.getDate());
        data.put("time", result.getTime().format(TIME_FORMAT));
        data.put("location", result.getLocation());
        data.put("locationInfo", locationInfo);
        data.put("report", report);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", result.getMessage());
        response.put("data", data);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Marcaciones del día del usuario
     * GET /api/attendance/today
     */
    @GetMapping("/today")
    public ResponseEntity<TodayAttendanceDTO> getTodayAttendance(CallerIdentity caller) {
        return ResponseEntity.ok(markingService.getToday(caller));
    }
}
