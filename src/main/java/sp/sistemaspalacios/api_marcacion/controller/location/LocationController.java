package sp.sistemaspalacios.api_marcacion.controller.location;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;
import sp.sistemaspalacios.api_marcacion.dto.location.LocationValidationRequest;
import sp.sistemaspalacios.api_marcacion.dto.location.QrInfoRequest;
import sp.sistemaspalacios.api_marcacion.dto.location.QrPayload;
import sp.sistemaspalacios.api_marcacion.dto.location.ValidationReport;
import sp.sistemaspalacios.api_marcacion.service.location.LocationDescriber;
import sp.sistemaspalacios.api_marcacion.service.location.LocationValidationService;
import sp.sistemaspalacios.api_marcacion.service.location.QrPayloadParser;
import sp.sistemaspalacios.api_marcacion.service.location.RegionBoundsChecker;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LocationController {

    private final LocationValidationService validationService;
    private final QrPayloadParser qrPayloadParser;
    private final LocationDescriber locationDescriber;
    private final RegionBoundsChecker regionBoundsChecker;

    /**
     * Validar ubicación sin realizar marcación
     * POST /api/location/validate
     */
    @PostMapping("/location/validate")
    public ResponseEntity<Map<String, Object>> validateLocation(
            @Valid @RequestBody LocationValidationRequest request
    ) {
        Coordinate user = Coordinate.of(request.getLatitude(), request.getLongitude());
        ValidationReport report = validationService.buildReport(user, request.getQrCode(), request.getAccuracy());

        Map<String, Object> response = new HashMap<>();
        response.put("valid", report.isOverallValid());
        response.put("summary", report.getPrimaryIssue());
        response.put("report", report);
        response.put("userLocation", locationDescriber.describe(user));

        return ResponseEntity.ok(response);
    }

    /**
     * Información de un código QR
     * POST /api/qr/info
     */
    @PostMapping("/qr/info")
    public ResponseEntity<Map<String, Object>> getQrInfo(@Valid @RequestBody QrInfoRequest request) {
        QrPayload payload = qrPayloadParser.parse(request.getQrCode());

        Map<String, Object> response = new HashMap<>();
        response.put("qr", payload);

        if (payload.isValid() && payload.hasCoordinates()) {
            response.put("locationInfo", locationDescriber.describe(payload.getCoordinates()));
            response.put("inRegion", regionBoundsChecker.isWithinRegion(payload.getCoordinates()));
        }

        return ResponseEntity.ok(response);
    }
}
