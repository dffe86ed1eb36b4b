package sp.sistemaspalacios.api_marcacion.service.location;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;
import sp.sistemaspalacios.api_marcacion.dto.location.QrFormat;
import sp.sistemaspalacios.api_marcacion.dto.location.QrPayload;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class QrPayloadParser {

    private static final String NOT_SPECIFIED = "No especificado";
    private static final int STANDARD_MIN_FIELDS = 5;
    private static final int CODE_PREVIEW_LENGTH = 20;

    private final CoordinateExtractor coordinateExtractor;

    public QrPayload parse(String qrCode) {
        if (qrCode == null || qrCode.isBlank()) {
            return QrPayload.builder()
                    .raw(qrCode)
                    .valid(false)
                    .format(QrFormat.INVALID)
                    .message("Código QR vacío")
                    .errorCode("EMPTY_QR")
                    .build();
        }

        String qrClean = qrCode.trim();
        Optional<Coordinate> coordinates = coordinateExtractor.extract(qrClean);

        if (coordinates.isEmpty()) {
            return QrPayload.builder()
                    .raw(qrClean)
                    .valid(false)
                    .format(QrFormat.INVALID)
                    .message("Formato de QR no reconocido o sin coordenadas válidas")
                    .errorCode("INVALID_FORMAT")
                    .build();
        }

        String[] parts = qrClean.split("\\|", -1);
        if (parts.length >= STANDARD_MIN_FIELDS) {
            return QrPayload.builder()
                    .raw(qrClean)
                    .valid(true)
                    .format(QrFormat.STANDARD)
                    .company(parts[0].trim())
                    .area(parts[1].trim())
                    .code(parts[2].trim())
                    .establishmentId(parts[4].trim())
                    .coordinates(coordinates.get())
                    .message("QR válido con formato estándar")
                    .build();
        }

        return QrPayload.builder()
                .raw(qrClean)
                .valid(true)
                .format(QrFormat.COORDINATES_ONLY)
                .company(NOT_SPECIFIED)
                .area(NOT_SPECIFIED)
                .code(qrClean.substring(0, Math.min(CODE_PREVIEW_LENGTH, qrClean.length())))
                .establishmentId(NOT_SPECIFIED)
                .coordinates(coordinates.get())
                .message("QR válido con coordenadas")
                .build();
    }
}
