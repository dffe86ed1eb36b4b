package sp.sistemaspalacios.api_marcacion.service.location;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;

import java.util.Optional;

@Slf4j
@Service
public class CoordinateExtractor {

    /**
     * Extrae las coordenadas del punto de marcación probando cada
     * {@link QrCoordinateFormat} en orden. Devuelve vacío si ningún formato
     * produce un par válido.
     */
    public Optional<Coordinate> extract(String qrCode) {
        if (qrCode == null || qrCode.isBlank()) {
            return Optional.empty();
        }

        String qrClean = qrCode.trim();

        for (QrCoordinateFormat format : QrCoordinateFormat.values()) {
            Optional<Coordinate> coordinate = format.parse(qrClean);
            if (coordinate.isPresent()) {
                log.debug("🎯 Coordenadas extraídas del QR ({}): {}", format, coordinate.get());
                return coordinate;
            }
        }

        log.warn("❌ No se pudieron extraer coordenadas del QR: {}...",
                qrClean.substring(0, Math.min(50, qrClean.length())));
        return Optional.empty();
    }
}
