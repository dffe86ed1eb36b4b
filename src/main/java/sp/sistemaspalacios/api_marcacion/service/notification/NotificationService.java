package sp.sistemaspalacios.api_marcacion.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingNotification;

/**
 * Cliente del servicio de mensajería. El envío es "dispara y olvida": un
 * error se registra en el log y nunca afecta a la marcación.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final RestTemplate restTemplate;

    @Value("${notification.enabled:true}")
    private boolean enabled;

    @Value("${notification.service.url:http://localhost:3008}")
    private String notificationServiceUrl;

    @Value("${notification.service.endpoint:/v1/marking-notifications}")
    private String notificationEndpoint;

    public void sendMarkingNotification(MarkingNotification notification) {
        if (!enabled) {
            log.debug("🔕 Notificaciones deshabilitadas, se omite {}", notification.getMarcationType());
            return;
        }

        try {
            String url = notificationServiceUrl + notificationEndpoint;

            log.info("📤 Enviando notificación de {} para {} - URL: {}",
                    notification.getMarcationType(), notification.getUserEmail(), url);
            log.debug("📦 Payload: {}", notification);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            HttpEntity<MarkingNotification> request = new HttpEntity<>(notification, headers);

            ResponseEntity<Void> response = restTemplate.exchange(
                    url,
                    HttpMethod.POST,
                    request,
                    Void.class
            );

            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("✅ Notificación enviada exitosamente");
            } else {
                log.warn("⚠️ Respuesta no exitosa: {}", response.getStatusCode());
            }

        } catch (Exception e) {
            log.warn("⚠️ Error enviando notificación (la marcación se mantiene): {}", e.getMessage(), e);
        }
    }
}
