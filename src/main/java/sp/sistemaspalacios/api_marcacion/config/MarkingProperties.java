package sp.sistemaspalacios.api_marcacion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "attendance.marking")
public class MarkingProperties {

    // Zona horaria en la que se registran fecha y hora de las marcaciones
    private String timezone = "America/Lima";

    // Espera máxima por el candado (usuario, fecha) antes de responder "reintente"
    private Duration lockTimeout = Duration.ofSeconds(3);
}
