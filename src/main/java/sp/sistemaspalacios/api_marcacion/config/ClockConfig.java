package sp.sistemaspalacios.api_marcacion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(MarkingProperties markingProperties) {
        return Clock.system(ZoneId.of(markingProperties.getTimezone()));
    }
}
