package sp.sistemaspalacios.api_marcacion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ApiMarcacionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiMarcacionApplication.class, args);
    }
}
