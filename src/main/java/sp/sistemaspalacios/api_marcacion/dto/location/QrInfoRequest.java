package sp.sistemaspalacios.api_marcacion.dto.location;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class QrInfoRequest {

    @NotBlank(message = "QR code vacío")
    private String qrCode;
}
