package sp.sistemaspalacios.api_marcacion.dto.attendance;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_marcacion.entity.attendance.MarcationType;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkingRequest {

    @NotBlank(message = "El código QR es requerido")
    private String qrCode;

    @NotNull(message = "El tipo de marcación es requerido")
    private MarcationType marcationType;

    @NotNull(message = "Coordenadas GPS requeridas")
    @DecimalMin(value = "-90.0", message = "Latitud fuera de rango válido")
    @DecimalMax(value = "90.0", message = "Latitud fuera de rango válido")
    private Double latitude;

    @NotNull(message = "Coordenadas GPS requeridas")
    @DecimalMin(value = "-180.0", message = "Longitud fuera de rango válido")
    @DecimalMax(value = "180.0", message = "Longitud fuera de rango válido")
    private Double longitude;

    @PositiveOrZero(message = "La precisión GPS no puede ser negativa")
    private Double accuracy;
}
