package sp.sistemaspalacios.api_marcacion.dto.attendance;

import lombok.Value;

/**
 * Usuario autenticado que realiza la marcación, reenviado por la capa de
 * autenticación. Siempre es obligatorio.
 */
@Value
public class CallerIdentity {
    String email;
    String name;
    String dni;
    String deviceId;
}
