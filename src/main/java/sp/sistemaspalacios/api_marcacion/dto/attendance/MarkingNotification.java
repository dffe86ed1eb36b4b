package sp.sistemaspalacios.api_marcacion.dto.attendance;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarkingNotification {
    String userName;
    String userEmail;
    String userDni;
    String marcationType;
    String company;
    String date;
    String time;
}
