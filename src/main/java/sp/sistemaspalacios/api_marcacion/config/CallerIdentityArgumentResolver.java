package sp.sistemaspalacios.api_marcacion.config;

import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import sp.sistemaspalacios.api_marcacion.dto.attendance.CallerIdentity;
import sp.sistemaspalacios.api_marcacion.exception.MissingCallerIdentityException;

import java.util.Locale;

/**
 * Construye el {@link CallerIdentity} a partir de las cabeceras que reenvía
 * la capa de autenticación. Sin email, nombre y DNI la petición se rechaza.
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String EMAIL_HEADER = "X-User-Email";
    public static final String NAME_HEADER = "X-User-Name";
    public static final String DNI_HEADER = "X-User-Dni";
    public static final String DEVICE_HEADER = "X-Device-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory
    ) {
        String email = required(webRequest, EMAIL_HEADER);
        String name = required(webRequest, NAME_HEADER);
        String dni = required(webRequest, DNI_HEADER);
        String deviceId = webRequest.getHeader(DEVICE_HEADER);

        return new CallerIdentity(email.toLowerCase(Locale.ROOT), name, dni, deviceId);
    }

    private static String required(NativeWebRequest webRequest, String header) {
        String value = webRequest.getHeader(header);
        if (value == null || value.isBlank()) {
            throw new MissingCallerIdentityException("Usuario no autenticado: falta la cabecera " + header);
        }
        return value.trim();
    }
}
