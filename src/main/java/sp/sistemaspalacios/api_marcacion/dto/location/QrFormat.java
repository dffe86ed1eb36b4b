package sp.sistemaspalacios.api_marcacion.dto.location;

public enum QrFormat {
    STANDARD,         // empresa|area|codigo|lat,lng|establecimiento|...
    COORDINATES_ONLY, // solo se reconocieron coordenadas
    INVALID
}
