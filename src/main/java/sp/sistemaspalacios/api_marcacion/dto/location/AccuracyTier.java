package sp.sistemaspalacios.api_marcacion.dto.location;

public enum AccuracyTier {
    EXCELLENT,  // <= 5 m
    GOOD,       // <= 20 m
    ACCEPTABLE, // <= máximo configurado
    POOR,       // > máximo configurado (se rechaza)
    UNKNOWN     // el dispositivo no reportó precisión
}
