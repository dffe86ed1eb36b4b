package sp.sistemaspalacios.api_marcacion.entity.attendance;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum MarcationType {
    ENTRY("Ingreso"),                     // Entrada del día
    BREAK_START("Inicio de Refrigerio"),  // Salida a refrigerio
    BREAK_END("Salida de Refrigerio"),    // Regreso del refrigerio
    EXIT("Salida");                       // Salida definitiva

    private final String label;

    MarcationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Solo ingreso y salida generan notificación. */
    public boolean notifies() {
        return this == ENTRY || this == EXIT;
    }

    /**
     * Acepta el nombre de la constante ("BREAK_START") o la etiqueta usada por
     * la aplicación móvil ("Inicio de Refrigerio").
     */
    @JsonCreator
    public static MarcationType fromValue(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (MarcationType type : values()) {
                if (type.name().equalsIgnoreCase(trimmed) || type.label.equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Tipo de marcación no válido: " + value);
    }
}
