package geotechstalker.exception;

/**
 * Clasificación de los fallos que puede devolver una fórmula.
 */
public enum GeotechErrorType {
    /**
     * Un parámetro de entrada viola su dominio documentado
     * (ancho negativo, factor de seguridad nulo, ángulo fuera de rango...).
     */
    INVALID_INPUT,

    /**
     * Una operación trascendente intermedia (tangente, raíz, logaritmo) se evalúa
     * fuera de su dominio matemático a partir de entradas en apariencia válidas.
     */
    DOMAIN_ERROR
}
