package geotechstalker.exception;

import lombok.Getter;

/**
 * Se lanza cuando un parámetro físico está fuera de su rango válido.
 * <p>
 * Nunca se corrige ni se acota la entrada: la fórmula falla en el punto de la violación.
 */
@Getter
public class InvalidInputException extends IllegalArgumentException implements GeotechException {

    private final String parameter;
    private final double value;

    public InvalidInputException(String parameter, double value, String constraint) {
        super(String.format("Parámetro '%s' inválido (%s): debe cumplir %s.", parameter, value, constraint));
        this.parameter = parameter;
        this.value = value;
    }

    @Override
    public GeotechErrorType getErrorType() {
        return GeotechErrorType.INVALID_INPUT;
    }
}
