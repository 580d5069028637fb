package geotechstalker.exception;

/**
 * Contrato común de los errores de la biblioteca.
 * Permite a quien llama distinguir el tipo de fallo sin depender de la jerarquía concreta.
 */
public interface GeotechException {

    GeotechErrorType getErrorType();
}
