package geotechstalker.exception;

/**
 * Se lanza cuando una operación trascendente intermedia cae fuera de su dominio
 * matemático (tan(90°), raíz de un negativo, desbordamiento de exp...).
 * <p>
 * Sustituye al NaN/Infinity silencioso que devolvería {@link Math}.
 */
public class DomainException extends ArithmeticException implements GeotechException {

    public DomainException(String message) {
        super(message);
    }

    @Override
    public GeotechErrorType getErrorType() {
        return GeotechErrorType.DOMAIN_ERROR;
    }
}
