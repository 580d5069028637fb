package geotechstalker.utils;

import geotechstalker.exception.InvalidInputException;

/**
 * Validaciones de entrada usadas en la frontera de cada fórmula.
 * <p>
 * Todos los métodos lanzan {@link InvalidInputException} con el nombre del parámetro,
 * su valor y la restricción incumplida. Los valores NaN nunca pasan ninguna validación.
 */
public final class Preconditions {

    private Preconditions() {}

    public static double requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(name, value, "ser un número finito");
        }
        return value;
    }

    /** value > 0 */
    public static double requirePositive(double value, String name) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new InvalidInputException(name, value, "> 0");
        }
        return value;
    }

    /** value >= 0 */
    public static double requireNonNegative(double value, String name) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new InvalidInputException(name, value, ">= 0");
        }
        return value;
    }

    /** value > bound */
    public static double requireGreaterThan(double value, double bound, String name) {
        if (!(value > bound) || Double.isInfinite(value)) {
            throw new InvalidInputException(name, value, "> " + bound);
        }
        return value;
    }

    /** min <= value < max */
    public static double requireInHalfOpenRange(double value, double min, double max, String name) {
        if (!(value >= min && value < max)) {
            throw new InvalidInputException(name, value, "estar en [" + min + ", " + max + ")");
        }
        return value;
    }

    /** min <= value <= max */
    public static double requireInClosedRange(double value, double min, double max, String name) {
        if (!(value >= min && value <= max)) {
            throw new InvalidInputException(name, value, "estar en [" + min + ", " + max + "]");
        }
        return value;
    }
}
