package geotechstalker.utils;

import geotechstalker.exception.DomainException;
import geotechstalker.exception.InvalidInputException;

/**
 * Utilidades numéricas compartidas por todos los grupos de fórmulas.
 * <p>
 * Los ángulos externos se expresan siempre en grados; la conversión a radianes
 * se hace aquí y en ningún otro sitio. Los envoltorios trascendentes fallan con
 * {@link DomainException} en lugar de devolver NaN/Infinity.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class GeoMath {

    /**
     * Margen angular respecto a ±90° por debajo del cual la tangente se considera
     * indefinida (en doble precisión tan(89.9999999°) ya supera 1e8).
     */
    private static final double TAN_POLE_MARGIN_DEG = 1e-9;

    private GeoMath() {}

    public static double degToRad(double degrees) {
        return degrees * Math.PI / 180.0;
    }

    public static double radToDeg(double radians) {
        return radians * 180.0 / Math.PI;
    }

    /**
     * @return true si y solo si |a - b| <= tolerance.
     */
    public static boolean approxEqual(double a, double b, double tolerance) {
        if (!(tolerance >= 0.0)) {
            throw new InvalidInputException("tolerance", tolerance, ">= 0");
        }
        return Math.abs(a - b) <= tolerance;
    }

    /**
     * Tangente de un ángulo en grados.
     * Solo definida en el intervalo abierto (-90°, 90°), que es donde caen
     * todas las transformaciones 45° ± φ/2 de la mecánica de suelos.
     */
    public static double tanDeg(double degrees) {
        if (!(Math.abs(degrees) < 90.0 - TAN_POLE_MARGIN_DEG)) {
            throw new DomainException("Tangente indefinida: el ángulo " + degrees + "° está fuera de (-90°, 90°).");
        }
        return Math.tan(degToRad(degrees));
    }

    public static double sinDeg(double degrees) {
        return checkFinite(Math.sin(degToRad(degrees)), "sin(" + degrees + "°)");
    }

    public static double cosDeg(double degrees) {
        return checkFinite(Math.cos(degToRad(degrees)), "cos(" + degrees + "°)");
    }

    public static double sqrt(double x) {
        if (!(x >= 0.0)) {
            throw new DomainException("Raíz cuadrada de un valor negativo: " + x);
        }
        return Math.sqrt(x);
    }

    public static double exp(double x) {
        return checkFinite(Math.exp(x), "exp(" + x + ")");
    }

    public static double ln(double x) {
        if (!(x > 0.0)) {
            throw new DomainException("Logaritmo de un valor no positivo: " + x);
        }
        return Math.log(x);
    }

    public static double log10(double x) {
        return ln(x) / Math.log(10.0);
    }

    /**
     * Verifica que un resultado intermedio sea finito.
     */
    public static double checkFinite(double value, String expression) {
        if (!Double.isFinite(value)) {
            throw new DomainException("Resultado no finito en " + expression + ": " + value);
        }
        return value;
    }
}
