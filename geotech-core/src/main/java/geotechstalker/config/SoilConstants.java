package geotechstalker.config;

/**
 * Constantes físicas y factores de conversión compartidos.
 */
public final class SoilConstants {

    /** Peso específico del agua en kN/m³. */
    public static final double UNIT_WEIGHT_WATER = 9.81;

    /** kPa contenidos en un MPa. Usado en las fórmulas con coeficientes expresados en MPa⁻¹. */
    public static final double KPA_PER_MPA = 1000.0;

    /** Factor de porcentaje (grado de saturación, humedad). */
    public static final double PERCENT = 100.0;

    private SoilConstants() {}
}
