package geotechstalker.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de las aproximaciones del grado de consolidación U(Tv).
 *
 * @param crossoverTimeFactor Factor tiempo Tc en el que la ley a tramos pasa de la forma
 *                            de raíz cuadrada (Tv ≤ Tc) a la forma exponencial (Tv > Tc).
 * @param continuityTolerance Salto máximo admitido en U al cruzar Tc. Los saltos descendentes
 *                            se rechazan siempre.
 * @param seriesTolerance     Magnitud del término a partir de la cual se trunca la serie exacta de Terzaghi.
 * @param maxSeriesTerms      Número máximo de términos de la serie (la convergencia es lenta para Tv pequeño).
 */
@Builder
@With
public record ConsolidationConfig(
        double crossoverTimeFactor,
        double continuityTolerance,
        double seriesTolerance,
        int maxSeriesTerms
) {
    /**
     * Tv en el que 2·√(Tv/π) = 1 - (8/π²)·e^{-π²·Tv/4} (raíz en 0.2130332869632009...),
     * redondeado por defecto para que el salto residual sea ascendente (≈ 1e-13).
     */
    public static final double BRANCH_INTERSECTION_TIME_FACTOR = 0.21303328696;

    public static ConsolidationConfig defaults() {
        return ConsolidationConfig.builder()
                .crossoverTimeFactor(BRANCH_INTERSECTION_TIME_FACTOR)
                .continuityTolerance(1e-9)
                .seriesTolerance(1e-12)
                .maxSeriesTerms(10_000)
                .build();
    }
}
