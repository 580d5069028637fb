package geotechstalker.physics.settlement;

/**
 * Contrato de los modelos que dan el grado medio de consolidación U en función
 * del factor tiempo Tv (consolidación unidimensional de Terzaghi).
 * <p>
 * Toda implementación debe cumplir U ∈ [0, 1], U(0) = 0, U → 1 cuando Tv → ∞
 * y ser monótona no decreciente.
 */
@FunctionalInterface
public interface DegreeOfConsolidationModel {

    /**
     * @param timeFactor Factor tiempo adimensional Tv ≥ 0.
     * @return Grado medio de consolidación como fracción en [0, 1].
     */
    double degree(double timeFactor);

    default String getName() {
        return getClass().getSimpleName();
    }
}
