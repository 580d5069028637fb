package geotechstalker.physics.settlement;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Condición de drenaje de un estrato en consolidación.
 * Determina la longitud del camino de drenaje H usada en el factor tiempo.
 */
@Getter
@RequiredArgsConstructor
public enum DrainageCondition {
    /** Drenaje por una sola cara (base impermeable): H = espesor. */
    SINGLE(1.0),
    /** Drenaje por ambas caras: H = espesor / 2. */
    DOUBLE(0.5);

    /** Fracción del espesor que recorre el agua hasta la cara drenante. */
    private final double pathFraction;

    public double drainagePath(double layerThickness) {
        return layerThickness * pathFraction;
    }
}
