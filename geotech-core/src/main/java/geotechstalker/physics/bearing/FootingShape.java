package geotechstalker.physics.bearing;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Forma en planta de la zapata y multiplicadores de Terzaghi asociados.
 * <p>
 * qu = sc·c·Nc + q·Nq + sγ·γ·B·Nγ, con B el ancho (o diámetro en zapatas circulares).
 */
@Getter
@RequiredArgsConstructor
public enum FootingShape {
    /** Zapata corrida (deformación plana). */
    STRIP(1.0, 0.5),
    SQUARE(1.3, 0.4),
    CIRCULAR(1.3, 0.3);

    /** Multiplicador del término de cohesión. */
    private final double cohesionFactor;

    /** Multiplicador del término de peso propio γ·B·Nγ. */
    private final double unitWeightFactor;
}
