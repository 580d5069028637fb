package geotechstalker.physics.bearing;

import lombok.Builder;

/**
 * Factores de capacidad portante de Terzaghi para un ángulo de rozamiento dado.
 *
 * @param frictionAngle φ en grados.
 * @param nc            Factor de cohesión Nc.
 * @param nq            Factor de sobrecarga Nq.
 * @param ngamma        Factor de peso propio Nγ.
 */
@Builder
public record BearingCapacityFactors(double frictionAngle, double nc, double nq, double ngamma) {
}
