package geotechstalker.physics.bearing;

import geotechstalker.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static geotechstalker.utils.GeoMath.checkFinite;
import static geotechstalker.utils.GeoMath.cosDeg;
import static geotechstalker.utils.GeoMath.degToRad;
import static geotechstalker.utils.GeoMath.exp;
import static geotechstalker.utils.GeoMath.sinDeg;
import static geotechstalker.utils.GeoMath.tanDeg;
import static geotechstalker.utils.Preconditions.requireInClosedRange;
import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Biblioteca estática de capacidad portante de cimentaciones superficiales (Terzaghi, 1943).
 * <p>
 * Los factores solo están ajustados hasta φ = 50°; por encima se rechaza la entrada
 * en lugar de extrapolar. Presiones en kPa, anchos en m, γ en kN/m³.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class BearingCapacity {

    /** Límite superior del rango ajustado de los factores de Terzaghi. */
    public static final double MAX_FRICTION_ANGLE = 50.0;

    /**
     * Por debajo de este ángulo (grados) Nc se evalúa con su límite analítico
     * 1 + 3π/2, porque (Nq - 1)·cot φ es una indeterminación 0·∞.
     */
    private static final double SMALL_ANGLE_THRESHOLD = 1e-6;

    /** lim φ→0 de Nc = 1 + 3π/2 ≈ 5.71. */
    private static final double NC_AT_ZERO_FRICTION = 1.0 + 1.5 * Math.PI;

    private BearingCapacity() {}

    /**
     * Nq = e^{2(3π/4 - φ/2)·tan φ} / (2·cos²(45° + φ/2)). Nq(0) = 1.
     */
    public static double terzaghiNq(double frictionAngle) {
        validateFrictionAngle(frictionAngle);
        double exponent = 2.0 * (0.75 * Math.PI - degToRad(frictionAngle) / 2.0) * tanDeg(frictionAngle);
        double cos = cosDeg(45.0 + frictionAngle / 2.0);
        return checkFinite(exp(exponent) / (2.0 * cos * cos), "Nq");
    }

    /**
     * Nc = (Nq - 1)·cot φ, con el límite 1 + 3π/2 para φ → 0 (arcillas en condiciones no drenadas).
     */
    public static double terzaghiNc(double frictionAngle) {
        validateFrictionAngle(frictionAngle);
        if (frictionAngle < SMALL_ANGLE_THRESHOLD) {
            return NC_AT_ZERO_FRICTION;
        }
        return checkFinite((terzaghiNq(frictionAngle) - 1.0) / tanDeg(frictionAngle), "Nc");
    }

    /**
     * Nγ = 2·(Nq + 1)·tan φ / (1 + 0.4·sin 4φ).
     * <p>
     * Ajuste cerrado de Coduto a los valores tabulados por Terzaghi (el original
     * procede de un Kpγ gráfico).
     * <p>
     * A diferencia de Nc y Nq, Nγ no es estrictamente positivo en todo el rango:
     * Nγ(0) = 0 (valor clásico de Terzaghi, sin rozamiento el peso propio no aporta)
     * y Nγ > 0 para φ > 0. Sigue siendo estrictamente creciente en [0°, 50°].
     */
    public static double terzaghiNgamma(double frictionAngle) {
        validateFrictionAngle(frictionAngle);
        double nq = terzaghiNq(frictionAngle);
        return checkFinite(2.0 * (nq + 1.0) * tanDeg(frictionAngle) / (1.0 + 0.4 * sinDeg(4.0 * frictionAngle)), "Nγ");
    }

    public static BearingCapacityFactors terzaghiFactors(double frictionAngle) {
        return BearingCapacityFactors.builder()
                .frictionAngle(frictionAngle)
                .nc(terzaghiNc(frictionAngle))
                .nq(terzaghiNq(frictionAngle))
                .ngamma(terzaghiNgamma(frictionAngle))
                .build();
    }

    /**
     * Carga de hundimiento de una zapata corrida: qu = c·Nc + q·Nq + ½·γ·B·Nγ (kPa).
     *
     * @param cohesion      c (kPa), c ≥ 0.
     * @param surcharge     q = γ·Df, sobrecarga al nivel de apoyo (kPa), q ≥ 0.
     * @param unitWeight    γ del terreno bajo la zapata (kN/m³), γ > 0.
     * @param width         B (m), B > 0.
     * @param frictionAngle φ (grados), 0 ≤ φ ≤ 50.
     */
    public static double terzaghiBearingCapacity(double cohesion, double surcharge, double unitWeight,
                                                 double width, double frictionAngle) {
        return terzaghiBearingCapacity(cohesion, surcharge, unitWeight, width, frictionAngle, FootingShape.STRIP);
    }

    /**
     * Carga de hundimiento con los multiplicadores de forma de Terzaghi
     * (B es el lado en zapatas cuadradas y el diámetro en circulares).
     */
    public static double terzaghiBearingCapacity(double cohesion, double surcharge, double unitWeight,
                                                 double width, double frictionAngle, FootingShape shape) {
        requireNonNegative(cohesion, "cohesion");
        requireNonNegative(surcharge, "surcharge");
        requirePositive(unitWeight, "unitWeight");
        requirePositive(width, "width");
        Objects.requireNonNull(shape, "La forma de la zapata no puede ser nula.");

        BearingCapacityFactors factors = terzaghiFactors(frictionAngle);

        double cohesionTerm = shape.getCohesionFactor() * cohesion * factors.nc();
        double surchargeTerm = surcharge * factors.nq();
        double weightTerm = shape.getUnitWeightFactor() * unitWeight * width * factors.ngamma();

        log.debug("Terzaghi {}: c·Nc={} q·Nq={} γBNγ={} (φ={}°)",
                shape, cohesionTerm, surchargeTerm, weightTerm, frictionAngle);

        return checkFinite(cohesionTerm + surchargeTerm + weightTerm, "qu");
    }

    /**
     * Sobrecarga efectiva al nivel de cimentación: q = γ·Df (kPa).
     */
    public static double overburdenPressure(double unitWeight, double foundationDepth) {
        requirePositive(unitWeight, "unitWeight");
        requireNonNegative(foundationDepth, "foundationDepth");
        return checkFinite(unitWeight * foundationDepth, "q");
    }

    /**
     * Presión admisible: qa = qu / Fs.
     *
     * @param ultimateCapacity qu (kPa), qu ≥ 0.
     * @param safetyFactor     Fs > 0.
     */
    public static double bearingCapacityDesign(double ultimateCapacity, double safetyFactor) {
        requireNonNegative(ultimateCapacity, "ultimateCapacity");
        requirePositive(safetyFactor, "safetyFactor");
        return checkFinite(ultimateCapacity / safetyFactor, "qa");
    }

    /**
     * Presión admisible neta: qa,net = (qu - q) / Fs. Exige qu ≥ q.
     */
    public static double netAllowableBearingCapacity(double ultimateCapacity, double surcharge, double safetyFactor) {
        requireNonNegative(surcharge, "surcharge");
        requirePositive(safetyFactor, "safetyFactor");
        requireNonNegative(ultimateCapacity, "ultimateCapacity");
        if (ultimateCapacity < surcharge) {
            throw new InvalidInputException("ultimateCapacity", ultimateCapacity, ">= surcharge (" + surcharge + ")");
        }
        return checkFinite((ultimateCapacity - surcharge) / safetyFactor, "qa,net");
    }

    private static void validateFrictionAngle(double frictionAngle) {
        requireInClosedRange(frictionAngle, 0.0, MAX_FRICTION_ANGLE, "frictionAngle");
    }
}
