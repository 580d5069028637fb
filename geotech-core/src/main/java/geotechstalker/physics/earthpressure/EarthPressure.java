package geotechstalker.physics.earthpressure;

import geotechstalker.exception.DomainException;
import geotechstalker.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import static geotechstalker.utils.GeoMath.checkFinite;
import static geotechstalker.utils.GeoMath.cosDeg;
import static geotechstalker.utils.GeoMath.sinDeg;
import static geotechstalker.utils.GeoMath.sqrt;
import static geotechstalker.utils.GeoMath.tanDeg;
import static geotechstalker.utils.Preconditions.requireGreaterThan;
import static geotechstalker.utils.Preconditions.requireInClosedRange;
import static geotechstalker.utils.Preconditions.requireInHalfOpenRange;
import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Biblioteca estática de empujes laterales del terreno sobre muros.
 * <p>
 * Contiene las teorías de Rankine (muro vertical liso, relleno horizontal),
 * Coulomb (cuña de rotura con rozamiento muro-terreno e inclinaciones) y el
 * empuje al reposo de Jaky.
 * <ul>
 * <li>Ángulos en grados.</li>
 * <li>Pesos específicos en kN/m³, profundidades en m, presiones en kPa, fuerzas en kN/m.</li>
 * </ul>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class EarthPressure {

    private static final double MAX_FRICTION_ANGLE = 90.0;

    private EarthPressure() {}

    // --- Rankine ---

    /**
     * Ka = tan²(45° - φ/2).
     *
     * @param frictionAngle Ángulo de rozamiento interno φ en grados, 0 ≤ φ < 90.
     */
    public static double rankineActiveCoefficient(double frictionAngle) {
        requireInHalfOpenRange(frictionAngle, 0.0, MAX_FRICTION_ANGLE, "frictionAngle");
        double t = tanDeg(45.0 - frictionAngle / 2.0);
        return checkFinite(t * t, "Ka");
    }

    /**
     * Kp = tan²(45° + φ/2).
     *
     * @param frictionAngle Ángulo de rozamiento interno φ en grados, 0 ≤ φ < 90.
     */
    public static double rankinePassiveCoefficient(double frictionAngle) {
        requireInHalfOpenRange(frictionAngle, 0.0, MAX_FRICTION_ANGLE, "frictionAngle");
        double t = tanDeg(45.0 + frictionAngle / 2.0);
        return checkFinite(t * t, "Kp");
    }

    /**
     * Presión activa a la profundidad z: σa = Ka·γ·z (kPa).
     */
    public static double rankineActivePressure(double ka, double unitWeight, double depth) {
        requirePositive(ka, "ka");
        requirePositive(unitWeight, "unitWeight");
        requireNonNegative(depth, "depth");
        return checkFinite(ka * unitWeight * depth, "σa");
    }

    /**
     * Resultante del diagrama triangular de empuje activo sobre una altura H:
     * Pa = ½·Ka·γ·H² (kN/m). Actúa a H/3 desde la base.
     */
    public static double rankineActiveForce(double ka, double unitWeight, double height) {
        requirePositive(ka, "ka");
        requirePositive(unitWeight, "unitWeight");
        requireNonNegative(height, "height");
        return checkFinite(0.5 * ka * unitWeight * height * height, "Pa");
    }

    public static double rankinePassivePressure(double kp, double unitWeight, double depth) {
        requirePositive(kp, "kp");
        requirePositive(unitWeight, "unitWeight");
        requireNonNegative(depth, "depth");
        return checkFinite(kp * unitWeight * depth, "σp");
    }

    public static double rankinePassiveForce(double kp, double unitWeight, double height) {
        requirePositive(kp, "kp");
        requirePositive(unitWeight, "unitWeight");
        requireNonNegative(height, "height");
        return checkFinite(0.5 * kp * unitWeight * height * height, "Pp");
    }

    /**
     * Presión activa en suelo con cohesión: σa = Ka·γ·z - 2c·√Ka.
     * <p>
     * Por encima de la profundidad de grieta de tracción el suelo no empuja
     * (no transmite tracciones al muro), así que el resultado se toma como 0.
     */
    public static double rankineActivePressureCohesive(double ka, double unitWeight, double depth, double cohesion) {
        requireNonNegative(cohesion, "cohesion");
        double frictional = rankineActivePressure(ka, unitWeight, depth);
        double pressure = checkFinite(frictional - 2.0 * cohesion * sqrt(ka), "σa (cohesivo)");
        return Math.max(0.0, pressure);
    }

    /**
     * Presión pasiva en suelo con cohesión: σp = Kp·γ·z + 2c·√Kp.
     */
    public static double rankinePassivePressureCohesive(double kp, double unitWeight, double depth, double cohesion) {
        requireNonNegative(cohesion, "cohesion");
        return checkFinite(rankinePassivePressure(kp, unitWeight, depth) + 2.0 * cohesion * sqrt(kp), "σp (cohesivo)");
    }

    /**
     * Profundidad de la grieta de tracción: z0 = 2c / (γ·√Ka) (m).
     */
    public static double tensionCrackDepth(double ka, double unitWeight, double cohesion) {
        requirePositive(ka, "ka");
        requirePositive(unitWeight, "unitWeight");
        requireNonNegative(cohesion, "cohesion");
        return checkFinite(2.0 * cohesion / (unitWeight * sqrt(ka)), "z0");
    }

    // --- Coulomb ---

    /**
     * Coeficiente de empuje activo de Coulomb.
     * <pre>
     *                          cos²(φ - θ)
     * Ka = ---------------------------------------------------------------
     *      cos²θ·cos(δ + θ)·[1 + √( sin(φ + δ)·sin(φ - β) / (cos(δ + θ)·cos(θ - β)) )]²
     * </pre>
     *
     * @param frictionAngle   φ, ángulo de rozamiento interno (grados), 0 ≤ φ < 90.
     * @param wallInclination θ, inclinación del trasdós respecto a la vertical (grados), |θ| < 90.
     * @param backfillSlope   β, pendiente del relleno respecto a la horizontal (grados), |β| ≤ φ.
     * @param wallFriction    δ, ángulo de rozamiento muro-terreno (grados), 0 ≤ δ ≤ φ.
     */
    public static double coulombActiveCoefficient(double frictionAngle, double wallInclination,
                                                  double backfillSlope, double wallFriction) {
        validateCoulombAngles(frictionAngle, wallInclination, backfillSlope, wallFriction);
        double phi = frictionAngle;
        double theta = wallInclination;

        double cosDeltaTheta = cosDeg(wallFriction + theta);
        double cosThetaBeta = cosDeg(theta - backfillSlope);
        requirePositiveDenominator(cosDeltaTheta * cosThetaBeta, "cos(δ+θ)·cos(θ-β)");

        double root = sqrt(sinDeg(phi + wallFriction) * sinDeg(phi - backfillSlope) / (cosDeltaTheta * cosThetaBeta));
        double cosTheta = cosDeg(theta);
        double denominator = cosTheta * cosTheta * cosDeltaTheta * (1.0 + root) * (1.0 + root);
        requirePositiveDenominator(denominator, "denominador de Ka (Coulomb)");

        double cosPhiTheta = cosDeg(phi - theta);
        return checkFinite(cosPhiTheta * cosPhiTheta / denominator, "Ka (Coulomb)");
    }

    /**
     * Coeficiente de empuje pasivo de Coulomb.
     * <pre>
     *                          cos²(φ + θ)
     * Kp = ---------------------------------------------------------------
     *      cos²θ·cos(δ - θ)·[1 - √( sin(φ + δ)·sin(φ + β) / (cos(δ - θ)·cos(β - θ)) )]²
     * </pre>
     * Con δ elevado la superficie plana de Coulomb sobreestima el empuje pasivo;
     * si el corchete se anula el resultado no existe y se lanza {@link DomainException}.
     */
    public static double coulombPassiveCoefficient(double frictionAngle, double wallInclination,
                                                   double backfillSlope, double wallFriction) {
        validateCoulombAngles(frictionAngle, wallInclination, backfillSlope, wallFriction);
        double phi = frictionAngle;
        double theta = wallInclination;

        if (wallFriction > phi / 2.0) {
            log.warn("Coulomb pasivo con δ={}° > φ/2={}°: la cuña plana sobreestima Kp.", wallFriction, phi / 2.0);
        }

        double cosDeltaTheta = cosDeg(wallFriction - theta);
        double cosBetaTheta = cosDeg(backfillSlope - theta);
        requirePositiveDenominator(cosDeltaTheta * cosBetaTheta, "cos(δ-θ)·cos(β-θ)");

        double root = sqrt(sinDeg(phi + wallFriction) * sinDeg(phi + backfillSlope) / (cosDeltaTheta * cosBetaTheta));
        double bracket = 1.0 - root;
        if (!(bracket > 0.0)) {
            throw new DomainException("Kp de Coulomb no definido: 1 - √(...) = " + bracket + " ≤ 0.");
        }

        double cosTheta = cosDeg(theta);
        double denominator = cosTheta * cosTheta * cosDeltaTheta * bracket * bracket;
        requirePositiveDenominator(denominator, "denominador de Kp (Coulomb)");

        double cosPhiTheta = cosDeg(phi + theta);
        return checkFinite(cosPhiTheta * cosPhiTheta / denominator, "Kp (Coulomb)");
    }

    /**
     * Resultante activa de Coulomb: Pa = ½·Ka·γ·H², inclinada δ respecto a la normal al trasdós.
     */
    public static double coulombActiveForce(double ka, double unitWeight, double height) {
        return rankineActiveForce(ka, unitWeight, height);
    }

    // --- Reposo ---

    /**
     * K0 = 1 - sin φ (Jaky, suelos normalmente consolidados).
     */
    public static double atRestCoefficient(double frictionAngle) {
        requireInHalfOpenRange(frictionAngle, 0.0, MAX_FRICTION_ANGLE, "frictionAngle");
        return 1.0 - sinDeg(frictionAngle);
    }

    /**
     * K0 = (1 - sin φ)·OCR^(sin φ) para suelos sobreconsolidados (Mayne y Kulhawy).
     *
     * @param overconsolidationRatio OCR ≥ 1.
     */
    public static double atRestCoefficientOverconsolidated(double frictionAngle, double overconsolidationRatio) {
        double k0 = atRestCoefficient(frictionAngle);
        if (!(overconsolidationRatio >= 1.0) || Double.isInfinite(overconsolidationRatio)) {
            throw new InvalidInputException("overconsolidationRatio", overconsolidationRatio, ">= 1");
        }
        double sinPhi = sinDeg(frictionAngle);
        return checkFinite(k0 * Math.pow(overconsolidationRatio, sinPhi), "K0 (OCR)");
    }

    public static double atRestPressure(double k0, double unitWeight, double depth) {
        requirePositive(k0, "k0");
        requirePositive(unitWeight, "unitWeight");
        requireNonNegative(depth, "depth");
        return checkFinite(k0 * unitWeight * depth, "σ0");
    }

    // --- Helpers internos ---

    private static void validateCoulombAngles(double phi, double theta, double beta, double delta) {
        requireInHalfOpenRange(phi, 0.0, MAX_FRICTION_ANGLE, "frictionAngle");
        requireGreaterThan(theta, -90.0, "wallInclination");
        if (!(theta < 90.0)) {
            throw new InvalidInputException("wallInclination", theta, "< 90");
        }
        requireInClosedRange(beta, -phi, phi, "backfillSlope");
        requireInClosedRange(delta, 0.0, phi, "wallFriction");
    }

    private static void requirePositiveDenominator(double value, String what) {
        if (!(value > 0.0)) {
            throw new DomainException("Denominador no positivo en " + what + ": " + value);
        }
    }
}
