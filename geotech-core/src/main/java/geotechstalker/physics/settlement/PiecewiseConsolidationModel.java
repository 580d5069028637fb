package geotechstalker.physics.settlement;

import geotechstalker.config.ConsolidationConfig;
import geotechstalker.exception.InvalidInputException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static geotechstalker.utils.GeoMath.exp;
import static geotechstalker.utils.GeoMath.ln;
import static geotechstalker.utils.GeoMath.sqrt;
import static geotechstalker.utils.Preconditions.requireInHalfOpenRange;
import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Ley a tramos para el grado medio de consolidación.
 * <ul>
 * <li><b>Tv ≤ Tc ({@link ConsolidationRegime#EARLY_TIME}):</b> U = 2·√(Tv/π).</li>
 * <li><b>Tv > Tc ({@link ConsolidationRegime#LATE_TIME}):</b> U = 1 - (8/π²)·e^{-π²·Tv/4}.</li>
 * </ul>
 * Las dos expresiones se cortan en Tv ≈ 0.2130 ({@link ConsolidationConfig#BRANCH_INTERSECTION_TIME_FACTOR}),
 * que es el cruce por defecto. Un Tc se acepta solo si el salto en U al cruzarlo es
 * ascendente y no supera {@link ConsolidationConfig#continuityTolerance()}: la curva es
 * continua (dentro de esa tolerancia) y nunca decrece.
 */
@Slf4j
@Getter
public class PiecewiseConsolidationModel implements DegreeOfConsolidationModel {

    private static final double LATE_TIME_AMPLITUDE = 8.0 / (Math.PI * Math.PI);
    private static final double LATE_TIME_DECAY = Math.PI * Math.PI / 4.0;

    private final double crossoverTimeFactor;

    public PiecewiseConsolidationModel() {
        this(ConsolidationConfig.defaults());
    }

    public PiecewiseConsolidationModel(ConsolidationConfig config) {
        Objects.requireNonNull(config, "La configuración de consolidación no puede ser nula.");
        double tc = requirePositive(config.crossoverTimeFactor(), "crossoverTimeFactor");
        double tolerance = requireNonNegative(config.continuityTolerance(), "continuityTolerance");

        double step = lateTimeDegree(tc) - earlyTimeDegree(tc);
        if (step < 0.0) {
            throw new InvalidInputException("crossoverTimeFactor", tc,
                    "Tc ≤ " + ConsolidationConfig.BRANCH_INTERSECTION_TIME_FACTOR
                            + " (sin salto descendente en U(Tv))");
        }
        if (step > tolerance) {
            throw new InvalidInputException("crossoverTimeFactor", tc,
                    "salto en U(Tv) ≤ " + tolerance + " (salto = " + step + ")");
        }
        log.debug("Ley a tramos con Tc={} (salto en el cruce = {})", tc, step);
        this.crossoverTimeFactor = tc;
    }

    @Override
    public String getName() {
        return "Piecewise_Terzaghi(Tc=" + crossoverTimeFactor + ")";
    }

    public ConsolidationRegime regimeFor(double timeFactor) {
        requireNonNegative(timeFactor, "timeFactor");
        return timeFactor <= crossoverTimeFactor ? ConsolidationRegime.EARLY_TIME : ConsolidationRegime.LATE_TIME;
    }

    @Override
    public double degree(double timeFactor) {
        ConsolidationRegime regime = regimeFor(timeFactor);
        double u = switch (regime) {
            case EARLY_TIME -> earlyTimeDegree(timeFactor);
            case LATE_TIME -> lateTimeDegree(timeFactor);
        };
        log.debug("U(Tv={}) = {} [{}]", timeFactor, u, regime);
        return u;
    }

    /**
     * Inversa de {@link #degree(double)}: factor tiempo necesario para alcanzar U.
     * Los valores de U que caen dentro del salto residual en Tc se asignan a Tc.
     *
     * @param degree U en [0, 1). U = 1 solo se alcanza en tiempo infinito.
     */
    public double timeFactorFor(double degree) {
        requireInHalfOpenRange(degree, 0.0, 1.0, "degree");
        if (degree <= earlyTimeDegree(crossoverTimeFactor)) {
            return Math.PI * degree * degree / 4.0;
        }
        double lateTime = -ln((1.0 - degree) / LATE_TIME_AMPLITUDE) / LATE_TIME_DECAY;
        return Math.max(crossoverTimeFactor, lateTime);
    }

    private static double earlyTimeDegree(double timeFactor) {
        return 2.0 * sqrt(timeFactor / Math.PI);
    }

    private static double lateTimeDegree(double timeFactor) {
        return 1.0 - LATE_TIME_AMPLITUDE * exp(-LATE_TIME_DECAY * timeFactor);
    }
}
