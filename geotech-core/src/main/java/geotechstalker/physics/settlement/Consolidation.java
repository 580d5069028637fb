package geotechstalker.physics.settlement;

import geotechstalker.config.ConsolidationConfig;
import geotechstalker.config.SoilConstants;
import geotechstalker.exception.DomainException;

import java.util.Objects;

import static geotechstalker.utils.GeoMath.checkFinite;
import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Consolidación unidimensional de Terzaghi: factor tiempo, grado medio de
 * consolidación y asiento final y diferido.
 * <p>
 * H es siempre la longitud del camino de drenaje: el espesor completo con drenaje
 * por una cara y la mitad con drenaje por ambas ({@link DrainageCondition}).
 */
public final class Consolidation {

    private static final DegreeOfConsolidationModel DEFAULT_MODEL = new PiecewiseConsolidationModel();

    private Consolidation() {}

    /**
     * Tv = Cv·t / H².
     *
     * @param consolidationCoefficient Cv (m²/s), > 0.
     * @param time                     t (s), ≥ 0.
     * @param drainagePath             H (m), > 0.
     */
    public static double timeFactor(double consolidationCoefficient, double time, double drainagePath) {
        requirePositive(consolidationCoefficient, "consolidationCoefficient");
        requireNonNegative(time, "time");
        requirePositive(drainagePath, "drainagePath");
        return checkFinite(consolidationCoefficient * time / (drainagePath * drainagePath), "Tv");
    }

    /**
     * t = Tv·H² / Cv, tiempo necesario para alcanzar un factor tiempo dado.
     */
    public static double timeForTimeFactor(double timeFactor, double consolidationCoefficient, double drainagePath) {
        requireNonNegative(timeFactor, "timeFactor");
        requirePositive(consolidationCoefficient, "consolidationCoefficient");
        requirePositive(drainagePath, "drainagePath");
        return checkFinite(timeFactor * drainagePath * drainagePath / consolidationCoefficient, "t");
    }

    public static double drainagePathLength(double layerThickness, DrainageCondition drainage) {
        requirePositive(layerThickness, "layerThickness");
        Objects.requireNonNull(drainage, "La condición de drenaje no puede ser nula.");
        return drainage.drainagePath(layerThickness);
    }

    /**
     * Grado medio de consolidación U ∈ [0, 1] con la ley a tramos por defecto
     * (cruce en la intersección de las dos ramas, Tv ≈ 0.2130).
     */
    public static double consolidationDegree(double timeFactor) {
        return DEFAULT_MODEL.degree(timeFactor);
    }

    public static double consolidationDegree(double timeFactor, ConsolidationConfig config) {
        return new PiecewiseConsolidationModel(config).degree(timeFactor);
    }

    /**
     * Factor tiempo necesario para alcanzar el grado de consolidación U ∈ [0, 1).
     */
    public static double timeFactorForDegree(double degree) {
        return new PiecewiseConsolidationModel().timeFactorFor(degree);
    }

    /**
     * Asiento final de consolidación: s∞ = mv·(σz/1000)·H.
     *
     * @param volumeCompressibility mv en MPa⁻¹, > 0.
     * @param stressIncrement       σz en kPa, ≥ 0.
     * @param layerThickness        H en m, ≥ 0.
     * @return Asiento en m.
     */
    public static double consolidationSettlementFinal(double volumeCompressibility, double stressIncrement,
                                                      double layerThickness) {
        requirePositive(volumeCompressibility, "volumeCompressibility");
        requireNonNegative(stressIncrement, "stressIncrement");
        requireNonNegative(layerThickness, "layerThickness");
        return checkFinite(volumeCompressibility * (stressIncrement / SoilConstants.KPA_PER_MPA) * layerThickness, "s∞");
    }

    /**
     * Asiento alcanzado en el instante de factor tiempo Tv: s(t) = s∞·U(Tv).
     */
    public static double settlementAtTime(double finalSettlement, double timeFactor) {
        return settlementAtTime(finalSettlement, timeFactor, DEFAULT_MODEL);
    }

    public static double settlementAtTime(double finalSettlement, double timeFactor,
                                          DegreeOfConsolidationModel model) {
        requireNonNegative(finalSettlement, "finalSettlement");
        requireNonNegative(timeFactor, "timeFactor");
        Objects.requireNonNull(model, "El modelo de consolidación no puede ser nulo.");
        double degree = model.degree(timeFactor);
        if (!(degree >= 0.0 && degree <= 1.0)) {
            throw new DomainException("El modelo " + model.getName() + " devolvió U=" + degree + " fuera de [0, 1].");
        }
        return finalSettlement * degree;
    }
}
