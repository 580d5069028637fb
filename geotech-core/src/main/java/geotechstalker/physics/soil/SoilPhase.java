package geotechstalker.physics.soil;

import geotechstalker.config.SoilConstants;
import geotechstalker.exception.InvalidInputException;

import static geotechstalker.utils.GeoMath.checkFinite;
import static geotechstalker.utils.Preconditions.requireGreaterThan;
import static geotechstalker.utils.Preconditions.requireInHalfOpenRange;
import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Relaciones de fase del suelo (sólido, agua, aire).
 * <p>
 * Saturación y humedad se expresan en porcentaje (0-100) en toda esta familia.
 */
public final class SoilPhase {

    private SoilPhase() {}

    /** e = n / (1 - n), con 0 ≤ n < 1. */
    public static double voidRatio(double porosity) {
        requireInHalfOpenRange(porosity, 0.0, 1.0, "porosity");
        return checkFinite(porosity / (1.0 - porosity), "e");
    }

    /** n = e / (1 + e), con e ≥ 0. */
    public static double porosity(double voidRatio) {
        requireNonNegative(voidRatio, "voidRatio");
        return checkFinite(voidRatio / (1.0 + voidRatio), "n");
    }

    /**
     * Sr = Vw / Vv · 100 (%).
     */
    public static double degreeOfSaturation(double waterVolume, double voidVolume) {
        requirePositive(voidVolume, "voidVolume");
        requireNonNegative(waterVolume, "waterVolume");
        if (waterVolume > voidVolume) {
            throw new InvalidInputException("waterVolume", waterVolume, "<= voidVolume (" + voidVolume + ")");
        }
        return checkFinite(waterVolume / voidVolume * SoilConstants.PERCENT, "Sr");
    }

    /**
     * ρd = ρ / (1 + w/100).
     *
     * @param bulkDensity ρ > 0 (cualquier unidad de densidad; el resultado va en la misma).
     * @param waterContent w en %, ≥ 0.
     */
    public static double dryDensity(double bulkDensity, double waterContent) {
        requirePositive(bulkDensity, "bulkDensity");
        requireNonNegative(waterContent, "waterContent");
        return checkFinite(bulkDensity / (1.0 + waterContent / SoilConstants.PERCENT), "ρd");
    }

    /** w = Ww / Ws · 100 (%). */
    public static double waterContent(double waterWeight, double solidsWeight) {
        requireNonNegative(waterWeight, "waterWeight");
        requirePositive(solidsWeight, "solidsWeight");
        return checkFinite(waterWeight / solidsWeight * SoilConstants.PERCENT, "w");
    }

    /**
     * e = w·Gs / Sr, con w y Sr en %.
     */
    public static double voidRatioFromWaterContent(double waterContent, double specificGravity, double saturation) {
        requireNonNegative(waterContent, "waterContent");
        requirePositive(specificGravity, "specificGravity");
        requirePositive(saturation, "saturation");
        if (saturation > SoilConstants.PERCENT) {
            throw new InvalidInputException("saturation", saturation, "<= 100");
        }
        return checkFinite(waterContent * specificGravity / saturation, "e (w·Gs/Sr)");
    }

    /** γd = Gs·γw / (1 + e) (kN/m³). */
    public static double dryUnitWeight(double specificGravity, double voidRatio) {
        requirePositive(specificGravity, "specificGravity");
        requireNonNegative(voidRatio, "voidRatio");
        return checkFinite(specificGravity * SoilConstants.UNIT_WEIGHT_WATER / (1.0 + voidRatio), "γd");
    }

    /** γsat = (Gs + e)·γw / (1 + e) (kN/m³). */
    public static double saturatedUnitWeight(double specificGravity, double voidRatio) {
        requirePositive(specificGravity, "specificGravity");
        requireNonNegative(voidRatio, "voidRatio");
        return checkFinite((specificGravity + voidRatio) * SoilConstants.UNIT_WEIGHT_WATER / (1.0 + voidRatio), "γsat");
    }

    /** γ' = γsat - γw (kN/m³). */
    public static double submergedUnitWeight(double saturatedUnitWeight) {
        requireGreaterThan(saturatedUnitWeight, SoilConstants.UNIT_WEIGHT_WATER, "saturatedUnitWeight");
        return saturatedUnitWeight - SoilConstants.UNIT_WEIGHT_WATER;
    }
}
