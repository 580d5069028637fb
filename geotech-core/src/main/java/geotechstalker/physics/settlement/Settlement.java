package geotechstalker.physics.settlement;

import geotechstalker.config.SoilConstants;
import geotechstalker.exception.InvalidInputException;

import static geotechstalker.utils.GeoMath.checkFinite;
import static geotechstalker.utils.GeoMath.log10;
import static geotechstalker.utils.Preconditions.requireGreaterThan;
import static geotechstalker.utils.Preconditions.requireInClosedRange;
import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Asientos de un estrato: método de sumas parciales (coeficiente de compresibilidad
 * o módulo edométrico), índice de compresión y asiento elástico inmediato.
 * <p>
 * Cada fórmula documenta sus unidades; las conversiones kPa/MPa forman parte del contrato.
 */
public final class Settlement {

    private Settlement() {}

    /**
     * Asiento de una capa con el coeficiente de compresibilidad:
     * s = av·(σz/1000)·Hi / (1 + e0).
     *
     * @param compressibility av en MPa⁻¹, av ≥ 0.
     * @param initialVoidRatio e0 > -1.
     * @param stressIncrement σz, incremento medio de tensión vertical en kPa, σz ≥ 0.
     * @param layerThickness Hi en m, Hi ≥ 0.
     * @return Asiento en m.
     */
    public static double settlementLayer(double compressibility, double initialVoidRatio,
                                         double stressIncrement, double layerThickness) {
        requireNonNegative(compressibility, "compressibility");
        requireGreaterThan(initialVoidRatio, -1.0, "initialVoidRatio");
        requireNonNegative(stressIncrement, "stressIncrement");
        requireNonNegative(layerThickness, "layerThickness");
        double stressMpa = stressIncrement / SoilConstants.KPA_PER_MPA;
        return checkFinite(compressibility * stressMpa * layerThickness / (1.0 + initialVoidRatio), "s (av)");
    }

    /**
     * Asiento de una capa con el módulo edométrico: s = (σz / Es)·Hi.
     * σz y Es deben ir en la misma unidad de tensión (p. ej. ambos en kPa).
     */
    public static double settlementLayerEs(double oedometricModulus, double stressIncrement, double layerThickness) {
        requirePositive(oedometricModulus, "oedometricModulus");
        requireNonNegative(stressIncrement, "stressIncrement");
        requireNonNegative(layerThickness, "layerThickness");
        return checkFinite(stressIncrement / oedometricModulus * layerThickness, "s (Es)");
    }

    /**
     * Asiento de consolidación primaria de una arcilla normalmente consolidada:
     * s = Cc·H/(1 + e0)·log10((σ0 + Δσ)/σ0).
     *
     * @param compressionIndex  Cc ≥ 0.
     * @param initialVoidRatio  e0 > -1.
     * @param layerThickness    H en m.
     * @param initialStress     σ'0 efectiva en el centro del estrato (kPa), > 0.
     * @param stressIncrement   Δσ (kPa), ≥ 0.
     */
    public static double settlementCompressionIndex(double compressionIndex, double initialVoidRatio,
                                                    double layerThickness, double initialStress,
                                                    double stressIncrement) {
        requireNonNegative(compressionIndex, "compressionIndex");
        requireGreaterThan(initialVoidRatio, -1.0, "initialVoidRatio");
        requireNonNegative(layerThickness, "layerThickness");
        requirePositive(initialStress, "initialStress");
        requireNonNegative(stressIncrement, "stressIncrement");
        double finalStress = initialStress + stressIncrement;
        return checkFinite(compressionIndex * layerThickness / (1.0 + initialVoidRatio) * log10(finalStress / initialStress),
                "s (Cc)");
    }

    /**
     * Asiento de una arcilla sobreconsolidada con presión de preconsolidación σ'p.
     * <ul>
     * <li>σ0 + Δσ ≤ σp: solo recompresión, s = Cr·H/(1+e0)·log10(σf/σ0).</li>
     * <li>σ0 + Δσ > σp: s = Cr·H/(1+e0)·log10(σp/σ0) + Cc·H/(1+e0)·log10(σf/σp).</li>
     * </ul>
     */
    public static double settlementOverconsolidated(double compressionIndex, double recompressionIndex,
                                                    double initialVoidRatio, double layerThickness,
                                                    double initialStress, double preconsolidationStress,
                                                    double stressIncrement) {
        requireNonNegative(compressionIndex, "compressionIndex");
        requireNonNegative(recompressionIndex, "recompressionIndex");
        requireGreaterThan(initialVoidRatio, -1.0, "initialVoidRatio");
        requireNonNegative(layerThickness, "layerThickness");
        requirePositive(initialStress, "initialStress");
        requireNonNegative(stressIncrement, "stressIncrement");
        if (!(preconsolidationStress >= initialStress) || Double.isInfinite(preconsolidationStress)) {
            throw new InvalidInputException("preconsolidationStress", preconsolidationStress,
                    ">= initialStress (" + initialStress + ")");
        }

        double factor = layerThickness / (1.0 + initialVoidRatio);
        double finalStress = initialStress + stressIncrement;
        if (finalStress <= preconsolidationStress) {
            return checkFinite(recompressionIndex * factor * log10(finalStress / initialStress), "s (Cr)");
        }
        return checkFinite(recompressionIndex * factor * log10(preconsolidationStress / initialStress)
                + compressionIndex * factor * log10(finalStress / preconsolidationStress), "s (Cr + Cc)");
    }

    /**
     * Asiento elástico inmediato bajo una zapata flexible: s = q·B·(1 - ν²)·I / E.
     *
     * @param netPressure     q (kPa), ≥ 0.
     * @param width           B (m), > 0.
     * @param elasticModulus  E (kPa), > 0.
     * @param poissonRatio    ν en [0, 0.5].
     * @param influenceFactor I, factor de forma/rigidez, > 0.
     * @return Asiento en m.
     */
    public static double elasticSettlement(double netPressure, double width, double elasticModulus,
                                           double poissonRatio, double influenceFactor) {
        requireNonNegative(netPressure, "netPressure");
        requirePositive(width, "width");
        requirePositive(elasticModulus, "elasticModulus");
        requireInClosedRange(poissonRatio, 0.0, 0.5, "poissonRatio");
        requirePositive(influenceFactor, "influenceFactor");
        return checkFinite(netPressure * width * (1.0 - poissonRatio * poissonRatio) * influenceFactor / elasticModulus,
                "s (elástico)");
    }
}
