package geotechstalker.physics.seepage;

import geotechstalker.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import static geotechstalker.utils.GeoMath.checkFinite;
import static geotechstalker.utils.Preconditions.requireFinite;
import static geotechstalker.utils.Preconditions.requireGreaterThan;
import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Flujo de agua a través del terreno (ley de Darcy) y comprobación de sifonamiento.
 * <p>
 * Permeabilidad k en m/s, longitudes en m, áreas en m², caudales en m³/s.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class Seepage {

    private Seepage() {}

    /**
     * Velocidad de descarga de Darcy: v = k·i (m/s).
     */
    public static double darcyVelocity(double permeability, double hydraulicGradient) {
        requirePositive(permeability, "permeability");
        requireNonNegative(hydraulicGradient, "hydraulicGradient");
        return checkFinite(permeability * hydraulicGradient, "v (Darcy)");
    }

    /**
     * Caudal a través de una sección: Q = k·i·A (m³/s).
     */
    public static double darcyFlowRate(double permeability, double hydraulicGradient, double area) {
        requireNonNegative(area, "area");
        return checkFinite(darcyVelocity(permeability, hydraulicGradient) * area, "Q (Darcy)");
    }

    /**
     * Gradiente hidráulico: i = Δh / L.
     *
     * @param headLoss Pérdida de carga Δh (m), ≥ 0.
     * @param length   Longitud del recorrido de filtración L (m), > 0.
     */
    public static double hydraulicGradient(double headLoss, double length) {
        requireNonNegative(headLoss, "headLoss");
        requirePositive(length, "length");
        return checkFinite(headLoss / length, "i");
    }

    /**
     * Gradiente crítico de sifonamiento: icr = (Gs - 1)/(1 + e).
     *
     * @param specificGravity Gs > 1.
     * @param voidRatio       e > -1.
     */
    public static double criticalHydraulicGradient(double specificGravity, double voidRatio) {
        requireGreaterThan(specificGravity, 1.0, "specificGravity");
        requireGreaterThan(voidRatio, -1.0, "voidRatio");
        return checkFinite((specificGravity - 1.0) / (1.0 + voidRatio), "icr");
    }

    /**
     * Decisión de umbral: hay sifonamiento si i ≥ icr. Comparación exacta, sin tolerancia.
     */
    public static boolean isPiping(double hydraulicGradient, double criticalGradient) {
        requireFinite(hydraulicGradient, "hydraulicGradient");
        requireFinite(criticalGradient, "criticalGradient");
        boolean piping = hydraulicGradient >= criticalGradient;
        if (piping) {
            log.warn("Sifonamiento: i={} ≥ icr={}", hydraulicGradient, criticalGradient);
        }
        return piping;
    }

    /**
     * Coeficiente de seguridad frente a sifonamiento: F = icr / i.
     */
    public static double pipingSafetyFactor(double hydraulicGradient, double criticalGradient) {
        requirePositive(hydraulicGradient, "hydraulicGradient");
        requirePositive(criticalGradient, "criticalGradient");
        return checkFinite(criticalGradient / hydraulicGradient, "F (sifonamiento)");
    }

    /**
     * Velocidad real media del agua en los poros: vs = v / n.
     *
     * @param porosity n en (0, 1].
     */
    public static double seepageVelocity(double darcyVelocity, double porosity) {
        requireNonNegative(darcyVelocity, "darcyVelocity");
        if (!(porosity > 0.0 && porosity <= 1.0)) {
            throw new InvalidInputException("porosity", porosity, "estar en (0, 1]");
        }
        return checkFinite(darcyVelocity / porosity, "vs");
    }

    /**
     * Fuerza de filtración por unidad de volumen: j = i·γw (kN/m³).
     */
    public static double seepageForce(double hydraulicGradient, double waterUnitWeight) {
        requireNonNegative(hydraulicGradient, "hydraulicGradient");
        requirePositive(waterUnitWeight, "waterUnitWeight");
        return checkFinite(hydraulicGradient * waterUnitWeight, "j");
    }

    /**
     * Caudal por metro lineal a partir de una red de flujo: q = k·Δh·Nf/Nd (m³/s/m).
     *
     * @param flowChannels     Nf, número de canales de flujo, > 0.
     * @param equipotentialDrops Nd, número de saltos equipotenciales, > 0.
     */
    public static double flowNetDischarge(double permeability, double headLoss,
                                          double flowChannels, double equipotentialDrops) {
        requirePositive(permeability, "permeability");
        requireNonNegative(headLoss, "headLoss");
        requirePositive(flowChannels, "flowChannels");
        requirePositive(equipotentialDrops, "equipotentialDrops");
        return checkFinite(permeability * headLoss * flowChannels / equipotentialDrops, "q (red de flujo)");
    }
}
