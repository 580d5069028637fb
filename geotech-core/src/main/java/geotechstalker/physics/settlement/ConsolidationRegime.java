package geotechstalker.physics.settlement;

/**
 * Tramo de la ley aproximada U(Tv) que se aplica a un factor tiempo concreto.
 */
public enum ConsolidationRegime {
    /**
     * Tiempos cortos: U = 2·√(Tv/π). Exacta mientras el frente de drenaje
     * no alcanza la frontera impermeable (U ≲ 0.6).
     */
    EARLY_TIME,

    /**
     * Tiempos largos: U = 1 - (8/π²)·e^{-π²·Tv/4}, primer término de la serie de Terzaghi.
     */
    LATE_TIME
}
