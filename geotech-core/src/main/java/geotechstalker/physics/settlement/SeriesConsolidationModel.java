package geotechstalker.physics.settlement;

import geotechstalker.config.ConsolidationConfig;
import lombok.Getter;

import static geotechstalker.utils.Preconditions.requireNonNegative;
import static geotechstalker.utils.Preconditions.requirePositive;

/**
 * Solución exacta de Terzaghi en serie de Fourier:
 * <pre>
 *   U = 1 - Σ (2/M²)·e^{-M²·Tv},   M = π·(2m + 1)/2,  m = 0, 1, 2...
 * </pre>
 * La serie converge muy despacio para Tv pequeño, por lo que se trunca cuando el término
 * cae por debajo de la tolerancia o se alcanza el número máximo de términos.
 * Sirve como referencia para validar aproximaciones cerradas.
 */
@Getter
public class SeriesConsolidationModel implements DegreeOfConsolidationModel {

    private final double tolerance;
    private final int maxTerms;

    public SeriesConsolidationModel() {
        this(ConsolidationConfig.defaults());
    }

    public SeriesConsolidationModel(ConsolidationConfig config) {
        this.tolerance = requirePositive(config.seriesTolerance(), "seriesTolerance");
        this.maxTerms = (int) requirePositive(config.maxSeriesTerms(), "maxSeriesTerms");
    }

    @Override
    public String getName() {
        return "Terzaghi_FourierSeries";
    }

    @Override
    public double degree(double timeFactor) {
        requireNonNegative(timeFactor, "timeFactor");
        if (timeFactor == 0.0) {
            return 0.0;
        }

        double sum = 0.0;
        for (int m = 0; m < maxTerms; m++) {
            double bigM = Math.PI * (2 * m + 1) / 2.0;
            double term = 2.0 / (bigM * bigM) * Math.exp(-bigM * bigM * timeFactor);
            sum += term;
            if (term < tolerance) {
                break;
            }
        }
        // La serie truncada queda por debajo de 1, pero el redondeo puede rozar los extremos.
        return Math.max(0.0, Math.min(1.0, 1.0 - sum));
    }
}
