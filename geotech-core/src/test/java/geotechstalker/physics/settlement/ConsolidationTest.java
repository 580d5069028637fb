package geotechstalker.physics.settlement;

import geotechstalker.config.ConsolidationConfig;
import geotechstalker.exception.DomainException;
import geotechstalker.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
@ExtendWith(MockitoExtension.class)
class ConsolidationTest {

    @Mock
    private DegreeOfConsolidationModel mockModel;

    @Test
    @DisplayName("Factor tiempo: escenario de referencia (Cv=1e-8 m²/s, t≈1 año, H=5 m)")
    void timeFactor_shouldMatchReference() {
        double tv = Consolidation.timeFactor(1.0e-8, 3.15e7, 5.0);
        log.info("Tv = {}", tv);

        assertEquals(0.0126, tv, 0.001);
        assertEquals(3.15e7, Consolidation.timeForTimeFactor(tv, 1.0e-8, 5.0), 1e-3);
    }

    @Test
    @DisplayName("Factor tiempo: H ≤ 0, t < 0 o Cv ≤ 0 son entradas inválidas")
    void timeFactor_invalidInputs_shouldThrow() {
        assertThrows(InvalidInputException.class, () -> Consolidation.timeFactor(1.0e-8, 3.15e7, 0.0));
        assertThrows(InvalidInputException.class, () -> Consolidation.timeFactor(1.0e-8, -1.0, 5.0));
        assertThrows(InvalidInputException.class, () -> Consolidation.timeFactor(0.0, 3.15e7, 5.0));
    }

    @Test
    @DisplayName("Camino de drenaje: con doble drenaje es la mitad del espesor")
    void drainagePathLength_shouldDependOnDrainage() {
        assertEquals(10.0, Consolidation.drainagePathLength(10.0, DrainageCondition.SINGLE), 0.0);
        assertEquals(5.0, Consolidation.drainagePathLength(10.0, DrainageCondition.DOUBLE), 0.0);
        assertEquals(0.5, DrainageCondition.DOUBLE.getPathFraction(), 0.0);
    }

    @Test
    @DisplayName("Grado de consolidación: U(0) = 0 y U(0.1) ≈ 0.357")
    void consolidationDegree_shouldMatchReference() {
        assertEquals(0.0, Consolidation.consolidationDegree(0.0), 0.0);
        assertEquals(0.357, Consolidation.consolidationDegree(0.1), 0.05);
        assertEquals(1.0, Consolidation.consolidationDegree(10.0), 1e-9);
    }

    @Test
    @DisplayName("Grado de consolidación: monótono no decreciente y acotado en [0, 1], también en el cruce")
    void consolidationDegree_shouldBeMonotonicAndBounded() {
        double previous = 0.0;
        for (int step = 0; step <= 3000; step++) {
            double tv = step * 0.001;
            double u = Consolidation.consolidationDegree(tv);

            assertTrue(u >= 0.0 && u <= 1.0, "U fuera de [0,1] en Tv=" + tv);
            assertTrue(u >= previous, "U decrece en Tv=" + tv);
            previous = u;
        }
        log.info("U(Tv=3.0) = {}", previous);
    }

    @Test
    @DisplayName("Grado de consolidación: Tv negativo es una entrada inválida")
    void consolidationDegree_negative_shouldThrow() {
        assertThrows(InvalidInputException.class, () -> Consolidation.consolidationDegree(-0.01));
    }

    @Test
    @DisplayName("Inversa: el factor tiempo para U = 90% es ≈ 0.848")
    void timeFactorForDegree_shouldInvertTheLaw() {
        assertEquals(0.848, Consolidation.timeFactorForDegree(0.9), 0.001);
        assertEquals(Math.PI * 0.25 / 4.0, Consolidation.timeFactorForDegree(0.5), 1e-12);

        for (double tv : new double[]{0.01, 0.1, 0.2, 0.5, 1.0}) {
            double u = Consolidation.consolidationDegree(tv);
            assertEquals(tv, Consolidation.timeFactorForDegree(u), 1e-9, "Ida y vuelta en Tv=" + tv);
        }
        assertThrows(InvalidInputException.class, () -> Consolidation.timeFactorForDegree(1.0));
    }

    @Test
    @DisplayName("Cruce configurable: Tc = 0.2 solo se acepta relajando la tolerancia; un salto descendente nunca")
    void consolidationDegree_withConfig_shouldValidateCrossover() {
        ConsolidationConfig early = ConsolidationConfig.defaults().withCrossoverTimeFactor(0.2);
        assertThrows(InvalidInputException.class, () -> Consolidation.consolidationDegree(0.1, early));

        ConsolidationConfig relaxed = early.withContinuityTolerance(1e-3);
        assertEquals(Consolidation.consolidationDegree(0.1), Consolidation.consolidationDegree(0.1, relaxed), 1e-12);

        ConsolidationConfig late = ConsolidationConfig.defaults().withCrossoverTimeFactor(0.3).withContinuityTolerance(1.0);
        assertThrows(InvalidInputException.class, () -> Consolidation.consolidationDegree(0.25, late));

        assertThrows(NullPointerException.class, () -> Consolidation.consolidationDegree(0.1, null));
    }

    @Test
    @DisplayName("Inversa: U = 0.505, justo por debajo del cruce, vuelve a sí mismo")
    void timeFactorForDegree_nearCrossover_shouldRoundTrip() {
        double tv = Consolidation.timeFactorForDegree(0.505);
        assertEquals(0.505, Consolidation.consolidationDegree(tv), 1e-12);
        assertEquals(Math.PI * 0.505 * 0.505 / 4.0, tv, 1e-15);
    }

    @Test
    @DisplayName("Desbordamiento: factor tiempo o asiento final no finitos producen DomainException")
    void overflow_shouldThrowDomainException() {
        assertThrows(DomainException.class, () -> Consolidation.timeFactor(1e300, 1e300, 1.0));
        assertThrows(DomainException.class, () -> Consolidation.timeForTimeFactor(1e300, 1e-300, 1.0));
        assertThrows(DomainException.class, () -> Consolidation.consolidationSettlementFinal(1e300, 1e300, 1e300));
    }

    @Test
    @DisplayName("Asiento final: mv en MPa⁻¹ por σz en kPa convierte a MPa")
    void consolidationSettlementFinal_shouldConvertUnits() {
        assertEquals(0.1, Consolidation.consolidationSettlementFinal(0.2, 100.0, 5.0), 1e-12);
        assertThrows(InvalidInputException.class, () -> Consolidation.consolidationSettlementFinal(0.0, 100.0, 5.0));
        assertThrows(InvalidInputException.class, () -> Consolidation.consolidationSettlementFinal(0.2, 100.0, -5.0));
    }

    @Test
    @DisplayName("Asiento diferido: s(t) = s∞·U(Tv) delegando en el modelo inyectado")
    void settlementAtTime_shouldDelegateToModel() {
        // ARRANGE
        when(mockModel.degree(0.5)).thenReturn(0.75);

        // ACT
        double s = Consolidation.settlementAtTime(0.1, 0.5, mockModel);

        // ASSERT
        assertEquals(0.075, s, 1e-12);
        verify(mockModel).degree(0.5);
    }

    @Test
    @DisplayName("Asiento diferido: un modelo que devuelve U fuera de [0, 1] produce DomainException")
    void settlementAtTime_modelOutOfRange_shouldThrow() {
        when(mockModel.degree(0.5)).thenReturn(1.2);

        assertThrows(DomainException.class, () -> Consolidation.settlementAtTime(0.1, 0.5, mockModel));
    }

    @Test
    @DisplayName("Asiento diferido con el modelo por defecto")
    void settlementAtTime_defaultModel_shouldUsePiecewiseLaw() {
        double sInf = Consolidation.consolidationSettlementFinal(0.2, 100.0, 5.0);
        assertEquals(sInf * Consolidation.consolidationDegree(0.4), Consolidation.settlementAtTime(sInf, 0.4), 1e-12);
    }
}
