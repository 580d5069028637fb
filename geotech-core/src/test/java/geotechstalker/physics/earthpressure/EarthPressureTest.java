package geotechstalker.physics.earthpressure;

import geotechstalker.exception.DomainException;
import geotechstalker.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class EarthPressureTest {

    @Test
    @DisplayName("Rankine: valores de referencia para φ = 30° (Ka ≈ 1/3, Kp ≈ 3)")
    void rankineCoefficients_atThirtyDegrees_shouldMatchReference() {
        double ka = EarthPressure.rankineActiveCoefficient(30.0);
        double kp = EarthPressure.rankinePassiveCoefficient(30.0);
        log.info("φ=30° -> Ka={}, Kp={}", ka, kp);

        assertEquals(0.333, ka, 0.01);
        assertEquals(3.0, kp, 0.1);
        assertEquals(1.0, ka * kp, 1e-9, "Con relleno horizontal Ka·Kp = 1");
    }

    @Test
    @DisplayName("Rankine: Kp > Ka estrictamente para φ en (0°, 45°) y ambos valen 1 en φ = 0")
    void rankinePassive_shouldExceedActive() {
        assertEquals(1.0, EarthPressure.rankineActiveCoefficient(0.0), 1e-12);
        assertEquals(1.0, EarthPressure.rankinePassiveCoefficient(0.0), 1e-12);

        for (double phi = 0.5; phi < 45.0; phi += 0.5) {
            double ka = EarthPressure.rankineActiveCoefficient(phi);
            double kp = EarthPressure.rankinePassiveCoefficient(phi);
            assertTrue(kp > ka, "Kp debe superar a Ka en φ=" + phi);
        }
    }

    @Test
    @DisplayName("Rankine: Ka estrictamente decreciente y Kp estrictamente creciente en [0°, 90°)")
    void rankineCoefficients_shouldBeMonotonic() {
        double previousKa = EarthPressure.rankineActiveCoefficient(0.0);
        double previousKp = EarthPressure.rankinePassiveCoefficient(0.0);

        for (double phi = 0.5; phi < 90.0; phi += 0.5) {
            double ka = EarthPressure.rankineActiveCoefficient(phi);
            double kp = EarthPressure.rankinePassiveCoefficient(phi);

            assertTrue(ka > 0.0, "Ka debe ser positivo en φ=" + phi);
            assertTrue(ka < previousKa, "Ka debe decrecer en φ=" + phi);
            assertTrue(kp > previousKp, "Kp debe crecer en φ=" + phi);

            previousKa = ka;
            previousKp = kp;
        }
    }

    @Test
    @DisplayName("Rankine: φ fuera de [0°, 90°) es una entrada inválida")
    void rankineCoefficients_outOfRange_shouldThrow() {
        assertThrows(InvalidInputException.class, () -> EarthPressure.rankineActiveCoefficient(90.0));
        assertThrows(InvalidInputException.class, () -> EarthPressure.rankineActiveCoefficient(-1.0));
        assertThrows(InvalidInputException.class, () -> EarthPressure.rankinePassiveCoefficient(Double.NaN));
    }

    @Test
    @DisplayName("Rankine: φ pegado a 90° lleva la tangente a su polo y falla con DomainException")
    void rankinePassive_nearPole_shouldRaiseDomainError() {
        assertThrows(DomainException.class,
                () -> EarthPressure.rankinePassiveCoefficient(Math.nextDown(90.0)));
    }

    @Test
    @DisplayName("Presión y empuje activos: escenarios de referencia")
    void rankineActivePressureAndForce_shouldMatchReference() {
        double pressure = EarthPressure.rankineActivePressure(0.333, 18.0, 3.0);
        double force = EarthPressure.rankineActiveForce(0.333, 18.0, 5.0);
        log.info("σa(z=3m)={} kPa, Pa(H=5m)={} kN/m", pressure, force);

        assertEquals(18.0, pressure, 0.5);
        assertEquals(75.0, force, 1.0);
        assertEquals(0.0, EarthPressure.rankineActiveForce(0.333, 18.0, 0.0), 0.0);
    }

    @Test
    @DisplayName("Presión y empuje: γ ≤ 0 o profundidad negativa son entradas inválidas")
    void rankineActivePressure_invalidInputs_shouldThrow() {
        assertThrows(InvalidInputException.class, () -> EarthPressure.rankineActivePressure(0.333, 0.0, 3.0));
        assertThrows(InvalidInputException.class, () -> EarthPressure.rankineActivePressure(0.333, 18.0, -0.1));
        assertThrows(InvalidInputException.class, () -> EarthPressure.rankineActiveForce(0.333, 18.0, -5.0));
        assertThrows(InvalidInputException.class, () -> EarthPressure.rankineActiveForce(0.0, 18.0, 5.0));
    }

    @Test
    @DisplayName("Pasivo: presión y empuje con Kp = 3")
    void rankinePassive_shouldScaleWithKp() {
        assertEquals(3.0 * 18.0 * 2.0, EarthPressure.rankinePassivePressure(3.0, 18.0, 2.0), 1e-9);
        assertEquals(0.5 * 3.0 * 18.0 * 16.0, EarthPressure.rankinePassiveForce(3.0, 18.0, 4.0), 1e-9);
    }

    @Test
    @DisplayName("Suelo cohesivo: grieta de tracción y presión nula por encima de ella")
    void cohesiveActivePressure_shouldVanishAboveTensionCrack() {
        double ka = 1.0 / 3.0;
        double z0 = EarthPressure.tensionCrackDepth(ka, 18.0, 10.0);
        log.info("Profundidad de grieta de tracción: {} m", z0);

        assertEquals(1.9245, z0, 1e-3);
        assertEquals(0.0, EarthPressure.rankineActivePressureCohesive(ka, 18.0, 1.0, 10.0), 0.0);
        assertEquals(0.0, EarthPressure.rankineActivePressureCohesive(ka, 18.0, z0, 10.0), 1e-9);
        assertEquals(18.453, EarthPressure.rankineActivePressureCohesive(ka, 18.0, 5.0, 10.0), 1e-3);

        double passive = EarthPressure.rankinePassivePressureCohesive(3.0, 18.0, 0.0, 10.0);
        assertEquals(2.0 * 10.0 * Math.sqrt(3.0), passive, 1e-9, "En superficie solo actúa el término de cohesión");
    }

    @Test
    @DisplayName("Coulomb: sin inclinaciones ni rozamiento de muro se reduce a Rankine")
    void coulomb_withoutWallEffects_shouldReduceToRankine() {
        for (double phi = 5.0; phi <= 45.0; phi += 5.0) {
            assertEquals(EarthPressure.rankineActiveCoefficient(phi),
                    EarthPressure.coulombActiveCoefficient(phi, 0.0, 0.0, 0.0), 1e-9, "Ka en φ=" + phi);
            assertEquals(EarthPressure.rankinePassiveCoefficient(phi),
                    EarthPressure.coulombPassiveCoefficient(phi, 0.0, 0.0, 0.0), 1e-9, "Kp en φ=" + phi);
        }
    }

    @Test
    @DisplayName("Coulomb: rozamiento de muro δ = 2φ/3 reduce el empuje activo (φ=30° -> Ka ≈ 0.297)")
    void coulombActive_withWallFriction_shouldMatchTable() {
        double ka = EarthPressure.coulombActiveCoefficient(30.0, 0.0, 0.0, 20.0);
        log.info("Ka Coulomb (φ=30°, δ=20°) = {}", ka);

        assertEquals(0.297, ka, 0.001);
        assertTrue(ka < EarthPressure.rankineActiveCoefficient(30.0));

        double sloped = EarthPressure.coulombActiveCoefficient(30.0, 0.0, 15.0, 20.0);
        assertTrue(sloped > ka, "Un relleno inclinado aumenta el empuje activo");

        double force = EarthPressure.coulombActiveForce(ka, 18.0, 5.0);
        assertEquals(0.5 * ka * 18.0 * 25.0, force, 1e-9);
    }

    @Test
    @DisplayName("Coulomb: ángulos fuera de límites físicos son entradas inválidas")
    void coulomb_invalidAngles_shouldThrow() {
        // δ > φ
        assertThrows(InvalidInputException.class, () -> EarthPressure.coulombActiveCoefficient(30.0, 0.0, 0.0, 31.0));
        // β > φ
        assertThrows(InvalidInputException.class, () -> EarthPressure.coulombActiveCoefficient(30.0, 0.0, 35.0, 0.0));
        // δ negativo
        assertThrows(InvalidInputException.class, () -> EarthPressure.coulombPassiveCoefficient(30.0, 0.0, 0.0, -1.0));
        assertThrows(InvalidInputException.class, () -> EarthPressure.coulombActiveCoefficient(30.0, 90.0, 0.0, 0.0));
    }

    @Test
    @DisplayName("Coulomb pasivo: combinación extrema sin solución produce DomainException")
    void coulombPassive_extremeAngles_shouldRaiseDomainError() {
        assertThrows(DomainException.class, () -> EarthPressure.coulombPassiveCoefficient(45.0, 0.0, 45.0, 45.0));
    }

    @Test
    @DisplayName("Reposo: Jaky K0 = 1 - sin φ y corrección por sobreconsolidación")
    void atRestCoefficient_shouldFollowJaky() {
        assertEquals(0.5, EarthPressure.atRestCoefficient(30.0), 1e-12);
        assertEquals(1.0, EarthPressure.atRestCoefficientOverconsolidated(30.0, 4.0), 1e-12);
        assertEquals(EarthPressure.atRestCoefficient(30.0),
                EarthPressure.atRestCoefficientOverconsolidated(30.0, 1.0), 1e-12);
        assertEquals(0.5 * 18.0 * 4.0, EarthPressure.atRestPressure(0.5, 18.0, 4.0), 1e-12);

        double k0 = EarthPressure.atRestCoefficient(30.0);
        assertTrue(k0 > EarthPressure.rankineActiveCoefficient(30.0) && k0 < EarthPressure.rankinePassiveCoefficient(30.0),
                "K0 queda entre el estado activo y el pasivo");

        assertThrows(InvalidInputException.class, () -> EarthPressure.atRestCoefficientOverconsolidated(30.0, 0.5));
    }

    @Test
    @DisplayName("Desbordamiento: empujes con producto no finito producen DomainException")
    void overflow_shouldThrowDomainException() {
        assertThrows(DomainException.class, () -> EarthPressure.rankineActiveForce(1.0, 1e200, 1e200));
        assertThrows(DomainException.class, () -> EarthPressure.rankinePassivePressure(1e200, 1e200, 1.0));
        assertThrows(DomainException.class, () -> EarthPressure.atRestPressure(0.5, 1e300, 1e300));
    }
}
