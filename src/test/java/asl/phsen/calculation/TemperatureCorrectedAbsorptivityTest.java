package asl.phsen.calculation;

import static asl.phsen.calculation.TemperatureCorrectedAbsorptivity.REFERENCE_TEMPERATURE;
import static org.junit.Assert.assertEquals;

import asl.phsen.input.CalibrationCoefficients;
import asl.phsen.test.TestUtils;
import org.junit.Test;

public class TemperatureCorrectedAbsorptivityTest {

  @Test
  public void unchangedAtReferenceTemperature() {
    CalibrationCoefficients coefficients = TestUtils.getCoefficients();
    MolarAbsorptivities corrected =
        TemperatureCorrectedAbsorptivity.correct(coefficients, REFERENCE_TEMPERATURE);
    assertEquals(TestUtils.EA434, corrected.getEa434(), 0.);
    assertEquals(TestUtils.EB434, corrected.getEb434(), 0.);
    assertEquals(TestUtils.EA578, corrected.getEa578(), 0.);
    assertEquals(TestUtils.EB578, corrected.getEb578(), 0.);
  }

  @Test
  public void slopesApplyPerDegree() {
    CalibrationCoefficients coefficients = TestUtils.getCoefficients();
    MolarAbsorptivities corrected =
        TemperatureCorrectedAbsorptivity.correct(coefficients, REFERENCE_TEMPERATURE + 2.);
    assertEquals(TestUtils.EA434 - 52., corrected.getEa434(), 1E-9);
    assertEquals(TestUtils.EB434 + 24., corrected.getEb434(), 1E-9);
    assertEquals(TestUtils.EA578 + 2., corrected.getEa578(), 1E-9);
    assertEquals(TestUtils.EB578 - 142., corrected.getEb578(), 1E-9);
  }

  @Test
  public void colderWaterRaisesEa434() {
    MolarAbsorptivities corrected =
        TemperatureCorrectedAbsorptivity.correct(TestUtils.getCoefficients(), 4.788);
    assertEquals(TestUtils.EA434 + 520., corrected.getEa434(), 1E-9);
    assertEquals(TestUtils.EB578 + 1420., corrected.getEb578(), 1E-9);
  }
}
