package asl.phsen.calculation;

import asl.phsen.input.CalibrationCoefficients;

/**
 * Linear temperature adjustment of the vendor molar absorptivities. The slopes are empirical
 * fits for mCP and are part of the formula, not tuning parameters.
 */
public class TemperatureCorrectedAbsorptivity {

  /**
   * Temperature at which the vendor absorptivities are specified (deg C)
   */
  public static final double REFERENCE_TEMPERATURE = 24.788;

  public static final double EA434_SLOPE = -26.;
  public static final double EB434_SLOPE = 12.;
  public static final double EA578_SLOPE = 1.;
  public static final double EB578_SLOPE = -71.;

  private TemperatureCorrectedAbsorptivity() {
  }

  /**
   * Adjust the four absorptivities to the given temperature.
   *
   * @param coefficients Vendor absorptivities at the reference temperature
   * @param temperature Measured temperature (deg C)
   * @return Absorptivities at the measured temperature
   */
  public static MolarAbsorptivities correct(CalibrationCoefficients coefficients,
      double temperature) {
    double delta = temperature - REFERENCE_TEMPERATURE;
    return new MolarAbsorptivities(
        coefficients.getEa434() + EA434_SLOPE * delta,
        coefficients.getEb434() + EB434_SLOPE * delta,
        coefficients.getEa578() + EA578_SLOPE * delta,
        coefficients.getEb578() + EB578_SLOPE * delta);
  }
}
