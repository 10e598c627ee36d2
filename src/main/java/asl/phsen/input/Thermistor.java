package asl.phsen.input;

import asl.phsen.calculation.PhCalculationException.InvalidMeasurementException;

/**
 * Conversion of the instrument's raw thermistor reading to temperature, using the
 * Steinhart-Hart fit for the SAMI-II thermistor and its 17.4 kOhm divider on a 12-bit ADC.
 */
public class Thermistor {

  public static final double ADC_FULL_SCALE = 4096.0;
  public static final double DIVIDER_RESISTANCE = 17400.0;

  public static final double STEINHART_A = 0.0010183;
  public static final double STEINHART_B = 0.000241;
  public static final double STEINHART_C = 0.00000015;

  public static final double KELVIN_OFFSET = 273.15;

  private Thermistor() {
  }

  /**
   * Convert a thermistor count to degrees Celsius.
   * @param counts raw ADC count, strictly between 0 and 4096
   * @return temperature in degrees C
   * @throws InvalidMeasurementException if the count leaves the divider resistance non-positive
   */
  public static double countsToCelsius(double counts) throws InvalidMeasurementException {
    if (!(counts > 0. && counts < ADC_FULL_SCALE)) {
      throw new InvalidMeasurementException("Thermistor count " + counts
          + " is outside the ADC range (0, " + ADC_FULL_SCALE + ")");
    }
    double resistance = (counts / (ADC_FULL_SCALE - counts)) * DIVIDER_RESISTANCE;
    double logR = Math.log(resistance);
    double inverseKelvin = STEINHART_A + STEINHART_B * logR + STEINHART_C * Math.pow(logR, 3);
    return 1.0 / inverseKelvin - KELVIN_OFFSET;
  }
}
