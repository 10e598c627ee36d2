package asl.phsen.input;

import asl.phsen.calculation.PhCalculationException.InvalidMeasurementException;
import asl.phsen.calculation.PhCalculationException.MalformedRecordException;

/**
 * One PHSEN sample: the blank cycle, the measurement cycle, the thermistor reading taken at the
 * end of the measurement, and the calibration coefficients of the reagent bag in use.
 * Salinity is not part of the record since it comes from a co-located CTD or a default.
 */
public class PhRecord {

  private final ReferenceCycle referenceCycle;
  private final LightCycle lightCycle;
  private final double thermistorCounts;
  private final CalibrationCoefficients coefficients;

  public PhRecord(ReferenceCycle referenceCycle, LightCycle lightCycle, double thermistorCounts,
      CalibrationCoefficients coefficients) {
    this.referenceCycle = referenceCycle;
    this.lightCycle = lightCycle;
    this.thermistorCounts = thermistorCounts;
    this.coefficients = coefficients;
  }

  /**
   * Build a record from the raw instrument arrays.
   * @param referenceCounts 16 blank-cycle counts
   * @param lightCounts 92 measurement-cycle counts
   * @param thermistorCounts raw thermistor count
   * @param coefficients calibration coefficients for the reagent bag
   * @return record wrapping the given data
   * @throws MalformedRecordException if either cycle has the wrong length or coefficients are
   * missing
   */
  public static PhRecord fromCounts(double[] referenceCounts, double[] lightCounts,
      double thermistorCounts, CalibrationCoefficients coefficients)
      throws MalformedRecordException {
    if (coefficients == null) {
      throw new MalformedRecordException("Calibration coefficients are missing");
    }
    return new PhRecord(new ReferenceCycle(referenceCounts), new LightCycle(lightCounts),
        thermistorCounts, coefficients);
  }

  public ReferenceCycle getReferenceCycle() {
    return referenceCycle;
  }

  public LightCycle getLightCycle() {
    return lightCycle;
  }

  public double getThermistorCounts() {
    return thermistorCounts;
  }

  public CalibrationCoefficients getCoefficients() {
    return coefficients;
  }

  /**
   * Temperature at the end of the measurement cycle.
   * @return temperature in degrees C
   * @throws InvalidMeasurementException if the thermistor count cannot be converted
   */
  public double getTemperature() throws InvalidMeasurementException {
    return Thermistor.countsToCelsius(thermistorCounts);
  }
}
