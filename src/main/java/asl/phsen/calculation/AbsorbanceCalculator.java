package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.InvalidMeasurementException;
import asl.phsen.input.LightCycle;

/**
 * Converts the measurement cycle into absorbances, with the blank absorbance subtracted.
 */
public class AbsorbanceCalculator {

  private AbsorbanceCalculator() {
  }

  /**
   * For each set i: A_i = -log10(signal_i / reference_i), and the result is
   * A_i - (-log10(blank)) at each wavelength.
   *
   * @param cycle Measurement cycle
   * @param blanks Blanks from the blank cycle
   * @return Blank-corrected absorbances for the 23 sets
   * @throws InvalidMeasurementException if a reference count is zero or a ratio is not positive
   */
  public static Absorbances calculate(LightCycle cycle, Blanks blanks)
      throws InvalidMeasurementException {
    double[] abs434 = absorbance(cycle.getSignal434(), cycle.getReference434(),
        blanks.getBlank434(), "434");
    double[] abs578 = absorbance(cycle.getSignal578(), cycle.getReference578(),
        blanks.getBlank578(), "578");
    return new Absorbances(abs434, abs578);
  }

  private static double[] absorbance(double[] signal, double[] reference, double blank,
      String wavelength) throws InvalidMeasurementException {
    if (!(blank > 0.)) {
      throw new InvalidMeasurementException(wavelength + " nm blank " + blank
          + " is not positive");
    }
    double blankAbsorbance = -Math.log10(blank);
    double[] out = new double[signal.length];
    for (int i = 0; i < signal.length; ++i) {
      if (reference[i] == 0.) {
        throw new InvalidMeasurementException(wavelength + " nm reference count of set " + i
            + " is zero");
      }
      double ratio = signal[i] / reference[i];
      if (!(ratio > 0.)) {
        throw new InvalidMeasurementException(wavelength + " nm signal/reference ratio of set "
            + i + " is " + ratio);
      }
      out[i] = -Math.log10(ratio) - blankAbsorbance;
    }
    return out;
  }
}
