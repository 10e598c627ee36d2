package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.InvalidMeasurementException;
import asl.phsen.input.ReferenceCycle;
import asl.phsen.utils.NumericUtils;

/**
 * Derives the blank baselines from the blank cycle. Each of the four groups in the cycle
 * contributes one signal/reference ratio per wavelength, and the blank is their mean.
 */
public class BlankEstimator {

  private BlankEstimator() {
  }

  /**
   * Compute the 434 nm and 578 nm blanks.
   * blank434 averages ref[1]/ref[0], ref[5]/ref[4], ref[9]/ref[8], ref[13]/ref[12];
   * blank578 averages ref[3]/ref[2], ref[7]/ref[6], ref[11]/ref[10], ref[15]/ref[14].
   *
   * @param cycle Blank cycle counts
   * @return Blanks for both wavelengths
   * @throws InvalidMeasurementException if a reference count is zero or a ratio is not positive
   */
  public static Blanks estimate(ReferenceCycle cycle) throws InvalidMeasurementException {
    double[] ratios434 = new double[ReferenceCycle.GROUPS];
    double[] ratios578 = new double[ReferenceCycle.GROUPS];
    for (int group = 0; group < ReferenceCycle.GROUPS; ++group) {
      int base = group * 4;
      ratios434[group] = ratio(cycle, base + 1, base);
      ratios578[group] = ratio(cycle, base + 3, base + 2);
    }
    return new Blanks(NumericUtils.mean(ratios434), NumericUtils.mean(ratios578));
  }

  private static double ratio(ReferenceCycle cycle, int signalIndex, int referenceIndex)
      throws InvalidMeasurementException {
    double reference = cycle.get(referenceIndex);
    if (reference == 0.) {
      throw new InvalidMeasurementException("Blank cycle reference count at index "
          + referenceIndex + " is zero");
    }
    double ratio = cycle.get(signalIndex) / reference;
    if (!(ratio > 0.)) {
      throw new InvalidMeasurementException("Blank cycle ratio ref[" + signalIndex + "]/ref["
          + referenceIndex + "] = " + ratio + " is not positive");
    }
    return ratio;
  }
}
