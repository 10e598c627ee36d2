package asl.phsen.input;

import asl.phsen.calculation.PhCalculationException.MalformedRecordException;

/**
 * Counts recorded during the measurement cycle. The instrument reports 92 values which are read
 * row by row into 23 sets of 4: reference 434 nm, signal 434 nm, reference 578 nm, signal 578 nm.
 * Set 0 is the earliest measurement and set 22 the latest.
 *
 * The signal columns are the level-0 intensity products (PH434SI and PH578SI).
 */
public class LightCycle {

  public static final int SETS = 23;
  public static final int VALUES_PER_SET = 4;
  public static final int LENGTH = SETS * VALUES_PER_SET;

  private static final int REF_434 = 0;
  private static final int SIG_434 = 1;
  private static final int REF_578 = 2;
  private static final int SIG_578 = 3;

  private final double[][] sets;

  /**
   * Reshape the raw light cycle into its 23 measurement sets.
   * @param counts 92 counts in instrument order
   * @throws MalformedRecordException if the array is null or not exactly 92 long; the cycle is
   * never truncated or padded to fit
   */
  public LightCycle(double[] counts) throws MalformedRecordException {
    if (counts == null) {
      throw new MalformedRecordException("Light cycle is missing");
    }
    if (counts.length != LENGTH) {
      throw new MalformedRecordException("Light cycle must have " + LENGTH
          + " counts, got " + counts.length);
    }
    sets = new double[SETS][VALUES_PER_SET];
    for (int i = 0; i < SETS; ++i) {
      System.arraycopy(counts, i * VALUES_PER_SET, sets[i], 0, VALUES_PER_SET);
    }
  }

  public double[] getReference434() {
    return column(REF_434);
  }

  /**
   * Signal intensity at 434 nm for each of the 23 sets (PH434SI_L0)
   * @return 23 counts, earliest first
   */
  public double[] getSignal434() {
    return column(SIG_434);
  }

  public double[] getReference578() {
    return column(REF_578);
  }

  /**
   * Signal intensity at 578 nm for each of the 23 sets (PH578SI_L0)
   * @return 23 counts, earliest first
   */
  public double[] getSignal578() {
    return column(SIG_578);
  }

  private double[] column(int index) {
    double[] out = new double[SETS];
    for (int i = 0; i < SETS; ++i) {
      out[i] = sets[i][index];
    }
    return out;
  }
}
