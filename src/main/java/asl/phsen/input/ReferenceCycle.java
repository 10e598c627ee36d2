package asl.phsen.input;

import asl.phsen.calculation.PhCalculationException.MalformedRecordException;

/**
 * Counts recorded during the blank cycle, before indicator dye is injected. The 16 values are
 * four groups of (reference 434, signal 434, reference 578, signal 578).
 */
public class ReferenceCycle {

  public static final int LENGTH = 16;
  public static final int GROUPS = 4;

  private final double[] counts;

  /**
   * Wrap the raw blank cycle counts.
   * @param counts 16 counts in the order the instrument reports them
   * @throws MalformedRecordException if the array is null or not exactly 16 long
   */
  public ReferenceCycle(double[] counts) throws MalformedRecordException {
    if (counts == null) {
      throw new MalformedRecordException("Reference cycle is missing");
    }
    if (counts.length != LENGTH) {
      throw new MalformedRecordException("Reference cycle must have " + LENGTH
          + " counts, got " + counts.length);
    }
    this.counts = counts.clone();
  }

  /**
   * Get a single count from the cycle
   * @param index position in the cycle (0-15)
   * @return count at that position
   */
  public double get(int index) {
    return counts[index];
  }

  public double[] getCounts() {
    return counts.clone();
  }
}
