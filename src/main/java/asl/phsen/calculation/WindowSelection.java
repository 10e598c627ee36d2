package asl.phsen.calculation;

/**
 * Result of the linearity search: where the chosen window starts within the candidate series,
 * and the R-squared of every window that was evaluated.
 */
public class WindowSelection {

  private final int start;
  private final int length;
  private final double[] rSquared;

  WindowSelection(int start, int length, double[] rSquared) {
    this.start = start;
    this.length = length;
    this.rSquared = rSquared;
  }

  /**
   * @return Index of the first point of the chosen window within the searched series
   */
  public int getStart() {
    return start;
  }

  public int getLength() {
    return length;
  }

  public double getBestRSquared() {
    return rSquared[start];
  }

  public double[] getRSquared() {
    return rSquared.clone();
  }
}
