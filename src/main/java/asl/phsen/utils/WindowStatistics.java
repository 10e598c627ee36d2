package asl.phsen.utils;

/**
 * Running sums and centered sums of squares for a contiguous window of paired (x, y) data. Both
 * the linearity search and the final pH regression are computed from these.
 *
 * The sums use the pairwise order of {@link NumericUtils#sum(double[])} and the centered terms
 * are taken as ss = sum(ab) - sum(a) * sum(b) / n. With that order a constant series has a
 * centered sum of squares of exactly zero.
 */
public class WindowStatistics {

  private final int count;
  private final double sumX;
  private final double sumY;
  private final double sumXY;
  private final double sumX2;
  private final double sumY2;

  private WindowStatistics(int count, double sumX, double sumY, double sumXY, double sumX2,
      double sumY2) {
    this.count = count;
    this.sumX = sumX;
    this.sumY = sumY;
    this.sumXY = sumXY;
    this.sumX2 = sumX2;
    this.sumY2 = sumY2;
  }

  /**
   * Accumulate the sums over x[start .. start + count - 1] and the matching y values.
   *
   * @param x Independent values
   * @param y Dependent values, same indexing as x
   * @param start First index of the window
   * @param count Number of points in the window
   * @return Statistics for the window
   * @throws IllegalArgumentException if the window does not fit within both arrays
   */
  public static WindowStatistics of(double[] x, double[] y, int start, int count) {
    if (count < 1 || start < 0 || start + count > x.length || start + count > y.length) {
      throw new IllegalArgumentException("Window [" + start + ", " + (start + count)
          + ") does not fit data of length " + Math.min(x.length, y.length));
    }
    double[] windowX = new double[count];
    double[] windowY = new double[count];
    double[] products = new double[count];
    double[] squaresX = new double[count];
    double[] squaresY = new double[count];
    for (int i = 0; i < count; ++i) {
      double xi = x[start + i];
      double yi = y[start + i];
      windowX[i] = xi;
      windowY[i] = yi;
      products[i] = xi * yi;
      squaresX[i] = xi * xi;
      squaresY[i] = yi * yi;
    }
    double sumX = NumericUtils.sum(windowX);
    double sumY = NumericUtils.sum(windowY);
    double sumXY = NumericUtils.sum(products);
    double sumX2 = NumericUtils.sum(squaresX);
    double sumY2 = NumericUtils.sum(squaresY);
    return new WindowStatistics(count, sumX, sumY, sumXY, sumX2, sumY2);
  }

  public int getCount() {
    return count;
  }

  public double getMeanX() {
    return sumX / count;
  }

  public double getMeanY() {
    return sumY / count;
  }

  /**
   * @return sum(xy) - sum(x) sum(y) / n
   */
  public double getSsxy() {
    return sumXY - (sumX * sumY) / count;
  }

  /**
   * @return sum(x^2) - sum(x)^2 / n
   */
  public double getSsx() {
    return sumX2 - (sumX * sumX) / count;
  }

  /**
   * @return sum(y^2) - sum(y)^2 / n
   */
  public double getSsy() {
    return sumY2 - (sumY * sumY) / count;
  }

  /**
   * True if either series is constant over the window, so that R-squared is undefined.
   * @return whether ssx or ssy is zero
   */
  public boolean isDegenerate() {
    return getSsx() == 0. || getSsy() == 0.;
  }

  /**
   * Coefficient of determination of a linear fit over the window, ssxy^2 / (ssx ssy).
   * Not guarded: a degenerate window gives NaN or infinity.
   * @return R-squared of the window
   */
  public double getRSquared() {
    double ssxy = getSsxy();
    return (ssxy * ssxy) / (getSsx() * getSsy());
  }

  /**
   * Least-squares slope of y against x.
   * @return ssxy / ssx
   */
  public double getSlope() {
    return getSsxy() / getSsx();
  }

  /**
   * Least-squares intercept of y against x, i.e., the value of y extrapolated to x = 0.
   * @return mean(y) - slope * mean(x)
   */
  public double getIntercept() {
    return getMeanY() - getSlope() * getMeanX();
  }
}
