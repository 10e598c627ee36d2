package asl.phsen.calculation;

/**
 * Blank-corrected absorbance at 434 and 578 nm for each of the 23 measurement sets.
 */
public class Absorbances {

  private final double[] abs434;
  private final double[] abs578;

  Absorbances(double[] abs434, double[] abs578) {
    this.abs434 = abs434;
    this.abs578 = abs578;
  }

  public double[] getAbs434() {
    return abs434.clone();
  }

  public double[] getAbs578() {
    return abs578.clone();
  }

  public double getAbs434(int index) {
    return abs434[index];
  }

  public double getAbs578(int index) {
    return abs578[index];
  }

  public int size() {
    return abs434.length;
  }
}
