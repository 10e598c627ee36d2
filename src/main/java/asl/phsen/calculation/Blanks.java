package asl.phsen.calculation;

/**
 * Mean signal-to-reference ratios at 434 and 578 nm over the blank cycle.
 */
public class Blanks {

  private final double blank434;
  private final double blank578;

  Blanks(double blank434, double blank578) {
    this.blank434 = blank434;
    this.blank578 = blank578;
  }

  public double getBlank434() {
    return blank434;
  }

  public double getBlank578() {
    return blank578;
  }
}
