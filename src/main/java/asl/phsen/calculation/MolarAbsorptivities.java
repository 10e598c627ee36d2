package asl.phsen.calculation;

/**
 * mCP molar absorptivities adjusted to the measurement temperature.
 */
public class MolarAbsorptivities {

  private final double ea434;
  private final double eb434;
  private final double ea578;
  private final double eb578;

  MolarAbsorptivities(double ea434, double eb434, double ea578, double eb578) {
    this.ea434 = ea434;
    this.eb434 = eb434;
    this.ea578 = ea578;
    this.eb578 = eb578;
  }

  public double getEa434() {
    return ea434;
  }

  public double getEb434() {
    return eb434;
  }

  public double getEa578() {
    return ea578;
  }

  public double getEb578() {
    return eb578;
  }

  /**
   * Determinant of the absorptivity matrix [[ea434, eb434], [ea578, eb578]].
   * @return ea434 * eb578 - eb434 * ea578
   */
  public double getDeterminant() {
    return ea434 * eb578 - eb434 * ea578;
  }
}
