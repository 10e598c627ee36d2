package asl.phsen.input;

/**
 * Vendor-supplied mCP molar absorptivities for one reagent bag: the protonated (a) and
 * deprotonated (b) forms of the indicator at 434 and 578 nm, given at the reference temperature.
 * These stay valid for the life of the bag and are looked up per record by the caller.
 */
public class CalibrationCoefficients {

  private final double ea434;
  private final double eb434;
  private final double ea578;
  private final double eb578;

  public CalibrationCoefficients(double ea434, double eb434, double ea578, double eb578) {
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

  @Override
  public String toString() {
    return "ea434=" + ea434 + ", eb434=" + eb434 + ", ea578=" + ea578 + ", eb578=" + eb578;
  }
}
