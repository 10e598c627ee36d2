package asl.phsen.calculation;

/**
 * Protonated (HI) and deprotonated (I) indicator concentrations for each measurement set.
 */
public class IndicatorConcentrations {

  private final double[] protonated;
  private final double[] deprotonated;

  IndicatorConcentrations(double[] protonated, double[] deprotonated) {
    this.protonated = protonated;
    this.deprotonated = deprotonated;
  }

  public double[] getProtonated() {
    return protonated.clone();
  }

  public double[] getDeprotonated() {
    return deprotonated.clone();
  }

  /**
   * Total indicator concentration, HI + I, per set.
   * @return array of totals
   */
  public double[] getTotal() {
    double[] total = new double[protonated.length];
    for (int i = 0; i < total.length; ++i) {
      total[i] = protonated[i] + deprotonated[i];
    }
    return total;
  }
}
