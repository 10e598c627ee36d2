package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.SingularSystemException;

/**
 * Recovers the indicator concentrations from the absorbances by inverting
 *
 * <pre>
 *   abs434 = ea434 * HI + eb434 * I
 *   abs578 = ea578 * HI + eb578 * I
 * </pre>
 *
 * with Cramer's rule, once per measurement set.
 */
public class IndicatorConcentrationSolver {

  /**
   * Determinants at or below this fraction of the larger product term are treated as zero.
   */
  public static final double SINGULARITY_TOLERANCE = 1E-12;

  private IndicatorConcentrationSolver() {
  }

  /**
   * Solve for HI and I at each set.
   *
   * @param absorbances Blank-corrected absorbances
   * @param absorptivities Temperature-corrected absorptivities
   * @return Concentrations per set
   * @throws SingularSystemException if the absorptivity determinant is zero or negligible
   */
  public static IndicatorConcentrations solve(Absorbances absorbances,
      MolarAbsorptivities absorptivities) throws SingularSystemException {
    double ea434 = absorptivities.getEa434();
    double eb434 = absorptivities.getEb434();
    double ea578 = absorptivities.getEa578();
    double eb578 = absorptivities.getEb578();

    double determinant = absorptivities.getDeterminant();
    double scale = Math.max(Math.abs(ea434 * eb578), Math.abs(eb434 * ea578));
    if (!(Math.abs(determinant) > SINGULARITY_TOLERANCE * scale)) {
      throw new SingularSystemException("Absorptivity determinant " + determinant
          + " is negligible");
    }

    int size = absorbances.size();
    double[] protonated = new double[size];
    double[] deprotonated = new double[size];
    for (int i = 0; i < size; ++i) {
      double abs434 = absorbances.getAbs434(i);
      double abs578 = absorbances.getAbs578(i);
      protonated[i] = (abs434 * eb578 - abs578 * eb434) / determinant;
      deprotonated[i] = (abs578 * ea434 - abs434 * ea578) / determinant;
    }
    return new IndicatorConcentrations(protonated, deprotonated);
  }
}
