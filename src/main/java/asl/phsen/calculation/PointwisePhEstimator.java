package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.SingularSystemException;
import asl.phsen.utils.NumericUtils;

/**
 * Candidate pH for each measurement set from the absorbance ratio, following Clayton and Byrne
 * (1993) for the dissociation constant of mCP.
 */
public class PointwisePhEstimator {

  public static final double PKA_TEMPERATURE_COEFFICIENT = 1245.69;
  public static final double PKA_OFFSET = 3.8275;
  public static final double PKA_SALINITY_COEFFICIENT = 0.0021;
  public static final double REFERENCE_SALINITY = 35.;
  public static final double KELVIN_OFFSET = 273.15;

  private PointwisePhEstimator() {
  }

  /**
   * Dissociation constant of the indicator.
   * pKa = 1245.69 / (T + 273.15) + 3.8275 + 0.0021 * (35 - S)
   *
   * @param temperature Temperature (deg C)
   * @param salinity Practical salinity
   * @return pKa of mCP at the given conditions
   */
  public static double pKa(double temperature, double salinity) {
    return (PKA_TEMPERATURE_COEFFICIENT / (temperature + KELVIN_OFFSET)) + PKA_OFFSET
        + (PKA_SALINITY_COEFFICIENT * (REFERENCE_SALINITY - salinity));
  }

  /**
   * Compute pH at each set as pKa + log10((R - e1) / (e2 - R e3)), where R = abs578 / abs434,
   * e1 = ea578 / ea434, e2 = eb578 / ea434 and e3 = eb434 / ea434.
   *
   * The log is taken over the complex plane and only its real part is kept, so a negative
   * argument yields pKa + log10(|argument|) rather than an error.
   *
   * @param absorbances Blank-corrected absorbances
   * @param absorptivities Temperature-corrected absorptivities
   * @param temperature Temperature (deg C)
   * @param salinity Practical salinity
   * @return Candidate pH per set
   * @throws SingularSystemException if ea434 or a ratio denominator (e2 - R e3) is zero
   */
  public static double[] estimate(Absorbances absorbances, MolarAbsorptivities absorptivities,
      double temperature, double salinity) throws SingularSystemException {
    double ea434 = absorptivities.getEa434();
    if (ea434 == 0.) {
      throw new SingularSystemException("Corrected ea434 absorptivity is zero");
    }
    double e1 = absorptivities.getEa578() / ea434;
    double e2 = absorptivities.getEb578() / ea434;
    double e3 = absorptivities.getEb434() / ea434;
    double pKa = pKa(temperature, salinity);

    double[] pointPh = new double[absorbances.size()];
    for (int i = 0; i < pointPh.length; ++i) {
      double ratio = absorbances.getAbs578(i) / absorbances.getAbs434(i);
      double numerator = ratio - e1;
      double denominator = e2 - ratio * e3;
      if (denominator == 0.) {
        throw new SingularSystemException("Absorbance ratio denominator is zero at set " + i);
      }
      pointPh[i] = pKa + NumericUtils.realPartOfComplexLog10(numerator / denominator);
    }
    return pointPh;
  }
}
