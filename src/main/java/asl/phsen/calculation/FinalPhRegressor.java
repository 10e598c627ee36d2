package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.DegenerateWindowException;
import asl.phsen.utils.WindowStatistics;

/**
 * Extrapolates the candidate pH values of the chosen window to zero indicator concentration,
 * removing the perturbation the dye itself causes. The intercept of pH against indicator
 * concentration is the sample's pH.
 */
public class FinalPhRegressor {

  private FinalPhRegressor() {
  }

  /**
   * Ordinary least squares of pH against indicator concentration over one window.
   *
   * @param indicatorConcentration Total indicator concentration per point
   * @param candidatePh Candidate pH per point, same indexing
   * @param start First point of the window
   * @return mean(pH) - slope * mean(concentration)
   * @throws DegenerateWindowException if the concentration is constant over the window
   */
  public static double regress(double[] indicatorConcentration, double[] candidatePh, int start)
      throws DegenerateWindowException {
    return fit(indicatorConcentration, candidatePh, start).getIntercept();
  }

  /**
   * Statistics of the final regression window, for callers that also want the slope.
   *
   * @param indicatorConcentration Total indicator concentration per point
   * @param candidatePh Candidate pH per point, same indexing
   * @param start First point of the window
   * @return Statistics over the 8-point window
   * @throws DegenerateWindowException if the concentration is constant over the window
   */
  public static WindowStatistics fit(double[] indicatorConcentration, double[] candidatePh,
      int start) throws DegenerateWindowException {
    WindowStatistics stats = WindowStatistics.of(indicatorConcentration, candidatePh, start,
        OptimalWindowSelector.WINDOW_LENGTH);
    if (stats.getSsx() == 0.) {
      throw new DegenerateWindowException("Indicator concentration is constant over window at "
          + start);
    }
    return stats;
  }
}
