package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.DegenerateWindowException;
import asl.phsen.calculation.PhCalculationException.MalformedRecordException;
import asl.phsen.utils.WindowStatistics;
import java.util.Arrays;

/**
 * Finds the most linear stretch of the candidate pH series. The series is regressed against its
 * position (1, 2, 3, ...) over every 8-point window, and the window with the highest R-squared
 * is kept for the final pH regression.
 */
public class OptimalWindowSelector {

  /**
   * Leading sets dropped while the instrument settles after dye injection
   */
  public static final int SETTLING_POINTS = 5;

  public static final int WINDOW_STEP = 7;
  public static final int WINDOW_LENGTH = WINDOW_STEP + 1;

  private OptimalWindowSelector() {
  }

  /**
   * Drop the settling transient from the start of a per-set series.
   * @param series Values for all 23 sets
   * @return Values from set 5 onward
   */
  public static double[] discardSettling(double[] series) {
    return Arrays.copyOfRange(series, SETTLING_POINTS, series.length);
  }

  /**
   * Evaluate R-squared for each window start and pick the best one. The first maximum wins ties.
   * A window with NaN R-squared (0/0 from a constant pH run) outranks every number, so the first
   * such window is the one chosen; this keeps the choice identical to the reference processing.
   *
   * @param candidatePh Candidate pH values after the settling points were discarded
   * @return Chosen window and the R-squared of every window
   * @throws MalformedRecordException if there are fewer points than one window
   * @throws DegenerateWindowException if every window has zero variance in x or y
   */
  public static WindowSelection select(double[] candidatePh)
      throws MalformedRecordException, DegenerateWindowException {
    if (candidatePh.length < WINDOW_LENGTH) {
      throw new MalformedRecordException("Need at least " + WINDOW_LENGTH
          + " candidate points, got " + candidatePh.length);
    }
    double[] positions = new double[candidatePh.length];
    for (int i = 0; i < positions.length; ++i) {
      positions[i] = i + 1;
    }

    int windows = candidatePh.length - WINDOW_STEP;
    double[] rSquared = new double[windows];
    boolean anyUsable = false;
    for (int k = 0; k < windows; ++k) {
      WindowStatistics stats =
          WindowStatistics.of(positions, candidatePh, k, WINDOW_LENGTH);
      anyUsable |= !stats.isDegenerate();
      rSquared[k] = stats.getRSquared();
    }
    if (!anyUsable) {
      throw new DegenerateWindowException("Candidate pH series is constant over every "
          + WINDOW_LENGTH + "-point window");
    }

    int best = 0;
    for (int k = 1; k < windows && !Double.isNaN(rSquared[best]); ++k) {
      if (Double.isNaN(rSquared[k]) || rSquared[k] > rSquared[best]) {
        best = k;
      }
    }
    return new WindowSelection(best, WINDOW_LENGTH, rSquared);
  }
}
