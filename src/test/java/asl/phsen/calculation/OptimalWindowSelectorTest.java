package asl.phsen.calculation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.phsen.calculation.PhCalculationException.DegenerateWindowException;
import asl.phsen.calculation.PhCalculationException.MalformedRecordException;
import java.util.Arrays;
import org.junit.Test;

public class OptimalWindowSelectorTest {

  @Test
  public void discardsSettlingPoints() {
    double[] series = new double[23];
    for (int i = 0; i < series.length; ++i) {
      series[i] = i;
    }
    double[] settled = OptimalWindowSelector.discardSettling(series);
    assertEquals(18, settled.length);
    assertEquals(5., settled[0], 0.);
    assertEquals(22., settled[17], 0.);
  }

  @Test
  public void findsCollinearStretch() throws Exception {
    double[] candidatePh = {7.95, 7.80, 7.99,
        7.80, 7.81, 7.82, 7.83, 7.84, 7.85, 7.86, 7.87,
        7.70, 7.98, 7.75, 7.90, 7.72, 7.96, 7.71};
    WindowSelection selection = OptimalWindowSelector.select(candidatePh);
    assertEquals(3, selection.getStart());
    assertEquals(OptimalWindowSelector.WINDOW_LENGTH, selection.getLength());
    assertEquals(1.0, selection.getBestRSquared(), 1E-9);
    assertEquals(11, selection.getRSquared().length);
  }

  @Test
  public void firstMaximumWinsTies() throws Exception {
    double[] candidatePh = new double[18];
    for (int i = 0; i < candidatePh.length; ++i) {
      candidatePh[i] = i;
    }
    WindowSelection selection = OptimalWindowSelector.select(candidatePh);
    assertEquals(0, selection.getStart());
    for (double r2 : selection.getRSquared()) {
      assertEquals(1.0, r2, 0.);
    }
  }

  @Test
  public void constantWindowOutranksNumericRSquared() throws Exception {
    double[] candidatePh = new double[18];
    Arrays.fill(candidatePh, 0, 8, 8.0);
    for (int i = 8; i < candidatePh.length; ++i) {
      candidatePh[i] = 8.0 + 0.01 * (i - 7);
    }
    WindowSelection selection = OptimalWindowSelector.select(candidatePh);
    assertEquals(0, selection.getStart());
    assertTrue(Double.isNaN(selection.getBestRSquared()));
  }

  @Test
  public void inexactConstantWindowOutranksNumericRSquared() throws Exception {
    // 7.8 has no exact binary form
    double[] candidatePh = new double[18];
    Arrays.fill(candidatePh, 0, 8, 7.8);
    for (int i = 8; i < candidatePh.length; ++i) {
      candidatePh[i] = 7.8 + 0.01 * (i - 7);
    }
    WindowSelection selection = OptimalWindowSelector.select(candidatePh);
    assertEquals(0, selection.getStart());
    assertTrue(Double.isNaN(selection.getBestRSquared()));
  }

  @Test
  public void inexactConstantSeriesIsDegenerate() throws Exception {
    for (double value : new double[]{7.8, 7.81, 7.9, 7.92}) {
      double[] candidatePh = new double[18];
      Arrays.fill(candidatePh, value);
      try {
        OptimalWindowSelector.select(candidatePh);
        fail("Constant series at " + value + " was not degenerate");
      } catch (DegenerateWindowException e) {
        // expected
      }
    }
  }

  @Test(expected = DegenerateWindowException.class)
  public void constantSeriesIsDegenerate() throws Exception {
    double[] candidatePh = new double[18];
    Arrays.fill(candidatePh, 7.5);
    OptimalWindowSelector.select(candidatePh);
  }

  @Test(expected = MalformedRecordException.class)
  public void tooFewPointsForAWindow() throws Exception {
    OptimalWindowSelector.select(new double[]{7.1, 7.2, 7.3});
  }
}
