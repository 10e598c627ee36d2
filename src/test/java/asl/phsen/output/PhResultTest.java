package asl.phsen.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class PhResultTest {

  private static PhResult sample(double ph) {
    return PhResult.builder()
        .ph(ph)
        .conditions(17.3, 35.0, 8.11)
        .blanks(0.90, 0.91)
        .absorbances(new double[]{0.23, 0.31}, new double[]{0.28, 0.38})
        .pointSeries(new double[]{1.9E-5, 2.6E-5}, new double[]{7.90, 7.89})
        .window(1, new double[]{0.5, 0.9, 0.7})
        .slope(-850.)
        .build();
  }

  @Test
  public void bestRSquaredIsAtWindowStart() {
    PhResult result = sample(7.92);
    assertEquals(1, result.getWindowStart());
    assertEquals(0.9, result.getBestRSquared(), 0.);
  }

  @Test
  public void numerMapHoldsEveryValueInOrder() {
    Map<String, double[]> map = sample(7.92).getNumerMap();
    List<String> expectedKeys = Arrays.asList("pH", "Temperature", "Salinity", "Blank_434",
        "Blank_578", "pKa", "Absorbance_434", "Absorbance_578", "Indicator_concentration",
        "Point_pH", "Window_R_squared", "Window_start", "Final_slope");
    assertEquals(expectedKeys, new ArrayList<>(map.keySet()));
    assertArrayEquals(new double[]{7.92}, map.get("pH"), 0.);
    assertArrayEquals(new double[]{7.90, 7.89}, map.get("Point_pH"), 0.);
    assertArrayEquals(new double[]{1.}, map.get("Window_start"), 0.);
  }

  @Test
  public void seriesCannotBeModifiedThroughGetters() {
    PhResult result = sample(7.92);
    result.getCandidatePh()[0] = 0.;
    result.getNumerMap().get("Absorbance_434")[0] = 0.;
    assertEquals(7.90, result.getCandidatePh()[0], 0.);
    assertEquals(0.23, result.getAbs434()[0], 0.);
  }

  @Test
  public void rangeCheckIsInclusive() {
    assertTrue(sample(8.5).isWithinRange(6.5, 8.5));
    assertTrue(sample(6.5).isWithinRange(6.5, 8.5));
    assertFalse(sample(8.51).isWithinRange(6.5, 8.5));
    assertFalse(sample(Double.NaN).isWithinRange(6.5, 8.5));
  }
}
