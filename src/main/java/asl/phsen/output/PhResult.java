package asl.phsen.output;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The pH of one record together with the intermediate values it was derived from. Scripting
 * clients (i.e., the Py4J gateway) read these through {@link #getNumerMap()}, a map from string
 * descriptors to the values given as arrays of doubles, which has more than one entry in the case
 * of per-set series such as the candidate pH values.
 *
 * Values outside the usual seawater range are not rejected here; {@link #isWithinRange} lets the
 * reporting side flag them.
 */
public class PhResult {

  private final double ph;
  private final double temperature;
  private final double salinity;
  private final double blank434;
  private final double blank578;
  private final double pKa;
  private final double[] abs434;
  private final double[] abs578;
  private final double[] indicatorConcentration;
  private final double[] candidatePh;
  private final double[] windowRSquared;
  private final int windowStart;
  private final double slope;

  private PhResult(Builder builder) {
    ph = builder.ph;
    temperature = builder.temperature;
    salinity = builder.salinity;
    blank434 = builder.blank434;
    blank578 = builder.blank578;
    pKa = builder.pKa;
    abs434 = builder.abs434;
    abs578 = builder.abs578;
    indicatorConcentration = builder.indicatorConcentration;
    candidatePh = builder.candidatePh;
    windowRSquared = builder.windowRSquared;
    windowStart = builder.windowStart;
    slope = builder.slope;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return pH of seawater (unitless)
   */
  public double getPh() {
    return ph;
  }

  public double getTemperature() {
    return temperature;
  }

  public double getSalinity() {
    return salinity;
  }

  public double getBlank434() {
    return blank434;
  }

  public double getBlank578() {
    return blank578;
  }

  public double getPKa() {
    return pKa;
  }

  public double[] getAbs434() {
    return abs434.clone();
  }

  public double[] getAbs578() {
    return abs578.clone();
  }

  /**
   * @return Total indicator concentration for all 23 sets
   */
  public double[] getIndicatorConcentration() {
    return indicatorConcentration.clone();
  }

  /**
   * @return Candidate pH for all 23 sets
   */
  public double[] getCandidatePh() {
    return candidatePh.clone();
  }

  public double[] getWindowRSquared() {
    return windowRSquared.clone();
  }

  /**
   * @return Start of the regression window, counted from the first set after settling
   */
  public int getWindowStart() {
    return windowStart;
  }

  public double getBestRSquared() {
    return windowRSquared[windowStart];
  }

  /**
   * @return Slope of candidate pH against indicator concentration in the final regression
   */
  public double getSlope() {
    return slope;
  }

  /**
   * Check whether the pH lies inside a plausibility range (inclusive).
   * @param low Lowest acceptable pH
   * @param high Highest acceptable pH
   * @return True if the pH is a number between low and high
   */
  public boolean isWithinRange(double low, double high) {
    return ph >= low && ph <= high;
  }

  /**
   * Get the result's values in a map with variable descriptions as keys. Scalars are stored as
   * single-entry arrays.
   * @return Map of descriptors to values, in pipeline order
   */
  public Map<String, double[]> getNumerMap() {
    Map<String, double[]> numerMap = new LinkedHashMap<>();
    numerMap.put("pH", new double[]{ph});
    numerMap.put("Temperature", new double[]{temperature});
    numerMap.put("Salinity", new double[]{salinity});
    numerMap.put("Blank_434", new double[]{blank434});
    numerMap.put("Blank_578", new double[]{blank578});
    numerMap.put("pKa", new double[]{pKa});
    numerMap.put("Absorbance_434", getAbs434());
    numerMap.put("Absorbance_578", getAbs578());
    numerMap.put("Indicator_concentration", getIndicatorConcentration());
    numerMap.put("Point_pH", getCandidatePh());
    numerMap.put("Window_R_squared", getWindowRSquared());
    numerMap.put("Window_start", new double[]{windowStart});
    numerMap.put("Final_slope", new double[]{slope});
    return numerMap;
  }

  @Override
  public String toString() {
    return "pH " + ph + " (T=" + temperature + " C, S=" + salinity + ", window " + windowStart
        + ", R^2=" + getBestRSquared() + ")";
  }

  /**
   * Collects the values produced along the pipeline.
   */
  public static class Builder {

    private double ph = Double.NaN;
    private double temperature = Double.NaN;
    private double salinity = Double.NaN;
    private double blank434 = Double.NaN;
    private double blank578 = Double.NaN;
    private double pKa = Double.NaN;
    private double[] abs434 = new double[]{};
    private double[] abs578 = new double[]{};
    private double[] indicatorConcentration = new double[]{};
    private double[] candidatePh = new double[]{};
    private double[] windowRSquared = new double[]{Double.NaN};
    private int windowStart = 0;
    private double slope = Double.NaN;

    private Builder() {
    }

    public Builder ph(double ph) {
      this.ph = ph;
      return this;
    }

    public Builder conditions(double temperature, double salinity, double pKa) {
      this.temperature = temperature;
      this.salinity = salinity;
      this.pKa = pKa;
      return this;
    }

    public Builder blanks(double blank434, double blank578) {
      this.blank434 = blank434;
      this.blank578 = blank578;
      return this;
    }

    public Builder absorbances(double[] abs434, double[] abs578) {
      this.abs434 = abs434.clone();
      this.abs578 = abs578.clone();
      return this;
    }

    public Builder pointSeries(double[] indicatorConcentration, double[] candidatePh) {
      this.indicatorConcentration = indicatorConcentration.clone();
      this.candidatePh = candidatePh.clone();
      return this;
    }

    public Builder window(int windowStart, double[] windowRSquared) {
      this.windowStart = windowStart;
      this.windowRSquared = windowRSquared.clone();
      return this;
    }

    public Builder slope(double slope) {
      this.slope = slope;
      return this;
    }

    public PhResult build() {
      return new PhResult(this);
    }
  }
}
