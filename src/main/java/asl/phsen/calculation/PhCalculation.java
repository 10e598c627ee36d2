package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.InvalidMeasurementException;
import asl.phsen.calculation.PhCalculationException.MalformedRecordException;
import asl.phsen.input.CalibrationCoefficients;
import asl.phsen.input.Configuration;
import asl.phsen.input.LightCycle;
import asl.phsen.input.PhRecord;
import asl.phsen.input.ReferenceCycle;
import asl.phsen.output.PhResult;
import asl.phsen.utils.NumericUtils;
import asl.phsen.utils.WindowStatistics;
import org.apache.log4j.Logger;

/**
 * Calculation of the pH of seawater (PHWATER) for a single PHSEN record. The steps are run in
 * order:
 *
 * <ol>
 * <li>blanks from the blank cycle</li>
 * <li>blank-corrected absorbances for the 23 measurement sets</li>
 * <li>absorptivities adjusted to the measured temperature</li>
 * <li>indicator concentration and candidate pH for each set</li>
 * <li>the most linear 8-point stretch of candidate pH, after the first 5 sets are dropped</li>
 * <li>regression of pH against indicator concentration over that stretch; the intercept is
 * the record's pH</li>
 * </ol>
 *
 * Every call depends only on its arguments, so records may be processed in any order or
 * concurrently. See {@link BatchPhCalculation} for running many records.
 */
public class PhCalculation {

  private static final Logger logger = Logger.getLogger(PhCalculation.class);

  private PhCalculation() {
  }

  /**
   * Calculate pH for a record at the default salinity of 35.
   * @param record Record to process
   * @return pH and intermediate values
   * @throws PhCalculationException if the record cannot be processed
   */
  public static PhResult calculate(PhRecord record) throws PhCalculationException {
    return calculate(record, Configuration.DEFAULT_SALINITY);
  }

  /**
   * Calculate pH for a record, converting its thermistor count to temperature.
   * @param record Record to process
   * @param salinity Practical salinity (from a co-located CTD or a default)
   * @return pH and intermediate values
   * @throws PhCalculationException if the record cannot be processed
   */
  public static PhResult calculate(PhRecord record, double salinity)
      throws PhCalculationException {
    if (record == null) {
      throw new MalformedRecordException("Record is missing");
    }
    if (record.getCoefficients() == null) {
      throw new MalformedRecordException("Calibration coefficients are missing");
    }
    return calculate(record.getReferenceCycle(), record.getLightCycle(),
        record.getTemperature(), record.getCoefficients(), salinity);
  }

  /**
   * Calculate pH from already-converted inputs.
   *
   * @param referenceCycle Blank cycle counts
   * @param lightCycle Measurement cycle counts
   * @param temperature Temperature at the end of the measurement cycle (deg C)
   * @param coefficients Reagent calibration coefficients
   * @param salinity Practical salinity
   * @return pH and intermediate values
   * @throws PhCalculationException if the record cannot be processed
   */
  public static PhResult calculate(ReferenceCycle referenceCycle, LightCycle lightCycle,
      double temperature, CalibrationCoefficients coefficients, double salinity)
      throws PhCalculationException {
    if (referenceCycle == null || lightCycle == null || coefficients == null) {
      throw new MalformedRecordException("Record is missing a cycle or its coefficients");
    }
    if (Double.isNaN(temperature) || Double.isNaN(salinity)) {
      throw new InvalidMeasurementException("Temperature " + temperature + " or salinity "
          + salinity + " is not a number");
    }

    Blanks blanks = BlankEstimator.estimate(referenceCycle);
    Absorbances absorbances = AbsorbanceCalculator.calculate(lightCycle, blanks);
    MolarAbsorptivities absorptivities =
        TemperatureCorrectedAbsorptivity.correct(coefficients, temperature);

    IndicatorConcentrations concentrations =
        IndicatorConcentrationSolver.solve(absorbances, absorptivities);
    double[] indicator = concentrations.getTotal();
    double[] pointPh =
        PointwisePhEstimator.estimate(absorbances, absorptivities, temperature, salinity);

    double[] settledIndicator = OptimalWindowSelector.discardSettling(indicator);
    double[] settledPh = OptimalWindowSelector.discardSettling(pointPh);
    WindowSelection selection = OptimalWindowSelector.select(settledPh);

    WindowStatistics fit =
        FinalPhRegressor.fit(settledIndicator, settledPh, selection.getStart());
    double ph = fit.getIntercept();

    if (logger.isDebugEnabled()) {
      logger.debug("Window at " + selection.getStart() + " (R^2 "
          + NumericUtils.DECIMAL_FORMAT.get().format(selection.getBestRSquared())
          + ") gives pH " + NumericUtils.DECIMAL_FORMAT.get().format(ph));
    }

    return PhResult.builder()
        .ph(ph)
        .conditions(temperature, salinity, PointwisePhEstimator.pKa(temperature, salinity))
        .blanks(blanks.getBlank434(), blanks.getBlank578())
        .absorbances(absorbances.getAbs434(), absorbances.getAbs578())
        .pointSeries(indicator, pointPh)
        .window(selection.getStart(), selection.getRSquared())
        .slope(fit.getSlope())
        .build();
  }
}
