package asl.phsen;

import asl.phsen.calculation.BatchPhCalculation;
import asl.phsen.calculation.PhCalculation;
import asl.phsen.calculation.PhCalculationException;
import asl.phsen.calculation.PhCalculationException.InvalidMeasurementException;
import asl.phsen.calculation.PhCalculationException.MalformedRecordException;
import asl.phsen.input.CalibrationCoefficients;
import asl.phsen.input.Configuration;
import asl.phsen.input.LightCycle;
import asl.phsen.input.PhRecord;
import asl.phsen.input.Thermistor;
import asl.phsen.output.BatchPhResult;
import asl.phsen.output.PhResult;
import org.apache.log4j.Logger;
import py4j.GatewayServer;
import py4j.Py4JNetworkException;

/**
 * PhProcessingServer allows for processing PHSEN records in a python environment using Py4J.
 *
 * It uses the Py4J default port: 25333 If a process is already using that port it silently
 * terminates.
 *
 * Results whose pH falls outside the configured expected range are returned as computed but
 * logged as a warning, so that the calling system can apply its quality flags.
 */
public class PhProcessingServer {

  private static final Logger logger = Logger.getLogger(PhProcessingServer.class);

  private final Configuration configuration;
  private final BatchPhCalculation batchCalculation;

  public PhProcessingServer() {
    this(Configuration.getInstance());
  }

  public PhProcessingServer(Configuration configuration) {
    this.configuration = configuration;
    this.batchCalculation = BatchPhCalculation.fromConfiguration(configuration);
  }

  /**
   * Get the salinity assumed when a caller does not provide one.
   * @return Default practical salinity from the configuration
   */
  public double getDefaultSalinity() {
    return configuration.getDefaultSalinity();
  }

  /**
   * Convert a raw thermistor reading to temperature.
   * @param counts Raw thermistor count
   * @return Temperature in degrees C
   * @throws InvalidMeasurementException if the count is outside the ADC range
   */
  public double convertThermistor(double counts) throws InvalidMeasurementException {
    return Thermistor.countsToCelsius(counts);
  }

  /**
   * Extract the 434 nm signal intensity (PH434SI_L0) from a measurement cycle.
   * @param light 92-count measurement cycle
   * @return 23 signal intensities
   * @throws MalformedRecordException if the cycle is not 92 counts long
   */
  public double[] getSignalIntensity434(double[] light) throws MalformedRecordException {
    return new LightCycle(light).getSignal434();
  }

  /**
   * Extract the 578 nm signal intensity (PH578SI_L0) from a measurement cycle.
   * @param light 92-count measurement cycle
   * @return 23 signal intensities
   * @throws MalformedRecordException if the cycle is not 92 counts long
   */
  public double[] getSignalIntensity578(double[] light) throws MalformedRecordException {
    return new LightCycle(light).getSignal578();
  }

  /**
   * Calculate the pH of one record at the configured default salinity.
   *
   * @param reference 16-count blank cycle
   * @param light 92-count measurement cycle
   * @param thermistor Raw thermistor count
   * @param ea434 mCP absorptivity ea434 of the reagent bag
   * @param eb434 mCP absorptivity eb434 of the reagent bag
   * @param ea578 mCP absorptivity ea578 of the reagent bag
   * @param eb578 mCP absorptivity eb578 of the reagent bag
   * @return Result holding pH and intermediate values
   * @throws PhCalculationException if the record cannot be processed
   */
  public PhResult calculatePh(double[] reference, double[] light, double thermistor,
      double ea434, double eb434, double ea578, double eb578) throws PhCalculationException {
    return calculatePh(reference, light, thermistor, ea434, eb434, ea578, eb578,
        getDefaultSalinity());
  }

  /**
   * Calculate the pH of one record.
   *
   * @param reference 16-count blank cycle
   * @param light 92-count measurement cycle
   * @param thermistor Raw thermistor count
   * @param ea434 mCP absorptivity ea434 of the reagent bag
   * @param eb434 mCP absorptivity eb434 of the reagent bag
   * @param ea578 mCP absorptivity ea578 of the reagent bag
   * @param eb578 mCP absorptivity eb578 of the reagent bag
   * @param salinity Practical salinity of the sample
   * @return Result holding pH and intermediate values
   * @throws PhCalculationException if the record cannot be processed
   */
  public PhResult calculatePh(double[] reference, double[] light, double thermistor,
      double ea434, double eb434, double ea578, double eb578, double salinity)
      throws PhCalculationException {
    PhRecord record = PhRecord.fromCounts(reference, light, thermistor,
        new CalibrationCoefficients(ea434, eb434, ea578, eb578));
    PhResult result = PhCalculation.calculate(record, salinity);
    flagIfOutOfRange("Record", result);
    return result;
  }

  /**
   * Calculate pH for a batch of records at the configured default salinity. Arrays are indexed
   * by record.
   *
   * @param references Blank cycles
   * @param lights Measurement cycles
   * @param thermistors Raw thermistor counts
   * @param ea434 ea434 per record
   * @param eb434 eb434 per record
   * @param ea578 ea578 per record
   * @param eb578 eb578 per record
   * @return Per-record results and failures
   * @throws MalformedRecordException if the arrays disagree on the number of records
   */
  public BatchPhResult calculatePhBatch(double[][] references, double[][] lights,
      double[] thermistors, double[] ea434, double[] eb434, double[] ea578, double[] eb578)
      throws MalformedRecordException {
    BatchPhResult batch = batchCalculation.run(references, lights, thermistors,
        ea434, eb434, ea578, eb578, getDefaultSalinity());
    flagIfOutOfRange(batch);
    return batch;
  }

  /**
   * Calculate pH for a batch of records with per-record salinity (i.e., from a co-located CTD).
   *
   * @param references Blank cycles
   * @param lights Measurement cycles
   * @param thermistors Raw thermistor counts
   * @param ea434 ea434 per record
   * @param eb434 eb434 per record
   * @param ea578 ea578 per record
   * @param eb578 eb578 per record
   * @param salinities Salinity per record
   * @return Per-record results and failures
   * @throws MalformedRecordException if the arrays disagree on the number of records
   */
  public BatchPhResult calculatePhBatch(double[][] references, double[][] lights,
      double[] thermistors, double[] ea434, double[] eb434, double[] ea578, double[] eb578,
      double[] salinities) throws MalformedRecordException {
    BatchPhResult batch = batchCalculation.run(references, lights, thermistors,
        ea434, eb434, ea578, eb578, salinities);
    flagIfOutOfRange(batch);
    return batch;
  }

  private void flagIfOutOfRange(BatchPhResult batch) {
    for (int i = 0; i < batch.size(); ++i) {
      if (batch.isSuccess(i)) {
        flagIfOutOfRange("Batch record " + i, batch.getResult(i));
      }
    }
  }

  private void flagIfOutOfRange(String description, PhResult result) {
    double low = configuration.getExpectedPhLow();
    double high = configuration.getExpectedPhHigh();
    if (!result.isWithinRange(low, high)) {
      logger.warn(description + " pH " + result.getPh() + " is outside the expected range ["
          + low + ", " + high + "]");
    }
  }

  public static void main(String[] args) {
    GatewayServer gatewayServer = new GatewayServer(new PhProcessingServer());
    try {
      gatewayServer.start();
    } catch (Py4JNetworkException e) {
      logger.error("Could not start gateway server", e);
      System.exit(0);
    }
    logger.info("Gateway Server Started");
  }
}
