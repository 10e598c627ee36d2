package asl.phsen.calculation;

import asl.phsen.calculation.PhCalculationException.MalformedRecordException;
import asl.phsen.input.CalibrationCoefficients;
import asl.phsen.input.Configuration;
import asl.phsen.input.PhRecord;
import asl.phsen.output.BatchPhResult;
import asl.phsen.output.PhResult;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.log4j.Logger;

/**
 * Runs {@link PhCalculation} over a batch of records. Each record is computed on its own; a
 * record that fails is reported in the returned {@link BatchPhResult} next to the results of the
 * others, rather than aborting the batch. Only a batch whose per-record inputs cannot be aligned
 * (vectors of different lengths) is rejected as a whole, before anything is computed.
 *
 * Salinity can be given as one value for every record or as one value per record.
 */
public class BatchPhCalculation {

  private static final Logger logger = Logger.getLogger(BatchPhCalculation.class);

  private final boolean parallel;

  /**
   * Construct a batch calculation that processes records in order on the calling thread.
   */
  public BatchPhCalculation() {
    this(false);
  }

  /**
   * @param parallel True if records may be computed concurrently. Results are the same either
   * way since no record depends on another.
   */
  public BatchPhCalculation(boolean parallel) {
    this.parallel = parallel;
  }

  /**
   * Construct a batch calculation using the configured parallelism.
   * @param configuration Loaded configuration
   * @return batch calculation
   */
  public static BatchPhCalculation fromConfiguration(Configuration configuration) {
    return new BatchPhCalculation(configuration.useParallelBatch());
  }

  public boolean isParallel() {
    return parallel;
  }

  /**
   * Process records at the default salinity of 35.
   * @param records Records to process
   * @return Per-record results and failures
   */
  public BatchPhResult run(List<PhRecord> records) {
    return run(records, Configuration.DEFAULT_SALINITY);
  }

  /**
   * Process records, using one salinity for all of them.
   * @param records Records to process
   * @param salinity Salinity broadcast to every record
   * @return Per-record results and failures
   */
  public BatchPhResult run(List<PhRecord> records, double salinity) {
    return runEach(records.size(), i -> PhCalculation.calculate(records.get(i), salinity));
  }

  /**
   * Process records, each with its own salinity.
   * @param records Records to process
   * @param salinities Salinity per record, index-aligned with the records
   * @return Per-record results and failures
   * @throws MalformedRecordException if there is not exactly one salinity per record
   */
  public BatchPhResult run(List<PhRecord> records, double[] salinities)
      throws MalformedRecordException {
    checkLength("salinity", salinities, records.size());
    return runEach(records.size(), i -> PhCalculation.calculate(records.get(i), salinities[i]));
  }

  /**
   * Process a batch given as parallel arrays, one entry per record, using one salinity for all.
   *
   * @param references Blank cycles, 16 counts each
   * @param lights Measurement cycles, 92 counts each
   * @param thermistors Thermistor count per record
   * @param ea434 ea434 absorptivity per record
   * @param eb434 eb434 absorptivity per record
   * @param ea578 ea578 absorptivity per record
   * @param eb578 eb578 absorptivity per record
   * @param salinity Salinity broadcast to every record
   * @return Per-record results and failures; a cycle of the wrong length fails only its record
   * @throws MalformedRecordException if the arrays do not all have the same number of records
   */
  public BatchPhResult run(double[][] references, double[][] lights, double[] thermistors,
      double[] ea434, double[] eb434, double[] ea578, double[] eb578, double salinity)
      throws MalformedRecordException {
    int count = checkAligned(references, lights, thermistors, ea434, eb434, ea578, eb578);
    return runEach(count, i -> PhCalculation.calculate(
        PhRecord.fromCounts(references[i], lights[i], thermistors[i],
            new CalibrationCoefficients(ea434[i], eb434[i], ea578[i], eb578[i])),
        salinity));
  }

  /**
   * Process a batch given as parallel arrays, one entry per record, each with its own salinity.
   *
   * @param references Blank cycles, 16 counts each
   * @param lights Measurement cycles, 92 counts each
   * @param thermistors Thermistor count per record
   * @param ea434 ea434 absorptivity per record
   * @param eb434 eb434 absorptivity per record
   * @param ea578 ea578 absorptivity per record
   * @param eb578 eb578 absorptivity per record
   * @param salinities Salinity per record
   * @return Per-record results and failures; a cycle of the wrong length fails only its record
   * @throws MalformedRecordException if the arrays do not all have the same number of records
   */
  public BatchPhResult run(double[][] references, double[][] lights, double[] thermistors,
      double[] ea434, double[] eb434, double[] ea578, double[] eb578, double[] salinities)
      throws MalformedRecordException {
    int count = checkAligned(references, lights, thermistors, ea434, eb434, ea578, eb578);
    checkLength("salinity", salinities, count);
    return runEach(count, i -> PhCalculation.calculate(
        PhRecord.fromCounts(references[i], lights[i], thermistors[i],
            new CalibrationCoefficients(ea434[i], eb434[i], ea578[i], eb578[i])),
        salinities[i]));
  }

  private BatchPhResult runEach(int count, RecordTask task) {
    PhResult[] results = new PhResult[count];
    PhCalculationException[] failures = new PhCalculationException[count];

    IntStream indices = IntStream.range(0, count);
    if (parallel) {
      indices = indices.parallel();
    }
    // each index writes only its own slot, so the arrays need no locking
    indices.forEach(i -> {
      try {
        results[i] = task.calculate(i);
      } catch (PhCalculationException e) {
        logger.warn("Record " + i + " could not be processed: " + e.getMessage());
        failures[i] = e;
      }
    });

    BatchPhResult batch = new BatchPhResult(results, failures);
    logger.debug("Processed " + count + " records, " + batch.getFailures().size() + " failed");
    return batch;
  }

  private static int checkAligned(double[][] references, double[][] lights,
      double[] thermistors, double[] ea434, double[] eb434, double[] ea578, double[] eb578)
      throws MalformedRecordException {
    if (references == null) {
      throw new MalformedRecordException("Batch has no reference cycles");
    }
    int count = references.length;
    if (lights == null || lights.length != count) {
      throw new MalformedRecordException("Batch has " + count + " reference cycles but "
          + (lights == null ? 0 : lights.length) + " light cycles");
    }
    checkLength("thermistor", thermistors, count);
    checkLength("ea434", ea434, count);
    checkLength("eb434", eb434, count);
    checkLength("ea578", ea578, count);
    checkLength("eb578", eb578, count);
    return count;
  }

  private static void checkLength(String name, double[] values, int count)
      throws MalformedRecordException {
    if (values == null || values.length != count) {
      throw new MalformedRecordException("Batch has " + count + " records but "
          + (values == null ? 0 : values.length) + " " + name + " values");
    }
  }

  /**
   * Calculation of one record of the batch, by index.
   */
  @FunctionalInterface
  private interface RecordTask {

    PhResult calculate(int index) throws PhCalculationException;
  }
}
