package asl.phsen.output;

import asl.phsen.calculation.PhCalculationException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of processing a batch of records. Every index holds either a result or the exception
 * that record raised; one record failing does not affect any other. The pH array reports NaN
 * for failed records so it can be handed to callers that only want the data product.
 */
public class BatchPhResult {

  private final PhResult[] results;
  private final PhCalculationException[] failures;

  /**
   * @param results Result per record, null where the record failed
   * @param failures Failure per record, null where the record succeeded
   */
  public BatchPhResult(PhResult[] results, PhCalculationException[] failures) {
    if (results.length != failures.length) {
      throw new IllegalArgumentException("Results and failures must be index-aligned");
    }
    this.results = results.clone();
    this.failures = failures.clone();
  }

  public int size() {
    return results.length;
  }

  /**
   * @return pH for every record, NaN where the record failed
   */
  public double[] getPh() {
    double[] ph = new double[results.length];
    for (int i = 0; i < ph.length; ++i) {
      ph[i] = results[i] == null ? Double.NaN : results[i].getPh();
    }
    return ph;
  }

  public boolean isSuccess(int index) {
    return results[index] != null;
  }

  /**
   * @param index Record index
   * @return Result of that record, or null if it failed
   */
  public PhResult getResult(int index) {
    return results[index];
  }

  /**
   * @param index Record index
   * @return Failure of that record, or null if it succeeded
   */
  public PhCalculationException getFailure(int index) {
    return failures[index];
  }

  public boolean hasFailures() {
    return !getFailures().isEmpty();
  }

  /**
   * @return Failures keyed by record index, in index order
   */
  public Map<Integer, PhCalculationException> getFailures() {
    Map<Integer, PhCalculationException> byIndex = new TreeMap<>();
    for (int i = 0; i < failures.length; ++i) {
      if (failures[i] != null) {
        byIndex.put(i, failures[i]);
      }
    }
    return Collections.unmodifiableMap(byIndex);
  }
}
