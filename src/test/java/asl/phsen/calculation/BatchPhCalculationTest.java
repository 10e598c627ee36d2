package asl.phsen.calculation;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import asl.phsen.calculation.PhCalculationException.InvalidMeasurementException;
import asl.phsen.calculation.PhCalculationException.MalformedRecordException;
import asl.phsen.input.PhRecord;
import asl.phsen.output.BatchPhResult;
import asl.phsen.test.TestUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class BatchPhCalculationTest {

  private static List<PhRecord> threeRecords() throws MalformedRecordException {
    List<PhRecord> records = new ArrayList<>();
    records.add(TestUtils.getRecord());
    records.add(TestUtils.getRecord(1700, TestUtils.getCoefficients()));
    records.add(TestUtils.getRecord(TestUtils.THERMISTOR_COUNTS,
        TestUtils.getAlternateCoefficients()));
    return records;
  }

  @Test
  public void batchMatchesSingleRecordRuns() throws Exception {
    List<PhRecord> records = threeRecords();
    BatchPhResult batch = new BatchPhCalculation().run(records, 35.0);

    assertEquals(3, batch.size());
    assertFalse(batch.hasFailures());
    for (int i = 0; i < records.size(); ++i) {
      double alone = PhCalculation.calculate(records.get(i), 35.0).getPh();
      assertEquals(alone, batch.getPh()[i], 0.);
    }
    assertEquals(TestUtils.EXPECTED_PH, batch.getPh()[0], TestUtils.PH_TOLERANCE);
    assertEquals(TestUtils.EXPECTED_PH_THERMISTOR_1700, batch.getPh()[1],
        TestUtils.PH_TOLERANCE);
    assertEquals(TestUtils.EXPECTED_PH_ALTERNATE_BAG, batch.getPh()[2], TestUtils.PH_TOLERANCE);
  }

  @Test
  public void defaultSalinityIsBroadcast() throws Exception {
    BatchPhResult batch = new BatchPhCalculation().run(threeRecords());
    for (int i = 0; i < batch.size(); ++i) {
      assertEquals(35.0, batch.getResult(i).getSalinity(), 0.);
    }
  }

  @Test
  public void perRecordSalinityIsApplied() throws Exception {
    List<PhRecord> records = Arrays.asList(TestUtils.getRecord(), TestUtils.getRecord());
    BatchPhResult batch =
        new BatchPhCalculation().run(records, new double[]{35.0, 30.0});
    assertEquals(TestUtils.EXPECTED_PH, batch.getPh()[0], TestUtils.PH_TOLERANCE);
    assertEquals(TestUtils.EXPECTED_PH_SALINITY_30, batch.getPh()[1], TestUtils.PH_TOLERANCE);
  }

  @Test(expected = MalformedRecordException.class)
  public void salinityVectorMustMatchRecordCount() throws Exception {
    new BatchPhCalculation().run(threeRecords(), new double[]{35.0, 34.0});
  }

  @Test
  public void parallelRunMatchesSequentialRun() throws Exception {
    List<PhRecord> records = new ArrayList<>();
    for (int i = 0; i < 40; ++i) {
      records.add(TestUtils.getRecord(1650 + 5 * i, TestUtils.getCoefficients()));
    }
    BatchPhCalculation parallel = new BatchPhCalculation(true);
    assertTrue(parallel.isParallel());
    double[] sequentialPh = new BatchPhCalculation(false).run(records, 34.0).getPh();
    double[] parallelPh = parallel.run(records, 34.0).getPh();
    assertArrayEquals(sequentialPh, parallelPh, 0.);
  }

  @Test
  public void failingRecordDoesNotAffectOthers() throws Exception {
    double[][] references = {
        TestUtils.REFERENCE_CYCLE, TestUtils.REFERENCE_CYCLE, TestUtils.REFERENCE_CYCLE};
    double[][] lights = {
        TestUtils.LIGHT_CYCLE, Arrays.copyOf(TestUtils.LIGHT_CYCLE, 91), TestUtils.LIGHT_CYCLE};
    double[] thermistors = {TestUtils.THERMISTOR_COUNTS, TestUtils.THERMISTOR_COUNTS, 1700};
    double[] ea434 = {TestUtils.EA434, TestUtils.EA434, TestUtils.EA434};
    double[] eb434 = {TestUtils.EB434, TestUtils.EB434, TestUtils.EB434};
    double[] ea578 = {TestUtils.EA578, TestUtils.EA578, TestUtils.EA578};
    double[] eb578 = {TestUtils.EB578, TestUtils.EB578, TestUtils.EB578};

    BatchPhResult batch = new BatchPhCalculation().run(references, lights, thermistors,
        ea434, eb434, ea578, eb578, 35.0);

    assertTrue(batch.hasFailures());
    assertEquals(1, batch.getFailures().size());
    assertTrue(batch.getFailure(1) instanceof MalformedRecordException);
    assertNull(batch.getResult(1));
    assertTrue(Double.isNaN(batch.getPh()[1]));

    assertEquals(TestUtils.EXPECTED_PH, batch.getPh()[0], TestUtils.PH_TOLERANCE);
    assertEquals(TestUtils.EXPECTED_PH_THERMISTOR_1700, batch.getPh()[2],
        TestUtils.PH_TOLERANCE);
  }

  @Test
  public void invalidMeasurementIsReportedForItsRecord() throws Exception {
    double[] badReference = TestUtils.REFERENCE_CYCLE.clone();
    badReference[4] = 0;
    double[][] references = {badReference, TestUtils.REFERENCE_CYCLE};
    double[][] lights = {TestUtils.LIGHT_CYCLE, TestUtils.LIGHT_CYCLE};
    double[] thermistors = {TestUtils.THERMISTOR_COUNTS, TestUtils.THERMISTOR_COUNTS};
    double[] ea434 = {TestUtils.EA434, TestUtils.EA434};
    double[] eb434 = {TestUtils.EB434, TestUtils.EB434};
    double[] ea578 = {TestUtils.EA578, TestUtils.EA578};
    double[] eb578 = {TestUtils.EB578, TestUtils.EB578};

    BatchPhResult batch = new BatchPhCalculation(true).run(references, lights, thermistors,
        ea434, eb434, ea578, eb578, new double[]{35.0, 33.5});

    assertTrue(batch.getFailure(0) instanceof InvalidMeasurementException);
    assertTrue(batch.isSuccess(1));
    assertEquals(TestUtils.EXPECTED_PH_SALINITY_33_5, batch.getPh()[1],
        TestUtils.PH_TOLERANCE);
  }

  @Test(expected = MalformedRecordException.class)
  public void misalignedCoefficientVectorsAreRejected() throws Exception {
    double[][] references = {TestUtils.REFERENCE_CYCLE, TestUtils.REFERENCE_CYCLE};
    double[][] lights = {TestUtils.LIGHT_CYCLE, TestUtils.LIGHT_CYCLE};
    double[] thermistors = {TestUtils.THERMISTOR_COUNTS, TestUtils.THERMISTOR_COUNTS};
    new BatchPhCalculation().run(references, lights, thermistors,
        new double[]{TestUtils.EA434}, new double[]{TestUtils.EB434, TestUtils.EB434},
        new double[]{TestUtils.EA578, TestUtils.EA578},
        new double[]{TestUtils.EB578, TestUtils.EB578}, 35.0);
  }

  @Test
  public void emptyBatchHasNoResults() throws Exception {
    BatchPhResult batch = new BatchPhCalculation().run(new ArrayList<>(), 35.0);
    assertEquals(0, batch.size());
    assertEquals(0, batch.getPh().length);
    assertFalse(batch.hasFailures());
  }
}
