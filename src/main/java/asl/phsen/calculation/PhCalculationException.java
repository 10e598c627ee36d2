package asl.phsen.calculation;

/**
 * Base of the failures a pH calculation can report for a single record. All of these are
 * detected synchronously from the record's own inputs; since the calculation is pure there is
 * nothing to retry. The concrete kinds are nested below so callers can catch the family or a
 * specific failure.
 */
public abstract class PhCalculationException extends Exception {

  PhCalculationException(String s) {
    super(s);
  }

  /**
   * Thrown when a record does not have the expected shape: a reference cycle that is not 16 counts,
   * a light cycle that is not 92 counts, or batch vectors whose lengths disagree.
   */
  public static class MalformedRecordException extends PhCalculationException {

    public MalformedRecordException(String s) {
      super(s);
    }
  }

  /**
   * Thrown when a measured ratio that feeds a real-valued logarithm is zero or negative, or
   * when a count is outside the range its conversion is defined for.
   */
  public static class InvalidMeasurementException extends PhCalculationException {

    public InvalidMeasurementException(String s) {
      super(s);
    }
  }

  /**
   * Thrown when the absorptivity system cannot be inverted (zero or negligible determinant, or a
   * zero denominator in the absorbance-ratio expression).
   */
  public static class SingularSystemException extends PhCalculationException {

    public SingularSystemException(String s) {
      super(s);
    }
  }

  /**
   * Thrown when a regression window has no variance to fit against.
   */
  public static class DegenerateWindowException extends PhCalculationException {

    public DegenerateWindowException(String s) {
      super(s);
    }
  }
}
