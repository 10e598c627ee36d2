package asl.phsen.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.complex.Complex;

/**
 * Class containing small math functions shared by the pH calculation, mainly the logarithm over
 * the complex plane that the candidate pH step relies on, and the summation order used for every
 * average and least-squares sum.
 */
public class NumericUtils {

  /**
   * Natural log of 10, used to change the base of complex logarithms.
   */
  public static final double LN_10 = Math.log(10.);

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.####");
        setNonNumericPrintable(format);
        return format;
      });

  /**
   * Arrays at or below this length are summed with eight interleaved partial sums; longer ones
   * are split in half first.
   */
  private static final int PAIRWISE_BLOCK_SIZE = 128;

  private NumericUtils() {
  }

  /**
   * Base-10 logarithm of a complex number (principal branch).
   *
   * @param c Complex number to take the log of
   * @return log10(c), with imaginary part in (-pi/ln10, pi/ln10]
   */
  public static Complex log10(Complex c) {
    return c.log().divide(LN_10);
  }

  /**
   * Evaluate log10 of a real number over the complex domain and keep only the real part.
   * For positive input this is the ordinary log10; for negative input the result is
   * log10(|x|), since the imaginary part (pi/ln10) is dropped. Zero gives negative infinity.
   *
   * @param x Real value, may be negative
   * @return Real part of the complex log10 of x
   */
  public static double realPartOfComplexLog10(double x) {
    if (x >= 0.) {
      return Math.log10(x);
    }
    return log10(new Complex(x, 0.)).getReal();
  }

  /**
   * Arithmetic mean, the {@link #sum(double[]) pairwise sum} divided by the count.
   *
   * @param values Values to average, must not be empty
   * @return Mean of the values
   */
  public static double mean(double[] values) {
    return sum(values) / values.length;
  }

  /**
   * Sum in pairwise order. Fewer than 8 values are added left to right. Up to 128 values are
   * gathered into 8 interleaved partial sums, combined as ((r0 + r1) + (r2 + r3)) +
   * ((r4 + r5) + (r6 + r7)), and any tail past the last multiple of 8 is added after. Longer
   * arrays are split at a multiple of 8 near the middle and each half is summed the same way.
   *
   * Eight equal values sum to exactly 8 * value.
   *
   * @param values Values to add
   * @return Sum of the values
   */
  public static double sum(double[] values) {
    return sum(values, 0, values.length);
  }

  private static double sum(double[] values, int from, int length) {
    if (length < 8) {
      double result = 0.;
      for (int i = from; i < from + length; ++i) {
        result += values[i];
      }
      return result;
    }
    if (length <= PAIRWISE_BLOCK_SIZE) {
      double[] partial = new double[8];
      System.arraycopy(values, from, partial, 0, 8);
      int i = 8;
      for (; i < length - (length % 8); i += 8) {
        for (int j = 0; j < 8; ++j) {
          partial[j] += values[from + i + j];
        }
      }
      double result = ((partial[0] + partial[1]) + (partial[2] + partial[3]))
          + ((partial[4] + partial[5]) + (partial[6] + partial[7]));
      for (; i < length; ++i) {
        result += values[from + i];
      }
      return result;
    }
    int half = length / 2;
    half -= half % 8;
    return sum(values, from, half) + sum(values, from + half, length - half);
  }

  /**
   * Sets decimalformat object so that infinity and NaN print as readable text in log output
   *
   * @param df DecimalFormat object to change the symbols of
   */
  public static void setNonNumericPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    symbols.setNaN("NaN");
    df.setDecimalFormatSymbols(symbols);
  }
}
