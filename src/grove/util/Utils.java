package grove.util;

import java.text.DecimalFormat;
import java.util.Arrays;

public class Utils {

  /** Returns the index of the largest value in the array.
   * In case of a tie, the lowest index wins.
   */
  public static int maxIndex(int[] from) {
    int result = 0;
    for (int i = 1; i<from.length; ++i)
      if (from[i]>from[result]) result = i;
    return result;
  }

  public static int sum(int[] from) {
    int result = 0;
    for (int d: from) result += d;
    return result;
  }

  /** Base-2 logarithm. */
  public static double log2(double what) { return Math.log(what) / LN2; }
  static final double LN2 = Math.log(2);

  /** Returns the array 0, 1, ..., n-1. */
  public static int[] range(int n) {
    int[] res = new int[n];
    for( int i = 0; i < n; ++i ) res[i] = i;
    return res;
  }

  /** Returns a copy of the index with the given value removed. */
  public static int[] remove(int[] idx, int what) {
    int[] res = new int[idx.length];
    int j = 0;
    for( int i : idx ) if( i != what ) res[j++] = i;
    return Arrays.copyOf(res, j);
  }

  public static String join(int[] what, String with) {
    if (what==null || what.length==0) return "";
    StringBuilder sb = new StringBuilder();
    sb.append(what[0]);
    for (int i = 1; i<what.length;++i) sb.append(with).append(what[i]);
    return sb.toString();
  }

  public static String p5d(double d) { return df5.format(d); }
  static final DecimalFormat df5 = new  DecimalFormat ("0.#####");
}
