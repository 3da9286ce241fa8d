package grove;

import java.util.Arrays;
import java.util.HashSet;

/** Small datasets shared by the tests. */
public class TestUtil {
  // Outlook: Rain 0, Overcast 1, Sunny 2; Temp: Cool 0, Mild 1, Hot 2;
  // Humidity: Normal 0, High 1; Wind: Weak 0, Strong 1; PlayTennis: No 0, Yes 1
  static final double[][] TENNIS = {
    { 2, 2, 1, 0, 0 }, { 2, 2, 1, 1, 0 }, { 1, 2, 1, 0, 1 }, { 0, 1, 1, 0, 1 },
    { 0, 0, 0, 0, 1 }, { 0, 0, 0, 1, 0 }, { 1, 0, 0, 1, 1 }, { 2, 1, 1, 0, 0 },
    { 2, 0, 0, 0, 1 }, { 0, 1, 0, 0, 1 }, { 2, 1, 0, 1, 1 }, { 1, 1, 1, 1, 1 },
    { 1, 2, 0, 0, 1 }, { 0, 1, 1, 1, 0 },
  };

  // Same days with temperature and humidity measured
  static final double[][] TENNIS_CONT = {
    { 2, 85, 85, 0, 0 }, { 2, 80, 90, 1, 0 }, { 1, 83, 78, 0, 1 }, { 0, 70, 96, 0, 1 },
    { 0, 68, 80, 0, 1 }, { 0, 65, 70, 1, 0 }, { 1, 64, 65, 1, 1 }, { 2, 72, 95, 0, 0 },
    { 2, 69, 70, 0, 1 }, { 0, 75, 80, 0, 1 }, { 2, 75, 70, 1, 1 }, { 1, 72, 90, 1, 1 },
    { 1, 81, 75, 0, 1 }, { 0, 71, 80, 1, 0 },
  };

  static final String[] TENNIS_COLS = { "Outlook", "Temp", "Humidity", "Wind" };

  // Wine quality excerpt, quality shifted down by 3
  static final double[][] WINE = {
    { 7.4, 0.70, 0.00, 1.9, 0.076, 11, 34, 0.9978, 3.51, 0.56,  9.4 },
    { 7.8, 0.88, 0.00, 2.6, 0.098, 25, 67, 0.9968, 3.20, 0.68,  9.8 },
    { 7.8, 0.76, 0.04, 2.3, 0.092, 15, 54, 0.9970, 3.26, 0.65,  9.8 },
    { 7.3, 0.65, 0.00, 1.2, 0.065, 15, 21, 0.9946, 3.39, 0.47, 10.0 },
    { 7.4, 0.66, 0.00, 1.8, 0.075, 13, 40, 0.9978, 3.51, 0.56,  9.4 },
    { 7.8, 0.58, 0.02, 2.0, 0.073,  9, 18, 0.9968, 3.36, 0.57,  9.5 },
    { 6.7, 0.58, 0.08, 1.8, 0.097, 15, 65, 0.9959, 3.28, 0.54,  9.2 },
    { 7.5, 0.50, 0.36, 6.1, 0.071, 17, 102, 0.9978, 3.35, 0.80, 10.5 },
    { 5.6, 0.615, 0.00, 1.6, 0.089, 16, 59, 0.9943, 3.58, 0.52,  9.9 },
    { 7.9, 0.60, 0.06, 1.6, 0.069, 15, 59, 0.9964, 3.30, 0.46,  9.4 },
    { 8.5, 0.28, 0.56, 1.8, 0.092, 35, 103, 0.9969, 3.30, 0.75, 10.5 },
  };
  static final int[] WINE_Y = { 2, 2, 2, 4, 2, 4, 3, 5, 3, 2, 5 };

  public static Data tennis() {
    return Data.make(TENNIS, 4, 2, TENNIS_COLS, new String[] { "No", "Yes" }, null);
  }

  public static Data tennisCont() {
    return Data.make(TENNIS_CONT, 4, 2, TENNIS_COLS, new String[] { "No", "Yes" },
        new HashSet<Integer>(Arrays.asList(1, 2)));
  }

  /** Two well separated clusters in column 0, column 1 is constant. */
  public static Data clusters() {
    double[][] x = { { 1, 0 }, { 2, 0 }, { 3, 0 }, { 10, 0 }, { 11, 0 }, { 12, 0 } };
    int[] y = { 0, 0, 0, 1, 1, 1 };
    return Data.make(x, y, 2, null, null, new HashSet<Integer>(Arrays.asList(0)));
  }

  public static Data wine() {
    HashSet<Integer> conts = new HashSet<Integer>();
    for( int j = 0; j < WINE[0].length; ++j ) conts.add(j);
    return Data.make(WINE, WINE_Y, 7, null, null, conts);
  }

  public static double[][] x(Data d) {
    double[][] x = new double[d.rows()][];
    for( int i = 0; i < x.length; ++i ) x[i] = d.row(i);
    return x;
  }

  public static int[] y(Data d) {
    int[] y = new int[d.rows()];
    for( int i = 0; i < y.length; ++i ) y[i] = d.classOf(i);
    return y;
  }
}
