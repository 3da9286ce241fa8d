package grove;

import grove.Classifier.IllegalConfigException;

import java.util.*;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.primitives.Doubles;

/**
 * Training data: an m-by-n instance matrix, the m class labels and the column
 * metadata (names, continuous columns) the inducers need. The matrix belongs
 * to the caller and is never written to; the derived views ({@link #subset},
 * {@link #project}, {@link #shiftToZero}) copy.
 */
public class Data {
  final double[][] _x;          // Instances, one row each
  final int[] _y;               // Class of each row, in [0,_classes)
  final int _classes;           // Number of classes
  final String[] _colNames;     // Feature names
  final String[] _classNames;   // Class names
  final SortedSet<Integer> _conts; // Columns holding continuous values

  /** Creates data with default feature and class names and no continuous columns. */
  public static Data make(double[][] x, int[] y, int classes) {
    return new Data(x, y, classes, null, null, null);
  }

  public static Data make(double[][] x, int[] y, int classes, String[] colNames, String[] classNames, Set<Integer> conts) {
    return new Data(x, y, classes, colNames, classNames, conts);
  }

  /** Splits a combined matrix [x | y] where column {@code col} holds the class. */
  public static Data make(double[][] xy, int col, int classes, String[] colNames, String[] classNames, Set<Integer> conts) {
    double[][] x = new double[xy.length][];
    int[] y = new int[xy.length];
    for( int i = 0; i < xy.length; ++i ) {
      double[] r = xy[i];
      x[i] = new double[r.length-1];
      for( int j = 0, c = 0; j < r.length; ++j )
        if( j != col ) x[i][c++] = r[j];
      y[i] = (int)r[col];
    }
    return new Data(x, y, classes, colNames, classNames, conts);
  }

  protected Data(double[][] x, int[] y, int classes, String[] colNames, String[] classNames, Set<Integer> conts) {
    if( x.length != y.length )
      throw new IllegalConfigException("Expected "+x.length+" labels, found "+y.length);
    if( classes < 1 )
      throw new IllegalConfigException("Number of classes must be positive, found "+classes);
    int cols = x.length == 0 ? (colNames == null ? 0 : colNames.length) : x[0].length;
    for( double[] r : x )
      if( r.length != cols ) throw new IllegalConfigException("Ragged instance matrix: rows must have "+cols+" columns");
    for( int c : y )
      if( c < 0 || c >= classes ) throw new IllegalConfigException("Class label "+c+" is outside [0,"+classes+")");
    if( colNames != null && colNames.length != cols )
      throw new IllegalConfigException("Expected "+cols+" feature names, found "+colNames.length);
    if( classNames != null && classNames.length != classes )
      throw new IllegalConfigException("Expected "+classes+" class names, found "+classNames.length);
    _conts = conts == null ? ImmutableSortedSet.<Integer>of() : ImmutableSortedSet.copyOf(conts);
    for( int j : _conts )
      if( j < 0 || j >= cols ) throw new IllegalConfigException("Continuous column "+j+" does not exist");
    _x = x;
    _y = y;
    _classes = classes;
    _colNames = colNames != null ? colNames : defaultColNames(cols);
    _classNames = classNames != null ? classNames : defaultClassNames(classes);
  }

  static String[] defaultColNames(int cols) {
    String[] res = new String[cols];
    for( int i = 0; i < cols; ++i ) res[i] = "x" + i;
    return res;
  }

  static String[] defaultClassNames(int classes) {
    if( classes == 2 ) return new String[] { "No", "Yes" };
    String[] res = new String[classes];
    for( int i = 0; i < classes; ++i ) res[i] = "c" + i;
    return res;
  }

  public int rows()                  { return _x.length; }
  public int columns()               { return _colNames.length; }
  public int classes()               { return _classes; }
  public String colName(int i)       { return _colNames[i]; }
  public String className(int c)     { return _classNames[c]; }
  public String[] colNames()         { return _colNames.clone(); }
  public String[] classNames()       { return _classNames.clone(); }
  public boolean isContinuous(int j) { return _conts.contains(j); }
  public SortedSet<Integer> conts()  { return _conts; }
  public double get(int row, int col){ return _x[row][col]; }
  public int classOf(int row)        { return _y[row]; }
  public double[] row(int i)         { return _x[i]; }

  public double[] column(int j) {
    double[] res = new double[_x.length];
    for( int i = 0; i < res.length; ++i ) res[i] = _x[i][j];
    return res;
  }

  /** Sorted distinct values of column {@code j} among the given rows. */
  public double[] distinct(int j, int[] rows) {
    TreeSet<Double> vals = new TreeSet<Double>();
    for( int i : rows ) vals.add(_x[i][j]);
    return Doubles.toArray(vals);
  }

  /** Class frequencies over the given rows. */
  public int[] frequencies(int[] rows) {
    int[] nu = new int[_classes];
    for( int i : rows ) nu[_y[i]]++;
    return nu;
  }

  /** Class frequencies over all rows. */
  public int[] frequencies() {
    int[] nu = new int[_classes];
    for( int c : _y ) nu[c]++;
    return nu;
  }

  /** Per column, the number of categorical values (max value + 1); 0 for
   *  continuous columns. Assumes values were shifted to start at zero. */
  public int[] valueCounts() {
    int[] vc = new int[columns()];
    for( int j = 0; j < vc.length; ++j ) {
      if( isContinuous(j) ) continue;
      int max = -1;
      for( double[] r : _x ) max = Math.max(max, (int)r[j]);
      vc[j] = max + 1;
    }
    return vc;
  }

  /** New data holding the given rows (duplicates allowed, as for bootstrap samples). */
  public Data subset(int[] rows) {
    double[][] x = new double[rows.length][];
    int[] y = new int[rows.length];
    for( int i = 0; i < rows.length; ++i ) {
      x[i] = _x[rows[i]];
      y[i] = _y[rows[i]];
    }
    return new Data(x, y, _classes, _colNames, _classNames, _conts);
  }

  /** New data restricted to the given columns, renumbered 0..cols.length-1.
   *  Names and continuous flags follow their columns. */
  public Data project(int[] cols) {
    double[][] x = new double[_x.length][];
    for( int i = 0; i < x.length; ++i ) x[i] = project(_x[i], cols);
    String[] names = new String[cols.length];
    Set<Integer> conts = new HashSet<Integer>();
    for( int c = 0; c < cols.length; ++c ) {
      names[c] = _colNames[cols[c]];
      if( isContinuous(cols[c]) ) conts.add(c);
    }
    return new Data(x, _y, _classes, names, _classNames, conts);
  }

  /** Projects a single feature vector onto the given columns. */
  public static double[] project(double[] z, int[] cols) {
    double[] res = new double[cols.length];
    for( int c = 0; c < cols.length; ++c ) res[c] = z[cols[c]];
    return res;
  }

  /** Shifts every categorical column so that its smallest value becomes 0.
   *  Continuous columns are copied unchanged. */
  public Data shiftToZero() {
    double[][] x = new double[_x.length][];
    for( int i = 0; i < x.length; ++i ) x[i] = _x[i].clone();
    for( int j = 0; j < columns(); ++j ) {
      if( isContinuous(j) || x.length == 0 ) continue;
      double min = Double.MAX_VALUE;
      for( double[] r : x ) min = Math.min(min, r[j]);
      if( min == 0 ) continue;
      for( double[] r : x ) r[j] -= min;
    }
    return new Data(x, _y, _classes, _colNames, _classNames, _conts);
  }

  /** Returns a copy of this data with the labels and instances replaced. */
  public Data with(double[][] x, int[] y) {
    return new Data(x, y, _classes, _colNames, _classNames, _conts);
  }

  @Override public String toString() {
    return "Data["+rows()+" rows, "+columns()+" cols, "+classes()+" classes, conts="+_conts+"]";
  }
}
