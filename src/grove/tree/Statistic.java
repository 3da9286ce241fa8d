package grove.tree;

import grove.Data;
import grove.util.Utils;

import java.util.Map;
import java.util.TreeMap;

/** A general split framework. Evaluates the candidate columns at a node and
 * produces the single split that will be used for the node.
 *
 * The gain of a split is measured against the impurity of the whole training
 * set, so a split into pure subsets always scores positively.
 */
abstract class Statistic {
  protected final Data _data;        // Training data
  protected final boolean _conts;    // Honour the continuous columns of the data
  protected final double _impurity0; // Impurity of all training rows

  /** Impurity of a class distribution, 0 for a pure one. */
  abstract double impurity(int[] freq);

  Statistic(Data data, boolean conts) {
    _data = data;
    _conts = conts;
    _impurity0 = impurity(data.frequencies());
  }

  /** Split descriptor for a particular column.
   *
   * Holds the column, the gain of splitting on it, the class frequencies of
   * the rows at the node and, for continuous columns, the split point. Rows
   * with values lower or equal to the split point go to branch 0, the rest to
   * branch 1. If the column index is -1 no split can be made.
   */
  static class Split {
    final int _column;
    final double _gain;
    final int[] _freq;
    final double _threshold;

    Split(int column, double gain, int[] freq, double threshold) {
      _column = column; _gain = gain; _freq = freq; _threshold = threshold;
    }

    /** No column gives a positive gain. */
    static Split impossible(int[] freq) { return new Split(Node.NO_FEATURE, 0, freq, Double.NaN); }

    final boolean isLeafNode()   { return _column < 0; }
    final boolean isContinuous() { return !Double.isNaN(_threshold); }
    final boolean betterThan(Split other) { return _gain > other._gain; }

    @Override public String toString() {
      return "Split(" + _column + ", gain = " + Utils.p5d(_gain)
          + (isContinuous() ? ", thres = " + _threshold : "") + ")";
    }
  }

  boolean isContinuous(int col) { return _conts && _data.isContinuous(col); }

  /** Gain of splitting the rows by the values of a categorical column, taken
   *  as integers. */
  double categoricalGain(int col, int[] rows) {
    TreeMap<Integer,int[]> dists = new TreeMap<Integer,int[]>();
    for( int r : rows ) {
      int v = (int)_data.get(r, col); // branch value, as in Node.branchOf
      int[] d = dists.get(v);
      if( d == null ) dists.put(v, d = new int[_data.classes()]);
      d[_data.classOf(r)]++;
    }
    double sum = 0;
    for( Map.Entry<Integer,int[]> e : dists.entrySet() ) {
      int[] d = e.getValue();
      sum += Utils.sum(d) * impurity(d);
    }
    return _impurity0 - sum / rows.length;
  }

  /** Weighted impurity of the binary split of the rows at the given point. */
  double binaryImpurity(int col, int[] rows, double thres) {
    int[] distL = new int[_data.classes()];
    int[] distR = new int[_data.classes()];
    for( int r : rows ) {
      if( _data.get(r, col) <= thres ) distL[_data.classOf(r)]++;
      else distR[_data.classOf(r)]++;
    }
    double totL = Utils.sum(distL), totR = Utils.sum(distR);
    return (totL * impurity(distL) + totR * impurity(distR)) / (totL + totR);
  }

  /** The midpoint between consecutive distinct values of the column that
   *  minimizes the weighted impurity of the binary split over the rows. The
   *  first minimum wins. A column with a single value splits at that value. */
  double findThreshold(int col, int[] rows) {
    double[] vals = _data.distinct(col, rows);
    if( vals.length == 1 ) return vals[0];
    double best = Double.MAX_VALUE, thres = vals[0];
    for( int i = 0; i < vals.length - 1; ++i ) {
      double t = (vals[i] + vals[i+1]) / 2;
      double imp = binaryImpurity(col, rows, t);
      if( imp < best ) { best = imp; thres = t; }
    }
    return thres;
  }

  /** Gain of the binary split of the rows at the given point. */
  double continuousGain(int col, int[] rows, double thres) {
    return _impurity0 - binaryImpurity(col, rows, thres);
  }

  /** Evaluates one column over the rows of a node. */
  Split columnSplit(int col, int[] rows, int[] freq) {
    if( isContinuous(col) ) {
      double thres = findThreshold(col, rows);
      return new Split(col, continuousGain(col, rows, thres), freq, thres);
    }
    return new Split(col, categoricalGain(col, rows), freq, Double.NaN);
  }

  /** Returns the column with the greatest positive gain, the first one on
   *  ties, or an impossible split when no column has a positive gain. */
  Split findBest(int[] rows, int[] cols) {
    int[] freq = _data.frequencies(rows);
    Split best = Split.impossible(freq);
    for( int col : cols ) {
      Split s = columnSplit(col, rows, freq);
      if( s.betterThan(best) ) best = s;
    }
    return best;
  }
}
