package grove.forest;

import grove.Data;
import grove.HyperParams;

import java.util.Arrays;
import java.util.Random;

/**
 * Bagging plus feature bagging: besides its bootstrap rows every tree gets
 * {@code fbRatio * n} columns chosen without replacement, and is trained in
 * that sub-space. Queries are projected onto the columns of each tree before
 * it votes.
 */
public class RandomForest extends BaggingTrees {
  static final long COLUMN_SEED = 1L << 16; // Offset of the column streams from the row streams

  public RandomForest(Data data, HyperParams params) {
    super(data, params);
    if( !(0 < params.fbRatio() && params.fbRatio() < 1) )
      throw new IllegalConfigException("Feature bagging ratio must be in (0,1), found " + params.fbRatio());
    if( nFeats() < 1 )
      throw new IllegalConfigException("Feature bagging ratio " + params.fbRatio() + " selects no column out of " + data.columns());
  }

  public RandomForest(Data data) { this(data, HyperParams.DEFAULT); }

  public int nFeats() { return (int)(_params.fbRatio() * _data.columns()); }

  /** Columns of tree {@code l}, ascending. */
  @Override public int[] sampleColumns(int l) {
    Random rnd = new Random(l + COLUMN_SEED);
    int n = _data.columns();
    int[] cols = new int[n];
    for( int i = 0; i < n; ++i ) cols[i] = i;
    int k = nFeats();
    for( int i = 0; i < k; ++i ) { // partial Fisher-Yates
      int j = i + rnd.nextInt(n - i);
      int tmp = cols[i]; cols[i] = cols[j]; cols[j] = tmp;
    }
    int[] res = Arrays.copyOf(cols, k);
    Arrays.sort(res);
    return res;
  }

  public int[] columns(int l) { return _columns[l].clone(); }
}
