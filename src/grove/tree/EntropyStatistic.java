package grove.tree;

import grove.Data;
import grove.util.Utils;

/** This is an entropy statistic calculation.
 *
 * The entropy formula is the classic Shannon entropy, which is:
 *
 * - \sum(p_i * log2(p_i))
 *
 * where p_i is the probability of i-th class occurring. Classes that do not
 * occur contribute nothing. The entropy of every branch is weighted by the
 * share of rows going to it, and the gain is the entropy of the training set
 * minus that weighted sum. The biggest gain is selected as the node split.
 */
class EntropyStatistic extends Statistic {

  EntropyStatistic(Data data, boolean conts) { super(data, conts); }

  @Override double impurity(int[] freq) { return entropy(freq); }

  /** Base-2 Shannon entropy of a class distribution. */
  static double entropy(int[] freq) {
    int tot = Utils.sum(freq);
    if( tot == 0 ) return 0;
    double e = 0;
    for( int f : freq ) {
      if( f == 0 ) continue;
      double p = f / (double)tot;
      e -= p * Utils.log2(p);
    }
    return e;
  }
}
