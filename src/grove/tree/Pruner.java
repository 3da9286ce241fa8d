package grove.tree;

import static grove.tree.Node.NONE;

import grove.util.Log;
import grove.util.Utils;

import java.util.Set;

/** Collapses low-information internal nodes into leaves. Each round looks at
 *  the parents of the current leaves whose children are all leaves, picks the
 *  one with the least gain and turns it into a leaf if its gain is below the
 *  threshold. */
public class Pruner {
  public static final int NPRUNE = 1;
  public static final double THRESHOLD = 0.98;

  final Tree _tree;

  public Pruner(Tree tree) { _tree = tree; }

  /** Runs {@code nPrune} rounds and returns the number of nodes pruned. */
  public int prune(int nPrune, double threshold) {
    int pruned = 0;
    for( int i = 0; i < nPrune; ++i ) {
      Set<Integer> can = _tree.candidates();
      int best = _tree.bestCandidate(can);
      if( best == NONE ) {
        Log.debug("Pruner", "no candidates, nothing to prune");
        break;
      }
      Node n = _tree.node(best);
      if( !(n._gain < threshold) ) {
        Log.debug("Pruner", "least gain " + Utils.p5d(n._gain) + " of node " + best + " is not below " + threshold);
        break;
      }
      Log.debug("Pruner", "pruning node " + best + " with gain " + Utils.p5d(n._gain));
      _tree.makeLeaf(best);
      pruned++;
    }
    return pruned;
  }

  public int prune() { return prune(NPRUNE, THRESHOLD); }
}
