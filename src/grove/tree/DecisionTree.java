package grove.tree;

import static grove.tree.Node.NONE;
import static grove.tree.Node.NO_FEATURE;

import grove.Classifier;
import grove.Data;
import grove.HyperParams;
import grove.util.Log;
import grove.util.Timer;
import grove.util.Utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.TreeSet;

import com.google.common.primitives.Ints;

/**
 * Top-down induction of a decision tree. The builder recursively picks the
 * column with the best gain over the rows reaching a node, removes it from the
 * columns available below and partitions the rows by the branch they take.
 * A node becomes a leaf when its entropy is at most the cutoff or the height
 * limit is reached.
 *
 * Subclasses decide which columns may be split on and how.
 */
public abstract class DecisionTree extends Classifier {
  protected Data _data;               // Training data
  protected final HyperParams _params;
  protected Tree _tree;               // Null until trained
  protected double _entropy0;         // Entropy of all training labels
  protected final ArrayList<Integer> _order = new ArrayList<Integer>(); // Features of the nodes, in build order
  private Statistic _stat;

  protected DecisionTree(Data data, HyperParams params) {
    _data = data;
    _params = params;
  }

  /** Split criterion used while building. */
  abstract Statistic statistic(Data data);

  /** Short name of the algorithm, e.g. ID3. */
  protected abstract String algorithm();

  /** Checks that the data can be handled; throws IllegalConfigException. */
  protected void checkData(Data data) { }

  @Override public void train(double[][] x, int[] y) {
    Data d = _data.with(x, y);
    checkData(d);
    _data = d;
    train();
  }

  /** Builds the tree from the current training data, replacing any previous one. */
  public void train() {
    Timer t = new Timer();
    _tree = new Tree();
    _order.clear();
    _entropy0 = EntropyStatistic.entropy(_data.frequencies());
    _stat = statistic(_data);
    int root = buildTree(Utils.range(_data.rows()), Utils.range(_data.columns()), NONE, 0);
    if( root == NONE ) // one class only, or nothing to split on
      root = _tree.newNode(NO_FEATURE, 0, _data.frequencies(), NONE, true);
    _tree.addRoot(root);
    _stat = null;
    Log.info(modelName(), "built in " + t + ": " + _tree.nodeCount() + " nodes, "
        + _tree.leafCount() + " leaves, depth " + _tree.depth()
        + ", entropy " + Utils.p5d(_entropy0) + " -> " + Utils.p5d(_tree.calcEntropy()));
    if( Log.isDebug() ) Log.debug(modelName(), "\n" + printTree());
  }

  /** Builds the subtree for the rows and returns its arena index, or NONE if
   *  no node should be attached for these rows. */
  int buildTree(int[] rows, int[] cols, int parent, int depth) {
    if( rows.length == 0 ) return NONE;
    Statistic.Split s = _stat.findBest(rows, cols); // impossible once the columns run out
    if( s.isLeafNode() ) return NONE;
    _order.add(s._column);
    if( Log.isDebug() ) Log.debug(modelName(), "depth " + depth + ", " + rows.length + " rows: " + s);
    boolean leaf = EntropyStatistic.entropy(s._freq) <= _params.cutoff() || depth >= _params.height();
    int n = _tree.newNode(s._column, s._gain, s._freq, parent, leaf);
    Node node = _tree.node(n);
    if( s.isContinuous() ) node._threshold = s._threshold;
    if( leaf ) return n;
    int[] rest = Utils.remove(cols, s._column);
    for( int v : branchValues(node, rows) ) {
      int c = buildTree(trimRows(node, rows, v), rest, n, depth + 1);
      if( c != NONE ) _tree.add(n, v, c);
    }
    if( node._branches.isEmpty() ) _tree.makeLeaf(n);
    return n;
  }

  /** Branch values of the node's split over the rows. */
  int[] branchValues(Node node, int[] rows) {
    if( node.isContinuous() ) return new int[] { 0, 1 };
    TreeSet<Integer> vals = new TreeSet<Integer>();
    for( int r : rows ) vals.add(node.branchOf(_data.get(r, node._feature)));
    return Ints.toArray(vals);
  }

  /** The rows that take branch {@code v} of the node. */
  int[] trimRows(Node node, int[] rows, int v) {
    int[] res = new int[rows.length];
    int j = 0;
    for( int r : rows )
      if( node.branchOf(_data.get(r, node._feature)) == v ) res[j++] = r;
    return Arrays.copyOf(res, j);
  }

  @Override public int predict(double[] z) {
    return checkTrained().predict(z);
  }

  @Override public int numClasses() { return _data.classes(); }

  @Override public String modelName() { return "DecisionTree" + algorithm() + "_" + _params.height(); }

  /** Size weighted entropy of the leaves. */
  public double calcEntropy() { return checkTrained().calcEntropy(); }

  /** Runs the pruner and returns the number of nodes pruned. */
  public int prune(int nPrune, double threshold) {
    int pruned = new Pruner(checkTrained()).prune(nPrune, threshold);
    Log.info(modelName(), "pruned " + pruned + " node(s), " + _tree.leafCount()
        + " leaves left, entropy " + Utils.p5d(_tree.calcEntropy()));
    return pruned;
  }

  public int prune() { return prune(Pruner.NPRUNE, Pruner.THRESHOLD); }

  /** Indented dump of the tree using the feature and class names. */
  public String printTree() {
    StringBuilder sb = new StringBuilder();
    try {
      new TextTreePrinter(sb, _data.colNames(), _data.classNames()).printTree(checkTrained());
    } catch( IOException e ) {
      throw new AssertionError(e); // StringBuilder does not throw
    }
    return sb.toString();
  }

  /** Columns split on, one per node in the order the nodes were built. */
  public int[] features() { return Ints.toArray(_order); }

  public Tree tree()          { return _tree; }
  public Data data()          { return _data; }
  public HyperParams params() { return _params; }
  public double entropy0()    { return _entropy0; }

  private Tree checkTrained() {
    if( _tree == null ) throw new IllegalStateException(modelName() + " has not been trained");
    return _tree;
  }

  @Override public String toString() {
    return modelName() + (_tree == null ? " (untrained)" : "\n" + printTree());
  }
}
