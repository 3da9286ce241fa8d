package grove.forest;

import grove.Classifier;
import grove.Data;
import grove.HyperParams;
import grove.tree.DecisionTreeC45;
import grove.util.Log;
import grove.util.Timer;
import grove.util.Utils;

import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;

/**
 * Bootstrap aggregation of C4.5 trees. Tree {@code l} is trained on
 * {@code bRatio * m} rows drawn with replacement from a random stream seeded
 * with {@code l}, so a forest is fully determined by its data and parameters.
 * Prediction is a majority vote, the lowest class winning ties.
 */
public class BaggingTrees extends Classifier {
  protected Data _data;
  protected final HyperParams _params;
  protected DecisionTreeC45[] _trees;  // Null slots for trees that failed to build
  protected int[][] _rows;             // Bootstrap sample of every tree
  protected int[][] _columns;          // Columns of every tree, null slots for all columns

  public BaggingTrees(Data data, HyperParams params) {
    if( params.nTrees() < 1 )
      throw new IllegalConfigException("Number of trees must be at least 1, found " + params.nTrees());
    if( !(0 < params.bRatio() && params.bRatio() < 1) )
      throw new IllegalConfigException("Bagging ratio must be in (0,1), found " + params.bRatio());
    _data = data;
    _params = params;
  }

  public BaggingTrees(Data data) { this(data, HyperParams.DEFAULT); }

  public int sampleSize() { return Math.max(1, (int)(_params.bRatio() * _data.rows())); }

  /** Rows of the bootstrap sample of tree {@code l}. */
  public int[] sampleRows(int l) {
    Random rnd = new Random(l);
    int m = _data.rows();
    int[] rows = new int[sampleSize()];
    for( int i = 0; i < rows.length; ++i ) rows[i] = rnd.nextInt(m);
    return rows;
  }

  /** Columns of tree {@code l}, or null when it sees all of them. */
  protected int[] sampleColumns(int l) { return null; }

  /** Training data of a tree: its bootstrap rows, restricted to its columns. */
  protected Data sample(int l, int[] rows, int[] cols) {
    Data d = _data.subset(rows);
    return cols == null ? d : d.project(cols);
  }

  /** Query as seen by tree {@code l}. */
  protected double[] view(int l, double[] z) {
    return _columns[l] == null ? z : Data.project(z, _columns[l]);
  }

  @Override public void train(double[][] x, int[] y) {
    _data = _data.with(x, y);
    train();
  }

  /** Builds all trees. The samples and trees are published together, so a
   *  failed training leaves the previous forest intact. */
  public void train() {
    if( _data.rows() == 0 ) throw new IllegalConfigException("Cannot train " + modelName() + " on empty data");
    Timer t = new Timer();
    final int n = _params.nTrees();
    final int[][] rows = new int[n][], cols = new int[n][];
    for( int l = 0; l < n; ++l ) {
      rows[l] = sampleRows(l);
      cols[l] = sampleColumns(l);
      if( cols[l] != null ) Log.debug(modelName(), "tree " + l + " columns " + Utils.join(cols[l], ","));
    }
    DecisionTreeC45[] trees = new DecisionTreeC45[n];
    if( _params.parallel() ) {
      TreeTask[] tasks = new TreeTask[n];
      for( int l = 0; l < n; ++l ) tasks[l] = new TreeTask(l, rows[l], cols[l]);
      ForkJoinPool.commonPool().invoke(new RecursiveTask<Void>() {
        @Override protected Void compute() { ForkJoinTask.invokeAll(tasks); return null; }
      });
      for( int l = 0; l < n; ++l ) trees[l] = tasks[l].join();
    } else {
      for( int l = 0; l < n; ++l ) trees[l] = build(l, rows[l], cols[l]);
    }
    int built = 0;
    for( DecisionTreeC45 tree : trees ) if( tree != null ) built++;
    if( built == 0 ) throw new IllegalStateException("No tree of " + modelName() + " could be built");
    if( built < n ) Log.warn(modelName(), (n - built) + " of " + n + " trees failed, voting with " + built);
    _rows = rows;
    _columns = cols;
    _trees = trees;
    Log.info(modelName(), "All trees (" + built + "/" + n + ") done in " + t);
  }

  /** Builds tree {@code l}; a failure is logged and leaves the slot empty. */
  DecisionTreeC45 build(int l, int[] rows, int[] cols) {
    try {
      DecisionTreeC45 tree = new DecisionTreeC45(sample(l, rows, cols), _params);
      tree.train();
      return tree;
    } catch( RuntimeException e ) {
      Log.warn(modelName(), "tree " + l + " failed, leaving it out of the vote", e);
      return null;
    }
  }

  class TreeTask extends RecursiveTask<DecisionTreeC45> {
    final int _l;
    final int[] _rows, _cols;
    TreeTask(int l, int[] rows, int[] cols) { _l = l; _rows = rows; _cols = cols; }
    @Override protected DecisionTreeC45 compute() { return build(_l, _rows, _cols); }
  }

  /** Votes of all trees per class. */
  public int[] vote(double[] z) {
    if( _trees == null ) throw new IllegalStateException(modelName() + " has not been trained");
    int[] votes = new int[numClasses()];
    for( int l = 0; l < _trees.length; ++l )
      if( _trees[l] != null ) votes[_trees[l].predict(view(l, z))]++;
    return votes;
  }

  @Override public int predict(double[] z) { return Utils.maxIndex(vote(z)); }

  @Override public int numClasses() { return _data.classes(); }

  @Override public String modelName() { return getClass().getSimpleName() + "_" + _params.nTrees(); }

  public int nTrees()                 { return _params.nTrees(); }
  public DecisionTreeC45 tree(int l)  { return _trees == null ? null : _trees[l]; }
  public int[] rows(int l)            { return _rows[l].clone(); }
  public Data data()                  { return _data; }
  public HyperParams params()         { return _params; }
}
