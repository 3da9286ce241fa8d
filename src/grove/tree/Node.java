package grove.tree;

import grove.util.Utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A vertex of a decision tree. Nodes live in the arena of their {@link Tree}
 * and refer to their parent and children by arena index. A node is created
 * once during induction; pruning is the only later change (an internal node
 * becomes a leaf).
 */
public final class Node {
  public static final int NO_FEATURE = -1;
  public static final int NONE = -1;

  final int _id;                  // Index in the tree arena
  final int _feature;             // Column split on, NO_FEATURE if none
  final double _gain;             // Information gain when the node was made
  final int[] _freq;              // Class counts of the rows reaching this node
  final int _size;                // Sum of _freq
  final int _majority;            // argmax(_freq)
  final int _parent;              // Arena index of the parent, NONE for the root
  int _branchValue = NONE;        // Value on the edge from the parent
  double _threshold = Double.NaN; // Split point for continuous features
  boolean _leaf;
  final SortedMap<Integer,Integer> _branches = new TreeMap<Integer,Integer>();

  Node(int id, int feature, double gain, int[] freq, int parent, boolean leaf) {
    _id = id;
    _feature = feature;
    _gain = gain;
    _freq = freq;
    _size = Utils.sum(freq);
    _majority = Utils.maxIndex(freq);
    _parent = parent;
    _leaf = leaf;
  }

  public int id()              { return _id; }
  public int feature()         { return _feature; }
  public double gain()         { return _gain; }
  public int[] freq()          { return _freq.clone(); }
  public int size()            { return _size; }
  public int majorityClass()   { return _majority; }
  public int parent()          { return _parent; }
  public int branchValue()     { return _branchValue; }
  public double threshold()    { return _threshold; }
  public boolean isLeaf()      { return _leaf; }
  public boolean isRoot()      { return _parent == NONE; }
  public boolean isContinuous(){ return !Double.isNaN(_threshold); }

  /** Arena index of the child under branch value {@code v}, or NONE. */
  public int child(int v) {
    Integer c = _branches.get(v);
    return c == null ? NONE : c;
  }

  public Collection<Integer> children() { return Collections.unmodifiableCollection(_branches.values()); }
  public SortedMap<Integer,Integer> branches() { return Collections.unmodifiableSortedMap(_branches); }

  /** Branch taken by the value {@code zj} of this node's feature. */
  int branchOf(double zj) {
    if( isContinuous() ) return zj <= _threshold ? 0 : 1;
    return (int)zj;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(_branchValue).append(" -> Node(j = ").append(_feature)
      .append(", nu = ").append(Arrays.toString(_freq))
      .append(", y = ").append(_majority)
      .append(", leaf = ").append(_leaf);
    if( !_leaf && isContinuous() ) sb.append(", thres = ").append(_threshold);
    return sb.append(')').toString();
  }
}
