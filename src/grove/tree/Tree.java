package grove.tree;

import static grove.tree.Node.NONE;

import grove.util.Log;

import java.io.IOException;
import java.util.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * The structure of a decision tree: an arena of {@link Node}s addressed by
 * index, the root, and the set of current leaves. Supports attaching nodes,
 * turning internal nodes into leaves, aggregate entropy, prediction and the
 * candidate search used by the {@link Pruner}.
 */
public class Tree {
  private final ArrayList<Node> _nodes = new ArrayList<Node>();
  private final TreeSet<Integer> _leaves = new TreeSet<Integer>(); // in creation order
  private int _root = NONE;

  /** Allocates a detached node in the arena and returns its index. */
  public int newNode(int feature, double gain, int[] freq, int parent, boolean leaf) {
    int id = _nodes.size();
    _nodes.add(new Node(id, feature, gain, freq, parent, leaf));
    return id;
  }

  public Node node(int id) { return _nodes.get(id); }
  public int root()        { return _root; }
  public Node rootNode()   { return _root == NONE ? null : _nodes.get(_root); }
  public boolean isEmpty() { return _root == NONE; }

  /** Current leaves, by arena index, in creation order. */
  public SortedSet<Integer> leaves() { return Collections.unmodifiableSortedSet(_leaves); }
  public int leafCount()   { return _leaves.size(); }

  public void addRoot(int r) {
    assert _nodes.get(r)._parent == NONE;
    _root = r;
    if( _nodes.get(r)._leaf ) _leaves.add(r);
  }

  /** Attaches child {@code c} to node {@code n} under branch value {@code v},
   *  which must be free. */
  public void add(int n, int v, int c) {
    Node child = _nodes.get(c);
    assert child._parent == n;
    Node node = _nodes.get(n);
    if( node._branches.containsKey(v) )
      throw new IllegalArgumentException("Branch " + v + " of node " + n + " is already taken by node " + node._branches.get(v));
    child._branchValue = v;
    node._branches.put(v, c);
    if( child._leaf ) _leaves.add(c);
  }

  /** Turns an internal node into a leaf, dropping everything below it. */
  public void makeLeaf(int n) {
    Node node = _nodes.get(n);
    if( node._leaf ) {
      Log.debug("Tree", "makeLeaf: node " + n + " already is a leaf");
      return;
    }
    for( int c : node._branches.values() ) dropSubtree(c);
    node._branches.clear();
    node._leaf = true;
    _leaves.add(n);
  }

  private void dropSubtree(int n) {
    _leaves.remove(n);
    for( int c : _nodes.get(n)._branches.values() ) dropSubtree(c);
  }

  /** True if every child of node {@code n} is a leaf. */
  public boolean leafChildren(int n) {
    for( int c : _nodes.get(n)._branches.values() )
      if( !_nodes.get(c)._leaf ) return false;
    return true;
  }

  /** Parents of the current leaves whose children are all leaves. */
  public Set<Integer> candidates() {
    LinkedHashSet<Integer> can = new LinkedHashSet<Integer>();
    for( int l : _leaves ) {
      int p = _nodes.get(l)._parent;
      if( p != NONE && leafChildren(p) ) can.add(p);
    }
    return can;
  }

  /** The candidate with the least gain (first one on ties), or NONE. */
  public int bestCandidate(Collection<Integer> can) {
    double min = Double.MAX_VALUE;
    int best = NONE;
    for( int n : can ) {
      double gn = _nodes.get(n)._gain;
      if( gn < min ) { min = gn; best = n; }
    }
    return best;
  }

  /** Size weighted mean entropy over the given nodes. */
  public double calcEntropy(Collection<Integer> nodes) {
    double sum = 0, ent = 0;
    for( int n : nodes ) {
      Node node = _nodes.get(n);
      sum += node._size;
      ent += node._size * EntropyStatistic.entropy(node._freq);
    }
    Log.debug("Tree", "calcEntropy: nodes = " + nodes.size() + ", sum = " + sum + ", ent = " + ent);
    return sum == 0 ? 0 : ent / sum;
  }

  /** Size weighted mean entropy of the leaves. */
  public double calcEntropy() { return calcEntropy(_leaves); }

  /** Follows the branches matching {@code z} down from the root. Returns the
   *  leaf's majority class, or the majority class of the node whose branch
   *  for the value in {@code z} does not exist. */
  public int predict(double[] z) {
    return _nodes.get(reach(z))._majority;
  }

  /** The leaf (or dead-end node) that {@code z} reaches. A query too short
   *  for a column split on along the way is rejected. */
  public int reach(double[] z) {
    if( _root == NONE ) throw new IllegalStateException("Tree has not been built");
    int id = _root;
    Node n = _nodes.get(id);
    while( !n._leaf ) {
      if( n._feature >= z.length )
        throw new IllegalArgumentException("Query has " + z.length + " values, node " + id + " splits on column " + n._feature);
      int c = n.child(n.branchOf(z[n._feature]));
      if( c == NONE ) break;
      n = _nodes.get(id = c);
    }
    return id;
  }

  /** Number of edges on the longest root-to-leaf path. */
  public int depth() { return _root == NONE ? 0 : depth(_root); }
  private int depth(int n) {
    int d = 0;
    for( int c : _nodes.get(n)._branches.values() ) d = Math.max(d, depth(c) + 1);
    return d;
  }

  /** Number of nodes reachable from the root. */
  public int nodeCount() { return _root == NONE ? 0 : nodeCount(_root); }
  private int nodeCount(int n) {
    int cnt = 1;
    for( int c : _nodes.get(n)._branches.values() ) cnt += nodeCount(c);
    return cnt;
  }

  public void print(TreePrinter p) throws IOException { p.printTree(this); }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    try {
      new TextTreePrinter(sb).printTree(this);
    } catch( IOException e ) {
      throw new AssertionError(e); // StringBuilder does not throw
    }
    return sb.toString();
  }

  /** The structure as JSON: nested objects from the root down. */
  public JsonObject toJson() {
    JsonObject res = new JsonObject();
    res.addProperty("depth", depth());
    res.addProperty("leaves", leafCount());
    if( _root != NONE ) res.add("root", toJson(_nodes.get(_root)));
    return res;
  }

  private JsonObject toJson(Node n) {
    JsonObject o = new JsonObject();
    o.addProperty("feature", n._feature);
    o.addProperty("gain", n._gain);
    JsonArray freq = new JsonArray();
    for( int f : n._freq ) freq.add(f);
    o.add("freq", freq);
    o.addProperty("class", n._majority);
    o.addProperty("leaf", n._leaf);
    if( !n._leaf && n.isContinuous() ) o.addProperty("threshold", n._threshold);
    if( !n._branches.isEmpty() ) {
      JsonObject br = new JsonObject();
      for( Map.Entry<Integer,Integer> e : n._branches.entrySet() )
        br.add(Integer.toString(e.getKey()), toJson(_nodes.get(e.getValue())));
      o.add("branches", br);
    }
    return o;
  }
}
