package grove.tree;

import java.io.*;
import java.util.Arrays;

/** Indented dump of a tree, one node per line, children below their parent. */
public class TextTreePrinter extends TreePrinter {
  private final Appendable _dest;

  public TextTreePrinter(Appendable dest) { this(dest, null, null); }

  public TextTreePrinter(OutputStream dest, String[] columns, String[] classNames) {
    this(new OutputStreamWriter(dest), columns, classNames);
  }

  public TextTreePrinter(Appendable dest, String[] columns, String[] classNames) {
    super(columns, classNames);
    _dest = dest;
  }

  @Override public void printTree(Tree t) throws IOException {
    if( t.isEmpty() ) _dest.append("<empty tree>\n");
    else printNode(t, t.rootNode(), 0);
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  @Override void printNode(Tree t, Node n, int depth) throws IOException {
    for( int i = 0; i < depth; ++i ) _dest.append("    ");
    _dest.append(n.isRoot() ? "root" : Integer.toString(n._branchValue)).append(" -> Node(");
    _dest.append(column(n._feature)).append(", nu = ").append(Arrays.toString(n._freq));
    _dest.append(", y = ").append(className(n._majority));
    if( n._leaf ) _dest.append(", leaf");
    else if( n.isContinuous() ) _dest.append(", thres = ").append(Double.toString(n._threshold));
    _dest.append(")\n");
    for( int c : n._branches.values() ) printNode(t, t.node(c), depth + 1);
  }
}
