package grove.tree;

import java.io.*;
import java.text.MessageFormat;

public class GraphvizTreePrinter extends TreePrinter {
  private final Appendable _dest;

  public GraphvizTreePrinter(OutputStream dest, String[] columns, String[] classNames) {
    this(new OutputStreamWriter(dest), columns, classNames);
  }

  public GraphvizTreePrinter(Appendable dest, String[] columns, String[] classNames) {
    super(columns, classNames);
    _dest = dest;
  }

  @Override public void printTree(Tree t) throws IOException {
    _dest.append("digraph {\n");
    if( !t.isEmpty() ) printNode(t, t.rootNode(), 0);
    _dest.append("}");
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  @Override void printNode(Tree t, Node n, int depth) throws IOException {
    if( n._leaf ) {
      _dest.append(String.format("%d [label=\"%s\\n%s\"];\n",
          n._id, "Leaf Node", className(n._majority)));
      return;
    }
    String test = n.isContinuous()
      ? MessageFormat.format("{0} <= {1} (entropy)", column(n._feature), Double.toString(n._threshold))
      : MessageFormat.format("{0} (entropy)", column(n._feature));
    _dest.append(String.format("%d [label=\"%s\\n%s\"];\n", n._id, "Node", test));
    for( int c : n._branches.values() ) {
      Node child = t.node(c);
      printNode(t, child, depth + 1);
      String label = n.isContinuous() ? (child._branchValue == 0 ? "yes" : "no") : Integer.toString(child._branchValue);
      _dest.append(String.format("%d -> %d [label=\"%s\"];\n", n._id, c, label));
    }
  }
}
