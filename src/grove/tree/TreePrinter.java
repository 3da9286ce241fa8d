package grove.tree;

import java.io.IOException;

public abstract class TreePrinter {
  protected final String[] _columnNames;
  protected final String[] _classNames;

  public TreePrinter(String[] columns, String[] classNames) {
    _columnNames = columns;
    _classNames = classNames;
  }

  public abstract void printTree(Tree t) throws IOException;
  abstract void printNode(Tree t, Node n, int depth) throws IOException;

  String column(int c) {
    if( c < 0 ) return "-";
    return _columnNames == null ? "x" + c : _columnNames[c];
  }

  String className(int c) {
    return _classNames == null || c >= _classNames.length ? "Class " + c : _classNames[c];
  }
}
