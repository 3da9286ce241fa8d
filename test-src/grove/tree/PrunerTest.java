package grove.tree;

import static org.junit.Assert.*;

import grove.HyperParams;

import org.junit.Test;

public class PrunerTest {
  static final HyperParams HEIGHT2 = HyperParams.DEFAULT.with(HyperParams.HEIGHT, 2);

  @Test public void testPruneLeastGainBelowThreshold() {
    DecisionTreeID3 dt = DecisionTreeID3Test.tennis(HEIGHT2);
    Tree t = dt.tree();
    int rain = t.rootNode().child(0);
    assertEquals(1, dt.prune());
    assertEquals(4, t.leafCount());
    Node n = t.node(rain);
    assertTrue(n.isLeaf());
    assertArrayEquals(new int[] { 2, 3 }, n.freq());
    assertTrue(n.children().isEmpty());
    assertEquals(1, dt.predict(new double[] { 0, 1, 0, 1 })); // rain now votes yes
    assertEquals(5 * 0.970951 / 14, dt.calcEntropy(), 1e-5);
  }

  @Test public void testNothingBelowThreshold() {
    DecisionTreeID3 dt = DecisionTreeID3Test.tennis(HEIGHT2);
    String before = dt.printTree();
    assertEquals(0, dt.prune(1, 0.5));
    assertEquals(5, dt.tree().leafCount());
    assertEquals(before, dt.printTree());
  }

  @Test public void testRepeatedPruningCollapsesToRoot() {
    DecisionTreeID3 dt = DecisionTreeID3Test.tennis(HEIGHT2);
    assertEquals(3, new Pruner(dt.tree()).prune(10, 0.98));
    Tree t = dt.tree();
    assertEquals(1, t.leafCount());
    assertTrue(t.rootNode().isLeaf());
    assertEquals(1, dt.predict(new double[] { 2, 2, 1, 1 }));
  }

  @Test public void testLeafCountNeverGrows() {
    DecisionTreeC45 dt = new DecisionTreeC45(grove.TestUtil.wine());
    dt.train();
    int leaves = dt.tree().leafCount();
    for( int i = 0; i < 5; ++i ) {
      dt.prune(1, 2.5);
      assertTrue(dt.tree().leafCount() <= leaves);
      leaves = dt.tree().leafCount();
    }
  }

  @Test public void testSingleNodeTree() {
    DecisionTreeID3 dt = DecisionTreeID3Test.tennis(HyperParams.DEFAULT.with(HyperParams.HEIGHT, 0));
    assertEquals(0, dt.prune(3, 1.0));
    assertEquals(1, dt.tree().leafCount());
  }
}
