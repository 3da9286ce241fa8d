package grove.tree;

import static org.junit.Assert.*;

import grove.Data;
import grove.HyperParams;
import grove.TestUtil;

import org.junit.Test;

public class DecisionTreeC45Test {

  @Test public void testTwoClusters() {
    DecisionTreeC45 dt = new DecisionTreeC45(TestUtil.clusters());
    dt.train();
    Tree t = dt.tree();
    Node root = t.rootNode();
    assertEquals(0, root.feature());
    assertTrue(root.isContinuous());
    assertEquals(6.5, root.threshold(), 0);
    assertEquals(1.0, root.gain(), 1e-12);
    assertEquals(2, t.leafCount());
    assertEquals(0, dt.calcEntropy(), 0);
    assertArrayEquals(new int[] { 3, 0 }, t.node(root.child(0)).freq());
    assertArrayEquals(new int[] { 0, 3 }, t.node(root.child(1)).freq());
    assertEquals(0, dt.predict(new double[] { 6.5, 0 }));
    assertEquals(1, dt.predict(new double[] { 6.6, 0 }));
    assertEquals(0, dt.predict(new double[] { -100, 0 }));
  }

  @Test public void testLastColumnGetsNoBranches() {
    Data d = TestUtil.clusters().project(new int[] { 0 });
    DecisionTreeC45 dt = new DecisionTreeC45(d);
    dt.train();
    Node root = dt.tree().rootNode();
    assertEquals(0, root.feature());
    assertTrue(root.isLeaf());
    assertEquals(1, dt.tree().nodeCount());
    assertEquals(0, dt.predict(new double[] { 12 })); // tie, lowest class
  }

  @Test public void testPlayTennisMeasured() {
    DecisionTreeC45 dt = new DecisionTreeC45(TestUtil.tennisCont());
    dt.train();
    Tree t = dt.tree();
    Node root = t.rootNode();
    assertEquals(0, root.feature());
    assertFalse(root.isContinuous());
    Node rain = t.node(root.child(0)), sunny = t.node(root.child(2));
    assertEquals(3, rain.feature());
    assertFalse(rain.isContinuous());
    assertEquals(2, sunny.feature());
    assertEquals(77.5, sunny.threshold(), 0);
    assertArrayEquals(new int[] { 0, 2 }, t.node(sunny.child(0)).freq());
    assertArrayEquals(new int[] { 3, 0 }, t.node(sunny.child(1)).freq());
    Data d = dt.data();
    assertArrayEquals(TestUtil.y(d), dt.predict(TestUtil.x(d)));
    assertEquals(1, dt.predict(new double[] { 2, 70, 60, 1 }));
    assertEquals(0, dt.predict(new double[] { 2, 70, 99, 1 }));
  }

  @Test public void testWineProperties() {
    for( int h = 1; h <= 4; ++h ) {
      DecisionTreeC45 dt = new DecisionTreeC45(TestUtil.wine(), HyperParams.DEFAULT.with(HyperParams.HEIGHT, h));
      dt.train();
      Tree t = dt.tree();
      assertEquals(11, t.rootNode().size());
      assertTrue(t.depth() <= h);
      assertTrue(dt.calcEntropy() <= dt.entropy0() + 1e-12);
      DecisionTreeID3Test.checkChildren(t, t.root());
      Data d = dt.data();
      for( int i = 0; i < d.rows(); ++i ) {
        Node leaf = t.node(t.reach(d.row(i)));
        assertEquals(leaf.majorityClass(), dt.predict(d.row(i)));
      }
    }
  }

  @Test public void testRetrainReplacesTree() {
    DecisionTreeC45 dt = new DecisionTreeC45(TestUtil.tennisCont());
    dt.train();
    Tree first = dt.tree();
    Data d = dt.data();
    dt.train(TestUtil.x(d), TestUtil.y(d));
    assertNotSame(first, dt.tree());
    assertEquals(first.toJson(), dt.tree().toJson());
    assertEquals("DecisionTreeC45_4", dt.modelName());
  }
}
