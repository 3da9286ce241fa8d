package grove.tree;

import static grove.tree.Node.NONE;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.google.gson.JsonObject;

public class TreeTest {

  // root splits on x0 into two pure leaves, value 2 has no branch
  static Tree stump() {
    Tree t = new Tree();
    int r = t.newNode(0, 0.5, new int[] { 3, 3 }, NONE, false);
    int a = t.newNode(1, 0.2, new int[] { 3, 0 }, r, true);
    int b = t.newNode(1, 0.3, new int[] { 0, 3 }, r, true);
    t.addRoot(r);
    t.add(r, 0, a);
    t.add(r, 1, b);
    return t;
  }

  @Test public void testStructure() {
    Tree t = stump();
    assertEquals(0, t.root());
    assertEquals(Arrays.asList(1, 2), Arrays.asList(t.leaves().toArray()));
    assertEquals(3, t.nodeCount());
    assertEquals(1, t.depth());
    assertEquals(1, t.node(2).branchValue());
    assertEquals(2, t.rootNode().child(1));
    assertEquals(NONE, t.rootNode().child(2));
    assertTrue(t.leafChildren(0));
    assertEquals(6, t.rootNode().size());
  }

  @Test public void testEntropy() {
    Tree t = stump();
    assertEquals(0, t.calcEntropy(), 0);
    assertEquals(1, t.calcEntropy(Collections.singleton(0)), 1e-12);
    assertEquals(0, t.calcEntropy(Collections.<Integer>emptySet()), 0);
  }

  @Test public void testPredictFallsBackToMajority() {
    Tree t = stump();
    assertEquals(0, t.predict(new double[] { 0 }));
    assertEquals(1, t.predict(new double[] { 1 }));
    assertEquals(0, t.predict(new double[] { 2 })); // tie at the root, lowest class
    assertEquals(0, t.reach(new double[] { 2 }));
    assertEquals(2, t.reach(new double[] { 1 }));
  }

  @Test public void testContinuousBranches() {
    Tree t = stump();
    t.rootNode()._threshold = 0.5;
    assertEquals(0, t.predict(new double[] { 0.5 }));
    assertEquals(1, t.predict(new double[] { 0.51 }));
  }

  @Test public void testCandidatesAndMakeLeaf() {
    Tree t = stump();
    assertEquals(Collections.singleton(0), t.candidates());
    assertEquals(0, t.bestCandidate(t.candidates()));
    t.makeLeaf(0);
    assertEquals(Collections.singleton(0), t.leaves());
    assertEquals(1, t.nodeCount());
    assertEquals(0, t.depth());
    assertTrue(t.candidates().isEmpty());
    assertEquals(NONE, t.bestCandidate(t.candidates()));
    assertEquals(0, t.predict(new double[] { 1 }));
  }

  @Test public void testMakeLeafDropsDescendants() {
    Tree t = new Tree();
    int r = t.newNode(0, 0.9, new int[] { 2, 2 }, NONE, false);
    int a = t.newNode(1, 0.4, new int[] { 2, 1 }, r, false);
    int b = t.newNode(1, 0.9, new int[] { 0, 1 }, r, true);
    int c = t.newNode(2, 0.9, new int[] { 2, 0 }, a, true);
    int d = t.newNode(2, 0.9, new int[] { 0, 1 }, a, true);
    t.addRoot(r);
    t.add(a, 0, c);
    t.add(a, 1, d);
    t.add(r, 0, a);
    t.add(r, 1, b);
    assertEquals(3, t.leafCount());
    assertEquals(2, t.depth());
    assertEquals(Collections.singleton(a), t.candidates());
    t.makeLeaf(r);
    assertEquals(Collections.singleton(r), t.leaves());
  }

  @Test public void testBestCandidateFirstOnTies() {
    Tree t = new Tree();
    int r = t.newNode(0, 0.9, new int[] { 4, 4 }, NONE, false);
    int a = t.newNode(1, 0.3, new int[] { 2, 2 }, r, false);
    int b = t.newNode(1, 0.3, new int[] { 2, 2 }, r, false);
    t.addRoot(r);
    t.add(r, 0, a);
    t.add(r, 1, b);
    for( int p : new int[] { a, b } )
      for( int v = 0; v < 2; ++v ) {
        int[] f = new int[2];
        f[v] = 2;
        t.add(p, v, t.newNode(2, 0.9, f, p, true));
      }
    assertEquals(a, t.bestCandidate(t.candidates()));
  }

  @Test public void testJson() {
    JsonObject o = stump().toJson();
    assertEquals(1, o.get("depth").getAsInt());
    assertEquals(2, o.get("leaves").getAsInt());
    JsonObject root = o.getAsJsonObject("root");
    assertEquals(0, root.get("feature").getAsInt());
    assertFalse(root.get("leaf").getAsBoolean());
    JsonObject one = root.getAsJsonObject("branches").getAsJsonObject("1");
    assertEquals(1, one.get("class").getAsInt());
    assertEquals(3, one.getAsJsonArray("freq").get(1).getAsInt());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBranchTakenOnce() {
    Tree t = stump();
    t.add(0, 1, t.newNode(1, 0.1, new int[] { 1, 1 }, 0, true));
  }

  @Test public void testShortQuery() {
    Tree t = stump();
    try {
      t.predict(new double[0]);
      fail("query without column 0 accepted");
    } catch( IllegalArgumentException e ) {
      assertTrue(e.getMessage().contains("splits on column 0"));
    }
    assertEquals(2, t.leafCount());
  }

  @Test(expected = IllegalStateException.class)
  public void testPredictEmpty() {
    new Tree().predict(new double[] { 0 });
  }
}
