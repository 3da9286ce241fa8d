package grove;

import static org.junit.Assert.*;

import grove.Classifier.IllegalConfigException;
import grove.util.Utils;

import java.util.Collections;

import org.junit.Test;

public class DataTest {

  @Test public void testMakeFromCombinedMatrix() {
    Data d = TestUtil.tennis();
    assertEquals(14, d.rows());
    assertEquals(4, d.columns());
    assertEquals(2, d.classes());
    assertEquals("Humidity", d.colName(2));
    assertEquals("Yes", d.className(1));
    assertArrayEquals(new int[] { 5, 9 }, d.frequencies());
    assertArrayEquals(new double[] { 2, 2, 1, 0 }, d.row(0), 0);
  }

  @Test public void testDefaultNames() {
    Data d = Data.make(new double[][] { { 0, 1 }, { 1, 0 } }, new int[] { 0, 1 }, 2);
    assertArrayEquals(new String[] { "x0", "x1" }, d.colNames());
    assertArrayEquals(new String[] { "No", "Yes" }, d.classNames());
    Data d3 = Data.make(new double[][] { { 0 } }, new int[] { 2 }, 3);
    assertArrayEquals(new String[] { "c0", "c1", "c2" }, d3.classNames());
  }

  @Test(expected = IllegalConfigException.class)
  public void testLabelOutOfRange() {
    Data.make(new double[][] { { 0 }, { 1 } }, new int[] { 0, 2 }, 2);
  }

  @Test(expected = IllegalConfigException.class)
  public void testRaggedMatrix() {
    Data.make(new double[][] { { 0, 1 }, { 1 } }, new int[] { 0, 1 }, 2);
  }

  @Test(expected = IllegalConfigException.class)
  public void testClassNamesMismatch() {
    Data.make(new double[][] { { 0 } }, new int[] { 0 }, 2, null, new String[] { "a", "b", "c" }, null);
  }

  @Test(expected = IllegalConfigException.class)
  public void testMissingContinuousColumn() {
    Data.make(new double[][] { { 0 } }, new int[] { 0 }, 2, null, null, Collections.singleton(3));
  }

  @Test public void testDistinctAndFrequencies() {
    Data d = TestUtil.tennis();
    int[] sunny = { 0, 1, 7, 8, 10 };
    assertArrayEquals(new double[] { 0, 1 }, d.distinct(2, sunny), 0);
    assertArrayEquals(new double[] { 0, 1, 2 }, d.distinct(0, Utils.range(14)), 0);
    assertArrayEquals(new int[] { 3, 2 }, d.frequencies(sunny));
    assertArrayEquals(new int[] { 3, 3, 2, 2 }, d.valueCounts());
  }

  @Test public void testSubsetKeepsDuplicates() {
    Data d = TestUtil.tennis();
    Data s = d.subset(new int[] { 2, 2, 0 });
    assertEquals(3, s.rows());
    assertArrayEquals(new int[] { 1, 2 }, s.frequencies());
    assertArrayEquals(d.colNames(), s.colNames());
  }

  @Test public void testProjectRemapsColumns() {
    Data d = TestUtil.tennisCont();
    Data p = d.project(new int[] { 0, 2 });
    assertEquals(2, p.columns());
    assertArrayEquals(new String[] { "Outlook", "Humidity" }, p.colNames());
    assertEquals(Collections.singleton(1), p.conts());
    assertEquals(85, p.get(0, 1), 0);
    assertArrayEquals(new double[] { 7, 9 }, Data.project(new double[] { 7, 8, 9 }, new int[] { 0, 2 }), 0);
  }

  @Test public void testShiftToZero() {
    double[][] x = { { 1, 2.5 }, { 3, 4.5 } };
    Data d = Data.make(x, new int[] { 0, 1 }, 2, null, null, Collections.singleton(1));
    Data s = d.shiftToZero();
    assertArrayEquals(new double[] { 0, 2 }, s.column(0), 0);
    assertArrayEquals(new double[] { 2.5, 4.5 }, s.column(1), 0);
    assertArrayEquals(new double[] { 1, 2.5 }, x[0], 0); // caller's matrix untouched
  }
}
