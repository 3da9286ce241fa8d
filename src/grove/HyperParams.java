package grove;

import grove.Classifier.IllegalConfigException;
import grove.util.Check;

import java.util.Properties;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;

/**
 * Hyper-parameters for decision trees, bagging trees and random forests.
 * Instances are immutable; {@link #with} returns an updated copy.
 */
public final class HyperParams {
  public static final String HEIGHT   = "height";
  public static final String CUTOFF   = "cutoff";
  public static final String NTREES   = "nTrees";
  public static final String BRATIO   = "bRatio";
  public static final String FBRATIO  = "fbRatio";
  public static final String PARALLEL = "parallel";

  public static final Set<String> NAMES = ImmutableSet.of(HEIGHT, CUTOFF, NTREES, BRATIO, FBRATIO, PARALLEL);
  static {
    for( String n : NAMES ) assert Check.paramName(n) : "Bad parameter name " + n;
  }

  /** Maximum tree height: edges on the longest root-to-leaf path (default: 4) */
  final int _height;
  /** Entropy at or below which a node becomes a leaf (default: 0.01) */
  final double _cutoff;
  /** Number of trees in an ensemble, odd is recommended (default: 11) */
  final int _nTrees;
  /** Fraction of rows sampled for each ensemble tree (default: 0.7) */
  final double _bRatio;
  /** Fraction of columns sampled for each random forest tree (default: 0.7) */
  final double _fbRatio;
  /** If true, ensemble trees are built in parallel (default: false) */
  final boolean _parallel;

  public static final HyperParams DEFAULT = new HyperParams(4, 0.01, 11, 0.7, 0.7, false);

  public HyperParams(int height, double cutoff, int nTrees, double bRatio, double fbRatio, boolean parallel) {
    if( height < 0 )
      throw new IllegalConfigException("Tree height must be non-negative, found " + height);
    if( !(0 <= cutoff && cutoff <= 1) )
      throw new IllegalConfigException("Entropy cutoff must be in [0,1], found " + cutoff);
    _height   = height;
    _cutoff   = cutoff;
    _nTrees   = nTrees;
    _bRatio   = bRatio;
    _fbRatio  = fbRatio;
    _parallel = parallel;
  }

  public int height()       { return _height;   }
  public double cutoff()    { return _cutoff;   }
  public int nTrees()       { return _nTrees;   }
  public double bRatio()    { return _bRatio;   }
  public double fbRatio()   { return _fbRatio;  }
  public boolean parallel() { return _parallel; }

  /** Returns a copy with the named parameter replaced. */
  public HyperParams with(String name, double value) {
    switch( checkName(name) ) {
    case HEIGHT:   return new HyperParams((int)value, _cutoff, _nTrees, _bRatio, _fbRatio, _parallel);
    case CUTOFF:   return new HyperParams(_height, value, _nTrees, _bRatio, _fbRatio, _parallel);
    case NTREES:   return new HyperParams(_height, _cutoff, (int)value, _bRatio, _fbRatio, _parallel);
    case BRATIO:   return new HyperParams(_height, _cutoff, _nTrees, value, _fbRatio, _parallel);
    case FBRATIO:  return new HyperParams(_height, _cutoff, _nTrees, _bRatio, value, _parallel);
    case PARALLEL: return new HyperParams(_height, _cutoff, _nTrees, _bRatio, _fbRatio, value != 0);
    default: throw new AssertionError(name);
    }
  }

  public HyperParams with(String name, boolean value) { return with(name, value ? 1 : 0); }

  /** Reads parameters from string properties; missing names keep their
   *  values from {@code this}, unknown names are rejected. */
  public HyperParams with(Properties p) {
    HyperParams res = this;
    for( String name : p.stringPropertyNames() ) {
      String s = p.getProperty(name).trim();
      double v;
      if( PARALLEL.equals(name) ) v = Boolean.parseBoolean(s) ? 1 : 0;
      else try {
        v = Double.parseDouble(s);
      } catch( NumberFormatException e ) {
        throw new IllegalConfigException("Parameter " + name + " expects a number, found '" + s + "'");
      }
      res = res.with(name, v);
    }
    return res;
  }

  public static HyperParams fromProperties(Properties p) { return DEFAULT.with(p); }

  private static String checkName(String name) {
    if( !Check.paramName(name) || !NAMES.contains(name) )
      throw new IllegalConfigException("Unknown hyper-parameter '" + name + "', expected one of " + NAMES);
    return name;
  }

  public JsonObject toJson() {
    JsonObject res = new JsonObject();
    res.addProperty(HEIGHT,   _height);
    res.addProperty(CUTOFF,   _cutoff);
    res.addProperty(NTREES,   _nTrees);
    res.addProperty(BRATIO,   _bRatio);
    res.addProperty(FBRATIO,  _fbRatio);
    res.addProperty(PARALLEL, _parallel);
    return res;
  }

  @Override public String toString() { return toJson().toString(); }

  @Override public boolean equals(Object o) {
    if( !(o instanceof HyperParams) ) return false;
    HyperParams h = (HyperParams)o;
    return _height == h._height && _cutoff == h._cutoff && _nTrees == h._nTrees
        && _bRatio == h._bRatio && _fbRatio == h._fbRatio && _parallel == h._parallel;
  }

  @Override public int hashCode() { return toString().hashCode(); }
}
