package grove.tree;

import grove.Data;
import grove.HyperParams;

/** C4.5: categorical columns split by value, continuous columns split in two
 *  at the best threshold (branch 0 for values at or below it, 1 above). The
 *  threshold is searched again for every continuous column at every node. */
public class DecisionTreeC45 extends DecisionTree {

  public DecisionTreeC45(Data data, HyperParams params) { super(data, params); }

  public DecisionTreeC45(Data data) { this(data, HyperParams.DEFAULT); }

  @Override Statistic statistic(Data data) { return new EntropyStatistic(data, true); }

  @Override protected String algorithm() { return "C45"; }
}
