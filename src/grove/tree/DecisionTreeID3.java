package grove.tree;

import grove.Data;
import grove.HyperParams;

/** ID3: every column is categorical and a split has one branch per value. */
public class DecisionTreeID3 extends DecisionTree {

  public DecisionTreeID3(Data data, HyperParams params) {
    super(data, params);
    checkData(data);
  }

  public DecisionTreeID3(Data data) { this(data, HyperParams.DEFAULT); }

  @Override protected void checkData(Data data) {
    if( !data.conts().isEmpty() )
      throw new IllegalConfigException("ID3 handles categorical columns only, found continuous columns " + data.conts());
  }

  @Override Statistic statistic(Data data) { return new EntropyStatistic(data, false); }

  @Override protected String algorithm() { return "ID3"; }
}
