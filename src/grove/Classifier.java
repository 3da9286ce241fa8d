package grove;

/**
 * A classifier maps a feature vector to one of {@link #numClasses()} zero
 * based classes. Subclasses implement training and single-row prediction; the
 * batch variant is shared.
 */
public abstract class Classifier {

  /** Trains on the instance matrix {@code x} (m rows by n columns) and the
   *  labels {@code y}, each in [0, numClasses). */
  public abstract void train(double[][] x, int[] y);

  /** Returns the class index for the feature vector {@code z}. */
  public abstract int predict(double[] z);

  public abstract int numClasses();

  public abstract String modelName();

  /** Classifies every row of the matrix. */
  public int[] predict(double[][] x) {
    int[] res = new int[x.length];
    for( int i = 0; i < x.length; ++i ) res[i] = predict(x[i]);
    return res;
  }

  /** Invalid hyper-parameters or mismatched names; the model is not built. */
  public static class IllegalConfigException extends RuntimeException {
    public IllegalConfigException(String string) { super(string); }
  }
}
