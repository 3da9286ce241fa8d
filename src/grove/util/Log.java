package grove.util;

import com.google.common.base.Throwables;

/**
 * Console logging. Normal output goes to System.out tagged with the component
 * name, warnings go to System.err. Debug output is printed only when the
 * {@code grove.verbose} system property is set to a positive level.
 */
public final class Log {
  private static final int VERBOSE = Integer.getInteger("grove.verbose", 0);

  private Log() { }

  public static boolean isDebug() { return VERBOSE > 0; }

  public static void info(String tag, String msg) {
    System.out.println("[" + tag + "] " + msg);
  }

  public static void debug(String tag, String msg) {
    if( VERBOSE > 0 ) System.out.println("[" + tag + "] " + msg);
  }

  public static void warn(String tag, String msg) {
    System.err.println("[" + tag + "] WARN: " + msg);
  }

  public static void warn(String tag, String msg, Throwable t) {
    System.err.println("[" + tag + "] WARN: " + msg);
    System.err.println(Throwables.getStackTraceAsString(t));
  }
}
