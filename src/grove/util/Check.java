package grove.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.Lists;

public class Check {
  private static final Pattern PARAM_PATTERN = Pattern.compile("[a-z]+([A-Z]?[a-z0-9]+)*");
  private static final List<String> RESERVED_WORDS = Lists.newArrayList(
    // java reserved words that would clash with generated accessors
    "class", "default", "public", "private", "protected", "static", "true",
    "false", "final", "volatile", "transient", "package", "null"
  );

  /** Hyper-parameter names are camelCase identifiers that are not reserved words. */
  public static boolean paramName(String s) {
    if( s == null ) return false;
    Matcher m = PARAM_PATTERN.matcher(s);
    return m.matches() && !RESERVED_WORDS.contains(s);
  }
}
