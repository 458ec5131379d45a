package eventcoder.util;

import java.util.Properties;

import edu.stanford.nlp.util.StringUtils;


/**
 * Command line flags: "-flag value" pairs, or a bare "-flag".
 */
public class HandleParameters {
  private final Properties _props;

  public HandleParameters(String[] args) {
    _props = StringUtils.argsToProperties(args);
  }

  private static String key(String flag) {
    int i = 0;
    while( i < flag.length() && flag.charAt(i) == '-' ) i++;
    return flag.substring(i);
  }

  public boolean hasFlag(String flag) {
    return _props.containsKey(key(flag));
  }

  /**
   * @return The value following the flag, or null.
   */
  public String get(String flag) {
    return _props.getProperty(key(flag));
  }

  /** All flags, without their leading dashes. */
  public Properties properties() {
    return _props;
  }
}
