package eventcoder.dict;

import java.util.Arrays;
import java.util.List;

/**
 * A continuation of a verb into a multi-word verb, e.g. CARRY + OUT.
 * The words are in order of distance from the verb.
 */
public class MultiWordVerb {
  private final boolean _after;
  private final List<String> _words;
  private final String _target;
  private final String _code;

  public MultiWordVerb(boolean after, List<String> words, String target, String code) {
    _after = after;
    _words = words;
    _target = target;
    _code = code;
  }

  /** True when the words follow the verb, false when they precede it. */
  public boolean after() { return _after; }
  public List<String> words() { return _words; }
  /** Key of the primary entry whose patterns apply once this matches. */
  public String target() { return _target; }
  public String code() { return _code; }

  public String toString() {
    return (_after ? "+" : "-") + Arrays.toString(_words.toArray()) + "->" + _target + "[" + _code + "]";
  }
}
