package eventcoder.dict;

import java.util.ArrayList;
import java.util.List;

/**
 * A verb dictionary entry: either a primary entry holding the block's
 * patterns, or a redirect to a primary entry carrying its own default code.
 * Either kind may carry multi-word continuations.
 */
public class VerbEntry {
  private final String _key;
  private final boolean _primary;
  private String _code;
  private final String _target;
  private final List<VerbPattern> _patterns = new ArrayList<VerbPattern>();
  private final List<MultiWordVerb> _multiWords = new ArrayList<MultiWordVerb>();

  private VerbEntry(String key, boolean primary, String code, String target) {
    _key = key;
    _primary = primary;
    _code = code;
    _target = target;
  }

  public static VerbEntry primary(String key, String code) {
    return new VerbEntry(key, true, code, key);
  }

  public static VerbEntry redirect(String key, String code, String target) {
    return new VerbEntry(key, false, code, target);
  }

  public String key() { return _key; }
  public boolean isPrimary() { return _primary; }
  public String code() { return _code; }
  /** The primary key: this entry's own key when primary. */
  public String target() { return _target; }
  public List<VerbPattern> patterns() { return _patterns; }
  public List<MultiWordVerb> multiWords() { return _multiWords; }

  void setCode(String code) { _code = code; }
  void addPattern(VerbPattern pattern) { _patterns.add(pattern); }
  void addMultiWord(MultiWordVerb multi) { _multiWords.add(multi); }

  public String toString() {
    if( _primary ) return _key + " [" + _code + "] " + _patterns.size() + " patterns";
    return _key + " -> " + _target + " [" + _code + "]";
  }
}
