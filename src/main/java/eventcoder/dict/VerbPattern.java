package eventcoder.dict;

import java.util.List;

/**
 * An (upper, lower, code) triple of a verb entry.  The upper atoms read
 * outward from the verb toward the start of the sentence; the lower atoms
 * read forward from the verb.
 */
public class VerbPattern {
  private final List<PatternAtom> _upper;
  private final List<PatternAtom> _lower;
  private final String _code;
  private final String _line;

  public VerbPattern(List<PatternAtom> upper, List<PatternAtom> lower, String code, String line) {
    _upper = upper;
    _lower = lower;
    _code = code;
    _line = line;
  }

  public List<PatternAtom> upper() { return _upper; }
  public List<PatternAtom> lower() { return _lower; }
  public String code() { return _code; }
  /** The dictionary line the pattern came from. */
  public String line() { return _line; }

  public String toString() {
    return _upper + " * " + _lower + " [" + _code + "]";
  }
}
