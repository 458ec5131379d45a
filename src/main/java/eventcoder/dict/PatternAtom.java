package eventcoder.dict;

/**
 * One element of a verb pattern, with the connector that governs the gap
 * before it: ' ' allows intervening words, '_' requires adjacency.
 */
public class PatternAtom {
  public enum Type {
    LITERAL,
    SYNSET,
    /** $ : the current entity is the source */
    SOURCE,
    /** + : the current entity is the target */
    TARGET,
    /** ^ : skip to the end of the current entity */
    SKIP,
    /** % : the current compound is both source and target */
    COMPOUND
  }

  private final Type _type;
  private final String _text;
  private final char _connector;
  private final Synset _synset;

  public PatternAtom(Type type, String text, char connector, Synset synset) {
    _type = type;
    _text = text;
    _connector = connector;
    _synset = synset;
  }

  public Type type() { return _type; }
  public String text() { return _text; }
  public char connector() { return _connector; }
  public Synset synset() { return _synset; }
  public boolean allowsGap() { return _connector == ' '; }

  public boolean isControl() {
    return _type == Type.SOURCE || _type == Type.TARGET || _type == Type.SKIP || _type == Type.COMPOUND;
  }

  public String toString() {
    return "[" + _connector + "]" + _text;
  }
}
