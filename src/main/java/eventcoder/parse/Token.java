package eventcoder.parse;

/**
 * One element of a flattened parse.  Open and close markers carry the
 * syntactic label and an occurrence index (0 when the label is not indexed).
 * An entity open (label NE) is always followed by a CODE token that holds
 * the resolved actor code, "---" until the entity is resolved.
 */
public class Token {
  public enum Kind { OPEN, CLOSE, WORD, CODE }

  public static final String ENTITY = "NE";
  public static final String COMPOUND = "NEC";
  public static final String NULL_CODE = "---";

  private final Kind _kind;
  private String _label;
  private int _index;
  private String _text;
  private String _root;

  private Token(Kind kind, String label, int index, String text) {
    _kind = kind;
    _label = label;
    _index = index;
    _text = text;
  }

  public static Token open(String label) { return new Token(Kind.OPEN, label, 0, null); }
  public static Token open(String label, int index) { return new Token(Kind.OPEN, label, index, null); }
  public static Token close(String label, int index) { return new Token(Kind.CLOSE, label, index, null); }
  /** A close whose label is filled in once the enclosing open is known. */
  public static Token pendingClose() { return new Token(Kind.CLOSE, null, 0, null); }
  public static Token word(String text) { return new Token(Kind.WORD, null, 0, text); }
  public static Token code() { return new Token(Kind.CODE, null, 0, NULL_CODE); }

  public Kind kind() { return _kind; }
  public String label() { return _label; }
  public int index() { return _index; }
  public String text() { return _text; }
  public String root() { return _root; }

  public boolean isOpen() { return _kind == Kind.OPEN; }
  public boolean isClose() { return _kind == Kind.CLOSE; }
  public boolean isWord() { return _kind == Kind.WORD; }
  public boolean isCode() { return _kind == Kind.CODE; }
  public boolean isMarkup() { return _kind == Kind.OPEN || _kind == Kind.CLOSE; }

  public boolean isOpen(String label) { return _kind == Kind.OPEN && label.equals(_label); }
  public boolean isClose(String label) { return _kind == Kind.CLOSE && label.equals(_label); }
  public boolean isEntityOpen() { return isOpen(ENTITY); }
  public boolean isEntityClose() { return isClose(ENTITY); }
  public boolean isCompoundOpen() { return isOpen(COMPOUND); }
  public boolean isCompoundClose() { return isClose(COMPOUND); }
  public boolean isComma() { return isOpen(","); }

  public boolean labelStartsWith(String prefix) {
    return _label != null && _label.startsWith(prefix);
  }

  /** True if this close marker ends the phrase opened by the given token. */
  public boolean closes(Token open) {
    return _kind == Kind.CLOSE && open.isOpen() && _index == open._index
        && _label != null && _label.equals(open._label);
  }

  void resolveClose(Token open) {
    _label = open._label;
    _index = open._index;
  }

  /** Entity code slot. */
  public boolean isResolved() {
    return _kind == Kind.CODE && !NULL_CODE.equals(_text);
  }

  public void setCode(String code, String root) {
    if( _kind != Kind.CODE )
      throw new IllegalStateException("not a code slot: " + this);
    _text = code;
    _root = root;
  }

  public Token copy() {
    Token tok = new Token(_kind, _label, _index, _text);
    tok._root = _root;
    return tok;
  }

  public String toString() {
    switch( _kind ) {
    case OPEN:  return "(" + _label + (_index > 0 ? String.valueOf(_index) : "");
    case CLOSE: return "~" + _label + (_index > 0 ? String.valueOf(_index) : "");
    default:    return _text;
    }
  }
}
