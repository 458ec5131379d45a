package eventcoder.coding;

import java.util.ArrayList;
import java.util.List;

import eventcoder.parse.Token;


/**
 * The words and entity markers on one side of a verb.  The upper sequence
 * holds what precedes the verb in reverse order, so both sides read outward
 * from the verb.
 */
public class ContextSequence {
  public enum Kind { WORD, ENTITY_OPEN, ENTITY_CLOSE, COMPOUND_OPEN, COMPOUND_CLOSE }

  /** One element of a context sequence. */
  public static class Item {
    private final Kind _kind;
    private final String _text;
    private final Token _code;
    private final int _position;

    Item(Kind kind, String text, Token code, int position) {
      _kind = kind;
      _text = text;
      _code = code;
      _position = position;
    }

    public Kind kind() { return _kind; }
    /** The word, for WORD items. */
    public String text() { return _text; }
    /** Position of the marker or word in the token sequence. */
    public int position() { return _position; }

    public boolean isWord() { return _kind == Kind.WORD; }
    public boolean isEntityOpen() { return _kind == Kind.ENTITY_OPEN; }
    public boolean isEntityClose() { return _kind == Kind.ENTITY_CLOSE; }
    public boolean isCompoundOpen() { return _kind == Kind.COMPOUND_OPEN; }
    public boolean isCompoundClose() { return _kind == Kind.COMPOUND_CLOSE; }

    /** Entity and compound markers. */
    public boolean isBoundary() { return _kind != Kind.WORD; }
    public boolean isCompoundBoundary() {
      return _kind == Kind.COMPOUND_OPEN || _kind == Kind.COMPOUND_CLOSE;
    }

    /** The resolved code of an entity open, "---" when unresolved. */
    public String code() {
      return (_code == null ? Token.NULL_CODE : _code.text());
    }

    /** The actor root phrase recorded with the code, or null. */
    public String root() {
      return (_code == null ? null : _code.root());
    }

    public boolean isResolved() {
      return _code != null && _code.isResolved();
    }

    public String toString() {
      switch( _kind ) {
      case WORD:           return _text;
      case ENTITY_OPEN:    return "(NE<" + _position + ">" + code();
      case ENTITY_CLOSE:   return "~NE";
      case COMPOUND_OPEN:  return "(NEC";
      default:             return "~NEC";
      }
    }
  }

  private final boolean _upper;
  private final List<Item> _items = new ArrayList<Item>();

  public ContextSequence(boolean upper) {
    _upper = upper;
  }

  public boolean isUpper() { return _upper; }
  public int size() { return _items.size(); }
  public Item get(int i) { return _items.get(i); }
  public List<Item> items() { return _items; }

  public void addWord(String word, int position) {
    _items.add(new Item(Kind.WORD, word, null, position));
  }

  /**
   * @param code The code slot that follows the entity open.
   */
  public void addEntityOpen(Token code, int position) {
    _items.add(new Item(Kind.ENTITY_OPEN, null, code, position));
  }

  public void addMarker(Kind kind, int position) {
    _items.add(new Item(kind, null, null, position));
  }

  /**
   * The words of the entity opened at index, in sentence order.
   */
  public List<String> entityWords(int index) {
    List<String> words = new ArrayList<String>();
    if( _upper ) {
      for( int i = index - 1; i >= 0 && _items.get(i).isWord(); i-- )
        words.add(_items.get(i).text());
    } else {
      for( int i = index + 1; i < _items.size() && _items.get(i).isWord(); i++ )
        words.add(_items.get(i).text());
    }
    return words;
  }

  public String toString() {
    return (_upper ? "upper" : "lower") + _items;
  }
}
