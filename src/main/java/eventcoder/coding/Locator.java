package eventcoder.coding;

/**
 * Where the source or target of an event was found: an item of the upper or
 * the lower context sequence.
 */
public class Locator {
  private final int _index;
  private final boolean _upper;

  public Locator(int index, boolean upper) {
    _index = index;
    _upper = upper;
  }

  public int index() { return _index; }
  public boolean inUpper() { return _upper; }

  public boolean equals(Object other) {
    if( !(other instanceof Locator) ) return false;
    Locator loc = (Locator)other;
    return loc._index == _index && loc._upper == _upper;
  }

  public int hashCode() { return _index * 2 + (_upper ? 1 : 0); }

  public String toString() {
    return (_upper ? "upper:" : "lower:") + _index;
  }
}
