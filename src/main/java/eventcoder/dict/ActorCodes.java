package eventcoder.dict;

import java.util.ArrayList;
import java.util.List;

/**
 * The codes of one actor: unconditional codes and date-restricted variants,
 * in file order.  Shared by the actor's primary phrase and its synonyms.
 */
public class ActorCodes {
  enum Kind { DEFAULT, BEFORE, AFTER, INTERVAL }

  static class Restriction {
    final Kind kind;
    final int from, to;
    final String code;

    Restriction(Kind kind, int from, int to, String code) {
      this.kind = kind;
      this.from = from;
      this.to = to;
      this.code = code;
    }

    boolean holds(int date) {
      switch( kind ) {
      case BEFORE:   return date <= to;
      case AFTER:    return date >= from;
      case INTERVAL: return date >= from && date <= to;
      default:       return false;
      }
    }

    public String toString() {
      switch( kind ) {
      case BEFORE:   return code + " <" + to;
      case AFTER:    return code + " >" + from;
      case INTERVAL: return code + " " + from + "-" + to;
      default:       return code;
      }
    }
  }

  private final String _root;
  private final List<Restriction> _codes = new ArrayList<Restriction>();

  /**
   * @param root The actor's primary phrase.
   */
  public ActorCodes(String root) {
    _root = root;
  }

  public String root() { return _root; }
  public boolean isEmpty() { return _codes.isEmpty(); }

  public void addDefault(String code) {
    _codes.add(new Restriction(Kind.DEFAULT, 0, 0, code));
  }

  public void addBefore(int date, String code) {
    _codes.add(new Restriction(Kind.BEFORE, 0, date, code));
  }

  public void addAfter(int date, String code) {
    _codes.add(new Restriction(Kind.AFTER, date, 0, code));
  }

  public void addInterval(int from, int to, String code) {
    _codes.add(new Restriction(Kind.INTERVAL, from, to, code));
  }

  /**
   * The first date restriction that holds wins, otherwise the last
   * unconditional code, otherwise "---".
   * @param date Ordinal sentence date, or null when the sentence has none;
   *             then only unconditional codes apply.
   */
  public String resolve(Integer date) {
    if( date != null ) {
      for( Restriction res : _codes )
        if( res.kind != Kind.DEFAULT && res.holds(date) ) return res.code;
    }
    String code = null;
    for( Restriction res : _codes )
      if( res.kind == Kind.DEFAULT ) code = res.code;
    return (code == null ? "---" : code);
  }

  public String toString() {
    return _root + _codes;
  }
}
