package eventcoder.parse;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

/**
 * The flattened, indexed parse of one sentence.  Created fresh for each
 * sentence; clause elision and entity resolution edit it in place.
 */
public class TokenSequence implements Iterable<Token> {
  /** First position examined by the coding stages: skips ROOT and the sentence node. */
  public static final int PARSE_START = 2;

  private List<Token> _tokens;

  public TokenSequence() {
    _tokens = new ArrayList<Token>();
  }

  public TokenSequence(List<Token> tokens) {
    _tokens = new ArrayList<Token>(tokens);
  }

  public int size() { return _tokens.size(); }
  public Token get(int i) { return _tokens.get(i); }
  public void add(Token tok) { _tokens.add(tok); }
  public Iterator<Token> iterator() { return _tokens.iterator(); }
  public List<Token> tokens() { return _tokens; }

  public List<Token> subList(int from, int to) {
    return new ArrayList<Token>(_tokens.subList(from, to));
  }

  /**
   * @return The position of the close marker matching the open at pos, or -1.
   */
  public int findClose(int pos) {
    return findClose(_tokens, pos);
  }

  public static int findClose(List<Token> tokens, int pos) {
    int depth = 0;
    for( int i = pos; i < tokens.size(); i++ ) {
      Token tok = tokens.get(i);
      if( tok.isOpen() ) depth++;
      else if( tok.isClose() ) {
        depth--;
        if( depth == 0 )
          return (tok.closes(tokens.get(pos)) ? i : -1);
      }
    }
    return -1;
  }

  /**
   * @return The first position at or after from holding an open with this label.
   */
  public int indexOfOpen(String label, int from) {
    for( int i = from; i < _tokens.size(); i++ )
      if( _tokens.get(i).isOpen(label) ) return i;
    return -1;
  }

  /**
   * Removes tokens from..to-1.
   * @return The number of removed tokens.
   */
  public int remove(int from, int to) {
    _tokens.subList(from, to).clear();
    return to - from;
  }

  /**
   * Replaces tokens from..to-1 with the given ones.
   */
  public void replace(int from, int to, List<Token> replacement) {
    _tokens.subList(from, to).clear();
    _tokens.addAll(from, replacement);
  }

  /**
   * The largest index used with a label, so new markers can be numbered after it.
   */
  public int maxIndex(String label) {
    int max = 0;
    for( Token tok : _tokens )
      if( tok.isOpen(label) && tok.index() > max ) max = tok.index();
    return max;
  }

  /**
   * Fills in the labels of pending close markers by unwinding the stack of
   * open markers.
   * @return False if a close appears with no open left on the stack.
   */
  public boolean resolveCloses() {
    LinkedList<Token> stack = new LinkedList<Token>();
    for( Token tok : _tokens ) {
      if( tok.isOpen() ) stack.push(tok);
      else if( tok.isClose() && tok.label() == null ) {
        if( stack.isEmpty() ) return false;
        tok.resolveClose(stack.pop());
      }
      else if( tok.isClose() ) {
        if( stack.isEmpty() ) return false;
        stack.pop();
      }
    }
    return true;
  }

  /**
   * Every open has exactly one matching close and nesting is well formed.
   */
  public boolean isBalanced() {
    LinkedList<Token> stack = new LinkedList<Token>();
    for( Token tok : _tokens ) {
      if( tok.isOpen() ) stack.push(tok);
      else if( tok.isClose() ) {
        if( stack.isEmpty() || !tok.closes(stack.pop()) )
          return false;
      }
    }
    return stack.isEmpty();
  }

  public String toString() {
    StringBuffer buf = new StringBuffer();
    for( Token tok : _tokens ) {
      if( buf.length() > 0 ) buf.append(' ');
      buf.append(tok);
    }
    return buf.toString();
  }
}
