package eventcoder.parse;

import java.util.LinkedList;

/**
 * Removes comma-delimited clauses whose word counts fall inside configured
 * ranges.  The initial clause (before the first comma) and the terminal
 * clause (after the last comma) are tried once; internal clauses between two
 * commas of the same phrase are tried repeatedly.  A maximum of zero turns
 * a pass off.  Only complete phrases are deleted, so the sequence stays
 * balanced.
 */
public class ClauseElision {
  private final int _minInitial, _maxInitial;
  private final int _minInternal, _maxInternal;
  private final int _minTerminal, _maxTerminal;

  public ClauseElision(int minInitial, int maxInitial,
                       int minInternal, int maxInternal,
                       int minTerminal, int maxTerminal) {
    _minInitial = minInitial;
    _maxInitial = maxInitial;
    _minInternal = minInternal;
    _maxInternal = maxInternal;
    _minTerminal = minTerminal;
    _maxTerminal = maxTerminal;
  }

  /**
   * @return null on success, COMMA_BALANCE if the edited sequence is no
   *         longer balanced.
   */
  public SkipReason elide(TokenSequence seq) {
    if( seq.indexOfOpen(",", 0) < 0 )
      return null;

    if( _maxInitial != 0 ) {
      int kcomma = seq.indexOfOpen(",", 0);
      int count = countWords(seq, TokenSequence.PARSE_START, kcomma);
      // the comma stays so an internal pass can still pair it
      if( count >= _minInitial && count <= _maxInitial )
        deletePhrases(seq, TokenSequence.PARSE_START, kcomma);
    }

    if( _maxTerminal != 0 ) {
      int kend = findEnd(seq);
      int ka = lastCommaBefore(seq, kend);
      if( ka >= 0 ) {
        int count = countWords(seq, ka, seq.size());
        if( count >= _minTerminal && count <= _maxTerminal )
          deletePhrases(seq, ka + 3, kend);
      }
    }

    if( _maxInternal != 0 ) {
      int ka = seq.indexOfOpen(",", 0);
      while( ka >= 0 ) {
        int kb = pairedComma(seq, ka);
        if( kb < 0 ) {
          ka = seq.indexOfOpen(",", ka + 1);
          continue;
        }
        int count = countWords(seq, ka + 2, kb);
        if( count >= _minInternal && count <= _maxInternal )
          kb -= deletePhrases(seq, ka, kb);
        ka = kb;
      }
    }

    // dangling initial and terminal commas
    int ka = seq.indexOfOpen(",", 0);
    if( ka >= 0 && countWords(seq, TokenSequence.PARSE_START, ka) == 0 )
      seq.remove(ka, ka + 3);

    int kend = findEnd(seq);
    ka = lastCommaBefore(seq, kend);
    if( ka >= 0 && countWords(seq, ka + 1, kend) == 0 )
      seq.remove(ka, ka + 3);

    if( !seq.isBalanced() )
      return SkipReason.COMMA_BALANCE;
    return null;
  }

  /**
   * Words in lo..hi-1: tokens starting with a letter.  Entity code slots do
   * not count.
   */
  static int countWords(TokenSequence seq, int lo, int hi) {
    int count = 0;
    for( int i = Math.max(lo, 0); i < hi && i < seq.size(); i++ ) {
      Token tok = seq.get(i);
      if( tok.isWord() && tok.text().length() > 0 && Character.isLetter(tok.text().charAt(0)) )
        count++;
    }
    return count;
  }

  /**
   * @return The position of the open marker on the final punctuation: the
   *         last token that is not a close, less one.
   */
  static int findEnd(TokenSequence seq) {
    int ka = seq.size() - 1;
    while( ka >= 2 && seq.get(ka).isClose() )
      ka--;
    return ka - 1;
  }

  private static int lastCommaBefore(TokenSequence seq, int kend) {
    for( int ka = kend - 1; ka >= 2; ka-- )
      if( seq.get(ka).isComma() ) return ka;
    return -1;
  }

  /**
   * @return The next comma after ka inside the same phrase, or -1.
   */
  static int pairedComma(TokenSequence seq, int ka) {
    int depth = 0;
    for( int i = ka + 3; i < seq.size(); i++ ) {
      Token tok = seq.get(i);
      if( depth == 0 && tok.isComma() )
        return i;
      if( tok.isOpen() ) depth++;
      else if( tok.isClose() ) {
        depth--;
        if( depth < 0 ) return -1;
      }
    }
    return -1;
  }

  /**
   * Delete the complete phrases within lo..hi-1, walking backwards and
   * leaving any markup whose partner lies outside the range.
   * @return The number of tokens removed.
   */
  static int deletePhrases(TokenSequence seq, int lo, int hi) {
    int removed = 0;
    LinkedList<Token> stack = new LinkedList<Token>();
    for( int ka = hi - 1; ka >= lo; ka-- ) {
      Token tok = seq.get(ka);
      if( tok.isClose() )
        stack.push(tok);
      else if( tok.isOpen() && !stack.isEmpty() && stack.peek().closes(tok) ) {
        int kclose = seq.findClose(ka);
        if( kclose < 0 ) break;
        removed += seq.remove(ka, kclose + 1);
        stack.pop();
      }
    }
    return removed;
  }
}
