package eventcoder.dict;

import java.util.List;

/**
 * An actor or agent phrase.  words[0] is the dictionary key; connectors[i]
 * governs the gap between words[i] and words[i+1]: '_' requires the next
 * word to follow at once, ' ' allows words in between.
 */
public class PhrasePattern<T> {
  private final String[] _words;
  private final char[] _connectors;
  private final T _payload;

  public PhrasePattern(String[] words, char[] connectors, T payload) {
    _words = words;
    _connectors = connectors;
    _payload = payload;
  }

  /**
   * Parse "WORD WORD_WORD" into a pattern.
   * @return null if the phrase holds no words.
   */
  public static <T> PhrasePattern<T> parse(String phrase, T payload) {
    List<String[]> pairs = VerbDictionary.phraseList(phrase.trim());
    int n = 0;
    for( String[] pair : pairs )
      if( pair[0].length() > 0 ) n++;
    if( n == 0 ) return null;

    String[] words = new String[n];
    char[] connectors = new char[n];
    int i = 0;
    for( String[] pair : pairs ) {
      if( pair[0].length() == 0 ) continue;
      words[i] = pair[0].toUpperCase();
      connectors[i] = pair[1].charAt(0);
      i++;
    }
    return new PhrasePattern<T>(words, connectors, payload);
  }

  public String key() { return _words[0]; }
  public int length() { return _words.length; }
  public T payload() { return _payload; }

  /**
   * Match against a phrase fragment whose word at start equals the key.
   * Every word of the pattern must be found.
   */
  public boolean matches(List<String> fragment, int start) {
    if( _words.length == 1 ) return true;
    char connector = _connectors[0];
    int kfrag = start + 1;
    int kword = 1;
    while( kword < _words.length ) {
      if( kfrag >= fragment.size() )
        return false;
      if( fragment.get(kfrag).equals(_words[kword]) ) {
        connector = _connectors[kword];
        kword++;
      }
      else if( connector == '_' )
        return false;
      kfrag++;
    }
    return true;
  }

  public String toString() {
    StringBuffer buf = new StringBuffer();
    for( int i = 0; i < _words.length; i++ ) {
      buf.append(_words[i]);
      if( i < _words.length - 1 ) buf.append(_connectors[i]);
    }
    return buf.toString();
  }
}
