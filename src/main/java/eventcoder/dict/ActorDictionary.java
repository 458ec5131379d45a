package eventcoder.dict;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.stanford.nlp.util.logging.Redwood;


/**
 * Actor phrases keyed on their first word, longest phrase first.
 *
 * File format:
 *   PHRASE [CODE]        primary phrase; the code may be left out
 *   +PHRASE              synonym of the current primary
 *   \t[CODE &lt;YYMMDD]     code before a date (inclusive)
 *   \t[CODE &gt;YYMMDD]     code after a date (inclusive)
 *   \t[CODE D1-D2]       code within an interval (inclusive)
 *   \t[CODE]             unconditional code
 *   ---STOP---           end of the file
 */
public class ActorDictionary {
  private static final Redwood.RedwoodChannels log = Redwood.channels(ActorDictionary.class);

  private final Map<String,List<PhrasePattern<ActorCodes>>> _phrases =
    new HashMap<String,List<PhrasePattern<ActorCodes>>>();
  private int _numActors = 0;

  public ActorDictionary() { }

  public static ActorDictionary fromFiles(List<File> files) throws IOException {
    ActorDictionary dict = new ActorDictionary();
    for( File file : files ) {
      DictionaryReader in = DictionaryReader.open(file);
      try {
        dict.read(in);
      } finally {
        in.close();
      }
    }
    return dict;
  }

  public static ActorDictionary fromReader(Reader reader, String name) throws IOException {
    ActorDictionary dict = new ActorDictionary();
    dict.read(new DictionaryReader(reader, name));
    return dict;
  }

  /**
   * @return The phrases starting with this word, longest first, or an empty list.
   */
  public List<PhrasePattern<ActorCodes>> phrases(String word) {
    List<PhrasePattern<ActorCodes>> list = _phrases.get(word);
    if( list == null ) return Collections.emptyList();
    return list;
  }

  public int numActors() { return _numActors; }

  /**
   * Add the actors of one file.  Several files can be read into the same table.
   */
  public void read(DictionaryReader in) throws IOException {
    log.info("Reading actors " + in.name());
    ActorCodes current = null;

    String line = in.readLine();
    while( line != null ) {
      if( line.indexOf("---STOP---") >= 0 )
        break;

      if( line.startsWith("\t") ) {
        if( current == null )
          log.warn(in.where() + " date restriction before any actor; skipped");
        else
          readRestriction(line, current, in);
      }
      else {
        String phrase;
        String trimmed = line.trim();
        if( trimmed.startsWith("+") ) {
          phrase = beforeComment(trimmed.substring(1));
          if( current == null ) {
            log.warn(in.where() + " synonym before any actor; skipped");
            line = in.readLine();
            continue;
          }
        }
        else {
          int bracket = line.indexOf('[');
          if( bracket >= 0 ) {
            phrase = line.substring(0, bracket).trim();
            current = new ActorCodes(phrase);
            int end = line.indexOf(']', bracket);
            String code = (end < 0 ? line.substring(bracket + 1) : line.substring(bracket + 1, end)).trim();
            if( code.length() > 0 ) current.addDefault(code);
          } else {
            phrase = beforeComment(trimmed);
            current = new ActorCodes(phrase);
          }
          _numActors++;
        }
        addPhrase(phrase, current, in);
      }
      line = in.readLine();
    }

    for( List<PhrasePattern<ActorCodes>> list : _phrases.values() )
      sortByLength(list);
  }

  private void addPhrase(String phrase, ActorCodes codes, DictionaryReader in) {
    PhrasePattern<ActorCodes> pattern = PhrasePattern.parse(phrase, codes);
    if( pattern == null ) {
      log.warn(in.where() + " empty actor phrase; skipped");
      return;
    }
    List<PhrasePattern<ActorCodes>> list = _phrases.get(pattern.key());
    if( list == null ) {
      list = new ArrayList<PhrasePattern<ActorCodes>>();
      _phrases.put(pattern.key(), list);
    }
    list.add(pattern);
  }

  private void readRestriction(String line, ActorCodes codes, DictionaryReader in) {
    int bracket = line.indexOf('[');
    if( bracket < 0 ) {
      log.warn(in.where() + " date restriction without [ ]; line skipped");
      return;
    }
    String inner = line.substring(bracket + 1).trim();
    int space = inner.indexOf(' ');
    String code = (space < 0 ? inner : inner.substring(0, space)).trim();
    String rest = (space < 0 ? "" : inner.substring(space + 1)).trim();
    if( rest.endsWith("]") ) rest = rest.substring(0, rest.length() - 1).trim();

    try {
      if( rest.indexOf('<') >= 0 || rest.indexOf('>') >= 0 ) {
        int date = OrdinalDate.parse(digits(rest));
        if( rest.charAt(0) == '<' ) codes.addBefore(date, code);
        else codes.addAfter(date, code);
      }
      else if( rest.indexOf('-') >= 0 ) {
        int dash = rest.indexOf('-');
        int from = OrdinalDate.parse(rest.substring(0, dash).trim());
        int to = OrdinalDate.parse(rest.substring(dash + 1).trim());
        if( to < from ) {
          log.warn(in.where() + " interval ends before it starts; line skipped");
          return;
        }
        codes.addInterval(from, to, code);
      }
      else {
        int end = code.indexOf(']');
        codes.addDefault(end < 0 ? code : code.substring(0, end).trim());
      }
    } catch( DateException ex ) {
      log.warn(in.where() + " " + ex.getMessage() + " in date restriction; line skipped");
    }
  }

  /** The first run of digits in str. */
  private static String digits(String str) {
    int start = 0;
    while( start < str.length() && !Character.isDigit(str.charAt(start)) ) start++;
    int end = start;
    while( end < str.length() && Character.isDigit(str.charAt(end)) ) end++;
    return str.substring(start, end);
  }

  private static String beforeComment(String str) {
    int semi = str.indexOf(';');
    return (semi < 0 ? str : str.substring(0, semi)).trim();
  }

  /**
   * Longest phrase first; phrases of equal length keep their file order.
   */
  static <T> void sortByLength(List<PhrasePattern<T>> list) {
    Collections.sort(list, new Comparator<PhrasePattern<T>>() {
      public int compare(PhrasePattern<T> a, PhrasePattern<T> b) {
        return b.length() - a.length();
      }
    });
  }
}
