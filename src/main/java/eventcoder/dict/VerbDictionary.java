package eventcoder.dict;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.stanford.nlp.util.logging.Redwood;


/**
 * The verb pattern table.  Maps every known verb form to an entry; the
 * primary entry of a block holds the default code and the patterns.
 *
 * File format, by line:
 *   --- NAME [CODE]            start of a block, CODE is the block default
 *   VERB [CODE] {FORM FORM}    a verb; the first after a header is primary
 *   +CARRY_OUT [CODE]          a multi-word verb, + marks the verb word
 *   - UPPER * LOWER [CODE]     a pattern of the current block
 *   &NAME                      a synset, followed by +MEMBER lines
 */
public class VerbDictionary {
  private static final Redwood.RedwoodChannels log = Redwood.channels(VerbDictionary.class);

  private final Map<String,VerbEntry> _entries = new HashMap<String,VerbEntry>();
  private final Map<String,Synset> _synsets = new HashMap<String,Synset>();

  // loader state
  private String _blockCode = "---";
  private boolean _newBlock = true;
  private VerbEntry _current = null;
  private int _patternCount = 0;


  public VerbDictionary() { }

  public static VerbDictionary fromFile(File file) throws IOException {
    VerbDictionary dict = new VerbDictionary();
    DictionaryReader in = DictionaryReader.open(file);
    try {
      dict.read(in);
    } finally {
      in.close();
    }
    return dict;
  }

  public static VerbDictionary fromReader(Reader reader, String name) throws IOException {
    VerbDictionary dict = new VerbDictionary();
    dict.read(new DictionaryReader(reader, name));
    return dict;
  }

  public VerbEntry get(String word) {
    return _entries.get(word);
  }

  /**
   * @return The primary entry with this key, or null.
   */
  public VerbEntry primary(String key) {
    VerbEntry entry = _entries.get(key);
    return (entry != null && entry.isPrimary() ? entry : null);
  }

  public Synset synset(String name) {
    return _synsets.get(name);
  }

  public int size() { return _entries.size(); }
  public int numPatterns() { return _patternCount; }

  public void read(DictionaryReader in) throws IOException {
    log.info("Reading verbs " + in.name());
    String line = in.readLine();
    while( line != null ) {
      String verb;
      String code = "";
      int bracket = line.indexOf('[');
      if( bracket >= 0 ) {
        verb = line.substring(0, bracket).trim();
        int end = line.indexOf(']', bracket);
        code = (end < 0 ? line.substring(bracket + 1) : line.substring(bracket + 1, end)).trim();
      }
      else verb = line.trim();

      if( verb.startsWith("---") ) {
        _blockCode = (code.length() > 0 ? code : "---");
        _newBlock = true;
        line = in.readLine();
      }
      else if( verb.startsWith("-") ) {
        readPattern(verb, code, in);
        line = in.readLine();
      }
      else if( verb.startsWith("&") ) {
        line = readSynset(verb, in);
      }
      else {
        readVerb(verb, (code.length() > 0 ? code : _blockCode), in);
        line = in.readLine();
      }
    }
  }

  private void readVerb(String verb, String code, DictionaryReader in) {
    boolean primaryLine = false;
    String root = (verb.indexOf('{') >= 0 ? verb.substring(0, verb.indexOf('{')).trim() : verb);
    if( root.length() == 0 ) {
      log.warn(in.where() + " verb line without a verb; skipped");
      return;
    }
    if( _newBlock || _current == null ) {
      String key = root.replace("+", "");
      VerbEntry existing = _entries.get(key);
      VerbEntry primary = VerbEntry.primary(key, code);
      if( existing != null ) {
        for( MultiWordVerb multi : existing.multiWords() )
          primary.addMultiWord(multi);
        if( existing.isPrimary() ) {
          for( VerbPattern pattern : existing.patterns() )
            primary.addPattern(pattern);
        }
      }
      _entries.put(key, primary);
      _current = primary;
      _newBlock = false;
      primaryLine = true;
    }

    if( verb.indexOf('_') >= 0 ) {
      storeMultiWord(verb, code, in);
      return;
    }

    List<String> forms;
    if( verb.indexOf('{') >= 0 ) {
      int end = verb.indexOf('}');
      if( end < 0 ) {
        log.warn(in.where() + " missing '}' in verb forms; forms skipped");
        forms = new ArrayList<String>();
      }
      else {
        forms = new ArrayList<String>();
        for( String form : verb.substring(verb.indexOf('{') + 1, end).trim().split("\\s+") )
          if( form.length() > 0 ) forms.add(form);
      }
    }
    else forms = WordForms.regularVerbForms(root);

    if( !primaryLine ) forms.add(0, root);
    for( String form : forms )
      register(VerbEntry.redirect(form, code, _current.key()), in);
  }

  /**
   * Add a redirect.  A primary entry is never replaced; continuations already
   * stored on a replaced redirect are kept.
   */
  private void register(VerbEntry redirect, DictionaryReader in) {
    VerbEntry existing = _entries.get(redirect.key());
    if( existing != null ) {
      if( existing.isPrimary() ) {
        if( !existing.key().equals(redirect.target()) )
          log.warn(in.where() + " " + redirect.key() + " is already a primary verb; form ignored");
        return;
      }
      for( MultiWordVerb multi : existing.multiWords() )
        redirect.addMultiWord(multi);
    }
    _entries.put(redirect.key(), redirect);
  }

  /**
   * Each form of a multi-word verb adds a continuation to the entry of its
   * verb word, which is created with a null code if needed.
   */
  private void storeMultiWord(String verb, String code, DictionaryReader in) {
    List<String> phrases = new ArrayList<String>();
    int brace = verb.indexOf('{');
    if( brace >= 0 ) {
      int end = verb.indexOf('}');
      String inner = (end < 0 ? verb.substring(brace + 1) : verb.substring(brace + 1, end));
      for( String form : inner.trim().split("\\s+") )
        if( form.length() > 0 ) phrases.add(form);
      phrases.add(verb.substring(0, brace).trim());
    }
    else phrases.add(verb);

    for( String phrase : phrases ) {
      if( phrase.indexOf('+') < 0 ) {
        log.warn(in.where() + " multi-word verb " + phrase + " has no +VERB; skipped");
        continue;
      }
      String[] words = phrase.split("_");
      boolean after;
      String verbWord;
      List<String> others = new ArrayList<String>();
      if( words[0].startsWith("+") ) {
        after = true;
        verbWord = words[0].substring(1);
        for( int i = 1; i < words.length; i++ )
          others.add(words[i]);
      }
      else if( words[words.length - 1].startsWith("+") ) {
        after = false;
        verbWord = words[words.length - 1].substring(1);
        for( int i = words.length - 2; i >= 0; i-- )
          others.add(words[i]);
      }
      else {
        log.warn(in.where() + " + must mark the first or last word of " + phrase + "; skipped");
        continue;
      }

      VerbEntry entry = _entries.get(verbWord);
      if( entry == null ) {
        entry = VerbEntry.primary(verbWord, "---");
        _entries.put(verbWord, entry);
      }
      entry.addMultiWord(new MultiWordVerb(after, others, _current.key(), code));
    }
  }

  private String readSynset(String verb, DictionaryReader in) throws IOException {
    boolean noPlural = verb.endsWith("_");
    String name = (noPlural ? verb.substring(0, verb.length() - 1) : verb);
    Synset synset = new Synset(name);
    _synsets.put(name, synset);

    String line = in.readLine();
    while( line != null && line.trim().startsWith("+") ) {
      String word = line.trim().substring(1).trim();
      if( noPlural || word.endsWith("_") )
        synset.add(word.replace('_', ' ').trim());
      else {
        word = word.replace('_', ' ');
        synset.add(word);
        synset.add(WordForms.plural(word));
      }
      line = in.readLine();
    }
    if( synset.size() == 0 )
      log.warn(in.where() + " synset " + name + " has no members");
    return line;
  }

  private void readPattern(String verb, String code, DictionaryReader in) {
    if( verb.indexOf('{') >= 0 ) return;   // legacy form
    if( _current == null ) {
      log.warn(in.where() + " pattern outside of a verb block; skipped");
      return;
    }
    String body = (verb + " ").replace("_ ", " ").substring(1);
    String upperText = body;
    String lowerText = "";
    int star = body.indexOf('*');
    if( star >= 0 ) {
      upperText = body.substring(0, star);
      lowerText = body.substring(star + 1);
    }

    try {
      List<PatternAtom> upper = upperAtoms(ltrim(upperText));
      List<PatternAtom> lower = lowerAtoms(rtrim(lowerText));
      _current.addPattern(new VerbPattern(upper, lower, (code.length() > 0 ? code : "---"), verb));
      _patternCount++;
    } catch( UndefinedSynsetException ex ) {
      log.warn(in.where() + " synset " + ex.getMessage() + " has not been defined; pattern skipped");
    }
  }

  /**
   * Upper text is stored reversed so it reads outward from the verb.  Each
   * atom takes the connector that follows it in the text.
   */
  private List<PatternAtom> upperAtoms(String text) throws UndefinedSynsetException {
    List<String[]> pairs = phraseList(text);
    List<PatternAtom> atoms = new ArrayList<PatternAtom>();
    for( int i = pairs.size() - 1; i >= 0; i-- ) {
      String[] pair = pairs.get(i);
      if( pair[0].length() > 0 )
        atoms.add(atom(pair[0], pair[1].charAt(0)));
    }
    return atoms;
  }

  /**
   * Lower text starts with its connector; each atom takes the connector that
   * precedes it.
   */
  private List<PatternAtom> lowerAtoms(String text) throws UndefinedSynsetException {
    List<PatternAtom> atoms = new ArrayList<PatternAtom>();
    if( text.length() == 0 ) return atoms;
    char connector = text.charAt(0);
    String rest = text.substring(1);
    if( connector != ' ' && connector != '_' ) {
      connector = ' ';
      rest = text;
    }
    for( String[] pair : phraseList(rest) ) {
      if( pair[0].length() > 0 )
        atoms.add(atom(pair[0], connector));
      connector = pair[1].charAt(0);
    }
    return atoms;
  }

  private PatternAtom atom(String text, char connector) throws UndefinedSynsetException {
    if( text.equals("$") ) return new PatternAtom(PatternAtom.Type.SOURCE, text, connector, null);
    if( text.equals("+") ) return new PatternAtom(PatternAtom.Type.TARGET, text, connector, null);
    if( text.equals("^") ) return new PatternAtom(PatternAtom.Type.SKIP, text, connector, null);
    if( text.equals("%") ) return new PatternAtom(PatternAtom.Type.COMPOUND, text, connector, null);
    if( text.startsWith("&") ) {
      Synset synset = _synsets.get(text);
      if( synset == null ) throw new UndefinedSynsetException(text);
      return new PatternAtom(PatternAtom.Type.SYNSET, text, connector, synset);
    }
    return new PatternAtom(PatternAtom.Type.LITERAL, text, connector, null);
  }

  /**
   * Break text at blanks and underscores into (word, connector) pairs; the
   * connector is the delimiter that ended the word.
   */
  static List<String[]> phraseList(String text) {
    List<String[]> pairs = new ArrayList<String[]>();
    int start = 0;
    while( start < text.length() ) {
      int space = text.indexOf(' ', start);
      int under = text.indexOf('_', start);
      if( space < 0 ) space = text.length();
      if( under < 0 ) under = text.length();
      if( under < space ) {
        pairs.add(new String[] { text.substring(start, under), "_" });
        start = under + 1;
      } else {
        pairs.add(new String[] { text.substring(start, space), " " });
        start = space + 1;
      }
    }
    return pairs;
  }

  private static String ltrim(String str) {
    int i = 0;
    while( i < str.length() && Character.isWhitespace(str.charAt(i)) ) i++;
    return str.substring(i);
  }

  private static String rtrim(String str) {
    int i = str.length();
    while( i > 0 && Character.isWhitespace(str.charAt(i - 1)) ) i--;
    return str.substring(0, i);
  }


  private static class UndefinedSynsetException extends Exception {
    private static final long serialVersionUID = 1L;
    UndefinedSynsetException(String name) { super(name); }
  }
}
