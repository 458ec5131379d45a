package eventcoder.dict;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.stats.ClassicCounter;
import edu.stanford.nlp.stats.Counter;
import edu.stanford.nlp.util.logging.Redwood;


/**
 * Issue phrases and their codes.  Lines are PHRASE [CODE]; inside a phrase
 * N:WORD adds the plural of WORD, V:WORD adds its regular verb forms and
 * A+B adds both "A B" and "A-B".  A line starting with ~ or ~~ is an ignore
 * phrase: when it occurs, the sentence gets no issues at all.
 */
public class IssueList {
  private static final Redwood.RedwoodChannels log = Redwood.channels(IssueList.class);

  private final List<String> _phrases = new ArrayList<String>();
  private final List<String> _codes = new ArrayList<String>();
  private final List<String> _ignore = new ArrayList<String>();

  public IssueList() { }

  public static IssueList fromFile(File file) throws IOException {
    IssueList list = new IssueList();
    DictionaryReader in = DictionaryReader.open(file);
    try {
      list.read(in);
    } finally {
      in.close();
    }
    return list;
  }

  public static IssueList fromReader(Reader reader, String name) throws IOException {
    IssueList list = new IssueList();
    list.read(new DictionaryReader(reader, name));
    return list;
  }

  public void read(DictionaryReader in) throws IOException {
    log.info("Reading issues " + in.name());
    String line = in.readLine();
    while( line != null ) {
      int hash = line.indexOf('#');
      if( hash >= 0 ) line = line.substring(0, hash);
      String trimmed = line.trim();

      if( trimmed.startsWith("~") ) {
        String target = (trimmed.startsWith("~~") ? trimmed.substring(2) : trimmed.substring(1));
        for( String form : expand(target.trim().toUpperCase()) )
          _ignore.add(form);
      }
      else if( trimmed.indexOf('[') < 0 ) {
        if( trimmed.length() > 0 )
          log.warn(in.where() + " issue without a code; line skipped");
      }
      else {
        int bracket = trimmed.indexOf('[');
        int end = trimmed.indexOf(']', bracket);
        String code = (end < 0 ? trimmed.substring(bracket + 1) : trimmed.substring(bracket + 1, end)).trim();
        String target = trimmed.substring(0, bracket).trim().toUpperCase();
        for( String form : expand(target) ) {
          _phrases.add(form);
          _codes.add(code);
        }
      }
      line = in.readLine();
    }
  }

  public int size() { return _phrases.size(); }

  /**
   * Expand the N:, V: and + shorthands until none is left.
   */
  static List<String> expand(String target) {
    List<String> forms = new ArrayList<String>();
    forms.add(target);
    boolean changed = true;
    while( changed ) {
      changed = false;
      for( int i = 0; i < forms.size(); i++ ) {
        String form = forms.get(i);
        int plus = form.indexOf('+');
        if( plus >= 0 ) {
          forms.set(i, form.substring(0, plus) + " " + form.substring(plus + 1));
          forms.add(i + 1, form.substring(0, plus) + "-" + form.substring(plus + 1));
          changed = true;
        }

        form = forms.get(i);
        int noun = form.indexOf("N:");
        if( noun >= 0 ) {
          String before = form.substring(0, noun);
          String[] parts = splitWord(form.substring(noun + 2));
          forms.set(i, before + parts[0] + parts[1]);
          forms.add(i + 1, before + plural(parts[0]) + parts[1]);
          changed = true;
        }

        form = forms.get(i);
        int verb = form.indexOf("V:");
        if( verb >= 0 ) {
          String before = form.substring(0, verb);
          String[] parts = splitWord(form.substring(verb + 2));
          forms.set(i, before + parts[0] + parts[1]);
          int k = i + 1;
          for( String inflected : WordForms.regularVerbForms(parts[0]) )
            forms.add(k++, before + inflected + parts[1]);
          changed = true;
        }
      }
    }
    return forms;
  }

  /**
   * Issue nouns only know two rules: Y becomes IES, anything else takes S.
   */
  static String plural(String word) {
    if( word.endsWith("Y") )
      return word.substring(0, word.length() - 1) + "IES";
    return word + "S";
  }

  /** The first word and the remainder, blank included. */
  private static String[] splitWord(String str) {
    int space = str.indexOf(' ');
    if( space < 0 ) return new String[] { str, "" };
    return new String[] { str.substring(0, space), str.substring(space) };
  }

  /**
   * @return Issue code to the number of its phrases found in the text; empty
   *         when an ignore phrase occurs.
   */
  public Counter<String> findIssues(String text) {
    Counter<String> issues = new ClassicCounter<String>();
    String sent = " " + text.toUpperCase() + " ";
    for( String phrase : _ignore )
      if( sent.indexOf(" " + phrase + " ") >= 0 ) return issues;
    for( int i = 0; i < _phrases.size(); i++ )
      if( sent.indexOf(" " + _phrases.get(i) + " ") >= 0 )
        issues.incrementCount(_codes.get(i));
    return issues;
  }
}
