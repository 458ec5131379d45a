package eventcoder.dict;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.util.logging.Redwood;


/**
 * Phrases that keep a sentence, or with a + prefix the whole story, from
 * being coded.  A phrase ending in _ must be followed by a blank, . ! ? or
 * the end of the text; otherwise it matches as a stem.  Matching is case
 * insensitive and the phrase must start a word.
 */
public class DiscardList {
  private static final Redwood.RedwoodChannels log = Redwood.channels(DiscardList.class);

  public enum Kind { NONE, SENTENCE, STORY }

  /** Result of a check: the kind and the phrase that matched. */
  public static class Match {
    public final Kind kind;
    public final String phrase;

    Match(Kind kind, String phrase) {
      this.kind = kind;
      this.phrase = phrase;
    }

    public String toString() { return kind + (phrase == null ? "" : ":" + phrase); }
  }

  public static final Match NO_MATCH = new Match(Kind.NONE, null);

  private final List<String> _story = new ArrayList<String>();
  private final List<String> _sentence = new ArrayList<String>();

  public DiscardList() { }

  public static DiscardList fromFile(File file) throws IOException {
    DiscardList list = new DiscardList();
    DictionaryReader in = DictionaryReader.open(file);
    try {
      list.read(in);
    } finally {
      in.close();
    }
    return list;
  }

  public static DiscardList fromReader(Reader reader, String name) throws IOException {
    DiscardList list = new DiscardList();
    list.read(new DictionaryReader(reader, name));
    return list;
  }

  public void read(DictionaryReader in) throws IOException {
    log.info("Reading discards " + in.name());
    String line = in.readLine();
    while( line != null ) {
      int hash = line.indexOf('#');
      if( hash >= 0 ) line = line.substring(0, hash);
      String phrase = line.trim().toUpperCase();
      if( phrase.startsWith("+") ) {
        phrase = phrase.substring(1).trim();
        if( phrase.length() > 0 ) _story.add(phrase);
      }
      else if( phrase.length() > 0 )
        _sentence.add(phrase);
      line = in.readLine();
    }
  }

  public int size() { return _story.size() + _sentence.size(); }

  /**
   * Story phrases are tested first, so a text holding both kinds is a story
   * discard.
   */
  public Match check(String text) {
    String sent = " " + text.toUpperCase();
    for( String phrase : _story )
      if( occurs(sent, phrase) ) return new Match(Kind.STORY, "+" + phrase);
    for( String phrase : _sentence )
      if( occurs(sent, phrase) ) return new Match(Kind.SENTENCE, phrase);
    return NO_MATCH;
  }

  private static boolean occurs(String sent, String phrase) {
    boolean exact = phrase.endsWith("_");
    String target = " " + (exact ? phrase.substring(0, phrase.length() - 1) : phrase);
    int loc = sent.indexOf(target);
    while( loc >= 0 ) {
      int after = loc + target.length();
      if( !exact || after >= sent.length() || " .!?".indexOf(sent.charAt(after)) >= 0 )
        return true;
      loc = sent.indexOf(target, loc + 1);
    }
    return false;
  }
}
