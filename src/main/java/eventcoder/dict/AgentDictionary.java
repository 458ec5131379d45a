package eventcoder.dict;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.stanford.nlp.util.logging.Redwood;


/**
 * Agent phrases keyed on their first word, longest phrase first.
 * Codes are written ~XXX (attach after the actor code) or XXX~ (before it).
 *
 * File format:
 *   PHRASE [CODE]            plural generated from the last word
 *   PHRASE {PLURAL} [CODE]   explicit plural; {} suppresses it
 *   !NAME! = A, B, C         substitution set
 *   WORD !NAME! [CODE]       one phrase per member of the set
 */
public class AgentDictionary {
  private static final Redwood.RedwoodChannels log = Redwood.channels(AgentDictionary.class);

  private final Map<String,List<PhrasePattern<String>>> _phrases =
    new HashMap<String,List<PhrasePattern<String>>>();
  private final Map<String,List<String>> _markers = new HashMap<String,List<String>>();

  public AgentDictionary() { }

  public static AgentDictionary fromFile(File file) throws IOException {
    AgentDictionary dict = new AgentDictionary();
    DictionaryReader in = DictionaryReader.open(file);
    try {
      dict.read(in);
    } finally {
      in.close();
    }
    return dict;
  }

  public static AgentDictionary fromReader(Reader reader, String name) throws IOException {
    AgentDictionary dict = new AgentDictionary();
    dict.read(new DictionaryReader(reader, name));
    return dict;
  }

  public List<PhrasePattern<String>> phrases(String word) {
    List<PhrasePattern<String>> list = _phrases.get(word);
    if( list == null ) return Collections.emptyList();
    return list;
  }

  public void read(DictionaryReader in) throws IOException {
    log.info("Reading agents " + in.name());
    String line = in.readLine();
    while( line != null ) {
      if( line.indexOf('!') >= 0 && line.indexOf('=') >= 0 )
        defineMarker(line, in);
      else if( line.indexOf('[') < 0 )
        log.warn(in.where() + " agents require a code; line skipped");
      else
        readAgent(line, in);
      line = in.readLine();
    }
    for( List<PhrasePattern<String>> list : _phrases.values() )
      ActorDictionary.sortByLength(list);
  }

  private void readAgent(String line, DictionaryReader in) {
    int bracket = line.indexOf('[');
    int end = line.indexOf(']', bracket);
    String code = (end < 0 ? line.substring(bracket + 1) : line.substring(bracket + 1, end)).trim();
    String agent = line.substring(0, bracket).trim();

    if( agent.indexOf('!') >= 0 ) {
      int first = agent.indexOf('!');
      int second = agent.indexOf('!', first + 1);
      if( second < 0 ) {
        log.warn(in.where() + " substitution marker syntax incorrect; line skipped");
        return;
      }
      String name = agent.substring(first + 1, second);
      List<String> members = _markers.get(name);
      if( members == null ) {
        log.warn(in.where() + " substitution marker !" + name + "! is not defined; line skipped");
        return;
      }
      for( String member : members ) {
        String phrase = agent.substring(0, first) + member + agent.substring(second + 1);
        store(phrase, code);
        store(WordForms.plural(phrase.trim()), code);
      }
      return;
    }

    String plural;
    int brace = agent.indexOf('{');
    if( brace >= 0 ) {
      int close = agent.indexOf('}', brace);
      if( close < 0 ) {
        log.warn(in.where() + " missing '}'; line skipped");
        return;
      }
      plural = agent.substring(brace + 1, close).trim();
      agent = agent.substring(0, brace).trim();
    }
    else plural = WordForms.plural(agent);

    store(agent, code);
    if( plural.length() > 0 )
      store(plural, code);
  }

  private void defineMarker(String line, DictionaryReader in) {
    int first = line.indexOf('!');
    int second = line.indexOf('!', first + 1);
    int equals = line.indexOf('=', first);
    if( second < 0 || equals < 0 ) {
      log.warn(in.where() + " substitution marker incorrectly defined; line skipped");
      return;
    }
    List<String> members = new ArrayList<String>();
    for( String item : line.substring(equals + 1).split(",") )
      if( item.trim().length() > 0 ) members.add(item.trim());
    _markers.put(line.substring(first + 1, second), members);
  }

  private void store(String phrase, String code) {
    PhrasePattern<String> pattern = PhrasePattern.parse(phrase, code);
    if( pattern == null ) return;
    List<PhrasePattern<String>> list = _phrases.get(pattern.key());
    if( list == null ) {
      list = new ArrayList<PhrasePattern<String>>();
      _phrases.put(pattern.key(), list);
    }
    list.add(pattern);
  }
}
