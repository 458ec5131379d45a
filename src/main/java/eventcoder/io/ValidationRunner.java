package eventcoder.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.jdom.Document;
import org.jdom.Element;
import org.jdom.JDOMException;
import org.jdom.input.SAXBuilder;

import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.CoderConfig;
import eventcoder.coding.CodedEvent;
import eventcoder.coding.SentenceCoder;
import eventcoder.coding.SentenceResult;
import eventcoder.dict.Dictionaries;
import eventcoder.dict.DiscardList;
import eventcoder.parse.SkipReason;


/**
 * Codes the records of a validation file and compares the events with the
 * expected ones.
 *
 * <pre>
 * &lt;Validation&gt;
 *   &lt;Environment&gt;
 *     &lt;Verbfile&gt;verbs.txt&lt;/Verbfile&gt;  &lt;Actorfile&gt;actors.txt&lt;/Actorfile&gt;
 *     &lt;Agentfile&gt;agents.txt&lt;/Agentfile&gt;  &lt;Discardfile&gt;discards.txt&lt;/Discardfile&gt;
 *     &lt;Include&gt;valid DEMO&lt;/Include&gt;  &lt;Exclude&gt;&lt;/Exclude&gt;  &lt;Pause&gt;never&lt;/Pause&gt;
 *   &lt;/Environment&gt;
 *   &lt;Sentences&gt;
 *     &lt;Config option="new_actor_length" value="4"/&gt;
 *     &lt;Sentence id="DEMO-01" date="20020101" category="DEMO" valid="true"&gt;
 *       &lt;EventCoding sourcecode="FRA" targetcode="GMY" eventcode="190"/&gt;
 *       &lt;Text&gt;...&lt;/Text&gt; &lt;Parse&gt;...&lt;/Parse&gt;
 *     &lt;/Sentence&gt;
 *     &lt;Stop/&gt;
 *   &lt;/Sentences&gt;
 * &lt;/Validation&gt;
 * </pre>
 *
 * An EventCoding may instead say noevents="true" or error="tag", where the
 * tag is a skip reason, sentencediscard or storydiscard.  Dictionary files
 * are found next to the validation file.
 */
public class ValidationRunner {
  private static final Redwood.RedwoodChannels log = Redwood.channels(ValidationRunner.class);

  public static final String SENTENCE_DISCARD = "sentencediscard";
  public static final String STORY_DISCARD = "storydiscard";

  public enum Pause { NEVER, ERROR, ALWAYS, STOP }

  private final CoderConfig _config;
  private final BufferedReader _console;
  private final PrintStream _out;

  private Pause _pause = Pause.NEVER;
  private List<String> _include = new ArrayList<String>();
  private List<String> _exclude = new ArrayList<String>();
  private boolean _validOnly = false;

  private int _correct = 0;
  private int _evaluated = 0;
  private int _skipped = 0;

  /**
   * @param console Read when the pause mode asks to wait; may be null.
   * @param out Where the report goes.
   */
  public ValidationRunner(CoderConfig config, InputStream console, PrintStream out) {
    _config = config;
    _console = (console == null ? null : new BufferedReader(new InputStreamReader(console)));
    _out = out;
  }

  /**
   * @return The number of records coded correctly.
   */
  public int run(File file) throws IOException {
    Document doc;
    try {
      doc = new SAXBuilder().build(file);
    } catch( JDOMException ex ) {
      throw new IOException("Malformed validation file " + file.getPath() + ": " + ex.getMessage(), ex);
    }
    Element root = doc.getRootElement();
    Element env = root.getChild("Environment");
    if( env == null )
      throw new IOException("Missing <Environment> block in " + file.getPath());

    File dir = file.getAbsoluteFile().getParentFile();
    readEnvironment(env, dir);
    Dictionaries dicts = Dictionaries.load(_config);
    SentenceCoder coder = new SentenceCoder(dicts, _config);

    Element sentences = root.getChild("Sentences");
    if( sentences == null ) {
      log.warn("No <Sentences> block in " + file.getPath());
      return 0;
    }

    for( Object obj : sentences.getChildren() ) {
      Element elem = (Element)obj;
      if( elem.getName().equals("Config") )
        changeOption(elem);
      else if( elem.getName().equals("Stop") ) {
        _out.println("Exiting: <Stop> record");
        break;
      }
      else if( elem.getName().equals("Sentence") ) {
        Sentence sentence = SentenceReader.toSentence(elem);
        if( skip(sentence, elem) ) {
          _skipped++;
          continue;
        }
        _evaluated++;
        boolean ok = evaluate(elem, sentence, coder);
        if( ok ) {
          _out.println("Events correctly coded in " + sentence.id());
          _correct++;
        }
        else {
          _out.println("Error: mismatched events in " + sentence.id());
          if( _pause == Pause.STOP ) break;
        }
        if( _pause == Pause.ALWAYS || (_pause == Pause.ERROR && !ok) ) {
          if( !waitForUser() ) break;
        }
      }
    }
    _out.println("Records coded correctly: " + _correct + " of " + _evaluated
                 + " (" + _skipped + " skipped)");
    return _correct;
  }

  private void readEnvironment(Element env, File dir) throws FileNotFoundException {
    _config.set(CoderConfig.DICTIONARY_DIR, dir.getPath());
    _config.set(CoderConfig.VERB_FILE, childText(env, "Verbfile"));
    _config.set(CoderConfig.ACTOR_FILES, childText(env, "Actorfile"));
    _config.set(CoderConfig.AGENT_FILE, childText(env, "Agentfile"));
    _config.set(CoderConfig.DISCARD_FILE, childText(env, "Discardfile"));
    _config.set(CoderConfig.ISSUE_FILE, childText(env, "Issuefile"));
    if( _config.verbFile().length() == 0 || _config.actorFiles().isEmpty() || _config.agentFile().length() == 0 )
      throw new FileNotFoundException("Missing <Verbfile>, <Actorfile> or <Agentfile> in <Environment>");

    String include = childText(env, "Include");
    if( include.length() > 0 ) {
      _include = new ArrayList<String>(Arrays.asList(include.split("\\s+")));
      if( _include.remove("valid") ) _validOnly = true;
    }
    String exclude = childText(env, "Exclude");
    if( exclude.length() > 0 )
      _exclude = Arrays.asList(exclude.split("\\s+"));
    _pause = pauseMode(childText(env, "Pause"));
  }

  static Pause pauseMode(String text) {
    String str = text.toLowerCase();
    if( str.length() == 0 || str.indexOf("never") >= 0 ) return Pause.NEVER;
    if( str.indexOf("always") >= 0 ) return Pause.ALWAYS;
    if( str.indexOf("stop") >= 0 ) return Pause.STOP;
    return Pause.ERROR;
  }

  private static String childText(Element elem, String name) {
    String text = elem.getChildTextTrim(name);
    return (text == null ? "" : text);
  }

  private void changeOption(Element elem) {
    String option = elem.getAttributeValue("option");
    String value = elem.getAttributeValue("value");
    _out.println("<Config>: changing " + option + " to " + value);
    if( option == null || value == null ) {
      log.warn("<Config> needs option and value; ignored");
      return;
    }
    try {
      _config.set(option, value);
    } catch( IllegalArgumentException ex ) {
      log.warn("<Config>: " + ex.getMessage() + "; ignored");
    }
  }

  private boolean skip(Sentence sentence, Element elem) {
    if( _validOnly && !sentence.isValid() ) return true;
    if( !_include.isEmpty() && !_include.contains(sentence.category()) ) return true;
    if( _exclude.contains(sentence.category()) ) return true;
    return elem.getChild("Skip") != null;
  }

  /**
   * Code one record and compare it with its expectations.
   */
  boolean evaluate(Element elem, Sentence sentence, SentenceCoder coder) {
    List<String[]> expected = new ArrayList<String[]>();
    String expectedError = "";
    for( Object obj : elem.getChildren("EventCoding") ) {
      Element coding = (Element)obj;
      if( coding.getAttributeValue("noevents") != null ) {
        expected.clear();
        break;
      }
      if( coding.getAttributeValue("error") != null ) {
        expected.clear();
        expectedError = coding.getAttributeValue("error").trim();
        if( expectedError.indexOf("discard") < 0 && SkipReason.fromTag(expectedError) == null )
          log.warn(sentence.id() + ": unknown error tag \"" + expectedError + "\"");
        break;
      }
      expected.add(new String[] { attr(coding, "sourcecode"), attr(coding, "targetcode"), attr(coding, "eventcode") });
    }

    _out.println();
    _out.println("Sentence: " + sentence.id() + " [" + sentence.category() + "]");
    _out.println(sentence.text());
    SentenceResult result = coder.code(sentence);

    if( result.isDiscarded() ) {
      String tag = (result.discard().kind == DiscardList.Kind.STORY ? STORY_DISCARD : SENTENCE_DISCARD);
      if( !tag.equals(expectedError) ) {
        _out.println(result.discard().phrase + " did not trigger \"" + expectedError + "\" but " + tag);
        return false;
      }
      return true;
    }
    if( expectedError.indexOf("discard") >= 0 ) {
      _out.println("\"" + expectedError + "\" was not triggered in " + sentence.id());
      return false;
    }
    if( result.isSkipped() ) {
      if( result.skipReason().tag().equals(expectedError) ) return true;
      _out.println("Record triggered the error \"" + result.skipReason().tag() + "\"");
      return false;
    }
    if( expectedError.length() > 0 ) {
      _out.println(sentence.id() + " did not trigger the error \"" + expectedError + "\"");
      return false;
    }
    return compare(expected, result.events());
  }

  /**
   * Every coded event must pair with a distinct expected one and the other
   * way around.
   */
  boolean compare(List<String[]> expected, List<CodedEvent> coded) {
    if( !expected.isEmpty() ) {
      _out.println("Expected events:");
      for( String[] ev : expected )
        _out.println("\t" + ev[0] + "\t" + ev[1] + "\t" + ev[2]);
    }
    if( !coded.isEmpty() ) {
      _out.println("Coded events:");
      for( CodedEvent ev : coded )
        _out.println("\t" + ev);
    }

    boolean allOk = true;
    boolean[] used = new boolean[expected.size()];
    for( CodedEvent ev : coded ) {
      boolean found = false;
      for( int i = 0; i < expected.size() && !found; i++ ) {
        String[] exp = expected.get(i);
        if( !used[i] && ev.sameTriple(exp[0], exp[1], exp[2]) ) {
          used[i] = true;
          found = true;
        }
      }
      if( !found ) {
        _out.println("No match for the coded event: " + ev);
        allOk = false;
      }
    }
    for( int i = 0; i < expected.size(); i++ ) {
      if( !used[i] ) {
        String[] exp = expected.get(i);
        _out.println("No match for the expected event: " + exp[0] + "\t" + exp[1] + "\t" + exp[2]);
        allOk = false;
      }
    }
    return allOk;
  }

  private static String attr(Element elem, String name) {
    String value = elem.getAttributeValue(name);
    return (value == null ? "" : value.trim());
  }

  /**
   * @return False if the user asked to quit.
   */
  private boolean waitForUser() {
    if( _console == null ) return true;
    _out.print("Press <Return> to continue; 'q' to quit--> ");
    _out.flush();
    try {
      String line = _console.readLine();
      return line != null && line.toLowerCase().indexOf('q') < 0;
    } catch( IOException ex ) {
      log.warn("Could not read the console: " + ex.getMessage());
      return false;
    }
  }

  public Pause pause() { return _pause; }
  public int numCorrect() { return _correct; }
  public int numEvaluated() { return _evaluated; }
  public int numSkipped() { return _skipped; }
}
