package eventcoder;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import edu.stanford.nlp.stats.ClassicCounter;
import edu.stanford.nlp.stats.Counter;
import edu.stanford.nlp.stats.Counters;
import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.coding.SentenceCoder;
import eventcoder.coding.SentenceResult;
import eventcoder.dict.Dictionaries;
import eventcoder.io.EventWriter;
import eventcoder.io.Sentence;
import eventcoder.io.SentenceReader;
import eventcoder.io.Story;
import eventcoder.io.ValidationRunner;
import eventcoder.util.HandleParameters;


/**
 * Batch event coding of parsed sentence files.
 *
 * EventCoder -config coder.properties [-inputs a.xml,b.xml] [-output events.txt] [-key value ...]
 * EventCoder [-config coder.properties] -validate validation.xml
 *
 * Any other -key value pair overrides the option of the same name.
 */
public class EventCoder {
  private static final Redwood.RedwoodChannels log = Redwood.channels(EventCoder.class);

  public static final String STORIES = "stories";
  public static final String SENTENCES = "sentences coded";
  public static final String EVENTS = "events";
  public static final String SENTENCE_DISCARDS = "sentence discards";
  public static final String STORY_DISCARDS = "story discards";
  public static final String NO_EVENTS = "sentences without events";
  public static final String SKIPPED = "sentences skipped";

  private final SentenceCoder _coder;
  private final CoderConfig _config;
  private final Counter<String> _counts = new ClassicCounter<String>();
  private boolean _stopped = false;

  public EventCoder(Dictionaries dicts, CoderConfig config) {
    _config = config;
    _coder = new SentenceCoder(dicts, config);
  }

  /**
   * Code the sentences of one story in order.  A story discard drops every
   * event of the story and its sentence counts.  With stop_on_error, the
   * first sentence that fails ends the story and the batch.
   * @return The results of the sentences that were coded.
   */
  public List<SentenceResult> codeStory(Story story) {
    _counts.incrementCount(STORIES);
    Counter<String> counts = new ClassicCounter<String>();
    List<SentenceResult> results = new ArrayList<SentenceResult>();
    for( Sentence sentence : story.sentences() ) {
      SentenceResult result = _coder.code(sentence);
      if( result.isStoryDiscard() ) {
        log.info("Story " + story.id() + " discarded at " + sentence.id());
        _counts.incrementCount(STORY_DISCARDS);
        return new ArrayList<SentenceResult>();
      }
      if( result.isDiscarded() ) {
        counts.incrementCount(SENTENCE_DISCARDS);
        continue;
      }
      if( result.isSkipped() ) {
        counts.incrementCount(SKIPPED);
        if( _config.stopOnError() ) {
          log.warn("Stopping at " + sentence.id() + ": " + result.skipReason().tag());
          _stopped = true;
          break;
        }
        continue;
      }
      counts.incrementCount(SENTENCES);
      if( result.events().isEmpty() )
        counts.incrementCount(NO_EVENTS);
      else
        counts.incrementCount(EVENTS, result.events().size());
      results.add(result);
    }
    Counters.addInPlace(_counts, counts);
    return results;
  }

  /**
   * Code every story of the input files and write their events.
   */
  public void codeFiles(List<File> inputs, EventWriter writer) throws IOException {
    SentenceReader reader = new SentenceReader();
    for( File input : inputs ) {
      for( Story story : reader.read(input) ) {
        List<SentenceResult> results = codeStory(story);
        for( SentenceResult result : results )
          writer.write(find(story, result.sentenceId()), result);
        if( _stopped ) return;
      }
    }
  }

  private static Sentence find(Story story, String id) {
    for( Sentence sentence : story.sentences() )
      if( sentence.id().equals(id) ) return sentence;
    throw new IllegalStateException("No sentence " + id + " in story " + story.id());
  }

  public boolean stopped() { return _stopped; }
  public Counter<String> counts() { return _counts; }

  public void printSummary(PrintStream out) {
    out.println("Summary:");
    String[] keys = { STORIES, SENTENCES, EVENTS, SENTENCE_DISCARDS, STORY_DISCARDS, NO_EVENTS, SKIPPED };
    for( String key : keys )
      out.println("  " + key + ": " + (int)_counts.getCount(key));
  }

  private static CoderConfig readConfig(HandleParameters params) throws IOException {
    CoderConfig config;
    if( params.hasFlag("-config") )
      config = CoderConfig.fromFile(new File(params.get("-config")));
    else config = CoderConfig.defaults();

    Properties overrides = new Properties();
    overrides.putAll(params.properties());
    overrides.remove("config");
    overrides.remove("validate");
    if( overrides.containsKey("inputs") )
      overrides.put(CoderConfig.TEXT_FILES, overrides.remove("inputs"));
    if( overrides.containsKey("output") )
      overrides.put(CoderConfig.EVENT_FILE, overrides.remove("output"));
    config.apply(overrides);
    return config;
  }

  public static void main(String[] args) {
    HandleParameters params = new HandleParameters(args);
    if( !params.hasFlag("-config") && !params.hasFlag("-validate") ) {
      System.out.println("EventCoder -config <properties> [-inputs <files>] [-output <file>]");
      System.out.println("EventCoder [-config <properties>] -validate <validation-xml>");
      System.exit(1);
    }

    CoderConfig config = null;
    try {
      config = readConfig(params);
    } catch( IOException ex ) {
      System.err.println("Could not read the configuration: " + ex.getMessage());
      System.exit(1);
    } catch( IllegalArgumentException ex ) {
      System.err.println("Bad configuration: " + ex.getMessage());
      System.exit(1);
    }

    if( params.hasFlag("-validate") ) {
      try {
        ValidationRunner runner = new ValidationRunner(config, System.in, System.out);
        runner.run(new File(params.get("-validate")));
      } catch( IOException ex ) {
        System.err.println("Validation failed: " + ex.getMessage());
        System.exit(1);
      }
      return;
    }

    Dictionaries dicts = null;
    try {
      dicts = Dictionaries.load(config);
    } catch( IOException ex ) {
      System.err.println("Could not load the dictionaries: " + ex.getMessage());
      System.exit(1);
    }
    if( config.textFiles().isEmpty() ) {
      System.err.println("No input files (" + CoderConfig.TEXT_FILES + ")");
      System.exit(1);
    }

    List<File> inputs = new ArrayList<File>();
    for( String name : config.textFiles() )
      inputs.add(new File(name));

    EventCoder coder = new EventCoder(dicts, config);
    try {
      EventWriter writer = EventWriter.open(config.eventFile());
      try {
        coder.codeFiles(inputs, writer);
      } finally {
        writer.close();
      }
      System.out.println("Wrote " + writer.numWritten() + " events to " + config.eventFile());
    } catch( IOException ex ) {
      System.err.println("Coding failed: " + ex.getMessage());
      System.exit(1);
    }
    coder.printSummary(System.out);
  }
}
