package eventcoder;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;

import eventcoder.coding.SentenceCoder;
import eventcoder.coding.SentenceResult;
import eventcoder.dict.Dictionaries;
import eventcoder.io.Sentence;


/**
 * The dictionaries and sentence files under src/test/resources/eventcoder.
 */
public class Fixtures {
  public static final String DATE = "20020115";

  public static File file(String name) {
    URL url = Fixtures.class.getResource("/eventcoder/" + name);
    if( url == null )
      throw new IllegalStateException("Missing test resource " + name);
    try {
      return new File(url.toURI());
    } catch( URISyntaxException ex ) {
      throw new IllegalStateException(ex);
    }
  }

  /**
   * Built in defaults pointed at the test dictionaries.
   */
  public static CoderConfig config() {
    CoderConfig config = new CoderConfig();
    config.set(CoderConfig.DICTIONARY_DIR, file("verbs.txt").getParent());
    config.set(CoderConfig.VERB_FILE, "verbs.txt");
    config.set(CoderConfig.ACTOR_FILES, "actors.txt");
    config.set(CoderConfig.AGENT_FILE, "agents.txt");
    config.set(CoderConfig.DISCARD_FILE, "discards.txt");
    config.set(CoderConfig.ISSUE_FILE, "issues.txt");
    return config;
  }

  public static Dictionaries dictionaries() throws IOException {
    return Dictionaries.load(config());
  }

  public static SentenceCoder coder(CoderConfig config) throws IOException {
    return new SentenceCoder(Dictionaries.load(config), config);
  }

  public static SentenceResult code(SentenceCoder coder, String text, String parse) {
    return coder.code(new Sentence("TEST-1_1", DATE, text, parse));
  }
}
