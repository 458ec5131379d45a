package eventcoder;

import java.io.File;
import java.util.Properties;

import junit.framework.TestCase;

public class CoderConfigTest extends TestCase {

  public void testDefaultsResource() {
    CoderConfig config = CoderConfig.defaults();
    assertEquals("data/dictionaries", config.dictionaryDir());
    assertEquals("events.txt", config.eventFile());
    assertEquals(0, config.newActorLength());
    assertTrue(config.requireDyad());
    assertFalse(config.stopOnError());
  }

  public void testProperties() {
    Properties props = new Properties();
    props.setProperty(CoderConfig.ACTOR_FILES, "countries.txt, leaders.txt,");
    props.setProperty(CoderConfig.REQUIRE_DYAD, " False ");
    props.setProperty(CoderConfig.NEW_ACTOR_LENGTH, "4");
    props.setProperty("unrelated_key", "ignored");
    CoderConfig config = CoderConfig.fromProperties(props);
    assertEquals(2, config.actorFiles().size());
    assertEquals("leaders.txt", config.actorFiles().get(1));
    assertFalse(config.requireDyad());
    assertEquals(4, config.newActorLength());
  }

  public void testUnknownCommaKeyIgnoredInProperties() {
    Properties props = new Properties();
    props.setProperty("comma_foo", "3");
    props.setProperty("comma_bmax", "5");
    CoderConfig config = CoderConfig.fromProperties(props);
    assertTrue(config.toString(), config.toString().contains("comma=0-5/2-8/0-0"));
    try {
      config.set("comma_foo", "3");
      fail("Expected an IllegalArgumentException");
    } catch( IllegalArgumentException ex ) {
      assertTrue(ex.getMessage().contains("comma_foo"));
    }
  }

  public void testBadValues() {
    CoderConfig config = new CoderConfig();
    try {
      config.set("no_such_option", "1");
      fail("Expected an IllegalArgumentException");
    } catch( IllegalArgumentException ex ) {
      assertTrue(ex.getMessage().contains("no_such_option"));
    }
    try {
      config.set(CoderConfig.NEW_ACTOR_LENGTH, "four");
      fail("Expected an IllegalArgumentException");
    } catch( IllegalArgumentException ex ) {
      assertTrue(ex.getMessage().contains(CoderConfig.NEW_ACTOR_LENGTH));
    }
    try {
      config.set(CoderConfig.STOP_ON_ERROR, "yes");
      fail("Expected an IllegalArgumentException");
    } catch( IllegalArgumentException ex ) {
      assertTrue(ex.getMessage().contains(CoderConfig.STOP_ON_ERROR));
    }
  }

  public void testDictionaryFile() {
    CoderConfig config = new CoderConfig();
    config.set(CoderConfig.DICTIONARY_DIR, "dicts");
    assertEquals(new File("dicts", "verbs.txt"), config.dictionaryFile("verbs.txt"));
    File absolute = new File("verbs.txt").getAbsoluteFile();
    assertEquals(absolute, config.dictionaryFile(absolute.getPath()));
    config.set(CoderConfig.DICTIONARY_DIR, "");
    assertEquals(new File("verbs.txt"), config.dictionaryFile("verbs.txt"));
  }
}
