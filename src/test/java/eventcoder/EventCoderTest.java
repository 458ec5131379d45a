package eventcoder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

import eventcoder.coding.SentenceResult;
import eventcoder.io.EventWriter;
import eventcoder.io.Sentence;
import eventcoder.io.Story;

public class EventCoderTest extends TestCase {
  private static final String ATTACK =
    "(ROOT (S (NP (NNP France)) (VP (VBD attacked) (NP (NNP Germany))) (. .)))";

  public void testCodeFiles() throws Exception {
    EventCoder coder = new EventCoder(Fixtures.dictionaries(), Fixtures.config());
    StringWriter out = new StringWriter();
    EventWriter writer = new EventWriter(out);
    coder.codeFiles(Arrays.asList(Fixtures.file("sentences.xml")), writer);
    writer.close();

    assertEquals(4, writer.numWritten());
    String[] lines = out.toString().split("\n");
    assertEquals("20020115\tFRA\tGMY\t190\tAFP-1_1\tAFP", lines[0]);
    assertEquals("20020115\tRUS\tGMY\t042\tAFP-1_2\tAFP", lines[1]);
    assertTrue(lines[2].startsWith("20020117\tBEL\tGMY\t190\tAFP-3_2"));

    assertEquals(3.0, coder.counts().getCount(EventCoder.STORIES), 0.0);
    assertEquals(3.0, coder.counts().getCount(EventCoder.SENTENCES), 0.0);
    assertEquals(4.0, coder.counts().getCount(EventCoder.EVENTS), 0.0);
    assertEquals(1.0, coder.counts().getCount(EventCoder.SENTENCE_DISCARDS), 0.0);
    assertEquals(1.0, coder.counts().getCount(EventCoder.STORY_DISCARDS), 0.0);
    assertEquals(0.0, coder.counts().getCount(EventCoder.SKIPPED), 0.0);
    assertFalse(coder.stopped());

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    coder.printSummary(new PrintStream(bytes, true));
    assertTrue(bytes.toString("UTF-8").contains("  events: 4"));
  }

  private static Story story() {
    Story story = new Story("TEST-1");
    story.add(new Sentence("TEST-1_1", Fixtures.DATE, "", "(ROOT (S (NP (NNP France)"));
    story.add(new Sentence("TEST-1_2", Fixtures.DATE, "", ATTACK));
    return story;
  }

  public void testSkippedSentenceCounted() throws Exception {
    EventCoder coder = new EventCoder(Fixtures.dictionaries(), Fixtures.config());
    List<SentenceResult> results = coder.codeStory(story());
    assertEquals(1, results.size());
    assertEquals("TEST-1_2", results.get(0).sentenceId());
    assertEquals(1.0, coder.counts().getCount(EventCoder.SKIPPED), 0.0);
    assertFalse(coder.stopped());
  }

  public void testStopOnError() throws Exception {
    CoderConfig config = Fixtures.config();
    config.set(CoderConfig.STOP_ON_ERROR, "true");
    EventCoder coder = new EventCoder(Fixtures.dictionaries(), config);
    List<SentenceResult> results = coder.codeStory(story());
    assertTrue(results.isEmpty());
    assertTrue(coder.stopped());
  }

  public void testMissingInputFile() throws Exception {
    EventCoder coder = new EventCoder(Fixtures.dictionaries(), Fixtures.config());
    EventWriter writer = new EventWriter(new StringWriter());
    try {
      coder.codeFiles(Arrays.asList(new File("no/such/file.xml")), writer);
      fail("Expected an IOException");
    } catch( java.io.IOException ex ) {
      // expected
    }
  }
}
