package eventcoder.io;

import java.io.StringReader;
import java.util.List;

import junit.framework.TestCase;

import eventcoder.Fixtures;

public class SentenceReaderTest extends TestCase {

  public void testStoriesFromFile() throws Exception {
    List<Story> stories = new SentenceReader().read(Fixtures.file("sentences.xml"));
    assertEquals(3, stories.size());
    assertEquals("AFP-1", stories.get(0).id());
    // AFP-1_3 has no parse
    assertEquals(2, stories.get(0).sentences().size());
    assertEquals(2, stories.get(1).sentences().size());

    Sentence first = stories.get(0).sentences().get(0);
    assertEquals("AFP-1_1", first.id());
    assertEquals("20020115", first.date());
    assertEquals("AFP", first.source());
    assertEquals("France attacked Germany.", first.text());
    assertTrue(first.parse().startsWith("(ROOT (S"));
  }

  public void testValidationAttributes() throws Exception {
    String xml = "<Sentences>"
      + "<Sentence id=\"VAL-01_1\" date=\"20020101\" category=\"DEMO\" valid=\"TRUE\" place=\"PARIS\">"
      + "<Text>France\n attacked Germany.</Text><Parse>(ROOT (S))</Parse></Sentence>"
      + "<Sentence id=\"VAL-02_1\"><Parse>(ROOT (S))</Parse></Sentence>"
      + "</Sentences>";
    List<Story> stories = new SentenceReader().read(new StringReader(xml));
    assertEquals(2, stories.size());

    Sentence sentence = stories.get(0).sentences().get(0);
    assertEquals("DEMO", sentence.category());
    assertTrue(sentence.isValid());
    assertEquals("PARIS", sentence.place());
    assertEquals("France  attacked Germany.", sentence.text());

    Sentence bare = stories.get(1).sentences().get(0);
    assertNull(bare.date());
    assertFalse(bare.isValid());
    assertEquals("", bare.text());
  }

  public void testMalformed() {
    try {
      new SentenceReader().read(new StringReader("<Sentences><Sentence>"));
      fail("Expected an IOException");
    } catch( java.io.IOException ex ) {
      assertTrue(ex.getMessage().startsWith("Malformed XML"));
    }
  }
}
