package eventcoder.io;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.jdom.Document;
import org.jdom.Element;
import org.jdom.JDOMException;
import org.jdom.input.SAXBuilder;

import edu.stanford.nlp.util.logging.Redwood;


/**
 * Reads the XML sentence format:
 *
 * <pre>
 * &lt;Sentences&gt;
 *   &lt;Sentence id="AFP-0101_01" date="20010101" source="AFP" sentence="true"&gt;
 *     &lt;Text&gt;France attacked Germany.&lt;/Text&gt;
 *     &lt;Parse&gt;(ROOT (S ...))&lt;/Parse&gt;
 *   &lt;/Sentence&gt;
 * &lt;/Sentences&gt;
 * </pre>
 *
 * Sentences are grouped into stories by the id part before the last
 * underscore.  A sentence without a parse is skipped with a warning.
 */
public class SentenceReader {
  private static final Redwood.RedwoodChannels log = Redwood.channels(SentenceReader.class);

  public SentenceReader() { }

  public List<Story> read(File file) throws IOException {
    log.info("Reading sentences " + file.getPath());
    try {
      return stories(new SAXBuilder().build(file));
    } catch( JDOMException ex ) {
      throw new IOException("Malformed XML in " + file.getPath() + ": " + ex.getMessage(), ex);
    }
  }

  public List<Story> read(Reader in) throws IOException {
    try {
      return stories(new SAXBuilder().build(in));
    } catch( JDOMException ex ) {
      throw new IOException("Malformed XML: " + ex.getMessage(), ex);
    }
  }

  private List<Story> stories(Document doc) {
    List<Story> stories = new ArrayList<Story>();
    Story current = null;
    for( Object obj : doc.getRootElement().getChildren("Sentence") ) {
      Sentence sentence = toSentence((Element)obj);
      if( sentence.parse() == null || sentence.parse().trim().length() == 0 ) {
        log.warn(sentence.id() + " has no parse; skipped");
        continue;
      }
      if( current == null || !current.id().equals(sentence.storyId()) ) {
        current = new Story(sentence.storyId());
        stories.add(current);
      }
      current.add(sentence);
    }
    return stories;
  }

  /**
   * A Sentence element, as used both by input files and validation files.
   */
  public static Sentence toSentence(Element elem) {
    String id = attribute(elem, "id", "");
    String valid = attribute(elem, "valid", "false");
    return new Sentence(id,
                        elem.getAttributeValue("date"),
                        attribute(elem, "source", ""),
                        attribute(elem, "category", ""),
                        valid.trim().equalsIgnoreCase("true"),
                        attribute(elem, "place", ""),
                        text(elem.getChildText("Text")),
                        elem.getChildText("Parse"));
  }

  private static String attribute(Element elem, String name, String def) {
    String value = elem.getAttributeValue(name);
    return (value == null ? def : value);
  }

  /** Sentence text on one line. */
  private static String text(String str) {
    if( str == null ) return "";
    return str.replace('\n', ' ').replace('\r', ' ').trim();
  }
}
