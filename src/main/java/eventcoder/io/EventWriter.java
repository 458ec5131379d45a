package eventcoder.io;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.stanford.nlp.stats.Counter;

import eventcoder.coding.CodedEvent;
import eventcoder.coding.SentenceResult;


/**
 * Writes one tab separated line per event:
 *   date source target eventcode sentenceid sourcelabel [issues] [roots] [texts]
 * Issues are written CODE,count;CODE,count.  Root phrases and matched texts
 * follow when they were recorded on the event.
 */
public class EventWriter {
  private final BufferedWriter _out;
  private int _written = 0;

  public EventWriter(Writer out) {
    _out = (out instanceof BufferedWriter ? (BufferedWriter)out : new BufferedWriter(out));
  }

  public static EventWriter open(String path) throws IOException {
    return new EventWriter(new OutputStreamWriter(new FileOutputStream(path), "UTF-8"));
  }

  public void write(Sentence sentence, SentenceResult result) throws IOException {
    String issues = formatIssues(result.issues());
    for( CodedEvent event : result.events() ) {
      StringBuffer buf = new StringBuffer();
      buf.append(sentence.date() == null ? "" : sentence.date());
      buf.append('\t').append(event.source());
      buf.append('\t').append(event.target());
      buf.append('\t').append(event.eventCode());
      buf.append('\t').append(sentence.id());
      buf.append('\t').append(sentence.source());
      if( issues.length() > 0 )
        buf.append('\t').append(issues);
      if( event.sourceRoot() != null || event.targetRoot() != null )
        buf.append('\t').append(orNull(event.sourceRoot())).append('\t').append(orNull(event.targetRoot()));
      if( event.sourceText() != null || event.targetText() != null )
        buf.append('\t').append(orNull(event.sourceText())).append('\t').append(orNull(event.targetText()));
      _out.write(buf.toString());
      _out.write("\n");
      _written++;
    }
  }

  /**
   * Issue codes in alphabetical order.
   */
  static String formatIssues(Counter<String> issues) {
    if( issues == null || issues.size() == 0 ) return "";
    List<String> codes = new ArrayList<String>(issues.keySet());
    Collections.sort(codes);
    StringBuffer buf = new StringBuffer();
    for( String code : codes ) {
      if( buf.length() > 0 ) buf.append(';');
      buf.append(code).append(',').append((int)issues.getCount(code));
    }
    return buf.toString();
  }

  private static String orNull(String str) {
    return (str == null ? "---" : str);
  }

  public int numWritten() { return _written; }

  public void flush() throws IOException {
    _out.flush();
  }

  public void close() throws IOException {
    _out.close();
  }
}
