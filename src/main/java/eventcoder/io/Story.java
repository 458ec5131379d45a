package eventcoder.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Consecutive sentences sharing a story id.
 */
public class Story {
  private final String _id;
  private final List<Sentence> _sentences = new ArrayList<Sentence>();

  public Story(String id) {
    _id = id;
  }

  public String id() { return _id; }
  public List<Sentence> sentences() { return _sentences; }
  public void add(Sentence sentence) { _sentences.add(sentence); }

  public String toString() { return _id + " (" + _sentences.size() + " sentences)"; }
}
