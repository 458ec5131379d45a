package eventcoder.dict;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named list of words and phrases usable in place of a literal in verb
 * patterns.  Multi-word members are kept as word arrays.
 */
public class Synset {
  private final String _name;
  private final Set<String> _words = new HashSet<String>();
  private final List<String[]> _phrases = new ArrayList<String[]>();

  public Synset(String name) {
    _name = name;
  }

  public String name() { return _name; }

  public void add(String member) {
    String[] words = member.trim().split("\\s+");
    if( words.length == 1 ) _words.add(words[0]);
    else if( words.length > 1 ) _phrases.add(words);
  }

  public boolean containsWord(String word) {
    return _words.contains(word);
  }

  public List<String[]> phrases() { return _phrases; }

  public int size() { return _words.size() + _phrases.size(); }

  public String toString() {
    return _name + _words + "+" + _phrases.size() + " phrases";
  }
}
