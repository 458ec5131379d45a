package eventcoder.coding;

import java.util.Collections;
import java.util.List;

import edu.stanford.nlp.stats.ClassicCounter;
import edu.stanford.nlp.stats.Counter;

import eventcoder.dict.DiscardList;
import eventcoder.parse.SkipReason;


/**
 * What coding one sentence produced: its events and issues, or why it was
 * skipped or discarded.
 */
public class SentenceResult {
  private final String _sentenceId;
  private final List<CodedEvent> _events;
  private final Counter<String> _issues;
  private final SkipReason _skip;
  private final DiscardList.Match _discard;

  private SentenceResult(String sentenceId, List<CodedEvent> events, Counter<String> issues,
                         SkipReason skip, DiscardList.Match discard) {
    _sentenceId = sentenceId;
    _events = events;
    _issues = issues;
    _skip = skip;
    _discard = discard;
  }

  public static SentenceResult coded(String sentenceId, List<CodedEvent> events, Counter<String> issues) {
    return new SentenceResult(sentenceId, events, issues, null, DiscardList.NO_MATCH);
  }

  public static SentenceResult skipped(String sentenceId, SkipReason reason) {
    return new SentenceResult(sentenceId, Collections.<CodedEvent>emptyList(),
                              new ClassicCounter<String>(), reason, DiscardList.NO_MATCH);
  }

  public static SentenceResult discarded(String sentenceId, DiscardList.Match discard) {
    return new SentenceResult(sentenceId, Collections.<CodedEvent>emptyList(),
                              new ClassicCounter<String>(), null, discard);
  }

  public String sentenceId() { return _sentenceId; }
  public List<CodedEvent> events() { return _events; }
  public Counter<String> issues() { return _issues; }
  /** Null unless the sentence could not be coded. */
  public SkipReason skipReason() { return _skip; }
  public DiscardList.Match discard() { return _discard; }

  public boolean isSkipped() { return _skip != null; }
  public boolean isDiscarded() { return _discard.kind != DiscardList.Kind.NONE; }
  public boolean isStoryDiscard() { return _discard.kind == DiscardList.Kind.STORY; }

  public String toString() {
    if( isSkipped() ) return _sentenceId + " skipped: " + _skip;
    if( isDiscarded() ) return _sentenceId + " discarded: " + _discard;
    return _sentenceId + " " + _events;
  }
}
