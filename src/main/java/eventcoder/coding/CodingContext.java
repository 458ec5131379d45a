package eventcoder.coding;

import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.CoderConfig;
import eventcoder.parse.SkipReason;
import eventcoder.parse.TokenSequence;


/**
 * Everything the coding stages share while working on one sentence.  A new
 * context is made for every sentence and dropped once its events are taken.
 */
public class CodingContext {
  private static final Redwood.RedwoodChannels log = Redwood.channels(CodingContext.class);

  private final String _sentenceId;
  private final Integer _date;
  private final TokenSequence _seq;
  private final CoderConfig _config;

  private SkipReason _failure = null;
  private String _where = null;

  // state of the verb being coded
  private ContextSequence _upper = new ContextSequence(true);
  private ContextSequence _lower = new ContextSequence(false);
  private Locator _source = null;
  private Locator _target = null;
  private boolean _passive = false;

  private final List<CodedEvent> _events = new ArrayList<CodedEvent>();

  /**
   * @param date Ordinal date of the sentence, or null if it has none.
   */
  public CodingContext(String sentenceId, Integer date, TokenSequence seq, CoderConfig config) {
    _sentenceId = sentenceId;
    _date = date;
    _seq = seq;
    _config = config;
  }

  public String sentenceId() { return _sentenceId; }
  public Integer date() { return _date; }
  public TokenSequence sequence() { return _seq; }
  public CoderConfig config() { return _config; }

  /**
   * Record why the sentence cannot be coded.  The first failure is kept.
   */
  public void fail(SkipReason reason, String where) {
    log.warn(_sentenceId + ": " + reason.tag() + " in " + where);
    if( _failure == null ) {
      _failure = reason;
      _where = where;
    }
  }

  public boolean failed() { return _failure != null; }
  public SkipReason failure() { return _failure; }
  public String failureLocation() { return _where; }

  public void setSequences(ContextSequence upper, ContextSequence lower) {
    _upper = upper;
    _lower = lower;
  }

  public ContextSequence upper() { return _upper; }
  public ContextSequence lower() { return _lower; }

  public ContextSequence sequence(Locator loc) {
    return (loc.inUpper() ? _upper : _lower);
  }

  public ContextSequence.Item item(Locator loc) {
    return sequence(loc).get(loc.index());
  }

  public Locator source() { return _source; }
  public Locator target() { return _target; }
  public void setSource(Locator loc) { _source = loc; }
  public void setTarget(Locator loc) { _target = loc; }

  public void resetLocators() {
    _source = null;
    _target = null;
  }

  public boolean isPassive() { return _passive; }
  public void setPassive(boolean passive) { _passive = passive; }

  /** Events of the sentence so far, in the order they were made. */
  public List<CodedEvent> events() { return _events; }

  /**
   * Add an event unless an identical one is already there.
   */
  public void addEvent(CodedEvent event) {
    if( !_events.contains(event) )
      _events.add(event);
  }
}
