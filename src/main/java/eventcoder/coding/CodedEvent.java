package eventcoder.coding;

/**
 * A (source, target, event code) triple with its optional root phrase and
 * matched text annotations.
 */
public class CodedEvent {
  private final String _source;
  private final String _target;
  private final String _eventCode;
  private final String _sourceRoot, _targetRoot;
  private final String _sourceText, _targetText;

  public CodedEvent(String source, String target, String eventCode) {
    this(source, target, eventCode, null, null, null, null);
  }

  public CodedEvent(String source, String target, String eventCode,
                    String sourceRoot, String targetRoot, String sourceText, String targetText) {
    _source = source;
    _target = target;
    _eventCode = eventCode;
    _sourceRoot = sourceRoot;
    _targetRoot = targetRoot;
    _sourceText = sourceText;
    _targetText = targetText;
  }

  public String source() { return _source; }
  public String target() { return _target; }
  public String eventCode() { return _eventCode; }
  public String sourceRoot() { return _sourceRoot; }
  public String targetRoot() { return _targetRoot; }
  public String sourceText() { return _sourceText; }
  public String targetText() { return _targetText; }

  /** True if either side is the null code. */
  public boolean isPartial() {
    return "---".equals(_source) || "---".equals(_target);
  }

  /** Same source, target and event code, annotations aside. */
  public boolean sameTriple(String source, String target, String eventCode) {
    return _source.equals(source) && _target.equals(target) && _eventCode.equals(eventCode);
  }

  private static boolean same(String a, String b) {
    return (a == null ? b == null : a.equals(b));
  }

  public boolean equals(Object other) {
    if( !(other instanceof CodedEvent) ) return false;
    CodedEvent ev = (CodedEvent)other;
    return _source.equals(ev._source) && _target.equals(ev._target) && _eventCode.equals(ev._eventCode)
        && same(_sourceRoot, ev._sourceRoot) && same(_targetRoot, ev._targetRoot)
        && same(_sourceText, ev._sourceText) && same(_targetText, ev._targetText);
  }

  public int hashCode() {
    return _source.hashCode() * 31 * 31 + _target.hashCode() * 31 + _eventCode.hashCode();
  }

  public String toString() {
    return _source + "\t" + _target + "\t" + _eventCode;
  }
}
