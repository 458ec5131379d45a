package eventcoder.parse;

/**
 * Either a value or the reason there is none.
 */
public class Outcome<T> {
  private final T _value;
  private final SkipReason _reason;

  private Outcome(T value, SkipReason reason) {
    _value = value;
    _reason = reason;
  }

  public static <T> Outcome<T> of(T value) {
    return new Outcome<T>(value, null);
  }

  public static <T> Outcome<T> failed(SkipReason reason) {
    return new Outcome<T>(null, reason);
  }

  public boolean ok() { return _reason == null; }
  public T value() { return _value; }
  public SkipReason reason() { return _reason; }

  public String toString() {
    return ok() ? String.valueOf(_value) : "failed:" + _reason;
  }
}
