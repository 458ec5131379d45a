package eventcoder.dict;

/**
 * A date string that is not a valid YYYYMMDD or YYMMDD calendar date.
 */
public class DateException extends Exception {
  private static final long serialVersionUID = 1L;

  public DateException(String date) {
    super("Invalid date: " + date);
  }
}
