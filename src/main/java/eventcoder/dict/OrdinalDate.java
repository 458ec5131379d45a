package eventcoder.dict;

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * Day ordinals for date comparisons: the ANSI date, where 1 Jan 1601 is day 1.
 */
public class OrdinalDate {
  private static final long BASE = LocalDate.of(1601, 1, 1).toEpochDay();

  /**
   * @param date YYYYMMDD, or YYMMDD with 00-30 read as 20YY and 31-99 as
   *             19YY.  Strings of eight or more characters are read as
   *             YYYYMMDD and anything after the eighth character is ignored;
   *             six or seven characters are read as YYMMDD from the first six.
   */
  public static int parse(String date) throws DateException {
    if( date == null ) throw new DateException("null");
    String str = date.trim();
    int year, month, day;
    try {
      if( str.length() > 7 ) {
        year = Integer.parseInt(str.substring(0, 4));
        month = Integer.parseInt(str.substring(4, 6));
        day = Integer.parseInt(str.substring(6, 8));
      } else if( str.length() >= 6 ) {
        year = Integer.parseInt(str.substring(0, 2));
        year += (year <= 30 ? 2000 : 1900);
        month = Integer.parseInt(str.substring(2, 4));
        day = Integer.parseInt(str.substring(4, 6));
      } else
        throw new DateException(date);
      return (int)(LocalDate.of(year, month, day).toEpochDay() - BASE) + 1;
    } catch( NumberFormatException ex ) {
      throw new DateException(date);
    } catch( DateTimeException ex ) {
      throw new DateException(date);
    }
  }
}
