package eventcoder.dict;

import junit.framework.TestCase;

public class OrdinalDateTest extends TestCase {

  public void testFirstDay() throws Exception {
    assertEquals(1, OrdinalDate.parse("16010101"));
    assertEquals(366, OrdinalDate.parse("16020101"));
  }

  public void testTwoDigitYears() throws Exception {
    assertEquals(OrdinalDate.parse("20010101"), OrdinalDate.parse("010101"));
    assertEquals(OrdinalDate.parse("20300615"), OrdinalDate.parse("300615"));
    assertEquals(OrdinalDate.parse("19310615"), OrdinalDate.parse("310615"));
    assertEquals(OrdinalDate.parse("20200201"), OrdinalDate.parse("200201"));
  }

  public void testSevenCharactersReadAsTwoDigitYear() throws Exception {
    assertEquals(OrdinalDate.parse("20200201"), OrdinalDate.parse("2002011"));
    assertEquals(OrdinalDate.parse("19990115"), OrdinalDate.parse("990115X"));
  }

  public void testOrdering() throws Exception {
    assertEquals(1, OrdinalDate.parse("19990101") - OrdinalDate.parse("19981231"));
    // leap day
    assertEquals(2, OrdinalDate.parse("20000301") - OrdinalDate.parse("20000228"));
  }

  public void testTrailingCharactersIgnored() throws Exception {
    assertEquals(OrdinalDate.parse("20020115"), OrdinalDate.parse("20020115-0800"));
  }

  public void testInvalid() {
    String[] bad = { "20021301", "200231", "021301", "2002131", "2002", "abcdefgh", "" };
    for( String date : bad ) {
      try {
        OrdinalDate.parse(date);
        fail("accepted " + date);
      } catch( DateException ex ) {
        assertTrue(ex.getMessage().indexOf("Invalid date") >= 0);
      }
    }
  }
}
