package eventcoder.dict;

import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

public class ActorDictionaryTest extends TestCase {
  private static final String ACTORS =
    "UNITED_STATES [USA]\n" +
    "+AMERICA\n" +
    "UNITED_NATIONS [IGOUNO]\n" +
    "UNITED [XYZ]  # a bare word\n" +
    "JOHN_SMITH\n" +
    "\t[AAA <981231]\n" +
    "\t[BBB >990101]\n" +
    "\t[CCC]\n" +
    "JANE_DOE\n" +
    "\t[DDD 950101-971231]\n" +
    "TONY_BLAIR ; prime minister\n" +
    "\t[GBRGOV 970502-070627]\n" +
    "---STOP---\n" +
    "ATLANTIS [ATL]\n";

  private ActorDictionary _dict;

  public void setUp() throws Exception {
    _dict = ActorDictionary.fromReader(new StringReader(ACTORS), "actors");
  }

  private ActorCodes find(String... words) {
    List<String> fragment = Arrays.asList(words);
    for( int k = 0; k < fragment.size(); k++ ) {
      for( PhrasePattern<ActorCodes> pattern : _dict.phrases(fragment.get(k)) )
        if( pattern.matches(fragment, k) ) return pattern.payload();
    }
    return null;
  }

  public void testLongestPhraseFirst() {
    List<PhrasePattern<ActorCodes>> list = _dict.phrases("UNITED");
    assertEquals(3, list.size());
    assertEquals(1, list.get(2).length());
    assertEquals("USA", find("THE", "UNITED", "STATES").resolve(null));
    assertEquals("IGOUNO", find("UNITED", "NATIONS").resolve(null));
    assertEquals("XYZ", find("UNITED", "ARAB", "EMIRATES").resolve(null));
  }

  public void testSynonymSharesCodes() {
    ActorCodes codes = find("AMERICA");
    assertEquals("USA", codes.resolve(null));
    assertEquals("UNITED STATES", codes.root().replace('_', ' '));
  }

  public void testDateRestrictions() throws Exception {
    ActorCodes smith = find("JOHN", "SMITH");
    assertEquals("AAA", smith.resolve(OrdinalDate.parse("19981231")));
    assertEquals("BBB", smith.resolve(OrdinalDate.parse("19990601")));
    assertEquals("BBB", smith.resolve(OrdinalDate.parse("19990101")));
    assertEquals("CCC", smith.resolve(null));
  }

  public void testIntervalIsInclusive() throws Exception {
    ActorCodes doe = find("JANE", "DOE");
    assertEquals("DDD", doe.resolve(OrdinalDate.parse("19950101")));
    assertEquals("DDD", doe.resolve(OrdinalDate.parse("19971231")));
    assertEquals("---", doe.resolve(OrdinalDate.parse("19980101")));
    assertEquals("---", doe.resolve(null));

    ActorCodes blair = find("TONY", "BLAIR");
    assertEquals("GBRGOV", blair.resolve(OrdinalDate.parse("20020115")));
  }

  public void testAllWordsRequired() {
    assertNull(find("JOHN"));
    assertNull(find("SMITH"));
  }

  public void testStopMarker() {
    assertTrue(_dict.phrases("ATLANTIS").isEmpty());
    assertEquals(6, _dict.numActors());
  }
}
