package eventcoder.dict;

import java.io.StringReader;

import junit.framework.TestCase;

public class AgentDictionaryTest extends TestCase {
  private static final String AGENTS =
    "!FORCE! = ARMY, NAVY\n" +
    "!FORCE! [~MIL]\n" +
    "REBEL [~REB]\n" +
    "POLICE {} [~COP]\n" +
    "MAN {MEN} [~CVL]\n" +
    "MINISTER\n" +
    "SOLDIER !UNDEFINED! [~MIL]\n";

  private AgentDictionary _dict;

  public void setUp() throws Exception {
    _dict = AgentDictionary.fromReader(new StringReader(AGENTS), "agents");
  }

  public void testGeneratedPlurals() {
    assertEquals(1, _dict.phrases("REBEL").size());
    assertEquals("~REB", _dict.phrases("REBELS").get(0).payload());
  }

  public void testSubstitutionSetWithPlurals() {
    assertEquals("~MIL", _dict.phrases("ARMY").get(0).payload());
    assertEquals("~MIL", _dict.phrases("ARMIES").get(0).payload());
    assertEquals("~MIL", _dict.phrases("NAVIES").get(0).payload());
  }

  public void testExplicitPlural() {
    assertEquals("~CVL", _dict.phrases("MEN").get(0).payload());
    assertTrue(_dict.phrases("MANS").isEmpty());
    assertEquals(1, _dict.phrases("POLICE").size());
  }

  public void testLinesWithoutCodesSkipped() {
    assertTrue(_dict.phrases("MINISTER").isEmpty());
    assertTrue(_dict.phrases("SOLDIER").isEmpty());
  }
}
