package eventcoder.dict;

import java.io.StringReader;
import java.util.List;

import junit.framework.TestCase;

import eventcoder.Fixtures;

public class VerbDictionaryTest extends TestCase {
  private VerbDictionary _dict;

  public void setUp() throws Exception {
    _dict = VerbDictionary.fromFile(Fixtures.file("verbs.txt"));
  }

  public void testRegularForms() {
    VerbEntry primary = _dict.get("ATTACK");
    assertTrue(primary.isPrimary());
    assertEquals("190", primary.code());
    for( String form : new String[] { "ATTACKS", "ATTACKED", "ATTACKING" } ) {
      VerbEntry entry = _dict.get(form);
      assertFalse(entry.isPrimary());
      assertEquals("ATTACK", entry.target());
      assertEquals("190", entry.code());
    }
  }

  public void testSecondVerbOfBlockRedirects() {
    VerbEntry assault = _dict.get("ASSAULT");
    assertFalse(assault.isPrimary());
    assertEquals("ATTACK", assault.target());
    assertEquals("ATTACK", _dict.get("ASSAULTED").target());
  }

  public void testIrregularForms() {
    assertEquals("MEET", _dict.get("MET").target());
    assertNull(_dict.get("MEETED"));
  }

  public void testPatterns() {
    List<VerbPattern> patterns = _dict.primary("ACCUSE").patterns();
    assertEquals(1, patterns.size());
    VerbPattern pattern = patterns.get(0);
    assertEquals("1121", pattern.code());
    assertTrue(pattern.upper().isEmpty());
    assertEquals(3, pattern.lower().size());
    assertEquals(PatternAtom.Type.TARGET, pattern.lower().get(0).type());
    assertEquals("OF", pattern.lower().get(1).text());
    PatternAtom crime = pattern.lower().get(2);
    assertEquals(PatternAtom.Type.SYNSET, crime.type());
    assertTrue(crime.synset().containsWord("MURDERS"));
    assertEquals(2, crime.synset().phrases().size());
  }

  public void testMultiWordVerb() {
    List<MultiWordVerb> multis = _dict.get("CARRIED").multiWords();
    assertEquals(1, multis.size());
    MultiWordVerb multi = multis.get(0);
    assertTrue(multi.after());
    assertEquals("OUT", multi.words().get(0));
    assertEquals("CARRY", multi.target());
    assertEquals("180", multi.code());
    assertEquals("---", _dict.get("CARRIED").code());
  }

  public void testUpperPatternIsReversed() throws Exception {
    VerbDictionary dict = VerbDictionary.fromReader(new StringReader(
        "--- WARN [130]\nWARN\n- $ STRONGLY * + [138]\n"), "verbs");
    VerbPattern pattern = dict.primary("WARN").patterns().get(0);
    assertEquals("STRONGLY", pattern.upper().get(0).text());
    assertEquals(PatternAtom.Type.SOURCE, pattern.upper().get(1).type());
    assertEquals(PatternAtom.Type.TARGET, pattern.lower().get(0).type());
  }

  public void testUndefinedSynsetSkipsPattern() throws Exception {
    VerbDictionary dict = VerbDictionary.fromReader(new StringReader(
        "--- WARN [130]\nWARN\n- * &NOTHING [138]\n- * OF [131]\n"), "verbs");
    assertEquals(1, dict.numPatterns());
    assertEquals("131", dict.primary("WARN").patterns().get(0).code());
  }

  public void testPrimaryNotReplacedByForm() throws Exception {
    VerbDictionary dict = VerbDictionary.fromReader(new StringReader(
        "--- LEAVE [020]\nLEAVE {LEAVES LEFT LEAVING}\n--- LEFT [999]\nLEFT\n--- GO [030]\nGO {LEFT}\n"), "verbs");
    assertTrue(dict.get("LEFT").isPrimary());
    assertEquals("999", dict.get("LEFT").code());
  }
}
