package eventcoder.parse;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

public class TreeNormalizerTest extends TestCase {
  private final TreeNormalizer _normalizer = new TreeNormalizer();

  private TokenSequence normalize(String parse) {
    Outcome<TokenSequence> out = _normalizer.normalize(parse);
    assertTrue("failed: " + out, out.ok());
    return out.value();
  }

  private static List<String> opens(TokenSequence seq) {
    List<String> labels = new ArrayList<String>();
    for( Token tok : seq )
      if( tok.isOpen() ) labels.add(tok.label());
    return labels;
  }

  public void testSimpleSentence() {
    TokenSequence seq = normalize("(ROOT (S (NP (NNP France)) (VP (VBD attacked) (NP (NNP Germany))) (. .)))");
    assertTrue(seq.isBalanced());
    assertEquals("(ROOT (S (NE --- FRANCE ~NE (VP1 (VBD ATTACKED ~VBD (NE --- GERMANY ~NE ~VP1 (. . ~. ~S ~ROOT",
                 seq.toString());
  }

  public void testEntityCodeSlot() {
    TokenSequence seq = normalize("(ROOT (S (NP (DT the) (NN army)) (VP (VBD left)) (. .)))");
    int kne = seq.indexOfOpen(Token.ENTITY, 0);
    assertTrue(seq.get(kne + 1).isCode());
    assertFalse(seq.get(kne + 1).isResolved());
    assertEquals("THE", seq.get(kne + 2).text());
  }

  public void testPossessiveIsOneEntity() {
    TokenSequence seq = normalize(
        "(ROOT (S (NP (NP (NNP France) (POS 's)) (NN army)) (VP (VBD attacked) (NP (NNP Germany))) (. .)))");
    assertTrue(seq.toString().startsWith("(ROOT (S (NE --- FRANCE ARMY ~NE"));
  }

  public void testPrepositionalPhraseFlattened() {
    TokenSequence seq = normalize(
        "(ROOT (S (NP (NP (DT the) (NN army)) (PP (IN of) (NP (NNP France)))) (VP (VBD left)) (. .)))");
    assertTrue(seq.toString().startsWith("(ROOT (S (NE --- THE ARMY OF FRANCE ~NE (VP1"));
  }

  public void testCompoundHeads() {
    TokenSequence seq = normalize(
        "(ROOT (S (NP (JJ French) (NNS soldiers) (CC and) (NNS police)) (VP (VBD left)) (. .)))");
    String str = seq.toString();
    assertTrue(str, str.startsWith("(ROOT (S (NEC1 (NE --- FRENCH SOLDIERS ~NE (NE --- FRENCH POLICE ~NE ~NEC1"));
  }

  public void testVerbPhrasesNumbered() {
    TokenSequence seq = normalize(
        "(ROOT (S (NP (NNP Germany)) (VP (VBD was) (VP (VBN attacked) (PP (IN by) (NP (NNP France))))) (. .)))");
    assertEquals(2, seq.maxIndex("VP"));
  }

  public void testCoordinatedVerbsNotCompound() {
    TokenSequence seq = normalize(
        "(ROOT (S (NP (NNP France)) (VP (VP (VBD attacked) (NP (NNP Germany))) (CC and) (VP (VBD left))) (. .)))");
    assertFalse(opens(seq).contains(Token.COMPOUND));
    assertTrue(opens(seq).contains("CCP"));
  }

  public void testSubordinateClauseCollapsed() {
    TokenSequence seq = normalize(
        "(ROOT (S (NP (NP (NNS troops)) (SBAR (WHNP (WDT that)) (S (VP (VBD arrived))))) (VP (VBD left)) (. .)))");
    assertFalse(opens(seq).contains("SBAR"));
    assertTrue(seq.toString().indexOf("THAT ARRIVED") >= 0);
  }

  public void testUnbalancedInput() {
    Outcome<TokenSequence> out = _normalizer.normalize("(ROOT (S (NP (NNP France)) (VP (VBD left))");
    assertFalse(out.ok());
    assertEquals(SkipReason.BAD_INPUT_PARSE, out.reason());
    assertEquals(SkipReason.BAD_INPUT_PARSE, _normalizer.normalize(null).reason());
  }

  public void testDateline() {
    Outcome<TokenSequence> out = _normalizer.normalize(
        "(ROOT (NP (NNP Paris)) (NP (NNP France) (CC and) (NNP Germany)))");
    assertEquals(SkipReason.DATELINE, out.reason());
  }
}
