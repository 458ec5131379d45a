package eventcoder.parse;

import junit.framework.TestCase;

public class ClauseElisionTest extends TestCase {
  private static final String APPOSITION =
    "(ROOT (S (NP (NP (NNP France)) (, ,) (NP (DT the) (JJ big) (NN country)) (, ,)) " +
    "(VP (VBD attacked) (NP (NNP Germany))) (. .)))";
  private static final String OPENER =
    "(ROOT (S (PP (IN on) (NP (NNP Monday))) (, ,) (NP (NNP France)) " +
    "(VP (VBD attacked) (NP (NNP Germany))) (. .)))";
  private static final String CLOSER =
    "(ROOT (S (NP (NNP France)) (VP (VBD attacked) (NP (NNP Germany))) (, ,) " +
    "(S (NP (NNS officials)) (VP (VBD said))) (. .)))";

  private static TokenSequence parse(String tree) {
    return new TreeNormalizer().normalize(tree).value();
  }

  private static boolean hasWord(TokenSequence seq, String word) {
    for( Token tok : seq )
      if( tok.isWord() && tok.text().equals(word) ) return true;
    return false;
  }

  public void testInternalClause() {
    TokenSequence seq = parse(APPOSITION);
    assertNull(new ClauseElision(0, 0, 2, 8, 0, 0).elide(seq));
    assertFalse(hasWord(seq, "COUNTRY"));
    assertFalse(hasWord(seq, "BIG"));
    assertTrue(hasWord(seq, "FRANCE"));
    assertTrue(seq.isBalanced());
  }

  public void testInternalClauseOutsideRange() {
    TokenSequence seq = parse(APPOSITION);
    assertNull(new ClauseElision(0, 0, 4, 8, 0, 0).elide(seq));
    assertTrue(hasWord(seq, "COUNTRY"));
  }

  public void testInitialClause() {
    TokenSequence seq = parse(OPENER);
    assertNull(new ClauseElision(1, 5, 0, 0, 0, 0).elide(seq));
    assertFalse(hasWord(seq, "MONDAY"));
    // the dangling comma goes too
    assertEquals(-1, seq.indexOfOpen(",", 0));
    assertTrue(seq.toString().startsWith("(ROOT (S (NE --- FRANCE ~NE (VP1"));
  }

  public void testTerminalClause() {
    TokenSequence seq = parse(CLOSER);
    assertNull(new ClauseElision(0, 0, 0, 0, 1, 4).elide(seq));
    assertFalse(hasWord(seq, "OFFICIALS"));
    assertEquals(-1, seq.indexOfOpen(",", 0));
    assertTrue(hasWord(seq, "."));
  }

  public void testAllPassesOff() {
    TokenSequence seq = parse(APPOSITION);
    String before = seq.toString();
    assertNull(new ClauseElision(0, 0, 0, 0, 0, 0).elide(seq));
    assertEquals(before, seq.toString());
  }

  public void testCountWords() {
    TokenSequence seq = parse(APPOSITION);
    assertEquals(6, ClauseElision.countWords(seq, 0, seq.size()));
  }
}
