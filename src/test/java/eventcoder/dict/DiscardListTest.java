package eventcoder.dict;

import java.io.StringReader;

import junit.framework.TestCase;

public class DiscardListTest extends TestCase {
  private DiscardList _list;

  public void setUp() throws Exception {
    _list = DiscardList.fromReader(new StringReader(
        "# sports\n+BASKETBALL\nFOOTBALL_\nSOCCER\n"), "discards");
  }

  public void testStoryDiscard() {
    DiscardList.Match match = _list.check("The basketball final was played in Paris.");
    assertEquals(DiscardList.Kind.STORY, match.kind);
    assertEquals("+BASKETBALL", match.phrase);
  }

  public void testExactPhraseNeedsWordEnd() {
    assertEquals(DiscardList.Kind.SENTENCE, _list.check("The football team won.").kind);
    assertEquals(DiscardList.Kind.SENTENCE, _list.check("They played football.").kind);
    assertEquals(DiscardList.Kind.NONE, _list.check("A footballer spoke.").kind);
  }

  public void testStemMatch() {
    assertEquals(DiscardList.Kind.SENTENCE, _list.check("Soccerball fans rioted.").kind);
    // the phrase must start a word
    assertEquals(DiscardList.Kind.NONE, _list.check("Minisoccer fans rioted.").kind);
  }

  public void testStoryWinsOverSentence() {
    assertEquals(DiscardList.Kind.STORY, _list.check("Football and basketball results.").kind);
  }

  public void testNoMatch() {
    assertSame(DiscardList.NO_MATCH, _list.check("France attacked Germany."));
  }
}
