package eventcoder.coding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

import eventcoder.Fixtures;
import eventcoder.dict.Dictionaries;
import eventcoder.parse.Token;
import eventcoder.parse.TokenSequence;

public class EntityResolverTest extends TestCase {
  private EntityResolver _resolver;

  public void setUp() throws Exception {
    Dictionaries dicts = Fixtures.dictionaries();
    _resolver = new EntityResolver(dicts.actors(), dicts.agents());
  }

  public void testCompose() {
    assertEquals("FRAMIL", EntityResolver.compose("FRA", "~MIL"));
    assertEquals("GOVFRA", EntityResolver.compose("FRA", "GOV~"));
    assertEquals("FRAMIL", EntityResolver.compose("FRA", "MIL"));
    assertEquals("---REB", EntityResolver.compose("---", "~REB"));
    // a block already there is not repeated
    assertEquals("FRAMIL", EntityResolver.compose("FRAMIL", "~MIL"));
    assertEquals("FRAGOV", EntityResolver.compose("FRAGOV", "GOV~"));
  }

  public void testActorAndAgent() {
    EntityResolver.Resolution res = _resolver.check(Arrays.asList("THE", "FRENCH", "ARMY"), null);
    assertEquals("FRAMIL", res.code);
    assertEquals("FRANCE", res.root);
  }

  public void testAgentOnly() {
    EntityResolver.Resolution res = _resolver.check(Arrays.asList("THE", "REBELS"), null);
    assertEquals("---REB", res.code);
    assertNull(res.root);
  }

  public void testNothingFound() {
    assertNull(_resolver.check(Arrays.asList("THE", "GUNMEN"), null));
  }

  public void testExpandCompound() {
    List<Token> tokens = new ArrayList<Token>();
    tokens.add(Token.open(Token.ENTITY));
    tokens.add(Token.code());
    tokens.add(Token.word("THE"));
    tokens.add(Token.open(Token.COMPOUND));
    tokens.add(Token.open("NNP"));
    tokens.add(Token.word("FRANCE"));
    tokens.add(Token.close("NNP", 0));
    tokens.add(Token.open("CC"));
    tokens.add(Token.word("AND"));
    tokens.add(Token.close("CC", 0));
    tokens.add(Token.open("NNP"));
    tokens.add(Token.word("GERMANY"));
    tokens.add(Token.close("NNP", 0));
    tokens.add(Token.close(Token.COMPOUND, 0));
    tokens.add(Token.word("ARMIES"));
    tokens.add(Token.close(Token.ENTITY, 0));
    TokenSequence seq = new TokenSequence(tokens);

    assertTrue(_resolver.expandCompound(seq, 0, seq.size() - 1));
    assertTrue(seq.isBalanced());
    assertEquals("(NEC1 (NE --- THE FRANCE ARMIES ~NE (NE --- THE GERMANY ARMIES ~NE ~NEC1", seq.toString());
  }
}
