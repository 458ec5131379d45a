package eventcoder.coding;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

import eventcoder.CoderConfig;
import eventcoder.dict.PatternAtom;
import eventcoder.parse.Token;
import eventcoder.parse.TokenSequence;

public class PatternMatcherTest extends TestCase {
  private final PatternMatcher _matcher = new PatternMatcher();
  private CodingContext _context;

  public void setUp() {
    _context = new CodingContext("TEST-1_1", null, new TokenSequence(), new CoderConfig());
  }

  private static List<PatternAtom> pattern(String... atoms) {
    List<PatternAtom> list = new ArrayList<PatternAtom>();
    for( String atom : atoms ) {
      char connector = ' ';
      String text = atom;
      if( atom.startsWith("_") ) {
        connector = '_';
        text = atom.substring(1);
      }
      PatternAtom.Type type = PatternAtom.Type.LITERAL;
      if( text.equals("$") ) type = PatternAtom.Type.SOURCE;
      else if( text.equals("+") ) type = PatternAtom.Type.TARGET;
      else if( text.equals("^") ) type = PatternAtom.Type.SKIP;
      list.add(new PatternAtom(type, text, connector, null));
    }
    return list;
  }

  /** Words, with "(" and ")" standing for entity markers. */
  private static ContextSequence sequence(boolean upper, String... items) {
    ContextSequence seq = new ContextSequence(upper);
    for( int i = 0; i < items.length; i++ ) {
      if( items[i].equals("(") ) seq.addEntityOpen(Token.code(), i);
      else if( items[i].equals(")") ) seq.addMarker(ContextSequence.Kind.ENTITY_CLOSE, i);
      else seq.addWord(items[i], i);
    }
    return seq;
  }

  public void testTargetInsideEntity() {
    ContextSequence lower = sequence(false, "WITH", "(", "GERMANY", ")");
    assertTrue(_matcher.match(pattern("WITH", "+"), lower, _context));
    assertEquals(new Locator(1, false), _context.target());
  }

  public void testSourceInUpperSequence() {
    ContextSequence upper = sequence(true, ")", "FRANCE", "(");
    assertTrue(_matcher.match(pattern("$"), upper, _context));
    assertEquals(new Locator(2, true), _context.source());
  }

  public void testGapAndAdjacency() {
    ContextSequence lower = sequence(false, "TALKS", "WITH", "(", "GERMANY", ")");
    assertTrue(_matcher.match(pattern("WITH"), lower, _context));
    assertFalse(_matcher.match(pattern("_WITH"), lower, _context));
    assertTrue(_matcher.match(pattern("TALKS", "_WITH"), lower, _context));
  }

  public void testSkipEntity() {
    ContextSequence lower = sequence(false, "(", "THE", "ARMY", ")", "OF", "(", "FRANCE", ")");
    assertTrue(_matcher.match(pattern("^", "OF", "+"), lower, _context));
    assertEquals(new Locator(5, false), _context.target());
  }

  public void testRunsOutOfSequence() {
    ContextSequence lower = sequence(false, "(", "GERMANY", ")");
    assertFalse(_matcher.match(pattern("+", "OF"), lower, _context));
    assertFalse(_matcher.match(pattern("WITH"), new ContextSequence(false), _context));
    assertTrue(_matcher.match(pattern(), lower, _context));
  }
}
