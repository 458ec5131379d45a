package eventcoder.coding;

import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.dict.ActorCodes;
import eventcoder.dict.ActorDictionary;
import eventcoder.dict.AgentDictionary;
import eventcoder.dict.PhrasePattern;
import eventcoder.parse.SkipReason;
import eventcoder.parse.Token;
import eventcoder.parse.TokenSequence;


/**
 * Assigns actor codes to the entity spans of a sentence.
 *
 * The first actor phrase found in an entity gives the base code; every agent
 * phrase found adds its code block before or after it.  Entities holding a
 * nested compound are first split into one entity per compound member, each
 * keeping the words around the compound.
 */
public class EntityResolver {
  private static final Redwood.RedwoodChannels log = Redwood.channels(EntityResolver.class);

  /** Width of one code block. */
  public static final int CODE_WIDTH = 3;

  private final ActorDictionary _actors;
  private final AgentDictionary _agents;

  /** A resolved code and the actor root phrase, null when only agents matched. */
  public static class Resolution {
    public final String code;
    public final String root;

    Resolution(String code, String root) {
      this.code = code;
      this.root = root;
    }

    public String toString() { return code + (root == null ? "" : "=" + root); }
  }

  public EntityResolver(ActorDictionary actors, AgentDictionary agents) {
    _actors = actors;
    _agents = agents;
  }

  /**
   * Fill in the code slot of every entity of the context's sequence.
   */
  public void resolve(CodingContext context) {
    TokenSequence seq = context.sequence();
    int kitem = TokenSequence.PARSE_START;
    while( kitem < seq.size() ) {
      if( !seq.get(kitem).isEntityOpen() ) {
        kitem++;
        continue;
      }
      int kend = seq.findClose(kitem);
      if( kend < 0 || kitem + 1 >= seq.size() || !seq.get(kitem + 1).isCode() ) {
        context.fail(SkipReason.COMPOUND_EXPANSION, "entity at " + kitem);
        return;
      }

      int ncstart = seq.indexOfOpen(Token.COMPOUND, kitem);
      if( ncstart >= 0 && ncstart < kend ) {
        if( !expandCompound(seq, kitem, kend) ) {
          context.fail(SkipReason.COMPOUND_EXPANSION, "entity at " + kitem);
          return;
        }
        // the members follow the new compound open
        kitem++;
        continue;
      }

      List<String> fragment = new ArrayList<String>();
      for( int i = kitem + 2; i < kend; i++ )
        if( seq.get(i).isWord() ) fragment.add(seq.get(i).text());

      Resolution res = check(fragment, context.date());
      if( res != null )
        seq.get(kitem + 1).setCode(res.code, res.root);
      kitem = kend + 1;
    }
  }

  /**
   * Code one entity's words.
   * @param date Ordinal sentence date, or null.
   * @return null if neither an actor nor an agent occurs.
   */
  public Resolution check(List<String> fragment, Integer date) {
    ActorCodes actor = null;
    for( int kword = 0; kword < fragment.size() && actor == null; kword++ ) {
      for( PhrasePattern<ActorCodes> pattern : _actors.phrases(fragment.get(kword)) ) {
        if( pattern.matches(fragment, kword) ) {
          actor = pattern.payload();
          break;
        }
      }
    }

    List<String> agents = new ArrayList<String>();
    for( int kword = 0; kword < fragment.size(); kword++ ) {
      for( PhrasePattern<String> pattern : _agents.phrases(fragment.get(kword)) ) {
        if( pattern.matches(fragment, kword) ) {
          if( !agents.contains(pattern.payload()) )
            agents.add(pattern.payload());
          break;
        }
      }
    }

    String code = (actor == null ? null : actor.resolve(date));
    String root = (actor == null ? null : actor.root());
    if( agents.isEmpty() )
      return (actor == null ? null : new Resolution(code, root));

    if( code == null ) code = Token.NULL_CODE;
    for( String agent : agents )
      code = compose(code, agent);
    return new Resolution(code, root);
  }

  /**
   * Attach an agent code: ~XXX after the base, XXX~ before it, a code with
   * no ~ after it.  A block already present at a block boundary is not
   * added again.
   */
  static String compose(String base, String agent) {
    boolean before = agent.endsWith("~") && !agent.startsWith("~");
    String agc = agent.replace("~", "");
    if( agc.length() == 0 ) return base;
    for( int ka = 0; ka < base.length() - agc.length() + 1; ka += CODE_WIDTH ) {
      if( base.regionMatches(ka, agc, 0, agc.length()) )
        return base;
    }
    return (before ? agc + base : base + agc);
  }

  /**
   * Replace the entity kstart..kend holding a compound with a compound of
   * entities, one per member.
   * @return False if the compound is malformed.
   */
  boolean expandCompound(TokenSequence seq, int kstart, int kend) {
    List<Token> content = seq.subList(kstart + 2, kend);
    List<List<Token>> members = new ArrayList<List<Token>>();
    if( !expandMembers(new ArrayList<Token>(), content, new ArrayList<Token>(), members) )
      return false;
    if( members.isEmpty() ) return false;

    int index = seq.maxIndex(Token.COMPOUND) + 1;
    List<Token> replacement = new ArrayList<Token>();
    replacement.add(Token.open(Token.COMPOUND, index));
    for( List<Token> member : members ) {
      replacement.add(Token.open(Token.ENTITY));
      replacement.add(Token.code());
      for( Token tok : member )
        replacement.add(tok.copy());
      replacement.add(Token.close(Token.ENTITY, 0));
    }
    replacement.add(Token.close(Token.COMPOUND, index));
    log.info("Expanded compound entity into " + members.size() + " members");
    seq.replace(kstart, kend + 1, replacement);
    return true;
  }

  /**
   * Split content around its first compound.  Every noun labelled child of
   * the compound becomes one member, with pre and the words before the
   * compound in front and the words after it plus post behind.  A member
   * holding a compound of its own is split again.
   */
  private boolean expandMembers(List<Token> pre, List<Token> content, List<Token> post,
                                List<List<Token>> out) {
    int ncstart = -1;
    for( int i = 0; i < content.size() && ncstart < 0; i++ )
      if( content.get(i).isCompoundOpen() ) ncstart = i;
    if( ncstart < 0 ) {
      List<Token> member = new ArrayList<Token>(pre);
      member.addAll(content);
      member.addAll(post);
      out.add(member);
      return true;
    }
    int ncend = TokenSequence.findClose(content, ncstart);
    if( ncend < 0 ) return false;

    List<Token> before = new ArrayList<Token>(pre);
    before.addAll(content.subList(0, ncstart));
    List<Token> after = new ArrayList<Token>(content.subList(ncend + 1, content.size()));
    after.addAll(post);

    int ka = ncstart + 1;
    while( ka < ncend ) {
      Token tok = content.get(ka);
      if( tok.isOpen() && tok.labelStartsWith("N") ) {
        int mend = TokenSequence.findClose(content, ka);
        if( mend < 0 || mend > ncend ) return false;
        // a nested compound keeps its open so it is split in turn
        List<Token> inner = (tok.isCompoundOpen() ? content.subList(ka, mend + 1)
                             : content.subList(ka + 1, mend));
        if( !expandMembers(before, inner, after, out) )
          return false;
        ka = mend + 1;
      }
      else ka++;
    }
    return true;
  }
}
