package eventcoder.coding;

import java.util.List;

import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.dict.MultiWordVerb;
import eventcoder.dict.VerbDictionary;
import eventcoder.dict.VerbEntry;
import eventcoder.dict.VerbPattern;
import eventcoder.parse.SkipReason;
import eventcoder.parse.Token;
import eventcoder.parse.TokenSequence;


/**
 * Finds the verb phrases of a sentence and codes each one whose verb is in
 * the dictionary.
 *
 * For every (VP (VB... the effective verb is looked up, its multi-word
 * continuations are tried first, and the patterns of the primary entry are
 * matched in file order against the context on both sides of the verb.  The
 * first pattern matching both sides gives the event code; otherwise the
 * entry's default code applies.  Source and target not set by the pattern
 * are filled in by position.
 */
public class VerbPatternEngine {
  private static final Redwood.RedwoodChannels log = Redwood.channels(VerbPatternEngine.class);

  private final VerbDictionary _verbs;
  private final PatternMatcher _matcher;
  private final EventAssembler _assembler;

  public VerbPatternEngine(VerbDictionary verbs) {
    this(verbs, new PatternMatcher(), new EventAssembler());
  }

  public VerbPatternEngine(VerbDictionary verbs, PatternMatcher matcher, EventAssembler assembler) {
    _verbs = verbs;
    _matcher = matcher;
    _assembler = assembler;
  }

  public void codeVerbs(CodingContext context) {
    TokenSequence seq = context.sequence();
    int kitem = TokenSequence.PARSE_START;
    while( kitem < seq.size() ) {
      if( seq.get(kitem).isOpen("VP") && kitem + 2 < seq.size()
          && seq.get(kitem + 1).isOpen() && seq.get(kitem + 1).labelStartsWith("VB") ) {
        int vpEnd = seq.findClose(kitem);
        if( vpEnd < 0 ) {
          log.warn(context.sentenceId() + ": no end for verb phrase at " + kitem + "; skipped");
          kitem++;
          continue;
        }
        int verb = kitem + 2;
        int passive = passiveVerb(seq, kitem, vpEnd);
        if( passive > 0 ) verb = passive;

        boolean matched = false;
        if( seq.get(verb).isWord() )
          matched = codeVerb(context, verb, vpEnd, passive > 0);
        if( context.failed() ) return;

        if( matched ) kitem = vpEnd;
        else if( passive > 0 ) kitem = verb - 2;
      }
      kitem++;
    }
  }

  /**
   * A verb phrase is passive when a past participle is followed by BY and an
   * earlier verb in the phrase is preceded by WAS, IS or BEEN.
   * @return The position of the participle, or 0.
   */
  static int passiveVerb(TokenSequence seq, int kvp, int vpEnd) {
    boolean hasParticiple = false;
    for( int i = kvp + 3; i < vpEnd && !hasParticiple; i++ )
      if( seq.get(i).isOpen("VBN") ) hasParticiple = true;
    if( !hasParticiple ) return 0;

    int ppv = -1;
    for( int i = kvp + 3; i < vpEnd && ppv < 0; i++ )
      if( seq.get(i).isClose("VBN") ) ppv = i;
    if( ppv < 0 ) return 0;

    boolean hasBy = false;
    for( int i = ppv + 3; i < vpEnd && !hasBy; i++ )
      if( seq.get(i).isWord() && "BY".equals(seq.get(i).text()) ) hasBy = true;
    if( !hasBy ) return 0;

    for( int ka = ppv - 3; ka > kvp; ka-- ) {
      Token tok = seq.get(ka);
      if( tok.isClose() && tok.labelStartsWith("VB") && seq.get(ka - 1).isWord() ) {
        String aux = seq.get(ka - 1).text();
        if( aux.equals("WAS") || aux.equals("IS") || aux.equals("BEEN") )
          return ppv - 1;
      }
    }
    return 0;
  }

  /**
   * @return True if the verb produced an event code.
   */
  private boolean codeVerb(CodingContext context, int verb, int vpEnd, boolean passive) {
    String word = context.sequence().get(verb).text();
    VerbEntry entry = _verbs.get(word);
    if( entry == null ) return false;
    context.resetLocators();
    context.setPassive(passive);

    VerbEntry primary = null;
    String verbCode = null;
    for( MultiWordVerb multi : entry.multiWords() ) {
      if( multiWordSequences(context, multi, verb, vpEnd) ) {
        primary = _verbs.primary(multi.target());
        verbCode = multi.code();
        break;
      }
      if( context.failed() ) return false;
    }
    if( verbCode == null ) {
      buildSequences(context, verb - 1, verb + 1, vpEnd);
      primary = (entry.isPrimary() ? entry : _verbs.primary(entry.target()));
      verbCode = entry.code();
    }
    if( context.failed() ) return false;

    String eventCode = null;
    if( primary != null ) {
      for( VerbPattern pattern : primary.patterns() ) {
        context.resetLocators();
        if( _matcher.match(pattern.upper(), context.upper(), context)
            && _matcher.match(pattern.lower(), context.lower(), context) ) {
          eventCode = pattern.code();
          break;
        }
        if( context.failed() ) return false;
      }
    }
    else log.warn(context.sentenceId() + ": no primary entry for " + word);

    if( Token.NULL_CODE.equals(eventCode) )
      eventCode = null;
    if( eventCode == null && verbCode != null && !Token.NULL_CODE.equals(verbCode) ) {
      context.resetLocators();
      eventCode = verbCode;
    }
    if( eventCode == null ) return false;

    if( context.source() == null )
      findSource(context);
    if( context.source() != null ) {
      if( context.target() == null )
        findTarget(context);
      if( context.target() != null )
        _assembler.assemble(context, eventCode);
    }
    return true;
  }

  /**
   * If the continuation's words sit next to the verb, build the context
   * sequences around verb and words.
   */
  private boolean multiWordSequences(CodingContext context, MultiWordVerb multi, int verb, int vpEnd) {
    TokenSequence seq = context.sequence();
    List<String> words = multi.words();
    int step = (multi.after() ? 1 : -1);
    int kword = verb + step;
    int matched = 0;
    while( matched < words.size() ) {
      if( kword < 0 || kword >= seq.size() )
        return false;
      Token tok = seq.get(kword);
      if( tok.isWord() ) {
        if( !tok.text().equals(words.get(matched)) )
          return false;
        matched++;
      }
      kword += step;
    }
    if( multi.after() )
      buildSequences(context, verb - 1, kword, vpEnd);
    else
      buildSequences(context, kword, verb + 1, vpEnd);
    return true;
  }

  private void buildSequences(CodingContext context, int upperStart, int lowerStart, int vpEnd) {
    ContextSequence upper = upperSequence(context, upperStart);
    if( upper == null ) return;
    ContextSequence lower = lowerSequence(context, lowerStart, vpEnd);
    if( lower == null ) return;
    context.setSequences(upper, lower);
  }

  /**
   * What precedes the verb, read backward to the start of the parse or the
   * nearest comma.
   */
  ContextSequence upperSequence(CodingContext context, int kword) {
    TokenSequence seq = context.sequence();
    ContextSequence upper = new ContextSequence(true);
    if( kword >= seq.size() ) {
      context.fail(SkipReason.UPPER_BOUNDS, "upper sequence from " + kword);
      return null;
    }
    for( int ka = kword; ka >= TokenSequence.PARSE_START; ka-- ) {
      Token tok = seq.get(ka);
      if( tok.isClose(",") ) break;
      addItem(upper, seq, ka);
    }
    return upper;
  }

  /**
   * What follows the verb up to the end of its verb phrase.
   */
  ContextSequence lowerSequence(CodingContext context, int kword, int vpEnd) {
    TokenSequence seq = context.sequence();
    ContextSequence lower = new ContextSequence(false);
    for( int ka = kword; ka != vpEnd; ka++ ) {
      if( ka >= seq.size() || ka > vpEnd ) {
        context.fail(SkipReason.LOWER_BOUNDS, "lower sequence from " + kword);
        return null;
      }
      addItem(lower, seq, ka);
    }
    return lower;
  }

  private static void addItem(ContextSequence cseq, TokenSequence seq, int ka) {
    Token tok = seq.get(ka);
    if( tok.isEntityOpen() ) {
      Token code = (ka + 1 < seq.size() && seq.get(ka + 1).isCode() ? seq.get(ka + 1) : null);
      cseq.addEntityOpen(code, ka);
    }
    else if( tok.isEntityClose() ) cseq.addMarker(ContextSequence.Kind.ENTITY_CLOSE, ka);
    else if( tok.isCompoundOpen() ) cseq.addMarker(ContextSequence.Kind.COMPOUND_OPEN, ka);
    else if( tok.isCompoundClose() ) cseq.addMarker(ContextSequence.Kind.COMPOUND_CLOSE, ka);
    else if( tok.isWord() ) cseq.addWord(tok.text(), ka);
  }

  /**
   * The first coded entity or compound of the upper sequence in sentence
   * order, else its first entity.
   */
  static void findSource(CodingContext context) {
    ContextSequence upper = context.upper();
    for( int k = upper.size() - 1; k >= 0; k-- ) {
      ContextSequence.Item item = upper.get(k);
      if( item.isCompoundOpen() || (item.isEntityOpen() && item.isResolved()) ) {
        context.setSource(new Locator(k, true));
        return;
      }
    }
    for( int k = upper.size() - 1; k >= 0; k-- ) {
      if( upper.get(k).isEntityOpen() ) {
        context.setSource(new Locator(k, true));
        return;
      }
    }
  }

  /**
   * In order: a coded entity of the lower sequence whose code differs from
   * a single source code, an uncoded entity of the lower sequence, a coded
   * entity of the upper sequence outward from the verb with a different
   * code, an uncoded entity of the upper sequence other than the source.
   * Compounds count as coded.
   */
  void findTarget(CodingContext context) {
    List<EventAssembler.ActorRef> sourceCodes = _assembler.codes(context, context.source());
    if( context.failed() ) return;
    String sourceCode = (sourceCodes.size() == 1 ? sourceCodes.get(0).code : null);

    ContextSequence lower = context.lower();
    for( int k = 0; k < lower.size(); k++ ) {
      if( isCodedCandidate(lower.get(k), sourceCode) ) {
        context.setTarget(new Locator(k, false));
        return;
      }
    }
    for( int k = 0; k < lower.size(); k++ ) {
      if( lower.get(k).isEntityOpen() && !lower.get(k).isResolved() ) {
        context.setTarget(new Locator(k, false));
        return;
      }
    }

    ContextSequence upper = context.upper();
    for( int k = 0; k < upper.size(); k++ ) {
      if( isCodedCandidate(upper.get(k), sourceCode) ) {
        context.setTarget(new Locator(k, true));
        return;
      }
    }
    Locator source = context.source();
    for( int k = 0; k < upper.size(); k++ ) {
      if( upper.get(k).isEntityOpen() && !upper.get(k).isResolved()
          && !(source.inUpper() && source.index() == k) ) {
        context.setTarget(new Locator(k, true));
        return;
      }
    }
  }

  private static boolean isCodedCandidate(ContextSequence.Item item, String sourceCode) {
    if( item.isCompoundOpen() ) return true;
    return item.isEntityOpen() && item.isResolved() && !item.code().equals(sourceCode);
  }
}
