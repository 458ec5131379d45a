package eventcoder.coding;

import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.CoderConfig;
import eventcoder.parse.SkipReason;
import eventcoder.parse.Token;


/**
 * Turns the source and target locators of a matched verb into events.
 *
 * Each side yields a list of codes: one per member of a compound, with
 * slash codes A/B split in two.  Events are the cross product of the lists,
 * minus pairs with the same code.  A symmetric event code A:B gives source x
 * target with A and target x source with B.  Passive sentences swap the two
 * sides of every pair.
 */
public class EventAssembler {
  private static final Redwood.RedwoodChannels log = Redwood.channels(EventAssembler.class);

  /** One code of one side with its annotations. */
  static class ActorRef {
    final String code;
    final String root;
    final String text;

    ActorRef(String code, String root, String text) {
      this.code = code;
      this.root = root;
      this.text = text;
    }

    public String toString() { return code; }
  }

  public EventAssembler() { }

  /**
   * Add the events for one verb match to the context.
   */
  public void assemble(CodingContext context, String eventCode) {
    List<ActorRef> sources = expandSlashes(codes(context, context.source()));
    if( context.failed() ) return;
    List<ActorRef> targets = expandSlashes(codes(context, context.target()));
    if( context.failed() ) return;

    if( sources.isEmpty() || targets.isEmpty() ) {
      log.warn(context.sentenceId() + ": empty codes for event " + eventCode);
      return;
    }

    List<CodedEvent> made = new ArrayList<CodedEvent>();
    int colon = eventCode.indexOf(':');
    if( colon >= 0 ) {
      if( Token.NULL_CODE.equals(sources.get(0).code) || Token.NULL_CODE.equals(targets.get(0).code) ) {
        if( Token.NULL_CODE.equals(targets.get(0).code) ) targets = sources;
        else sources = targets;
      }
      makeEvents(context, sources, targets, eventCode.substring(0, colon), made);
      makeEvents(context, targets, sources, eventCode.substring(colon + 1), made);
    }
    else makeEvents(context, sources, targets, eventCode, made);

    for( CodedEvent event : made ) {
      if( context.config().requireDyad() && event.isPartial() )
        continue;
      context.addEvent(event);
    }
  }

  private void makeEvents(CodingContext context, List<ActorRef> sources, List<ActorRef> targets,
                          String eventCode, List<CodedEvent> out) {
    CoderConfig config = context.config();
    for( ActorRef src : sources ) {
      for( ActorRef tar : targets ) {
        if( src.code.equals(tar.code) ) continue;
        ActorRef first = (context.isPassive() ? tar : src);
        ActorRef second = (context.isPassive() ? src : tar);
        out.add(new CodedEvent(first.code, second.code, eventCode,
                               config.writeActorRoot() ? first.root : null,
                               config.writeActorRoot() ? second.root : null,
                               config.writeActorText() ? first.text : null,
                               config.writeActorText() ? second.text : null));
      }
    }
  }

  /**
   * The codes at a locator: every member of a compound, or the single
   * entity.  Unresolved entities give "---", or their quoted words when
   * new_actor_length allows.  Never empty unless the context failed.
   */
  public List<ActorRef> codes(CodingContext context, Locator loc) {
    List<ActorRef> codes = new ArrayList<ActorRef>();
    ContextSequence seq = context.sequence(loc);
    if( loc.index() < 0 || loc.index() >= seq.size() ) {
      context.fail(SkipReason.CODE_BOUNDS, "locator " + loc);
      return codes;
    }

    if( seq.get(loc.index()).isCompoundOpen() ) {
      int step = (seq.isUpper() ? -1 : 1);
      int ka = loc.index() + step;
      while( true ) {
        if( ka < 0 || ka >= seq.size() ) {
          context.fail(SkipReason.CODE_BOUNDS, "compound at " + loc);
          return codes;
        }
        if( seq.get(ka).isCompoundClose() ) break;
        if( seq.get(ka).isEntityOpen() )
          addCode(context, seq, ka, codes);
        ka += step;
      }
    }
    else addCode(context, seq, loc.index(), codes);

    if( codes.isEmpty() )
      codes.add(new ActorRef(Token.NULL_CODE, null, null));
    return codes;
  }

  private void addCode(CodingContext context, ContextSequence seq, int kne, List<ActorRef> codes) {
    ContextSequence.Item item = seq.get(kne);
    String text = join(seq.entityWords(kne));
    if( item.isResolved() )
      codes.add(new ActorRef(item.code(), item.root(), text));
    else {
      int maxWords = context.config().newActorLength();
      if( maxWords > 0 ) {
        String quoted = "\"" + text + "\"";
        if( countSpaces(quoted) < maxWords )
          codes.add(new ActorRef(quoted, Token.NULL_CODE, text));
        else
          codes.add(new ActorRef(Token.NULL_CODE, Token.NULL_CODE, text));
      }
    }
  }

  /**
   * Codes of the form A/B become two entries, in order.
   */
  static List<ActorRef> expandSlashes(List<ActorRef> codes) {
    List<ActorRef> expanded = new ArrayList<ActorRef>();
    for( ActorRef ref : codes ) {
      if( ref.code.indexOf('/') < 0 || ref.code.startsWith("\"") )
        expanded.add(ref);
      else {
        for( String part : ref.code.split("/") )
          if( part.length() > 0 ) expanded.add(new ActorRef(part, ref.root, ref.text));
      }
    }
    return expanded;
  }

  private static int countSpaces(String str) {
    int n = 0;
    for( int i = 0; i < str.length(); i++ )
      if( str.charAt(i) == ' ' ) n++;
    return n;
  }

  private static String join(List<String> words) {
    StringBuffer buf = new StringBuffer();
    for( String word : words ) {
      if( buf.length() > 0 ) buf.append(' ');
      buf.append(word);
    }
    return buf.toString();
  }
}
