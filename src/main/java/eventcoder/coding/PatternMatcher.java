package eventcoder.coding;

import java.util.List;

import eventcoder.dict.PatternAtom;
import eventcoder.parse.SkipReason;


/**
 * Matches one side of a verb pattern against a context sequence.
 *
 * Atoms are compared with the sequence items in reading order.  On a
 * mismatch a blank connector lets the sequence move on and the atom is tried
 * again; an underscore fails the match.  Entity and compound markers in the
 * sequence are stepped over without using up an atom, and the control atoms
 * $ + ^ % only act while the walk is inside an entity (or, for %, a
 * compound).
 */
public class PatternMatcher {

  /** Walk state for one match attempt. */
  private static class Walk {
    final List<PatternAtom> pattern;
    final ContextSequence seq;
    int kpat = 0;
    int kseq = 0;

    Walk(List<PatternAtom> pattern, ContextSequence seq) {
      this.pattern = pattern;
      this.seq = seq;
    }

    PatternAtom atom() { return pattern.get(kpat); }
    ContextSequence.Item item() { return seq.get(kseq); }

    /** @return True when the sequence is used up. */
    boolean nextItem() {
      kseq++;
      return kseq >= seq.size();
    }

    /** @return True when the pattern is used up. */
    boolean nextAtom() {
      kpat++;
      return kpat >= pattern.size();
    }
  }

  public PatternMatcher() { }

  /**
   * Source and target locators found by control atoms are stored on the
   * context.  An entity marker that cannot be found fails the context with
   * ENTITY_BOUNDS.
   */
  public boolean match(List<PatternAtom> pattern, ContextSequence seq, CodingContext context) {
    if( pattern.isEmpty() ) return true;
    if( seq.size() == 0 ) return false;

    boolean upper = seq.isUpper();
    boolean insideNE = false;
    boolean inNEC = false;
    Walk walk = new Walk(pattern, seq);

    while( walk.kpat < pattern.size() ) {
      ContextSequence.Item item = walk.item();
      PatternAtom atom = walk.atom();

      if( item.isBoundary() ) {
        if( walk.nextItem() ) return false;
        if( item.isCompoundBoundary() ) inNEC = !inNEC;
        else insideNE = !insideNE;
      }

      else if( atom.isControl() ) {
        if( insideNE || inNEC ) {
          if( insideNE ) {
            if( atom.type() == PatternAtom.Type.SOURCE || atom.type() == PatternAtom.Type.TARGET ) {
              int kne = findEntityOpen(walk.seq, walk.kseq, upper);
              if( kne < 0 ) {
                context.fail(SkipReason.ENTITY_BOUNDS, "pattern " + pattern);
                return false;
              }
              if( atom.type() == PatternAtom.Type.SOURCE ) context.setSource(new Locator(kne, upper));
              else context.setTarget(new Locator(kne, upper));
            }
            else if( atom.type() == PatternAtom.Type.SKIP ) {
              int kfar = findFarBoundary(walk.seq, walk.kseq, upper);
              if( kfar < 0 ) {
                context.fail(SkipReason.ENTITY_BOUNDS, "pattern " + pattern);
                return false;
              }
              walk.kseq = kfar;
              insideNE = false;
            }
          }
          else if( atom.type() == PatternAtom.Type.COMPOUND ) {
            int knec = findCompoundOpen(walk.seq, walk.kseq, upper);
            if( knec < 0 ) return false;
            context.setSource(new Locator(knec, upper));
            context.setTarget(new Locator(knec, upper));
          }
          if( walk.nextAtom() ) return true;
          if( walk.nextItem() ) return false;
        }
        else if( atom.allowsGap() ) {
          if( walk.nextItem() ) return false;
        }
        else return false;
      }

      else if( atom.type() == PatternAtom.Type.SYNSET ) {
        if( synsetMatch(walk, upper) ) {
          if( walk.nextAtom() ) return true;
          if( walk.nextItem() ) return false;
        }
        else if( !atom.allowsGap() || walk.nextItem() )
          return false;
      }

      else if( !atom.text().equals(item.text()) ) {
        if( !atom.allowsGap() || walk.nextItem() )
          return false;
      }

      else {
        if( walk.nextAtom() ) return true;
        if( walk.nextItem() ) return false;
      }
    }
    return true;
  }

  /**
   * Single word members, then multi-word members; the upper sequence holds
   * a phrase in reverse.  A phrase match moves the walk to its last word.
   */
  private boolean synsetMatch(Walk walk, boolean upper) {
    ContextSequence.Item item = walk.item();
    if( item.isWord() && walk.atom().synset().containsWord(item.text()) )
      return true;

    for( String[] words : walk.atom().synset().phrases() ) {
      int matched = 0;
      while( matched < words.length && walk.kseq + matched < walk.seq.size() ) {
        ContextSequence.Item next = walk.seq.get(walk.kseq + matched);
        String word = (upper ? words[words.length - 1 - matched] : words[matched]);
        if( !next.isWord() || !word.equals(next.text()) ) break;
        matched++;
      }
      if( matched == words.length ) {
        walk.kseq += words.length - 1;
        return true;
      }
    }
    return false;
  }

  /**
   * From inside an entity, the position of its open marker: further along
   * the upper sequence, back along the lower one.
   */
  static int findEntityOpen(ContextSequence seq, int kseq, boolean upper) {
    int ka = kseq;
    while( ka >= 0 && ka < seq.size() && !seq.get(ka).isEntityOpen() )
      ka += (upper ? 1 : -1);
    return (ka >= 0 && ka < seq.size() ? ka : -1);
  }

  /**
   * From inside an entity, the marker that ends it in reading order: its
   * open in the upper sequence, its close in the lower one.
   */
  static int findFarBoundary(ContextSequence seq, int kseq, boolean upper) {
    int ka = kseq;
    while( ka >= 0 && ka < seq.size()
           && !(upper ? seq.get(ka).isEntityOpen() : seq.get(ka).isEntityClose()) )
      ka++;
    return (ka < seq.size() ? ka : -1);
  }

  static int findCompoundOpen(ContextSequence seq, int kseq, boolean upper) {
    int ka = kseq;
    while( ka >= 0 && ka < seq.size() && !seq.get(ka).isCompoundOpen() )
      ka += (upper ? 1 : -1);
    return (ka >= 0 && ka < seq.size() ? ka : -1);
  }
}
