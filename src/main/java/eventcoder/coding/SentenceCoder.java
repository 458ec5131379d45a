package eventcoder.coding;

import java.util.ArrayList;

import edu.stanford.nlp.stats.ClassicCounter;
import edu.stanford.nlp.stats.Counter;
import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.CoderConfig;
import eventcoder.dict.DateException;
import eventcoder.dict.Dictionaries;
import eventcoder.dict.DiscardList;
import eventcoder.dict.OrdinalDate;
import eventcoder.io.Sentence;
import eventcoder.parse.Outcome;
import eventcoder.parse.SkipReason;
import eventcoder.parse.TokenSequence;
import eventcoder.parse.TreeNormalizer;


/**
 * Codes one sentence: discard check, parse normalization, clause elision,
 * entity resolution, verb patterns, and the issues of a sentence that
 * produced events.
 */
public class SentenceCoder {
  private static final Redwood.RedwoodChannels log = Redwood.channels(SentenceCoder.class);

  private final Dictionaries _dicts;
  private final CoderConfig _config;
  private final TreeNormalizer _normalizer = new TreeNormalizer();
  private final EntityResolver _resolver;
  private final VerbPatternEngine _engine;

  /**
   * @param config Read at every sentence, so changes apply to the next one.
   */
  public SentenceCoder(Dictionaries dicts, CoderConfig config) {
    _dicts = dicts;
    _config = config;
    _resolver = new EntityResolver(dicts.actors(), dicts.agents());
    _engine = new VerbPatternEngine(dicts.verbs());
  }

  public CoderConfig config() { return _config; }

  public SentenceResult code(Sentence sentence) {
    String id = sentence.id();
    DiscardList.Match discard = _dicts.discards().check(sentence.text() == null ? "" : sentence.text());
    if( discard.kind != DiscardList.Kind.NONE ) {
      log.info(id + ": " + discard.kind.toString().toLowerCase() + " discard " + discard.phrase);
      return SentenceResult.discarded(id, discard);
    }

    Outcome<TokenSequence> parsed = _normalizer.normalize(sentence.parse());
    if( !parsed.ok() ) {
      log.warn(id + ": " + parsed.reason().tag());
      return SentenceResult.skipped(id, parsed.reason());
    }
    TokenSequence seq = parsed.value();

    SkipReason elided = _config.elision().elide(seq);
    if( elided != null ) {
      log.warn(id + ": " + elided.tag());
      return SentenceResult.skipped(id, elided);
    }

    CodingContext context = new CodingContext(id, ordinalDate(sentence), seq, _config);
    _resolver.resolve(context);
    if( !context.failed() )
      _engine.codeVerbs(context);
    if( context.failed() )
      return SentenceResult.skipped(id, context.failure());

    Counter<String> issues = new ClassicCounter<String>();
    if( !context.events().isEmpty() && _dicts.issues() != null )
      issues = _dicts.issues().findIssues(sentence.text());
    return SentenceResult.coded(id, new ArrayList<CodedEvent>(context.events()), issues);
  }

  /**
   * @return The sentence date as a day ordinal, or null if it is missing or
   *         unreadable; then only unconditional actor codes apply.
   */
  private static Integer ordinalDate(Sentence sentence) {
    if( sentence.date() == null || sentence.date().length() == 0 ) {
      log.warn(sentence.id() + ": no date");
      return null;
    }
    try {
      return OrdinalDate.parse(sentence.date());
    } catch( DateException ex ) {
      log.warn(sentence.id() + ": unreadable date " + ex.getMessage());
      return null;
    }
  }
}
