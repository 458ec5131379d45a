package eventcoder.dict;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.CoderConfig;


/**
 * The tables the coder reads.  Built once and never changed afterwards.
 */
public class Dictionaries {
  private static final Redwood.RedwoodChannels log = Redwood.channels(Dictionaries.class);

  private final VerbDictionary _verbs;
  private final ActorDictionary _actors;
  private final AgentDictionary _agents;
  private final DiscardList _discards;
  private final IssueList _issues;

  /**
   * @param discards May be null.
   * @param issues May be null.
   */
  public Dictionaries(VerbDictionary verbs, ActorDictionary actors, AgentDictionary agents,
                      DiscardList discards, IssueList issues) {
    _verbs = verbs;
    _actors = actors;
    _agents = agents;
    _discards = (discards == null ? new DiscardList() : discards);
    _issues = issues;
  }

  /**
   * Read the files named by the configuration.  The verb, actor and agent
   * dictionaries are required.
   * @throws FileNotFoundException if a required dictionary is not named or
   *         does not exist.
   */
  public static Dictionaries load(CoderConfig config) throws IOException {
    if( config.verbFile().length() == 0 )
      throw new FileNotFoundException("No verb dictionary given (" + CoderConfig.VERB_FILE + ")");
    if( config.actorFiles().isEmpty() )
      throw new FileNotFoundException("No actor dictionary given (" + CoderConfig.ACTOR_FILES + ")");
    if( config.agentFile().length() == 0 )
      throw new FileNotFoundException("No agent dictionary given (" + CoderConfig.AGENT_FILE + ")");

    VerbDictionary verbs = VerbDictionary.fromFile(config.dictionaryFile(config.verbFile()));
    List<File> actorFiles = new ArrayList<File>();
    for( String name : config.actorFiles() )
      actorFiles.add(config.dictionaryFile(name));
    ActorDictionary actors = ActorDictionary.fromFiles(actorFiles);
    AgentDictionary agents = AgentDictionary.fromFile(config.dictionaryFile(config.agentFile()));

    DiscardList discards = null;
    if( config.discardFile().length() > 0 )
      discards = DiscardList.fromFile(config.dictionaryFile(config.discardFile()));
    IssueList issues = null;
    if( config.issueFile().length() > 0 )
      issues = IssueList.fromFile(config.dictionaryFile(config.issueFile()));

    log.info("Loaded " + verbs.size() + " verb forms, " + verbs.numPatterns() + " patterns, "
             + actors.numActors() + " actors");
    return new Dictionaries(verbs, actors, agents, discards, issues);
  }

  public VerbDictionary verbs() { return _verbs; }
  public ActorDictionary actors() { return _actors; }
  public AgentDictionary agents() { return _agents; }
  public DiscardList discards() { return _discards; }
  /** Null when no issue list was loaded. */
  public IssueList issues() { return _issues; }
}
