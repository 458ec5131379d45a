package eventcoder;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import edu.stanford.nlp.util.PropertiesUtils;
import edu.stanford.nlp.util.logging.Redwood;

import eventcoder.parse.ClauseElision;


/**
 * The coder's options.  Read from a properties file whose keys follow the
 * names below; missing keys take the defaults of the eventcoder.properties
 * resource.
 */
public class CoderConfig {
  private static final Redwood.RedwoodChannels log = Redwood.channels(CoderConfig.class);

  public static final String DEFAULT_RESOURCE = "eventcoder.properties";

  public static final String DICTIONARY_DIR = "dictionary_dir";
  public static final String VERB_FILE = "verbfile_name";
  public static final String ACTOR_FILES = "actorfile_list";
  public static final String AGENT_FILE = "agentfile_name";
  public static final String DISCARD_FILE = "discardfile_name";
  public static final String ISSUE_FILE = "issuefile_name";
  public static final String TEXT_FILES = "textfile_list";
  public static final String EVENT_FILE = "eventfile_name";
  public static final String NEW_ACTOR_LENGTH = "new_actor_length";
  public static final String REQUIRE_DYAD = "require_dyad";
  public static final String STOP_ON_ERROR = "stop_on_error";
  public static final String WRITE_ACTOR_ROOT = "write_actor_root";
  public static final String WRITE_ACTOR_TEXT = "write_actor_text";

  private String _dictionaryDir = "data/dictionaries";
  private String _verbFile = "";
  private List<String> _actorFiles = new ArrayList<String>();
  private String _agentFile = "";
  private String _discardFile = "";
  private String _issueFile = "";
  private List<String> _textFiles = new ArrayList<String>();
  private String _eventFile = "events.txt";

  private int _newActorLength = 0;
  private boolean _requireDyad = true;
  private boolean _stopOnError = false;
  private boolean _writeActorRoot = false;
  private boolean _writeActorText = false;

  // clause elision ranges: initial (b), internal, terminal (e)
  private int _commaBMin = 0, _commaBMax = 0;
  private int _commaMin = 2, _commaMax = 8;
  private int _commaEMin = 0, _commaEMax = 0;


  public CoderConfig() { }

  /**
   * The options of the eventcoder.properties resource, or the built in
   * defaults if it is not on the classpath.
   */
  public static CoderConfig defaults() {
    CoderConfig config = new CoderConfig();
    InputStream in = CoderConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if( in == null ) return config;
    try {
      Properties props = new Properties();
      props.load(in);
      config.apply(props);
    } catch( IOException ex ) {
      log.warn("Could not read " + DEFAULT_RESOURCE + ": " + ex.getMessage());
    } finally {
      try { in.close(); } catch( IOException ex ) { log.warn(ex.getMessage()); }
    }
    return config;
  }

  /**
   * The defaults overridden by a properties file.
   */
  public static CoderConfig fromFile(File file) throws IOException {
    Properties props = new Properties();
    InputStream in = new FileInputStream(file);
    try {
      props.load(in);
    } finally {
      in.close();
    }
    CoderConfig config = defaults();
    config.apply(props);
    return config;
  }

  public static CoderConfig fromProperties(Properties props) {
    CoderConfig config = defaults();
    config.apply(props);
    return config;
  }

  /**
   * Set every recognized key present in props.
   * @throws IllegalArgumentException naming the key of a malformed value.
   */
  public void apply(Properties props) {
    for( String key : props.stringPropertyNames() ) {
      if( isOption(key) )
        set(key, PropertiesUtils.getString(props, key, "").trim());
    }
  }

  private static boolean isOption(String key) {
    return key.equals(DICTIONARY_DIR) || key.equals(VERB_FILE) || key.equals(ACTOR_FILES)
        || key.equals(AGENT_FILE) || key.equals(DISCARD_FILE) || key.equals(ISSUE_FILE)
        || key.equals(TEXT_FILES) || key.equals(EVENT_FILE) || key.equals(NEW_ACTOR_LENGTH)
        || key.equals(REQUIRE_DYAD) || key.equals(STOP_ON_ERROR) || key.equals(WRITE_ACTOR_ROOT)
        || key.equals(WRITE_ACTOR_TEXT) || isCommaOption(key);
  }

  private static boolean isCommaOption(String key) {
    return key.equals("comma_min") || key.equals("comma_max") || key.equals("comma_bmin")
        || key.equals("comma_bmax") || key.equals("comma_emin") || key.equals("comma_emax");
  }

  /**
   * Change one option.  Validation files use this between records.
   * @throws IllegalArgumentException if the option is unknown or the value
   *         is not of the option's type.
   */
  public void set(String key, String value) {
    if( key.equals(DICTIONARY_DIR) ) _dictionaryDir = value;
    else if( key.equals(VERB_FILE) ) _verbFile = value;
    else if( key.equals(ACTOR_FILES) ) _actorFiles = splitList(value);
    else if( key.equals(AGENT_FILE) ) _agentFile = value;
    else if( key.equals(DISCARD_FILE) ) _discardFile = value;
    else if( key.equals(ISSUE_FILE) ) _issueFile = value;
    else if( key.equals(TEXT_FILES) ) _textFiles = splitList(value);
    else if( key.equals(EVENT_FILE) ) _eventFile = value;
    else if( key.equals(NEW_ACTOR_LENGTH) ) _newActorLength = toInt(key, value);
    else if( key.equals(REQUIRE_DYAD) ) _requireDyad = toBoolean(key, value);
    else if( key.equals(STOP_ON_ERROR) ) _stopOnError = toBoolean(key, value);
    else if( key.equals(WRITE_ACTOR_ROOT) ) _writeActorRoot = toBoolean(key, value);
    else if( key.equals(WRITE_ACTOR_TEXT) ) _writeActorText = toBoolean(key, value);
    else if( key.equals("comma_min") ) _commaMin = toInt(key, value);
    else if( key.equals("comma_max") ) _commaMax = toInt(key, value);
    else if( key.equals("comma_bmin") ) _commaBMin = toInt(key, value);
    else if( key.equals("comma_bmax") ) _commaBMax = toInt(key, value);
    else if( key.equals("comma_emin") ) _commaEMin = toInt(key, value);
    else if( key.equals("comma_emax") ) _commaEMax = toInt(key, value);
    else throw new IllegalArgumentException("Unknown option " + key);
  }

  private static int toInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch( NumberFormatException ex ) {
      throw new IllegalArgumentException(key + " must be an integer: " + value);
    }
  }

  private static boolean toBoolean(String key, String value) {
    String str = value.trim().toLowerCase();
    if( str.equals("true") ) return true;
    if( str.equals("false") ) return false;
    throw new IllegalArgumentException(key + " must be true or false: " + value);
  }

  private static List<String> splitList(String value) {
    List<String> items = new ArrayList<String>();
    for( String item : value.split(",") )
      if( item.trim().length() > 0 ) items.add(item.trim());
    return items;
  }

  /**
   * A dictionary file name resolved against the dictionary directory,
   * unless it is absolute.
   */
  public File dictionaryFile(String name) {
    File file = new File(name);
    if( file.isAbsolute() || _dictionaryDir.length() == 0 ) return file;
    return new File(_dictionaryDir, name);
  }

  public ClauseElision elision() {
    return new ClauseElision(_commaBMin, _commaBMax, _commaMin, _commaMax, _commaEMin, _commaEMax);
  }

  public String dictionaryDir() { return _dictionaryDir; }
  public String verbFile() { return _verbFile; }
  public List<String> actorFiles() { return _actorFiles; }
  public String agentFile() { return _agentFile; }
  public String discardFile() { return _discardFile; }
  public String issueFile() { return _issueFile; }
  public List<String> textFiles() { return _textFiles; }
  public String eventFile() { return _eventFile; }
  public int newActorLength() { return _newActorLength; }
  public boolean requireDyad() { return _requireDyad; }
  public boolean stopOnError() { return _stopOnError; }
  public boolean writeActorRoot() { return _writeActorRoot; }
  public boolean writeActorText() { return _writeActorText; }

  public String toString() {
    return "verbs=" + _verbFile + " actors=" + _actorFiles + " agents=" + _agentFile
        + " discards=" + _discardFile + " issues=" + _issueFile
        + " comma=" + _commaBMin + "-" + _commaBMax + "/" + _commaMin + "-" + _commaMax
        + "/" + _commaEMin + "-" + _commaEMax;
  }
}
