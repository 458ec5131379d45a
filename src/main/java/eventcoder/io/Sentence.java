package eventcoder.io;

/**
 * One input sentence: its metadata, text and parse.
 */
public class Sentence {
  private final String _id;
  private final String _date;
  private final String _source;
  private final String _category;
  private final boolean _valid;
  private final String _place;
  private final String _text;
  private final String _parse;

  public Sentence(String id, String date, String text, String parse) {
    this(id, date, "", "", false, "", text, parse);
  }

  public Sentence(String id, String date, String source, String category, boolean valid,
                  String place, String text, String parse) {
    _id = id;
    _date = date;
    _source = source;
    _category = category;
    _valid = valid;
    _place = place;
    _text = text;
    _parse = parse;
  }

  public String id() { return _id; }
  /** YYYYMMDD or YYMMDD, or null. */
  public String date() { return _date; }
  public String source() { return _source; }
  public String category() { return _category; }
  public boolean isValid() { return _valid; }
  public String place() { return _place; }
  public String text() { return _text; }
  public String parse() { return _parse; }

  /**
   * The id up to its last underscore: sentences STORY_01, STORY_02 belong
   * to the story STORY.
   */
  public String storyId() {
    int under = _id.lastIndexOf('_');
    return (under < 0 ? _id : _id.substring(0, under));
  }

  public String toString() { return _id + " " + _text; }
}
