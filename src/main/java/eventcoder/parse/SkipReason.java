package eventcoder.parse;

/**
 * Why a sentence was skipped.  The tags are stable: validation files name
 * them in their error expectations.
 */
public enum SkipReason {
  BAD_INPUT_PARSE("bad_input_parse"),
  EMPTY_NPLIST("empty_nplist"),
  BAD_FINAL_PARSE("bad_final_parse"),
  DATELINE("dateline"),
  COMMA_BALANCE("comma_balance"),
  COMPOUND_EXPANSION("compound_expansion"),
  UPPER_BOUNDS("upper_bounds"),
  LOWER_BOUNDS("lower_bounds"),
  ENTITY_BOUNDS("entity_bounds"),
  CODE_BOUNDS("code_bounds");

  private final String _tag;

  SkipReason(String tag) {
    _tag = tag;
  }

  public String tag() { return _tag; }

  public static SkipReason fromTag(String tag) {
    for( SkipReason reason : values() )
      if( reason._tag.equals(tag) ) return reason;
    return null;
  }

  public String toString() { return _tag; }
}
