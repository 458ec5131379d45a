package eventcoder.dict;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed inflection rules used when loading dictionaries.
 */
public class WordForms {

  /**
   * Plural of the last word of a phrase: Y becomes IES, S takes ES,
   * anything else takes S.
   */
  public static String plural(String phrase) {
    if( phrase.length() == 0 ) return phrase;
    char last = phrase.charAt(phrase.length() - 1);
    if( last == 'Y' )
      return phrase.substring(0, phrase.length() - 1) + "IES";
    else if( last == 'S' )
      return phrase + "ES";
    else
      return phrase + "S";
  }

  /**
   * Regular inflections of a verb root: +S, then +D and -E+ING for roots
   * ending in E, otherwise +ED and +ING.
   */
  public static List<String> regularVerbForms(String root) {
    List<String> forms = new ArrayList<String>();
    if( root.length() == 0 ) return forms;
    forms.add(root + "S");
    if( root.endsWith("E") ) {
      forms.add(root + "D");
      forms.add(root.substring(0, root.length() - 1) + "ING");
    } else {
      forms.add(root + "ED");
      forms.add(root + "ING");
    }
    return forms;
  }
}
