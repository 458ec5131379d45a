package eventcoder.dict;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;

/**
 * Reads the significant lines of a dictionary file.  Skips blank lines,
 * lines starting with # or &lt;!, and XML comments; strips a trailing " #"
 * comment.  Keeps the current line number for warnings.
 */
public class DictionaryReader {
  private final BufferedReader _in;
  private final String _name;
  private int _lineNumber = 0;

  public DictionaryReader(Reader in, String name) {
    _in = (in instanceof BufferedReader ? (BufferedReader)in : new BufferedReader(in));
    _name = name;
  }

  public static DictionaryReader open(File file) throws FileNotFoundException {
    if( !file.exists() )
      throw new FileNotFoundException("Dictionary not found: " + file.getPath());
    try {
      return new DictionaryReader(new InputStreamReader(new FileInputStream(file), "UTF-8"), file.getName());
    } catch( java.io.UnsupportedEncodingException ex ) {
      throw new IllegalStateException(ex);
    }
  }

  public String name() { return _name; }
  public int lineNumber() { return _lineNumber; }

  /**
   * @return The next significant line without its line terminator, or null
   *         at end of file.
   */
  public String readLine() throws IOException {
    String line = next();
    while( line != null ) {
      if( line.startsWith("#") || line.startsWith("<!") || line.trim().length() == 0 ) {
        line = next();
        continue;
      }
      int hash = line.lastIndexOf(" #");
      if( hash >= 0 )
        line = line.substring(0, hash);

      int comment = line.indexOf("<!--");
      if( comment >= 0 ) {
        int end = line.indexOf("-->", comment);
        if( end >= 0 )
          line = line.substring(0, comment) + line.substring(end + 3);
        else {
          // multi-line comment: skip through its end
          while( line != null && line.indexOf("-->") < 0 )
            line = next();
          line = next();
          continue;
        }
      }
      if( line.trim().length() > 0 )
        return line;
      line = next();
    }
    return null;
  }

  private String next() throws IOException {
    String line = _in.readLine();
    if( line != null ) _lineNumber++;
    return line;
  }

  public void close() throws IOException {
    _in.close();
  }

  /** "file:line" for warnings. */
  public String where() {
    return _name + ":" + _lineNumber;
  }
}
