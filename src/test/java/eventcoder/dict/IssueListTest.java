package eventcoder.dict;

import java.io.StringReader;
import java.util.List;

import edu.stanford.nlp.stats.Counter;

import junit.framework.TestCase;

public class IssueListTest extends TestCase {
  private IssueList _list;

  public void setUp() throws Exception {
    _list = IssueList.fromReader(new StringReader(
        "NUCLEAR+WEAPON [NUC]\nN:REFUGEE [REF]\nV:SMUGGLE ARMS [ARM]\n~REFUGEE CAMP\nNO CODE HERE\n"), "issues");
  }

  public void testExpansions() {
    List<String> forms = IssueList.expand("NUCLEAR+WEAPON");
    assertTrue(forms.contains("NUCLEAR WEAPON"));
    assertTrue(forms.contains("NUCLEAR-WEAPON"));

    forms = IssueList.expand("N:REFUGEE");
    assertEquals(2, forms.size());
    assertTrue(forms.contains("REFUGEES"));

    forms = IssueList.expand("V:SMUGGLE ARMS");
    assertTrue(forms.contains("SMUGGLE ARMS"));
    assertTrue(forms.contains("SMUGGLED ARMS"));
    assertTrue(forms.contains("SMUGGLING ARMS"));
  }

  public void testNounPlurals() {
    assertEquals("REFUGEES", IssueList.plural("REFUGEE"));
    assertEquals("MILITIES", IssueList.plural("MILITY"));
    assertEquals("VIRUSS", IssueList.plural("VIRUS"));
    assertTrue(IssueList.expand("N:VIRUS OUTBREAK").contains("VIRUSS OUTBREAK"));
  }

  public void testCounts() {
    Counter<String> issues = _list.findIssues("Refugees fled the nuclear-weapon site as refugees do");
    assertEquals(1.0, issues.getCount("REF"), 0.0);
    assertEquals(1.0, issues.getCount("NUC"), 0.0);
    assertEquals(0.0, issues.getCount("ARM"), 0.0);
  }

  public void testPhraseAtEdges() {
    assertEquals(1.0, _list.findIssues("Smuggled arms").getCount("ARM"), 0.0);
  }

  public void testIgnorePhrase() {
    assertEquals(0, _list.findIssues("Nuclear weapon found near the refugee camp today").size());
  }

  public void testLineWithoutCodeSkipped() {
    assertEquals(8, _list.size());
  }
}
