package eventcoder.util;

import junit.framework.TestCase;

public class HandleParametersTest extends TestCase {

  public void testFlags() {
    HandleParameters params = new HandleParameters(new String[] {
        "-config", "coder.properties", "-inputs", "a.xml,b.xml", "-verbose" });
    assertTrue(params.hasFlag("-config"));
    assertTrue(params.hasFlag("config"));
    assertEquals("coder.properties", params.get("-config"));
    assertEquals("a.xml,b.xml", params.get("-inputs"));
    assertTrue(params.hasFlag("-verbose"));
    assertFalse(params.hasFlag("-validate"));
    assertNull(params.get("-validate"));
    assertEquals("coder.properties", params.properties().getProperty("config"));
  }
}
