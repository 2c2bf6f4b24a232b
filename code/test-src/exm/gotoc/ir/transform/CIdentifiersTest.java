package exm.gotoc.ir.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class CIdentifiersTest {

  @Test
  public void testIdentifiers() {
    assertTrue(CIdentifiers.isIdentifier("foo_bar"));
    assertTrue(CIdentifiers.isIdentifier("_x1"));
    assertTrue(CIdentifiers.isIdentifier("foo$2"));
    assertFalse(CIdentifiers.isIdentifier(""));
    assertFalse(CIdentifiers.isIdentifier("1abc"));
    assertFalse(CIdentifiers.isIdentifier("x::y"));
    assertFalse(CIdentifiers.isIdentifier("while"));
  }

  @Test
  public void testLegalNames() {
    assertTrue(CIdentifiers.isLegalName("tag-pair"));
    assertFalse(CIdentifiers.isLegalName("tag-a::b"));
    assertFalse(CIdentifiers.isLegalName("pair-tag"));
  }

  @Test
  public void testSanitize() {
    assertEquals("foo_bar", CIdentifiers.sanitize("foo:bar"));
    assertEquals("x__y_i32_", CIdentifiers.sanitize("x::y<i32>"));
    assertEquals("_1st", CIdentifiers.sanitize("1st"));
    assertEquals("_", CIdentifiers.sanitize(""));
    assertEquals("int_", CIdentifiers.sanitize("int"));
    assertEquals("a_b", CIdentifiers.sanitize("a.b"));
  }

  @Test
  public void testHeaderNamesReserved() {
    String[] names = {"bool", "true", "false", "NULL", "size_t", "int32_t",
                      "uint64_t"};
    for (String name: names) {
      assertFalse(name, CIdentifiers.isIdentifier(name));
      assertEquals(name + "_", CIdentifiers.sanitize(name));
    }
  }

  @Test
  public void testSanitizeIsLegal() {
    String[] names = {"std::fmt::Display", "<T as Trait>::f", "9", "",
                      "return", "{{closure}}", "a-b", "ü"};
    for (String name: names) {
      assertTrue(name, CIdentifiers.isIdentifier(
                          CIdentifiers.sanitize(name)));
    }
  }
}
