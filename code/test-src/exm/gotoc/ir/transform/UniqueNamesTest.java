package exm.gotoc.ir.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import exm.gotoc.common.exceptions.NameCollisionExhaustedException;

public class UniqueNamesTest {

  @Test
  public void testFirstFreeSuffix() throws Exception {
    UniqueNames names = new UniqueNames(100);
    names.reserveAll(Arrays.asList("foo_bar", "foo_bar$1"));
    assertEquals("foo_bar$2", names.claim("foo_bar"));
    assertEquals("foo_bar$3", names.claim("foo_bar"));
    assertEquals("baz", names.claim("baz"));
    assertTrue(names.isUsed("foo_bar$3"));
  }

  @Test
  public void testReserve() {
    UniqueNames names = new UniqueNames(100);
    assertTrue(names.reserve("x"));
    assertFalse(names.reserve("x"));
  }

  @Test
  public void testPrefixedClaim() throws Exception {
    UniqueNames names = new UniqueNames(100);
    names.reserve("tag-u");
    assertEquals("u$1", names.claim("tag-", "u"));
    assertTrue(names.isUsed("tag-u$1"));
    // Untagged name is still free
    assertEquals("u", names.claim("u"));
  }

  @Test
  public void testExhausted() {
    UniqueNames names = new UniqueNames(2);
    names.reserveAll(Arrays.asList("n", "n$1", "n$2"));
    try {
      names.claim("n");
      throw new AssertionError("expected exhaustion");
    } catch (NameCollisionExhaustedException e) {
      assertEquals("n", e.getBaseName());
      assertEquals(3, e.getAttempts());
    }
  }
}
