package FAMin.Model;

import FAMin.FAFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class WellSpecifiedAutomatonTest {
  private static void assertNotWellSpecified(String content, String reason) throws FAException {
    FiniteAutomaton fa = FAFormat.parse(content);
    FAException e = Assertions.assertThrows(FAException.class, () -> WellSpecifiedAutomaton.of(fa), content);
    Assertions.assertEquals(FAException.Kind.NOT_WELL_SPECIFIED, e.getKind());
    Assertions.assertEquals(reason, e.getMessage());
    Assertions.assertEquals(62, e.getCode());
    Assertions.assertEquals("fa file error: not well specified: " + reason, e.format());
  }

  @Test
  void testReasons() throws FAException {
    assertNotWellSpecified("({a, b}, {'0'}, {a '0' -> a, a '0' -> b, b '0' -> b}, a, {b})", "not deterministic");
    assertNotWellSpecified("({a, b}, {'', '0'}, {a '' -> b, a '0' -> b, b '0' -> b}, a, {b})", "not deterministic");
    assertNotWellSpecified("({a, b}, {'0', '1'}, {a '0' -> b, a '1' -> b, b '0' -> b}, a, {b})", "not complete");
    assertNotWellSpecified("({a, b, c}, {'0'}, {a '0' -> b, b '0' -> b, c '0' -> b}, a, {b})",
        "states are not accessible");
    assertNotWellSpecified("({a, b, c}, {'0'}, {a '0' -> b, b '0' -> c, c '0' -> b}, a, {a})",
        "number of nonterminating states > 1");
  }

  @Test
  void testReasonOrder() throws FAException {
    // incomplete and inaccessible: completeness is checked first
    assertNotWellSpecified("({a, b, c}, {'0', '1'}, {a '0' -> b, b '0' -> b, c '0' -> b}, a, {b})", "not complete");
  }

  @Test
  void testWellSpecified() throws FAException {
    FiniteAutomaton fa = FAFormat.parse("({a, b, c}, {'0'}, {a '0' -> b, b '0' -> b, c '0' -> c}, a, {b})");
    WellSpecifiedAutomaton wsa = WellSpecifiedAutomaton.of(fa);
    Assertions.assertEquals(fa, wsa);
    Assertions.assertSame(wsa, WellSpecifiedAutomaton.of(wsa));
    Assertions.assertEquals("b", wsa.successor("a", Symbol.of('0')));
    Assertions.assertEquals("c", wsa.successor("c", Symbol.of('0')));
    Assertions.assertThrows(IllegalArgumentException.class, () -> wsa.successor("a", Symbol.of('1')));
    Assertions.assertEquals(wsa.getStates().size() * wsa.getAlphabet().size(), wsa.getRules().size());
  }

  @Test
  void testSingleState() throws FAException {
    WellSpecifiedAutomaton wsa = WellSpecifiedAutomaton.of(FAFormat.parse("({q}, {}, {}, q, {})"));
    Assertions.assertEquals(1, wsa.nonTerminatingStates().size());
  }
}
