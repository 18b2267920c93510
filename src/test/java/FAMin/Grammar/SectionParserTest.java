package FAMin.Grammar;

import java.util.Set;

import FAMin.Model.FAException;
import FAMin.Model.Rule;
import FAMin.Model.Symbol;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SectionParserTest {
  @Test
  void testDecodeSymbol() {
    Assertions.assertEquals(Symbol.EPSILON, SectionParser.decodeSymbol("''"));
    Assertions.assertEquals(Symbol.of('x'), SectionParser.decodeSymbol("'x'"));
    Assertions.assertEquals(Symbol.of(' '), SectionParser.decodeSymbol("' '"));
    Assertions.assertEquals(Symbol.of('\''), SectionParser.decodeSymbol("''''"));
    Assertions.assertNull(SectionParser.decodeSymbol("'''"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> SectionParser.decodeSymbol("'"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> SectionParser.decodeSymbol("'''''"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> SectionParser.decodeSymbol("'ab'"));

    // a character outside the BMP is a single symbol
    Symbol smiley = SectionParser.decodeSymbol("'\uD83D\uDE00'");
    Assertions.assertEquals(Symbol.ofCodePoint(0x1F600), smiley);
    Assertions.assertEquals(0x1F600, smiley.getCodePoint());
    Assertions.assertEquals("'\uD83D\uDE00'", smiley.toLiteral());
    Assertions.assertThrows(IllegalArgumentException.class, () -> SectionParser.decodeSymbol("'\uD83D\uDE00x'"));
  }

  @Test
  void testStates() throws FAException {
    Assertions.assertEquals(Set.of("a", "b1", "c_d", "E"), SectionParser.parseStates(" a ,b1,\n c_d , E "));
    Assertions.assertEquals(Set.of("a"), SectionParser.parseStates("a, a"));
    Assertions.assertTrue(SectionParser.parseStates("  \n ").isEmpty());
    Assertions.assertTrue(SectionParser.parseFinalStates("").isEmpty());
  }

  @Test
  void testBadStates() {
    for (String content : new String[] {"a_", "1a", "a b", "a,", ",a", "a,,b", "_a", "a-b"}) {
      FAException e = Assertions.assertThrows(FAException.class, () -> SectionParser.parseStates(content), content);
      Assertions.assertEquals(FAException.Kind.SYNTAX, e.getKind());
      Assertions.assertEquals("bad states definition", e.getMessage());
    }
    FAException e = Assertions.assertThrows(FAException.class, () -> SectionParser.parseFinalStates("a b"));
    Assertions.assertEquals("bad final states definition", e.getMessage());
  }

  @Test
  void testAlphabet() throws FAException {
    Set<Symbol> alphabet = SectionParser.parseAlphabet("'a', '', '''', ',', '}' ,'#'");
    Assertions.assertEquals(Set.of(Symbol.of('a'), Symbol.EPSILON, Symbol.of('\''), Symbol.of(','),
        Symbol.of('}'), Symbol.of('#')), alphabet);
    Assertions.assertTrue(SectionParser.parseAlphabet(" ").isEmpty());

    Assertions.assertEquals(Set.of(Symbol.ofCodePoint(0x1F600), Symbol.of('a')),
        SectionParser.parseAlphabet("'\uD83D\uDE00', 'a'"));
  }

  @Test
  void testBadAlphabet() {
    for (String content : new String[] {"a", "'a' 'b'", "'ab'", "'''''", "'", "'a',"}) {
      FAException e = Assertions.assertThrows(FAException.class, () -> SectionParser.parseAlphabet(content), content);
      Assertions.assertEquals(FAException.Kind.SYNTAX, e.getKind());
      Assertions.assertEquals("bad alphabet definition", e.getMessage());
    }
    FAException e = Assertions.assertThrows(FAException.class, () -> SectionParser.parseAlphabet("'a', '''"));
    Assertions.assertEquals("bad symbol \"'''\"", e.getMessage());
  }

  @Test
  void testRules() throws FAException {
    Set<Rule> rules = SectionParser.parseRules("a 'x' -> b,\n b'x'->b ,  a '' -> a, a '''' -> b, a 'x' -> b");
    Assertions.assertEquals(4, rules.size());
    Assertions.assertTrue(rules.contains(new Rule("a", Symbol.of('x'), "b")));
    Assertions.assertTrue(rules.contains(new Rule("b", Symbol.of('x'), "b")));
    Assertions.assertTrue(rules.contains(new Rule("a", Symbol.EPSILON, "a")));
    Assertions.assertTrue(rules.contains(new Rule("a", Symbol.of('\''), "b")));
    Assertions.assertTrue(SectionParser.parseRules("").isEmpty());
    Assertions.assertEquals(Set.of(new Rule("a", Symbol.ofCodePoint(0x1F600), "a")),
        SectionParser.parseRules("a '\uD83D\uDE00' -> a"));
  }

  @Test
  void testBadRules() {
    for (String content : new String[] {"a 'x' b", "a -> b", "a 'x' -> ", "a 'x' -> b c", "a_ 'x' -> b", "a 'x' - > b"}) {
      FAException e = Assertions.assertThrows(FAException.class, () -> SectionParser.parseRules(content), content);
      Assertions.assertEquals(FAException.Kind.SYNTAX, e.getKind());
      Assertions.assertEquals("bad rules definition", e.getMessage());
    }
    FAException e = Assertions.assertThrows(FAException.class, () -> SectionParser.parseRules("a 'x' -> b, a ''' -> b"));
    Assertions.assertEquals("in rule 'a ''' -> b' bad symbol definition \"'''\"", e.getMessage());
  }

  @Test
  void testStartState() throws FAException {
    Assertions.assertEquals("q0", SectionParser.parseStartState(" q0 "));
    FAException e = Assertions.assertThrows(FAException.class, () -> SectionParser.parseStartState("0q"));
    Assertions.assertEquals("bad start state definition", e.getMessage());
    Assertions.assertThrows(FAException.class, () -> SectionParser.parseStartState("q0 q1"));
  }
}
