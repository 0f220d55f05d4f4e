package wordeq.formula.automata;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("automata")
@Tag("fast")
public class BricsNfaTest {
  private final NfaFactory factory = new BricsNfaFactory("ab");

  @Test
  public void testComplementStaysInAlphabet() {
    final Nfa notA = factory.word("a").complement();
    assertTrue(notA.accepts(""));
    assertTrue(notA.accepts("b"));
    assertFalse(notA.accepts("a"));
    assertFalse(notA.accepts("c"));
    assertTrue(notA.complement().isEquivalent(factory.word("a")));
    assertFalse(factory.fromRegex("c").accepts("c"));
  }

  @Test
  public void testUniversal() {
    assertTrue(factory.anyWord().isUniversal());
    assertTrue(factory.fromRegex("(a|b)*").isUniversal());
    assertFalse(factory.fromRegex("a*").isUniversal());
    assertTrue(factory.anyWordOfLengthAtLeast(0).isEquivalent(factory.anyWord()));
  }

  @Test
  public void testWordLengthBounds() {
    assertEquals(-1, factory.empty().shortestWordLength());
    assertEquals(2, factory.fromRegex("ab|bab").shortestWordLength());
    assertEquals(3, factory.fromRegex("ab|bab").longestWordLength());
    assertEquals(0, factory.epsilon().longestWordLength());
    assertThrows(IllegalStateException.class, () -> factory.fromRegex("a*").longestWordLength());
  }

  @Test
  public void testSingletonWord() {
    assertEquals(Optional.of("ab"), factory.fromRegex("ab").singletonWord());
    assertEquals(Optional.of("ab"), factory.fromRegex("a*b").intersection(factory.fromRegex("..")).singletonWord());
    assertEquals(Optional.empty(), factory.fromRegex("ab|b").singletonWord());
    assertEquals(Optional.empty(), factory.empty().singletonWord());
  }

  @Test
  public void testWordLengths() {
    assertEquals(List.of(Pair.of(2, 0)), factory.fromRegex("ab|ba").wordLengths());
    assertEquals(List.of(Pair.of(1, 2)), factory.fromRegex("a(aa)*").wordLengths());
    assertEquals(List.of(Pair.of(0, 0), Pair.of(3, 1)), factory.fromRegex("()|bbb+").wordLengths());
    assertEquals(List.of(), factory.empty().wordLengths());
    assertEquals(
        List.of(Pair.of(2, 1)), factory.anyWordOfLengthAtLeast(2).wordLengths());
  }
}
