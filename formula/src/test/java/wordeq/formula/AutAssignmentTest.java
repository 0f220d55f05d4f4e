package wordeq.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import wordeq.formula.automata.BricsNfaFactory;
import wordeq.formula.automata.NfaFactory;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static wordeq.formula.FormulaSupport.parseConcat;
import static wordeq.formula.Term.mkVar;

@Tag("automata")
@Tag("fast")
public class AutAssignmentTest {
  private NfaFactory factory;
  private AutAssignment autAss;

  private final Term x = mkVar("x"), y = mkVar("y"), z = mkVar("z");

  @BeforeEach
  public void setUp() {
    factory = new BricsNfaFactory("ab");
    autAss = new AutAssignment(factory);
  }

  @Test
  public void testUnassigned() {
    final UnassignedVariableException ex =
        assertThrows(UnassignedVariableException.class, () -> autAss.at(x));
    assertEquals(x, ex.var());
    autAss.put(y, factory.anyWord());
    assertThrows(UnassignedVariableException.class, () -> autAss.languageOfConcat(parseConcat("y x")));
  }

  @Test
  public void testLanguageOfConcat() {
    autAss.put(x, factory.fromRegex("a*"));
    autAss.put(y, factory.fromRegex("b"));
    final var lang = autAss.languageOfConcat(parseConcat("x 'ba' y"));
    assertTrue(lang.accepts("bab"));
    assertTrue(lang.accepts("aabab"));
    assertFalse(lang.accepts("ab"));
    assertTrue(autAss.languageOfConcat(parseConcat("")).isEquivalent(factory.epsilon()));
  }

  @Test
  public void testEpsilonAndSingleton() {
    autAss.put(x, factory.epsilon());
    autAss.put(y, factory.fromRegex("ab|ab"));
    autAss.put(z, factory.fromRegex("a*"));
    assertTrue(autAss.isEpsilonOnly(x));
    assertTrue(autAss.isSingleton(x));
    assertEquals(Optional.of(""), autAss.singletonWord(x));
    assertFalse(autAss.isEpsilonOnly(y));
    assertEquals(Optional.of("ab"), autAss.singletonWord(y));
    assertFalse(autAss.isEpsilonOnly(z));
    assertFalse(autAss.isSingleton(z));

    autAss.restrict(z, factory.fromRegex("b*"));
    assertTrue(autAss.isEpsilonOnly(z));
  }

  @Test
  public void testCoFinite() {
    autAss.put(x, factory.word("ab").complement());
    autAss.put(y, factory.anyWord());
    autAss.put(z, factory.fromRegex("a*"));
    assertTrue(autAss.isCoFinite(x));
    assertFalse(autAss.isLengthOnly(x));
    assertTrue(autAss.isCoFinite(y));
    assertTrue(autAss.isUniversal(y));
    assertFalse(autAss.isCoFinite(z));

    autAss.put(x, factory.anyWordOfLengthAtLeast(2));
    assertTrue(autAss.isCoFinite(x));
    assertTrue(autAss.isLengthOnly(x));
    assertFalse(autAss.isUniversal(x));
  }

  @Test
  public void testSatisfiableAndMerge() {
    autAss.put(x, factory.fromRegex("a+"));
    assertTrue(autAss.isSatisfiable());

    final AutAssignment other = new AutAssignment(factory);
    other.put(x, factory.empty());
    other.put(y, factory.fromRegex("b"));
    autAss.merge(other);
    assertTrue(autAss.isSatisfiable());
    assertTrue(autAss.at(x).accepts("aa"));
    assertSame(other.at(y), autAss.at(y));

    other.merge(autAss);
    assertFalse(other.isSatisfiable());
  }

  @Test
  public void testCopyIsIndependent() {
    autAss.put(x, factory.anyWord());
    final AutAssignment copy = autAss.copy();
    copy.restrict(x, factory.fromRegex("a"));
    copy.put(y, factory.epsilon());
    assertTrue(autAss.isUniversal(x));
    assertFalse(autAss.contains(y));
    assertEquals(2, copy.size());
  }
}
