package wordeq.formula;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static wordeq.formula.FormulaSupport.parseConcat;
import static wordeq.formula.FormulaSupport.parsePredicate;
import static wordeq.formula.Term.mkLiteral;
import static wordeq.formula.Term.mkVar;

@Tag("formula")
@Tag("fast")
public class PredicateTest {

  @Test
  public void testTermEquality() {
    assertEquals(mkVar("x"), mkVar("x"));
    assertEquals(mkVar("x").hashCode(), mkVar("x").hashCode());
    assertNotEquals(mkVar("a"), mkLiteral("a"));
    assertTrue(mkVar("z").compareTo(mkLiteral("a")) < 0);
    assertTrue(mkVar("x1").compareTo(mkVar("x2")) < 0);
  }

  @Test
  public void testDerivedTerms() {
    final Term len = Term.mk(TermKind.LENGTH, "x");
    assertFalse(len.isVariable());
    assertFalse(len.isLiteral());
    assertTrue(len.isKind(TermKind.LENGTH));
    assertEquals("length(x)", len.toString());
    assertNotEquals(len, mkVar("x"));
    assertTrue(mkLiteral("x").compareTo(len) < 0);
    assertTrue(len.compareTo(Term.mk(TermKind.INDEX_OF, "x")) < 0);

    final Predicate eq = Predicate.mkEquation(List.of(len), parseConcat("y"));
    assertEquals(Set.of(mkVar("y")), eq.vars());
  }

  @Test
  public void testReplace() {
    final Predicate eq1 = parsePredicate("y1 'a' x1 = y1 x1 x1");
    final Predicate eq2 = parsePredicate("x1 = x2 'b'");
    final Predicate eq4 = parsePredicate("'a' x3 x4 = 'b' x1 x2");

    assertEquals(
        Optional.of(parsePredicate("y1 'a' x1 'a' x1 = y1 'a' x1 x1 x1")),
        eq1.replace(parseConcat("y1"), parseConcat("y1 'a' x1")));
    assertEquals(
        Optional.of(parsePredicate("y1 'a' = y1")), eq1.replace(parseConcat("x1"), List.of()));
    assertEquals(Optional.of(parsePredicate("'' = x2 'b'")), eq2.replace(parseConcat("x1"), List.of()));
    assertEquals(Optional.empty(), eq2.replace(parseConcat("x3"), List.of()));
    assertEquals(
        Optional.of(parsePredicate("'a' x3 x4 = 'b' x1 x1")),
        eq4.replace(parseConcat("x2"), parseConcat("x1")));
  }

  @Test
  public void testReplaceSequence() {
    final Predicate eq = parsePredicate("'a' x3 x4 'b' = x1 x1 x2");
    assertEquals(
        Optional.of(parsePredicate("'a' y1 = x1 x1 x2")),
        eq.replace(parseConcat("x3 x4 'b'"), parseConcat("y1")));
    // matches do not overlap
    assertEquals(
        Optional.of(parsePredicate("y x = y")),
        parsePredicate("x x x = x x").replace(parseConcat("x x"), parseConcat("y")));
    assertEquals(Optional.empty(), eq.replace(List.of(), parseConcat("y")));
  }

  @Test
  public void testSubstituteAndRemove() {
    final Predicate eq = parsePredicate("x 'a' y = z x");
    assertEquals(
        parsePredicate("u v 'a' y = z u v"),
        eq.substitute(Map.of(mkVar("x"), parseConcat("u v"))));
    assertEquals(parsePredicate("'a' = z"), eq.removeTerms(Set.of(mkVar("x"), mkVar("y"))));
    assertEquals(parsePredicate("x 'a' y = z x"), eq);
  }

  @Test
  public void testSides() {
    final SidedPredicate eq = parsePredicate("x 'a' x = y").asSided();
    assertEquals(parsePredicate("y = x 'a' x"), eq.switched());
    assertEquals(Set.of(mkVar("x")), eq.sideVars(SidedPredicate.Side.LEFT));
    assertTrue(eq.multipleOccurrences(SidedPredicate.Side.LEFT));
    assertFalse(eq.multipleOccurrences(SidedPredicate.Side.RIGHT));
    assertFalse(eq.isTrivial());
    assertTrue(parsePredicate("x 'a' = x 'a'").asSided().isTrivial());
  }

  @Test
  public void testParamsAreCopied() {
    final List<Term> left = new ArrayList<>(parseConcat("x 'a'"));
    final Predicate eq = Predicate.mkEquation(left, parseConcat("y"));
    left.add(mkVar("z"));
    assertEquals(parsePredicate("x 'a' = y"), eq);
    assertThrows(UnsupportedOperationException.class, () -> eq.params().get(0).add(mkVar("z")));
    assertThrows(UnsupportedOperationException.class, () -> eq.params().add(List.of()));
    assertThrows(UnsupportedOperationException.class, () -> eq.asSided().right().clear());
  }

  @Test
  public void testKinds() {
    final Predicate eq = parsePredicate("x = y");
    final Predicate ineq = parsePredicate("x != y");
    assertNotEquals(eq, ineq);
    assertTrue(eq.compareTo(ineq) < 0);
    assertEquals(ineq, Predicate.mk(PredKind.INEQUATION, ineq.params()));

    final Predicate contains =
        Predicate.mk(PredKind.CONTAINS, List.of(parseConcat("x y"), parseConcat("'ab'")));
    assertFalse(contains.isEqOrIneq());
    assertEquals(Set.of(mkVar("x"), mkVar("y")), contains.vars());
    assertEquals("contains(x y, 'ab')", contains.toString());
    assertThrows(IllegalStateException.class, contains::asSided);
  }
}
