package wordeq.formula;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static wordeq.formula.Term.mkLiteral;
import static wordeq.formula.Term.mkVar;

@Tag("formula")
@Tag("fast")
public class FormulaSupportTest {

  @Test
  public void testParseEquation() {
    final Predicate pred = FormulaSupport.parsePredicate("x1 'ab' x2 = y");
    assertTrue(pred.isEquation());
    assertEquals(List.of(mkVar("x1"), mkLiteral("ab"), mkVar("x2")), pred.asSided().left());
    assertEquals(List.of(mkVar("y")), pred.asSided().right());
    assertEquals("x1 'ab' x2 = y", pred.toString());
  }

  @Test
  public void testParseInequationWithEmptySide() {
    final Predicate pred = FormulaSupport.parsePredicate("x != ''");
    assertTrue(pred.isInequation());
    assertTrue(pred.asSided().right().isEmpty());
    assertEquals("x != ''", pred.toString());
  }

  @Test
  public void testLiteralWithSpaces() {
    final List<Term> concat = FormulaSupport.parseConcat("x 'a b'y");
    assertEquals(List.of(mkVar("x"), mkLiteral("a b"), mkVar("y")), concat);
  }

  @Test
  public void testParseFormula() {
    final Formula formula = FormulaSupport.parseFormula("x = y 'a'", "y != z");
    assertEquals(2, formula.size());
    assertEquals("x = y 'a' /\\ y != z", formula.toString());
    assertEquals(List.of(mkVar("x"), mkVar("y"), mkVar("z")), List.copyOf(formula.vars()));
  }

  @Test
  public void testMalformed() {
    assertThrows(IllegalArgumentException.class, () -> FormulaSupport.parsePredicate("x y"));
    assertThrows(IllegalArgumentException.class, () -> FormulaSupport.parsePredicate("x = y = z"));
    assertThrows(IllegalArgumentException.class, () -> FormulaSupport.parsePredicate("x = 'ab"));
  }
}
