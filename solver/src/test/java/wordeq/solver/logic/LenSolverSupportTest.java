package wordeq.solver.logic;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import wordeq.formula.Term;
import wordeq.solver.LBool;
import wordeq.solver.lenform.LenNode;
import wordeq.solver.lenform.LenNodePrecision;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static wordeq.solver.lenform.LenNode.mkAnd;
import static wordeq.solver.lenform.LenNode.mkConst;
import static wordeq.solver.lenform.LenNode.mkEq;
import static wordeq.solver.lenform.LenNode.mkLe;
import static wordeq.solver.lenform.LenNode.mkNot;
import static wordeq.solver.lenform.LenNode.mkOr;
import static wordeq.solver.lenform.LenNode.mkPlus;
import static wordeq.solver.lenform.LenNode.mkTerm;
import static wordeq.solver.lenform.LenNode.mkTimes;
import static wordeq.solver.lenform.LenNode.mkTrue;
import static wordeq.solver.lenform.LenNode.mkVar;

@Tag("logic")
@Tag("fast")
public class LenSolverSupportTest {
  private final LenNode x = mkVar("x");
  private final LenNode y = mkVar("y");

  @Test
  public void testCheck() {
    assertEquals(LBool.FALSE, LenSolverSupport.check(mkAnd(mkLe(mkConst(5), x), mkLe(x, mkConst(3)))));
    assertEquals(LBool.TRUE, LenSolverSupport.check(mkOr(mkEq(x, mkConst(2)), mkEq(x, y))));
    assertEquals(LBool.TRUE, LenSolverSupport.check(mkAnd()));
    assertEquals(LBool.TRUE, LenSolverSupport.check(mkTrue()));
    assertEquals(LBool.FALSE, LenSolverSupport.check(mkOr()));
    assertEquals(LBool.FALSE, LenSolverSupport.check(mkNot(mkEq(x, x))));
  }

  @Test
  public void testLiteralLength() {
    final LenNode abc = mkTerm(Term.mkLiteral("abc"));
    assertEquals(LBool.FALSE, LenSolverSupport.check(mkEq(abc, mkConst(2))));
    assertEquals(LBool.TRUE, LenSolverSupport.check(mkEq(mkPlus(abc, x), mkConst(5))));
  }

  @Test
  public void testFindModel() {
    final LenNode formula = mkAnd(mkEq(mkPlus(x, mkConst(2)), mkConst(5)), mkEq(y, mkTimes(3, x)));
    final Optional<Map<String, Long>> model = LenSolverSupport.findModel(formula);
    assertTrue(model.isPresent());
    assertEquals(Map.of("x", 3L, "y", 9L), model.get());
    assertTrue(formula.holds(model.get()));

    assertTrue(LenSolverSupport.findModel(mkLe(x, mkTimes(-1, mkConst(1)))).isPresent());
    assertTrue(LenSolverSupport.findModel(mkAnd(mkLe(x, mkConst(0)), mkLe(mkConst(1), x))).isEmpty());
  }

  @Test
  public void testDecide() {
    final LenNode unsat = mkAnd(mkLe(mkConst(1), x), mkEq(x, mkConst(0)));
    final LenNode sat = mkEq(x, y);
    assertEquals(LBool.FALSE, LenSolverSupport.decide(Pair.of(unsat, LenNodePrecision.EXACT)));
    assertEquals(LBool.UNDEF, LenSolverSupport.decide(Pair.of(unsat, LenNodePrecision.UNDERAPPROX)));
    assertEquals(LBool.TRUE, LenSolverSupport.decide(Pair.of(sat, LenNodePrecision.UNDERAPPROX)));
    assertEquals(LBool.TRUE, LenSolverSupport.decide(Pair.of(sat, LenNodePrecision.EXACT)));
  }

  @Test
  public void testOf() {
    assertEquals(LBool.TRUE, LBool.of(true));
    assertEquals(LBool.FALSE, LBool.of(false));
  }
}
