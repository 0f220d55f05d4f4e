package wordeq.solver.lenform;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import wordeq.formula.Term;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Quantifier-free linear integer formula over string lengths and begin offsets. Term references
 * denote the length of a string variable, the (constant) length of a literal, or a plain integer
 * variable such as a begin offset.
 */
public abstract class LenNode {

  public abstract LenOpType getType();

  public abstract List<LenNode> operands();

  /** Names of all integer variables referenced by this formula. */
  public abstract Set<String> collectVarSet();

  public abstract Expr transToSMT(Context ctx, Map<String, IntExpr> varsName);

  /** Value of an arithmetic node under <code>model</code>. */
  public long eval(Map<String, Long> model) {
    throw new UnsupportedOperationException("not an arithmetic node: " + this);
  }

  /** Truth of a boolean node under <code>model</code>. */
  public boolean holds(Map<String, Long> model) {
    throw new UnsupportedOperationException("not a boolean node: " + this);
  }

  public boolean isArith() {
    return getType().isArith();
  }

  public BoolExpr transToSMTBool(Context ctx, Map<String, IntExpr> varsName) {
    return (BoolExpr) transToSMT(ctx, varsName);
  }

  static IntExpr intConst(Context ctx, Map<String, IntExpr> varsName, String name) {
    return varsName.computeIfAbsent(name, ctx::mkIntConst);
  }

  static long lookup(Map<String, Long> model, String name) {
    final Long value = model.get(name);
    if (value == null) throw new IllegalArgumentException("no value for " + name);
    return value;
  }

  public static LenNode mkConst(long c) {
    return new LenConstImpl(c);
  }

  public static LenNode mkTerm(Term term) {
    return new LenTermImpl(term);
  }

  public static LenNode mkVar(String name) {
    return new LenTermImpl(Term.mkVar(name));
  }

  public static LenNode mkPlus(LenNode... operands) {
    return mkPlus(Arrays.asList(operands));
  }

  public static LenNode mkPlus(List<LenNode> operands) {
    return new LenPlusImpl(operands);
  }

  public static LenNode mkTimes(long coefficient, LenNode operand) {
    return new LenTimesImpl(coefficient, operand);
  }

  public static LenNode mkEq(LenNode a, LenNode b) {
    return new LenEqImpl(a, b);
  }

  public static LenNode mkLe(LenNode a, LenNode b) {
    return new LenLeImpl(a, b);
  }

  public static LenNode mkAnd(LenNode... operands) {
    return mkAnd(Arrays.asList(operands));
  }

  public static LenNode mkAnd(List<LenNode> operands) {
    return new LenAndImpl(operands);
  }

  public static LenNode mkOr(LenNode... operands) {
    return mkOr(Arrays.asList(operands));
  }

  public static LenNode mkOr(List<LenNode> operands) {
    return new LenOrImpl(operands);
  }

  public static LenNode mkNot(LenNode a) {
    return new LenNotImpl(a);
  }

  public static LenNode mkTrue() {
    return LenTrueImpl.INSTANCE;
  }

  /** Flattens nested conjunctions into <code>literals</code>. */
  public static void decomposeConjunction(LenNode formula, List<LenNode> literals) {
    if (formula.getType() == LenOpType.LAND) {
      for (LenNode operand : formula.operands()) decomposeConjunction(operand, literals);
    } else {
      literals.add(formula);
    }
  }
}
