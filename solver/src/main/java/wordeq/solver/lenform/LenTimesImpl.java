package wordeq.solver.lenform;

import com.google.common.collect.ImmutableList;
import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Constant multiple of an arithmetic node. */
public class LenTimesImpl extends LenNode {

  final long coefficient;
  final LenNode operand;

  LenTimesImpl(long coefficient, LenNode operand) {
    this.coefficient = coefficient;
    this.operand = operand;
  }

  @Override
  public LenOpType getType() {
    return LenOpType.LTIMES;
  }

  @Override
  public List<LenNode> operands() {
    return ImmutableList.of(operand);
  }

  @Override
  public Set<String> collectVarSet() {
    return operand.collectVarSet();
  }

  @Override
  public Expr transToSMT(Context ctx, Map<String, IntExpr> varsName) {
    return ctx.mkMul(ctx.mkInt(coefficient), (ArithExpr) operand.transToSMT(ctx, varsName));
  }

  @Override
  public long eval(Map<String, Long> model) {
    return coefficient * operand.eval(model);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof LenTimesImpl)) return false;
    final LenTimesImpl that = (LenTimesImpl) obj;
    return coefficient == that.coefficient && operand.equals(that.operand);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(coefficient) * 31 + operand.hashCode();
  }

  @Override
  public String toString() {
    return coefficient + "*" + operand;
  }
}
