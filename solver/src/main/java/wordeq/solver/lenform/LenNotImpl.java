package wordeq.solver.lenform;

import com.google.common.collect.ImmutableList;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class LenNotImpl extends LenNode {

  final LenNode operand;

  LenNotImpl(LenNode operand) {
    this.operand = operand;
  }

  @Override
  public LenOpType getType() {
    return LenOpType.LNOT;
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
    return ctx.mkNot(operand.transToSMTBool(ctx, varsName));
  }

  @Override
  public boolean holds(Map<String, Long> model) {
    return !operand.holds(model);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof LenNotImpl)) return false;
    return operand.equals(((LenNotImpl) obj).operand);
  }

  @Override
  public int hashCode() {
    return ~operand.hashCode();
  }

  @Override
  public String toString() {
    return "!(" + operand + ")";
  }
}
