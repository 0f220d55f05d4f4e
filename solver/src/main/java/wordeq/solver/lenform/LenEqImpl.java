package wordeq.solver.lenform;

import com.google.common.collect.ImmutableList;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class LenEqImpl extends LenNode {

  final LenNode operand1;
  final LenNode operand2;

  LenEqImpl(LenNode op1, LenNode op2) {
    operand1 = op1;
    operand2 = op2;
  }

  @Override
  public LenOpType getType() {
    return LenOpType.LEQ;
  }

  @Override
  public List<LenNode> operands() {
    return ImmutableList.of(operand1, operand2);
  }

  @Override
  public Set<String> collectVarSet() {
    final Set<String> varSet = operand1.collectVarSet();
    varSet.addAll(operand2.collectVarSet());
    return varSet;
  }

  @Override
  public Expr transToSMT(Context ctx, Map<String, IntExpr> varsName) {
    final Expr one = operand1.transToSMT(ctx, varsName);
    final Expr two = operand2.transToSMT(ctx, varsName);
    return ctx.mkEq(one, two);
  }

  @Override
  public boolean holds(Map<String, Long> model) {
    return operand1.eval(model) == operand2.eval(model);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof LenEqImpl)) return false;
    final LenEqImpl that = (LenEqImpl) obj;
    return operand1.equals(that.operand1) && operand2.equals(that.operand2);
  }

  @Override
  public int hashCode() {
    return (operand1.hashCode() * 31 + operand2.hashCode()) * 31 + getType().hashCode();
  }

  @Override
  public String toString() {
    return operand1 + " = " + operand2;
  }
}
