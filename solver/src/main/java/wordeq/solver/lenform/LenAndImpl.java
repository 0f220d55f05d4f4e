package wordeq.solver.lenform;

import com.google.common.collect.ImmutableList;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class LenAndImpl extends LenNode {

  final List<LenNode> operands;

  LenAndImpl(List<LenNode> operands) {
    this.operands = ImmutableList.copyOf(operands);
  }

  @Override
  public LenOpType getType() {
    return LenOpType.LAND;
  }

  @Override
  public List<LenNode> operands() {
    return operands;
  }

  @Override
  public Set<String> collectVarSet() {
    final Set<String> varSet = new HashSet<>();
    for (LenNode operand : operands) varSet.addAll(operand.collectVarSet());
    return varSet;
  }

  @Override
  public Expr transToSMT(Context ctx, Map<String, IntExpr> varsName) {
    final BoolExpr[] args = new BoolExpr[operands.size()];
    for (int i = 0; i < args.length; i++) args[i] = operands.get(i).transToSMTBool(ctx, varsName);
    return ctx.mkAnd(args);
  }

  @Override
  public boolean holds(Map<String, Long> model) {
    return operands.stream().allMatch(it -> it.holds(model));
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof LenAndImpl)) return false;
    return operands.equals(((LenAndImpl) obj).operands);
  }

  @Override
  public int hashCode() {
    return 31 * operands.hashCode() + getType().hashCode();
  }

  @Override
  public String toString() {
    if (operands.isEmpty()) return "true";
    return operands.stream().map(Object::toString).collect(Collectors.joining(" && ", "(", ")"));
  }
}
