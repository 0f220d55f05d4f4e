package wordeq.solver.lenform;

import com.google.common.collect.ImmutableList;
import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class LenPlusImpl extends LenNode {

  final List<LenNode> operands;

  LenPlusImpl(List<LenNode> operands) {
    this.operands = ImmutableList.copyOf(operands);
  }

  @Override
  public LenOpType getType() {
    return LenOpType.LPLUS;
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
    if (operands.isEmpty()) return ctx.mkInt(0);
    final ArithExpr[] args = new ArithExpr[operands.size()];
    for (int i = 0; i < args.length; i++)
      args[i] = (ArithExpr) operands.get(i).transToSMT(ctx, varsName);
    return args.length == 1 ? args[0] : ctx.mkAdd(args);
  }

  @Override
  public long eval(Map<String, Long> model) {
    long sum = 0;
    for (LenNode operand : operands) sum += operand.eval(model);
    return sum;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof LenPlusImpl)) return false;
    return operands.equals(((LenPlusImpl) obj).operands);
  }

  @Override
  public int hashCode() {
    return 31 * operands.hashCode() + getType().hashCode();
  }

  @Override
  public String toString() {
    if (operands.isEmpty()) return "0";
    return operands.stream().map(Object::toString).collect(Collectors.joining(" + ", "(", ")"));
  }
}
