package wordeq.solver.lenform;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class LenConstImpl extends LenNode {

  final long value;

  LenConstImpl(long value) {
    this.value = value;
  }

  public long value() {
    return value;
  }

  @Override
  public LenOpType getType() {
    return LenOpType.LCONST;
  }

  @Override
  public List<LenNode> operands() {
    return Collections.emptyList();
  }

  @Override
  public Set<String> collectVarSet() {
    return new HashSet<>();
  }

  @Override
  public Expr transToSMT(Context ctx, Map<String, IntExpr> varsName) {
    return ctx.mkInt(value);
  }

  @Override
  public long eval(Map<String, Long> model) {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof LenConstImpl)) return false;
    return value == ((LenConstImpl) obj).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
