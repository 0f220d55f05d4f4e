package wordeq.solver.lenform;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class LenTrueImpl extends LenNode {

  static final LenTrueImpl INSTANCE = new LenTrueImpl();

  private LenTrueImpl() {}

  @Override
  public LenOpType getType() {
    return LenOpType.LTRUE;
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
    return ctx.mkTrue();
  }

  @Override
  public boolean holds(Map<String, Long> model) {
    return true;
  }

  @Override
  public String toString() {
    return "true";
  }
}
