package wordeq.solver.lenform;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import wordeq.formula.Term;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Length of a term. Literals evaluate to the length of their word; every other term is an
 * integer variable named after the term.
 */
public class LenTermImpl extends LenNode {

  final Term term;

  LenTermImpl(Term term) {
    this.term = term;
  }

  public Term term() {
    return term;
  }

  @Override
  public LenOpType getType() {
    return LenOpType.LTERM;
  }

  @Override
  public List<LenNode> operands() {
    return Collections.emptyList();
  }

  @Override
  public Set<String> collectVarSet() {
    final Set<String> vars = new HashSet<>();
    if (!term.isLiteral()) vars.add(term.name());
    return vars;
  }

  @Override
  public Expr transToSMT(Context ctx, Map<String, IntExpr> varsName) {
    if (term.isLiteral()) return ctx.mkInt(term.name().length());
    return intConst(ctx, varsName, term.name());
  }

  @Override
  public long eval(Map<String, Long> model) {
    if (term.isLiteral()) return term.name().length();
    return lookup(model, term.name());
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof LenTermImpl)) return false;
    return term.equals(((LenTermImpl) obj).term);
  }

  @Override
  public int hashCode() {
    return term.hashCode();
  }

  @Override
  public String toString() {
    return term.isLiteral() ? "|" + term + "|" : term.name();
  }
}
