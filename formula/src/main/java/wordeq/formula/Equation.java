package wordeq.formula;

import java.util.List;

public final class Equation extends SidedPredicate {

  Equation(List<Term> left, List<Term> right) {
    super(left, right);
  }

  @Override
  public PredKind kind() {
    return PredKind.EQUATION;
  }

  @Override
  public Predicate withParams(List<List<Term>> params) {
    assert params.size() == 2;
    return new Equation(params.get(0), params.get(1));
  }

  @Override
  public Equation switched() {
    return new Equation(right(), left());
  }
}
