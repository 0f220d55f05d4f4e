package wordeq.formula;

import java.util.List;

public final class Inequation extends SidedPredicate {

  Inequation(List<Term> left, List<Term> right) {
    super(left, right);
  }

  @Override
  public PredKind kind() {
    return PredKind.INEQUATION;
  }

  @Override
  public Predicate withParams(List<List<Term>> params) {
    assert params.size() == 2;
    return new Inequation(params.get(0), params.get(1));
  }

  @Override
  public Inequation switched() {
    return new Inequation(right(), left());
  }
}
