package wordeq.formula;

import java.util.List;
import java.util.stream.Collectors;

/** <code>contains(haystack, needle)</code> and any further parameters the host attaches. */
public final class Contains extends AbstractPredicate {

  Contains(List<List<Term>> params) {
    super(params);
  }

  @Override
  public PredKind kind() {
    return PredKind.CONTAINS;
  }

  @Override
  public Predicate withParams(List<List<Term>> params) {
    return new Contains(params);
  }

  @Override
  public String toString() {
    return params.stream()
        .map(AbstractPredicate::concatToString)
        .collect(Collectors.joining(", ", kind().text() + "(", ")"));
  }
}
