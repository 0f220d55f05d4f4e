package wordeq.formula;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

abstract class AbstractPredicate implements Predicate {
  protected final ImmutableList<List<Term>> params;

  AbstractPredicate(List<List<Term>> params) {
    this.params = Predicate.copyParams(params);
  }

  @Override
  public List<List<Term>> params() {
    return params;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Predicate)) return false;
    final Predicate that = (Predicate) o;
    return kind() == that.kind() && params().equals(that.params());
  }

  @Override
  public int hashCode() {
    int res = 0;
    for (List<Term> param : params) for (Term t : param) res ^= t.hashCode() << 1;
    return kind().hashCode() ^ res;
  }

  static String concatToString(List<Term> concat) {
    if (concat.isEmpty()) return "''";
    return concat.stream().map(Term::toString).collect(Collectors.joining(" "));
  }
}
