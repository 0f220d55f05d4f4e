package wordeq.formula;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A predicate over sequences of terms. Equations and inequations own exactly a left and a right
 * side (see {@link SidedPredicate}); other kinds own an arbitrary list of sequences.
 *
 * <p>Predicates are immutable, every rewriting operation returns a new predicate.
 */
public interface Predicate extends Comparable<Predicate> {

  PredKind kind();

  List<List<Term>> params();

  /** A predicate of the same kind over the given parameters. */
  Predicate withParams(List<List<Term>> params);

  default boolean isEquation() {
    return kind() == PredKind.EQUATION;
  }

  default boolean isInequation() {
    return kind() == PredKind.INEQUATION;
  }

  default boolean isEqOrIneq() {
    return kind().isEqOrIneq();
  }

  default boolean isPredKind(PredKind kind) {
    return kind() == kind;
  }

  /** Side view of an (in)equation. Fails fast for any other kind. */
  default SidedPredicate asSided() {
    throw new IllegalStateException("not an equation or inequation: " + this);
  }

  default Set<Term> vars() {
    final Set<Term> vars = new TreeSet<>();
    for (List<Term> param : params())
      for (Term t : param) if (t.isVariable()) vars.add(t);
    return vars;
  }

  /**
   * Replaces every maximal non-overlapping occurrence of <code>find</code> in each parameter
   * (scanning left to right) by <code>replacement</code>.
   *
   * @return the rewritten predicate, or empty if nothing matched
   */
  default Optional<Predicate> replace(List<Term> find, List<Term> replacement) {
    if (find.isEmpty()) return Optional.empty();
    boolean modified = false;
    final List<List<Term>> newParams = new ArrayList<>(params().size());
    for (List<Term> param : params()) {
      final List<Term> res = new ArrayList<>(param.size());
      int i = 0;
      while (i < param.size()) {
        if (i + find.size() <= param.size() && param.subList(i, i + find.size()).equals(find)) {
          res.addAll(replacement);
          i += find.size();
          modified = true;
        } else {
          res.add(param.get(i++));
        }
      }
      newParams.add(res);
    }
    return modified ? Optional.of(withParams(newParams)) : Optional.empty();
  }

  /** Replaces each term that is a key of <code>replacement</code> by the mapped sequence. */
  default Predicate substitute(Map<Term, List<Term>> replacement) {
    final List<List<Term>> newParams = new ArrayList<>(params().size());
    for (List<Term> param : params()) {
      final List<Term> res = new ArrayList<>(param.size());
      for (Term t : param) {
        final List<Term> rep = replacement.get(t);
        if (rep == null) res.add(t);
        else res.addAll(rep);
      }
      newParams.add(res);
    }
    return withParams(newParams);
  }

  /** Drops every occurrence of the given terms from all parameters. */
  default Predicate removeTerms(Set<Term> terms) {
    final List<List<Term>> newParams = new ArrayList<>(params().size());
    for (List<Term> param : params()) {
      final List<Term> res = new ArrayList<>(param.size());
      for (Term t : param) if (!terms.contains(t)) res.add(t);
      newParams.add(res);
    }
    return withParams(newParams);
  }

  @Override
  default int compareTo(Predicate other) {
    final int res = kind().compareTo(other.kind());
    if (res != 0) return res;
    return compareParams(params(), other.params());
  }

  static Equation mkEquation(List<Term> left, List<Term> right) {
    return new Equation(left, right);
  }

  static Inequation mkInequation(List<Term> left, List<Term> right) {
    return new Inequation(left, right);
  }

  static Predicate mk(PredKind kind, List<List<Term>> params) {
    return switch (kind) {
      case EQUATION -> new Equation(params.get(0), params.get(1));
      case INEQUATION -> new Inequation(params.get(0), params.get(1));
      case CONTAINS -> new Contains(params);
    };
  }

  static int compareConcat(List<Term> xs, List<Term> ys) {
    for (int i = 0, bound = Math.min(xs.size(), ys.size()); i < bound; ++i) {
      final int res = xs.get(i).compareTo(ys.get(i));
      if (res != 0) return res;
    }
    return Integer.compare(xs.size(), ys.size());
  }

  private static int compareParams(List<List<Term>> xs, List<List<Term>> ys) {
    for (int i = 0, bound = Math.min(xs.size(), ys.size()); i < bound; ++i) {
      final int res = compareConcat(xs.get(i), ys.get(i));
      if (res != 0) return res;
    }
    return Integer.compare(xs.size(), ys.size());
  }

  static ImmutableList<List<Term>> copyParams(List<List<Term>> params) {
    final ImmutableList.Builder<List<Term>> builder = ImmutableList.builder();
    for (List<Term> param : params) builder.add(ImmutableList.copyOf(param));
    return builder.build();
  }
}
