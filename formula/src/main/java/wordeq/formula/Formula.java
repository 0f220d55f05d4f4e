package wordeq.formula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/** A conjunction of predicates. Insertion order is kept so that rewriting stays deterministic. */
public class Formula {
  private final List<Predicate> predicates;

  public Formula() {
    this.predicates = new ArrayList<>();
  }

  public Formula(Collection<? extends Predicate> predicates) {
    this.predicates = new ArrayList<>(predicates);
  }

  public List<Predicate> predicates() {
    return predicates;
  }

  public Predicate predicate(int index) {
    return predicates.get(index);
  }

  public void addPredicate(Predicate predicate) {
    predicates.add(predicate);
  }

  public int size() {
    return predicates.size();
  }

  public boolean isEmpty() {
    return predicates.isEmpty();
  }

  public Set<Term> vars() {
    final Set<Term> vars = new TreeSet<>();
    for (Predicate pred : predicates) vars.addAll(pred.vars());
    return vars;
  }

  public Set<Predicate> predicatesSet() {
    return new TreeSet<>(predicates);
  }

  public Formula copy() {
    return new Formula(predicates);
  }

  @Override
  public String toString() {
    return predicates.stream().map(Predicate::toString).collect(Collectors.joining(" /\\ "));
  }
}
