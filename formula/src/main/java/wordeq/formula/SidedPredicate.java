package wordeq.formula;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** An equation or inequation: a predicate with exactly a left and a right side. */
public abstract class SidedPredicate extends AbstractPredicate {

  public enum Side {
    LEFT,
    RIGHT
  }

  SidedPredicate(List<Term> left, List<Term> right) {
    super(List.of(left, right));
  }

  @Override
  public SidedPredicate asSided() {
    return this;
  }

  public List<Term> left() {
    return params.get(0);
  }

  public List<Term> right() {
    return params.get(1);
  }

  public List<Term> side(Side side) {
    return side == Side.LEFT ? left() : right();
  }

  /** The same predicate with the two sides swapped. */
  public abstract SidedPredicate switched();

  public Set<Term> sideVars(Side side) {
    final Set<Term> vars = new TreeSet<>();
    for (Term t : side(side)) if (t.isVariable()) vars.add(t);
    return vars;
  }

  /** Whether some variable occurs more than once on the given side. */
  public boolean multipleOccurrences(Side side) {
    final Set<Term> seen = new TreeSet<>();
    for (Term t : side(side)) {
      if (t.isVariable() && !seen.add(t)) return true;
    }
    return false;
  }

  /** Whether both sides are the same sequence. */
  public boolean isTrivial() {
    return left().equals(right());
  }

  @Override
  public String toString() {
    return concatToString(left()) + " " + kind().text() + " " + concatToString(right());
  }
}
