package wordeq.solver.preprocess;

import wordeq.formula.Term;

import java.util.Comparator;

/**
 * One occurrence of a term inside the predicate numbered <code>eqIndex</code>. Positions are
 * 1-based, negative on the left side and positive on the right side of an (in)equation.
 */
public record VarNode(Term term, int eqIndex, int position) implements Comparable<VarNode> {
  private static final Comparator<VarNode> ORDER =
      Comparator.comparing(VarNode::term)
          .thenComparingInt(VarNode::eqIndex)
          .thenComparingInt(VarNode::position);

  @Override
  public int compareTo(VarNode o) {
    return ORDER.compare(this, o);
  }

  public boolean onLeft() {
    return position < 0;
  }

  /** 0-based index into the side the occurrence belongs to. */
  public int sideIndex() {
    return Math.abs(position) - 1;
  }
}
