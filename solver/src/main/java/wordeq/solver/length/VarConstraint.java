package wordeq.solver.length;

import wordeq.solver.lenform.LenNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import static wordeq.solver.lenform.LenNode.mkConst;
import static wordeq.solver.lenform.LenNode.mkEq;
import static wordeq.solver.lenform.LenNode.mkLe;
import static wordeq.solver.lenform.LenNode.mkNot;
import static wordeq.solver.lenform.LenNode.mkOr;
import static wordeq.solver.lenform.LenNode.mkPlus;
import static wordeq.solver.lenform.LenNode.mkTrue;
import static wordeq.solver.lenform.LenNode.mkVar;

/**
 * The sides a variable (or a fresh key standing for an equation without a single-variable side) is
 * equated to. Sides hold handles of a {@link NameTable}; literal occurrences are aliases of a
 * {@link LiteralAliases}.
 *
 * <p>After {@link #parse}, {@link #lits()} holds every literal alias reachable from this node, and
 * each pair of aliases that can overlap inside the value of this node is recorded as an alignment.
 */
public class VarConstraint {
  private static final Logger LOG = Logger.getLogger(VarConstraint.class.getName());

  enum ParseState {
    UNVISITED,
    IN_PROGRESS,
    DONE
  }

  private final int var;
  private final List<int[]> sides = new ArrayList<>();
  private final List<Integer> lits = new ArrayList<>();
  private final List<int[]> alignments = new ArrayList<>();
  private ParseState state = ParseState.UNVISITED;

  public VarConstraint(int var) {
    this.var = var;
  }

  public int var() {
    return var;
  }

  public List<int[]> sides() {
    return Collections.unmodifiableList(sides);
  }

  public List<Integer> lits() {
    return Collections.unmodifiableList(lits);
  }

  /** Pairs of literal aliases that occur in the value of this node at the same time. */
  public List<int[]> alignments() {
    return Collections.unmodifiableList(alignments);
  }

  ParseState state() {
    return state;
  }

  public void addSide(int[] side) {
    sides.add(side.clone());
  }

  /**
   * Resolves the nodes this one depends on, depth first without recursion.
   *
   * @param pool nodes indexed by handle, <code>null</code> for unconstrained handles
   * @return false if the dependencies are cyclic
   */
  public boolean parse(List<VarConstraint> pool, LiteralAliases aliases) {
    if (state == ParseState.DONE) return true;
    if (state == ParseState.IN_PROGRESS) return false;

    final Deque<Frame> stack = new ArrayDeque<>();
    state = ParseState.IN_PROGRESS;
    stack.push(new Frame(this));

    while (!stack.isEmpty()) {
      final Frame frame = stack.peek();
      final VarConstraint node = frame.node;
      if (frame.side == node.sides.size()) {
        node.state = ParseState.DONE;
        stack.pop();
        continue;
      }

      final int[] side = node.sides.get(frame.side);
      if (frame.term == side.length) {
        node.finishSide(frame.litsInSide);
        frame.nextSide();
        continue;
      }

      final int t = side[frame.term];
      final VarConstraint dep = aliases.isAlias(t) ? null : nodeOf(pool, t);
      if (aliases.isAlias(t)) {
        frame.litsInSide.add(t);
        ++frame.term;
      } else if (dep == null || dep.state == ParseState.DONE) {
        if (dep != null) frame.litsInSide.addAll(dep.lits);
        ++frame.term;
      } else if (dep.state == ParseState.IN_PROGRESS) {
        return false;
      } else {
        // revisit the same term once the dependency is done
        dep.state = ParseState.IN_PROGRESS;
        stack.push(new Frame(dep));
      }
    }
    return true;
  }

  private void finishSide(List<Integer> litsInSide) {
    for (int l1 : lits) for (int l2 : litsInSide) alignments.add(new int[] {l1, l2});
    lits.addAll(litsInSide);
  }

  static VarConstraint nodeOf(List<VarConstraint> pool, int handle) {
    return handle < pool.size() ? pool.get(handle) : null;
  }

  /**
   * Length and position constraints of this node: alignment of every recorded pair of literals,
   * <code>|var| = |t1| + ... + |tn|</code> for each side, and the begin offset of every term and of
   * every literal nested in it, relative to the value of this node.
   */
  public LenNode getLengths(List<VarConstraint> pool, NameTable names, LiteralAliases aliases) {
    final List<LenNode> form = new ArrayList<>();
    for (int[] pair : alignments) form.add(alignLiterals(pair[0], pair[1], names, aliases));

    for (int[] side : sides) {
      final List<LenNode> sideLen = new ArrayList<>(side.length);
      for (int t : side) sideLen.add(lengthOf(t, names, aliases));
      form.add(mkEq(mkVar(names.name(var)), sum(sideLen)));
    }

    for (int[] side : sides) {
      LenNode endOfLast = mkConst(0);
      for (int t : side) {
        final LenNode begin = beginOf(names.name(t), names.name(var));
        form.add(mkEq(endOfLast, begin));
        final VarConstraint dep = aliases.isAlias(t) ? null : nodeOf(pool, t);
        if (dep != null) {
          for (int lit : dep.lits) {
            form.add(
                mkEq(
                    beginOf(names.name(lit), names.name(var)),
                    mkPlus(beginOf(names.name(lit), names.name(t)), begin)));
          }
        }
        endOfLast = mkPlus(begin, lengthOf(t, names, aliases));
      }
    }

    LOG.fine(() -> "length constraints of " + names.name(var) + ": " + form);
    return LenNode.mkAnd(form);
  }

  /**
   * Constraint on the begin offsets of two literal aliases inside this node: either they do not
   * overlap, or they overlap at a shift where their letters agree.
   */
  public LenNode alignLiterals(int l1, int l2, NameTable names, LiteralAliases aliases) {
    final String w1 = aliases.word(l1), w2 = aliases.word(l2);
    final LenNode b1 = beginOf(names.name(l1), names.name(var));
    final LenNode b2 = beginOf(names.name(l2), names.name(var));

    if (w1.length() == 1 && w2.length() == 1) {
      return w1.charAt(0) == w2.charAt(0) ? mkTrue() : mkNot(mkEq(b1, b2));
    }

    final List<LenNode> align = new ArrayList<>();
    align.add(mkLe(mkPlus(b1, mkConst(w1.length())), b2));
    align.add(mkLe(mkPlus(b2, mkConst(w2.length())), b1));
    for (int n = 1; n <= w1.length() + w2.length() - 1; ++n) {
      // b1 = b2 + |w2| - n
      if (overlapMatches(w1, w2, n))
        align.add(mkEq(mkPlus(b1, mkConst(n)), mkPlus(b2, mkConst(w2.length()))));
    }
    return mkOr(align);
  }

  /**
   * Whether <code>w1</code> placed to start <code>|w2| - n</code> letters after the start of
   * <code>w2</code> agrees with <code>w2</code> on the overlapping letters. For
   * <code>n <= |w2|</code> this compares the first n letters of <code>w1</code> with the last n of
   * <code>w2</code>.
   */
  static boolean overlapMatches(String w1, String w2, int n) {
    int s1 = 0;
    int s2 = w2.length() - n;
    int count = n;
    if (s2 < 0) {
      s1 = -s2;
      count += s2;
      s2 = 0;
    }
    if (s1 + count > w1.length()) count = w1.length() - s1;
    for (int i = 0; i < count; ++i) {
      if (w1.charAt(s1 + i) != w2.charAt(s2 + i)) return false;
    }
    return true;
  }

  public static String beginOfName(String of, String from) {
    return "B!" + of + "_IN_" + from;
  }

  static LenNode beginOf(String of, String from) {
    return mkVar(beginOfName(of, from));
  }

  private static LenNode lengthOf(int t, NameTable names, LiteralAliases aliases) {
    return aliases.isAlias(t) ? mkConst(aliases.word(t).length()) : mkVar(names.name(t));
  }

  private static LenNode sum(List<LenNode> terms) {
    if (terms.isEmpty()) return mkConst(0);
    return terms.size() == 1 ? terms.get(0) : mkPlus(terms);
  }

  public String toString(NameTable names) {
    final StringBuilder builder = new StringBuilder(names.name(var)).append(" =");
    boolean first = true;
    for (int[] side : sides) {
      if (!first) builder.append(" =");
      first = false;
      for (int t : side) builder.append(' ').append(names.name(t));
    }
    builder.append("\n  lits:");
    for (int lit : lits) builder.append(' ').append(names.name(lit));
    return builder.toString();
  }

  private static class Frame {
    private final VarConstraint node;
    private int side;
    private int term;
    private List<Integer> litsInSide = new ArrayList<>();

    private Frame(VarConstraint node) {
      this.node = node;
    }

    private void nextSide() {
      ++side;
      term = 0;
      litsInSide = new ArrayList<>();
    }
  }
}
