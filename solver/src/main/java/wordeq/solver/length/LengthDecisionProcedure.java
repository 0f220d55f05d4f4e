package wordeq.solver.length;

import org.apache.commons.lang3.tuple.Pair;
import wordeq.formula.AutAssignment;
import wordeq.formula.Formula;
import wordeq.formula.Predicate;
import wordeq.formula.SidedPredicate;
import wordeq.formula.SidedPredicate.Side;
import wordeq.formula.Term;
import wordeq.solver.LBool;
import wordeq.solver.lenform.LenNode;
import wordeq.solver.lenform.LenNodePrecision;
import wordeq.solver.preprocess.FormulaPreprocessor;
import wordeq.solver.preprocess.PreprocessPass;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import static wordeq.solver.lenform.LenNode.mkConst;
import static wordeq.solver.lenform.LenNode.mkEq;
import static wordeq.solver.lenform.LenNode.mkLe;
import static wordeq.solver.lenform.LenNode.mkPlus;
import static wordeq.solver.lenform.LenNode.mkTerm;
import static wordeq.solver.lenform.LenNode.mkTimes;
import static wordeq.solver.lenform.LenNode.mkVar;

/**
 * Decides word equations in which no variable occurs twice in concatenations by reduction to
 * linear integer arithmetic over lengths and begin offsets.
 *
 * <pre>
 *   LengthDecisionProcedure proc = new LengthDecisionProcedure(formula, autAss, lenVars);
 *   if (proc.preprocess() == LBool.FALSE) ... // unsat
 *   if (proc.computeNextSolution() == LBool.TRUE) ... proc.getLengths()
 * </pre>
 */
public class LengthDecisionProcedure {
  private static final Logger LOG = Logger.getLogger(LengthDecisionProcedure.class.getName());
  private static final String FRESH_KEY_PREFIX = "f!";
  private static final String PERIOD_PREFIX = "k!";

  private Formula formula;
  private AutAssignment autAss;
  private Set<Term> lenVars;
  private LenNode preprocessingLenFormula = LenNode.mkTrue();
  private LenNodePrecision precision = LenNodePrecision.EXACT;

  private final List<LenNode> implicitLenFormula = new ArrayList<>();
  private final List<LenNode> computedLenFormula = new ArrayList<>();
  private final NameTable names = new NameTable();
  private final LiteralAliases aliases = new LiteralAliases(names);
  private final List<VarConstraint> pool = new ArrayList<>();

  public LengthDecisionProcedure(Formula formula, AutAssignment autAss, Set<Term> lenVars) {
    this.formula = formula;
    this.autAss = autAss;
    this.lenVars = lenVars;
  }

  public Formula formula() {
    return formula;
  }

  public AutAssignment autAssignment() {
    return autAss;
  }

  public LenNodePrecision precision() {
    return precision;
  }

  /**
   * Whether the procedure may apply: only (in)equations, and every variable is universal,
   * co-finite or has a single word.
   */
  public static boolean isSuitable(Formula formula, AutAssignment autAss) {
    for (Predicate pred : formula.predicates()) {
      if (!pred.isEqOrIneq()) {
        LOG.fine(() -> "not suitable, predicate " + pred);
        return false;
      }
    }
    for (Term var : formula.vars()) {
      if (!autAss.contains(var)) continue;
      if (autAss.isUniversal(var) || autAss.isCoFinite(var) || autAss.isSingleton(var)) continue;
      LOG.fine(() -> "not suitable, regular constraint on " + var);
      return false;
    }
    return true;
  }

  /**
   * Simplifies the formula for length abstraction. Languages may be underapproximated, which is
   * then reflected by {@link #precision()}.
   *
   * @return <code>FALSE</code> if the formula is unsatisfiable, <code>UNDEF</code> otherwise
   */
  public LBool preprocess() {
    final FormulaPreprocessor prep = new FormulaPreprocessor(formula, autAss, lenVars);
    precision = precision.join(prep.run(PreprocessPass.LENGTH_SCHEDULE));

    formula = prep.getModifiedFormula();
    autAss = prep.getAutAssignment();
    lenVars = prep.getLenVariables();
    preprocessingLenFormula = prep.getLenFormula();
    if (!formula.isEmpty()) autAss.reduce();

    if (prep.containsUnsat() || !autAss.isSatisfiable()) return LBool.FALSE;
    return LBool.UNDEF;
  }

  /**
   * Builds the arithmetic constraints of the current formula.
   *
   * @return <code>TRUE</code> if {@link #getLengths()} now holds an equisatisfiable formula (up to
   *     {@link #precision()}), <code>UNDEF</code> if the formula is outside the fragment
   */
  public LBool computeNextSolution() {
    implicitLenFormula.clear();
    computedLenFormula.clear();
    pool.clear();

    final Set<Term> vars = formula.vars();
    final Map<Term, List<Term>> singletons = new HashMap<>();
    for (Term var : vars) {
      implicitLenFormula.add(mkLe(mkConst(0), mkTerm(var)));
      if (!autAss.contains(var)) continue;
      final Optional<String> word = autAss.singletonWord(var);
      if (word.isPresent()) {
        final String w = word.get();
        singletons.put(var, w.isEmpty() ? List.of() : List.of(Term.mkLiteral(w)));
        implicitLenFormula.add(mkEq(mkTerm(var), mkConst(w.length())));
      } else if (autAss.isLengthOnly(var)) {
        final int shortest = autAss.at(var).shortestWordLength();
        if (shortest > 0) implicitLenFormula.add(mkLe(mkConst(shortest), mkTerm(var)));
      } else {
        LOG.fine(() -> "not suitable, regular constraint on " + var);
        return LBool.UNDEF;
      }
    }

    final List<SidedPredicate> eqs = new ArrayList<>();
    for (Predicate pred : formula.predicates()) {
      if (!pred.isEquation()) {
        LOG.fine(() -> "not suitable, predicate " + pred);
        return LBool.UNDEF;
      }
      eqs.add(singletons.isEmpty() ? pred.asSided() : pred.substitute(singletons).asSided());
    }
    if (!noMultiConcat(eqs)) return LBool.UNDEF;

    for (Term var : vars) names.intern(var.name());
    for (SidedPredicate eq : eqs) addToPool(eq);
    LOG.fine(() -> "literal aliases:\n" + aliases);

    for (VarConstraint node : pool) {
      if (node != null && !node.parse(pool, aliases)) {
        LOG.fine(() -> "cyclic dependency through " + names.name(node.var()));
        return LBool.UNDEF;
      }
    }
    for (VarConstraint node : pool) {
      if (node != null) computedLenFormula.add(node.getLengths(pool, names, aliases));
    }
    return LBool.TRUE;
  }

  private static boolean noMultiConcat(List<SidedPredicate> eqs) {
    final Set<Term> concatTerms = new HashSet<>();
    for (SidedPredicate eq : eqs) {
      for (List<Term> side : eq.params()) {
        if (side.size() <= 1) continue;
        for (Term t : side) {
          if (t.isLiteral()) continue;
          if (!concatTerms.add(t)) {
            LOG.fine(() -> "not suitable, " + t + " occurs twice in concatenations");
            return false;
          }
        }
      }
    }
    return true;
  }

  private void addToPool(SidedPredicate eq) {
    boolean inPool = false;
    for (Side s : Side.values()) {
      final List<Term> side = eq.side(s);
      if (side.size() == 1 && side.get(0).isVariable()) {
        final int var = names.intern(side.get(0).name());
        final List<Term> other = eq.side(s == Side.LEFT ? Side.RIGHT : Side.LEFT);
        constraintOf(var).addSide(toHandles(other));
        inPool = true;
      }
    }
    if (!inPool) {
      final VarConstraint fresh = constraintOf(names.fresh(FRESH_KEY_PREFIX));
      fresh.addSide(toHandles(eq.right()));
      fresh.addSide(toHandles(eq.left()));
    }
  }

  private VarConstraint constraintOf(int handle) {
    while (pool.size() <= handle) pool.add(null);
    if (pool.get(handle) == null) pool.set(handle, new VarConstraint(handle));
    return pool.get(handle);
  }

  private int[] toHandles(List<Term> side) {
    final int[] handles = new int[side.size()];
    for (int i = 0; i < handles.length; ++i) {
      final Term t = side.get(i);
      handles[i] = t.isLiteral() ? aliases.alias(t.name()) : names.intern(t.name());
    }
    return handles;
  }

  /**
   * The conjunction of the preprocessing side conditions, the implicit length bounds, the computed
   * constraints, and the lengths allowed by the language of every assigned variable that does not
   * occur in the formula.
   */
  public Pair<LenNode, LenNodePrecision> getLengths() {
    final List<LenNode> conjuncts = new ArrayList<>();
    conjuncts.add(preprocessingLenFormula);
    conjuncts.add(LenNode.mkAnd(implicitLenFormula));
    conjuncts.add(LenNode.mkAnd(computedLenFormula));

    final Set<Term> vars = formula.vars();
    for (Term var : new TreeSet<>(autAss.vars())) {
      if (!vars.contains(var)) conjuncts.add(lengthsOfLanguage(var));
    }
    return Pair.of(LenNode.mkAnd(conjuncts), precision);
  }

  private LenNode lengthsOfLanguage(Term var) {
    final List<LenNode> options = new ArrayList<>();
    for (Pair<Integer, Integer> lengths : autAss.wordLengths(var)) {
      final int offset = lengths.getLeft(), period = lengths.getRight();
      if (period == 0) {
        options.add(mkEq(mkTerm(var), mkConst(offset)));
      } else {
        final LenNode k = mkVar(names.name(names.fresh(PERIOD_PREFIX)));
        options.add(
            LenNode.mkAnd(
                mkLe(mkConst(0), k),
                mkEq(mkTerm(var), mkPlus(mkConst(offset), mkTimes(period, k)))));
      }
    }
    return LenNode.mkOr(options);
  }
}
