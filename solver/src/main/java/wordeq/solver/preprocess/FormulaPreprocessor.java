package wordeq.solver.preprocess;

import wordeq.formula.AutAssignment;
import wordeq.formula.Formula;
import wordeq.formula.Predicate;
import wordeq.formula.SidedPredicate;
import wordeq.formula.SidedPredicate.Side;
import wordeq.formula.Term;
import wordeq.formula.automata.Nfa;
import wordeq.formula.automata.NfaFactory;
import wordeq.solver.SolverConfig;
import wordeq.solver.lenform.LenNode;
import wordeq.solver.lenform.LenNodePrecision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

import static wordeq.solver.lenform.LenNode.mkConst;
import static wordeq.solver.lenform.LenNode.mkEq;
import static wordeq.solver.lenform.LenNode.mkTerm;

/**
 * Rewrites a formula together with its automaton assignment into a simpler equisatisfiable one.
 * Each pass mutates the state in place; once a contradiction is found {@link #containsUnsat()}
 * holds and further passes are no-ops.
 *
 * <p>Length facts discovered on the way (for length-sensitive variables) are collected and exposed
 * by {@link #getLenFormula()}.
 */
public class FormulaPreprocessor {
  private static final Logger LOG = Logger.getLogger(FormulaPreprocessor.class.getName());
  private static final String FRESH_PREFIX = "tmp!";

  private final FormulaVar formula;
  private final AutAssignment autAss;
  private final Set<Term> lenVars;
  private final Set<LenNode> lenFormula;
  private int nextFresh;
  private boolean unsat;

  /** Variables of <code>formula</code> missing from <code>autAss</code> get the universal language. */
  public FormulaPreprocessor(Formula formula, AutAssignment autAss, Set<Term> lenVars) {
    this.formula = new FormulaVar(formula);
    this.autAss = autAss.copy();
    this.lenVars = new TreeSet<>(lenVars);
    this.lenFormula = new LinkedHashSet<>();
    for (Term var : formula.vars())
      if (!this.autAss.contains(var)) this.autAss.put(var, this.autAss.factory().anyWord());
  }

  public FormulaPreprocessor(Formula formula, NfaFactory factory) {
    this(formula, new AutAssignment(factory), Collections.emptySet());
  }

  public FormulaPreprocessor(Formula formula) {
    this(formula, SolverConfig.defaultNfaFactory());
  }

  public FormulaVar getFormula() {
    return formula;
  }

  public Formula getModifiedFormula() {
    return formula.toFormula();
  }

  public AutAssignment getAutAssignment() {
    return autAss;
  }

  public Set<Term> getLenVariables() {
    return Collections.unmodifiableSet(lenVars);
  }

  public LenNode getLenFormula() {
    return LenNode.mkAnd(new ArrayList<>(lenFormula));
  }

  /**
   * Whether a contradiction was found by a pass, or some predicate is false regardless of the
   * assignment: <code>u != u</code>, or two different words equated.
   */
  public boolean containsUnsat() {
    if (unsat) return true;
    for (Predicate pred : formula.predicates().values()) {
      if (!pred.isEqOrIneq()) continue;
      final SidedPredicate sided = pred.asSided();
      if (pred.isInequation() && sided.isTrivial()) return true;
      if (pred.isEquation()
          && isPureLiteral(sided.left())
          && isPureLiteral(sided.right())
          && !concatWord(sided.left()).equals(concatWord(sided.right()))) return true;
    }
    return false;
  }

  /** Runs the passes in order and returns the precision of the result. */
  public LenNodePrecision run(List<PreprocessPass> schedule) {
    LenNodePrecision precision = LenNodePrecision.EXACT;
    for (PreprocessPass pass : schedule) {
      if (unsat) break;
      precision = precision.join(apply(pass));
      LOG.fine(() -> "after " + pass + ":\n" + formula);
    }
    return precision;
  }

  public LenNodePrecision apply(PreprocessPass pass) {
    switch (pass) {
      case REMOVE_TRIVIAL -> removeTrivial();
      case REMOVE_REGULAR -> removeRegular();
      case REDUCE_DISEQUALITIES -> reduceDiseqalities();
      case UNDERAPPROX_LANGUAGES -> {
        return underapproxLanguages();
      }
      case PROPAGATE_EPS -> propagateEps();
      case PROPAGATE_VARIABLES -> propagateVariables();
      case GENERATE_IDENTITIES -> generateIdentities();
      case REDUCE_REGULAR_SEQUENCE -> reduceRegularSequence(SolverConfig.reduceRegularMin);
      case SEPARATE_EQS -> separateEqs();
    }
    return LenNodePrecision.EXACT;
  }

  /** Drops equations with syntactically identical sides. */
  public void removeTrivial() {
    for (int index : indices()) {
      final Predicate pred = formula.predicate(index);
      if (pred != null && pred.isEquation() && pred.asSided().isTrivial())
        formula.removePredicate(index);
    }
  }

  /**
   * Drops equations <code>X = t1 ... tn</code> whose right-hand variables occur nowhere else and are
   * not length-sensitive, intersecting the language of <code>X</code> with the language of the
   * concatenation instead.
   */
  public void removeRegular() {
    boolean changed = true;
    while (changed && !unsat) {
      changed = false;
      for (int index : indices()) {
        final Predicate pred = formula.predicate(index);
        if (pred == null || !pred.isEquation()) continue;
        final SidedPredicate eq = pred.asSided();
        for (Side side : Side.values()) {
          if (!isRegularDefinition(eq, side)) continue;
          final Term var = eq.side(side).get(0);
          autAss.restrict(var, autAss.languageOfConcat(eq.side(opposite(side))));
          formula.removePredicate(index);
          LOG.fine(() -> "regular definition of " + var + ": " + eq);
          if (autAss.at(var).isEmpty()) markUnsat("empty language of " + var);
          changed = true;
          break;
        }
        if (unsat) return;
      }
    }
    formula.cleanVarmap();
  }

  private boolean isRegularDefinition(SidedPredicate eq, Side side) {
    final List<Term> single = eq.side(side);
    if (single.size() != 1 || !single.get(0).isVariable()) return false;
    final Term var = single.get(0);
    for (Term t : eq.side(opposite(side))) {
      if (!t.isVariable()) continue;
      if (t.equals(var) || lenVars.contains(t) || formula.occurrences(t) != 1) return false;
    }
    return true;
  }

  /**
   * Eliminates equations <code>x = y</code> between two variables, also after dropping a common
   * prefix and suffix of both sides: <code>y</code> is renamed to <code>x</code> everywhere and both
   * get the intersection of their languages.
   */
  public void propagateVariables() {
    boolean changed = true;
    while (changed && !unsat) {
      changed = false;
      for (int index : indices()) {
        final Predicate pred = formula.predicate(index);
        if (pred == null || !pred.isEquation()) continue;
        final SidedPredicate eq = stripCommon(pred.asSided());
        if (!isVarEquation(eq)) continue;

        final Term x = eq.left().get(0), y = eq.right().get(0);
        formula.removePredicate(index);
        final Nfa joined = autAss.at(x).intersection(autAss.at(y)).minimize();
        autAss.put(x, joined);
        autAss.put(y, joined);
        formula.replace(List.of(y), List.of(x));
        if (lenVars.contains(y)) {
          lenFormula.add(mkEq(mkTerm(x), mkTerm(y)));
          lenVars.add(x);
        }
        if (joined.isEmpty()) markUnsat("empty language of " + x);
        changed = true;
        break;
      }
    }
    formula.cleanVarmap();
  }

  private static boolean isVarEquation(SidedPredicate eq) {
    return eq.left().size() == 1
        && eq.right().size() == 1
        && eq.left().get(0).isVariable()
        && eq.right().get(0).isVariable()
        && !eq.left().equals(eq.right());
  }

  /**
   * Forces to epsilon every variable equated with a side that can only be empty, then removes
   * epsilon variables from all predicates.
   */
  public void propagateEps() {
    final NfaFactory factory = autAss.factory();
    final Set<Term> epsVars = new TreeSet<>();
    for (Term var : formula.vars()) if (autAss.isEpsilonOnly(var)) epsVars.add(var);

    boolean changed = true;
    while (changed && !unsat) {
      changed = false;
      for (Predicate pred : formula.predicates().values()) {
        if (!pred.isEquation()) continue;
        final SidedPredicate eq = pred.asSided();
        for (Side side : Side.values()) {
          if (!allEps(eq.side(side), epsVars)) continue;
          for (Term t : eq.side(opposite(side))) {
            if (t.isLiteral()) {
              if (!t.name().isEmpty()) markUnsat("empty side equated with " + eq);
            } else if (epsVars.add(t)) {
              autAss.restrict(t, factory.epsilon());
              if (autAss.at(t).isEmpty()) markUnsat("epsilon not in the language of " + t);
              changed = true;
            }
          }
        }
      }
    }
    if (unsat) return;

    final Set<Term> dropped = new TreeSet<>(epsVars);
    dropped.add(Term.mkLiteral(""));
    for (int index : indices()) {
      final Predicate pred = formula.predicate(index);
      final Predicate res = pred.removeTerms(dropped);
      if (res.isEqOrIneq() && res.asSided().isTrivial()) {
        if (res.isInequation()) {
          markUnsat("trivial inequation " + res);
          return;
        }
        formula.removePredicate(index);
      } else if (!res.equals(pred)) {
        formula.updatePredicate(index, res);
      }
    }
    for (Term var : epsVars) if (lenVars.contains(var)) lenFormula.add(mkEq(mkTerm(var), mkConst(0)));
    formula.cleanVarmap();
  }

  private static boolean allEps(List<Term> side, Set<Term> epsVars) {
    for (Term t : side) {
      if (t.isLiteral() ? !t.name().isEmpty() : !epsVars.contains(t)) return false;
    }
    return true;
  }

  /**
   * Adds, without removing anything, the equations obtained by cancelling common prefixes and
   * suffixes, and by equating the other sides of two equations sharing a side.
   */
  public void generateIdentities() {
    final List<SidedPredicate> eqs = new ArrayList<>();
    for (Predicate pred : formula.predicates().values()) if (pred.isEquation()) eqs.add(pred.asSided());

    final List<Predicate> identities = new ArrayList<>();
    for (SidedPredicate eq : eqs) {
      final SidedPredicate stripped = stripCommon(eq);
      if (stripped != eq && !stripped.isTrivial()) identities.add(stripped);
    }
    for (int i = 0; i < eqs.size(); ++i)
      for (int j = i + 1; j < eqs.size(); ++j)
        for (Side s1 : Side.values())
          for (Side s2 : Side.values()) {
            if (!eqs.get(i).side(s1).equals(eqs.get(j).side(s2))) continue;
            final SidedPredicate identity =
                stripCommon(
                    Predicate.mkEquation(
                        eqs.get(i).side(opposite(s1)), eqs.get(j).side(opposite(s2))));
            if (!identity.isTrivial()) identities.add(identity);
          }

    for (Predicate identity : identities) formula.addPredicate(identity);
  }

  /**
   * Simplifies inequations: identical sides are a contradiction, a side that is a single variable
   * against a word shrinks the variable's language, sides that can never be equal are dropped.
   */
  public void reduceDiseqalities() {
    for (int index : indices()) {
      final Predicate pred = formula.predicate(index);
      if (pred == null || !pred.isInequation()) continue;

      final SidedPredicate ineq = stripCommon(substituteSingletons(pred.asSided()));
      if (ineq.isTrivial()) {
        markUnsat("inequation with identical sides " + pred);
        return;
      }

      final List<Term> left = ineq.left(), right = ineq.right();
      if (isPureLiteral(left) && isPureLiteral(right)) {
        if (concatWord(left).equals(concatWord(right))) {
          markUnsat("inequation between equal words " + pred);
          return;
        }
        formula.removePredicate(index);
      } else if (autAss.languageOfConcat(left).intersection(autAss.languageOfConcat(right)).isEmpty()) {
        formula.removePredicate(index);
      } else if (isSingleVar(left) && isPureLiteral(right)) {
        excludeWord(index, left.get(0), concatWord(right));
      } else if (isSingleVar(right) && isPureLiteral(left)) {
        excludeWord(index, right.get(0), concatWord(left));
      } else if (!ineq.equals(pred)) {
        formula.updatePredicate(index, ineq);
      }
      if (unsat) return;
    }
    formula.cleanVarmap();
  }

  private void excludeWord(int index, Term var, String word) {
    final NfaFactory factory = autAss.factory();
    autAss.restrict(var, factory.word(word).complement());
    formula.removePredicate(index);
    if (autAss.at(var).isEmpty()) markUnsat("language of " + var + " is {" + word + "}");
  }

  private SidedPredicate substituteSingletons(SidedPredicate pred) {
    final Map<Term, List<Term>> replacement = new HashMap<>();
    for (Term var : pred.vars()) {
      final Optional<String> word = autAss.singletonWord(var);
      word.ifPresent(
          w -> replacement.put(var, w.isEmpty() ? List.of() : List.of(Term.mkLiteral(w))));
    }
    return replacement.isEmpty() ? pred : pred.substitute(replacement).asSided();
  }

  /**
   * Replaces every co-finite language that is not already a plain length bound by the words longer
   * than any excluded one.
   *
   * @return <code>UNDERAPPROX</code> if some language was replaced
   */
  public LenNodePrecision underapproxLanguages() {
    final NfaFactory factory = autAss.factory();
    LenNodePrecision precision = LenNodePrecision.EXACT;
    for (Term var : formula.vars()) {
      if (!autAss.isCoFinite(var) || autAss.isLengthOnly(var)) continue;
      final int longestExcluded = autAss.at(var).complement().longestWordLength();
      autAss.put(var, factory.anyWordOfLengthAtLeast(longestExcluded + 1));
      LOG.fine(() -> "underapproximated " + var + " to length >= " + (longestExcluded + 1));
      precision = LenNodePrecision.UNDERAPPROX;
    }
    return precision;
  }

  /**
   * Maximal runs of adjacent terms, inside equation sides, that behave as one regular unit: only
   * literals and variables that are not length-sensitive and occur in equations only, where every
   * occurrence of a variable of the run has the same neighbours. Runs consisting of literals only
   * are not reported.
   *
   * @return each run mapped to the number of its occurrences
   */
  public Map<List<Term>, Integer> getRegularSublists() {
    final Map<List<Term>, Integer> sublists = new TreeMap<>(Predicate::compareConcat);
    for (Predicate pred : formula.predicates().values()) {
      if (!pred.isEquation()) continue;
      for (List<Term> side : pred.params()) {
        int begin = 0;
        while (begin < side.size()) {
          int end = begin + 1;
          while (end < side.size() && glued(side.get(end - 1), side.get(end))) ++end;
          final List<Term> run = side.subList(begin, end);
          if (run.size() >= 2 && run.stream().anyMatch(Term::isVariable))
            sublists.merge(List.copyOf(run), 1, Integer::sum);
          begin = end;
        }
      }
    }
    return sublists;
  }

  private boolean glued(Term left, Term right) {
    if (!isRegularTerm(left) || !isRegularTerm(right)) return false;
    if (left.isVariable() && !allNeighbours(left, 1, right)) return false;
    return !right.isVariable() || allNeighbours(right, -1, left);
  }

  private boolean isRegularTerm(Term t) {
    if (t.isLiteral()) return true;
    if (!t.isVariable() || lenVars.contains(t)) return false;
    for (VarNode node : formula.getVarPositions(t))
      if (!formula.predicate(node.eqIndex()).isEquation()) return false;
    return true;
  }

  private boolean allNeighbours(Term var, int offset, Term expected) {
    for (VarNode node : formula.getVarPositions(var)) {
      final SidedPredicate eq = formula.predicate(node.eqIndex()).asSided();
      final List<Term> side = node.onLeft() ? eq.left() : eq.right();
      final int at = node.sideIndex() + offset;
      if (at < 0 || at >= side.size() || !side.get(at).equals(expected)) return false;
    }
    return true;
  }

  /**
   * Folds each regular run occurring at least <code>minOccurrences</code> times into a fresh
   * variable bound to the language of the run, and adds the defining equation
   * <code>fresh = run</code>.
   */
  public void reduceRegularSequence(int minOccurrences) {
    final List<Predicate> definitions = new ArrayList<>();
    for (Map.Entry<List<Term>, Integer> entry : getRegularSublists().entrySet()) {
      if (entry.getValue() < minOccurrences) continue;
      final List<Term> run = entry.getKey();
      final Term fresh = freshVar();
      autAss.put(fresh, autAss.languageOfConcat(run).minimize());
      if (formula.replace(run, List.of(fresh))) {
        definitions.add(Predicate.mkEquation(List.of(fresh), run));
      } else {
        autAss.remove(fresh);
      }
    }
    for (Predicate definition : definitions) formula.addPredicate(definition);
    formula.cleanVarmap();
  }

  private Term freshVar() {
    Term fresh;
    do {
      fresh = Term.mkVar(FRESH_PREFIX + nextFresh++);
    } while (autAss.contains(fresh));
    return fresh;
  }

  /**
   * Splits <code>P1 w S1 = P2 w S2</code> into <code>P1 = P2</code> and <code>S1 = S2</code>, where
   * both occurrences of the literal token <code>w</code> are forced to start at the same position
   * because no word of <code>P1</code> or <code>P2</code> contains the first letter of <code>w</code>.
   * The symmetric split is done with suffixes and the last letter.
   */
  public void separateEqs() {
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int index : indices()) {
        final Predicate pred = formula.predicate(index);
        if (pred == null || !pred.isEquation()) continue;
        final SidedPredicate eq = pred.asSided();
        Optional<List<Predicate>> split = splitFront(eq);
        if (split.isEmpty()) split = splitBack(eq);
        if (split.isEmpty()) continue;

        LOG.fine(() -> "separated " + eq);
        formula.removePredicate(index);
        for (Predicate part : split.get()) formula.addPredicate(part);
        changed = true;
      }
    }
    formula.cleanVarmap();
  }

  private Optional<List<Predicate>> splitFront(SidedPredicate eq) {
    final List<Term> left = eq.left(), right = eq.right();
    for (int i = 0; i < left.size(); ++i) {
      final Term lit = left.get(i);
      if (!lit.isLiteral() || lit.name().isEmpty()) continue;
      final Nfa containing = containingLetter(lit.name().charAt(0));
      if (!autAss.languageOfConcat(left.subList(0, i)).intersection(containing).isEmpty())
        continue;
      for (int j = 0; j < right.size(); ++j) {
        if (!right.get(j).equals(lit)) continue;
        if (!autAss.languageOfConcat(right.subList(0, j)).intersection(containing).isEmpty())
          continue;
        return Optional.of(
            splitAt(left.subList(0, i), right.subList(0, j),
                left.subList(i + 1, left.size()), right.subList(j + 1, right.size())));
      }
    }
    return Optional.empty();
  }

  private Optional<List<Predicate>> splitBack(SidedPredicate eq) {
    final List<Term> left = eq.left(), right = eq.right();
    for (int i = left.size() - 1; i >= 0; --i) {
      final Term lit = left.get(i);
      if (!lit.isLiteral() || lit.name().isEmpty()) continue;
      final Nfa containing = containingLetter(lit.name().charAt(lit.name().length() - 1));
      if (!autAss.languageOfConcat(left.subList(i + 1, left.size())).intersection(containing).isEmpty())
        continue;
      for (int j = right.size() - 1; j >= 0; --j) {
        if (!right.get(j).equals(lit)) continue;
        if (!autAss.languageOfConcat(right.subList(j + 1, right.size())).intersection(containing).isEmpty())
          continue;
        return Optional.of(
            splitAt(left.subList(0, i), right.subList(0, j),
                left.subList(i + 1, left.size()), right.subList(j + 1, right.size())));
      }
    }
    return Optional.empty();
  }

  private static List<Predicate> splitAt(
      List<Term> leftPrefix, List<Term> rightPrefix, List<Term> leftSuffix, List<Term> rightSuffix) {
    final List<Predicate> parts = new ArrayList<>(2);
    if (!leftPrefix.isEmpty() || !rightPrefix.isEmpty())
      parts.add(Predicate.mkEquation(leftPrefix, rightPrefix));
    if (!leftSuffix.isEmpty() || !rightSuffix.isEmpty())
      parts.add(Predicate.mkEquation(leftSuffix, rightSuffix));
    return parts;
  }

  private Nfa containingLetter(char c) {
    final NfaFactory factory = autAss.factory();
    return factory.anyWord().concatenate(factory.word(String.valueOf(c))).concatenate(factory.anyWord());
  }

  /** Replaces each occurrence of <code>find</code> in the formula. */
  public boolean replace(List<Term> find, List<Term> replacement) {
    return formula.replace(find, replacement);
  }

  public void cleanVarmap() {
    formula.cleanVarmap();
  }

  private void markUnsat(String reason) {
    LOG.info(() -> "unsat: " + reason);
    unsat = true;
  }

  private List<Integer> indices() {
    return new ArrayList<>(formula.predicates().keySet());
  }

  static SidedPredicate stripCommon(SidedPredicate pred) {
    final List<Term> left = pred.left(), right = pred.right();
    int prefix = 0;
    while (prefix < left.size() && prefix < right.size() && left.get(prefix).equals(right.get(prefix)))
      ++prefix;
    int suffix = 0;
    while (suffix < left.size() - prefix
        && suffix < right.size() - prefix
        && left.get(left.size() - 1 - suffix).equals(right.get(right.size() - 1 - suffix))) ++suffix;
    if (prefix == 0 && suffix == 0) return pred;
    return pred.withParams(
            List.of(
                left.subList(prefix, left.size() - suffix),
                right.subList(prefix, right.size() - suffix)))
        .asSided();
  }

  static boolean isPureLiteral(List<Term> side) {
    for (Term t : side) if (!t.isLiteral()) return false;
    return true;
  }

  static String concatWord(List<Term> side) {
    final StringBuilder builder = new StringBuilder();
    for (Term t : side) builder.append(t.name());
    return builder.toString();
  }

  private static boolean isSingleVar(List<Term> side) {
    return side.size() == 1 && side.get(0).isVariable();
  }

  private static Side opposite(Side side) {
    return side == Side.LEFT ? Side.RIGHT : Side.LEFT;
  }

  @Override
  public String toString() {
    return formula + "\n" + autAss;
  }
}
