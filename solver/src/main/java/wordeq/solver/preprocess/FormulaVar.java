package wordeq.solver.preprocess;

import wordeq.formula.Formula;
import wordeq.formula.Predicate;
import wordeq.formula.SidedPredicate;
import wordeq.formula.Term;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A formula with its predicates numbered and an occurrence index from every term to the places it
 * occurs at. Adding a predicate that is already present is a no-op.
 */
public class FormulaVar {
  private final TreeMap<Integer, Predicate> predicates;
  private final Set<Predicate> allPreds;
  private final TreeMap<Term, Set<VarNode>> varmap;
  private int nextIndex;

  public FormulaVar(Formula formula) {
    this.predicates = new TreeMap<>();
    this.allPreds = new HashSet<>();
    this.varmap = new TreeMap<>();
    for (Predicate pred : formula.predicates()) addPredicate(pred);
  }

  public Map<Integer, Predicate> predicates() {
    return Collections.unmodifiableMap(predicates);
  }

  public Predicate predicate(int index) {
    return predicates.get(index);
  }

  public Set<Predicate> predicatesSet() {
    return new TreeSet<>(predicates.values());
  }

  public int size() {
    return predicates.size();
  }

  public Map<Term, Set<VarNode>> varmap() {
    return Collections.unmodifiableMap(varmap);
  }

  /** @return false if the predicate was already present */
  public boolean addPredicate(Predicate pred) {
    if (!allPreds.add(pred)) return false;
    final int index = nextIndex++;
    predicates.put(index, pred);
    indexOccurrences(pred, index);
    return true;
  }

  public void removePredicate(int index) {
    final Predicate pred = predicates.remove(index);
    if (pred == null) return;
    allPreds.remove(pred);
    for (VarNode node : varPositions(pred, index)) {
      final Set<VarNode> nodes = varmap.get(node.term());
      if (nodes != null) nodes.remove(node);
    }
  }

  /**
   * Puts <code>pred</code> in place of the predicate numbered <code>index</code>. If an equal
   * predicate is already present elsewhere the slot is dropped instead.
   */
  public void updatePredicate(int index, Predicate pred) {
    removePredicate(index);
    if (!allPreds.add(pred)) return;
    predicates.put(index, pred);
    indexOccurrences(pred, index);
  }

  /**
   * Replaces every occurrence of <code>find</code> in all predicates by <code>replacement</code>.
   * Occurrence sets left empty are kept until {@link #cleanVarmap()}.
   *
   * @return whether some predicate changed
   */
  public boolean replace(List<Term> find, List<Term> replacement) {
    boolean modified = false;
    for (Integer index : List.copyOf(predicates.keySet())) {
      final Optional<Predicate> res = predicates.get(index).replace(find, replacement);
      if (res.isPresent()) {
        updatePredicate(index, res.get());
        modified = true;
      }
    }
    return modified;
  }

  public void cleanVarmap() {
    varmap.values().removeIf(Set::isEmpty);
  }

  public Set<VarNode> getVarPositions(Term term) {
    final Set<VarNode> nodes = varmap.get(term);
    return nodes == null ? Collections.emptySet() : Collections.unmodifiableSet(nodes);
  }

  public int occurrences(Term term) {
    return getVarPositions(term).size();
  }

  /** Variables with at least one occurrence. */
  public Set<Term> vars() {
    final Set<Term> vars = new TreeSet<>();
    for (Map.Entry<Term, Set<VarNode>> entry : varmap.entrySet())
      if (entry.getKey().isVariable() && !entry.getValue().isEmpty()) vars.add(entry.getKey());
    return vars;
  }

  public Formula toFormula() {
    return new Formula(predicates.values());
  }

  /**
   * Occurrences of all terms of <code>pred</code>, as if it were numbered <code>index</code>.
   * Predicates other than (in)equations count positions through all parameters.
   */
  public static Set<VarNode> varPositions(Predicate pred, int index) {
    final Set<VarNode> nodes = new TreeSet<>();
    if (pred.isEqOrIneq()) {
      final SidedPredicate sided = pred.asSided();
      final List<Term> left = sided.left(), right = sided.right();
      for (int i = 0; i < left.size(); ++i) nodes.add(new VarNode(left.get(i), index, -(i + 1)));
      for (int i = 0; i < right.size(); ++i) nodes.add(new VarNode(right.get(i), index, i + 1));
    } else {
      int pos = 0;
      for (List<Term> param : pred.params())
        for (Term t : param) nodes.add(new VarNode(t, index, ++pos));
    }
    return nodes;
  }

  private void indexOccurrences(Predicate pred, int index) {
    for (VarNode node : varPositions(pred, index))
      varmap.computeIfAbsent(node.term(), ignored -> new TreeSet<>()).add(node);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    for (Map.Entry<Integer, Predicate> entry : predicates.entrySet())
      builder.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
    for (Map.Entry<Term, Set<VarNode>> entry : varmap.entrySet())
      builder.append(entry.getKey()).append(" -> ").append(entry.getValue()).append('\n');
    return builder.toString();
  }
}
