package wordeq.formula;

import org.apache.commons.lang3.tuple.Pair;
import wordeq.formula.automata.Nfa;
import wordeq.formula.automata.NfaFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps each string variable to the automaton of the language it can still take. Automata may be
 * shared by variables proven to be language-equal.
 */
public class AutAssignment {
  private final NfaFactory factory;
  private final TreeMap<Term, Nfa> assignment;

  public AutAssignment(NfaFactory factory) {
    this.factory = factory;
    this.assignment = new TreeMap<>();
  }

  private AutAssignment(NfaFactory factory, Map<Term, Nfa> assignment) {
    this.factory = factory;
    this.assignment = new TreeMap<>(assignment);
  }

  public NfaFactory factory() {
    return factory;
  }

  /** @throws UnassignedVariableException if <code>var</code> is not bound */
  public Nfa at(Term var) {
    final Nfa nfa = assignment.get(var);
    if (nfa == null) throw new UnassignedVariableException(var);
    return nfa;
  }

  public void put(Term var, Nfa nfa) {
    assert var.isVariable();
    assignment.put(var, nfa);
  }

  public boolean contains(Term var) {
    return assignment.containsKey(var);
  }

  public void remove(Term var) {
    assignment.remove(var);
  }

  public Set<Term> vars() {
    return Collections.unmodifiableSet(assignment.keySet());
  }

  public Set<Map.Entry<Term, Nfa>> entries() {
    return Collections.unmodifiableSet(assignment.entrySet());
  }

  public int size() {
    return assignment.size();
  }

  /** Narrows the language of <code>var</code> to its intersection with <code>nfa</code>. */
  public void restrict(Term var, Nfa nfa) {
    put(var, at(var).intersection(nfa).minimize());
  }

  /**
   * The automaton of a concatenation, built left to right from the epsilon automaton. Literals stand
   * for their own word.
   *
   * @throws UnassignedVariableException if a variable of <code>concat</code> is not bound
   */
  public Nfa languageOfConcat(List<Term> concat) {
    Nfa res = factory.epsilon();
    for (Term t : concat) {
      res = res.concatenate(t.isLiteral() ? factory.word(t.name()) : at(t));
    }
    return res;
  }

  /** Whether the language of <code>var</code> is exactly the empty word. */
  public boolean isEpsilonOnly(Term var) {
    final Nfa nfa = at(var).removeEpsilon().minimize();
    return nfa.numberOfTransitions() == 0 && nfa.numberOfStates() == 1 && nfa.acceptsEpsilon();
  }

  public boolean isSingleton(Term var) {
    return at(var).singletonWord().isPresent();
  }

  public Optional<String> singletonWord(Term var) {
    return at(var).singletonWord();
  }

  public boolean isUniversal(Term var) {
    return at(var).isUniversal();
  }

  /** Whether the complement of the language of <code>var</code> is finite. */
  public boolean isCoFinite(Term var) {
    return at(var).complement().isFinite();
  }

  /**
   * Whether the language of <code>var</code> is "any word of length at least n" for some n, i.e. the
   * variable is constrained by its length only.
   */
  public boolean isLengthOnly(Term var) {
    final Nfa nfa = at(var);
    final int shortest = nfa.shortestWordLength();
    return shortest >= 0 && nfa.isEquivalent(factory.anyWordOfLengthAtLeast(shortest));
  }

  public List<Pair<Integer, Integer>> wordLengths(Term var) {
    return at(var).wordLengths();
  }

  /** Minimizes every automaton of the assignment. */
  public void reduce() {
    assignment.replaceAll((var, nfa) -> nfa.minimize());
  }

  /** False iff some variable is bound to the empty language. */
  public boolean isSatisfiable() {
    for (Nfa nfa : assignment.values()) if (nfa.isEmpty()) return false;
    return true;
  }

  /** Adds the bindings of <code>other</code> for variables not yet bound here. */
  public void merge(AutAssignment other) {
    for (Map.Entry<Term, Nfa> entry : other.assignment.entrySet()) {
      assignment.putIfAbsent(entry.getKey(), entry.getValue());
    }
  }

  public AutAssignment copy() {
    return new AutAssignment(factory, assignment);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    for (Map.Entry<Term, Nfa> entry : assignment.entrySet()) {
      builder.append(entry.getKey()).append(" -> ").append(entry.getValue().numberOfStates())
          .append(" states\n");
    }
    return builder.toString();
  }
}
