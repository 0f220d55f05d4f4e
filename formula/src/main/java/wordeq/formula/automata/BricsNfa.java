package wordeq.formula.automata;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.State;
import dk.brics.automaton.Transition;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link Nfa} over a dk.brics.automaton {@link Automaton}. The wrapped automaton is never mutated
 * in place; operations that mutate in brics work on a clone.
 */
class BricsNfa implements Nfa {
  private static final char UNARY_LETTER = 'a';

  private final Automaton automaton;
  private final BricsNfaFactory factory;

  BricsNfa(Automaton automaton, BricsNfaFactory factory) {
    this.automaton = automaton;
    this.factory = factory;
  }

  private static Automaton unwrap(Nfa nfa) {
    if (!(nfa instanceof BricsNfa))
      throw new IllegalArgumentException("not a brics automaton: " + nfa.getClass());
    return ((BricsNfa) nfa).automaton;
  }

  @Override
  public Nfa concatenate(Nfa other) {
    return factory.wrap(automaton.concatenate(unwrap(other)));
  }

  @Override
  public Nfa intersection(Nfa other) {
    return factory.wrap(automaton.intersection(unwrap(other)));
  }

  @Override
  public Nfa complement() {
    return factory.wrap(factory.sigmaStar().minus(automaton));
  }

  @Override
  public Nfa minimize() {
    final Automaton copy = automaton.clone();
    copy.minimize();
    return factory.wrap(copy);
  }

  /** brics keeps automata free of epsilon transitions. */
  @Override
  public Nfa removeEpsilon() {
    return factory.wrap(automaton.clone());
  }

  @Override
  public boolean isEmpty() {
    return automaton.isEmpty();
  }

  @Override
  public boolean isEquivalent(Nfa other) {
    final Automaton that = unwrap(other);
    return automaton.subsetOf(that) && that.subsetOf(automaton);
  }

  @Override
  public int numberOfStates() {
    return automaton.getNumberOfStates();
  }

  @Override
  public int numberOfTransitions() {
    return automaton.getNumberOfTransitions();
  }

  @Override
  public boolean acceptsEpsilon() {
    return automaton.run("");
  }

  @Override
  public boolean accepts(String word) {
    return automaton.run(word);
  }

  @Override
  public boolean isFinite() {
    return automaton.isFinite();
  }

  @Override
  public boolean isUniversal() {
    return factory.sigmaStar().subsetOf(automaton);
  }

  @Override
  public int shortestWordLength() {
    final String example = automaton.getShortestExample(true);
    return example == null ? -1 : example.length();
  }

  @Override
  public int longestWordLength() {
    if (!automaton.isFinite()) throw new IllegalStateException("infinite language");
    final Automaton dfa = automaton.clone();
    dfa.minimize();
    final Set<State> live = liveStates(dfa);
    if (!live.contains(dfa.getInitialState())) return -1;
    return longestFrom(dfa.getInitialState(), live, new HashMap<>());
  }

  private static int longestFrom(State state, Set<State> live, Map<State, Integer> memo) {
    final Integer known = memo.get(state);
    if (known != null) return known;

    int longest = state.isAccept() ? 0 : -1;
    for (Transition t : state.getTransitions()) {
      if (!live.contains(t.getDest())) continue;
      final int sub = longestFrom(t.getDest(), live, memo);
      if (sub >= 0) longest = Math.max(longest, sub + 1);
    }
    memo.put(state, longest);
    return longest;
  }

  /** States from which some accepting state is reachable. */
  private static Set<State> liveStates(Automaton dfa) {
    final Set<State> states = dfa.getStates();
    final Map<State, Set<State>> predecessors = new HashMap<>();
    final List<State> worklist = new ArrayList<>();
    for (State s : states) {
      for (Transition t : s.getTransitions())
        predecessors.computeIfAbsent(t.getDest(), k -> new HashSet<>()).add(s);
      if (s.isAccept()) worklist.add(s);
    }
    final Set<State> live = new HashSet<>(worklist);
    while (!worklist.isEmpty()) {
      final State s = worklist.remove(worklist.size() - 1);
      for (State pred : predecessors.getOrDefault(s, Set.of())) {
        if (live.add(pred)) worklist.add(pred);
      }
    }
    return live;
  }

  @Override
  public Optional<String> singletonWord() {
    final Set<String> words = automaton.getFiniteStrings(1);
    if (words == null || words.size() != 1) return Optional.empty();
    return Optional.of(words.iterator().next());
  }

  @Override
  public List<Pair<Integer, Integer>> wordLengths() {
    // Project every letter to a single one; the minimal unary DFA is a lasso.
    final Map<State, State> copies = new HashMap<>();
    for (State s : automaton.getStates()) {
      final State copy = new State();
      copy.setAccept(s.isAccept());
      copies.put(s, copy);
    }
    for (State s : automaton.getStates())
      for (Transition t : s.getTransitions())
        copies.get(s).addTransition(new Transition(UNARY_LETTER, copies.get(t.getDest())));

    final Automaton unary = new Automaton();
    unary.setInitialState(copies.get(automaton.getInitialState()));
    unary.setDeterministic(false);
    unary.minimize();

    final List<State> path = new ArrayList<>();
    final Map<State, Integer> indexOf = new HashMap<>();
    State current = unary.getInitialState();
    while (current != null && !indexOf.containsKey(current)) {
      indexOf.put(current, path.size());
      path.add(current);
      current = current.step(UNARY_LETTER);
    }

    final int cycleStart = current == null ? path.size() : indexOf.get(current);
    final int period = path.size() - cycleStart;
    final List<Pair<Integer, Integer>> lengths = new ArrayList<>();
    for (int i = 0; i < path.size(); ++i) {
      if (path.get(i).isAccept()) lengths.add(Pair.of(i, i < cycleStart ? 0 : period));
    }
    return lengths;
  }

  @Override
  public String toString() {
    return automaton.toString();
  }
}
