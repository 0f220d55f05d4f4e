package wordeq.formula.automata;

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Optional;

/**
 * A finite automaton as seen by the solver. Implementations bind an automaton library; the solver
 * relies on nothing but these operations. Values are immutable: every operation returns a new
 * automaton.
 *
 * <p>Complement and universality are relative to the alphabet of the {@link NfaFactory} that
 * created the automaton.
 */
public interface Nfa {

  Nfa concatenate(Nfa other);

  Nfa intersection(Nfa other);

  Nfa complement();

  Nfa minimize();

  Nfa removeEpsilon();

  boolean isEmpty();

  boolean isEquivalent(Nfa other);

  int numberOfStates();

  int numberOfTransitions();

  /** Whether the initial state is accepting. */
  boolean acceptsEpsilon();

  boolean accepts(String word);

  boolean isFinite();

  boolean isUniversal();

  /** Length of the shortest accepted word, -1 for the empty language. */
  int shortestWordLength();

  /**
   * Length of the longest accepted word, -1 for the empty language.
   *
   * @throws IllegalStateException if the language is infinite
   */
  int longestWordLength();

  /** The only accepted word, if the language has exactly one. */
  Optional<String> singletonWord();

  /**
   * Lengths of accepted words as a union of arithmetic progressions: each pair <code>(a, p)</code>
   * stands for <code>{a + p * k | k >= 0}</code>, where <code>p = 0</code> means the single length
   * <code>a</code>.
   */
  List<Pair<Integer, Integer>> wordLengths();
}
