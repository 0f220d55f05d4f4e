package wordeq.formula.automata;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.BasicAutomata;
import dk.brics.automaton.RegExp;

/**
 * Binds {@link Nfa} to dk.brics.automaton. The alphabet is either a given set of letters or, when
 * none is given, the whole char range.
 */
public class BricsNfaFactory implements NfaFactory {
  private final String alphabet;
  private final Automaton sigma;
  private final Automaton sigmaStar;

  public BricsNfaFactory() {
    this(null);
  }

  /** @param alphabet the letters of Sigma, or null for every char */
  public BricsNfaFactory(String alphabet) {
    this.alphabet = alphabet;
    this.sigma = alphabet == null ? BasicAutomata.makeAnyChar() : BasicAutomata.makeCharSet(alphabet);
    this.sigmaStar = sigma.repeat();
    this.sigmaStar.minimize();
  }

  public String alphabet() {
    return alphabet;
  }

  Automaton sigmaStar() {
    return sigmaStar;
  }

  Nfa wrap(Automaton automaton) {
    return new BricsNfa(automaton, this);
  }

  @Override
  public Nfa empty() {
    return wrap(BasicAutomata.makeEmpty());
  }

  @Override
  public Nfa epsilon() {
    return wrap(BasicAutomata.makeEmptyString());
  }

  @Override
  public Nfa word(String word) {
    return wrap(BasicAutomata.makeString(word));
  }

  @Override
  public Nfa anyWord() {
    return wrap(sigmaStar.clone());
  }

  @Override
  public Nfa anyWordOfLengthAtLeast(int n) {
    return wrap(sigma.repeat(n));
  }

  @Override
  public Nfa fromRegex(String regex) {
    final Automaton automaton = new RegExp(regex, RegExp.NONE).toAutomaton();
    return wrap(alphabet == null ? automaton : automaton.intersection(sigmaStar));
  }
}
