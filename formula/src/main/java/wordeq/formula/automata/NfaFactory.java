package wordeq.formula.automata;

/** Creates automata over one fixed alphabet. */
public interface NfaFactory {

  Nfa empty();

  Nfa epsilon();

  Nfa word(String word);

  /** Sigma*, the language of a variable with no regular constraint. */
  Nfa anyWord();

  /** Sigma^n Sigma*. */
  Nfa anyWordOfLengthAtLeast(int n);

  Nfa fromRegex(String regex);
}
