package wordeq.solver;

import wordeq.formula.automata.BricsNfaFactory;
import wordeq.formula.automata.NfaFactory;

/** Settings read once from JVM system properties. */
public abstract class SolverConfig {
  /** Z3 timeout in milliseconds. */
  public static final Integer smtTimeout = Integer.getInteger("wordeq.smt_timeout", 2000);
  /** Minimal number of occurrences for a regular run to be folded into a fresh variable. */
  public static final Integer reduceRegularMin = Integer.getInteger("wordeq.reduce_regular_min", 2);
  /** Letters of the alphabet, <code>null</code> for the whole character range. */
  public static final String alphabet = System.getProperty("wordeq.alphabet");

  private SolverConfig() {}

  public static NfaFactory defaultNfaFactory() {
    return new BricsNfaFactory(alphabet);
  }
}
