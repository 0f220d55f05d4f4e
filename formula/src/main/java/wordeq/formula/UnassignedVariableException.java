package wordeq.formula;

import java.util.NoSuchElementException;

/** A variable was looked up in an automaton assignment that does not bind it. */
public class UnassignedVariableException extends NoSuchElementException {
  private final Term var;

  public UnassignedVariableException(Term var) {
    super("no automaton assigned to " + var);
    this.var = var;
  }

  public Term var() {
    return var;
  }
}
