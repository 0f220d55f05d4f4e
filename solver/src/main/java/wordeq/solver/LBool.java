package wordeq.solver;

/** Outcome of a decision step. <code>UNDEF</code> means the step does not apply. */
public enum LBool {
  TRUE,
  FALSE,
  UNDEF;

  public static LBool of(boolean b) {
    return b ? TRUE : FALSE;
  }
}
