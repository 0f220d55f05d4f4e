package wordeq.solver.lenform;

/**
 * Whether a length formula is equisatisfiable with the string formula it was derived from
 * (<code>EXACT</code>) or only implies it (<code>UNDERAPPROX</code>: a model proves SAT, UNSAT
 * proves nothing).
 */
public enum LenNodePrecision {
  EXACT,
  UNDERAPPROX;

  public LenNodePrecision join(LenNodePrecision other) {
    return this == UNDERAPPROX || other == UNDERAPPROX ? UNDERAPPROX : EXACT;
  }
}
