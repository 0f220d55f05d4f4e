package wordeq.solver.logic;

import com.microsoft.z3.*;
import org.apache.commons.lang3.tuple.Pair;
import wordeq.solver.LBool;
import wordeq.solver.SolverConfig;
import wordeq.solver.lenform.LenNode;
import wordeq.solver.lenform.LenNodePrecision;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/** Checks length formulas with Z3. Lengths and begin offsets become integer constants. */
public abstract class LenSolverSupport {
  private static final Logger LOG = Logger.getLogger(LenSolverSupport.class.getName());

  static {
    Global.setParameter("smt.random_seed", "9876543210");
    Global.setParameter("timeout", SolverConfig.smtTimeout.toString());
  }

  private LenSolverSupport() {}

  public static LBool check(LenNode formula) {
    try (final Context z3 = new Context()) {
      final Solver s = z3.mkSolver();
      s.add(formula.transToSMTBool(z3, new HashMap<>()));
      return toLBool(s.check());
    }
  }

  /**
   * Verdict on the string formula a length formula was derived from. An unsatisfiable
   * underapproximation proves nothing and yields <code>UNDEF</code>.
   */
  public static LBool decide(Pair<LenNode, LenNodePrecision> lengths) {
    final LBool res = check(lengths.getLeft());
    if (res == LBool.FALSE && lengths.getRight() == LenNodePrecision.UNDERAPPROX) return LBool.UNDEF;
    return res;
  }

  /** A model of <code>formula</code>, with a value for each of its integer variables. */
  public static Optional<Map<String, Long>> findModel(LenNode formula) {
    try (final Context z3 = new Context()) {
      final Map<String, IntExpr> varDef = new HashMap<>();
      final Solver s = z3.mkSolver();
      s.add(formula.transToSMTBool(z3, varDef));
      final Status q = s.check();
      if (q != Status.SATISFIABLE) {
        if (q == Status.UNKNOWN) LOG.fine(() -> "unknown: " + s.getReasonUnknown());
        return Optional.empty();
      }

      final Model model = s.getModel();
      final Map<String, Long> values = new TreeMap<>();
      for (Map.Entry<String, IntExpr> entry : varDef.entrySet()) {
        final IntNum value = (IntNum) model.eval(entry.getValue(), true);
        values.put(entry.getKey(), value.getInt64());
      }
      return Optional.of(values);
    }
  }

  private static LBool toLBool(Status status) {
    return switch (status) {
      case SATISFIABLE -> LBool.TRUE;
      case UNSATISFIABLE -> LBool.FALSE;
      case UNKNOWN -> LBool.UNDEF;
    };
  }
}
