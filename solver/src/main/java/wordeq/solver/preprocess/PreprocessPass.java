package wordeq.solver.preprocess;

import java.util.List;

public enum PreprocessPass {
  REMOVE_TRIVIAL,
  REMOVE_REGULAR,
  REDUCE_DISEQUALITIES,
  UNDERAPPROX_LANGUAGES,
  PROPAGATE_EPS,
  PROPAGATE_VARIABLES,
  GENERATE_IDENTITIES,
  REDUCE_REGULAR_SEQUENCE,
  SEPARATE_EQS;

  /** Passes run before length abstraction. */
  public static final List<PreprocessPass> LENGTH_SCHEDULE =
      List.of(
          REMOVE_TRIVIAL,
          REDUCE_DISEQUALITIES,
          UNDERAPPROX_LANGUAGES,
          PROPAGATE_EPS,
          PROPAGATE_VARIABLES,
          GENERATE_IDENTITIES,
          PROPAGATE_VARIABLES,
          REMOVE_TRIVIAL);

  /** Passes run before an automata-based procedure. Keeps languages exact. */
  public static final List<PreprocessPass> GENERAL_SCHEDULE =
      List.of(
          REMOVE_REGULAR,
          PROPAGATE_VARIABLES,
          PROPAGATE_EPS,
          GENERATE_IDENTITIES,
          PROPAGATE_VARIABLES,
          REMOVE_REGULAR,
          REDUCE_REGULAR_SEQUENCE,
          SEPARATE_EQS,
          PROPAGATE_EPS,
          REMOVE_TRIVIAL);
}
