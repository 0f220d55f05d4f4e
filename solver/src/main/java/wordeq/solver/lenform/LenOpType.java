package wordeq.solver.lenform;

public enum LenOpType {
  LCONST,
  LTERM,
  LPLUS,
  LTIMES,
  LEQ,
  LLE,
  LAND,
  LOR,
  LNOT,
  LTRUE;

  public boolean isArith() {
    return this == LCONST || this == LTERM || this == LPLUS || this == LTIMES;
  }
}
