package wordeq.formula;

public enum PredKind {
  EQUATION("="),
  INEQUATION("!="),
  CONTAINS("contains");

  private final String text;

  PredKind(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }

  public boolean isEqOrIneq() {
    return this == EQUATION || this == INEQUATION;
  }
}
