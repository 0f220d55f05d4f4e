package wordeq.formula;

public enum TermKind {
  VARIABLE,
  LITERAL,
  LENGTH,
  SUBSTRING,
  INDEX_OF;
}
