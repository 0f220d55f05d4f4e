package wordeq.formula;

/**
 * A term of a word equation. Variables and literals carry a name; for a literal the name is the
 * literal's value. Equality and ordering are structural: kind first, then name.
 */
public interface Term extends Comparable<Term> {

  TermKind kind();

  String name();

  default boolean isVariable() {
    return kind() == TermKind.VARIABLE;
  }

  default boolean isLiteral() {
    return kind() == TermKind.LITERAL;
  }

  default boolean isKind(TermKind kind) {
    return kind() == kind;
  }

  @Override
  default int compareTo(Term other) {
    final int res = kind().compareTo(other.kind());
    if (res != 0) return res;
    return name().compareTo(other.name());
  }

  static Term mkVar(String name) {
    return new TermImpl(TermKind.VARIABLE, name);
  }

  static Term mkLiteral(String value) {
    return new TermImpl(TermKind.LITERAL, value);
  }

  static Term mk(TermKind kind, String name) {
    return new TermImpl(kind, name);
  }
}
