package wordeq.formula;

import static java.util.Objects.requireNonNull;

final class TermImpl implements Term {
  private final TermKind kind;
  private final String name;

  TermImpl(TermKind kind, String name) {
    this.kind = requireNonNull(kind);
    this.name = requireNonNull(name);
  }

  @Override
  public TermKind kind() {
    return kind;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Term)) return false;
    final Term that = (Term) o;
    return kind == that.kind() && name.equals(that.name());
  }

  @Override
  public int hashCode() {
    return kind.hashCode() ^ (name.hashCode() << 1);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case VARIABLE -> name;
      case LITERAL -> "'" + name + "'";
      default -> kind.name().toLowerCase() + "(" + name + ")";
    };
  }
}
