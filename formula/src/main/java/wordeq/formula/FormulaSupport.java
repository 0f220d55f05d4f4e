package wordeq.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Textual (in)equations: whitespace separated terms, literals in single quotes, sides separated by
 * <code>=</code> or <code>!=</code>. An empty side is written as <code>''</code> or left blank.
 *
 * <pre>
 *   x1 'ab' x2 = y1
 *   x != 'a'
 * </pre>
 */
public abstract class FormulaSupport {

  private FormulaSupport() {}

  public static Formula parseFormula(String... lines) {
    final Formula formula = new Formula();
    for (String line : lines) formula.addPredicate(parsePredicate(line));
    return formula;
  }

  public static Predicate parsePredicate(String text) {
    final List<String> tokens = tokenize(text);
    int sep = -1;
    for (int i = 0; i < tokens.size(); ++i) {
      final String token = tokens.get(i);
      if (token.equals("=") || token.equals("!=")) {
        if (sep >= 0) throw new IllegalArgumentException("more than one relation in: " + text);
        sep = i;
      }
    }
    if (sep < 0) throw new IllegalArgumentException("missing '=' or '!=' in: " + text);

    final List<Term> left = parseConcat(tokens.subList(0, sep));
    final List<Term> right = parseConcat(tokens.subList(sep + 1, tokens.size()));
    return tokens.get(sep).equals("=")
        ? Predicate.mkEquation(left, right)
        : Predicate.mkInequation(left, right);
  }

  public static List<Term> parseConcat(String text) {
    return parseConcat(tokenize(text));
  }

  private static List<Term> parseConcat(List<String> tokens) {
    final List<Term> concat = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      if (token.startsWith("'")) {
        final String value = token.substring(1, token.length() - 1);
        // '' only marks an empty side
        if (!value.isEmpty()) concat.add(Term.mkLiteral(value));
      } else {
        concat.add(Term.mkVar(token));
      }
    }
    return concat;
  }

  private static List<String> tokenize(String text) {
    final List<String> tokens = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        ++i;
      } else if (c == '\'') {
        final int end = text.indexOf('\'', i + 1);
        if (end < 0) throw new IllegalArgumentException("unterminated literal in: " + text);
        tokens.add(text.substring(i, end + 1));
        i = end + 1;
      } else {
        int end = i;
        while (end < text.length()
            && !Character.isWhitespace(text.charAt(end))
            && text.charAt(end) != '\'') ++end;
        tokens.add(text.substring(i, end));
        i = end;
      }
    }
    return tokens;
  }
}
