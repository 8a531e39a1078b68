package ca.gc.cra.snapline.domain.selector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hand-written parser for selector expressions.
 *
 * <p>Grammar: {@code path := ["."] segment ("." segment)*} where a segment is an identifier, a quoted
 * string, a non-negative integer, {@code *} or {@code **}. Any segment may be followed by bracket
 * suffixes {@code [n]}, {@code ["key"]} or {@code []}.</p>
 *
 * @since 0.1.0
 */
final class SelectorParser {
  private final String expression;
  private int pos;

  private SelectorParser(String expression) {
    this.expression = expression;
  }

  static Selector parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    return new SelectorParser(expression).parse();
  }

  static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isIdentifierChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '$';
  }

  private Selector parse() {
    List<Segment> segments = new ArrayList<>();
    int length = expression.length();
    if (length > 0 && expression.charAt(0) == '.') {
      pos = 1;
    }
    while (true) {
      if (pos >= length || expression.charAt(pos) == '.') {
        throw fail(pos, "empty segment");
      }
      segments.add(segment());
      while (pos < length && expression.charAt(pos) == '[') {
        segments.add(bracket());
      }
      if (pos >= length) {
        break;
      }
      char c = expression.charAt(pos);
      if (c != '.') {
        throw fail(pos, "unexpected character '" + c + "'");
      }
      pos++;
      if (pos >= length) {
        throw fail(pos - 1, "trailing separator");
      }
    }
    return new Selector(segments);
  }

  private Segment segment() {
    char c = expression.charAt(pos);
    if (c == '[') {
      return bracket();
    }
    if (c == '"' || c == '\'') {
      return new Segment.Key(quoted());
    }
    if (c == '*') {
      if (pos + 1 < expression.length() && expression.charAt(pos + 1) == '*') {
        pos += 2;
        return Segment.DEEP_WILDCARD;
      }
      pos++;
      return Segment.WILDCARD;
    }
    if (isAsciiDigit(c) || (c == '-' && pos + 1 < expression.length()
        && isAsciiDigit(expression.charAt(pos + 1)))) {
      return new Segment.Index(integer());
    }
    if (isIdentifierChar(c)) {
      int start = pos;
      while (pos < expression.length() && isIdentifierChar(expression.charAt(pos))) {
        pos++;
      }
      return new Segment.Key(expression.substring(start, pos));
    }
    throw fail(pos, "unexpected character '" + c + "'");
  }

  private Segment bracket() {
    int open = pos;
    pos++;
    if (pos >= expression.length()) {
      throw fail(open, "unterminated bracket");
    }
    char c = expression.charAt(pos);
    Segment segment;
    if (c == ']') {
      segment = Segment.WILDCARD;
    } else if (c == '"' || c == '\'') {
      segment = new Segment.Key(quoted());
    } else if (isAsciiDigit(c) || c == '-') {
      segment = new Segment.Index(integer());
    } else {
      throw fail(pos, "unexpected character '" + c + "' in brackets");
    }
    if (pos >= expression.length() || expression.charAt(pos) != ']') {
      throw fail(open, "unterminated bracket");
    }
    pos++;
    return segment;
  }

  private String quoted() {
    int open = pos;
    char quote = expression.charAt(pos);
    pos++;
    StringBuilder sb = new StringBuilder();
    while (pos < expression.length()) {
      char ch = expression.charAt(pos);
      if (ch == '\\') {
        if (pos + 1 >= expression.length()) {
          throw fail(open, "unterminated quote");
        }
        sb.append(expression.charAt(pos + 1));
        pos += 2;
      } else if (ch == quote) {
        pos++;
        return sb.toString();
      } else {
        sb.append(ch);
        pos++;
      }
    }
    throw fail(open, "unterminated quote");
  }

  private int integer() {
    int start = pos;
    while (pos < expression.length() && isIdentifierChar(expression.charAt(pos))) {
      pos++;
    }
    String token = expression.substring(start, pos);
    for (int i = 0; i < token.length(); i++) {
      if (!isAsciiDigit(token.charAt(i))) {
        throw fail(start, "invalid integer '" + token + "'");
      }
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException ex) {
      throw fail(start, "invalid integer '" + token + "'");
    }
  }

  private SelectorParseException fail(int position, String reason) {
    return new SelectorParseException(expression, position, reason);
  }
}
