package io.legalis.dsl.parser;

import io.legalis.dsl.DslException;
import io.legalis.dsl.KeywordSuggester;
import io.legalis.dsl.ast.And;
import io.legalis.dsl.ast.Between;
import io.legalis.dsl.ast.Comparison;
import io.legalis.dsl.ast.ConditionNode;
import io.legalis.dsl.ast.ConditionValue;
import io.legalis.dsl.ast.HasAttribute;
import io.legalis.dsl.ast.In;
import io.legalis.dsl.ast.InRange;
import io.legalis.dsl.ast.Like;
import io.legalis.dsl.ast.Matches;
import io.legalis.dsl.ast.Not;
import io.legalis.dsl.ast.NotInRange;
import io.legalis.dsl.ast.Or;
import io.legalis.dsl.ast.TemporalComparison;
import io.legalis.dsl.ast.TemporalField;
import io.legalis.dsl.lexer.Lexer;
import io.legalis.dsl.lexer.Token;
import io.legalis.dsl.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Precedence-climbing parser for boolean conditions.
 *
 * <p>Precedence from tightest to loosest is {@code NOT}, {@code AND}, {@code OR}; parentheses
 * reset it. {@code AND} and {@code OR} are left-associative, so {@code A OR B AND C} parses as
 * {@code Or(A, And(B, C))} and {@code A AND B AND C} as {@code And(And(A, B), C)}.
 */
public final class ExpressionParser {
  private static final List<String> OPERATOR_KEYWORDS =
      List.of("BETWEEN", "IN", "LIKE", "MATCHES", "IN_RANGE", "NOT_IN_RANGE");

  private final TokenCursor cursor;
  private final int maxDepth;
  private int depth;
  /** Height of the subtree most recently returned by a parse method. */
  private int height;

  ExpressionParser(TokenCursor cursor, ParserOptions options) {
    this.cursor = cursor;
    this.maxDepth = options.maxNestingDepth();
    this.depth = 0;
  }

  /**
   * Parses a standalone condition such as {@code AGE >= 18 AND HAS citizen}.
   *
   * @param source the condition text
   * @return the condition tree
   * @throws DslException if the text is not a single well-formed condition
   */
  public static ConditionNode parseCondition(String source) throws DslException {
    return parseCondition(source, ParserOptions.defaults());
  }

  /**
   * Parses a standalone condition with explicit options.
   *
   * @param source the condition text
   * @param options the parser options
   * @return the condition tree
   * @throws DslException if the text is not a single well-formed condition
   */
  public static ConditionNode parseCondition(String source, ParserOptions options)
      throws DslException {
    TokenCursor cursor = new TokenCursor(Lexer.tokenize(source));
    ConditionNode node = new ExpressionParser(cursor, options).parse();
    if (!cursor.atEnd()) {
      throw cursor.error("AND, OR or end of condition", cursor.peek(), null);
    }
    return node;
  }

  /**
   * Parses one condition starting at the cursor, leaving the cursor after it. The tree is at most
   * {@link ParserOptions#maxNestingDepth()} nodes high.
   */
  ConditionNode parse() throws DslException {
    return parseOr();
  }

  /** Returns the height of the tree returned by the last {@link #parse()} call. */
  int lastHeight() {
    return height;
  }

  /** Fails if a tree of the given height would exceed the nesting limit. */
  void checkHeight(int treeHeight, Token at) throws DslException {
    if (treeHeight > maxDepth) {
      throw cursor.error(
          "condition nested at most " + maxDepth + " levels deep",
          at,
          "group alternatives with IN or split the rule into several statutes");
    }
  }

  private ConditionNode parseOr() throws DslException {
    ConditionNode left = parseAnd();
    int leftHeight = height;
    while (cursor.check(TokenKind.OR)) {
      Token op = cursor.advance();
      ConditionNode right = parseAnd();
      leftHeight = joinedHeight(leftHeight, height, op);
      left = new Or(left, right);
    }
    height = leftHeight;
    return left;
  }

  private ConditionNode parseAnd() throws DslException {
    ConditionNode left = parseUnary();
    int leftHeight = height;
    while (cursor.check(TokenKind.AND)) {
      Token op = cursor.advance();
      ConditionNode right = parseUnary();
      leftHeight = joinedHeight(leftHeight, height, op);
      left = new And(left, right);
    }
    height = leftHeight;
    return left;
  }

  // Chains fold to the left, so each operator adds a level
  private int joinedHeight(int left, int right, Token op) throws DslException {
    int joined = Math.max(left, right) + 1;
    checkHeight(joined, op);
    return joined;
  }

  private ConditionNode parseUnary() throws DslException {
    if (cursor.check(TokenKind.NOT)) {
      Token not = cursor.advance();
      enter(not);
      ConditionNode inner = parseUnary();
      depth--;
      height++;
      checkHeight(height, not);
      return new Not(inner);
    }
    return parsePrimary();
  }

  private ConditionNode parsePrimary() throws DslException {
    Token tok = cursor.peek();
    if (tok.kind() == TokenKind.LPAREN) {
      cursor.advance();
      enter(tok);
      ConditionNode inner = parseOr();
      cursor.expect(TokenKind.RPAREN, "')' closing parenthesized condition");
      depth--;
      return inner;
    }
    height = 1;
    return switch (tok.kind()) {
      case HAS -> parseHas();
      case CURRENT_DATE -> {
        cursor.advance();
        yield parseTemporal(new TemporalField.CurrentDate(), tok.text());
      }
      case DATE_FIELD -> {
        cursor.advance();
        Token name = cursor.peek();
        if (name.kind() != TokenKind.IDENT && name.kind() != TokenKind.STRING) {
          throw cursor.error("date field name after DATE_FIELD", name, null);
        }
        cursor.advance();
        yield parseTemporal(new TemporalField.DateField(name.text()), "DATE_FIELD " + name.text());
      }
      case IDENT -> parseFieldCondition();
      default -> throw cursor.error("condition", tok, conditionHint(tok));
    };
  }

  private ConditionNode parseHas() throws DslException {
    cursor.expect(TokenKind.HAS, "HAS");
    Token key = cursor.peek();
    if (key.kind() != TokenKind.IDENT && key.kind() != TokenKind.STRING) {
      throw cursor.error("attribute name after HAS", key, null);
    }
    cursor.advance();
    return new HasAttribute(key.text());
  }

  private ConditionNode parseTemporal(TemporalField field, String subject) throws DslException {
    Token op = cursor.peek();
    if (!op.kind().isComparison()) {
      throw cursor.error("comparison operator after " + subject, op, operatorHint(op));
    }
    cursor.advance();
    ConditionValue value = parseDateValue("date in temporal comparison");
    return new TemporalComparison(field, op.text(), value);
  }

  private ConditionNode parseFieldCondition() throws DslException {
    Token fieldTok = cursor.advance();
    String field = fieldTok.text().toLowerCase(Locale.ROOT);
    Token op = cursor.peek();

    if (op.kind().isComparison()) {
      cursor.advance();
      ConditionValue value = parseValue("value after '" + field + " " + op.text() + "'");
      return new Comparison(field, op.text(), value);
    }

    return switch (op.kind()) {
      case BETWEEN -> {
        cursor.advance();
        ConditionValue min = parseValue("lower bound of BETWEEN");
        cursor.expect(TokenKind.AND, "AND between BETWEEN bounds");
        ConditionValue max = parseValue("upper bound of BETWEEN");
        yield new Between(field, min, max);
      }
      case IN -> {
        cursor.advance();
        yield new In(field, parseValueList());
      }
      case LIKE -> {
        cursor.advance();
        Token pattern = cursor.expect(TokenKind.STRING, "quoted pattern after LIKE");
        yield new Like(field, pattern.text());
      }
      case MATCHES -> {
        cursor.advance();
        Token pattern = cursor.expect(TokenKind.STRING, "quoted regular expression after MATCHES");
        try {
          Pattern.compile(pattern.text());
        } catch (PatternSyntaxException e) {
          throw DslException.invalidCondition(
              "Invalid regex pattern: " + pattern.text() + " (" + e.getDescription() + ")",
              pattern.location());
        }
        yield new Matches(field, pattern.text());
      }
      case IN_RANGE -> {
        cursor.advance();
        Range range = parseRange();
        yield new InRange(field, range.min, range.max, range.inclusiveMin, range.inclusiveMax);
      }
      case NOT_IN_RANGE -> {
        cursor.advance();
        Range range = parseRange();
        yield new NotInRange(field, range.min, range.max, range.inclusiveMin, range.inclusiveMax);
      }
      default -> throw cursor.error("operator after field '" + field + "'", op, operatorHint(op));
    };
  }

  private List<ConditionValue> parseValueList() throws DslException {
    boolean parenthesized = cursor.match(TokenKind.LPAREN);
    List<ConditionValue> values = new ArrayList<>();
    values.add(parseValue("value in IN list"));
    while (cursor.match(TokenKind.COMMA)) {
      values.add(parseValue("value in IN list"));
    }
    if (parenthesized) {
      cursor.expect(TokenKind.RPAREN, "',' or ')' closing IN list");
    }
    return values;
  }

  /**
   * Parses {@code lo..hi}, {@code lo...hi} or an interval in brackets.
   *
   * <p>{@code (} and {@code )} exclude a bound, {@code [} and {@code ]} include it. Without
   * brackets both bounds are inclusive, except that {@code ...} excludes the upper bound.
   */
  private Range parseRange() throws DslException {
    Token open = cursor.peek();
    if (open.kind() == TokenKind.LPAREN || open.kind() == TokenKind.LBRACKET) {
      cursor.advance();
      ConditionValue min = parseValue("lower bound of range");
      cursor.expect(TokenKind.RANGE, "'..' between range bounds");
      ConditionValue max = parseValue("upper bound of range");
      Token close = cursor.peek();
      if (close.kind() != TokenKind.RPAREN && close.kind() != TokenKind.RBRACKET) {
        throw cursor.error("')' or ']' closing range", close, null);
      }
      cursor.advance();
      return new Range(
          min, max, open.kind() == TokenKind.LBRACKET, close.kind() == TokenKind.RBRACKET);
    }

    ConditionValue min = parseValue("lower bound of range");
    Token marker = cursor.peek();
    boolean inclusiveMax;
    if (marker.kind() == TokenKind.RANGE) {
      inclusiveMax = true;
    } else if (marker.kind() == TokenKind.RANGE_EXCLUSIVE) {
      inclusiveMax = false;
    } else {
      throw cursor.error("'..' or '...' between range bounds", marker, null);
    }
    cursor.advance();
    ConditionValue max = parseValue("upper bound of range");
    return new Range(min, max, true, inclusiveMax);
  }

  ConditionValue parseValue(String construct) throws DslException {
    Token tok = cursor.peek();
    ConditionValue value =
        switch (tok.kind()) {
          case NUMBER -> ConditionValue.number(tok.numberVal());
          case STRING, IDENT -> ConditionValue.text(tok.text());
          case DATE -> ConditionValue.date(tok.text());
          default -> null;
        };
    if (value == null) {
      String hint = tok.kind() == TokenKind.ASSIGN ? "use '==' for equality" : null;
      throw cursor.error(construct, tok, hint);
    }
    cursor.advance();
    return value;
  }

  private ConditionValue parseDateValue(String construct) throws DslException {
    Token tok = cursor.peek();
    if (tok.kind() == TokenKind.DATE
        || (tok.kind() == TokenKind.STRING && ISO_DATE.matcher(tok.text()).matches())) {
      cursor.advance();
      return ConditionValue.date(tok.text());
    }
    throw cursor.error(construct + " (YYYY-MM-DD)", tok, null);
  }

  private void enter(Token at) throws DslException {
    depth++;
    if (depth > maxDepth) {
      throw cursor.error(
          "condition nested at most " + maxDepth + " levels deep",
          at,
          "split the condition into separate WHEN clauses");
    }
  }

  private static String operatorHint(Token op) {
    if (op.kind() == TokenKind.ASSIGN) {
      return "use '==' for equality";
    }
    if (op.kind() == TokenKind.IDENT) {
      return KeywordSuggester.suggest(op.text(), OPERATOR_KEYWORDS)
          .map(s -> "did you mean '" + s + "'?")
          .orElse(null);
    }
    return null;
  }

  private static String conditionHint(Token tok) {
    if (tok.kind() == TokenKind.THEN || tok.kind() == TokenKind.EOF) {
      return "a condition is required here";
    }
    return null;
  }

  static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private record Range(
      ConditionValue min, ConditionValue max, boolean inclusiveMin, boolean inclusiveMax) {}
}
