package io.legalis.dsl.parser;

import io.legalis.dsl.DslException;
import io.legalis.dsl.ast.AmendmentClause;
import io.legalis.dsl.ast.ConditionNode;
import io.legalis.dsl.ast.ConditionValue;
import io.legalis.dsl.ast.DefaultClause;
import io.legalis.dsl.ast.EffectNode;
import io.legalis.dsl.ast.ExceptionClause;
import io.legalis.dsl.lexer.Token;
import io.legalis.dsl.lexer.TokenKind;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the body of individual statute clauses. Each method is called with the cursor just past
 * the clause keyword; conditions are delegated to {@link ExpressionParser}.
 */
final class ClauseParser {
  private final TokenCursor cursor;
  private final ExpressionParser expressions;

  ClauseParser(TokenCursor cursor, ExpressionParser expressions) {
    this.cursor = cursor;
    this.expressions = expressions;
  }

  /** WHEN / UNLESS body. */
  ConditionNode parseCondition() throws DslException {
    return expressions.parse();
  }

  /** Height of the condition returned by the last {@link #parseCondition()}. */
  int lastConditionHeight() {
    return expressions.lastHeight();
  }

  /** Fails if conjoining clauses would nest the condition past the limit. */
  void checkConditionHeight(int height, Token at) throws DslException {
    expressions.checkHeight(height, at);
  }

  /** JURISDICTION / DISCRETION body. */
  String parseText(String expected) throws DslException {
    return cursor.expect(TokenKind.STRING, expected).text();
  }

  /** VERSION body: a positive integer. */
  int parseVersion(String expected) throws DslException {
    Token tok = cursor.expect(TokenKind.NUMBER, expected);
    if (tok.numberVal() < 1 || tok.numberVal() > Integer.MAX_VALUE) {
      throw DslException.syntax(tok.location(), expected, tok.describe(), "versions start at 1");
    }
    return (int) tok.numberVal();
  }

  /** EFFECTIVE_DATE / EXPIRY_DATE body: a bare or quoted ISO calendar date. */
  LocalDate parseIsoDate(String expected) throws DslException {
    Token tok = cursor.peek();
    boolean dateShaped =
        tok.kind() == TokenKind.DATE
            || (tok.kind() == TokenKind.STRING
                && ExpressionParser.ISO_DATE.matcher(tok.text()).matches());
    if (!dateShaped) {
      throw cursor.error(expected + " (YYYY-MM-DD)", tok, null);
    }
    try {
      LocalDate date = LocalDate.parse(tok.text());
      cursor.advance();
      return date;
    } catch (DateTimeParseException e) {
      throw DslException.syntax(
          tok.location(), "valid calendar date", tok.describe(), "check the month and day");
    }
  }

  /** THEN body: effect keyword and description. */
  EffectNode parseEffect() throws DslException {
    Token type = cursor.peek();
    if (!type.kind().isEffectType()) {
      throw cursor.error("effect type (GRANT, OBLIGATION, PROHIBIT or REVOKE)", type, null);
    }
    cursor.advance();
    String description = parseText("effect description string");
    return new EffectNode(type.text(), description);
  }

  /** EXCEPTION body: {@code [WHEN condition] "text"}. */
  ExceptionClause parseException() throws DslException {
    List<ConditionNode> conditions = new ArrayList<>();
    if (cursor.match(TokenKind.WHEN)) {
      conditions.add(expressions.parse());
    }
    String description = parseText("exception description string");
    return new ExceptionClause(conditions, description);
  }

  /** AMENDMENT body: {@code target [VERSION n] [EFFECTIVE_DATE date] "text"}. */
  AmendmentClause parseAmendment(List<StatuteReference> references, String clause)
      throws DslException {
    Token target = cursor.expect(TokenKind.IDENT, "amended statute id");
    references.add(new StatuteReference(target.text(), clause, target.location()));

    Integer version = null;
    String date = null;
    while (true) {
      if (cursor.match(TokenKind.VERSION)) {
        version = parseVersion("amendment version number");
      } else if (cursor.match(TokenKind.EFFECTIVE_DATE)) {
        date = parseLooseDate();
      } else {
        break;
      }
    }
    String description = parseText("amendment description string");
    return new AmendmentClause(target.text(), version, date, description);
  }

  /** SUPERSEDES / REQUIRES body: one or more comma-separated statute ids. */
  List<String> parseIdList(String clause, List<StatuteReference> references) throws DslException {
    List<String> ids = new ArrayList<>();
    do {
      Token id = cursor.expect(TokenKind.IDENT, "statute id after " + clause);
      ids.add(id.text());
      references.add(new StatuteReference(id.text(), clause, id.location()));
    } while (cursor.match(TokenKind.COMMA));
    return ids;
  }

  /** DEFAULT body: {@code field [=] value}. */
  DefaultClause parseDefault() throws DslException {
    Token field = cursor.expect(TokenKind.IDENT, "field name after DEFAULT");
    cursor.match(TokenKind.ASSIGN);
    ConditionValue value = expressions.parseValue("default value for '" + field.text() + "'");
    return new DefaultClause(field.text(), value);
  }

  /**
   * Parses an amendment date into unpadded "Y-M-D" text. The value is not checked against the
   * calendar.
   */
  private String parseLooseDate() throws DslException {
    Token tok = cursor.peek();
    if (tok.kind() == TokenKind.DATE || tok.kind() == TokenKind.STRING) {
      String[] parts = tok.text().split("-", -1);
      if (parts.length == 3) {
        try {
          String date =
              Integer.parseInt(parts[0])
                  + "-"
                  + Integer.parseInt(parts[1])
                  + "-"
                  + Integer.parseInt(parts[2]);
          cursor.advance();
          return date;
        } catch (NumberFormatException e) {
          throw DslException.syntax(
              tok.location(), "amendment date (YYYY-MM-DD)", tok.describe(), null);
        }
      }
    }
    throw cursor.error("amendment date (YYYY-MM-DD)", tok, null);
  }
}
