package io.legalis.dsl.parser;

import io.legalis.dsl.DslException;
import io.legalis.dsl.DslWarning;
import io.legalis.dsl.KeywordSuggester;
import io.legalis.dsl.ast.AmendmentClause;
import io.legalis.dsl.ast.And;
import io.legalis.dsl.ast.ConditionNode;
import io.legalis.dsl.ast.DefaultClause;
import io.legalis.dsl.ast.EffectNode;
import io.legalis.dsl.ast.ExceptionClause;
import io.legalis.dsl.ast.Not;
import io.legalis.dsl.ast.StatuteNode;
import io.legalis.dsl.lexer.Token;
import io.legalis.dsl.lexer.TokenKind;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses one {@code STATUTE id: "title" { ... }} block.
 *
 * <p>Clauses may appear in any order, but a statute needs exactly one {@code THEN}. Legacy
 * keywords {@code EXCEPT}, {@code AMENDS} and {@code REPLACES} parse exactly like their modern
 * forms and add a {@link DslWarning.DeprecatedSyntax} warning.
 */
final class StatuteParser {
  private static final Logger logger = LoggerFactory.getLogger(StatuteParser.class);

  static final List<String> CLAUSE_KEYWORDS =
      List.of(
          "WHEN",
          "UNLESS",
          "THEN",
          "DISCRETION",
          "EXCEPTION",
          "AMENDMENT",
          "SUPERSEDES",
          "REQUIRES",
          "DEFAULT",
          "JURISDICTION",
          "VERSION",
          "EFFECTIVE_DATE",
          "EXPIRY_DATE");

  private final TokenCursor cursor;
  private final ClauseParser clauses;
  private final List<DslWarning> warnings;
  private final List<StatuteReference> references;

  StatuteParser(
      TokenCursor cursor,
      ClauseParser clauses,
      List<DslWarning> warnings,
      List<StatuteReference> references) {
    this.cursor = cursor;
    this.clauses = clauses;
    this.warnings = warnings;
    this.references = references;
  }

  StatuteNode parse() throws DslException {
    cursor.expect(TokenKind.STATUTE, "'STATUTE'");
    Token idTok = cursor.expect(TokenKind.IDENT, "statute id after STATUTE");
    String id = idTok.text();
    cursor.expect(TokenKind.COLON, "':' after statute id '" + id + "'");
    String title = clauses.parseText("statute title string");
    cursor.expect(TokenKind.LBRACE, "'{' opening the body of statute '" + id + "'");

    String jurisdiction = null;
    int version = 1;
    LocalDate effectiveDate = null;
    LocalDate expiryDate = null;
    ConditionNode condition = null;
    int conditionHeight = 0;
    EffectNode effect = null;
    String discretion = null;
    List<ExceptionClause> exceptions = new ArrayList<>();
    List<AmendmentClause> amendments = new ArrayList<>();
    List<String> supersedes = new ArrayList<>();
    List<String> requires = new ArrayList<>();
    List<DefaultClause> defaults = new ArrayList<>();

    while (!cursor.check(TokenKind.RBRACE)) {
      Token tok = cursor.peek();
      switch (tok.kind()) {
        case JURISDICTION -> {
          cursor.advance();
          jurisdiction = clauses.parseText("jurisdiction string after JURISDICTION");
        }
        case VERSION -> {
          cursor.advance();
          version = clauses.parseVersion("version number after VERSION");
        }
        case EFFECTIVE_DATE -> {
          cursor.advance();
          effectiveDate = clauses.parseIsoDate("date after " + tok.text());
        }
        case EXPIRY_DATE -> {
          cursor.advance();
          expiryDate = clauses.parseIsoDate("date after " + tok.text());
        }
        case WHEN, UNLESS -> {
          cursor.advance();
          ConditionNode parsed = clauses.parseCondition();
          int parsedHeight = clauses.lastConditionHeight();
          if (tok.kind() == TokenKind.UNLESS) {
            parsed = new Not(parsed);
            parsedHeight++;
          }
          if (condition == null) {
            condition = parsed;
            conditionHeight = parsedHeight;
          } else {
            condition = new And(condition, parsed);
            conditionHeight = Math.max(conditionHeight, parsedHeight) + 1;
          }
          clauses.checkConditionHeight(conditionHeight, tok);
        }
        case THEN -> {
          if (effect != null) {
            throw cursor.error(
                "a single THEN clause in statute '" + id + "'",
                tok,
                "combine the effects into one statute each");
          }
          cursor.advance();
          effect = clauses.parseEffect();
        }
        case DISCRETION -> {
          cursor.advance();
          if (discretion != null) {
            warnings.add(
                new DslWarning.DuplicateClause(
                    tok.location(),
                    "DISCRETION",
                    "DISCRETION given more than once in statute '"
                        + id
                        + "'; the last one is used"));
          }
          discretion = clauses.parseText("discretion text after DISCRETION");
        }
        case EXCEPTION, EXCEPT -> {
          deprecated(tok, TokenKind.EXCEPT, "EXCEPTION");
          cursor.advance();
          exceptions.add(clauses.parseException());
        }
        case AMENDMENT, AMENDS -> {
          deprecated(tok, TokenKind.AMENDS, "AMENDMENT");
          cursor.advance();
          amendments.add(clauses.parseAmendment(references, "AMENDMENT"));
        }
        case SUPERSEDES, REPLACES -> {
          deprecated(tok, TokenKind.REPLACES, "SUPERSEDES");
          cursor.advance();
          supersedes.addAll(clauses.parseIdList("SUPERSEDES", references));
        }
        case REQUIRES -> {
          cursor.advance();
          requires.addAll(clauses.parseIdList("REQUIRES", references));
        }
        case DEFAULT -> {
          cursor.advance();
          defaults.add(clauses.parseDefault());
        }
        default -> throw cursor.error("clause keyword or '}'", tok, clauseHint(tok, id));
      }
    }
    Token close = cursor.advance();

    if (effect == null) {
      throw DslException.syntax(
          close.location(),
          "THEN clause in statute '" + id + "'",
          close.describe(),
          "every statute needs an effect, e.g. THEN GRANT \"...\"");
    }

    List<ConditionNode> conditions = condition == null ? List.of() : List.of(condition);
    return new StatuteNode(
        id,
        title,
        jurisdiction,
        version,
        effectiveDate,
        expiryDate,
        conditions,
        effect,
        discretion,
        exceptions,
        amendments,
        supersedes,
        requires,
        defaults);
  }

  private void deprecated(Token tok, TokenKind legacy, String modern) {
    if (tok.kind() != legacy) {
      return;
    }
    DslWarning.DeprecatedSyntax warning =
        DslWarning.DeprecatedSyntax.of(tok.location(), tok.text(), modern);
    warnings.add(warning);
    logger.debug("{} at {}", warning.message(), tok.location());
  }

  private static String clauseHint(Token tok, String id) {
    if (tok.kind() == TokenKind.IDENT) {
      return KeywordSuggester.suggest(tok.text(), CLAUSE_KEYWORDS)
          .map(s -> "did you mean '" + s + "'?")
          .orElse(null);
    }
    if (tok.kind() == TokenKind.STATUTE || tok.kind() == TokenKind.EOF) {
      return "statute '" + id + "' is missing its closing '}'";
    }
    return null;
  }
}
