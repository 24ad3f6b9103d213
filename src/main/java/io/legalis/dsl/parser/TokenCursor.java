package io.legalis.dsl.parser;

import io.legalis.dsl.DslException;
import io.legalis.dsl.lexer.Token;
import io.legalis.dsl.lexer.TokenKind;
import java.util.List;

/** A position in a token list shared by the expression, clause and statute parsers. */
final class TokenCursor {
  private final List<Token> tokens;
  private int pos;

  TokenCursor(List<Token> tokens) {
    if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.EOF) {
      throw new IllegalArgumentException("token list must end with EOF");
    }
    this.tokens = tokens;
    this.pos = 0;
  }

  Token peek() {
    return tokens.get(pos);
  }

  boolean check(TokenKind kind) {
    return peek().kind() == kind;
  }

  boolean atEnd() {
    return check(TokenKind.EOF);
  }

  Token advance() {
    Token tok = peek();
    if (tok.kind() != TokenKind.EOF) {
      pos++;
    }
    return tok;
  }

  /** Consumes the current token if it has the given kind. */
  boolean match(TokenKind kind) {
    if (check(kind)) {
      pos++;
      return true;
    }
    return false;
  }

  /**
   * Consumes a token of the given kind or fails.
   *
   * @param kind the required kind
   * @param expected what is being parsed, for the error message
   */
  Token expect(TokenKind kind, String expected) throws DslException {
    Token tok = peek();
    if (tok.kind() != kind) {
      throw error(expected, tok, null);
    }
    pos++;
    return tok;
  }

  DslException error(String expected, Token found, String hint) {
    return DslException.syntax(found.location(), expected, found.describe(), hint);
  }
}
