package io.legalis.dsl.lexer;

import io.legalis.dsl.SourceLocation;
import io.legalis.dsl.SourceSpan;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param text the lexeme as written, or the unescaped payload for STRING tokens
 * @param numberVal the value (for NUMBER tokens)
 * @param span the location in the source
 */
public record Token(TokenKind kind, String text, long numberVal, SourceSpan span) {
  /** Creates a keyword, punctuation or operator token. */
  public static Token of(TokenKind kind, String text, SourceSpan span) {
    return new Token(kind, text, 0, span);
  }

  /** Creates an identifier token. */
  public static Token ident(String name, SourceSpan span) {
    return new Token(TokenKind.IDENT, name, 0, span);
  }

  /** Creates a string token holding the unescaped payload. */
  public static Token string(String payload, SourceSpan span) {
    return new Token(TokenKind.STRING, payload, 0, span);
  }

  /** Creates a number token. */
  public static Token number(long value, String text, SourceSpan span) {
    return new Token(TokenKind.NUMBER, text, value, span);
  }

  /** Creates a bare date token. */
  public static Token date(String date, SourceSpan span) {
    return new Token(TokenKind.DATE, date, 0, span);
  }

  /** Creates the end-of-input token. */
  public static Token eof(SourceSpan span) {
    return new Token(TokenKind.EOF, "", 0, span);
  }

  /**
   * Returns the location where this token starts.
   *
   * @return the start location
   */
  public SourceLocation location() {
    return span.start();
  }

  /**
   * Describes the token for error messages.
   *
   * @return e.g. {@code 'THEN'}, {@code string "abc"} or {@code end of input}
   */
  public String describe() {
    return switch (kind) {
      case EOF -> "end of input";
      case STRING -> "string \"" + text + "\"";
      default -> "'" + text + "'";
    };
  }
}
