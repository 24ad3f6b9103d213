package io.legalis.dsl.lexer;

import io.legalis.dsl.DslException;
import io.legalis.dsl.SourceMap;
import io.legalis.dsl.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Tokenizes DSL source into a list of tokens terminated by an EOF token. */
public final class Lexer {
  private final String input;
  private final SourceMap sourceMap;
  private int pos;

  private Lexer(String input, SourceMap sourceMap) {
    this.input = input;
    this.sourceMap = sourceMap;
    this.pos = 0;
  }

  /**
   * Strips comments and tokenizes the source.
   *
   * @param source the DSL source
   * @return the tokens, always ending with an EOF token
   * @throws DslException if a comment is unclosed or the input contains invalid tokens
   */
  public static List<Token> tokenize(String source) throws DslException {
    return tokenize(source, new SourceMap(source));
  }

  /**
   * Strips comments and tokenizes the source, reusing an existing source map.
   *
   * @param source the DSL source
   * @param sourceMap the source map built from {@code source}
   * @return the tokens, always ending with an EOF token
   * @throws DslException if a comment is unclosed or the input contains invalid tokens
   */
  public static List<Token> tokenize(String source, SourceMap sourceMap) throws DslException {
    return new Lexer(CommentStripper.strip(source), sourceMap).doTokenize();
  }

  private List<Token> doTokenize() throws DslException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      if (ch == '"') {
        tokens.add(lexString());
        continue;
      }

      if (isDigit(ch) || (ch == '-' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
        tokens.add(lexNumberOrDate());
        continue;
      }

      if (isIdentStart(ch)) {
        tokens.add(lexWord());
        continue;
      }

      if (ch == '.') {
        if (input.startsWith("...", pos)) {
          pos += 3;
          tokens.add(Token.of(TokenKind.RANGE_EXCLUSIVE, "...", span(start)));
        } else if (input.startsWith("..", pos)) {
          pos += 2;
          tokens.add(Token.of(TokenKind.RANGE, "..", span(start)));
        } else {
          pos++;
          tokens.add(Token.of(TokenKind.DOT, ".", span(start)));
        }
        continue;
      }

      Token op = lexOperator();
      if (op != null) {
        tokens.add(op);
        continue;
      }

      TokenKind punct = PUNCTUATION.get(ch);
      if (punct != null) {
        pos++;
        tokens.add(Token.of(punct, String.valueOf(ch), span(start)));
        continue;
      }

      String hint = ch == '!' ? "use NOT for negation" : null;
      throw DslException.syntax(
          sourceMap.locate(start), "a token", "unexpected character '" + ch + "'", hint);
    }

    tokens.add(Token.eof(span(input.length())));
    return tokens;
  }

  private void skipWhitespace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private Token lexString() throws DslException {
    int start = pos;
    pos++; // opening quote
    StringBuilder sb = new StringBuilder();
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == '"') {
        pos++;
        return Token.string(sb.toString(), span(start));
      }
      if (c == '\\' && pos + 1 < input.length()) {
        char next = input.charAt(pos + 1);
        if (next == '"' || next == '\\') {
          sb.append(next);
          pos += 2;
          continue;
        }
      }
      // Other backslashes are kept verbatim so regex payloads survive
      sb.append(c);
      pos++;
    }
    throw DslException.syntax(
        sourceMap.locate(start), "closing '\"' of string literal", "end of input", null);
  }

  private Token lexNumberOrDate() throws DslException {
    int start = pos;
    if (input.charAt(pos) == '-') {
      pos++;
    }

    int digitsStart = pos;
    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    String digits = input.substring(digitsStart, pos);

    // Check for ISO date: YYYY-MM-DD
    if (start == digitsStart && digits.length() == 4 && isIsoDateAt(start)) {
      pos = start + 10;
      return Token.date(input.substring(start, pos), span(start));
    }

    String text = input.substring(start, pos);
    try {
      return Token.number(Long.parseLong(text), text, span(start));
    } catch (NumberFormatException e) {
      throw DslException.syntax(
          sourceMap.locate(start), "integer literal within 64-bit range", "'" + text + "'", null);
    }
  }

  private boolean isIsoDateAt(int start) {
    if (start + 10 > input.length()) {
      return false;
    }
    String s = input.substring(start, start + 10);
    boolean shape =
        s.charAt(4) == '-'
            && isDigit(s.charAt(5))
            && isDigit(s.charAt(6))
            && s.charAt(7) == '-'
            && isDigit(s.charAt(8))
            && isDigit(s.charAt(9));
    // "2024-01-015" is not a date
    return shape && (start + 10 == input.length() || !isDigit(input.charAt(start + 10)));
  }

  private Token lexWord() {
    int start = pos;
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (isIdentPart(c)) {
        pos++;
      } else if (c == '-' && pos + 1 < input.length() && isIdentPart(input.charAt(pos + 1))) {
        pos++;
      } else if (c == '.' && pos + 1 < input.length() && isIdentStart(input.charAt(pos + 1))) {
        pos++;
      } else {
        break;
      }
    }
    String word = input.substring(start, pos);
    TokenKind keyword = KEYWORDS.get(word);
    if (keyword != null) {
      return Token.of(keyword, word, span(start));
    }
    return Token.ident(word, span(start));
  }

  private Token lexOperator() {
    int start = pos;
    char c = input.charAt(pos);
    char next = pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
    TokenKind kind;
    int width = 1;
    switch (c) {
      case '>' -> {
        kind = next == '=' ? TokenKind.GE : TokenKind.GT;
        width = next == '=' ? 2 : 1;
      }
      case '<' -> {
        kind = next == '=' ? TokenKind.LE : TokenKind.LT;
        width = next == '=' ? 2 : 1;
      }
      case '=' -> {
        kind = next == '=' ? TokenKind.EQ : TokenKind.ASSIGN;
        width = next == '=' ? 2 : 1;
      }
      case '!' -> {
        if (next != '=') {
          return null;
        }
        kind = TokenKind.NE;
        width = 2;
      }
      default -> {
        return null;
      }
    }
    pos += width;
    return Token.of(kind, input.substring(start, pos), span(start));
  }

  private SourceSpan span(int start) {
    return sourceMap.span(start, pos);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || isDigit(c);
  }

  private static final Map<Character, TokenKind> PUNCTUATION =
      Map.of(
          '(', TokenKind.LPAREN,
          ')', TokenKind.RPAREN,
          '{', TokenKind.LBRACE,
          '}', TokenKind.RBRACE,
          '[', TokenKind.LBRACKET,
          ']', TokenKind.RBRACKET,
          ',', TokenKind.COMMA,
          ':', TokenKind.COLON);

  /** Keywords are recognized in upper case only; synonyms share a kind. */
  private static final Map<String, TokenKind> KEYWORDS =
      Map.ofEntries(
          Map.entry("STATUTE", TokenKind.STATUTE),
          Map.entry("IMPORT", TokenKind.IMPORT),
          Map.entry("AS", TokenKind.AS),
          Map.entry("WHEN", TokenKind.WHEN),
          Map.entry("UNLESS", TokenKind.UNLESS),
          Map.entry("THEN", TokenKind.THEN),
          Map.entry("DISCRETION", TokenKind.DISCRETION),
          Map.entry("EXCEPTION", TokenKind.EXCEPTION),
          Map.entry("EXCEPT", TokenKind.EXCEPT),
          Map.entry("AMENDMENT", TokenKind.AMENDMENT),
          Map.entry("AMENDS", TokenKind.AMENDS),
          Map.entry("SUPERSEDES", TokenKind.SUPERSEDES),
          Map.entry("REPLACES", TokenKind.REPLACES),
          Map.entry("REQUIRES", TokenKind.REQUIRES),
          Map.entry("DEFAULT", TokenKind.DEFAULT),
          Map.entry("JURISDICTION", TokenKind.JURISDICTION),
          Map.entry("VERSION", TokenKind.VERSION),
          Map.entry("EFFECTIVE_DATE", TokenKind.EFFECTIVE_DATE),
          Map.entry("EFFECTIVE", TokenKind.EFFECTIVE_DATE),
          Map.entry("EXPIRY_DATE", TokenKind.EXPIRY_DATE),
          Map.entry("EXPIRES", TokenKind.EXPIRY_DATE),
          Map.entry("GRANT", TokenKind.GRANT),
          Map.entry("OBLIGATION", TokenKind.OBLIGATION),
          Map.entry("PROHIBIT", TokenKind.PROHIBIT),
          Map.entry("REVOKE", TokenKind.REVOKE),
          Map.entry("AND", TokenKind.AND),
          Map.entry("OR", TokenKind.OR),
          Map.entry("NOT", TokenKind.NOT),
          Map.entry("HAS", TokenKind.HAS),
          Map.entry("BETWEEN", TokenKind.BETWEEN),
          Map.entry("IN", TokenKind.IN),
          Map.entry("LIKE", TokenKind.LIKE),
          Map.entry("MATCHES", TokenKind.MATCHES),
          Map.entry("MATCH", TokenKind.MATCHES),
          Map.entry("IN_RANGE", TokenKind.IN_RANGE),
          Map.entry("NOT_IN_RANGE", TokenKind.NOT_IN_RANGE),
          Map.entry("CURRENT_DATE", TokenKind.CURRENT_DATE),
          Map.entry("NOW", TokenKind.CURRENT_DATE),
          Map.entry("TODAY", TokenKind.CURRENT_DATE),
          Map.entry("DATE_FIELD", TokenKind.DATE_FIELD));

  /** Every keyword spelling the lexer recognizes. */
  public static final Set<String> KEYWORD_SPELLINGS = KEYWORDS.keySet();
}
