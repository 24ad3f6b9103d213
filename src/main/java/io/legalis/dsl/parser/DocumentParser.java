package io.legalis.dsl.parser;

import io.legalis.dsl.DslException;
import io.legalis.dsl.DslWarning;
import io.legalis.dsl.KeywordSuggester;
import io.legalis.dsl.SourceMap;
import io.legalis.dsl.ast.Document;
import io.legalis.dsl.ast.ImportDirective;
import io.legalis.dsl.ast.StatuteNode;
import io.legalis.dsl.lexer.Lexer;
import io.legalis.dsl.lexer.Token;
import io.legalis.dsl.lexer.TokenKind;
import io.legalis.dsl.lower.Statute;
import io.legalis.dsl.lower.StatuteLowering;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for parsing DSL sources.
 *
 * <p>A source is zero or more {@code IMPORT "path" [AS alias]} lines followed by zero or more
 * {@code STATUTE} blocks. The first fatal error aborts the parse and records no warnings. The
 * non-fatal diagnostics of each successful parse collect in a warning buffer that lives as long as
 * the parser instance and grows with every parse until {@link #clearWarnings()} is called.
 *
 * <p>Instances are not thread-safe; use one parser per worker.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * DocumentParser parser = new DocumentParser();
 * Document doc = parser.parse("STATUTE adult: \"Adult Rights\" { WHEN AGE >= 18 THEN GRANT \"Vote\" }");
 * for (DslWarning warning : parser.warnings()) {
 *     System.err.println(warning.location() + ": " + warning.message());
 * }
 * }</pre>
 */
public final class DocumentParser {
  private static final Logger logger = LoggerFactory.getLogger(DocumentParser.class);

  private final ParserOptions options;
  private final List<DslWarning> warnings = new ArrayList<>();

  /** Creates a parser with {@link ParserOptions#defaults()}. */
  public DocumentParser() {
    this(ParserOptions.defaults());
  }

  /**
   * Creates a parser with explicit options.
   *
   * @param options the parser options
   */
  public DocumentParser(ParserOptions options) {
    this.options = options;
  }

  /**
   * Parses a complete source into a document.
   *
   * @param source the DSL source
   * @return the imports and statutes in source order
   * @throws DslException on the first lexical, syntactic or semantic error
   */
  public Document parse(String source) throws DslException {
    Session session = new Session(source);
    List<ImportDirective> imports = session.parseImports();
    List<StatuteNode> statutes = new ArrayList<>();
    while (!session.cursor.atEnd()) {
      statutes.add(session.parseStatute(!statutes.isEmpty()));
    }
    Document document = new Document(imports, statutes);
    if (options.resolveReferences()) {
      session.resolveReferences(document);
    }
    warnings.addAll(session.pending);
    logger.debug(
        "Parsed document with {} imports and {} statutes ({} warnings pending)",
        imports.size(),
        statutes.size(),
        warnings.size());
    return document;
  }

  /**
   * Parses a source holding exactly one statute and lowers it into the simplified model.
   *
   * <p>Leading imports are accepted and ignored. Exceptions, amendments, defaults and the raw
   * condition tree are only available through {@link #parse(String)}.
   *
   * @param source the DSL source
   * @return the lowered statute
   * @throws DslException if parsing fails, the source holds no or several statutes, or a condition
   *     cannot be lowered under {@link io.legalis.dsl.lower.LoweringPolicy#STRICT}
   */
  public Statute parseStatute(String source) throws DslException {
    Session session = new Session(source);
    session.parseImports();
    StatuteNode node = session.parseStatute(false);
    if (!session.cursor.atEnd()) {
      throw session.cursor.error(
          "end of input after statute '" + node.id() + "'",
          session.cursor.peek(),
          "use parse() for sources with several statutes");
    }
    Statute statute = new StatuteLowering(options.loweringPolicy()).lower(node);
    warnings.addAll(session.pending);
    return statute;
  }

  /**
   * Returns the warnings collected since the last {@link #clearWarnings()}.
   *
   * @return an unmodifiable snapshot of the warnings, in the order they were raised
   */
  public List<DslWarning> warnings() {
    return List.copyOf(warnings);
  }

  /** Discards all collected warnings. */
  public void clearWarnings() {
    warnings.clear();
  }

  /**
   * Returns the options this parser was created with.
   *
   * @return the options
   */
  public ParserOptions options() {
    return options;
  }

  /** State of one parse call. Its warnings reach the parser only if the call succeeds. */
  private final class Session {
    private final TokenCursor cursor;
    private final List<DslWarning> pending = new ArrayList<>();
    private final StatuteParser statutes;
    private final List<StatuteReference> references = new ArrayList<>();
    private final List<ImportDirective> imports = new ArrayList<>();

    Session(String source) throws DslException {
      List<Token> tokens = Lexer.tokenize(source, new SourceMap(source));
      this.cursor = new TokenCursor(tokens);
      ExpressionParser expressions = new ExpressionParser(cursor, options);
      ClauseParser clauses = new ClauseParser(cursor, expressions);
      this.statutes = new StatuteParser(cursor, clauses, pending, references);
    }

    List<ImportDirective> parseImports() throws DslException {
      while (cursor.match(TokenKind.IMPORT)) {
        String path = cursor.expect(TokenKind.STRING, "quoted import path after IMPORT").text();
        String alias = null;
        if (cursor.match(TokenKind.AS)) {
          alias = cursor.expect(TokenKind.IDENT, "import alias after AS").text();
        }
        imports.add(new ImportDirective(path, alias));
      }
      return imports;
    }

    StatuteNode parseStatute(boolean afterStatute) throws DslException {
      Token tok = cursor.peek();
      if (tok.kind() != TokenKind.STATUTE) {
        String hint = null;
        if (tok.kind() == TokenKind.IMPORT && afterStatute) {
          hint = "IMPORT directives must precede all statutes";
        } else if (tok.kind() == TokenKind.IDENT) {
          hint =
              KeywordSuggester.suggest(tok.text(), List.of("STATUTE", "IMPORT"))
                  .map(s -> "did you mean '" + s + "'?")
                  .orElse(null);
        }
        throw cursor.error("'STATUTE' block", tok, hint);
      }
      return statutes.parse();
    }

    void resolveReferences(Document document) throws DslException {
      Set<String> known = new HashSet<>();
      document.statutes().forEach(s -> known.add(s.id()));
      Set<String> aliases = new HashSet<>();
      imports.stream().filter(i -> i.alias() != null).forEach(i -> aliases.add(i.alias()));

      for (StatuteReference ref : references) {
        if (known.contains(ref.id())) {
          continue;
        }
        int dot = ref.id().indexOf('.');
        if (dot > 0 && aliases.contains(ref.id().substring(0, dot))) {
          continue;
        }
        String hint =
            KeywordSuggester.suggest(ref.id(), known)
                .map(s -> "did you mean '" + s + "'?")
                .orElse(ref.clause() + " targets must be statutes of this document or alias.id");
        throw DslException.undefinedReference(ref.location(), ref.id(), hint);
      }
    }
  }
}
