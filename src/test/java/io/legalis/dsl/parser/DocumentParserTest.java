package io.legalis.dsl.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.legalis.dsl.DslException;
import io.legalis.dsl.DslWarning;
import io.legalis.dsl.ErrorKind;
import io.legalis.dsl.ast.AmendmentClause;
import io.legalis.dsl.ast.And;
import io.legalis.dsl.ast.Comparison;
import io.legalis.dsl.ast.ConditionValue;
import io.legalis.dsl.ast.DefaultClause;
import io.legalis.dsl.ast.Document;
import io.legalis.dsl.ast.EffectNode;
import io.legalis.dsl.ast.ExceptionClause;
import io.legalis.dsl.ast.HasAttribute;
import io.legalis.dsl.ast.ImportDirective;
import io.legalis.dsl.ast.Not;
import io.legalis.dsl.ast.StatuteNode;
import io.legalis.dsl.lower.Condition;
import io.legalis.dsl.lower.EffectType;
import io.legalis.dsl.lower.LoweringPolicy;
import io.legalis.dsl.lower.Statute;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class DocumentParserTest {

  @Test
  void testAgeAndIncome() throws DslException {
    Document doc =
        new DocumentParser()
            .parse("STATUTE a: \"A\" { WHEN AGE >= 18 AND INCOME <= 5000000 THEN GRANT \"x\" }");
    assertEquals(1, doc.statutes().size());
    StatuteNode statute = doc.statutes().get(0);
    assertEquals(
        List.of(
            new And(
                new Comparison("age", ">=", ConditionValue.number(18)),
                new Comparison("income", "<=", ConditionValue.number(5000000)))),
        statute.conditions());
    assertEquals(new EffectNode("GRANT", "x"), statute.effect());
    assertEquals(1, statute.version());
  }

  @Test
  void testFullStatute() throws DslException {
    String source =
        "STATUTE tax-credit: \"Child Tax Credit\" {\n"
            + "    JURISDICTION \"US\"\n"
            + "    VERSION 3\n"
            + "    EFFECTIVE_DATE 2024-01-01\n"
            + "    EXPIRES \"2030-12-31\"\n"
            + "    REQUIRES income-base, residency\n"
            + "    SUPERSEDES tax-credit-v2\n"
            + "    WHEN HAS dependents\n"
            + "    THEN GRANT \"Credit of $2000 per child\"\n"
            + "    DISCRETION \"Agency may verify dependents\"\n"
            + "    EXCEPTION WHEN INCOME > 400000 \"Phased out for high earners\"\n"
            + "    EXCEPTION \"Fraud voids the credit\"\n"
            + "    AMENDMENT tax-credit-v2 VERSION 2 EFFECTIVE_DATE 2023-07-04 \"Raised amount\"\n"
            + "    DEFAULT children = 0\n"
            + "    DEFAULT filing_status \"single\"\n"
            + "}";
    DocumentParser parser = new DocumentParser();
    StatuteNode s = parser.parse(source).statutes().get(0);

    assertEquals("tax-credit", s.id());
    assertEquals("Child Tax Credit", s.title());
    assertEquals("US", s.jurisdiction());
    assertEquals(3, s.version());
    assertEquals(LocalDate.of(2024, 1, 1), s.effectiveDate());
    assertEquals(LocalDate.of(2030, 12, 31), s.expiryDate());
    assertEquals(List.of("income-base", "residency"), s.requires());
    assertEquals(List.of("tax-credit-v2"), s.supersedes());
    assertEquals(List.of(new HasAttribute("dependents")), s.conditions());
    assertEquals("Agency may verify dependents", s.discretion());
    assertEquals(
        List.of(
            new ExceptionClause(
                List.of(new Comparison("income", ">", ConditionValue.number(400000))),
                "Phased out for high earners"),
            new ExceptionClause(List.of(), "Fraud voids the credit")),
        s.exceptions());
    assertEquals(
        List.of(new AmendmentClause("tax-credit-v2", 2, "2023-7-4", "Raised amount")),
        s.amendments());
    assertEquals(
        List.of(
            new DefaultClause("children", ConditionValue.number(0)),
            new DefaultClause("filing_status", ConditionValue.text("single"))),
        s.defaults());
    assertTrue(parser.warnings().isEmpty());
  }

  @Test
  void testUnlessDesugarsToNot() throws DslException {
    StatuteNode s =
        new DocumentParser()
            .parse("STATUTE a: \"A\" { WHEN HAS x UNLESS HAS y THEN REVOKE \"r\" }")
            .statutes()
            .get(0);
    assertEquals(
        List.of(new And(new HasAttribute("x"), new Not(new HasAttribute("y")))), s.conditions());
  }

  @Test
  void testImportsAndMultipleStatutes() throws DslException {
    String source =
        "IMPORT \"common/base.legalis\" AS base\n"
            + "IMPORT \"extra.legalis\"\n"
            + "STATUTE one: \"One\" { THEN GRANT \"a\" }\n"
            + "STATUTE two: \"Two\" { REQUIRES one THEN OBLIGATION \"b\" }\n";
    Document doc = new DocumentParser().parse(source);
    assertEquals(
        List.of(
            new ImportDirective("common/base.legalis", "base"),
            new ImportDirective("extra.legalis", null)),
        doc.imports());
    assertEquals(2, doc.statutes().size());
    assertEquals("two", doc.statutes().get(1).id());
    assertTrue(doc.statutes().get(0).conditions().isEmpty());
  }

  @Test
  void testEmptyDocument() throws DslException {
    Document doc = new DocumentParser().parse("// nothing here\n");
    assertTrue(doc.imports().isEmpty());
    assertTrue(doc.statutes().isEmpty());
  }

  @Test
  void testImportAfterStatute() {
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                new DocumentParser()
                    .parse("STATUTE a: \"A\" { THEN GRANT \"x\" }\nIMPORT \"late.legalis\""));
    assertEquals("IMPORT directives must precede all statutes", e.hint().orElseThrow());
  }

  // Deprecated syntax and warnings

  @Test
  void testExceptIsDeprecatedSynonym() throws DslException {
    String legacy = "STATUTE a: \"A\" { THEN GRANT \"x\" EXCEPT WHEN AGE < 16 \"No rights\" }";
    String modern = "STATUTE a: \"A\" { THEN GRANT \"x\" EXCEPTION WHEN AGE < 16 \"No rights\" }";

    DocumentParser parser = new DocumentParser();
    StatuteNode fromLegacy = parser.parse(legacy).statutes().get(0);
    List<DslWarning> warnings = parser.warnings();

    assertEquals(new DocumentParser().parse(modern).statutes().get(0), fromLegacy);
    assertEquals(1, warnings.size());
    DslWarning.DeprecatedSyntax warning = (DslWarning.DeprecatedSyntax) warnings.get(0);
    assertEquals("EXCEPT", warning.oldSyntax());
    assertEquals("EXCEPTION", warning.newSyntax());
    assertEquals("'EXCEPT' is deprecated, use 'EXCEPTION' instead", warning.message());
    assertEquals(legacy.indexOf("EXCEPT"), warning.location().offset());
  }

  @Test
  void testAmendsAndReplacesDeprecated() throws DslException {
    DocumentParser parser = new DocumentParser();
    StatuteNode s =
        parser
            .parse("STATUTE b: \"B\" { THEN GRANT \"x\" AMENDS a \"fix\" REPLACES old }")
            .statutes()
            .get(0);
    assertEquals(List.of("old"), s.supersedes());
    assertEquals("a", s.amendments().get(0).targetId());
    assertEquals(
        List.of("AMENDS", "REPLACES"),
        parser.warnings().stream()
            .map(w -> ((DslWarning.DeprecatedSyntax) w).oldSyntax())
            .collect(Collectors.toList()));
  }

  @Test
  void testWarningsDeterministicAndClearable() throws DslException {
    String source = "STATUTE a: \"A\" { THEN GRANT \"x\" EXCEPT \"e\" REPLACES z }";
    DocumentParser first = new DocumentParser();
    DocumentParser second = new DocumentParser();
    first.parse(source);
    second.parse(source);
    assertEquals(2, first.warnings().size());
    assertEquals(first.warnings(), second.warnings());

    first.parse(source);
    assertEquals(4, first.warnings().size());

    first.clearWarnings();
    assertTrue(first.warnings().isEmpty());
  }

  @Test
  void testFailedParseRecordsNoWarnings() throws DslException {
    DocumentParser parser = new DocumentParser();
    assertThrows(
        DslException.class,
        () -> parser.parse("STATUTE a: \"A\" { THEN GRANT \"x\" EXCEPT \"e\" BOGUS }"));
    assertTrue(parser.warnings().isEmpty());
    assertThrows(
        DslException.class,
        () -> parser.parseStatute("STATUTE a: \"A\" { THEN GRANT \"x\" REPLACES z"));
    assertTrue(parser.warnings().isEmpty());

    parser.parse("STATUTE a: \"A\" { THEN GRANT \"x\" REPLACES z }");
    assertEquals(1, parser.warnings().size());
    assertEquals(
        "REPLACES", ((DslWarning.DeprecatedSyntax) parser.warnings().get(0)).oldSyntax());
  }

  @Test
  void testDuplicateDiscretionLastWins() throws DslException {
    DocumentParser parser = new DocumentParser();
    StatuteNode s =
        parser
            .parse(
                "STATUTE a: \"A\" { DISCRETION \"first\" THEN GRANT \"x\""
                    + " DISCRETION \"second\" }")
            .statutes()
            .get(0);
    assertEquals("second", s.discretion());
    assertEquals(1, parser.warnings().size());
    assertInstanceOf(DslWarning.DuplicateClause.class, parser.warnings().get(0));
  }

  // Errors

  @Test
  void testMissingThen() {
    DslException e =
        assertThrows(
            DslException.class,
            () -> new DocumentParser().parse("STATUTE a: \"A\" { WHEN HAS x }"));
    assertEquals(ErrorKind.SYNTAX, e.kind());
    assertTrue(e.expected().orElseThrow().startsWith("THEN clause"));
  }

  @Test
  void testDuplicateThen() {
    assertThrows(
        DslException.class,
        () ->
            new DocumentParser()
                .parse("STATUTE a: \"A\" { THEN GRANT \"x\" THEN REVOKE \"y\" }"));
  }

  @Test
  void testMisspelledClause() {
    String source = "STATUTE a: \"A\" {\n    WHN AGE >= 18\n    THEN GRANT \"x\"\n}";
    DslException e = assertThrows(DslException.class, () -> new DocumentParser().parse(source));
    assertEquals("did you mean 'WHEN'?", e.hint().orElseThrow());
    assertEquals(2, e.location().orElseThrow().line());
    assertEquals(5, e.location().orElseThrow().column());
  }

  @Test
  void testMisspelledStatute() {
    DslException e =
        assertThrows(
            DslException.class,
            () -> new DocumentParser().parse("STAUTE a: \"A\" { THEN GRANT \"x\" }"));
    assertEquals("did you mean 'STATUTE'?", e.hint().orElseThrow());
  }

  @Test
  void testMissingClosingBrace() {
    DslException e =
        assertThrows(
            DslException.class,
            () -> new DocumentParser().parse("STATUTE a: \"A\" { THEN GRANT \"x\""));
    assertEquals("statute 'a' is missing its closing '}'", e.hint().orElseThrow());
  }

  @Test
  void testInvalidCalendarDate() {
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                new DocumentParser()
                    .parse("STATUTE a: \"A\" { EFFECTIVE_DATE 2024-02-30 THEN GRANT \"x\" }"));
    assertEquals("valid calendar date", e.expected().orElseThrow());
  }

  @Test
  void testVersionMustBePositive() {
    assertThrows(
        DslException.class,
        () -> new DocumentParser().parse("STATUTE a: \"A\" { VERSION 0 THEN GRANT \"x\" }"));
  }

  @Test
  void testUnclosedCommentInStatute() {
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                new DocumentParser()
                    .parse("STATUTE test: \"Test\" {\n            /* unclosed\n}"));
    assertEquals(ErrorKind.UNCLOSED_COMMENT, e.kind());
    assertEquals(2, e.location().orElseThrow().line());
  }

  // Reference resolution

  @Test
  void testReferencesUnresolvedByDefault() throws DslException {
    Document doc =
        new DocumentParser().parse("STATUTE a: \"A\" { REQUIRES missing THEN GRANT \"x\" }");
    assertEquals(List.of("missing"), doc.statutes().get(0).requires());
  }

  @Test
  void testResolveReferences() {
    DocumentParser parser =
        new DocumentParser(ParserOptions.defaults().withResolveReferences(true));
    String source =
        "STATUTE adult-rights: \"A\" { THEN GRANT \"x\" }\n"
            + "STATUTE voting: \"V\" { REQUIRES adult-right THEN GRANT \"vote\" }";
    DslException e = assertThrows(DslException.class, () -> parser.parse(source));
    assertEquals(ErrorKind.UNDEFINED_REFERENCE, e.kind());
    assertEquals("adult-right", e.name().orElseThrow());
    assertEquals("did you mean 'adult-rights'?", e.hint().orElseThrow());
  }

  @Test
  void testResolveReferencesThroughImportAlias() throws DslException {
    DocumentParser parser =
        new DocumentParser(ParserOptions.defaults().withResolveReferences(true));
    String source =
        "IMPORT \"federal.legalis\" AS fed\n"
            + "STATUTE local: \"L\" { REQUIRES fed.citizenship SUPERSEDES local THEN GRANT \"x\" }";
    Document doc = parser.parse(source);
    assertEquals(List.of("fed.citizenship"), doc.statutes().get(0).requires());
  }

  // Single-statute API

  @Test
  void testParseStatuteLowers() throws DslException {
    Statute statute =
        new DocumentParser()
            .parseStatute(
                "IMPORT \"ignored.legalis\"\n"
                    + "STATUTE a: \"A\" { JURISDICTION \"JP\" WHEN AGE >= 18 AND INCOME <= 5000000"
                    + " THEN PROHIBIT \"x\" }");
    assertEquals("a", statute.id());
    assertEquals("JP", statute.jurisdiction());
    assertEquals(EffectType.PROHIBITION, statute.effect().type());
    assertEquals(1, statute.preconditions().size());
    assertInstanceOf(Condition.And.class, statute.preconditions().get(0));
  }

  @Test
  void testParseStatuteStrictLowering() {
    DocumentParser parser =
        new DocumentParser(ParserOptions.defaults().withLoweringPolicy(LoweringPolicy.STRICT));
    assertEquals(LoweringPolicy.STRICT, parser.options().loweringPolicy());
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                parser.parseStatute(
                    "STATUTE a: \"A\" { WHEN id MATCHES \"^X\" THEN GRANT \"x\" }"));
    assertEquals(ErrorKind.INVALID_CONDITION, e.kind());
  }

  @Test
  void testParseStatuteRejectsSeveral() {
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                new DocumentParser()
                    .parseStatute(
                        "STATUTE a: \"A\" { THEN GRANT \"x\" }"
                            + " STATUTE b: \"B\" { THEN GRANT \"y\" }"));
    assertEquals("use parse() for sources with several statutes", e.hint().orElseThrow());
  }

  @Test
  void testVeryLongConditionChainIsSyntaxError() {
    String chain = String.join(" AND ", Collections.nCopies(10000, "AGE > 1"));
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                new DocumentParser()
                    .parseStatute("STATUTE a: \"A\" { WHEN " + chain + " THEN GRANT \"x\" }"));
    assertEquals(ErrorKind.SYNTAX, e.kind());
  }

  @Test
  void testTooManyWhenClauses() throws DslException {
    String clauses = String.join(" ", Collections.nCopies(300, "WHEN HAS a"));
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                new DocumentParser()
                    .parseStatute("STATUTE a: \"A\" { " + clauses + " THEN GRANT \"x\" }"));
    assertEquals(ErrorKind.SYNTAX, e.kind());

    String few = String.join(" ", Collections.nCopies(100, "WHEN HAS a"));
    Statute statute =
        new DocumentParser().parseStatute("STATUTE a: \"A\" { " + few + " THEN GRANT \"x\" }");
    assertEquals(1, statute.preconditions().size());
  }

  @Test
  void testParseStatuteRejectsEmpty() {
    assertThrows(DslException.class, () -> new DocumentParser().parseStatute(""));
  }
}
