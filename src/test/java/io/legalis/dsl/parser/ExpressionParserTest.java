package io.legalis.dsl.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.legalis.dsl.DslException;
import io.legalis.dsl.ErrorKind;
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
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ExpressionParserTest {

  private static ConditionNode parse(String source) throws DslException {
    return ExpressionParser.parseCondition(source);
  }

  private static Comparison cmp(String field, String op, long value) {
    return new Comparison(field, op, ConditionValue.number(value));
  }

  private static HasAttribute has(String key) {
    return new HasAttribute(key);
  }

  // Precedence and associativity

  @Test
  void testAndBindsTighterThanOr() throws DslException {
    assertEquals(
        new Or(has("x"), new And(has("y"), has("z"))), parse("HAS x OR HAS y AND HAS z"));
    assertEquals(
        new Or(new And(has("x"), has("y")), has("z")), parse("HAS x AND HAS y OR HAS z"));
  }

  @Test
  void testLeftAssociative() throws DslException {
    assertEquals(
        new And(new And(has("a"), has("b")), has("c")), parse("HAS a AND HAS b AND HAS c"));
    assertEquals(new Or(new Or(has("a"), has("b")), has("c")), parse("HAS a OR HAS b OR HAS c"));
  }

  @Test
  void testNotBindsTightest() throws DslException {
    assertEquals(new And(new Not(has("a")), has("b")), parse("NOT HAS a AND HAS b"));
    assertEquals(new Not(new Not(has("a"))), parse("NOT NOT HAS a"));
  }

  @Test
  void testParenthesesResetPrecedence() throws DslException {
    assertEquals(
        new And(new Or(has("a"), has("b")), has("c")), parse("(HAS a OR HAS b) AND HAS c"));
    assertEquals(new Not(new Or(has("a"), has("b"))), parse("NOT (HAS a OR HAS b)"));
  }

  // Atoms

  @Test
  void testComparisonLowerCasesField() throws DslException {
    assertEquals(
        new And(cmp("age", ">=", 18), cmp("income", "<=", 5000000)),
        parse("AGE >= 18 AND INCOME <= 5000000"));
  }

  @Test
  void testComparisonValues() throws DslException {
    assertEquals(cmp("balance", ">", -100), parse("balance > -100"));
    assertEquals(
        new Comparison("status", "==", ConditionValue.text("active")), parse("STATUS == active"));
    assertEquals(
        new Comparison("name", "!=", ConditionValue.text("Jane Doe")),
        parse("name != \"Jane Doe\""));
    assertEquals(
        new Comparison("filed", "<", ConditionValue.date("2024-04-15")),
        parse("filed < 2024-04-15"));
  }

  @Test
  void testHasWithQuotedKey() throws DslException {
    assertEquals(has("permanent resident"), parse("HAS \"permanent resident\""));
  }

  @Test
  void testBetween() throws DslException {
    assertEquals(
        new And(
            new Between("age", ConditionValue.number(18), ConditionValue.number(65)), has("job")),
        parse("AGE BETWEEN 18 AND 65 AND HAS job"));
  }

  @Test
  void testInWithAndWithoutParentheses() throws DslException {
    In expected =
        new In("state", List.of(ConditionValue.text("CA"), ConditionValue.text("NY")));
    assertEquals(expected, parse("STATE IN (\"CA\", \"NY\")"));
    assertEquals(expected, parse("STATE IN CA, NY"));
  }

  @Test
  void testLikeAndMatches() throws DslException {
    assertEquals(new Like("name", "J%"), parse("NAME LIKE \"J%\""));
    assertEquals(new Matches("code", "^\\d{3}$"), parse("CODE MATCHES \"^\\d{3}$\""));
    assertEquals(new Matches("code", "[A-Z]+"), parse("CODE MATCH \"[A-Z]+\""));
  }

  @Test
  void testInvalidRegex() {
    DslException e =
        assertThrows(DslException.class, () -> parse("field MATCHES \"[invalid(regex\""));
    assertEquals(ErrorKind.INVALID_CONDITION, e.kind());
    assertTrue(e.getMessage().contains("Invalid regex pattern"), e.getMessage());
    assertEquals(15, e.location().orElseThrow().column());
  }

  @Test
  void testTemporalComparisons() throws DslException {
    assertEquals(
        new TemporalComparison(
            new TemporalField.CurrentDate(), ">=", ConditionValue.date("2024-01-01")),
        parse("CURRENT_DATE >= 2024-01-01"));
    assertEquals(
        new TemporalComparison(
            new TemporalField.CurrentDate(), "<", ConditionValue.date("2030-12-31")),
        parse("TODAY < \"2030-12-31\""));
    assertEquals(
        new TemporalComparison(
            new TemporalField.DateField("birth_date"), "<=", ConditionValue.date("2006-01-01")),
        parse("DATE_FIELD birth_date <= 2006-01-01"));
  }

  @Test
  void testTemporalRequiresDate() {
    DslException e = assertThrows(DslException.class, () -> parse("NOW > 18"));
    assertEquals(ErrorKind.SYNTAX, e.kind());
  }

  @Test
  void testRanges() throws DslException {
    ConditionValue lo = ConditionValue.number(0);
    ConditionValue hi = ConditionValue.number(100);
    assertEquals(new InRange("score", lo, hi, true, true), parse("SCORE IN_RANGE 0..100"));
    assertEquals(new InRange("score", lo, hi, true, false), parse("SCORE IN_RANGE 0...100"));
    assertEquals(new InRange("score", lo, hi, false, true), parse("SCORE IN_RANGE (0..100]"));
    assertEquals(new InRange("score", lo, hi, true, false), parse("SCORE IN_RANGE [0..100)"));
    assertEquals(
        new NotInRange("score", lo, hi, false, false), parse("SCORE NOT_IN_RANGE (0..100)"));
  }

  // Errors

  @Test
  void testAssignSuggestsEquality() {
    DslException e = assertThrows(DslException.class, () -> parse("AGE = 18"));
    assertEquals("use '==' for equality", e.hint().orElseThrow());
  }

  @Test
  void testMisspelledOperator() {
    DslException e = assertThrows(DslException.class, () -> parse("AGE BETWEN 18 AND 65"));
    assertEquals("did you mean 'BETWEEN'?", e.hint().orElseThrow());
    assertEquals("'BETWEN'", e.found().orElseThrow());
  }

  @Test
  void testTrailingTokens() {
    DslException e = assertThrows(DslException.class, () -> parse("HAS a HAS b"));
    assertEquals("AND, OR or end of condition", e.expected().orElseThrow());
  }

  @Test
  void testUnbalancedParenthesis() {
    DslException e = assertThrows(DslException.class, () -> parse("(HAS a OR HAS b"));
    assertEquals("end of input", e.found().orElseThrow());
  }

  @Test
  void testEmptyCondition() {
    DslException e = assertThrows(DslException.class, () -> parse(""));
    assertEquals("a condition is required here", e.hint().orElseThrow());
  }

  @Test
  void testNestingLimit() throws DslException {
    ParserOptions options = ParserOptions.defaults().withMaxNestingDepth(3);
    assertEquals(has("a"), ExpressionParser.parseCondition("(((HAS a)))", options));
    assertThrows(
        DslException.class, () -> ExpressionParser.parseCondition("((((HAS a))))", options));
    assertThrows(
        DslException.class,
        () -> ExpressionParser.parseCondition("NOT NOT NOT NOT HAS a", options));
  }

  @Test
  void testChainLengthCountsTowardNesting() throws DslException {
    ParserOptions options = ParserOptions.defaults().withMaxNestingDepth(3);
    assertEquals(
        new And(new And(has("a"), has("b")), has("c")),
        ExpressionParser.parseCondition("HAS a AND HAS b AND HAS c", options));
    assertThrows(
        DslException.class,
        () -> ExpressionParser.parseCondition("HAS a AND HAS b AND HAS c AND HAS d", options));
    assertThrows(
        DslException.class,
        () -> ExpressionParser.parseCondition("HAS a OR HAS b OR HAS c OR HAS d", options));
    assertThrows(
        DslException.class,
        () -> ExpressionParser.parseCondition("NOT (HAS a AND HAS b AND HAS c)", options));
    assertThrows(
        DslException.class,
        () -> ExpressionParser.parseCondition("(HAS a AND HAS b AND HAS c) OR HAS d", options));
  }

  @Test
  void testLongChainRejectedAtDefaultLimit() {
    String source = String.join(" AND ", Collections.nCopies(300, "HAS a"));
    DslException e = assertThrows(DslException.class, () -> parse(source));
    assertEquals(ErrorKind.SYNTAX, e.kind());
    assertTrue(e.getMessage().contains("256"));
  }

  @Test
  void testDeepNestingWithinDefaultLimit() throws DslException {
    String source = "(".repeat(200) + "HAS a" + ")".repeat(200);
    assertEquals(has("a"), parse(source));
  }

  @Test
  void testInvalidOptions() {
    assertThrows(IllegalArgumentException.class, () -> new ParserOptions(0, false, null));
    assertNotNull(new ParserOptions(1, false, null).loweringPolicy());
  }
}
