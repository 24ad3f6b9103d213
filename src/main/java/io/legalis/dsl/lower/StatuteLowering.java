package io.legalis.dsl.lower;

import io.legalis.dsl.DslException;
import io.legalis.dsl.ast.And;
import io.legalis.dsl.ast.Between;
import io.legalis.dsl.ast.Comparison;
import io.legalis.dsl.ast.ConditionNode;
import io.legalis.dsl.ast.ConditionValue;
import io.legalis.dsl.ast.EffectNode;
import io.legalis.dsl.ast.HasAttribute;
import io.legalis.dsl.ast.In;
import io.legalis.dsl.ast.InRange;
import io.legalis.dsl.ast.Like;
import io.legalis.dsl.ast.Matches;
import io.legalis.dsl.ast.Not;
import io.legalis.dsl.ast.NotInRange;
import io.legalis.dsl.ast.Or;
import io.legalis.dsl.ast.StatuteNode;
import io.legalis.dsl.ast.TemporalComparison;
import io.legalis.dsl.ast.TemporalField;
import io.legalis.dsl.display.DslPrinter;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a parsed {@link StatuteNode} into the simplified {@link Statute} model.
 *
 * <p>Imports, exceptions, amendments, defaults, supersession and requirements are dropped; they
 * remain available on the document-level AST. Conditions map as follows:
 *
 * <ul>
 *   <li>{@code age}/{@code income} compared with a number become {@link Condition.Age} / {@link
 *       Condition.Income}; {@code BETWEEN} on them becomes a pair of comparisons
 *   <li>{@code field == "text"} becomes {@link Condition.AttributeEquals}
 *   <li>{@code IN} over plain values becomes {@link Condition.SetMembership}
 *   <li>{@code CURRENT_DATE} comparisons become {@link Condition.DateRange}
 *   <li>everything else ({@code MATCHES}, {@code LIKE}, ranges, set expressions, date fields and
 *       other comparisons) is handled by the {@link LoweringPolicy}
 * </ul>
 */
public final class StatuteLowering implements ConditionNode.Visitor<Condition, DslException> {
  private static final Logger logger = LoggerFactory.getLogger(StatuteLowering.class);

  private final LoweringPolicy policy;

  /**
   * Creates a lowering with the given policy.
   *
   * @param policy how to treat conditions without a downstream equivalent
   */
  public StatuteLowering(LoweringPolicy policy) {
    this.policy = policy;
  }

  /**
   * Lowers a statute.
   *
   * @param node the parsed statute
   * @return the simplified statute
   * @throws DslException if the effect type is unknown, or under {@link LoweringPolicy#STRICT} if
   *     a condition cannot be lowered
   */
  public Statute lower(StatuteNode node) throws DslException {
    List<Condition> preconditions = new ArrayList<>();
    for (ConditionNode condition : node.conditions()) {
      preconditions.add(condition.accept(this));
    }
    return new Statute(
        node.id(),
        node.title(),
        preconditions,
        lowerEffect(node.effect()),
        node.discretion(),
        node.jurisdiction(),
        node.version(),
        new TemporalValidity(node.effectiveDate(), node.expiryDate()));
  }

  static Effect lowerEffect(EffectNode effect) throws DslException {
    EffectType type =
        switch (String.valueOf(effect.effectType())) {
          case "GRANT" -> EffectType.GRANT;
          case "REVOKE" -> EffectType.REVOKE;
          case "OBLIGATION" -> EffectType.OBLIGATION;
          case "PROHIBIT", "PROHIBITION" -> EffectType.PROHIBITION;
          default -> throw DslException.invalidCondition(
              "Unknown effect type '" + effect.effectType() + "' in THEN clause");
        };
    return new Effect(type, effect.description());
  }

  @Override
  public Condition visitAnd(And node) throws DslException {
    return new Condition.And(node.left().accept(this), node.right().accept(this));
  }

  @Override
  public Condition visitOr(Or node) throws DslException {
    return new Condition.Or(node.left().accept(this), node.right().accept(this));
  }

  @Override
  public Condition visitNot(Not node) throws DslException {
    return new Condition.Not(node.inner().accept(this));
  }

  @Override
  public Condition visitHasAttribute(HasAttribute node) {
    return new Condition.HasAttribute(node.key());
  }

  @Override
  public Condition visitComparison(Comparison node) throws DslException {
    ComparisonOp op = ComparisonOp.fromSymbol(node.operator()).orElse(null);
    if (op != null && node.value() instanceof ConditionValue.Number number) {
      if (node.field().equals("age")) {
        return new Condition.Age(op, number.value());
      }
      if (node.field().equals("income")) {
        return new Condition.Income(op, number.value());
      }
    }
    if (op == ComparisonOp.EQUAL && node.value() instanceof ConditionValue.Text text) {
      return new Condition.AttributeEquals(node.field(), text.value());
    }
    return unsupported(node);
  }

  @Override
  public Condition visitBetween(Between node) throws DslException {
    if (node.min() instanceof ConditionValue.Number min
        && node.max() instanceof ConditionValue.Number max) {
      if (node.field().equals("age")) {
        return new Condition.And(
            new Condition.Age(ComparisonOp.GREATER_OR_EQUAL, min.value()),
            new Condition.Age(ComparisonOp.LESS_OR_EQUAL, max.value()));
      }
      if (node.field().equals("income")) {
        return new Condition.And(
            new Condition.Income(ComparisonOp.GREATER_OR_EQUAL, min.value()),
            new Condition.Income(ComparisonOp.LESS_OR_EQUAL, max.value()));
      }
    }
    return unsupported(node);
  }

  @Override
  public Condition visitIn(In node) throws DslException {
    List<String> members = new ArrayList<>();
    for (ConditionValue value : node.values()) {
      if (value instanceof ConditionValue.Number number) {
        members.add(String.valueOf(number.value()));
      } else if (value instanceof ConditionValue.Text text) {
        members.add(text.value());
      } else if (value instanceof ConditionValue.Date date) {
        members.add(date.value());
      } else {
        return unsupported(node);
      }
    }
    return new Condition.SetMembership(node.field(), members, false);
  }

  @Override
  public Condition visitLike(Like node) throws DslException {
    return unsupported(node);
  }

  @Override
  public Condition visitMatches(Matches node) throws DslException {
    return unsupported(node);
  }

  @Override
  public Condition visitTemporalComparison(TemporalComparison node) throws DslException {
    if (!(node.field() instanceof TemporalField.CurrentDate)
        || !(node.value() instanceof ConditionValue.Date value)) {
      return unsupported(node);
    }
    LocalDate date;
    try {
      date = LocalDate.parse(value.value());
    } catch (DateTimeParseException e) {
      return unsupported(node);
    }
    return switch (node.operator()) {
      case ">=" -> new Condition.DateRange(date, null);
      case ">" -> new Condition.DateRange(date.plusDays(1), null);
      case "<=" -> new Condition.DateRange(null, date);
      case "<" -> new Condition.DateRange(null, date.minusDays(1));
      case "==" -> new Condition.DateRange(date, date);
      case "!=" -> new Condition.Not(new Condition.DateRange(date, date));
      default -> unsupported(node);
    };
  }

  @Override
  public Condition visitInRange(InRange node) throws DslException {
    return unsupported(node);
  }

  @Override
  public Condition visitNotInRange(NotInRange node) throws DslException {
    return unsupported(node);
  }

  private Condition unsupported(ConditionNode node) throws DslException {
    String text = DslPrinter.formatCondition(node);
    if (policy == LoweringPolicy.STRICT) {
      throw DslException.invalidCondition("Condition has no downstream equivalent: " + text);
    }
    logger.warn("Lowering '{}' as a custom condition", text);
    return new Condition.Custom(text);
  }
}
