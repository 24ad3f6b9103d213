package io.legalis.dsl.display;

import io.legalis.dsl.ast.AmendmentClause;
import io.legalis.dsl.ast.And;
import io.legalis.dsl.ast.Between;
import io.legalis.dsl.ast.Comparison;
import io.legalis.dsl.ast.ConditionNode;
import io.legalis.dsl.ast.ConditionValue;
import io.legalis.dsl.ast.DefaultClause;
import io.legalis.dsl.ast.Document;
import io.legalis.dsl.ast.EffectNode;
import io.legalis.dsl.ast.ExceptionClause;
import io.legalis.dsl.ast.HasAttribute;
import io.legalis.dsl.ast.ImportDirective;
import io.legalis.dsl.ast.In;
import io.legalis.dsl.ast.InRange;
import io.legalis.dsl.ast.Like;
import io.legalis.dsl.ast.Matches;
import io.legalis.dsl.ast.Not;
import io.legalis.dsl.ast.NotInRange;
import io.legalis.dsl.ast.Or;
import io.legalis.dsl.ast.SetExpression;
import io.legalis.dsl.ast.StatuteNode;
import io.legalis.dsl.ast.TemporalComparison;
import io.legalis.dsl.ast.TemporalField;
import io.legalis.dsl.lexer.Lexer;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders documents, statutes and conditions as DSL text.
 *
 * <p>Output parses back to an equal AST, with two exceptions: set expressions have no syntax and
 * are rendered descriptively, and a statute with several top-level conditions comes back as one
 * conjunction.
 */
public final class DslPrinter {
  private static final Pattern BARE_WORD =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(-[A-Za-z0-9_]+)*");

  private final PrinterConfig config;

  /** Creates a printer with the default configuration. */
  public DslPrinter() {
    this(PrinterConfig.defaults());
  }

  /**
   * Creates a printer with a custom configuration.
   *
   * @param config the configuration
   */
  public DslPrinter(PrinterConfig config) {
    this.config = config;
  }

  /**
   * Renders a whole document: imports first, then statutes separated by blank lines.
   *
   * @param document the document
   * @return the DSL text
   */
  public String format(Document document) {
    StringBuilder sb = new StringBuilder();
    for (ImportDirective imp : document.imports()) {
      sb.append("IMPORT ").append(quote(imp.path()));
      if (imp.alias() != null) {
        sb.append(" AS ").append(imp.alias());
      }
      sb.append('\n');
    }
    if (!document.imports().isEmpty() && !document.statutes().isEmpty()) {
      sb.append('\n');
    }
    sb.append(document.statutes().stream().map(this::format).collect(Collectors.joining("\n")));
    return sb.toString();
  }

  /**
   * Renders a single statute block.
   *
   * @param statute the statute
   * @return the DSL text, ending with a newline
   */
  public String format(StatuteNode statute) {
    StringBuilder sb = new StringBuilder();
    if (config.includeComments()) {
      sb.append("// Statute: ").append(statute.title()).append('\n');
      if (statute.jurisdiction() != null) {
        sb.append("// Jurisdiction: ").append(statute.jurisdiction()).append('\n');
      }
    }

    sb.append("STATUTE ")
        .append(statute.id())
        .append(": ")
        .append(quote(statute.title()))
        .append(" {\n");

    if (statute.jurisdiction() != null) {
      line(sb, "JURISDICTION " + quote(statute.jurisdiction()));
    }
    if (statute.version() != 1) {
      line(sb, "VERSION " + statute.version());
    }
    if (statute.effectiveDate() != null) {
      line(sb, "EFFECTIVE_DATE " + statute.effectiveDate());
    }
    if (statute.expiryDate() != null) {
      line(sb, "EXPIRY_DATE " + statute.expiryDate());
    }
    if (!statute.requires().isEmpty()) {
      line(sb, "REQUIRES " + String.join(", ", statute.requires()));
    }
    if (!statute.supersedes().isEmpty()) {
      line(sb, "SUPERSEDES " + String.join(", ", statute.supersedes()));
    }
    for (ConditionNode condition : statute.conditions()) {
      line(sb, "WHEN " + formatCondition(condition));
    }

    EffectNode effect = statute.effect();
    line(sb, "THEN " + effect.effectType() + " " + quote(effect.description()));

    if (statute.discretion() != null) {
      line(sb, "DISCRETION " + quote(statute.discretion()));
    }
    for (ExceptionClause exception : statute.exceptions()) {
      StringBuilder clause = new StringBuilder("EXCEPTION");
      if (!exception.conditions().isEmpty()) {
        clause.append(" WHEN ").append(formatConjunction(exception.conditions()));
      }
      clause.append(' ').append(quote(exception.description()));
      line(sb, clause.toString());
    }
    for (AmendmentClause amendment : statute.amendments()) {
      StringBuilder clause = new StringBuilder("AMENDMENT ").append(amendment.targetId());
      if (amendment.version() != null) {
        clause.append(" VERSION ").append(amendment.version());
      }
      if (amendment.date() != null) {
        clause.append(" EFFECTIVE_DATE ").append(quote(amendment.date()));
      }
      clause.append(' ').append(quote(amendment.description()));
      line(sb, clause.toString());
    }
    for (DefaultClause def : statute.defaults()) {
      line(sb, "DEFAULT " + def.field() + " = " + formatValue(def.value()));
    }

    sb.append("}\n");
    return sb.toString();
  }

  private void line(StringBuilder sb, String text) {
    sb.append(config.indent()).append(text).append('\n');
  }

  /**
   * Renders a condition with the fewest parentheses that preserve its structure.
   *
   * @param condition the condition
   * @return the DSL text
   */
  public static String formatCondition(ConditionNode condition) {
    return render(condition, PREC_OR);
  }

  private static String formatConjunction(List<ConditionNode> conditions) {
    return conditions.stream()
        .map(c -> render(c, PREC_AND))
        .collect(Collectors.joining(" AND "));
  }

  private static final int PREC_OR = 1;
  private static final int PREC_AND = 2;
  private static final int PREC_NOT = 3;

  // AND and OR are left-associative, so a right operand of equal precedence needs parentheses
  private static String render(ConditionNode node, int minPrec) {
    int prec;
    String text;
    if (node instanceof Or or) {
      prec = PREC_OR;
      text = render(or.left(), PREC_OR) + " OR " + render(or.right(), PREC_AND);
    } else if (node instanceof And and) {
      prec = PREC_AND;
      text = render(and.left(), PREC_AND) + " AND " + render(and.right(), PREC_NOT);
    } else if (node instanceof Not not) {
      prec = PREC_NOT;
      text = "NOT " + render(not.inner(), PREC_NOT);
    } else {
      return renderAtom(node);
    }
    return prec < minPrec ? "(" + text + ")" : text;
  }

  private static String renderAtom(ConditionNode node) {
    if (node instanceof HasAttribute has) {
      return "HAS " + word(has.key());
    }
    if (node instanceof Comparison cmp) {
      return cmp.field() + " " + cmp.operator() + " " + formatValue(cmp.value());
    }
    if (node instanceof Between between) {
      return between.field()
          + " BETWEEN "
          + formatValue(between.min())
          + " AND "
          + formatValue(between.max());
    }
    if (node instanceof In in) {
      return in.field()
          + " IN ("
          + in.values().stream().map(DslPrinter::formatValue).collect(Collectors.joining(", "))
          + ")";
    }
    if (node instanceof Like like) {
      return like.field() + " LIKE " + quote(like.pattern());
    }
    if (node instanceof Matches matches) {
      return matches.field() + " MATCHES " + quote(matches.regexPattern());
    }
    if (node instanceof TemporalComparison temporal) {
      String subject =
          temporal.field() instanceof TemporalField.DateField df
              ? "DATE_FIELD " + word(df.name())
              : "CURRENT_DATE";
      return subject + " " + temporal.operator() + " " + formatValue(temporal.value());
    }
    if (node instanceof InRange range) {
      return range.field()
          + " IN_RANGE "
          + formatRange(range.min(), range.max(), range.inclusiveMin(), range.inclusiveMax());
    }
    NotInRange range = (NotInRange) node;
    return range.field()
        + " NOT_IN_RANGE "
        + formatRange(range.min(), range.max(), range.inclusiveMin(), range.inclusiveMax());
  }

  private static String formatRange(
      ConditionValue min, ConditionValue max, boolean inclusiveMin, boolean inclusiveMax) {
    String lo = formatValue(min);
    String hi = formatValue(max);
    if (inclusiveMin && inclusiveMax) {
      return lo + ".." + hi;
    }
    if (inclusiveMin) {
      return lo + "..." + hi;
    }
    return "(" + lo + ".." + hi + (inclusiveMax ? "]" : ")");
  }

  /**
   * Renders a condition value: numbers and dates bare, strings quoted.
   *
   * @param value the value
   * @return the DSL text
   */
  public static String formatValue(ConditionValue value) {
    if (value instanceof ConditionValue.Number number) {
      return String.valueOf(number.value());
    }
    if (value instanceof ConditionValue.Text text) {
      return quote(text.value());
    }
    if (value instanceof ConditionValue.Date date) {
      return date.value();
    }
    return formatSet(((ConditionValue.SetExpr) value).expression());
  }

  private static String formatSet(SetExpression set) {
    if (set instanceof SetExpression.Values values) {
      return "{"
          + values.values().stream().map(DslPrinter::formatValue).collect(Collectors.joining(", "))
          + "}";
    }
    if (set instanceof SetExpression.Union union) {
      return "(" + formatSet(union.left()) + " UNION " + formatSet(union.right()) + ")";
    }
    if (set instanceof SetExpression.Intersect intersect) {
      return "(" + formatSet(intersect.left()) + " INTERSECT " + formatSet(intersect.right()) + ")";
    }
    SetExpression.Difference difference = (SetExpression.Difference) set;
    return "(" + formatSet(difference.left()) + " EXCEPT " + formatSet(difference.right()) + ")";
  }

  private static String word(String s) {
    if (BARE_WORD.matcher(s).matches() && !Lexer.KEYWORD_SPELLINGS.contains(s)) {
      return s;
    }
    return quote(s);
  }

  private static String quote(String s) {
    return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
