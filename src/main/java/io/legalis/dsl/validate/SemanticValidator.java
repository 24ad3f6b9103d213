package io.legalis.dsl.validate;

import io.legalis.dsl.ast.And;
import io.legalis.dsl.ast.AmendmentClause;
import io.legalis.dsl.ast.Between;
import io.legalis.dsl.ast.ConditionNode;
import io.legalis.dsl.ast.ConditionValue;
import io.legalis.dsl.ast.Document;
import io.legalis.dsl.ast.ExceptionClause;
import io.legalis.dsl.ast.InRange;
import io.legalis.dsl.ast.Not;
import io.legalis.dsl.ast.Or;
import io.legalis.dsl.ast.StatuteNode;
import io.legalis.dsl.validate.ValidationError.Kind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a parsed document for problems the grammar cannot catch: duplicate ids, dangling or
 * circular REQUIRES, amendments of unknown statutes, inverted date ranges and empty numeric
 * ranges.
 *
 * <p>Superseding a statute that is not in the document is allowed, since it may live elsewhere.
 */
public final class SemanticValidator {
  private static final Logger logger = LoggerFactory.getLogger(SemanticValidator.class);

  /**
   * Validates a document.
   *
   * @param document the parsed document
   * @return the problems found, empty if the document is valid
   */
  public List<ValidationError> validate(Document document) {
    List<ValidationError> errors = new ArrayList<>();
    Map<String, StatuteNode> byId = new LinkedHashMap<>();
    for (StatuteNode statute : document.statutes()) {
      if (byId.putIfAbsent(statute.id(), statute) != null) {
        errors.add(
            new ValidationError(
                Kind.DUPLICATE_STATUTE_ID,
                statute.id(),
                "statute id '" + statute.id() + "' is defined more than once"));
      }
    }

    for (StatuteNode statute : document.statutes()) {
      validateStatute(statute, byId, errors);
    }
    findCycles(byId, errors);

    logger.debug(
        "Validated {} statutes: {} problems", document.statutes().size(), errors.size());
    return errors;
  }

  private void validateStatute(
      StatuteNode statute, Map<String, StatuteNode> byId, List<ValidationError> errors) {
    String id = statute.id();

    if (statute.effectiveDate() != null
        && statute.expiryDate() != null
        && statute.effectiveDate().isAfter(statute.expiryDate())) {
      errors.add(
          new ValidationError(
              Kind.INVALID_DATE_RANGE,
              id,
              "effective date "
                  + statute.effectiveDate()
                  + " is after expiry date "
                  + statute.expiryDate()));
    }

    for (String required : statute.requires()) {
      if (required.equals(id)) {
        errors.add(new ValidationError(Kind.SELF_REFERENCE, id, "statute requires itself"));
      } else if (!byId.containsKey(required)) {
        errors.add(
            new ValidationError(
                Kind.UNDEFINED_REFERENCE, id, "required statute '" + required + "' does not exist"));
      }
    }

    for (String superseded : statute.supersedes()) {
      if (superseded.equals(id)) {
        errors.add(new ValidationError(Kind.SELF_REFERENCE, id, "statute supersedes itself"));
      }
    }

    for (AmendmentClause amendment : statute.amendments()) {
      if (!byId.containsKey(amendment.targetId())) {
        errors.add(
            new ValidationError(
                Kind.INVALID_AMENDMENT,
                id,
                "amended statute '" + amendment.targetId() + "' does not exist"));
      }
    }

    for (ConditionNode condition : statute.conditions()) {
      checkRanges(condition, id, errors);
    }
    for (ExceptionClause exception : statute.exceptions()) {
      for (ConditionNode condition : exception.conditions()) {
        checkRanges(condition, id, errors);
      }
    }
  }

  private void checkRanges(ConditionNode node, String id, List<ValidationError> errors) {
    if (node instanceof And and) {
      checkRanges(and.left(), id, errors);
      checkRanges(and.right(), id, errors);
    } else if (node instanceof Or or) {
      checkRanges(or.left(), id, errors);
      checkRanges(or.right(), id, errors);
    } else if (node instanceof Not not) {
      checkRanges(not.inner(), id, errors);
    } else if (node instanceof Between between
        && between.min() instanceof ConditionValue.Number min
        && between.max() instanceof ConditionValue.Number max
        && min.value() > max.value()) {
      errors.add(emptyRange(id, between.field(), min.value(), max.value()));
    } else if (node instanceof InRange range
        && range.min() instanceof ConditionValue.Number min
        && range.max() instanceof ConditionValue.Number max) {
      if (isEmptyIntegerRange(
          min.value(), max.value(), range.inclusiveMin(), range.inclusiveMax())) {
        errors.add(emptyRange(id, range.field(), min.value(), max.value()));
      }
    }
  }

  static boolean isEmptyIntegerRange(
      long min, long max, boolean inclusiveMin, boolean inclusiveMax) {
    if (min > max) {
      return true;
    }
    if (min == max) {
      return !(inclusiveMin && inclusiveMax);
    }
    // max > min, so max - 1 cannot overflow
    return max - 1 == min && !inclusiveMin && !inclusiveMax;
  }

  private static ValidationError emptyRange(String id, String field, long min, long max) {
    return new ValidationError(
        Kind.INVALID_NUMERIC_RANGE,
        id,
        "range " + min + ".." + max + " on '" + field + "' can never match");
  }

  private void findCycles(Map<String, StatuteNode> byId, List<ValidationError> errors) {
    Set<String> done = new HashSet<>();
    for (String id : byId.keySet()) {
      visit(id, byId, new ArrayList<>(), done, errors);
    }
  }

  private void visit(
      String id,
      Map<String, StatuteNode> byId,
      List<String> path,
      Set<String> done,
      List<ValidationError> errors) {
    if (done.contains(id)) {
      return;
    }
    int onPath = path.indexOf(id);
    if (onPath >= 0) {
      List<String> cycle = new ArrayList<>(path.subList(onPath, path.size()));
      cycle.add(id);
      errors.add(
          new ValidationError(
              Kind.CIRCULAR_DEPENDENCY, id, "REQUIRES cycle " + String.join(" -> ", cycle)));
      return;
    }
    StatuteNode statute = byId.get(id);
    if (statute == null) {
      return;
    }
    path.add(id);
    for (String required : statute.requires()) {
      if (!required.equals(id)) {
        visit(required, byId, path, done, errors);
      }
    }
    path.remove(path.size() - 1);
    done.add(id);
  }
}
