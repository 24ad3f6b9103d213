package io.legalis.dsl.ast;

/**
 * Regular expression test. The pattern is known to compile.
 *
 * @param field the lower-cased field name
 * @param regexPattern the regular expression source
 */
public record Matches(String field, String regexPattern) implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitMatches(this);
  }
}
