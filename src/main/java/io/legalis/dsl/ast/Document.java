package io.legalis.dsl.ast;

import java.util.List;

/**
 * A parsed DSL source file.
 *
 * @param imports the import directives in source order
 * @param statutes the statutes in source order
 */
public record Document(List<ImportDirective> imports, List<StatuteNode> statutes) {
  /** Creates a new Document with defensive copies of lists. */
  public Document {
    imports = imports == null ? List.of() : List.copyOf(imports);
    statutes = statutes == null ? List.of() : List.copyOf(statutes);
  }
}
