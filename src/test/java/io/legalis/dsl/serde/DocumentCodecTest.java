package io.legalis.dsl.serde;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.legalis.dsl.DslException;
import io.legalis.dsl.ErrorKind;
import io.legalis.dsl.ast.ConditionValue;
import io.legalis.dsl.ast.Document;
import io.legalis.dsl.ast.EffectNode;
import io.legalis.dsl.ast.In;
import io.legalis.dsl.ast.SetExpression;
import io.legalis.dsl.ast.StatuteNode;
import io.legalis.dsl.parser.DocumentParser;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class DocumentCodecTest {
  private static final String SOURCE =
      "IMPORT \"base.legalis\" AS base\n"
          + "IMPORT \"other.legalis\"\n"
          + "STATUTE voting: \"Voting Rights\" {\n"
          + "    JURISDICTION \"JP\"\n"
          + "    EFFECTIVE_DATE 2016-06-19\n"
          + "    REQUIRES base.citizenship\n"
          + "    WHEN AGE >= 18 AND NOT HAS disqualified OR CURRENT_DATE > 2030-01-01\n"
          + "    THEN GRANT \"May vote\"\n"
          + "    EXCEPTION WHEN region IN (\"a\", \"b\") \"Special regions\"\n"
          + "    AMENDMENT base.citizenship VERSION 2 \"Lowered age\"\n"
          + "    DEFAULT turnout = 0\n"
          + "}\n"
          + "STATUTE levy: \"Levy\" {\n"
          + "    WHEN score IN_RANGE (1..5] AND name MATCHES \"^[a-z]+$\" AND name LIKE \"a%\"\n"
          + "    THEN OBLIGATION \"Pay\"\n"
          + "}\n";

  private static Document document;

  @BeforeAll
  static void parseSource() throws DslException {
    document = new DocumentParser().parse(SOURCE);
  }

  @Test
  void testJsonRoundTrip() throws DslException {
    String json = DocumentCodec.toJson(document);
    Document back = DocumentCodec.documentFromJson(json);
    assertEquals(document, back);
    assertEquals(2, back.imports().size());
    assertEquals(1, back.statutes().get(0).exceptions().size());
    assertEquals(1, back.statutes().get(0).amendments().size());
    assertEquals(1, back.statutes().get(0).defaults().size());
  }

  @Test
  void testYamlRoundTrip() throws DslException {
    String yaml = DocumentCodec.toYaml(document);
    assertEquals(document, DocumentCodec.documentFromYaml(yaml));
  }

  @Test
  void testStatuteRoundTrip() throws DslException {
    StatuteNode statute = document.statutes().get(1);
    assertEquals(statute, DocumentCodec.statuteFromJson(DocumentCodec.toJson(statute)));
    assertEquals(statute, DocumentCodec.statuteFromYaml(DocumentCodec.toYaml(statute)));
  }

  @Test
  void testJsonShape() throws Exception {
    JsonNode tree = new ObjectMapper().readTree(DocumentCodec.toJson(document));
    JsonNode voting = tree.get("statutes").get(0);
    assertEquals("2016-06-19", voting.get("effectiveDate").asText());
    assertFalse(voting.has("expiryDate"));
    assertFalse(voting.has("discretion"));

    JsonNode condition = voting.get("conditions").get(0);
    assertEquals("Or", condition.get("type").asText());
    assertEquals("And", condition.get("left").get("type").asText());
    assertEquals("TemporalComparison", condition.get("right").get("type").asText());
    assertEquals("CurrentDate", condition.get("right").get("field").get("type").asText());

    JsonNode age = condition.get("left").get("left");
    assertEquals("Comparison", age.get("type").asText());
    assertEquals("age", age.get("field").asText());
    assertEquals("Number", age.get("value").get("type").asText());
    assertEquals(18, age.get("value").get("value").asLong());

    assertFalse(tree.get("imports").get(1).has("alias"));
  }

  @Test
  void testSetExpressionRoundTrip() throws DslException {
    SetExpression set =
        new SetExpression.Union(
            new SetExpression.Values(List.of(ConditionValue.text("x"))),
            new SetExpression.Intersect(
                new SetExpression.Values(List.of(ConditionValue.number(1))),
                new SetExpression.Values(List.of(ConditionValue.date("2024-01-01")))));
    StatuteNode statute =
        StatuteNode.of("sets", "Sets", new EffectNode("REVOKE", "r"))
            .withConditions(List.of(new In("tag", List.of(new ConditionValue.SetExpr(set)))))
            .withRequires(List.of("other"));
    assertEquals(statute, DocumentCodec.statuteFromJson(DocumentCodec.toJson(statute)));
  }

  @Test
  void testMalformedJson() {
    DslException e =
        assertThrows(DslException.class, () -> DocumentCodec.documentFromJson("{\"statutes\": ["));
    assertEquals(ErrorKind.SERIALIZATION, e.kind());
    assertNotNull(e.getCause());
  }

  @Test
  void testUnknownConditionType() {
    String json =
        "{\"id\":\"a\",\"title\":\"A\",\"version\":1,"
            + "\"conditions\":[{\"type\":\"Teleport\"}],"
            + "\"effect\":{\"effectType\":\"GRANT\",\"description\":\"x\"},"
            + "\"exceptions\":[],\"amendments\":[],\"supersedes\":[],\"requires\":[],"
            + "\"defaults\":[]}";
    DslException e = assertThrows(DslException.class, () -> DocumentCodec.statuteFromJson(json));
    assertEquals(ErrorKind.SERIALIZATION, e.kind());
  }
}
