package io.legalis.dsl.serde;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.legalis.dsl.DslException;
import io.legalis.dsl.ast.Document;
import io.legalis.dsl.ast.StatuteNode;

/**
 * Converts parsed documents and statutes to and from JSON and YAML.
 *
 * <p>Condition nodes, values and set expressions carry a {@code type} property naming their kind.
 * Dates are written as ISO strings. Null fields are omitted.
 */
public final class DocumentCodec {
  private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
  private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

  private DocumentCodec() {}

  private static ObjectMapper configure(ObjectMapper mapper) {
    return mapper
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);
  }

  /**
   * Serializes a document as JSON.
   *
   * @param document the document
   * @return the JSON text
   * @throws DslException if serialization fails
   */
  public static String toJson(Document document) throws DslException {
    return write(JSON_MAPPER, document, "JSON");
  }

  /**
   * Serializes a statute as JSON.
   *
   * @param statute the statute
   * @return the JSON text
   * @throws DslException if serialization fails
   */
  public static String toJson(StatuteNode statute) throws DslException {
    return write(JSON_MAPPER, statute, "JSON");
  }

  /**
   * Reads a document from JSON.
   *
   * @param json the JSON text
   * @return the document
   * @throws DslException if the text is not a valid document
   */
  public static Document documentFromJson(String json) throws DslException {
    return read(JSON_MAPPER, json, Document.class, "JSON");
  }

  /**
   * Reads a statute from JSON.
   *
   * @param json the JSON text
   * @return the statute
   * @throws DslException if the text is not a valid statute
   */
  public static StatuteNode statuteFromJson(String json) throws DslException {
    return read(JSON_MAPPER, json, StatuteNode.class, "JSON");
  }

  /**
   * Serializes a document as YAML.
   *
   * @param document the document
   * @return the YAML text
   * @throws DslException if serialization fails
   */
  public static String toYaml(Document document) throws DslException {
    return write(YAML_MAPPER, document, "YAML");
  }

  /**
   * Serializes a statute as YAML.
   *
   * @param statute the statute
   * @return the YAML text
   * @throws DslException if serialization fails
   */
  public static String toYaml(StatuteNode statute) throws DslException {
    return write(YAML_MAPPER, statute, "YAML");
  }

  /**
   * Reads a document from YAML.
   *
   * @param yaml the YAML text
   * @return the document
   * @throws DslException if the text is not a valid document
   */
  public static Document documentFromYaml(String yaml) throws DslException {
    return read(YAML_MAPPER, yaml, Document.class, "YAML");
  }

  /**
   * Reads a statute from YAML.
   *
   * @param yaml the YAML text
   * @return the statute
   * @throws DslException if the text is not a valid statute
   */
  public static StatuteNode statuteFromYaml(String yaml) throws DslException {
    return read(YAML_MAPPER, yaml, StatuteNode.class, "YAML");
  }

  private static String write(ObjectMapper mapper, Object value, String format)
      throws DslException {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw DslException.serialization(
          "Failed to write " + format + ": " + e.getOriginalMessage(), e);
    }
  }

  private static <T> T read(ObjectMapper mapper, String text, Class<T> type, String format)
      throws DslException {
    try {
      return mapper.readValue(text, type);
    } catch (JsonProcessingException e) {
      throw DslException.serialization(
          "Failed to read " + type.getSimpleName() + " from " + format + ": "
              + e.getOriginalMessage(),
          e);
    }
  }
}
