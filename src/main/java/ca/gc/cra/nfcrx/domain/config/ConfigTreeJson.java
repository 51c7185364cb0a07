package ca.gc.cra.nfcrx.domain.config;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON codec for {@link ConfigTree} documents, used for log output and fixtures.
 *
 * <p>Arrays are rejected; config trees only hold objects and scalars. JSON {@code null} members are
 * dropped, matching the "absent key" semantics of the tree.</p>
 *
 * @since 0.1.0
 */
public final class ConfigTreeJson {
  private static final JsonFactory FACTORY = new JsonFactory();

  private ConfigTreeJson() {}

  /**
   * Parses a JSON object into a tree.
   *
   * @param json JSON document whose root is an object; blank input yields an empty tree
   * @return parsed tree
   * @throws IllegalArgumentException when the document is malformed or contains arrays
   */
  public static ConfigTree parse(String json) {
    Objects.requireNonNull(json, "json");
    if (json.isBlank()) {
      return ConfigTree.empty();
    }
    try (JsonParser parser = FACTORY.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("config JSON root must be an object");
      }
      Map<String, Object> root = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return ConfigTree.fromMap(root);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON config payload", ex);
    }
  }

  /**
   * Renders a tree as compact JSON preserving key order.
   *
   * @param tree tree to render
   * @return JSON text
   */
  public static String write(ConfigTree tree) {
    Objects.requireNonNull(tree, "tree");
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      writeTree(generator, tree);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render config tree", ex);
    }
    return out.toString();
  }

  private static void writeTree(JsonGenerator generator, ConfigTree tree) throws IOException {
    generator.writeStartObject();
    for (Map.Entry<String, ConfigValue> entry : tree.entries().entrySet()) {
      generator.writeFieldName(entry.getKey());
      if (entry.getValue() instanceof ConfigTree nested) {
        writeTree(generator, nested);
      } else {
        Object value = ((ConfigValue.Scalar) entry.getValue()).value();
        if (value instanceof Boolean b) {
          generator.writeBoolean(b);
        } else if (value instanceof Long l) {
          generator.writeNumber(l);
        } else if (value instanceof Double d) {
          generator.writeNumber(d);
        } else {
          generator.writeString(value.toString());
        }
      }
    }
    generator.writeEndObject();
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token in config: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }
}
