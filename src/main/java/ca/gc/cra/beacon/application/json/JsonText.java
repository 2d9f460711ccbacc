package ca.gc.cra.beacon.application.json;

import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON reading and writing for configuration trees, built on the Jackson streaming API.
 *
 * <p>Hooks have no JSON form and are written as the string {@code "[hook <class>]"}.</p>
 *
 * @since 0.1.0
 */
public final class JsonText {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonText() {}

  /**
   * Renders {@code value} on a single line.
   *
   * @param value configuration tree
   * @return compact JSON text
   */
  public static String compact(ConfigValue value) {
    return render(value, false);
  }

  /**
   * Renders {@code value} with Jackson's default pretty printer.
   *
   * @param value configuration tree
   * @return indented JSON text
   */
  public static String pretty(ConfigValue value) {
    return render(value, true);
  }

  /**
   * Parses a JSON object document into plain maps, lists and scalars.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object; an empty document yields an empty map
   * @throws IllegalArgumentException when the text is not a JSON object
   */
  public static Map<String, Object> parseObject(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = FACTORY.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Expected a JSON object but found " + token);
      }
      Map<String, Object> value = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  private static String render(ConfigValue value, boolean pretty) {
    Objects.requireNonNull(value, "value");
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      if (pretty) {
        generator.useDefaultPrettyPrinter();
      }
      write(generator, value);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to render configuration as JSON", ex);
    }
    return out.toString();
  }

  private static void write(JsonGenerator generator, ConfigValue value) throws IOException {
    switch (value.kind()) {
      case SCALAR -> writeScalar(generator, ((ConfigValue.Scalar) value).value());
      case SEQUENCE -> {
        generator.writeStartArray();
        for (ConfigValue item : ((ConfigValue.Sequence) value).items()) {
          write(generator, item);
        }
        generator.writeEndArray();
      }
      case MAPPING -> {
        generator.writeStartObject();
        for (Map.Entry<String, ConfigValue> entry : ((ConfigValue.Mapping) value).entries().entrySet()) {
          generator.writeFieldName(entry.getKey());
          write(generator, entry.getValue());
        }
        generator.writeEndObject();
      }
      case CALLABLE -> generator.writeString(ConfigValues.describe(value));
    }
  }

  private static void writeScalar(JsonGenerator generator, Object scalar) throws IOException {
    if (scalar == null) {
      generator.writeNull();
    } else if (scalar instanceof String s) {
      generator.writeString(s);
    } else if (scalar instanceof Boolean b) {
      generator.writeBoolean(b);
    } else if (scalar instanceof BigDecimal d) {
      generator.writeNumber(d);
    } else if (scalar instanceof BigInteger i) {
      generator.writeNumber(i);
    } else if (scalar instanceof Double || scalar instanceof Float) {
      generator.writeNumber(((Number) scalar).doubleValue());
    } else {
      generator.writeNumber(((Number) scalar).longValue());
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return map;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        return list;
      }
      list.add(readValue(parser, token));
    }
  }
}
