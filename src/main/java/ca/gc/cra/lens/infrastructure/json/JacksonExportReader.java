package ca.gc.cra.lens.infrastructure.json;

import ca.gc.cra.lens.application.load.MalformedExportException;
import ca.gc.cra.lens.application.port.ExportReaderPort;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams an export file into a tree of {@link Map}s, {@link List}s, and scalars using the Jackson core
 * parser.
 *
 * <p>Syntax errors surface as {@link MalformedExportException}; read failures stay {@link IOException}s.
 *
 * @since 0.1.0
 */
public final class JacksonExportReader implements ExportReaderPort {
  private static final Logger log = LoggerFactory.getLogger(JacksonExportReader.class);

  private final JsonFactory factory = new JsonFactory();

  @Override
  public Object read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (InputStream in = Files.newInputStream(path)) {
      Object tree = parse(in, path.toString());
      log.debug("Parsed export {} ({} bytes)", path, Files.size(path));
      return tree;
    }
  }

  /**
   * Parses a JSON document from a stream.
   *
   * @param in JSON bytes; not closed by this method
   * @param source description used in error messages
   * @return parsed document root
   * @throws IOException when the stream cannot be read
   * @throws MalformedExportException when the content is not a single JSON document
   */
  public Object parse(InputStream in, String source) throws IOException {
    try (JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new MalformedExportException("Export " + source + " is empty");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new MalformedExportException("Export " + source + " contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new MalformedExportException("Export " + source + " is not valid JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new MalformedExportException("Unexpected end of export");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new MalformedExportException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new MalformedExportException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      if (token == null) {
        throw new MalformedExportException("Unexpected end of export inside an array");
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
