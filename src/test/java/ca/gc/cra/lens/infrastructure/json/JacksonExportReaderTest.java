package ca.gc.cra.lens.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lens.application.load.ConversationLoader;
import ca.gc.cra.lens.application.load.MalformedExportException;
import ca.gc.cra.lens.application.load.MalformedMessageException;
import ca.gc.cra.lens.domain.conversation.Conversation;
import ca.gc.cra.lens.domain.conversation.Role;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;

class JacksonExportReaderTest {
  private final JacksonExportReader reader = new JacksonExportReader();
  private final ConversationLoader loader = new ConversationLoader();

  @Test
  void sampleExportLoadsBothShapes() throws Exception {
    List<Conversation> conversations = loader.load(reader.read(resource("/exports/sample-export.json")));

    assertEquals(2, conversations.size());
    Conversation deploy = conversations.get(0);
    assertEquals("conv-deploy", deploy.id());
    assertEquals("claude-3-opus", deploy.model());
    assertEquals(Role.USER, deploy.messages().get(0).role());
    assertTrue(deploy.messages().get(1).text().startsWith("Try this compose file:\n```yaml"));

    Conversation atlantis = conversations.get(1);
    assertEquals("Atlantis question", atlantis.name());
    assertNull(atlantis.model());
    assertEquals(Instant.parse("2024-03-05T14:02:00Z"), atlantis.messages().get(2).timestamp());
  }

  @Test
  void bareArrayExportIsAccepted() throws Exception {
    List<Conversation> conversations = loader.load(reader.read(resource("/exports/bare-array-export.json")));

    assertEquals("bare-1", conversations.get(0).id());
    assertEquals(Instant.parse("2024-03-04T09:00:00Z"), conversations.get(0).messages().get(1).timestamp());
  }

  @Test
  void missingRoleSurfacesFromLoader() throws Exception {
    Object tree = reader.read(resource("/exports/missing-role-export.json"));

    MalformedMessageException ex = assertThrows(MalformedMessageException.class, () -> loader.load(tree));
    assertEquals("broken", ex.conversationId());
  }

  @Test
  void truncatedExportIsMalformed() throws Exception {
    Path truncated = resource("/exports/truncated-export.json");

    assertThrows(MalformedExportException.class, () -> reader.read(truncated));
  }

  @Test
  void emptyInputIsMalformed() {
    MalformedExportException ex = assertThrows(MalformedExportException.class, () -> parse("   "));
    assertTrue(ex.getMessage().contains("is empty"));
  }

  @Test
  void trailingContentIsMalformed() {
    assertThrows(MalformedExportException.class, () -> parse("{} {}"));
  }

  @Test
  void scalarsMapToJavaTypes() throws IOException {
    Object tree = parse("{\"n\": 3, \"f\": 1.5, \"b\": true, \"z\": null, \"s\": \"x\", \"a\": [1, \"two\"]}");

    Map<?, ?> map = assertInstanceOf(Map.class, tree);
    assertEquals(3, ((Number) map.get("n")).intValue());
    assertEquals(1.5d, ((Number) map.get("f")).doubleValue());
    assertEquals(Boolean.TRUE, map.get("b"));
    assertTrue(map.containsKey("z"));
    assertNull(map.get("z"));
    assertEquals("x", map.get("s"));
    assertEquals(2, ((List<?>) map.get("a")).size());
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(IOException.class, () -> reader.read(Path.of("does-not-exist.json")));
  }

  private Object parse(String json) throws IOException {
    return reader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
  }

  private static Path resource(String name) throws URISyntaxException {
    return Path.of(Objects.requireNonNull(JacksonExportReaderTest.class.getResource(name), name).toURI());
  }
}
