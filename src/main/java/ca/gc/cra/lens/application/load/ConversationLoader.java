package ca.gc.cra.lens.application.load;

import ca.gc.cra.lens.domain.conversation.Conversation;
import ca.gc.cra.lens.domain.conversation.Message;
import ca.gc.cra.lens.domain.conversation.Role;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts a parsed export tree into typed {@link Conversation}s.
 * <p><strong>Why:</strong> Exports vary in field naming ({@code chat_messages} vs {@code messages},
 * {@code sender} vs {@code role}, string or block content); the loader absorbs those differences so the
 * rest of the pipeline sees one shape.</p>
 * <p><strong>Role:</strong> First stage of the analyze pipeline; runs once, sequentially.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the conversations collection (wrapped object or bare array).</li>
 *   <li>Normalize role labels and timestamps.</li>
 *   <li>Fail the whole load on the first malformed conversation or message.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs conversation and message totals at INFO; never logs message text.</p>
 *
 * @since 0.1.0
 */
public final class ConversationLoader {
  private static final Logger log = LoggerFactory.getLogger(ConversationLoader.class);
  static final String DEFAULT_NAME = "Untitled";

  /**
   * Loads every conversation from the export tree.
   *
   * @param exportTree parsed JSON document made of maps, lists, and scalars
   * @return conversations in export order
   * @throws MalformedExportException when the document or a conversation is structurally invalid
   * @throws MalformedMessageException when a message lacks its role or text or has a bad timestamp
   */
  public List<Conversation> load(Object exportTree) {
    List<?> rawConversations = conversationsOf(exportTree);
    List<Conversation> conversations = new ArrayList<>(rawConversations.size());
    Set<String> ids = new LinkedHashSet<>();
    int messageTotal = 0;
    for (int position = 0; position < rawConversations.size(); position++) {
      Conversation conversation = parseConversation(rawConversations.get(position), position);
      if (!ids.add(conversation.id())) {
        throw new MalformedExportException("Duplicate conversation id: " + conversation.id());
      }
      conversations.add(conversation);
      messageTotal += conversation.messages().size();
    }
    log.info("Loaded {} conversations containing {} messages", conversations.size(), messageTotal);
    return List.copyOf(conversations);
  }

  private List<?> conversationsOf(Object exportTree) {
    if (exportTree instanceof List<?> bare) {
      return bare;
    }
    if (exportTree instanceof Map<?, ?> root) {
      Object node = root.get("conversations");
      if (node == null) {
        throw new MalformedExportException("Export is missing the 'conversations' collection");
      }
      if (!(node instanceof List<?> list)) {
        throw new MalformedExportException("'conversations' must be an array");
      }
      return list;
    }
    throw new MalformedExportException(
        "Export root must be an object or array (was " + describe(exportTree) + ")");
  }

  private Conversation parseConversation(Object node, int position) {
    Map<String, Object> map = asMap(node, "conversation at position " + position);
    String id = optionalString(map.get("id"))
        .or(() -> optionalString(map.get("uuid")))
        .orElseThrow(() -> new MalformedExportException("Conversation at position " + position + " has no id"));
    String name = optionalString(map.get("name")).orElse(DEFAULT_NAME);
    String model = optionalString(map.get("model")).orElse(null);

    Object rawCreated = map.get("created_at");
    Instant createdAt = null;
    if (rawCreated != null) {
      createdAt = TimestampParser.parse(rawCreated)
          .orElseThrow(() -> new MalformedExportException(
              "Conversation " + id + " has an unparsable created_at value"));
    }

    Object messagesNode = map.containsKey("chat_messages") ? map.get("chat_messages") : map.get("messages");
    if (!(messagesNode instanceof List<?> rawMessages)) {
      throw new MalformedExportException("Conversation " + id + " has no messages array");
    }

    List<Message> messages = new ArrayList<>(rawMessages.size());
    for (int index = 0; index < rawMessages.size(); index++) {
      messages.add(parseMessage(id, index, rawMessages.get(index), createdAt));
    }

    if (createdAt == null) {
      if (messages.isEmpty()) {
        throw new MalformedExportException("Conversation " + id + " has neither created_at nor messages");
      }
      createdAt = messages.get(0).timestamp();
    }
    return new Conversation(id, name, createdAt, model, messages);
  }

  private Message parseMessage(String conversationId, int index, Object node, Instant fallbackTimestamp) {
    if (!(node instanceof Map<?, ?>)) {
      throw new MalformedMessageException(conversationId, index, "message must be an object");
    }
    Map<String, Object> map = asMap(node, "message");

    Object roleNode = map.containsKey("sender") ? map.get("sender") : map.get("role");
    if (roleNode == null) {
      throw new MalformedMessageException(conversationId, index, "missing role");
    }
    Role role = Role.fromLabel(roleNode.toString())
        .orElseThrow(() -> new MalformedMessageException(
            conversationId, index, "unknown role '" + roleNode + "'"));

    String text = extractText(map)
        .orElseThrow(() -> new MalformedMessageException(conversationId, index, "missing text"));

    Object timestampNode = map.containsKey("created_at") ? map.get("created_at") : map.get("timestamp");
    Instant timestamp;
    if (timestampNode != null) {
      timestamp = TimestampParser.parse(timestampNode)
          .orElseThrow(() -> new MalformedMessageException(
              conversationId, index, "unparsable timestamp '" + timestampNode + "'"));
    } else if (fallbackTimestamp != null) {
      timestamp = fallbackTimestamp;
    } else {
      throw new MalformedMessageException(conversationId, index, "missing timestamp");
    }

    return Message.of(conversationId, index, role, timestamp, text);
  }

  private Optional<String> extractText(Map<String, Object> map) {
    Object textNode = map.get("text");
    if (textNode instanceof String text) {
      return Optional.of(text);
    }
    Object content = map.get("content");
    if (content instanceof String text) {
      return Optional.of(text);
    }
    if (content instanceof List<?> blocks) {
      StringBuilder joined = new StringBuilder();
      boolean found = false;
      for (Object block : blocks) {
        String piece = null;
        if (block instanceof String str) {
          piece = str;
        } else if (block instanceof Map<?, ?> blockMap && blockMap.get("text") instanceof String str) {
          piece = str;
        }
        if (piece != null) {
          if (found) {
            joined.append('\n');
          }
          joined.append(piece);
          found = true;
        }
      }
      return found ? Optional.of(joined.toString()) : Optional.empty();
    }
    return Optional.empty();
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new MalformedExportException(context + " must be an object (was " + describe(node) + ")");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(Objects.toString(entry.getKey()), entry.getValue());
    }
    return map;
  }

  private static Optional<String> optionalString(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  private static String describe(Object node) {
    return node == null ? "null" : node.getClass().getSimpleName();
  }
}
