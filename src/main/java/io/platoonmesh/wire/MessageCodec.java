package io.platoonmesh.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.platoonmesh.model.MessageKind;
import io.platoonmesh.model.PlatoonMessage;
import io.platoonmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON body of a frame: the message record's fields plus a {@code type} tag naming its kind.
 */
public final class MessageCodec {
    static final String TYPE_FIELD = "type";

    private MessageCodec() {
    }

    public static byte[] encode(PlatoonMessage message) {
        ObjectNode node = Jsons.compactMapper().valueToTree(message);
        node.put(TYPE_FIELD, message.kind().name());
        return Jsons.toCompactJson(node).getBytes(StandardCharsets.UTF_8);
    }

    public static PlatoonMessage decode(byte[] body) {
        JsonNode tree;
        try {
            tree = Jsons.compactMapper().readTree(body);
        } catch (IOException e) {
            throw new MessageFormatException("Malformed message body", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new MessageFormatException("Message body is not a JSON object");
        }
        ObjectNode node = (ObjectNode) tree;
        MessageKind kind;
        try {
            kind = MessageKind.fromString(node.path(TYPE_FIELD).asText(null));
        } catch (IllegalArgumentException e) {
            throw new MessageFormatException(e.getMessage(), e);
        }
        node.remove(TYPE_FIELD);
        try {
            return Jsons.compactMapper().treeToValue(node, kind.type());
        } catch (IOException | IllegalArgumentException e) {
            throw new MessageFormatException("Invalid " + kind + " message", e);
        }
    }
}
