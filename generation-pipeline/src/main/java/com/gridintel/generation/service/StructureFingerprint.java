package com.gridintel.generation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * MD5 over a document's shape rather than its values: object keys (sorted),
 * the shape of each array's first element, and scalar type names. Two forecast
 * pulls with different numbers but the same schema hash identically.
 */
public final class StructureFingerprint {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private StructureFingerprint() {
    }

    public static String of(JsonNode document, ObjectMapper mapper) {
        try {
            String skeleton = mapper.writeValueAsString(skeleton(document));
            return DigestUtils.md5DigestAsHex(skeleton.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise structure skeleton", e);
        }
    }

    static JsonNode skeleton(JsonNode node) {
        if (node == null || node.isNull()) return NODES.textNode("null");
        if (node.isObject()) {
            List<String> keys = new ArrayList<>();
            node.fieldNames().forEachRemaining(keys::add);
            Collections.sort(keys);
            ObjectNode out = NODES.objectNode();
            for (String key : keys) {
                out.set(key, skeleton(node.get(key)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode();
            Iterator<JsonNode> it = node.elements();
            if (it.hasNext()) out.add(skeleton(it.next()));
            return out;
        }
        return NODES.textNode(node.getNodeType().name().toLowerCase());
    }
}
