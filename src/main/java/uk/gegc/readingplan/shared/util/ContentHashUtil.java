package uk.gegc.readingplan.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes a stable SHA-256 fingerprint of generated JSON content.
 * Object keys are sorted recursively before hashing; array order is significant.
 */
@Component
@RequiredArgsConstructor
public class ContentHashUtil {

    private final ObjectMapper objectMapper;

    public String hash(JsonNode content) {
        JsonNode canonical = canonicalize(content);
        return sha256Hex(writeCanonicalJson(canonical));
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return NullNode.getInstance();
        }
        if (node.isObject()) {
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            fieldNames.sort(Comparator.naturalOrder());
            ObjectNode sorted = objectMapper.createObjectNode();
            for (String name : fieldNames) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode arrayNode = objectMapper.createArrayNode();
            for (JsonNode item : node) {
                arrayNode.add(canonicalize(item));
            }
            return arrayNode;
        }
        return node;
    }

    private String writeCanonicalJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize canonical JSON", ex);
        }
    }

    private String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
