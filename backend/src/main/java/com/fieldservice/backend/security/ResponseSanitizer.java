package com.fieldservice.backend.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Escapes HTML-significant characters in response values.
 *
 * Walks strings, collections, maps, arrays and Jackson trees. Strings without
 * {@code & < > " '} come back as the same instance; non-string scalars are untouched.
 * Pure: no state, same input gives the same output.
 */
@Component
public class ResponseSanitizer {

    public Object sanitize(Object value) {
        if (value instanceof String text) {
            return sanitize(text);
        }
        if (value instanceof JsonNode node) {
            return sanitize(node);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>(map.size());
            map.forEach((key, entry) -> result.put(key, sanitize(entry)));
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            for (Object item : collection) {
                result.add(sanitize(item));
            }
            return result;
        }
        if (value instanceof Object[] array) {
            Object[] result = new Object[array.length];
            for (int i = 0; i < array.length; i++) {
                result[i] = sanitize(array[i]);
            }
            return result;
        }
        return value;
    }

    public String sanitize(String text) {
        if (text == null || !needsEscaping(text)) {
            return text;
        }
        // UTF-8 mode escapes only & < > " ' and leaves other characters alone
        return HtmlUtils.htmlEscape(text, "UTF-8");
    }

    public JsonNode sanitize(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            String escaped = sanitize(node.textValue());
            return escaped.equals(node.textValue()) ? node : TextNode.valueOf(escaped);
        }
        if (node.isObject()) {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                result.set(field.getKey(), sanitize(field.getValue()));
            }
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode item : node) {
                result.add(sanitize(item));
            }
            return result;
        }
        return node;
    }

    private static boolean needsEscaping(String text) {
        for (int i = 0; i < text.length(); i++) {
            switch (text.charAt(i)) {
                case '&', '<', '>', '"', '\'':
                    return true;
                default:
                    break;
            }
        }
        return false;
    }
}
