package com.fieldservice.backend.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ResponseSanitizerTest {

    private final ResponseSanitizer sanitizer = new ResponseSanitizer();

    @Test
    @DisplayName("markup is escaped")
    void escapesMarkup() {
        assertThat(sanitizer.sanitize("<script>alert(1)</script>"))
                .isEqualTo("&lt;script&gt;alert(1)&lt;/script&gt;");
        assertThat(sanitizer.sanitize("Tom & \"Jerry\" 'n'"))
                .isEqualTo("Tom &amp; &quot;Jerry&quot; &#39;n&#39;");
    }

    @Test
    @DisplayName("plain text is returned as the same instance")
    void plainTextUntouched() {
        String plain = "Заявка на ремонт, 42 кв.";

        assertThat(sanitizer.sanitize(plain)).isSameAs(plain);
    }

    @Test
    @DisplayName("escaping is not idempotent: an escaped string is escaped again")
    void notIdempotent() {
        String once = sanitizer.sanitize("<b>");

        assertThat(sanitizer.sanitize(once)).isEqualTo("&amp;lt;b&amp;gt;");
    }

    @Test
    @DisplayName("nested maps and lists are walked; numbers and booleans are left alone")
    void nestedStructures() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("note", "<i>urgent</i>");
        inner.put("count", 3);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("items", List.of("a<b", inner));
        body.put("paid", true);

        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) sanitizer.sanitize((Object) body);

        assertThat(result.get("paid")).isEqualTo(true);
        List<?> items = (List<?>) result.get("items");
        assertThat(items.get(0)).isEqualTo("a&lt;b");
        assertThat(items.get(1)).isEqualTo(Map.of("note", "&lt;i&gt;urgent&lt;/i&gt;", "count", 3));
    }

    @Test
    @DisplayName("Jackson trees are rebuilt with escaped text nodes")
    void jsonTree() throws Exception {
        JsonNode tree = new ObjectMapper().readTree("{\"name\":\"<x>\",\"tags\":[\"ok\",\"a&b\"],\"n\":7}");

        JsonNode result = sanitizer.sanitize(tree);

        assertThat(result.get("name").textValue()).isEqualTo("&lt;x&gt;");
        assertThat(result.get("tags").get(0).textValue()).isEqualTo("ok");
        assertThat(result.get("tags").get(1).textValue()).isEqualTo("a&amp;b");
        assertThat(result.get("n").intValue()).isEqualTo(7);
    }
}
