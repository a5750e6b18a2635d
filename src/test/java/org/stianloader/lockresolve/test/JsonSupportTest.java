package org.stianloader.lockresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.stianloader.lockresolve.internal.JsonSupport;

import com.fasterxml.jackson.databind.JsonNode;

public class JsonSupportTest {

    @Test
    public void testMapperIsNotExposed() {
        for (Field field : JsonSupport.class.getDeclaredFields()) {
            assertFalse(Modifier.isPublic(field.getModifiers()), "Field " + field.getName() + " must not be public");
        }
    }

    @Test
    public void testWriteCanonicalSortsKeys() throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("b", 1);
        document.put("a", List.of());
        document.put("c", Map.of());

        assertEquals("{\n  \"a\": [],\n  \"b\": 1,\n  \"c\": {}\n}\n", JsonSupport.writeCanonical(document));
    }

    @Test
    public void testReadTree() throws IOException {
        JsonNode node = JsonSupport.readTree("{\"version\": \"5\", \"n\": 4}".getBytes(StandardCharsets.UTF_8));
        assertEquals("5", JsonSupport.optText(node, "version"));
        assertEquals(null, JsonSupport.optText(node, "n"));
        assertTrue(JsonSupport.readTree(new byte[0]).isMissingNode());
        assertThrows(IOException.class, () -> JsonSupport.readTree("{\"version\": ".getBytes(StandardCharsets.UTF_8)));
    }
}
