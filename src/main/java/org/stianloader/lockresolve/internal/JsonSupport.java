package org.stianloader.lockresolve.internal;

import java.io.IOException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared JSON plumbing. All documents are handled as Jackson trees, which keeps the structure of lock files,
 * registry metadata and manifests under the control of the code reading them.
 */
public final class JsonSupport {

    @NotNull
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    /**
     * A writer emitting two-space indented JSON with {@code "key": value} separators, {@code \n} line endings
     * and compact empty containers ({@code []} and {@code {}}).
     */
    @NotNull
    private static final ObjectWriter CANONICAL_WRITER = JsonSupport.MAPPER.writer(new CanonicalPrettyPrinter());

    private JsonSupport() {
        throw new UnsupportedOperationException("Static utility class");
    }

    /**
     * Parses a JSON document into a tree.
     *
     * @param data The UTF-8 encoded document
     * @return The root node, a missing node if the document is empty
     * @throws IOException If the document is not valid JSON
     */
    @NotNull
    public static JsonNode readTree(byte @NotNull[] data) throws IOException {
        return JsonSupport.MAPPER.readTree(data);
    }

    @NotNull
    public static String writeCanonical(@NotNull Object value) throws IOException {
        return JsonSupport.CANONICAL_WRITER.writeValueAsString(value) + '\n';
    }

    /**
     * Obtains the textual value of a field, returning null if the field is absent or not a string.
     *
     * @param node The object node to read the field from
     * @param field The name of the field
     * @return The text value of the field, or null
     */
    @Nullable
    public static String optText(@NotNull JsonNode node, @NotNull String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        return value.textValue();
    }

    private static final class CanonicalPrettyPrinter extends DefaultPrettyPrinter {

        private static final long serialVersionUID = 2384913771051294467L;

        CanonicalPrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            this.indentObjectsWith(indenter);
            this.indentArraysWith(indenter);
        }

        CanonicalPrettyPrinter(CanonicalPrettyPrinter base) {
            super(base);
        }

        @Override
        public CanonicalPrettyPrinter createInstance() {
            return new CanonicalPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!this._objectIndenter.isInline()) {
                this._nesting--;
            }
            if (nrOfEntries > 0) {
                this._objectIndenter.writeIndentation(g, this._nesting);
            }
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!this._arrayIndenter.isInline()) {
                this._nesting--;
            }
            if (nrOfValues > 0) {
                this._arrayIndenter.writeIndentation(g, this._nesting);
            }
            g.writeRaw(']');
        }
    }
}
