package org.dxworks.sasframe.construct;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.sasframe.token.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of the construct tree. Instances are created by {@link ConstructBuilder} and never change
 * afterwards; a parent exclusively owns its children.
 */
@JsonPropertyOrder({"id", "kind", "block", "span", "text", "attributes", "children"})
public class Construct {
    public final int id;
    public final ConstructKind kind;
    /** True when the construct was opened as a scope (step, DO group, macro definition, ...). */
    public final boolean block;
    public final SourceSpan span;
    /** Source text of the statement that introduced the construct. */
    public final String text;
    public final Map<String, Object> attributes;
    public final List<Construct> children;

    @JsonIgnore
    public final List<Token> tokens;

    public Construct(int id, ConstructKind kind, boolean block, SourceSpan span, String text,
                     Map<String, Object> attributes, List<Token> tokens, List<Construct> children) {
        this.id = id;
        this.kind = kind;
        this.block = block;
        this.span = span;
        this.text = text;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.tokens = List.copyOf(tokens);
        this.children = List.copyOf(children);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public String stringAttribute(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }

    public boolean booleanAttribute(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    public int intAttribute(String key, int defaultValue) {
        Object value = attributes.get(key);
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    /** List attribute as strings; empty when absent or not a list. */
    public List<String> listAttribute(String key) {
        Object value = attributes.get(key);
        if (!(value instanceof List)) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (Object element : (List<?>) value) {
            values.add(String.valueOf(element));
        }
        return List.copyOf(values);
    }

    @Override
    public String toString() {
        return kind + "#" + id + "@" + span.line;
    }
}
