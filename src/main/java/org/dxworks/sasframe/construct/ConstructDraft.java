package org.dxworks.sasframe.construct;

import org.dxworks.sasframe.token.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable construct used while the builder's stack is open; frozen into a {@link Construct} at the end.
 */
final class ConstructDraft {

    final ConstructKind kind;
    final Map<String, Object> attributes = new LinkedHashMap<>();
    final List<Token> tokens = new ArrayList<>();
    final List<ConstructDraft> children = new ArrayList<>();
    /** Keywords that close this construct; empty for leaves and the root. */
    final Set<String> terminators;
    /** Soft blocks (steps) may be closed implicitly without a recovery event. */
    final boolean soft;
    final String text;
    int id = -1;

    private ConstructDraft(ConstructKind kind, Set<String> terminators, boolean soft, Statement header) {
        this.kind = kind;
        this.terminators = terminators;
        this.soft = soft;
        if (header != null) {
            this.tokens.addAll(header.tokens());
            this.text = header.text();
        } else {
            this.text = "";
        }
    }

    static ConstructDraft root() {
        return new ConstructDraft(ConstructKind.PROGRAM, Set.of(), false, null);
    }

    static ConstructDraft leaf(ConstructKind kind, Statement statement) {
        return new ConstructDraft(kind, Set.of(), false, statement);
    }

    static ConstructDraft block(ConstructKind kind, Statement statement, String... terminators) {
        return new ConstructDraft(kind, Set.of(terminators), false, statement);
    }

    static ConstructDraft step(ConstructKind kind, Statement statement, String... terminators) {
        return new ConstructDraft(kind, Set.of(terminators), true, statement);
    }

    ConstructDraft with(String key, Object value) {
        if (value != null) {
            attributes.put(key, value);
        }
        return this;
    }

    boolean isBlock() {
        return !terminators.isEmpty();
    }

    boolean isHardBlock() {
        return isBlock() && !soft;
    }

    int line() {
        return tokens.isEmpty() ? 0 : tokens.get(0).line;
    }

    String describe() {
        return kind + " at line " + line();
    }
}
