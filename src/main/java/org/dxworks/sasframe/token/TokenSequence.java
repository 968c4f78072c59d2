package org.dxworks.sasframe.token;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Lazily adapted token sequence. Every {@link #iterator()} call starts an independent pass.
 */
public class TokenSequence implements Iterable<Token> {

    private final Supplier<Iterator<Token>> iterators;

    TokenSequence(Supplier<Iterator<Token>> iterators) {
        this.iterators = iterators;
    }

    @Override
    public Iterator<Token> iterator() {
        return iterators.get();
    }

    /** Drains a fresh pass into a list, validating every token on the way. */
    public List<Token> toList() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }
}
