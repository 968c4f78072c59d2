package org.dxworks.sasframe.construct;

import org.dxworks.sasframe.token.Token;
import org.dxworks.sasframe.token.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups a token sequence into a construct tree with one left-to-right scan over an explicit stack of
 * open constructs.
 * <p>
 * Structural decisions are made from token kinds only: a keyword inside a string literal or a comment
 * never opens or closes anything. Mismatched terminators are repaired and reported as
 * {@link RecoveryEvent}s so the rest of the file can still be analysed.
 * <p>
 * Instances hold no state between calls and may be shared across threads.
 */
public class ConstructBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstructBuilder.class);

    private static final Set<String> TERMINATORS = Set.of(
            StatementClassifier.RUN, StatementClassifier.QUIT, StatementClassifier.END,
            StatementClassifier.MEND, StatementClassifier.MACRO_END);

    private final StatementClassifier classifier = new StatementClassifier();

    public ConstructTree build(Iterable<Token> tokens) {
        List<Token> list = new ArrayList<>();
        for (Token token : tokens) {
            list.add(token);
        }
        return build(list);
    }

    public ConstructTree build(List<Token> tokens) {
        Scan scan = new Scan();
        int i = 0;
        while (i < tokens.size()) {
            List<Token> statementTokens = new ArrayList<>();
            i = nextStatement(tokens, i, statementTokens);
            if (statementTokens.isEmpty()) {
                continue;
            }
            Statement statement = new Statement(statementTokens);
            if (statement.size() == 0) {
                continue;
            }
            scan.accept(statement);
        }
        scan.finish(tokens.isEmpty() ? null : tokens.get(tokens.size() - 1));

        resolveMacroRecursion(scan.root);
        List<ConstructDraft> ordered = assignIds(scan.root);
        Construct root = freeze(ordered);
        List<RecoveryEvent> events = new ArrayList<>();
        for (PendingEvent pending : scan.events) {
            events.add(pending.toEvent());
        }
        if (!events.isEmpty()) {
            LOGGER.debug("Construct tree repaired at {} point(s)", events.size());
        }
        return new ConstructTree(root, events, tokens.size());
    }

    /**
     * Collects the next statement starting at {@code from} into {@code sink}, comments excluded, and returns
     * the index after it. A macro invocation at statement start is a statement of its own: the call, its
     * balanced argument list and an optional {@code ;}.
     */
    private int nextStatement(List<Token> tokens, int from, List<Token> sink) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).kind == TokenKind.COMMENT) {
            i++;
        }
        if (i >= tokens.size()) {
            return i;
        }
        if (tokens.get(i).isMacroReference()) {
            sink.add(tokens.get(i++));
            int next = skipComments(tokens, i);
            if (next < tokens.size() && tokens.get(next).isDelimiter("(")) {
                int depth = 0;
                i = next;
                while (i < tokens.size()) {
                    Token token = tokens.get(i++);
                    if (token.kind == TokenKind.COMMENT) {
                        continue;
                    }
                    sink.add(token);
                    if (token.isDelimiter("(")) {
                        depth++;
                    } else if (token.isDelimiter(")") && --depth == 0) {
                        break;
                    }
                }
                next = skipComments(tokens, i);
            }
            if (next < tokens.size() && tokens.get(next).isDelimiter(";")) {
                sink.add(tokens.get(next));
                return next + 1;
            }
            return i;
        }
        while (i < tokens.size()) {
            Token token = tokens.get(i++);
            if (token.kind == TokenKind.COMMENT) {
                continue;
            }
            sink.add(token);
            if (token.isDelimiter(";")) {
                break;
            }
        }
        return i;
    }

    private static int skipComments(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).kind == TokenKind.COMMENT) {
            i++;
        }
        return i;
    }

    // ---- post-scan passes ----

    /** Marks macro definitions that call themselves, directly or through other in-file definitions. */
    private void resolveMacroRecursion(ConstructDraft root) {
        Map<String, ConstructDraft> definitions = new LinkedHashMap<>();
        Map<String, Set<String>> calls = new HashMap<>();

        Deque<ConstructDraft> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ConstructDraft draft = stack.pop();
            if (draft.kind == ConstructKind.MACRO_DEFINITION) {
                String name = (String) draft.attributes.get("macroName");
                definitions.putIfAbsent(name, draft);
                calls.computeIfAbsent(name, key -> new LinkedHashSet<>()).addAll(callsWithin(draft));
            }
            for (ConstructDraft child : draft.children) {
                stack.push(child);
            }
        }

        for (Map.Entry<String, ConstructDraft> entry : definitions.entrySet()) {
            String name = entry.getKey();
            Set<String> direct = calls.getOrDefault(name, Set.of());
            String recursion = "none";
            if (direct.contains(name)) {
                recursion = "direct";
            } else if (reaches(name, direct, calls)) {
                recursion = "mutual";
            }
            entry.getValue().attributes.put("recursive", !"none".equals(recursion));
            entry.getValue().attributes.put("recursion", recursion);
        }
    }

    // Invocations in a definition's body, not counting bodies of definitions nested inside it.
    private static Set<String> callsWithin(ConstructDraft definition) {
        Set<String> names = new LinkedHashSet<>();
        Deque<ConstructDraft> stack = new ArrayDeque<>(definition.children);
        while (!stack.isEmpty()) {
            ConstructDraft draft = stack.pop();
            if (draft.kind == ConstructKind.MACRO_DEFINITION) {
                continue;
            }
            if (draft.kind == ConstructKind.MACRO_INVOCATION) {
                names.add((String) draft.attributes.get("macroName"));
            }
            for (ConstructDraft child : draft.children) {
                stack.push(child);
            }
        }
        return names;
    }

    private static boolean reaches(String target, Set<String> start, Map<String, Set<String>> calls) {
        Set<String> seen = new HashSet<>();
        Deque<String> work = new ArrayDeque<>(start);
        while (!work.isEmpty()) {
            String name = work.pop();
            if (!seen.add(name)) {
                continue;
            }
            Set<String> next = calls.get(name);
            if (next == null) {
                continue;
            }
            if (next.contains(target)) {
                return true;
            }
            work.addAll(next);
        }
        return false;
    }

    private static List<ConstructDraft> assignIds(ConstructDraft root) {
        List<ConstructDraft> ordered = new ArrayList<>();
        Deque<ConstructDraft> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ConstructDraft draft = stack.pop();
            draft.id = ordered.size();
            ordered.add(draft);
            for (int i = draft.children.size() - 1; i >= 0; i--) {
                stack.push(draft.children.get(i));
            }
        }
        return ordered;
    }

    // Reverse pre-order visits every child before its parent.
    private static Construct freeze(List<ConstructDraft> ordered) {
        Construct[] frozen = new Construct[ordered.size()];
        for (int i = ordered.size() - 1; i >= 0; i--) {
            ConstructDraft draft = ordered.get(i);
            List<Construct> children = new ArrayList<>(draft.children.size());
            for (ConstructDraft child : draft.children) {
                children.add(frozen[child.id]);
            }
            frozen[i] = new Construct(draft.id, draft.kind, draft.isBlock() || draft.kind == ConstructKind.PROGRAM,
                    spanOf(draft, children), draft.text, draft.attributes, draft.tokens, children);
        }
        return frozen[0];
    }

    private static SourceSpan spanOf(ConstructDraft draft, List<Construct> children) {
        int start;
        int line;
        int column;
        if (!draft.tokens.isEmpty()) {
            Token first = draft.tokens.get(0);
            start = first.start;
            line = first.line;
            column = first.column;
        } else if (!children.isEmpty()) {
            SourceSpan firstChild = children.get(0).span;
            start = firstChild.start;
            line = firstChild.line;
            column = firstChild.column;
        } else {
            start = 0;
            line = 1;
            column = 0;
        }
        int end = start;
        int endLine = line;
        for (Token token : draft.tokens) {
            end = Math.max(end, token.end);
            endLine = Math.max(endLine, token.line);
        }
        for (Construct child : children) {
            end = Math.max(end, child.span.end);
            endLine = Math.max(endLine, child.span.endLine);
        }
        return new SourceSpan(start, end, line, column, endLine);
    }

    private static boolean isMacroLevel(ConstructDraft draft) {
        return switch (draft.kind) {
            case MACRO_DEFINITION, MACRO_IF, MACRO_ELSE, MACRO_DO_BLOCK, MACRO_DO_LOOP -> true;
            default -> false;
        };
    }

    /** One build's mutable state. */
    private final class Scan {
        final ConstructDraft root = ConstructDraft.root();
        final List<ConstructDraft> open = new ArrayList<>();
        final List<PendingEvent> events = new ArrayList<>();
        /** PROC closed by RUN on the previous statement; a QUIT right after it belongs to that step. */
        ConstructDraft closedByRun;

        Scan() {
            open.add(root);
        }

        void accept(Statement statement) {
            ConstructDraft previousProc = closedByRun;
            closedByRun = null;
            String terminator = terminatorOf(statement);
            if (terminator != null) {
                close(statement, terminator, previousProc);
                return;
            }
            Token first = statement.first();
            if (isStepStart(statement)) {
                closeOpenStep(statement);
                ConstructDraft step = first.isKeyword("DATA")
                        ? classifier.dataStep(statement)
                        : classifier.procStep(statement);
                attach(step);
                return;
            }
            attach(classifier.classify(statement, context()));
        }

        void finish(Token last) {
            List<ConstructDraft> forced = new ArrayList<>();
            while (open.size() > 1) {
                ConstructDraft draft = open.remove(open.size() - 1);
                if (draft.isHardBlock()) {
                    forced.add(draft);
                }
            }
            if (!forced.isEmpty()) {
                events.add(new PendingEvent(last == null ? 0 : last.line, last == null ? 0 : last.column, null,
                        "end of file reached with " + forced.size() + " unterminated block(s)", forced));
            }
        }

        private void attach(ConstructDraft draft) {
            top().children.add(draft);
            if (draft.isBlock()) {
                open.add(draft);
            }
        }

        private ConstructDraft top() {
            return open.get(open.size() - 1);
        }

        private void close(Statement statement, String terminator, ConstructDraft previousProc) {
            Token first = statement.first();
            if (StatementClassifier.RUN.equals(terminator) && endRunGroup(statement)) {
                return;
            }
            int target = findOpen(terminator);
            if (target < 0) {
                if (StatementClassifier.QUIT.equals(terminator) && previousProc != null) {
                    previousProc.tokens.addAll(statement.tokens());
                    return;
                }
                events.add(new PendingEvent(first.line, first.column, terminator,
                        "unmatched " + terminator + " ignored", List.of()));
                return;
            }
            List<ConstructDraft> forced = popAbove(target);
            ConstructDraft closed = open.remove(open.size() - 1);
            closed.tokens.addAll(statement.tokens());
            if (!forced.isEmpty()) {
                events.add(new PendingEvent(first.line, first.column, terminator,
                        terminator + " closed " + closed.describe() + " over " + forced.size()
                                + " unterminated block(s)", forced));
            }
            if (closed.kind == ConstructKind.PROC_STEP && StatementClassifier.RUN.equals(terminator)) {
                closedByRun = closed;
            }
        }

        // RUN inside a procedure that only QUIT ends: the step stays open for the next run group.
        private boolean endRunGroup(Statement statement) {
            int stepIndex = openStepIndex();
            if (stepIndex < 0) {
                return false;
            }
            ConstructDraft step = open.get(stepIndex);
            if (step.kind != ConstructKind.PROC_STEP || step.terminators.contains(StatementClassifier.RUN)) {
                return false;
            }
            List<ConstructDraft> forced = popAbove(stepIndex);
            step.tokens.addAll(statement.tokens());
            if (!forced.isEmpty()) {
                Token first = statement.first();
                events.add(new PendingEvent(first.line, first.column, StatementClassifier.RUN,
                        "RUN ended a run group of " + step.describe() + " over " + forced.size()
                                + " unterminated block(s)", forced));
            }
            return true;
        }

        // Removes everything above the given stack index, returning the hard blocks among them.
        private List<ConstructDraft> popAbove(int index) {
            List<ConstructDraft> forced = new ArrayList<>();
            while (open.size() - 1 > index) {
                ConstructDraft draft = open.remove(open.size() - 1);
                if (draft.isHardBlock()) {
                    forced.add(draft);
                }
            }
            return forced;
        }

        // Index on the open stack of the construct this terminator closes, or -1. Statement terminators do
        // not reach past an enclosing macro definition.
        private int findOpen(String terminator) {
            for (int i = open.size() - 1; i > 0; i--) {
                ConstructDraft draft = open.get(i);
                if (draft.terminators.contains(terminator)) {
                    return i;
                }
                if (draft.kind == ConstructKind.MACRO_DEFINITION) {
                    return -1;
                }
            }
            return -1;
        }

        // Index of the innermost open step, or -1 when none is open or a macro-level block lies in between.
        private int openStepIndex() {
            for (int i = open.size() - 1; i > 0; i--) {
                ConstructDraft draft = open.get(i);
                if (draft.soft) {
                    return i;
                }
                if (isMacroLevel(draft)) {
                    return -1;
                }
            }
            return -1;
        }

        // A new step ends the current one, unless a macro-level block lies in between.
        private void closeOpenStep(Statement statement) {
            int stepIndex = openStepIndex();
            if (stepIndex < 0) {
                return;
            }
            List<ConstructDraft> forced = popAbove(stepIndex);
            open.remove(open.size() - 1);
            if (!forced.isEmpty()) {
                Token first = statement.first();
                events.add(new PendingEvent(first.line, first.column, null,
                        "step boundary closed " + forced.size() + " unterminated block(s)", forced));
            }
        }

        private StatementContext context() {
            for (int i = open.size() - 1; i > 0; i--) {
                ConstructDraft draft = open.get(i);
                StatementContext context = switch (draft.kind) {
                    case DATA_STEP -> StatementContext.DATA_STEP;
                    case PROC_STEP -> "SQL".equals(draft.attributes.get("procName"))
                            ? StatementContext.PROC_SQL
                            : StatementContext.PROC;
                    case MACRO_DEFINITION -> StatementContext.MACRO_BODY;
                    default -> null;
                };
                if (context != null) {
                    return context;
                }
            }
            return StatementContext.OPEN_CODE;
        }
    }

    private static String terminatorOf(Statement statement) {
        Token first = statement.first();
        if (first.kind != TokenKind.KEYWORD || !TERMINATORS.contains(first.normalized())) {
            return null;
        }
        Token second = statement.at(1);
        return second != null && second.isOperator("=") ? null : first.normalized();
    }

    private static boolean isStepStart(Statement statement) {
        Token first = statement.first();
        if (!first.isKeyword("DATA") && !first.isKeyword("PROC")) {
            return false;
        }
        Token second = statement.at(1);
        return second == null || !second.isOperator("=");
    }

    /** Recovery event whose construct ids are known only after the tree is numbered. */
    private static final class PendingEvent {
        final int line;
        final int column;
        final String terminator;
        final String message;
        final List<ConstructDraft> forceClosed;

        PendingEvent(int line, int column, String terminator, String message, List<ConstructDraft> forceClosed) {
            this.line = line;
            this.column = column;
            this.terminator = terminator;
            this.message = message;
            this.forceClosed = forceClosed;
        }

        RecoveryEvent toEvent() {
            List<Integer> ids = new ArrayList<>();
            for (ConstructDraft draft : forceClosed) {
                ids.add(draft.id);
            }
            return new RecoveryEvent(line, column, terminator, message, ids);
        }
    }
}
