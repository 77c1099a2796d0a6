package net.stategraph.builder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Generic engine turning a token stream into a model.
 *
 * Tokens whose kind is ignored are dropped; all others are buffered. A
 * kind is actionable if an action is registered for it. Whenever more
 * than one actionable token is buffered, the action of the token at the
 * head of the buffer (if that is actionable) is run; the action consumes
 * its token and whatever lookahead tokens its rule covers. Thus, an action
 * always sees every token up to the next actionable one. Once the input
 * is exhausted, remaining actions are run the same way, while
 * non-actionable tokens blocking the head are dropped with a diagnostic.
 *
 * Subclasses register their actions at construction time; instances are
 * not thread-safe, but every parse starts afresh.
 */
public abstract class ModelBuilder<K, M> {

    public interface Action {

        void apply() throws GrammarException;

    }

    private static final Logger LOGGER = Logger.getLogger("ModelBuilder");

    private final Set<K> ignored;
    private final Map<K, Action> actions;
    private final LinkedList<Token<K>> queue;
    private final List<Diagnostic> diagnostics;

    protected ModelBuilder(Collection<K> ignored) {
        this.ignored = new HashSet<K>(ignored);
        this.actions = new LinkedHashMap<K, Action>();
        this.queue = new LinkedList<Token<K>>();
        this.diagnostics = new ArrayList<Diagnostic>();
    }

    public boolean isIgnored(K kind) {
        return ignored.contains(kind);
    }

    public boolean isActionable(K kind) {
        return actions.containsKey(kind);
    }

    protected void registerAction(K kind, Action action) {
        if (action == null)
            throw new NullPointerException("Action may not be null");
        if (ignored.contains(kind))
            throw new IllegalArgumentException("Cannot register action " +
                "for ignored token kind " + kind);
        actions.put(kind, action);
    }

    /**
     * The number of tokens currently buffered.
     */
    public int getBufferedCount() {
        return queue.size();
    }

    /**
     * The token at the head of the buffer, or null if the buffer is
     * empty.
     */
    protected Token<K> peekToken() {
        return queue.peekFirst();
    }

    /**
     * Whether the buffer is non-empty and its head is of the given kind.
     */
    protected boolean nextIs(K kind) {
        Token<K> tok = queue.peekFirst();
        return (tok != null && tok.is(kind));
    }

    protected Token<K> takeToken() {
        if (queue.isEmpty())
            throw new IllegalStateException("Token buffer is empty");
        return queue.removeFirst();
    }

    protected void addDiagnostic(String message, Token<K> token) {
        Diagnostic d = new Diagnostic(message, token);
        LOGGER.warning(d.toString());
        diagnostics.add(d);
    }

    /**
     * Non-fatal problems encountered during the most recent parse.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Prepare a fresh model; called at the start of every parse.
     */
    protected abstract void reset();

    protected abstract M getModel();

    /**
     * Called once the input is exhausted and all actions have run.
     */
    protected void finish() {}

    public M parse(Iterator<? extends Token<K>> tokens)
            throws GrammarException {
        queue.clear();
        diagnostics.clear();
        reset();
        int pending = 0;
        while (tokens.hasNext()) {
            Token<K> tok = tokens.next();
            if (isIgnored(tok.getKind())) continue;
            if (isActionable(tok.getKind())) pending++;
            queue.addLast(tok);
            if (pending > 1 && commit()) pending--;
        }
        while (pending > 0) {
            if (queue.isEmpty()) {
                LOGGER.warning("Token buffer exhausted with " + pending +
                               " action(s) pending");
                break;
            }
            if (commit()) {
                pending--;
            } else {
                addDiagnostic("Non-actionable token at end of input " +
                              "dropped", queue.removeFirst());
            }
        }
        if (! queue.isEmpty())
            LOGGER.fine(queue.size() + " trailing token(s) left unused");
        finish();
        return getModel();
    }
    public M parse(Iterable<? extends Token<K>> tokens)
            throws GrammarException {
        return parse(tokens.iterator());
    }

    /**
     * Parse, capturing a grammar error instead of throwing it.
     */
    public BuildResult<M> build(Iterable<? extends Token<K>> tokens) {
        try {
            M model = parse(tokens);
            return BuildResult.success(model,
                new ArrayList<Diagnostic>(diagnostics));
        } catch (GrammarException exc) {
            LOGGER.warning("Build aborted: " + exc.getMessage());
            return BuildResult.failure(exc,
                new ArrayList<Diagnostic>(diagnostics));
        }
    }

    private boolean commit() throws GrammarException {
        Token<K> head = queue.peekFirst();
        if (head == null) return false;
        Action act = actions.get(head.getKind());
        if (act == null) return false;
        act.apply();
        return true;
    }

}
