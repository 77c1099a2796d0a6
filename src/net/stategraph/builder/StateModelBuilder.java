package net.stategraph.builder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.logging.Logger;
import net.stategraph.model.Diagram;
import net.stategraph.model.NoSuchStateException;
import net.stategraph.model.State;
import net.stategraph.util.Util;
import net.stategraph.util.config.Configuration;

/**
 * Builds state diagrams from a token stream.
 * Superstates being declared are tracked on a scope stack; states and
 * transitions are declared in the scope on top of it.
 */
public class StateModelBuilder extends ModelBuilder<StateToken, Diagram> {

    /**
     * Configuration key for the start/end marker notation.
     */
    public static final String MARKER_KEY = "stategraph.marker";

    /**
     * Configuration key selecting whether closing a scope at the top level
     * is ignored (with a diagnostic) rather than an error.
     */
    public static final String LENIENT_SCOPE_CLOSE_KEY =
        "stategraph.builder.lenientScopeClose";

    private static final Logger LOGGER =
        Logger.getLogger("StateModelBuilder");

    private final String marker;
    private final boolean lenientScopeClose;
    // The null entry at the bottom stands for the top level.
    private final LinkedList<State> scopeStack;
    private Diagram diagram;

    public StateModelBuilder(Configuration config) {
        super(Arrays.asList(StateToken.TEXT, StateToken.ERROR));
        String m = config.get(MARKER_KEY);
        this.marker = (m == null) ? Diagram.DEFAULT_MARKER : m;
        this.lenientScopeClose = Util.isTrue(
            config.get(LENIENT_SCOPE_CLOSE_KEY));
        this.scopeStack = new LinkedList<State>();
        registerAction(StateToken.STATE, new Action() {
            public void apply() throws GrammarException {
                assignState();
            }
        });
        registerAction(StateToken.STATE_ALIAS, new Action() {
            public void apply() throws GrammarException {
                lookupState();
            }
        });
        registerAction(StateToken.SCOPE_CLOSE, new Action() {
            public void apply() throws GrammarException {
                endSuperstate();
            }
        });
        registerAction(StateToken.TRANSITION_SOURCE, new Action() {
            public void apply() throws GrammarException {
                assignTransition();
            }
        });
        reset();
    }
    public StateModelBuilder() {
        this(Configuration.DEFAULT);
    }

    public String getMarker() {
        return marker;
    }

    public boolean isLenientScopeClose() {
        return lenientScopeClose;
    }

    protected void reset() {
        diagram = new Diagram();
        diagram.setMarker(marker);
        scopeStack.clear();
        scopeStack.add(null);
    }

    protected Diagram getModel() {
        return diagram;
    }

    protected void finish() {
        for (String name : getOpenScopes()) {
            addDiagnostic("Superstate " + name + " not closed", null);
        }
    }

    /**
     * The names of the superstates whose bodies are currently open,
     * outermost first.
     */
    public List<String> getOpenScopes() {
        List<String> ret = new ArrayList<String>();
        for (State st : scopeStack) {
            if (st != null) ret.add(st.getName());
        }
        return ret;
    }

    /**
     * The superstate whose body is being declared, or null at the top
     * level.
     */
    protected State currentScope() {
        return scopeStack.getLast();
    }

    protected void assignState() throws GrammarException {
        Token<StateToken> tok = takeToken();
        String name = tok.getContent();
        State parent = currentScope();
        State st = diagram.addState(name, parent);
        if (nextIs(StateToken.SCOPE_OPEN)) {
            takeToken();
            scopeStack.addLast(st);
            LOGGER.finer("Entering superstate " + st);
        }
        if (nextIs(StateToken.STATE_ATTRIBUTE)) {
            Token<StateToken> attr = takeToken();
            Diagram scope = (parent == null) ? diagram :
                parent.getSubstates();
            try {
                scope.addStateAttribute(name, attr.getContent());
            } catch (NoSuchStateException exc) {
                throw new GrammarException(GrammarException.Kind.UNKNOWN_STATE,
                    attr, "Attribute " + attr + " refers to unknown state " +
                    Util.formatString(name), exc);
            }
        }
    }

    protected void lookupState() throws GrammarException {
        Token<StateToken> tok = peekToken();
        throw new GrammarException(GrammarException.Kind.ALIAS_UNSUPPORTED,
            tok, "State aliases are not supported (" + tok + ")");
    }

    protected void endSuperstate() throws GrammarException {
        Token<StateToken> tok = takeToken();
        if (scopeStack.size() <= 1) {
            if (lenientScopeClose) {
                addDiagnostic("Scope closed at top level; ignored", tok);
                return;
            }
            throw new GrammarException(GrammarException.Kind.STACK_UNDERFLOW,
                tok, "Scope closed at top level (" + tok + ")");
        }
        State closed = scopeStack.removeLast();
        LOGGER.finer("Leaving superstate " + closed);
    }

    protected void assignTransition() throws GrammarException {
        Token<StateToken> src = takeToken();
        if (! nextIs(StateToken.TRANSITION_DESTINATION))
            throw new GrammarException(
                GrammarException.Kind.MISSING_DESTINATION, src,
                "Transition source " + src + " found without " +
                "corresponding destination");
        Token<StateToken> dst = takeToken();
        List<String> attrs = null;
        if (nextIs(StateToken.TRANSITION_ATTRIBUTE))
            attrs = Collections.singletonList(takeToken().getContent());
        diagram.addTransition(src.getContent(), dst.getContent(),
                              currentScope(), attrs);
    }

}
