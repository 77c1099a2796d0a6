package net.stategraph.builder;

import java.util.logging.Logger;
import net.stategraph.model.Diagram;
import net.stategraph.util.config.Configuration;

public final class StateDiagrams {

    private static final Logger LOGGER = Logger.getLogger("StateDiagrams");

    private StateDiagrams() {}

    public static Diagram build(Iterable<? extends Token<StateToken>> tokens,
            Configuration config) throws GrammarException {
        StateModelBuilder builder = new StateModelBuilder(config);
        Diagram ret = builder.parse(tokens);
        LOGGER.info("Parsed " + ret.getAllStates().size() + " states");
        LOGGER.info("Parsed " + ret.getAllTransitions().size() +
                    " transitions");
        if (! builder.getDiagnostics().isEmpty())
            LOGGER.info(builder.getDiagnostics().size() +
                        " diagnostic(s) while parsing");
        return ret;
    }
    public static Diagram build(Iterable<? extends Token<StateToken>> tokens)
            throws GrammarException {
        return build(tokens, Configuration.DEFAULT);
    }

}
