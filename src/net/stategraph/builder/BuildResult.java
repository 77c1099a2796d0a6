package net.stategraph.builder;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of a build: either a model or the error that aborted the
 * build, together with the diagnostics gathered until then.
 */
public class BuildResult<M> {

    private final M model;
    private final GrammarException error;
    private final List<Diagnostic> diagnostics;

    protected BuildResult(M model, GrammarException error,
                          List<Diagnostic> diagnostics) {
        this.model = model;
        this.error = error;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public boolean isSuccess() {
        return (error == null);
    }

    /**
     * The model built, or null if the build failed.
     */
    public M getModel() {
        return model;
    }

    public GrammarException getError() {
        return error;
    }

    public GrammarException.Kind getErrorKind() {
        return (error == null) ? null : error.getKind();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public static <M> BuildResult<M> success(M model,
            List<Diagnostic> diagnostics) {
        return new BuildResult<M>(model, null, diagnostics);
    }

    public static <M> BuildResult<M> failure(GrammarException error,
            List<Diagnostic> diagnostics) {
        if (error == null)
            throw new NullPointerException("Error may not be null");
        return new BuildResult<M>(null, error, diagnostics);
    }

}
