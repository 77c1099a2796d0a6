package net.stategraph.builder;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Unit tests for the dispatching rules of ModelBuilder.
 */
public class ModelBuilderTest {

    enum Kind { NOISE, OPEN, CLOSE, EXTRA }

    /* Records every action as "content[consumed lookahead]". */
    static class RecordingBuilder extends ModelBuilder<Kind, List<String>> {

        private List<String> log;

        RecordingBuilder() {
            super(Arrays.asList(Kind.NOISE));
            registerAction(Kind.OPEN, new Action() {
                public void apply() throws GrammarException {
                    record();
                }
            });
            registerAction(Kind.CLOSE, new Action() {
                public void apply() throws GrammarException {
                    Token<Kind> tok = peekToken();
                    if (tok.getContent().equals("bad"))
                        throw new GrammarException(
                            GrammarException.Kind.UNKNOWN_STATE, tok,
                            "bad token");
                    record();
                }
            });
        }

        private void record() {
            StringBuilder sb = new StringBuilder(takeToken().getContent());
            List<String> extra = new ArrayList<String>();
            while (nextIs(Kind.EXTRA)) extra.add(takeToken().getContent());
            if (! extra.isEmpty()) sb.append(extra);
            log.add(sb.toString());
        }

        protected void reset() {
            log = new ArrayList<String>();
        }

        protected List<String> getModel() {
            return log;
        }

    }

    /* Counts how many tokens have been pulled. */
    static class CountingIterator implements Iterator<Token<Kind>> {

        private final Iterator<Token<Kind>> base;
        private int pulled;

        CountingIterator(List<Token<Kind>> tokens) {
            base = tokens.iterator();
        }

        public boolean hasNext() {
            return base.hasNext();
        }

        public Token<Kind> next() {
            pulled++;
            return base.next();
        }

        public void remove() {
            throw new UnsupportedOperationException();
        }

        int getPulled() {
            return pulled;
        }

    }

    private RecordingBuilder builder;

    @Before
    public void setUp() {
        builder = new RecordingBuilder();
    }

    private static Token<Kind> tok(Kind kind, String content) {
        return new Token<Kind>(kind, content);
    }

    @Test
    public void testActionable() {
        assertTrue(builder.isActionable(Kind.OPEN));
        assertTrue(builder.isActionable(Kind.CLOSE));
        assertFalse(builder.isActionable(Kind.EXTRA));
        assertTrue(builder.isIgnored(Kind.NOISE));
    }

    @Test
    public void testLookaheadConsumed() throws Exception {
        List<String> log = builder.parse(Arrays.asList(
            tok(Kind.OPEN, "a"), tok(Kind.EXTRA, "x"),
            tok(Kind.NOISE, " "), tok(Kind.EXTRA, "y"),
            tok(Kind.CLOSE, "b"), tok(Kind.EXTRA, "z")));

        assertEquals(Arrays.asList("a[x, y]", "b[z]"), log);
        assertEquals(0, builder.getBufferedCount());
    }

    @Test
    public void testActionWaitsForSecondActionable() throws Exception {
        CountingIterator it = new CountingIterator(Arrays.asList(
            tok(Kind.OPEN, "a"), tok(Kind.EXTRA, "x"),
            tok(Kind.OPEN, "b")));
        List<String> log = builder.parse(it);

        assertEquals(Arrays.asList("a[x]", "b"), log);
        assertEquals(3, it.getPulled());
    }

    @Test
    public void testStalledHeadDroppedAtEnd() throws Exception {
        List<String> log = builder.parse(Arrays.asList(
            tok(Kind.EXTRA, "stray"), tok(Kind.OPEN, "a"),
            tok(Kind.CLOSE, "b"), tok(Kind.OPEN, "c")));

        assertEquals(Arrays.asList("a", "b", "c"), log);
        assertEquals(1, builder.getDiagnostics().size());
        assertEquals("stray",
            builder.getDiagnostics().get(0).getToken().getContent());
    }

    @Test
    public void testErrorAbortsStream() {
        CountingIterator it = new CountingIterator(Arrays.asList(
            tok(Kind.CLOSE, "bad"), tok(Kind.OPEN, "a"),
            tok(Kind.OPEN, "b"), tok(Kind.OPEN, "c")));
        try {
            builder.parse(it);
            fail("Expected GrammarException");
        } catch (GrammarException exc) {
            assertEquals(GrammarException.Kind.UNKNOWN_STATE, exc.getKind());
            assertNull(exc.getPosition());
        }
        assertEquals(2, it.getPulled());
    }

    @Test
    public void testBuildResult() {
        BuildResult<List<String>> ok = builder.build(Arrays.asList(
            tok(Kind.OPEN, "a")));
        assertTrue(ok.isSuccess());
        assertEquals(Arrays.asList("a"), ok.getModel());
        assertNull(ok.getErrorKind());

        BuildResult<List<String>> bad = builder.build(Arrays.asList(
            tok(Kind.CLOSE, "bad")));
        assertFalse(bad.isSuccess());
        assertNull(bad.getModel());
        assertNotNull(bad.getError());
    }

    @Test
    public void testEmptyInput() throws Exception {
        List<String> log = builder.parse(new ArrayList<Token<Kind>>());
        assertTrue(log.isEmpty());
        assertTrue(builder.getDiagnostics().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testActionForIgnoredKind() {
        builder.registerAction(Kind.NOISE, new ModelBuilder.Action() {
            public void apply() {}
        });
    }

}
