package work.lcod.mustache.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.mustache.support.MustacheTestSupport.map;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.mustache.api.LogLevel;
import work.lcod.mustache.escape.HtmlEscaper;
import work.lcod.mustache.program.Program;
import work.lcod.mustache.render.BindingCallbacks;
import work.lcod.mustache.render.RenderCallbacks;
import work.lcod.mustache.render.RenderException;
import work.lcod.mustache.scope.ScopeFrame;
import work.lcod.mustache.shared.RenderLog;
import work.lcod.mustache.support.MustacheTestSupport;

class InstructionExecutorTest {
    @Test
    void rendersUsersFixture() {
        var sink = new StringBuilder();
        new InstructionExecutor(new BindingCallbacks(sink, HtmlEscaper.INSTANCE))
            .execute(MustacheTestSupport.usersProgram(), MustacheTestSupport.usersDocument(4));

        assertEquals(MustacheTestSupport.USERS_OUTPUT, sink.toString());
        assertEquals(135, sink.length());
    }

    @Test
    void invertedSectionRendersOnlyWhenCountIsZero() {
        var program = Program.builder()
            .inverted("items", body -> body.text("none"))
            .section("items", body -> body.raw("label"))
            .inverted("flag", body -> body.text("!"))
            .build();

        assertEquals("none!", render(program, map("items", List.of(), "flag", false)));
        assertEquals("ab", render(program, map("items", List.of(map("label", "a"), map("label", "b")), "flag", true)));
    }

    @Test
    void invertedSectionKeepsCurrentFrame() {
        var program = Program.builder()
            .inverted("missing", body -> body.raw("title"))
            .build();

        assertEquals("root title", render(program, map("title", "root title")));
    }

    @Test
    void nestedSectionsSeeAncestorValues() {
        var program = Program.builder()
            .section("groups", group -> group
                .raw("label")
                .text(":")
                .section("members", member -> member.raw("name").raw("suffix").text(";")))
            .build();
        var document = map(
            "suffix", "!",
            "groups", List.of(
                map("label", "g1", "members", List.of(map("name", "x"), map("name", "y", "suffix", "?"))),
                map("label", "g2", "members", List.of())
            )
        );

        assertEquals("g1:x!;y?;g2:", render(program, document));
    }

    @Test
    void scalarSectionPushesValueItself() {
        var program = Program.builder()
            .section("person", person -> person.raw("name").text(" in ").raw("city"))
            .section("enabled", on -> on.text(" [on]"))
            .build();

        assertEquals("Ada in London [on]", render(program, map("city", "London", "person", map("name", "Ada"), "enabled", true)));
    }

    @Test
    void framesArePushedAndPoppedPerRepetition() {
        var depths = new ArrayList<Integer>();
        var recorder = new RecordingCallbacks(depths);
        var program = Program.builder()
            .section("rows", row -> row.arg("x"))
            .arg("x")
            .build();

        new InstructionExecutor(recorder).execute(program, map("rows", List.of(1, 2)));

        assertEquals(List.of(1, 1, 0), depths);
    }

    @Test
    void negativeCountAbortsAndNotifiesOnce() {
        var recorder = new RecordingCallbacks(new ArrayList<>());
        recorder.forcedCount = -1;
        var program = Program.builder().text("before").section("any", body -> body.text("never")).text("after").build();

        var error = assertThrows(RenderException.class, () -> new InstructionExecutor(recorder).execute(program, "doc"));

        assertEquals(RenderException.STRUCTURAL_ERROR, error.code());
        assertEquals(List.of("doc"), recorder.errors);
        assertEquals("before", recorder.out.toString());
    }

    @Test
    void failedEnterLeavesPartialOutput() {
        var sink = new StringBuilder();
        var binding = new BindingCallbacks(sink, null);
        var program = Program.builder().text("head|").section("gone", body -> body.text("x")).build();
        var callbacks = new ForwardingCallbacks(binding) {
            @Override
            public int onSectionTest(ScopeFrame frame, String name, boolean callable) {
                return 1;
            }
        };

        var error = assertThrows(RenderException.class, () -> new InstructionExecutor(callbacks).execute(program, map()));

        assertEquals(RenderException.STRUCTURAL_ERROR, error.code());
        assertEquals("head|", sink.toString());
        assertSame(sink, binding.sink());
    }

    @Test
    void unexpectedFailuresAreWrappedAndLogged() {
        var bytes = new ByteArrayOutputStream();
        var log = new RenderLog(LogLevel.ERROR, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        var program = Program.builder("broken").raw("value").build();

        var error = assertThrows(
            RenderException.class,
            () -> new InstructionExecutor(new BindingCallbacks(new StringBuilder(), null), log)
                .execute(program, map("value", new Object()))
        );

        assertEquals(RenderException.UNEXPECTED_ERROR, error.code());
        assertEquals(IllegalArgumentException.class, error.getCause().getClass());
        assertEquals(true, bytes.toString(StandardCharsets.UTF_8).contains("render of broken failed"));
    }

    @Test
    void repetitionsAreTracedOnlyAtTraceLevel() {
        var program = Program.builder().section("items", body -> body.raw("label")).build();
        var document = map("items", List.of(map("label", "a"), map("label", "b")));

        var quiet = new ByteArrayOutputStream();
        new InstructionExecutor(
            new BindingCallbacks(new StringBuilder(), null),
            new RenderLog(LogLevel.DEBUG, new PrintStream(quiet, true, StandardCharsets.UTF_8))
        ).execute(program, document);

        var traced = new ByteArrayOutputStream();
        new InstructionExecutor(
            new BindingCallbacks(new StringBuilder(), null),
            new RenderLog(LogLevel.TRACE, new PrintStream(traced, true, StandardCharsets.UTF_8))
        ).execute(program, document);

        assertEquals("", quiet.toString(StandardCharsets.UTF_8));
        var lines = traced.toString(StandardCharsets.UTF_8);
        assertEquals(true, lines.contains("[trace] enter items [1/2] at depth 1"));
        assertEquals(true, lines.contains("[trace] enter items [2/2] at depth 1"));
    }

    @Test
    void errorHookFailureIsAttachedNotThrown() {
        var program = Program.builder().section("s", body -> body.text("x")).build();
        var callbacks = new ForwardingCallbacks(new BindingCallbacks(new StringBuilder(), null)) {
            @Override
            public int onSectionTest(ScopeFrame frame, String name, boolean callable) {
                return -1;
            }

            @Override
            public void onError(Object context) {
                throw new IllegalStateException("hook");
            }
        };

        var error = assertThrows(RenderException.class, () -> new InstructionExecutor(callbacks).execute(program, map()));

        assertEquals(1, error.getSuppressed().length);
    }

    private static String render(Program program, Object document) {
        var sink = new StringBuilder();
        new InstructionExecutor(new BindingCallbacks(sink, HtmlEscaper.INSTANCE)).execute(program, document);
        return sink.toString();
    }

    private static final class RecordingCallbacks extends ForwardingCallbacks {
        private final List<Integer> argDepths;
        private final List<Object> errors = new ArrayList<>();
        private final StringBuilder out;
        private Integer forcedCount;

        RecordingCallbacks(List<Integer> argDepths) {
            this(argDepths, new StringBuilder());
        }

        private RecordingCallbacks(List<Integer> argDepths, StringBuilder out) {
            super(new BindingCallbacks(out, null));
            this.argDepths = argDepths;
            this.out = out;
        }

        @Override
        public void onArg(ScopeFrame frame, String name, boolean escape) {
            argDepths.add(frame.depth());
            super.onArg(frame, name, escape);
        }

        @Override
        public int onSectionTest(ScopeFrame frame, String name, boolean callable) {
            return forcedCount != null ? forcedCount : super.onSectionTest(frame, name, callable);
        }

        @Override
        public void onError(Object context) {
            errors.add(context);
        }
    }

    private static class ForwardingCallbacks implements RenderCallbacks {
        private final RenderCallbacks delegate;

        ForwardingCallbacks(RenderCallbacks delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onText(ScopeFrame frame, String text) {
            delegate.onText(frame, text);
        }

        @Override
        public void onArg(ScopeFrame frame, String name, boolean escape) {
            delegate.onArg(frame, name, escape);
        }

        @Override
        public int onSectionTest(ScopeFrame frame, String name, boolean callable) {
            return delegate.onSectionTest(frame, name, callable);
        }

        @Override
        public Object onSectionStart(ScopeFrame frame, String name, int index) {
            return delegate.onSectionStart(frame, name, index);
        }

        @Override
        public void onError(Object context) {
            delegate.onError(context);
        }
    }
}
