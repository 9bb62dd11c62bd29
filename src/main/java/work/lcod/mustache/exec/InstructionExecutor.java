package work.lcod.mustache.exec;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.mustache.api.LogLevel;
import work.lcod.mustache.program.Instruction;
import work.lcod.mustache.program.Program;
import work.lcod.mustache.render.RenderCallbacks;
import work.lcod.mustache.render.RenderException;
import work.lcod.mustache.scope.ScopeStack;
import work.lcod.mustache.shared.RenderLog;

/**
 * Walks a compiled program, maintaining the scope stack and delegating every decision to
 * {@link RenderCallbacks}.
 *
 * <p>A section asks for its repetition count, then for each repetition obtains the child context and
 * renders its body in a new frame. An inverted section renders its body once, in the current frame,
 * when the count is zero. The first failure invokes {@link RenderCallbacks#onError(Object)} and aborts
 * the render; output already emitted is left in place.
 */
public final class InstructionExecutor {
    private final RenderCallbacks callbacks;
    private final RenderLog log;

    public InstructionExecutor(RenderCallbacks callbacks) {
        this(callbacks, RenderLog.silent());
    }

    public InstructionExecutor(RenderCallbacks callbacks, RenderLog log) {
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.log = log == null ? RenderLog.silent() : log;
    }

    public void execute(Program program, Object document) {
        Objects.requireNonNull(program, "program");
        var scopes = new ScopeStack(document);
        try {
            run(program.instructions(), scopes);
        } catch (RenderException ex) {
            log.error("render of %s aborted: %s", program.name(), ex.getMessage());
            notifyError(document, ex);
            throw ex;
        } catch (RuntimeException ex) {
            var wrapped = new RenderException(
                RenderException.UNEXPECTED_ERROR,
                ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(),
                null,
                ex
            );
            log.error("render of %s failed: %s", program.name(), wrapped.getMessage());
            notifyError(document, wrapped);
            throw wrapped;
        }
    }

    private void run(List<Instruction> instructions, ScopeStack scopes) {
        for (var instruction : instructions) {
            if (instruction instanceof Instruction.Text text) {
                callbacks.onText(scopes.top(), text.text());
            } else if (instruction instanceof Instruction.Arg arg) {
                callbacks.onArg(scopes.top(), arg.name(), arg.escape());
            } else if (instruction instanceof Instruction.Section section) {
                runSection(section, scopes);
            } else {
                throw new RenderException(
                    RenderException.INVALID_PROGRAM,
                    "Unsupported instruction: " + instruction,
                    null
                );
            }
        }
    }

    private void runSection(Instruction.Section section, ScopeStack scopes) {
        var frame = scopes.top();
        int count = callbacks.onSectionTest(frame, section.name(), section.callable());
        if (count < 0) {
            throw RenderException.structural(
                "Section '" + section.name() + "' could not be evaluated",
                Map.of("name", section.name(), "depth", frame.depth())
            );
        }
        if (section.inverted()) {
            if (count == 0) {
                run(section.body(), scopes);
            }
            return;
        }
        for (int index = 0; index < count; index++) {
            var child = callbacks.onSectionStart(frame, section.name(), index);
            if (log.isEnabled(LogLevel.TRACE)) {
                log.trace("enter %s [%d/%d] at depth %d", section.name(), index + 1, count, frame.depth() + 1);
            }
            scopes.push(child);
            try {
                run(section.body(), scopes);
            } finally {
                scopes.pop();
            }
        }
    }

    private void notifyError(Object document, RenderException failure) {
        try {
            callbacks.onError(document);
        } catch (RuntimeException hookFailure) {
            failure.addSuppressed(hookFailure);
        }
    }
}
