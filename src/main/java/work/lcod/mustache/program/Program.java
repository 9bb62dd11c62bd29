package work.lcod.mustache.program;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable instruction tree produced by a template compiler (or loaded from its serialized form).
 */
public record Program(String name, List<Instruction> instructions) {
    public Program {
        name = name == null || name.isBlank() ? "anonymous" : name;
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }

    /**
     * Total length of literal text, used to pre-size output buffers.
     */
    public int literalLength() {
        return literalLength(instructions);
    }

    private static int literalLength(List<Instruction> items) {
        int total = 0;
        for (var item : items) {
            if (item instanceof Instruction.Text text) {
                total += text.text().length();
            } else if (item instanceof Instruction.Section section) {
                total += literalLength(section.body());
            }
        }
        return total;
    }

    public static Builder builder() {
        return new Builder("anonymous");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<Instruction> instructions = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder text(String text) {
            instructions.add(new Instruction.Text(text));
            return this;
        }

        /** Escaped interpolation ({@code {{name}}}). */
        public Builder arg(String name) {
            return arg(name, true);
        }

        /** Unescaped interpolation ({@code {{& name}}}). */
        public Builder raw(String name) {
            return arg(name, false);
        }

        public Builder arg(String name, boolean escape) {
            instructions.add(new Instruction.Arg(name, escape));
            return this;
        }

        public Builder section(String name, Consumer<Builder> body) {
            return section(name, false, false, body);
        }

        public Builder inverted(String name, Consumer<Builder> body) {
            return section(name, true, false, body);
        }

        public Builder section(String name, boolean inverted, boolean callable, Consumer<Builder> body) {
            Objects.requireNonNull(body, "body");
            var nested = new Builder(name);
            body.accept(nested);
            instructions.add(new Instruction.Section(name, inverted, callable, nested.instructions));
            return this;
        }

        public Builder add(Instruction instruction) {
            instructions.add(Objects.requireNonNull(instruction, "instruction"));
            return this;
        }

        public Program build() {
            return new Program(name, instructions);
        }
    }
}
