package work.lcod.mustache.program;

import java.util.List;
import java.util.Objects;

/**
 * A compiled template instruction. Sections own their body, so a program is a tree.
 */
public interface Instruction {

    record Text(String text) implements Instruction {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    record Arg(String name, boolean escape) implements Instruction {
        public Arg {
            Objects.requireNonNull(name, "name");
        }
    }

    record Section(String name, boolean inverted, boolean callable, List<Instruction> body) implements Instruction {
        public Section {
            Objects.requireNonNull(name, "name");
            body = body == null ? List.of() : List.copyOf(body);
        }
    }
}
