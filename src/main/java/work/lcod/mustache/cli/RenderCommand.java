package work.lcod.mustache.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import picocli.CommandLine;
import work.lcod.mustache.api.DocumentFormat;
import work.lcod.mustache.api.EscapeMode;
import work.lcod.mustache.api.LogLevel;
import work.lcod.mustache.api.MustacheRenderer;
import work.lcod.mustache.api.RenderConfiguration;
import work.lcod.mustache.api.RenderResult;
import work.lcod.mustache.shared.RenderLog;

@CommandLine.Command(
    name = "lcod-mustache",
    description = "Render a compiled mustache program against a JSON, YAML or TOML document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RenderCommand implements java.util.concurrent.Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-p", "--program"},
        required = true,
        description = "Compiled program file (YAML or JSON)."
    )
    private String programPath;

    @CommandLine.Option(
        names = {"-d", "--data"},
        paramLabel = "PATH|-|JSON",
        description = "Document file, '-' for stdin, or inline JSON (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String data;

    @CommandLine.Option(
        names = "--format",
        description = "Document format (json|yaml|toml); detected from the file extension when omitted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--no-escape",
        description = "Do not HTML-escape {{name}} tags."
    )
    private boolean noEscape;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--json",
        description = "Print a JSON result envelope instead of the rendered text."
    )
    private boolean json;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        Path program = Paths.get(programPath).toAbsolutePath().normalize();
        if (!Files.exists(program)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Program file not found: " + program);
        }

        RenderConfiguration configuration = RenderConfiguration.builder()
            .programPath(program)
            .documentPayload(loadDocumentPayload())
            .documentFormat(resolveFormat(logLevel))
            .escapeMode(noEscape ? EscapeMode.NONE : EscapeMode.HTML)
            .logLevel(logLevel)
            .build();

        RenderResult result = MustacheRenderer.run(configuration);
        var out = spec.commandLine().getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else {
            out.print(result.output());
            if (!result.isSuccess()) {
                var err = spec.commandLine().getErr();
                err.println(spec.commandLine().getColorScheme().errorText(describeFailure(result)));
            }
        }
        out.flush();
        return result.status().exitCode();
    }

    private static String describeFailure(RenderResult result) {
        Object code = result.metadata().get("code");
        Object error = result.metadata().get("error");
        return (code == null ? "error" : code) + ": " + (error == null ? "render failed" : error);
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private DocumentFormat resolveFormat(LogLevel logLevel) {
        if (formatRaw != null) {
            try {
                return DocumentFormat.from(formatRaw);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
        }
        if (data == null || "-".equals(data) || isInlineJson(data)) {
            return DocumentFormat.JSON;
        }
        DocumentFormat detected = DocumentFormat.detect(Paths.get(data));
        RenderLog.stderr(logLevel).log(LogLevel.DEBUG, "document format %s detected for %s", detected, data);
        return detected;
    }

    private String loadDocumentPayload() {
        if (data == null || data.isBlank()) {
            return "{}";
        }
        if ("-".equals(data)) {
            return readStdin();
        }
        if (isInlineJson(data)) {
            return data.trim();
        }
        Path path = Paths.get(data).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read document file: " + path);
        }
    }

    private static boolean isInlineJson(String value) {
        String trimmed = value.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    private String readStdin() {
        try {
            InputStream stdin = System.in;
            byte[] bytes = stdin.readAllBytes();
            if (bytes.length == 0) {
                RenderLog.stderr(resolveLogLevel()).warn("stdin was empty, rendering against {}");
                return "{}";
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
