package dev.patchwork.compiler.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PatchworkCommandTest {

    private static final String WORKER = """
            worker hello() {
                $ echo hello
            }
            """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new PatchworkCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        commandLine.getOut().flush();
        commandLine.getErr().flush();
        return exitCode;
    }

    private Path source(String text) throws IOException {
        Path file = tempDir.resolve("main.pw");
        Files.writeString(file, text);
        return file;
    }

    @Test
    void compile_writesIndexJs() throws IOException {
        Path file = source(WORKER);
        Path outDir = tempDir.resolve("out");

        int exitCode = run(file.toString(), "-o", outDir.toString());

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_OK);
        String js = Files.readString(outDir.resolve(PatchworkCommand.OUTPUT_FILE));
        assertThat(js).contains("export async function hello(session) {\n  await $shell(`echo hello`);\n}\n");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void compile_withoutOutputDir_printsModule() throws IOException {
        int exitCode = run(source(WORKER).toString());

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_OK);
        assertThat(out.toString()).startsWith("import { $shell,").contains("export async function hello(session)");
    }

    @Test
    void compileError_exitsOneAndReportsLocation() throws IOException {
        Path file = source("worker w() {\n  var r = 1...3\n}\n");
        Path outDir = tempDir.resolve("out");

        int exitCode = run(file.toString(), "-o", outDir.toString());

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_COMPILE_ERROR);
        assertThat(err.toString()).contains("main.pw:2:11: [UNSUPPORTED_FEATURE]");
        assertThat(outDir.resolve(PatchworkCommand.OUTPUT_FILE)).doesNotExist();
    }

    @Test
    void syntaxError_exitsOne() throws IOException {
        int exitCode = run(source("worker w( {\n}\n").toString());

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_COMPILE_ERROR);
        assertThat(err.toString()).contains("[PARSE]");
    }

    @Test
    void missingSource_exitsTwo() {
        int exitCode = run(tempDir.resolve("absent.pw").toString());

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_IO_ERROR);
        assertThat(err.toString()).startsWith("error: cannot read");
    }

    @Test
    void invalidConfig_exitsTwo() throws IOException {
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, "{\"workerKeywords\": []}");

        int exitCode = run(source(WORKER).toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("invalid configuration");
    }

    @Test
    void config_changesRuntimeModule() throws IOException {
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, "{\"runtimeModule\": \"./lib/runtime.js\"}");

        int exitCode = run(source(WORKER).toString(), "--config", config.toString());

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_OK);
        assertThat(out.toString()).contains("from './lib/runtime.js';");
    }

    @Test
    void dumpTokens_printsTokenStream() throws IOException {
        int exitCode = run(source(WORKER).toString(), "--dump-tokens");

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_OK);
        assertThat(out.toString())
                .contains("1:1 WORKER 'worker'")
                .contains("2:5 SHELL_START '$ '")
                .contains("EOF");
    }

    @Test
    void help_saysRuntimeMustBeSupplied() {
        int exitCode = run("--help");

        assertThat(exitCode).isEqualTo(PatchworkCommand.EXIT_OK);
        assertThat(out.toString().replaceAll("\\s+", " ")).contains("must be supplied next to the output");
    }

    @Test
    void localRuntime_resolvesRelativeSpecifiersAgainstOutputDir() {
        PatchworkCommand command = new PatchworkCommand();
        Path outDir = tempDir.resolve("out");
        new CommandLine(command).parseArgs("main.pw", "-o", outDir.toString());

        assertThat(command.localRuntime("./patchwork-runtime.js")).isEqualTo(outDir.resolve("patchwork-runtime.js"));
        assertThat(command.localRuntime("../lib/rt.js")).isEqualTo(tempDir.resolve("lib/rt.js"));
        assertThat(command.localRuntime("@patchwork/runtime")).isNull();
    }

    @Test
    void localRuntime_withoutOutputDir_isNull() {
        PatchworkCommand command = new PatchworkCommand();
        new CommandLine(command).parseArgs("main.pw");

        assertThat(command.localRuntime("./patchwork-runtime.js")).isNull();
    }

    @Test
    void missingArgument_isUsageError() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Missing required parameter");
    }
}
