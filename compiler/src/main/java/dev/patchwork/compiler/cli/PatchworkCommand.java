package dev.patchwork.compiler.cli;

import ch.qos.logback.classic.Level;
import dev.patchwork.compiler.CompileException;
import dev.patchwork.compiler.CompileOutput;
import dev.patchwork.compiler.CompilerConfig;
import dev.patchwork.compiler.PatchworkCompiler;
import dev.patchwork.compiler.SourceFile;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * {@code patchworkc}: compiles one Patchwork file to {@code index.js}.
 */
@Command(name = "patchworkc", mixinStandardHelpOptions = true, version = "patchworkc 0.1.0",
         description = {"Compile a Patchwork source file to a JavaScript module.",
                 "The module imports its shell helpers from the configured runtimeModule; "
                         + "that file is not generated and must be supplied next to the output."})
public class PatchworkCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    static final String OUTPUT_FILE = "index.js";

    private static final Logger log = LoggerFactory.getLogger(PatchworkCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Patchwork source file")
    private Path source;

    @Option(names = {"-o", "--output"}, paramLabel = "DIR",
            description = "Directory to write " + OUTPUT_FILE + " into (default: print to stdout)")
    private Path outputDir;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE",
            description = "JSON compiler configuration overriding the built-in defaults")
    private Path configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log compiler progress to stderr")
    private boolean verbose = false;

    @Option(names = "--dump-tokens", description = "Print the token stream instead of compiling")
    private boolean dumpTokens = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PatchworkCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.patchwork")).setLevel(Level.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SourceFile file;
        CompilerConfig config;
        try {
            file = SourceFile.read(source);
            config = configFile != null ? CompilerConfig.load(configFile) : CompilerConfig.defaults();
        } catch (IOException e) {
            err.println("error: cannot read " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        log.debug("using {}", config);

        PatchworkCompiler compiler = new PatchworkCompiler(config);
        try {
            if (dumpTokens) {
                for (Token token : compiler.tokenize(file)) {
                    out.println(PatchworkCompiler.describe(token));
                }
                out.flush();
                return EXIT_OK;
            }
            CompileOutput output = compiler.compile(file);
            if (outputDir == null) {
                out.print(output.javascript());
                out.flush();
                return EXIT_OK;
            }
            Files.createDirectories(outputDir);
            Path target = outputDir.resolve(OUTPUT_FILE);
            Files.writeString(target, output.javascript(), StandardCharsets.UTF_8);
            log.info("wrote {} (imports runtime from {})", target, output.runtimeModule());
            Path runtime = localRuntime(output.runtimeModule());
            if (runtime != null && !Files.exists(runtime)) {
                log.warn("runtime module {} not found, supply it before running {}", runtime, target);
            }
            return EXIT_OK;
        } catch (CompileException e) {
            err.println("error: " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            err.println("error: cannot write output: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    /** File a relative runtime specifier resolves to from the output directory, or null for a package name. */
    Path localRuntime(String runtimeModule) {
        if (outputDir == null || !(runtimeModule.startsWith("./") || runtimeModule.startsWith("../"))) {
            return null;
        }
        return outputDir.resolve(runtimeModule).normalize();
    }
}
