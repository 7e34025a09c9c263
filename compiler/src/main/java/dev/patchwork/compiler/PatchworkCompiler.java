package dev.patchwork.compiler;

import dev.patchwork.antlr.PatchworkLexer;
import dev.patchwork.antlr.PatchworkParser;
import dev.patchwork.compiler.ast.Program;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the Patchwork-to-JavaScript compiler. Wires the generated ANTLR4
 * lexer and parser to {@link AstBuilder} and {@link JavaScriptGenerator}.
 * <p>
 * Every call builds fresh lexer, parser and generator instances, so one compiler may
 * be shared between threads.
 */
public final class PatchworkCompiler {

    private static final Logger log = LoggerFactory.getLogger(PatchworkCompiler.class);

    private final CompilerConfig config;

    public PatchworkCompiler() {
        this(CompilerConfig.defaults());
    }

    public PatchworkCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compiles one source file to an ES module.
     *
     * @throws CompileException on the first lex, parse or lowering error
     */
    public CompileOutput compile(SourceFile source) {
        Objects.requireNonNull(source, "source");
        log.debug("compiling {} ({} chars)", source.name(), source.text().length());
        try {
            Program program = parse(source);
            String javascript = new JavaScriptGenerator(source.name(), config).generate(program);
            log.debug("compiled {}: {} items, {} chars of JavaScript",
                    source.name(), program.items.size(), javascript.length());
            return new CompileOutput(source.name(), javascript, config.runtimeModule());
        } catch (CompileException e) {
            log.warn("compilation of {} failed: {}", source.name(), e.getMessage());
            throw e;
        }
    }

    /**
     * Parses a source file without generating code.
     */
    public Program parse(SourceFile source) {
        Objects.requireNonNull(source, "source");
        PatchworkLexer lexer = newLexer(source);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PatchworkParser parser = new PatchworkParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ThrowingErrorListener(source.name()));

        PatchworkParser.CompilationUnitContext tree = parser.compilationUnit();
        return new AstBuilder(source.name(), config).build(tree);
    }

    /**
     * Runs only the lexer. The returned list ends with the EOF token.
     */
    public List<Token> tokenize(SourceFile source) {
        Objects.requireNonNull(source, "source");
        CommonTokenStream tokens = new CommonTokenStream(newLexer(source));
        tokens.fill();
        return tokens.getTokens();
    }

    /**
     * One-line rendering of a token: {@code line:col TYPE 'text'}.
     */
    public static String describe(Token token) {
        String type = token.getType() == Token.EOF
                ? "EOF"
                : PatchworkLexer.VOCABULARY.getSymbolicName(token.getType());
        String text = token.getText() == null ? "" : token.getText()
                .replace("\\", "\\\\")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        return token.getLine() + ":" + (token.getCharPositionInLine() + 1) + " " + type + " '" + text + "'";
    }

    private static PatchworkLexer newLexer(SourceFile source) {
        CharStream input = CharStreams.fromString(source.text(), source.name());
        PatchworkLexer lexer = new PatchworkLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ThrowingErrorListener(source.name()));
        return lexer;
    }
}
