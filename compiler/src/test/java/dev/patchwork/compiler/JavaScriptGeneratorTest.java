package dev.patchwork.compiler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end lowering tests: Patchwork source in, ES module text out.
 */
class JavaScriptGeneratorTest {

    private static final String HEADER =
            "import { $shell, $shellPipe, $shellAnd, $shellOr, $shellRedirect, SessionContext } "
                    + "from './patchwork-runtime.js';\n\n";

    private final PatchworkCompiler compiler = new PatchworkCompiler();

    private String compile(String source) {
        return compile(compiler, source);
    }

    private static String compile(PatchworkCompiler compiler, String source) {
        return compiler.compile(SourceFile.of("test.pw", source)).javascript();
    }

    /** Compiles {@code body} as the body of worker {@code w}, statements starting on line 2. */
    private String worker(String body) {
        return compile("worker w() {\n" + body + "\n}\n");
    }

    // ------------------------------------------------------------------
    // module layout
    // ------------------------------------------------------------------

    @Test
    void simpleWorker_fullOutput() {
        String js = compile("""
                worker example() {
                    var x = 5
                    return x
                }
                """);
        assertThat(js).isEqualTo(HEADER
                + "export async function example(session) {\n"
                + "  let x = 5;\n"
                + "  return x;\n"
                + "}\n"
                + "\n");
    }

    @Test
    void emptyProgram_isHeaderOnly() {
        assertThat(compile("")).isEqualTo(HEADER);
    }

    @Test
    void workerParams_followSession() {
        assertThat(compile("task sync(repo, branch) {\n}\n"))
                .contains("export async function sync(session, repo, branch) {\n}\n");
    }

    @Test
    void functions_exportOnlyWhenDeclared() {
        String js = compile("""
                fun helper(x) {
                    return x * 2
                }
                export fun shared() {
                    return helper(1)
                }
                """);
        assertThat(js).contains("\nasync function helper(x) {\n  return x * 2;\n}\n");
        assertThat(js).contains("export async function shared() {\n  return helper(1);\n}\n");
    }

    @Test
    void emptyFunction() {
        assertThat(compile("fun f(x) {}")).isEqualTo(HEADER + "async function f(x) {\n}\n\n");
        assertThat(compile("export fun f(x) {}")).isEqualTo(HEADER + "export async function f(x) {\n}\n\n");
    }

    @Test
    void declarationsWithoutRuntimeCode_emitNothing() {
        String js = compile("""
                import std.log
                skill summarize(text) {
                    return text
                }
                type Status = "ok" | "failed"
                trait Helper {
                    fun run(x) { return x }
                }
                """);
        assertThat(js).isEqualTo(HEADER);
    }

    @Test
    void customRuntimeModule_appearsInHeader() {
        PatchworkCompiler custom = new PatchworkCompiler(
                CompilerConfig.builder().runtimeModule("@patchwork/runtime").build());
        assertThat(compile(custom, "worker w() {\n}\n"))
                .startsWith("import { $shell, $shellPipe, $shellAnd, $shellOr, $shellRedirect, SessionContext } "
                        + "from '@patchwork/runtime';\n\n");
    }

    @Test
    void output_isDeterministic() {
        String source = """
                worker w(items) {
                    for item in items {
                        $ echo "item ${item}"
                    }
                }
                """;
        assertThat(compile(new PatchworkCompiler(), source)).isEqualTo(compile(new PatchworkCompiler(), source));
    }

    // ------------------------------------------------------------------
    // statements
    // ------------------------------------------------------------------

    @Test
    void variables() {
        String js = worker("""
                var a
                var b: int = 1
                var _ = run()""");
        assertThat(js).contains("  let a;\n  let b = 1;\n  run();\n");
    }

    @Test
    void elseIf_nestsInsideElse() {
        String js = worker("""
                if x > 1 {
                    return 1
                } else if x < 0 {
                    return 2
                } else {
                    return 3
                }""");
        assertThat(js).contains("""
                  if (x > 1) {
                    return 1;
                  } else {
                    if (x < 0) {
                      return 2;
                    } else {
                      return 3;
                    }
                  }
                """);
    }

    @Test
    void loops() {
        String js = worker("""
                var i = 0
                while i < 3 {
                    i++
                }
                for item in items {
                    if item == "stop" {
                        break
                    }
                    process(item)
                }""");
        assertThat(js).contains("""
                  while (i < 3) {
                    i++;
                  }
                  for (let item of items) {
                    if (item === "stop") {
                      break;
                    }
                    process(item);
                  }
                """);
    }

    @Test
    void returnWithoutValue_andSucceed() {
        assertThat(worker("succeed\nreturn")).contains("  // succeed\n  return;\n");
    }

    @Test
    void nestedTypeDeclaration_emitsNothing() {
        assertThat(worker("type Id = string\nreturn 1")).contains("(session) {\n  return 1;\n}");
    }

    // ------------------------------------------------------------------
    // expressions
    // ------------------------------------------------------------------

    @Test
    void operators() {
        String js = worker("""
                var a = x == y
                var b = x != y && !done || -n > 0
                total = total + (price - discount) / 2""");
        assertThat(js).contains("  let a = x === y;\n");
        assertThat(js).contains("  let b = x !== y && !done || -n > 0;\n");
        assertThat(js).contains("  total = total + (price - discount) / 2;\n");
    }

    @Test
    void collectionsAndAccess() {
        String js = worker("""
                var o = {x, y: 2}
                var e = {}
                var l = [1, "two", true]
                var v = o.items[0].run(false)
                count--""");
        assertThat(js).contains("  let o = { x, y: 2 };\n");
        assertThat(js).contains("  let e = {};\n");
        assertThat(js).contains("  let l = [1, \"two\", true];\n");
        assertThat(js).contains("  let v = o.items[0].run(false);\n");
        assertThat(js).contains("  count--;\n");
    }

    @Test
    void nestedNegation_keepsOperatorsApart() {
        String js = worker("""
                var y = - -x
                var z = - -1
                var w = -(-x)""");
        assertThat(js).contains("  let y = - -x;\n");
        assertThat(js).contains("  let z = - -1;\n");
        assertThat(js).contains("  let w = -(-x);\n");
    }

    @Test
    void accessOnAwaitedValue_isParenthesized() {
        String js = worker("""
                var n = $(ls).trim()
                var first = $(ls | head -1)[0]
                var body = (await fetch(url)).text
                var ok = await fetch(url).ok""");
        assertThat(js).contains("  let n = (await $shell(`ls`, {capture: true})).trim();\n");
        assertThat(js).contains("  let first = (await $shellPipe([`ls`, `head -1`], {capture: true}))[0];\n");
        assertThat(js).contains("  let body = (await fetch(url)).text;\n");
        assertThat(js).contains("  let ok = await fetch(url).ok;\n");
    }

    @Test
    void awaitAndThrow() {
        String js = worker("""
                var r = await fetch(url)
                throw "failed: ${r}\"""");
        assertThat(js).contains("  let r = await fetch(url);\n");
        assertThat(js).contains("  throw new Error(String(`failed: ${r}`));\n");
    }

    @Test
    void strings_plainUseDoubleQuotesAndInterpolationUsesTemplates() {
        String js = worker("""
                var a = "hello"
                var b = "Hello, ${name}!"
                var c = \"\"""");
        assertThat(js).contains("  let a = \"hello\";\n");
        assertThat(js).contains("  let b = `Hello, ${name}!`;\n");
        assertThat(js).contains("  let c = \"\";\n");
    }

    @Test
    void strings_escapedForTheirJavaScriptForm() {
        String js = worker("""
                var q = "say \\"hi\\"\\n\\\\"
                var t = "a`b \\${x} ${n}\"""");
        assertThat(js).contains("  let q = \"say \\\"hi\\\"\\n\\\\\";\n");
        assertThat(js).contains("  let t = `a\\`b \\${x} ${n}`;\n");
    }

    @Test
    void escapeHelpers() {
        assertThat(JavaScriptGenerator.escapeString("a\"b\\c\td\r\n")).isEqualTo("a\\\"b\\\\c\\td\\r\\n");
        assertThat(JavaScriptGenerator.escapeTemplate("`x` ${y} \\ $z")).isEqualTo("\\`x\\` \\${y} \\\\ $z");
        assertThat(JavaScriptGenerator.escapeTemplate("a\rb")).isEqualTo("a\\rb");
    }

    @Test
    void carriageReturn_inTemplateStaysEscaped() {
        assertThat(worker("var s = \"a\\rb${x}\""))
                .contains("  let s = `a\\rb${x}`;\n");
    }

    @Test
    void escapedString_decodesBackToSourceText() {
        String text = "tab\there \"quoted\" back\\slash\nnext";
        assertThat(decodeDoubleQuoted(JavaScriptGenerator.escapeString(text))).isEqualTo(text);
    }

    /** Reads a double-quoted JavaScript string body the way a JS engine would. */
    private static String decodeDoubleQuoted(String body) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch != '\\') {
                assertThat(ch).as("unescaped control or quote").isNotIn('"', '\n', '\r');
                out.append(ch);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n': out.append('\n'); break;
                case 'r': out.append('\r'); break;
                case 't': out.append('\t'); break;
                default: out.append(next);
            }
        }
        return out.toString();
    }

    // ------------------------------------------------------------------
    // shell
    // ------------------------------------------------------------------

    @Test
    void bareCommand() {
        assertThat(worker("$ echo hello")).contains("  await $shell(`echo hello`);\n");
    }

    @Test
    void bareCommand_quotedArgumentContributesItsText() {
        assertThat(worker("$ echo \"hello\"")).contains("  await $shell(`echo hello`);\n");
    }

    @Test
    void bareCommand_withStringArgument() {
        assertThat(worker("$ git commit -m \"fix ${issue}\""))
                .contains("  await $shell(`git commit -m fix ${issue}`);\n");
    }

    @Test
    void commandSubstitution_capturesOutput() {
        assertThat(worker("var files = $(ls -la)"))
                .contains("  let files = await $shell(`ls -la`, {capture: true});\n");
    }

    @Test
    void commandSubstitution_ofPipeline() {
        assertThat(worker("var n = $(ls | wc -l)"))
                .contains("  let n = await $shellPipe([`ls`, `wc -l`], {capture: true});\n");
    }

    @Test
    void commandSubstitution_asArgument() {
        assertThat(worker("$ echo $(date)"))
                .contains("  await $shell(`echo ${await $shell(`date`, {capture: true})}`);\n");
    }

    @Test
    void chains() {
        String js = worker("""
                $ cat log | grep error | wc -l
                $ make && make test
                $ test -f x || touch x""");
        assertThat(js).contains("  await $shellPipe([`cat log`, `grep error`, `wc -l`]);\n");
        assertThat(js).contains("  await $shellAnd([`make`, `make test`]);\n");
        assertThat(js).contains("  await $shellOr([`test -f x`, `touch x`]);\n");
    }

    @Test
    void mixedChain_keepsInnerChainAsShellText() {
        String js = worker("""
                $ a && b || c
                $ make && cat out | head""");
        assertThat(js).contains("  await $shellOr([`a && b`, `c`]);\n");
        assertThat(js).contains("  await $shellAnd([`make`, `cat out | head`]);\n");
    }

    @Test
    void redirects() {
        String js = worker("""
                $ echo hi > out.txt
                $ echo more >> "${dir}/log"
                $ sort < in.txt
                $ make 2> err.txt
                $ make 2>&1""");
        assertThat(js).contains("  await $shellRedirect(`echo hi`, '>', \"out.txt\");\n");
        assertThat(js).contains("  await $shellRedirect(`echo more`, '>>', `${dir}/log`);\n");
        assertThat(js).contains("  await $shellRedirect(`sort`, '<', \"in.txt\");\n");
        assertThat(js).contains("  await $shellRedirect(`make`, '2>', \"err.txt\");\n");
        assertThat(js).contains("  await $shellRedirect(`make`, '2>&1', null);\n");
    }

    @Test
    void redirectInsideChain_isShellText() {
        assertThat(worker("$ make > build.log && echo done"))
                .contains("  await $shellAnd([`make > build.log`, `echo done`]);\n");
    }

    @Test
    void redirectInsideSubstitution_isUnsupported() {
        assertThatThrownBy(() -> worker("var x = $(make 2>&1)"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("redirect inside a command substitution");
    }

    @Test
    void shellText_escapesTemplateCharacters() {
        assertThat(worker("$ echo 'a`b'")).contains("  await $shell(`echo 'a\\`b'`);\n");
    }

    // ------------------------------------------------------------------
    // session access
    // ------------------------------------------------------------------

    @Test
    void sessionFields_mapToSessionParameter() {
        String js = worker("""
                var id = self.session.id
                var at = self.timestamp
                var msg = "run ${self.session.dir}\"""");
        assertThat(js).contains("  let id = session.id;\n");
        assertThat(js).contains("  let at = session.timestamp;\n");
        assertThat(js).contains("  let msg = `run ${session.dir}`;\n");
    }

    @Test
    void sessionField_inShellArgument() {
        assertThat(worker("$ cd \"${self.session.dir}\""))
                .contains("  await $shell(`cd ${session.dir}`);\n");
    }

    @Test
    void bareSelf_isRejected() {
        assertThatThrownBy(() -> worker("var s = self"))
                .isInstanceOf(InvalidSessionAccessException.class)
                .satisfies(e -> {
                    InvalidSessionAccessException error = (InvalidSessionAccessException) e;
                    assertThat(error.getKind()).isEqualTo(CompileException.Kind.INVALID_SESSION_ACCESS);
                    assertThat(error.getAccessPath()).isEqualTo("self");
                    assertThat(error.getLine()).isEqualTo(2);
                    assertThat(error.getColumn()).isEqualTo(9);
                    assertThat(error.getMessage()).startsWith("test.pw:2:9: [INVALID_SESSION_ACCESS] bare 'self'");
                });
    }

    @Test
    void bareSelfSession_isRejected() {
        assertThatThrownBy(() -> worker("var s = self.session"))
                .isInstanceOf(InvalidSessionAccessException.class)
                .hasMessageContaining("bare 'self.session' is not supported");
    }

    @Test
    void unknownSessionField_isRejected() {
        assertThatThrownBy(() -> worker("var m = self.mailbox"))
                .isInstanceOf(InvalidSessionAccessException.class)
                .hasMessageContaining("'self.mailbox' is not a session field")
                .satisfies(e -> assertThat(((InvalidSessionAccessException) e).getAccessPath())
                        .isEqualTo("self.mailbox"));
        assertThatThrownBy(() -> worker("var m = self.session.mailbox"))
                .isInstanceOf(InvalidSessionAccessException.class)
                .hasMessageContaining("'self.session.mailbox' is not a session field");
    }

    @Test
    void configuredSessionFields_extendAccess() {
        PatchworkCompiler withMailbox = new PatchworkCompiler(
                CompilerConfig.builder().sessionFields("id", "mailbox").build());
        String js = compile(withMailbox, "worker w() {\nvar m = self.session.mailbox\n}\n");
        assertThat(js).contains("  let m = session.mailbox;\n");
        assertThatThrownBy(() -> compile(withMailbox, "worker w() {\nvar d = self.dir\n}\n"))
                .isInstanceOf(InvalidSessionAccessException.class);
    }

    @Test
    void selfAsMemberOfSomethingElse_isOrdinaryAccess() {
        assertThat(worker("var x = config.self")).contains("  let x = config.self;\n");
    }

    @Test
    void sessionField_outsideWorker_isRejected() {
        assertThatThrownBy(() -> compile("fun helper() {\n  return self.session.id\n}\n"))
                .isInstanceOf(InvalidSessionAccessException.class)
                .hasMessageContaining("'self.session.id' is only available inside a worker")
                .satisfies(e -> assertThat(((InvalidSessionAccessException) e).getLine()).isEqualTo(2));
        assertThatThrownBy(() -> compile("export fun stamp() {\n  return self.timestamp\n}\n"))
                .isInstanceOf(InvalidSessionAccessException.class);
    }

    @Test
    void sessionName_isReservedInsideWorkers() {
        assertThatThrownBy(() -> compile("worker w(session) {\n}\n"))
                .isInstanceOf(InvalidSessionAccessException.class)
                .hasMessageContaining("'session' is reserved");
        assertThatThrownBy(() -> worker("var session = 1"))
                .isInstanceOf(InvalidSessionAccessException.class)
                .satisfies(e -> {
                    InvalidSessionAccessException error = (InvalidSessionAccessException) e;
                    assertThat(error.getAccessPath()).isEqualTo("session");
                    assertThat(error.getLine()).isEqualTo(2);
                });
        assertThatThrownBy(() -> worker("for session in runs {\n}"))
                .isInstanceOf(InvalidSessionAccessException.class);
    }

    @Test
    void sessionName_isOrdinaryInFunctions() {
        assertThat(compile("fun f(session) {\n  var s = session\n}\n"))
                .contains("async function f(session) {\n  let s = session;\n}\n");
    }

    // ------------------------------------------------------------------
    // unsupported constructs
    // ------------------------------------------------------------------

    @Test
    void range_isUnsupportedWithPosition() {
        assertThatThrownBy(() -> worker("var r = 1...10"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessage("test.pw:2:9: [UNSUPPORTED_FEATURE] range operator '...' is not supported");
    }

    @Test
    void pipeOperatorInExpression_isUnsupported() {
        assertThatThrownBy(() -> worker("var r = items | sorted"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("pipe operator");
    }

    @Test
    void destructuring_isUnsupported() {
        assertThatThrownBy(() -> worker("var {a, b} = pair"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .satisfies(e -> assertThat(((UnsupportedFeatureException) e).getFeature())
                        .isEqualTo("object destructuring"));
        assertThatThrownBy(() -> worker("var [a, b] = pair"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("array destructuring");
    }

    @Test
    void promptBlocks_areUnsupported() {
        assertThatThrownBy(() -> worker("var plan = think { outline the steps }"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("think block is not supported");
        assertThatThrownBy(() -> worker("ask { continue? }"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("ask block is not supported");
    }

    @Test
    void standaloneDo_isUnsupported() {
        assertThatThrownBy(() -> worker("var v = do { var y = 1 }"))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("do block outside a prompt");
    }

    @Test
    void failingProgram_producesNoPartialOutput() {
        PatchworkCompiler fresh = new PatchworkCompiler();
        assertThatThrownBy(() -> compile(fresh, """
                worker first() {
                    return 1
                }
                worker second() {
                    var r = 1...2
                }
                """)).isInstanceOf(UnsupportedFeatureException.class);
    }
}
