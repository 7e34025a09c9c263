package dev.patchwork.compiler;

import dev.patchwork.compiler.ast.Block;
import dev.patchwork.compiler.ast.CommandArg;
import dev.patchwork.compiler.ast.Expr;
import dev.patchwork.compiler.ast.Item;
import dev.patchwork.compiler.ast.Node;
import dev.patchwork.compiler.ast.Param;
import dev.patchwork.compiler.ast.Pattern;
import dev.patchwork.compiler.ast.Program;
import dev.patchwork.compiler.ast.Statement;
import dev.patchwork.compiler.ast.StringPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Lowers a {@link Program} to an ES module in one pass.
 * <p>
 * Workers and functions become {@code async} functions because shell helpers are
 * awaited. Every construct without a lowering raises
 * {@link UnsupportedFeatureException}; nothing is dropped silently. The module text
 * is only returned once the whole program has been lowered.
 * <p>
 * Instances are single use and not thread safe.
 */
final class JavaScriptGenerator implements Item.Visitor<Void>, Statement.Visitor<Void>, Expr.Visitor<String> {

    private static final Logger log = LoggerFactory.getLogger(JavaScriptGenerator.class);

    static final String SESSION_PARAM = "session";
    private static final String SELF = "self";

    private final String sourceName;
    private final CompilerConfig config;
    private final StringBuilder script = new StringBuilder();
    private int indentLevel = 0;
    private boolean inWorker = false;

    JavaScriptGenerator(String sourceName, CompilerConfig config) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.config = Objects.requireNonNull(config, "config");
    }

    String generate(Program program) {
        Objects.requireNonNull(program, "program");
        if (script.length() > 0) {
            throw new IllegalStateException("generator already used");
        }
        script.append("import { $shell, $shellPipe, $shellAnd, $shellOr, $shellRedirect, SessionContext } from '")
              .append(escapeSingleQuoted(config.runtimeModule()))
              .append("';\n\n");
        for (Item item : program.items) {
            item.accept(this);
        }
        return script.toString();
    }

    // ---------------------------------------------------------------------
    // items
    // ---------------------------------------------------------------------

    @Override
    public Void visitWorker(Item.WorkerDecl worker) {
        List<String> params = new ArrayList<>();
        params.add(SESSION_PARAM);
        for (Param param : worker.params) {
            if (SESSION_PARAM.equals(param.name)) {
                throw reservedSession(worker);
            }
            params.add(param.name);
        }
        inWorker = true;
        try {
            renderFunction("export ", worker.name, params, worker.body);
        } finally {
            inWorker = false;
        }
        return null;
    }

    @Override
    public Void visitFunction(Item.FunctionDecl function) {
        List<String> params = new ArrayList<>();
        for (Param param : function.params) {
            params.add(param.name);
        }
        renderFunction(function.exported ? "export " : "", function.name, params, function.body);
        return null;
    }

    @Override
    public Void visitImport(Item.ImportDecl item) {
        log.debug("{}: import {} has no runtime code, skipped", sourceName, item.path);
        return null;
    }

    @Override
    public Void visitSkill(Item.SkillDecl item) {
        log.debug("{}: skill {} has no runtime code, skipped", sourceName, item.name);
        return null;
    }

    @Override
    public Void visitTrait(Item.TraitDecl item) {
        log.debug("{}: trait {} has no runtime code, skipped", sourceName, item.name);
        return null;
    }

    @Override
    public Void visitType(Item.TypeDecl item) {
        return null;
    }

    private void renderFunction(String prefix, String name, List<String> params, Block body) {
        script.append(prefix).append("async function ").append(name)
              .append('(').append(String.join(", ", params)).append(") {\n");
        renderBlock(body, 1);
        script.append("}\n\n");
    }

    private void renderBlock(Block block, int level) {
        int saved = indentLevel;
        indentLevel = level;
        for (Statement statement : block.statements) {
            statement.accept(this);
        }
        indentLevel = saved;
    }

    private void indent(int level) {
        for (int i = 0; i < level; i++) {
            script.append("  ");
        }
    }

    private void line(String text) {
        indent(indentLevel);
        script.append(text).append('\n');
    }

    // ---------------------------------------------------------------------
    // statements
    // ---------------------------------------------------------------------

    @Override
    public Void visitVarDecl(Statement.VarDecl statement) {
        statement.pattern.accept(new Pattern.Visitor<Void>() {
            @Override
            public Void visitIdentifier(Pattern.IdentifierPattern pattern) {
                if (inWorker && SESSION_PARAM.equals(pattern.name)) {
                    throw reservedSession(pattern);
                }
                if (statement.initializer == null) {
                    line("let " + pattern.name + ";");
                } else {
                    line("let " + pattern.name + " = " + render(statement.initializer) + ";");
                }
                return null;
            }

            @Override
            public Void visitIgnore(Pattern.IgnorePattern pattern) {
                if (statement.initializer != null) {
                    line(render(statement.initializer) + ";");
                }
                return null;
            }

            @Override
            public Void visitObject(Pattern.ObjectPattern pattern) {
                throw unsupported(pattern, "object destructuring");
            }

            @Override
            public Void visitArray(Pattern.ArrayPattern pattern) {
                throw unsupported(pattern, "array destructuring");
            }
        });
        return null;
    }

    @Override
    public Void visitExpression(Statement.ExprStatement statement) {
        line(render(statement.expression) + ";");
        return null;
    }

    @Override
    public Void visitIf(Statement.If statement) {
        int level = indentLevel;
        line("if (" + render(statement.condition) + ") {");
        renderBlock(statement.thenBlock, level + 1);
        if (statement.elseBlock != null) {
            line("} else {");
            renderBlock(statement.elseBlock, level + 1);
        }
        line("}");
        return null;
    }

    @Override
    public Void visitWhile(Statement.While statement) {
        line("while (" + render(statement.condition) + ") {");
        renderBlock(statement.body, indentLevel + 1);
        line("}");
        return null;
    }

    @Override
    public Void visitForIn(Statement.ForIn statement) {
        if (inWorker && SESSION_PARAM.equals(statement.variable)) {
            throw reservedSession(statement);
        }
        line("for (let " + statement.variable + " of " + render(statement.iterable) + ") {");
        renderBlock(statement.body, indentLevel + 1);
        line("}");
        return null;
    }

    @Override
    public Void visitReturn(Statement.Return statement) {
        line(statement.value == null ? "return;" : "return " + render(statement.value) + ";");
        return null;
    }

    @Override
    public Void visitBreak(Statement.Break statement) {
        line("break;");
        return null;
    }

    /** Completion is signalled by the host runtime when the worker returns. */
    @Override
    public Void visitSucceed(Statement.Succeed statement) {
        line("// succeed");
        return null;
    }

    @Override
    public Void visitTypeDecl(Statement.TypeDeclaration statement) {
        return null;
    }

    // ---------------------------------------------------------------------
    // expressions
    // ---------------------------------------------------------------------

    private String render(Expr expr) {
        return expr.accept(this);
    }

    private String renderAll(List<Expr> exprs) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Expr expr : exprs) {
            joiner.add(render(expr));
        }
        return joiner.toString();
    }

    @Override
    public String visitIdentifier(Expr.Identifier expr) {
        if (SELF.equals(expr.name)) {
            throw new InvalidSessionAccessException(sourceName, expr.position.line, expr.position.column, SELF,
                    "bare 'self' is not supported, read a session field such as self.session.id");
        }
        return expr.name;
    }

    @Override
    public String visitNumber(Expr.NumberLiteral expr) {
        return expr.text;
    }

    @Override
    public String visitString(Expr.StringLiteral expr) {
        if (expr.isPlainText()) {
            return '"' + escapeString(expr.plainText()) + '"';
        }
        return '`' + templateText(expr) + '`';
    }

    @Override
    public String visitBoolean(Expr.BooleanLiteral expr) {
        return expr.value ? "true" : "false";
    }

    @Override
    public String visitArray(Expr.ArrayLiteral expr) {
        return "[" + renderAll(expr.elements) + "]";
    }

    @Override
    public String visitObject(Expr.ObjectLiteral expr) {
        if (expr.fields.isEmpty()) {
            return "{}";
        }
        StringJoiner joiner = new StringJoiner(", ", "{ ", " }");
        for (Expr.ObjectField field : expr.fields) {
            joiner.add(field.value == null ? field.key : field.key + ": " + render(field.value));
        }
        return joiner.toString();
    }

    @Override
    public String visitBinary(Expr.Binary expr) {
        String op;
        switch (expr.operator) {
            case ADD: op = "+"; break;
            case SUB: op = "-"; break;
            case MUL: op = "*"; break;
            case DIV: op = "/"; break;
            case EQ: op = "==="; break;
            case NOT_EQ: op = "!=="; break;
            case LT: op = "<"; break;
            case GT: op = ">"; break;
            case AND: op = "&&"; break;
            case OR: op = "||"; break;
            case ASSIGN: op = "="; break;
            case PIPE:
                throw unsupported(expr, "pipe operator '|' outside a shell command");
            case RANGE:
                throw unsupported(expr, "range operator '...'");
            default:
                throw unsupported(expr, "binary operator " + expr.operator);
        }
        return render(expr.left) + " " + op + " " + render(expr.right);
    }

    @Override
    public String visitUnary(Expr.Unary expr) {
        switch (expr.operator) {
            case NOT:
                return "!" + render(expr.operand);
            case NEG:
                String operand = render(expr.operand);
                // "- -x" must not fuse into the decrement operator
                return operand.startsWith("-") ? "- " + operand : "-" + operand;
            case THROW:
                return "throw new Error(String(" + render(expr.operand) + "))";
            default:
                throw unsupported(expr, "unary operator " + expr.operator);
        }
    }

    @Override
    public String visitCall(Expr.Call expr) {
        return renderTarget(expr.callee) + "(" + renderAll(expr.arguments) + ")";
    }

    @Override
    public String visitMember(Expr.Member expr) {
        if (isSelf(expr.target)) {
            if (!"session".equals(expr.property) && config.sessionFields().contains(expr.property)) {
                return sessionField(expr, SELF + "." + expr.property);
            }
            throw invalidSession(expr, SELF + "." + expr.property);
        }
        if (expr.target instanceof Expr.Member) {
            Expr.Member inner = (Expr.Member) expr.target;
            if (isSelf(inner.target) && "session".equals(inner.property)) {
                if (config.sessionFields().contains(expr.property)) {
                    return sessionField(expr, SELF + ".session." + expr.property);
                }
                throw invalidSession(expr, SELF + ".session." + expr.property);
            }
        }
        return renderTarget(expr.target) + "." + expr.property;
    }

    private String sessionField(Expr.Member expr, String path) {
        if (!inWorker) {
            throw new InvalidSessionAccessException(sourceName, expr.position.line, expr.position.column, path,
                    "'" + path + "' is only available inside a worker, pass the value to the function instead");
        }
        return SESSION_PARAM + "." + expr.property;
    }

    private InvalidSessionAccessException reservedSession(Node node) {
        return new InvalidSessionAccessException(sourceName, node.position.line, node.position.column,
                SESSION_PARAM, "'" + SESSION_PARAM + "' is reserved for the worker session parameter");
    }

    /**
     * Target of a call, member or index access. Shell helpers render as {@code await ...},
     * which would otherwise apply the access to the pending promise.
     */
    private String renderTarget(Expr target) {
        String rendered = render(target);
        if (target instanceof Expr.Await
                || target instanceof Expr.BareCommand
                || target instanceof Expr.CommandSubstitution
                || target instanceof Expr.ShellChain
                || target instanceof Expr.ShellRedirect) {
            return "(" + rendered + ")";
        }
        return rendered;
    }

    private static boolean isSelf(Expr expr) {
        return expr instanceof Expr.Identifier && SELF.equals(((Expr.Identifier) expr).name);
    }

    private InvalidSessionAccessException invalidSession(Node node, String path) {
        String detail = "session".equals(path.substring(path.lastIndexOf('.') + 1))
                ? "bare '" + path + "' is not supported, read one of its fields " + config.sessionFields()
                : "'" + path + "' is not a session field, expected one of " + config.sessionFields();
        return new InvalidSessionAccessException(sourceName, node.position.line, node.position.column, path, detail);
    }

    @Override
    public String visitIndex(Expr.Index expr) {
        return renderTarget(expr.target) + "[" + render(expr.index) + "]";
    }

    @Override
    public String visitParen(Expr.Paren expr) {
        return "(" + render(expr.inner) + ")";
    }

    @Override
    public String visitPostIncrement(Expr.PostIncrement expr) {
        return renderTarget(expr.operand) + "++";
    }

    @Override
    public String visitPostDecrement(Expr.PostDecrement expr) {
        return renderTarget(expr.operand) + "--";
    }

    @Override
    public String visitAwait(Expr.Await expr) {
        return "await " + render(expr.operand);
    }

    @Override
    public String visitPrompt(Expr.Prompt expr) {
        throw unsupported(expr, expr.kind.keyword() + " block");
    }

    @Override
    public String visitDo(Expr.Do expr) {
        throw unsupported(expr, "do block outside a prompt");
    }

    // ---------------------------------------------------------------------
    // shell
    // ---------------------------------------------------------------------

    @Override
    public String visitBareCommand(Expr.BareCommand expr) {
        return "await $shell(" + commandTemplate(expr) + ")";
    }

    @Override
    public String visitCommandSubstitution(Expr.CommandSubstitution expr) {
        Expr command = expr.command;
        if (command instanceof Expr.BareCommand) {
            return "await $shell(" + commandTemplate(command) + ", {capture: true})";
        }
        if (command instanceof Expr.ShellChain) {
            Expr.ShellChain chain = (Expr.ShellChain) command;
            return "await " + chainHelper(chain) + "([" + chainTemplates(chain) + "], {capture: true})";
        }
        throw unsupported(command, "redirect inside a command substitution");
    }

    @Override
    public String visitShellChain(Expr.ShellChain expr) {
        return "await " + chainHelper(expr) + "([" + chainTemplates(expr) + "])";
    }

    @Override
    public String visitShellRedirect(Expr.ShellRedirect expr) {
        String target = expr.target == null ? "null" : render(expr.target);
        return "await $shellRedirect(" + commandTemplate(expr.command) + ", '" + expr.operator.symbol() + "', "
                + target + ")";
    }

    private static String chainHelper(Expr.ShellChain chain) {
        switch (chain.operator) {
            case PIPE:
                return "$shellPipe";
            case AND:
                return "$shellAnd";
            case OR:
                return "$shellOr";
            default:
                throw new IllegalArgumentException("unknown shell operator " + chain.operator);
        }
    }

    private String chainTemplates(Expr.ShellChain chain) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Expr command : chain.commands) {
            joiner.add(commandTemplate(command));
        }
        return joiner.toString();
    }

    private String commandTemplate(Expr command) {
        return '`' + commandText(command) + '`';
    }

    /**
     * Shell text of a command as it appears inside a template literal. A nested chain
     * or redirect is handed to the shell whole, operators included.
     */
    private String commandText(Expr command) {
        if (command instanceof Expr.BareCommand) {
            Expr.BareCommand bare = (Expr.BareCommand) command;
            StringBuilder text = new StringBuilder(escapeTemplate(bare.name));
            for (CommandArg arg : bare.arguments) {
                text.append(' ').append(argumentText(arg));
            }
            return text.toString();
        }
        if (command instanceof Expr.ShellChain) {
            Expr.ShellChain chain = (Expr.ShellChain) command;
            StringJoiner joiner = new StringJoiner(" " + chain.operator.symbol() + " ");
            for (Expr member : chain.commands) {
                joiner.add(commandText(member));
            }
            return joiner.toString();
        }
        if (command instanceof Expr.ShellRedirect) {
            Expr.ShellRedirect redirect = (Expr.ShellRedirect) command;
            String text = commandText(redirect.command) + " " + redirect.operator.symbol();
            if (redirect.target == null) {
                return text;
            }
            if (redirect.target instanceof Expr.StringLiteral) {
                return text + " " + templateText((Expr.StringLiteral) redirect.target);
            }
            return text + " ${" + render(redirect.target) + "}";
        }
        throw unsupported(command, "expression in shell command position");
    }

    private String argumentText(CommandArg arg) {
        if (arg instanceof CommandArg.Literal) {
            return escapeTemplate(((CommandArg.Literal) arg).text);
        }
        if (arg instanceof CommandArg.Str) {
            return templateText(((CommandArg.Str) arg).value);
        }
        CommandArg.Substitution substitution = (CommandArg.Substitution) arg;
        Expr.CommandSubstitution captured =
                new Expr.CommandSubstitution(substitution.command.position, substitution.command);
        return "${" + visitCommandSubstitution(captured) + "}";
    }

    private String templateText(Expr.StringLiteral literal) {
        StringBuilder text = new StringBuilder();
        for (StringPart part : literal.parts) {
            if (part instanceof StringPart.Text) {
                text.append(escapeTemplate(((StringPart.Text) part).value));
            } else {
                text.append("${").append(render(((StringPart.Interpolation) part).expression)).append('}');
            }
        }
        return text.toString();
    }

    // ---------------------------------------------------------------------
    // escaping
    // ---------------------------------------------------------------------

    /** Body of a double-quoted JavaScript string. */
    static String escapeString(String text) {
        StringBuilder result = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '\\': result.append("\\\\"); break;
                case '"': result.append("\\\""); break;
                case '\n': result.append("\\n"); break;
                case '\r': result.append("\\r"); break;
                case '\t': result.append("\\t"); break;
                default: result.append(ch);
            }
        }
        return result.toString();
    }

    /** Literal text inside a template literal. A raw CR would be read back as LF. */
    static String escapeTemplate(String text) {
        return text.replace("\\", "\\\\")
                   .replace("`", "\\`")
                   .replace("${", "\\${")
                   .replace("\r", "\\r");
    }

    private static String escapeSingleQuoted(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }

    private UnsupportedFeatureException unsupported(Node node, String feature) {
        return new UnsupportedFeatureException(sourceName, node.position.line, node.position.column, feature);
    }
}
