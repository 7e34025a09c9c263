package dev.patchwork.compiler;

import dev.patchwork.antlr.PatchworkParser;
import dev.patchwork.antlr.PatchworkParserBaseVisitor;
import dev.patchwork.compiler.ast.BinaryOp;
import dev.patchwork.compiler.ast.Block;
import dev.patchwork.compiler.ast.CommandArg;
import dev.patchwork.compiler.ast.Expr;
import dev.patchwork.compiler.ast.Item;
import dev.patchwork.compiler.ast.Param;
import dev.patchwork.compiler.ast.Pattern;
import dev.patchwork.compiler.ast.Program;
import dev.patchwork.compiler.ast.PromptItem;
import dev.patchwork.compiler.ast.PromptKind;
import dev.patchwork.compiler.ast.RedirectOp;
import dev.patchwork.compiler.ast.ShellOperator;
import dev.patchwork.compiler.ast.SourcePosition;
import dev.patchwork.compiler.ast.Statement;
import dev.patchwork.compiler.ast.StringPart;
import dev.patchwork.compiler.ast.UnaryOp;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the immutable {@link Program} from a parse tree. Top-level declarations are
 * collected by the visitor callbacks; statement and expression subtrees are
 * translated by the {@code build*} methods, one per grammar level.
 */
final class AstBuilder extends PatchworkParserBaseVisitor<Void> {

    private final String sourceName;
    private final CompilerConfig config;
    private final List<Item> items = new ArrayList<>();

    AstBuilder(String sourceName, CompilerConfig config) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.config = Objects.requireNonNull(config, "config");
    }

    Program build(PatchworkParser.CompilationUnitContext tree) {
        Objects.requireNonNull(tree, "tree");
        items.clear();
        visit(tree);
        return new Program(items);
    }

    @Override
    public Void visitImportDecl(PatchworkParser.ImportDeclContext ctx) {
        PatchworkParser.ImportPathContext path = ctx.importPath();
        List<String> members = new ArrayList<>();
        String text;
        if (path.LBRACE() != null) {
            for (PatchworkParser.NameContext name : path.name()) {
                members.add(name.getText());
            }
            text = "./";
        } else {
            text = path.getText();
        }
        items.add(new Item.ImportDecl(position(ctx), text, members));
        return null;
    }

    @Override
    public Void visitSkillDecl(PatchworkParser.SkillDeclContext ctx) {
        items.add(new Item.SkillDecl(position(ctx), ctx.IDENT().getText(),
                buildParams(ctx.parameterList()), buildBlock(ctx.block())));
        return null;
    }

    @Override
    public Void visitWorkerDecl(PatchworkParser.WorkerDeclContext ctx) {
        String keyword = ctx.kind.getText();
        if (!config.workerKeywords().contains(keyword)) {
            throw new ParseException(sourceName, ctx.kind.getLine(), ctx.kind.getCharPositionInLine() + 1, keyword,
                    "'" + keyword + "' is not an accepted worker keyword, expected one of " + config.workerKeywords());
        }
        items.add(new Item.WorkerDecl(position(ctx), keyword, ctx.IDENT().getText(),
                buildParams(ctx.parameterList()), buildBlock(ctx.block())));
        return null;
    }

    @Override
    public Void visitFunctionDecl(PatchworkParser.FunctionDeclContext ctx) {
        items.add(buildFunction(ctx));
        return null;
    }

    @Override
    public Void visitTraitDecl(PatchworkParser.TraitDeclContext ctx) {
        List<Item.FunctionDecl> methods = new ArrayList<>();
        for (PatchworkParser.TraitMemberContext member : ctx.traitMember()) {
            if (member.functionDecl() != null) {
                methods.add(buildFunction(member.functionDecl()));
            }
        }
        items.add(new Item.TraitDecl(position(ctx), ctx.IDENT(0).getText(), methods));
        return null;
    }

    @Override
    public Void visitTypeDecl(PatchworkParser.TypeDeclContext ctx) {
        items.add(new Item.TypeDecl(position(ctx), ctx.IDENT().getText(), sourceText(ctx.typeExpr())));
        return null;
    }

    private Item.FunctionDecl buildFunction(PatchworkParser.FunctionDeclContext ctx) {
        return new Item.FunctionDecl(position(ctx), ctx.IDENT().getText(),
                buildParams(ctx.parameterList()), buildBlock(ctx.block()), ctx.EXPORT() != null);
    }

    private List<Param> buildParams(PatchworkParser.ParameterListContext ctx) {
        List<Param> params = new ArrayList<>();
        if (ctx == null) {
            return params;
        }
        for (PatchworkParser.ParameterContext parameter : ctx.parameter()) {
            String type = parameter.typeExpr() != null ? sourceText(parameter.typeExpr()) : null;
            params.add(new Param(parameter.IDENT().getText(), type));
        }
        return params;
    }

    private Block buildBlock(PatchworkParser.BlockContext ctx) {
        return buildBlockBody(ctx.blockBody());
    }

    private Block buildBlockBody(PatchworkParser.BlockBodyContext ctx) {
        List<Statement> statements = new ArrayList<>();
        for (PatchworkParser.StatementContext statement : ctx.statement()) {
            statements.add(buildStatement(statement));
        }
        return new Block(statements);
    }

    private Statement buildStatement(PatchworkParser.StatementContext ctx) {
        SourcePosition pos = position(ctx);
        if (ctx.varDeclaration() != null) {
            return buildVarDeclaration(ctx.varDeclaration());
        }
        if (ctx.ifStatement() != null) {
            return buildIf(ctx.ifStatement());
        }
        if (ctx.whileStatement() != null) {
            PatchworkParser.WhileStatementContext loop = ctx.whileStatement();
            return new Statement.While(pos, buildExpression(loop.expression()), buildBlock(loop.block()));
        }
        if (ctx.forStatement() != null) {
            PatchworkParser.ForStatementContext loop = ctx.forStatement();
            return new Statement.ForIn(pos, loop.IDENT().getText(),
                    buildExpression(loop.expression()), buildBlock(loop.block()));
        }
        if (ctx.returnStatement() != null) {
            PatchworkParser.ExpressionContext value = ctx.returnStatement().expression();
            return new Statement.Return(pos, value != null ? buildExpression(value) : null);
        }
        if (ctx.breakStatement() != null) {
            return new Statement.Break(pos);
        }
        if (ctx.succeedStatement() != null) {
            return new Statement.Succeed(pos);
        }
        if (ctx.typeDecl() != null) {
            PatchworkParser.TypeDeclContext type = ctx.typeDecl();
            return new Statement.TypeDeclaration(pos, type.IDENT().getText(), sourceText(type.typeExpr()));
        }
        if (ctx.shellStatement() != null) {
            return new Statement.ExprStatement(pos, buildShellChain(ctx.shellStatement().shellChain()));
        }
        if (ctx.expressionStatement() != null) {
            return new Statement.ExprStatement(pos, buildExpression(ctx.expressionStatement().expression()));
        }
        throw unexpected(ctx);
    }

    private Statement buildVarDeclaration(PatchworkParser.VarDeclarationContext ctx) {
        Pattern pattern = buildPattern(ctx.bindingPattern());
        String type = ctx.typeExpr() != null ? sourceText(ctx.typeExpr()) : null;
        Expr initializer = ctx.expression() != null ? buildExpression(ctx.expression()) : null;
        return new Statement.VarDecl(position(ctx), pattern, type, initializer);
    }

    private Pattern buildPattern(PatchworkParser.BindingPatternContext ctx) {
        SourcePosition pos = position(ctx);
        if (ctx.IDENT() != null) {
            String name = ctx.IDENT().getText();
            if ("_".equals(name)) {
                return new Pattern.IgnorePattern(pos);
            }
            return new Pattern.IdentifierPattern(pos, name);
        }
        if (ctx.LBRACE() != null) {
            List<Pattern.Field> fields = new ArrayList<>();
            for (PatchworkParser.PatternFieldContext field : ctx.patternField()) {
                Pattern binding = field.bindingPattern() != null ? buildPattern(field.bindingPattern()) : null;
                fields.add(new Pattern.Field(field.name().getText(), binding));
            }
            return new Pattern.ObjectPattern(pos, fields);
        }
        List<Pattern> elements = new ArrayList<>();
        for (PatchworkParser.BindingPatternContext element : ctx.bindingPattern()) {
            elements.add(buildPattern(element));
        }
        return new Pattern.ArrayPattern(pos, elements);
    }

    private Statement.If buildIf(PatchworkParser.IfStatementContext ctx) {
        Block elseBlock = null;
        if (ctx.ifStatement() != null) {
            elseBlock = new Block(List.of(buildIf(ctx.ifStatement())));
        } else if (ctx.block().size() > 1) {
            elseBlock = buildBlock(ctx.block(1));
        }
        return new Statement.If(position(ctx), buildExpression(ctx.expression()), buildBlock(ctx.block(0)), elseBlock);
    }

    private Expr buildExpression(PatchworkParser.ExpressionContext ctx) {
        return buildAssignment(ctx.assignment());
    }

    private Expr buildAssignment(PatchworkParser.AssignmentContext ctx) {
        Expr target = buildRange(ctx.rangeExpression());
        if (ctx.assignment() == null) {
            return target;
        }
        return new Expr.Binary(target.position, BinaryOp.ASSIGN, target, buildAssignment(ctx.assignment()));
    }

    private Expr buildRange(PatchworkParser.RangeExpressionContext ctx) {
        Expr from = buildPipe(ctx.pipeExpression(0));
        if (ctx.ELLIPSIS() == null) {
            return from;
        }
        return new Expr.Binary(from.position, BinaryOp.RANGE, from, buildPipe(ctx.pipeExpression(1)));
    }

    private Expr buildPipe(PatchworkParser.PipeExpressionContext ctx) {
        List<PatchworkParser.LogicOrExpressionContext> parts = ctx.logicOrExpression();
        Expr result = buildLogicOr(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            result = new Expr.Binary(result.position, BinaryOp.PIPE, result, buildLogicOr(parts.get(i)));
        }
        return result;
    }

    private Expr buildLogicOr(PatchworkParser.LogicOrExpressionContext ctx) {
        List<PatchworkParser.LogicAndExpressionContext> parts = ctx.logicAndExpression();
        Expr result = buildLogicAnd(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            result = new Expr.Binary(result.position, BinaryOp.OR, result, buildLogicAnd(parts.get(i)));
        }
        return result;
    }

    private Expr buildLogicAnd(PatchworkParser.LogicAndExpressionContext ctx) {
        List<PatchworkParser.EqualityExpressionContext> parts = ctx.equalityExpression();
        Expr result = buildEquality(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            result = new Expr.Binary(result.position, BinaryOp.AND, result, buildEquality(parts.get(i)));
        }
        return result;
    }

    private Expr buildEquality(PatchworkParser.EqualityExpressionContext ctx) {
        List<PatchworkParser.RelationalExpressionContext> parts = ctx.relationalExpression();
        Expr result = buildRelational(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            BinaryOp op = ctx.equalityOperator(i - 1).EQ_EQ() != null ? BinaryOp.EQ : BinaryOp.NOT_EQ;
            result = new Expr.Binary(result.position, op, result, buildRelational(parts.get(i)));
        }
        return result;
    }

    private Expr buildRelational(PatchworkParser.RelationalExpressionContext ctx) {
        List<PatchworkParser.AdditiveExpressionContext> parts = ctx.additiveExpression();
        Expr result = buildAdditive(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            BinaryOp op = ctx.relationalOperator(i - 1).LT() != null ? BinaryOp.LT : BinaryOp.GT;
            result = new Expr.Binary(result.position, op, result, buildAdditive(parts.get(i)));
        }
        return result;
    }

    private Expr buildAdditive(PatchworkParser.AdditiveExpressionContext ctx) {
        List<PatchworkParser.MultiplicativeExpressionContext> parts = ctx.multiplicativeExpression();
        Expr result = buildMultiplicative(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            BinaryOp op = ctx.additiveOperator(i - 1).PLUS() != null ? BinaryOp.ADD : BinaryOp.SUB;
            result = new Expr.Binary(result.position, op, result, buildMultiplicative(parts.get(i)));
        }
        return result;
    }

    private Expr buildMultiplicative(PatchworkParser.MultiplicativeExpressionContext ctx) {
        List<PatchworkParser.UnaryExpressionContext> parts = ctx.unaryExpression();
        Expr result = buildUnary(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            BinaryOp op = ctx.multiplicativeOperator(i - 1).STAR() != null ? BinaryOp.MUL : BinaryOp.DIV;
            result = new Expr.Binary(result.position, op, result, buildUnary(parts.get(i)));
        }
        return result;
    }

    private Expr buildUnary(PatchworkParser.UnaryExpressionContext ctx) {
        SourcePosition pos = position(ctx);
        if (ctx.THROW() != null) {
            return new Expr.Unary(pos, UnaryOp.THROW, buildExpression(ctx.expression()));
        }
        if (ctx.AWAIT() != null) {
            return new Expr.Await(pos, buildUnary(ctx.unaryExpression()));
        }
        if (ctx.BANG() != null) {
            return new Expr.Unary(pos, UnaryOp.NOT, buildUnary(ctx.unaryExpression()));
        }
        if (ctx.MINUS() != null) {
            return new Expr.Unary(pos, UnaryOp.NEG, buildUnary(ctx.unaryExpression()));
        }
        return buildPostfix(ctx.postfixExpression());
    }

    private Expr buildPostfix(PatchworkParser.PostfixExpressionContext ctx) {
        Expr result = buildPrimary(ctx.primaryExpression());
        for (PatchworkParser.PostfixOperatorContext op : ctx.postfixOperator()) {
            SourcePosition pos = result.position;
            if (op.LPAREN() != null) {
                result = new Expr.Call(pos, result, buildArguments(op.arguments()));
            } else if (op.DOT() != null) {
                result = new Expr.Member(pos, result, op.name().getText());
            } else if (op.LBRACK() != null) {
                result = new Expr.Index(pos, result, buildExpression(op.expression()));
            } else if (op.PLUS_PLUS() != null) {
                result = new Expr.PostIncrement(pos, result);
            } else if (op.MINUS_MINUS() != null) {
                result = new Expr.PostDecrement(pos, result);
            } else {
                throw unexpected(op);
            }
        }
        return result;
    }

    private List<Expr> buildArguments(PatchworkParser.ArgumentsContext ctx) {
        List<Expr> arguments = new ArrayList<>();
        if (ctx == null) {
            return arguments;
        }
        for (PatchworkParser.ExpressionContext expression : ctx.expression()) {
            arguments.add(buildExpression(expression));
        }
        return arguments;
    }

    private Expr buildPrimary(PatchworkParser.PrimaryExpressionContext ctx) {
        SourcePosition pos = position(ctx);
        if (ctx.NUMBER() != null) {
            return new Expr.NumberLiteral(pos, ctx.NUMBER().getText());
        }
        if (ctx.stringLiteral() != null) {
            return buildString(ctx.stringLiteral());
        }
        if (ctx.TRUE() != null) {
            return new Expr.BooleanLiteral(pos, true);
        }
        if (ctx.FALSE() != null) {
            return new Expr.BooleanLiteral(pos, false);
        }
        if (ctx.IDENT() != null) {
            return new Expr.Identifier(pos, ctx.IDENT().getText());
        }
        if (ctx.LBRACK() != null) {
            List<Expr> elements = new ArrayList<>();
            for (PatchworkParser.ExpressionContext element : ctx.expression()) {
                elements.add(buildExpression(element));
            }
            return new Expr.ArrayLiteral(pos, elements);
        }
        if (ctx.LBRACE() != null) {
            List<Expr.ObjectField> fields = new ArrayList<>();
            for (PatchworkParser.ObjectFieldContext field : ctx.objectField()) {
                Expr value = field.expression() != null ? buildExpression(field.expression()) : null;
                fields.add(new Expr.ObjectField(field.name().getText(), value));
            }
            return new Expr.ObjectLiteral(pos, fields);
        }
        if (ctx.LPAREN() != null) {
            return new Expr.Paren(pos, buildExpression(ctx.expression(0)));
        }
        if (ctx.SUBST_OPEN() != null) {
            return new Expr.CommandSubstitution(pos, buildShellChain(ctx.shellChain()));
        }
        if (ctx.promptBlock() != null) {
            return buildPrompt(ctx.promptBlock());
        }
        if (ctx.DO_OPEN() != null) {
            return new Expr.Do(pos, buildBlockBody(ctx.blockBody()));
        }
        throw unexpected(ctx);
    }

    private Expr.StringLiteral buildString(PatchworkParser.StringLiteralContext ctx) {
        List<StringPart> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        boolean pendingText = false;
        for (PatchworkParser.StringPartContext part : ctx.stringPart()) {
            if (part.STRING_TEXT() != null) {
                text.append(unescape(part.STRING_TEXT().getText()));
                pendingText = true;
                continue;
            }
            if (pendingText) {
                parts.add(new StringPart.Text(text.toString()));
                text.setLength(0);
                pendingText = false;
            }
            parts.add(new StringPart.Interpolation(buildExpression(part.expression())));
        }
        if (pendingText || parts.isEmpty()) {
            parts.add(new StringPart.Text(text.toString()));
        }
        return new Expr.StringLiteral(position(ctx), parts);
    }

    /**
     * Decodes {@code \n \r \t \" \\ \$}. Any other escaped character stands for itself.
     */
    static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder result = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch != '\\' || i + 1 == raw.length()) {
                result.append(ch);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 'n':
                    result.append('\n');
                    break;
                case 'r':
                    result.append('\r');
                    break;
                case 't':
                    result.append('\t');
                    break;
                default:
                    result.append(next);
            }
        }
        return result.toString();
    }

    private Expr buildPrompt(PatchworkParser.PromptBlockContext ctx) {
        PromptKind kind = ctx.kind.getType() == PatchworkParser.THINK_OPEN ? PromptKind.THINK : PromptKind.ASK;
        List<PromptItem> promptItems = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (PatchworkParser.PromptItemContext item : ctx.promptItem()) {
            if (item.PROMPT_TEXT() != null) {
                text.append(item.PROMPT_TEXT().getText());
                continue;
            }
            if (text.length() > 0) {
                promptItems.add(new PromptItem.Text(text.toString()));
                text.setLength(0);
            }
            if (item.DO_OPEN() != null) {
                promptItems.add(new PromptItem.Code(buildBlockBody(item.blockBody())));
            } else {
                promptItems.add(new PromptItem.Interpolation(buildExpression(item.expression())));
            }
        }
        if (text.length() > 0) {
            promptItems.add(new PromptItem.Text(text.toString()));
        }
        return new Expr.Prompt(position(ctx), kind, promptItems);
    }

    /**
     * {@code &&} and {@code ||} bind equally and associate left. A run of one operator
     * becomes a single chain; switching operator nests what was built so far.
     */
    private Expr buildShellChain(PatchworkParser.ShellChainContext ctx) {
        List<PatchworkParser.ShellPipelineContext> pipelines = ctx.shellPipeline();
        Expr first = buildShellPipeline(pipelines.get(0));
        if (pipelines.size() == 1) {
            return first;
        }
        ShellOperator current = null;
        List<Expr> commands = new ArrayList<>();
        commands.add(first);
        for (int i = 1; i < pipelines.size(); i++) {
            ShellOperator op = ctx.chainOperator(i - 1).AND_AND() != null ? ShellOperator.AND : ShellOperator.OR;
            if (current != null && op != current) {
                Expr nested = new Expr.ShellChain(first.position, current, commands);
                commands = new ArrayList<>();
                commands.add(nested);
            }
            current = op;
            commands.add(buildShellPipeline(pipelines.get(i)));
        }
        return new Expr.ShellChain(first.position, current, commands);
    }

    private Expr buildShellPipeline(PatchworkParser.ShellPipelineContext ctx) {
        List<Expr> commands = new ArrayList<>();
        for (PatchworkParser.ShellRedirectedContext redirected : ctx.shellRedirected()) {
            commands.add(buildShellRedirected(redirected));
        }
        if (commands.size() == 1) {
            return commands.get(0);
        }
        return new Expr.ShellChain(commands.get(0).position, ShellOperator.PIPE, commands);
    }

    private Expr buildShellRedirected(PatchworkParser.ShellRedirectedContext ctx) {
        Expr command = buildShellCommand(ctx.shellCommand());
        PatchworkParser.ShellRedirectContext redirect = ctx.shellRedirect();
        if (redirect == null) {
            return command;
        }
        if (redirect.REDIRECT_ERR_TO_OUT() != null) {
            return new Expr.ShellRedirect(command.position, command, RedirectOp.ERR_TO_OUT, null);
        }
        return new Expr.ShellRedirect(command.position, command,
                redirectOperator(redirect.redirectOperator()), buildShellTarget(redirect.shellTarget()));
    }

    private RedirectOp redirectOperator(PatchworkParser.RedirectOperatorContext ctx) {
        if (ctx.REDIRECT_OUT() != null) {
            return RedirectOp.OUT;
        }
        if (ctx.REDIRECT_APPEND() != null) {
            return RedirectOp.APPEND;
        }
        if (ctx.REDIRECT_IN() != null) {
            return RedirectOp.IN;
        }
        return RedirectOp.ERR_OUT;
    }

    private Expr buildShellTarget(PatchworkParser.ShellTargetContext ctx) {
        SourcePosition pos = position(ctx);
        if (ctx.SHELL_WORD() != null) {
            return new Expr.StringLiteral(pos, List.of(new StringPart.Text(ctx.SHELL_WORD().getText())));
        }
        if (ctx.stringLiteral() != null) {
            return buildString(ctx.stringLiteral());
        }
        return new Expr.CommandSubstitution(pos, buildShellChain(ctx.shellChain()));
    }

    private Expr buildShellCommand(PatchworkParser.ShellCommandContext ctx) {
        List<CommandArg> arguments = new ArrayList<>();
        for (PatchworkParser.ShellArgumentContext argument : ctx.shellArgument()) {
            if (argument.SHELL_WORD() != null) {
                arguments.add(new CommandArg.Literal(argument.SHELL_WORD().getText()));
            } else if (argument.stringLiteral() != null) {
                arguments.add(new CommandArg.Str(buildString(argument.stringLiteral())));
            } else {
                arguments.add(new CommandArg.Substitution(buildShellChain(argument.shellChain())));
            }
        }
        return new Expr.BareCommand(position(ctx), ctx.SHELL_WORD().getText(), arguments);
    }

    private SourcePosition position(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return new SourcePosition(start.getLine(), start.getCharPositionInLine() + 1);
    }

    /** Raw source text of a rule, whitespace included. */
    private static String sourceText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (stop == null || stop.getStopIndex() < start.getStartIndex()) {
            return "";
        }
        return start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    }

    private ParseException unexpected(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return new ParseException(sourceName, start.getLine(), start.getCharPositionInLine() + 1,
                start.getText(), "unexpected " + ctx.getClass().getSimpleName());
    }
}
