package com.scadlang.compiler.extract;

import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.decl.ModuleParameter;
import com.scadlang.compiler.ast.expr.*;
import com.scadlang.compiler.ast.stmt.ForLoopVariable;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.diagnostic.DiagnosticCollector;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.cst.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 从 CST 表达式产生式重建 AST 表达式
 *
 * <p>CST 中的多运算符链按出现顺序平铺，这里用优先级爬升法重建结合关系：</p>
 * <pre>
 *   ^           8 右结合
 *   一元 ! - +  7
 *   * / %       6
 *   + -         5
 *   &lt; &lt;= &gt; &gt;=   4
 *   == !=       3
 *   &amp;&amp;          2
 *   ||          1
 *   ?:          三元，右结合
 * </pre>
 *
 * <p>无法重建的子树返回 {@link ErrorNode}，不会中断外层语句的转换。
 * 已由 CST 的 ERROR / MISSING 节点表示的问题不再重复记录诊断。</p>
 */
public class ExpressionReconstructor {

    private final DiagnosticCollector diagnostics;
    private final ParameterExtractor parameterExtractor;

    public ExpressionReconstructor(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
        this.parameterExtractor = new ParameterExtractor(this, diagnostics);
    }

    public ParameterExtractor getParameterExtractor() {
        return parameterExtractor;
    }

    /**
     * 重建表达式；字段缺失时以父节点位置生成错误节点
     */
    public Expression reconstruct(SyntaxNode node, SyntaxNode parent) {
        if (node != null) {
            return reconstruct(node);
        }
        Location at = LocationUtils.getLocation(parent);
        if (parent == null || !parent.hasError()) {
            diagnostics.error(ErrorCode.MISSING_FIELD, "Missing expression", at);
        }
        return new ErrorNode(at, "Missing expression", ErrorCode.MISSING_FIELD,
                parent != null ? parent.getType() : null, "");
    }

    public Expression reconstruct(SyntaxNode node) {
        if (node.isMissing()) {
            return silentError(node, "Missing " + node.getType(), ErrorCode.SYNTAX_ERROR);
        }
        Location at = LocationUtils.getLocation(node);
        switch (node.getType()) {
            case "number":
                return number(node, at);
            case "string":
                return string(node, at);
            case "boolean":
                return new Literal(at, Literal.LiteralKind.BOOLEAN, "true".equals(node.getText()));
            case "undef":
                return new Literal(at, Literal.LiteralKind.UNDEF, null);
            case "identifier":
                return new Identifier(at, node.getText());
            case "special_variable":
                return new Variable(at, node.getText());
            case SyntaxNode.ERROR:
                return silentError(node, "Invalid expression", ErrorCode.SYNTAX_ERROR);
            case "parenthesized_expression":
                return parenthesized(node);
            case "unary_expression":
                return unary(node, at);
            case "binary_expression":
                return binary(node).expr;
            case "conditional_expression":
                return new ConditionalExpr(at,
                        reconstruct(node.getChildForFieldName("condition"), node),
                        reconstruct(node.getChildForFieldName("consequence"), node),
                        reconstruct(node.getChildForFieldName("alternative"), node));
            case "call_expression":
                return new CallExpr(at,
                        reconstruct(node.getChildForFieldName("function"), node),
                        parameterExtractor.extractArguments(node.getChildForFieldName("arguments")));
            case "index_expression":
                return new IndexExpr(at,
                        reconstruct(node.getChildForFieldName("array"), node),
                        reconstruct(node.getChildForFieldName("index"), node));
            case "member_expression":
                return member(node, at);
            case "vector_expression":
                return vector(node, at);
            case "range_expression":
                return range(node, at);
            case "list_comprehension":
                return listComprehension(node, at);
            case "let_expression":
                return letExpression(node, at);
            case "function_literal":
                return new FunctionLiteral(at,
                        parameterExtractor.extractParameters(node.getChildForFieldName("parameters")),
                        reconstruct(node.getChildForFieldName("body"), node));
            case "echo_expression":
                return new EchoExpr(at,
                        parameterExtractor.extractArguments(node.getChildForFieldName("arguments")),
                        optional(node.getChildForFieldName("body")));
            case "assert_expression":
                return assertExpression(node, at);
            case "each_statement":
                return new Each(at, reconstruct(node.getChildForFieldName("value"), node));
            default:
                diagnostics.error(ErrorCode.UNHANDLED_CONSTRUCT,
                        "Unsupported expression '" + node.getType() + "'", at);
                return new ErrorNode(at, "Unsupported expression", ErrorCode.UNHANDLED_CONSTRUCT,
                        node.getType(), node.getText());
        }
    }

    private Expression optional(SyntaxNode node) {
        return node != null ? reconstruct(node) : null;
    }

    // ============ 字面量 ============

    private Expression number(SyntaxNode node, Location at) {
        String text = node.getText();
        try {
            return new Literal(at, Literal.LiteralKind.NUMBER, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            String message = "Malformed number '" + text + "'";
            diagnostics.error(ErrorCode.MALFORMED_LITERAL, message, at);
            return new ErrorNode(at, message, ErrorCode.MALFORMED_LITERAL, node.getType(), text);
        }
    }

    private Expression string(SyntaxNode node, Location at) {
        List<String> invalid = new ArrayList<>(0);
        String value = StringUnescaper.unescape(StringUnescaper.stripQuotes(node.getText()), invalid);
        for (String sequence : invalid) {
            diagnostics.warning(ErrorCode.INVALID_ESCAPE_SEQUENCE,
                    "Invalid escape sequence '" + sequence + "'", at);
        }
        return new Literal(at, Literal.LiteralKind.STRING, value);
    }

    // ============ 运算符 ============

    private Expression parenthesized(SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.isEmpty()) {
            return silentError(node, "Empty parentheses", ErrorCode.SYNTAX_ERROR);
        }
        return reconstruct(named.get(0));
    }

    private Expression unary(SyntaxNode node, Location at) {
        SyntaxNode operator = node.getChildForFieldName("operator");
        UnaryExpr.UnaryOp op = operator != null ? UnaryExpr.UnaryOp.fromSource(operator.getText()) : null;
        if (op == null) {
            return unknownOperator(node, operator);
        }
        return new UnaryExpr(at, op, reconstruct(node.getChildForFieldName("operand"), node));
    }

    /**
     * 运算链中的操作数：AST 表达式及其来源 CST 节点
     */
    private static final class Operand {
        final Expression expr;
        final SyntaxNode cst;

        Operand(Expression expr, SyntaxNode cst) {
            this.expr = expr;
            this.cst = cst;
        }
    }

    /**
     * 平铺的运算链与爬升游标
     */
    private static final class Chain {
        final List<Operand> operands = new ArrayList<>();
        final List<BinaryExpr.BinaryOp> operators = new ArrayList<>();
        int index;
    }

    private Operand binary(SyntaxNode node) {
        Chain chain = new Chain();
        List<SyntaxNode> parts = new ArrayList<>();
        if (node.getChildForFieldName("operator") != null) {
            parts.add(node.getChildForFieldName("left"));
            parts.add(node.getChildForFieldName("operator"));
            parts.add(node.getChildForFieldName("right"));
        } else {
            parts.addAll(node.getChildren());
        }
        for (int i = 0; i < parts.size(); i++) {
            SyntaxNode part = parts.get(i);
            if (i % 2 == 0) {
                chain.operands.add(new Operand(reconstruct(part, node), part));
                continue;
            }
            BinaryExpr.BinaryOp op = part != null ? BinaryExpr.BinaryOp.fromSource(part.getText()) : null;
            if (op == null) {
                return new Operand(unknownOperator(node, part), node);
            }
            chain.operators.add(op);
        }
        if (chain.operands.size() != chain.operators.size() + 1) {
            return new Operand(silentError(node, "Incomplete binary expression", ErrorCode.SYNTAX_ERROR), node);
        }
        return climb(chain, 0);
    }

    private Operand climb(Chain chain, int minPrecedence) {
        Operand left = chain.operands.get(chain.index);
        while (chain.index < chain.operators.size()) {
            BinaryExpr.BinaryOp op = chain.operators.get(chain.index);
            if (op.getPrecedence() < minPrecedence) {
                break;
            }
            chain.index++;
            int next = op.isRightAssociative() ? op.getPrecedence() : op.getPrecedence() + 1;
            Operand right = climb(chain, next);
            left = new Operand(combine(left, op, right.expr), null);
        }
        return left;
    }

    /**
     * 组合二元表达式；乘方的左操作数是未加括号的一元表达式时，
     * 一元运算符改为作用在整个乘方上：-a^2 即 -(a^2)
     */
    private Expression combine(Operand left, BinaryExpr.BinaryOp op, Expression right) {
        if (op.getPrecedence() > UnaryExpr.UnaryOp.PRECEDENCE
                && left.cst != null && "unary_expression".equals(left.cst.getType())
                && left.expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) left.expr;
            Operand inner = new Operand(unary.getOperand(), left.cst.getChildForFieldName("operand"));
            Expression rebound = combine(inner, op, right);
            return new UnaryExpr(LocationUtils.span(unary.getLocation(), right.getLocation()),
                    unary.getOperator(), rebound);
        }
        return new BinaryExpr(LocationUtils.span(left.expr.getLocation(), right.getLocation()),
                left.expr, op, right);
    }

    private ErrorNode unknownOperator(SyntaxNode node, SyntaxNode operator) {
        String text = operator != null ? operator.getText() : "";
        String message = "Unknown operator '" + text + "'";
        Location at = LocationUtils.getLocation(node);
        if (!node.hasError()) {
            diagnostics.error(ErrorCode.SYNTAX_ERROR, message, at);
        }
        return new ErrorNode(at, message, ErrorCode.SYNTAX_ERROR, node.getType(), node.getText());
    }

    // ============ 复合表达式 ============

    private Expression member(SyntaxNode node, Location at) {
        SyntaxNode property = node.getChildForFieldName("property");
        if (property == null || property.isMissing()) {
            return silentError(node, "Missing member name", ErrorCode.MISSING_NAME);
        }
        return new MemberExpr(at, reconstruct(node.getChildForFieldName("object"), node), property.getText());
    }

    private Expression vector(SyntaxNode node, Location at) {
        List<Expression> elements = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            elements.add(reconstruct(child));
        }
        return new VectorExpr(at, elements);
    }

    private Expression range(SyntaxNode node, Location at) {
        SyntaxNode step = node.getChildForFieldName("step");
        Expression stepExpr = step != null
                ? reconstruct(step)
                : new Literal(at, Literal.LiteralKind.NUMBER, 1.0);
        return new RangeExpr(at,
                reconstruct(node.getChildForFieldName("start"), node),
                reconstruct(node.getChildForFieldName("end"), node),
                stepExpr, step != null);
    }

    private Expression listComprehension(SyntaxNode node, Location at) {
        List<ForLoopVariable> clauses = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if ("list_comprehension_for".equals(child.getType())) {
                clauses.addAll(extractForClauses(child));
            }
        }
        return new ListComprehension(at,
                reconstruct(node.getChildForFieldName("expr"), node),
                clauses,
                optional(node.getChildForFieldName("condition")));
    }

    /**
     * for 子句：单子句时 iterator / range 直接挂在节点上，多子句时为 for_assignment 子节点
     */
    public List<ForLoopVariable> extractForClauses(SyntaxNode node) {
        List<ForLoopVariable> variables = new ArrayList<>();
        if (node.getChildForFieldName("iterator") != null || node.getChildForFieldName("range") != null) {
            variables.add(forClause(node, node));
            return variables;
        }
        for (SyntaxNode child : node.getNamedChildren()) {
            if ("for_assignment".equals(child.getType())) {
                variables.add(forClause(child, child));
            }
        }
        return variables;
    }

    private ForLoopVariable forClause(SyntaxNode clause, SyntaxNode owner) {
        SyntaxNode iterator = clause.getChildForFieldName("iterator");
        SyntaxNode range = clause.getChildForFieldName("range");
        String name = iterator != null && !iterator.isMissing() ? iterator.getText() : "";
        Location location = iterator != null && range != null
                ? LocationUtils.span(iterator, range)
                : LocationUtils.getLocation(owner);
        return new ForLoopVariable(name, reconstruct(range, owner), location);
    }

    private Expression letExpression(SyntaxNode node, Location at) {
        return new LetExpr(at, extractLetAssignments(node),
                reconstruct(node.getChildForFieldName("body"), node));
    }

    /**
     * let 绑定；缺少名字或值的子句跳过并给出警告
     */
    public LinkedHashMap<String, Expression> extractLetAssignments(SyntaxNode node) {
        LinkedHashMap<String, Expression> assignments = new LinkedHashMap<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!"let_assignment".equals(child.getType())) {
                continue;
            }
            SyntaxNode name = child.getChildForFieldName("name");
            SyntaxNode value = child.getChildForFieldName("value");
            if (name == null || value == null) {
                diagnostics.warning(ErrorCode.MISSING_FIELD, "Incomplete let assignment skipped",
                        LocationUtils.getLocation(child));
                continue;
            }
            assignments.put(name.getText(), reconstruct(value));
        }
        return assignments;
    }

    private Expression assertExpression(SyntaxNode node, Location at) {
        List<Parameter> args = parameterExtractor.extractArguments(node.getChildForFieldName("arguments"));
        Expression condition = argument(args, "condition", 0);
        if (condition == null) {
            condition = new Literal(at, Literal.LiteralKind.UNDEF, null);
        }
        return new AssertExpr(at, condition, argument(args, "message", 1),
                optional(node.getChildForFieldName("body")));
    }

    /**
     * 取具名实参，不存在时取第 position 个位置实参
     */
    public static Expression argument(List<Parameter> args, String name, int position) {
        Expression named = null;
        int seen = 0;
        Expression positional = null;
        for (Parameter arg : args) {
            if (name.equals(arg.getName())) {
                named = arg.getValue();
            } else if (!arg.isNamed()) {
                if (seen == position) {
                    positional = arg.getValue();
                }
                seen++;
            }
        }
        return named != null ? named : positional;
    }

    /**
     * 形参声明（供函数字面量与定义共用）
     */
    public List<ModuleParameter> extractParameters(SyntaxNode parameterList) {
        return parameterExtractor.extractParameters(parameterList);
    }

    /**
     * CST 已经标出问题的节点：生成错误节点但不重复记录诊断
     */
    private ErrorNode silentError(SyntaxNode node, String message, ErrorCode code) {
        return new ErrorNode(LocationUtils.getLocation(node), message, code, node.getType(), node.getText());
    }
}
