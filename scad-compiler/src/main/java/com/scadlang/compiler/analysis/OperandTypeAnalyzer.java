package com.scadlang.compiler.analysis;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstNodes;
import com.scadlang.compiler.ast.expr.BinaryExpr;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.Literal;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.DiagnosticCollector;
import com.scadlang.compiler.diagnostic.DiagnosticSource;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.diagnostic.Severity;
import com.scadlang.compiler.extract.ArgumentBinder;
import com.scadlang.compiler.visitor.BuiltinModules;

import java.util.List;
import java.util.Set;

/**
 * 运算数与内置模块实参的类型检查，产生 SEMANTIC 诊断
 *
 * <ul>
 *   <li>算术运算两侧为不同的标量类型：INVALID_OPERATION，定位到需要转换的运算数</li>
 *   <li>字面量实参不符合内置模块形参类型：INVALID_ARGUMENTS，定位到实参值</li>
 * </ul>
 */
public class OperandTypeAnalyzer {

    private final TypeChecker typeChecker;
    private final DiagnosticCollector diagnostics;

    public OperandTypeAnalyzer(TypeChecker typeChecker, DiagnosticCollector diagnostics) {
        this.typeChecker = typeChecker;
        this.diagnostics = diagnostics;
    }

    public void analyze(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            AstNodes.walk(node, this::check);
        }
    }

    private void check(AstNode node) {
        if (node instanceof BinaryExpr) {
            checkBinary((BinaryExpr) node);
        } else if (node instanceof InstantiationNode) {
            checkArguments((InstantiationNode) node);
        }
    }

    private void checkBinary(BinaryExpr expr) {
        if (!expr.getOperator().isArithmetic()) {
            return;
        }
        ValueType left = typeChecker.getType(expr.getLeft());
        ValueType right = typeChecker.getType(expr.getRight());
        if (!left.isScalar() || !right.isScalar() || typeChecker.isAssignable(left, right)) {
            return;
        }
        // 字符串一侧优先：另一侧转为字符串；否则布尔一侧转为数值
        Expression offending;
        ValueType expected;
        if (left == ValueType.STRING || right == ValueType.STRING) {
            offending = left == ValueType.STRING ? expr.getRight() : expr.getLeft();
            expected = ValueType.STRING;
        } else {
            offending = left == ValueType.BOOLEAN ? expr.getLeft() : expr.getRight();
            expected = ValueType.NUMBER;
        }
        ValueType actual = typeChecker.getType(offending);
        diagnostics.record(new Diagnostic(
                "Operator '" + expr.getOperator().toSourceString() + "' cannot combine "
                        + left.getDisplayName() + " and " + right.getDisplayName(),
                ErrorCode.INVALID_OPERATION, Severity.ERROR, offending.getLocation(), DiagnosticSource.SEMANTIC,
                expected.getDisplayName(), actual.getDisplayName()));
    }

    private void checkArguments(InstantiationNode node) {
        BuiltinModules.Signature signature = BuiltinModules.getSignature(node.getName());
        if (signature == null) {
            return;
        }
        List<Parameter> args = node.getArgs();
        List<String> targets = ArgumentBinder.targets(signature.getParameters(), args);
        for (int i = 0; i < args.size(); i++) {
            Parameter arg = args.get(i);
            String name = targets.get(i);
            if (name == null || !(arg.getValue() instanceof Literal)) {
                continue;
            }
            Set<String> accepted = signature.getAcceptedTypes(name);
            ValueType actual = typeChecker.getType(arg.getValue());
            if (accepted == null || actual == ValueType.UNDEF || accepted.contains(actual.getDisplayName())) {
                continue;
            }
            String expected = accepted.iterator().next();
            diagnostics.record(new Diagnostic(
                    "Argument '" + name + "' of " + node.getName() + "() expects " + String.join(" or ", accepted)
                            + " but got " + actual.getDisplayName(),
                    ErrorCode.INVALID_ARGUMENTS, Severity.ERROR, arg.getValue().getLocation(),
                    DiagnosticSource.SEMANTIC, expected, actual.getDisplayName()));
        }
    }
}
