package com.scadlang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.ast.decl.*;
import com.scadlang.compiler.ast.expr.*;
import com.scadlang.compiler.ast.geometry.*;
import com.scadlang.compiler.ast.stmt.*;
import com.scadlang.ide.IdeJson;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * AST 到 JSON 的序列化
 *
 * <p>每个节点输出 {@code type}（节点种类的小写名）与 {@code range}，其余字段按节点类型展开。</p>
 */
public class AstJsonWriter implements AstVisitor<JsonElement, Void> {

    public JsonArray write(List<AstNode> nodes) {
        JsonArray array = new JsonArray();
        for (AstNode node : nodes) {
            array.add(node(node));
        }
        return array;
    }

    private JsonElement node(AstNode node) {
        return node == null ? JsonNull.INSTANCE : node.accept(this, null);
    }

    private JsonObject base(AstNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("type", node.getKind().name().toLowerCase(Locale.ROOT));
        json.add("range", IdeJson.range(node.getLocation()));
        return json;
    }

    private JsonArray nodes(List<? extends AstNode> nodes) {
        JsonArray array = new JsonArray();
        for (AstNode node : nodes) {
            array.add(node(node));
        }
        return array;
    }

    private JsonArray parameters(List<ModuleParameter> parameters) {
        JsonArray array = new JsonArray();
        for (ModuleParameter parameter : parameters) {
            JsonObject json = new JsonObject();
            json.addProperty("name", parameter.getName());
            if (parameter.hasDefault()) {
                json.add("default", node(parameter.getDefaultValue()));
            }
            array.add(json);
        }
        return array;
    }

    private JsonArray arguments(List<Parameter> args) {
        JsonArray array = new JsonArray();
        for (Parameter arg : args) {
            JsonObject json = new JsonObject();
            if (arg.isNamed()) {
                json.addProperty("name", arg.getName());
            }
            json.add("value", node(arg.getValue()));
            array.add(json);
        }
        return array;
    }

    private JsonArray forClauses(List<ForLoopVariable> variables) {
        JsonArray array = new JsonArray();
        for (ForLoopVariable variable : variables) {
            JsonObject json = new JsonObject();
            json.addProperty("variable", variable.getName());
            json.add("range", node(variable.getRange()));
            array.add(json);
        }
        return array;
    }

    private JsonObject assignments(Map<String, Expression> assignments) {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, Expression> entry : assignments.entrySet()) {
            json.add(entry.getKey(), node(entry.getValue()));
        }
        return json;
    }

    private static JsonArray numbers(double[] values) {
        JsonArray array = new JsonArray();
        for (double value : values) {
            array.add(value);
        }
        return array;
    }

    private JsonObject instantiation(InstantiationNode node) {
        JsonObject json = base(node);
        json.addProperty("name", node.getName());
        if (node.getModifier() != null) {
            json.addProperty("modifier", node.getModifier());
        }
        json.add("arguments", arguments(node.getArgs()));
        json.add("children", nodes(node.getChildren()));
        return json;
    }

    // ============ 定义 ============

    @Override
    public JsonElement visitModuleDefinition(ModuleDefinition node, Void context) {
        JsonObject json = base(node);
        json.addProperty("name", node.getName());
        json.add("parameters", parameters(node.getParameters()));
        json.add("body", nodes(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitFunctionDefinition(FunctionDefinition node, Void context) {
        JsonObject json = base(node);
        json.addProperty("name", node.getName());
        json.add("parameters", parameters(node.getParameters()));
        json.add("value", node(node.getValueExpr()));
        return json;
    }

    @Override
    public JsonElement visitAssignmentStatement(AssignmentStatement node, Void context) {
        JsonObject json = base(node);
        json.addProperty("name", node.getName());
        json.add("value", node(node.getValue()));
        return json;
    }

    @Override
    public JsonElement visitIncludeStatement(IncludeStatement node, Void context) {
        JsonObject json = base(node);
        json.addProperty("path", node.getPath());
        return json;
    }

    @Override
    public JsonElement visitUseStatement(UseStatement node, Void context) {
        JsonObject json = base(node);
        json.addProperty("path", node.getPath());
        return json;
    }

    // ============ 实例化 ============

    @Override
    public JsonElement visitModuleInstantiation(ModuleInstantiation node, Void context) {
        return instantiation(node);
    }

    @Override
    public JsonElement visitTranslate(Translate node, Void context) {
        JsonObject json = instantiation(node);
        json.add("v", numbers(node.getV()));
        return json;
    }

    @Override
    public JsonElement visitRotate(Rotate node, Void context) {
        JsonObject json = instantiation(node);
        AngleSpec a = node.getA();
        json.add("a", a.isScalar() ? new JsonPrimitive(a.getScalar()) : numbers(a.getVector()));
        if (node.getV() != null) {
            json.add("v", numbers(node.getV()));
        }
        return json;
    }

    @Override
    public JsonElement visitScale(Scale node, Void context) {
        JsonObject json = instantiation(node);
        json.add("v", numbers(node.getV()));
        return json;
    }

    @Override
    public JsonElement visitMirror(Mirror node, Void context) {
        JsonObject json = instantiation(node);
        json.add("v", numbers(node.getV()));
        return json;
    }

    @Override
    public JsonElement visitMultmatrix(Multmatrix node, Void context) {
        JsonObject json = instantiation(node);
        JsonArray rows = new JsonArray();
        for (double[] row : node.getM()) {
            rows.add(numbers(row));
        }
        json.add("m", rows);
        return json;
    }

    @Override
    public JsonElement visitColor(Color node, Void context) {
        JsonObject json = instantiation(node);
        if (node.getColorName() != null) {
            json.addProperty("c", node.getColorName());
        }
        if (node.getRgba() != null) {
            json.add("rgba", numbers(node.getRgba()));
        }
        json.addProperty("alpha", node.getAlpha());
        return json;
    }

    @Override
    public JsonElement visitOffset(Offset node, Void context) {
        JsonObject json = instantiation(node);
        if (node.getR() != null) {
            json.addProperty("r", node.getR());
        }
        json.addProperty("delta", node.getDelta());
        json.addProperty("chamfer", node.isChamfer());
        return json;
    }

    @Override
    public JsonElement visitCube(Cube node, Void context) {
        JsonObject json = instantiation(node);
        json.add("size", numbers(node.getSize()));
        json.addProperty("center", node.isCenter());
        return json;
    }

    @Override
    public JsonElement visitSphere(Sphere node, Void context) {
        JsonObject json = instantiation(node);
        json.addProperty("radius", node.getRadius());
        return json;
    }

    @Override
    public JsonElement visitCylinder(Cylinder node, Void context) {
        JsonObject json = instantiation(node);
        json.addProperty("height", node.getHeight());
        json.addProperty("r1", node.getR1());
        json.addProperty("r2", node.getR2());
        json.addProperty("center", node.isCenter());
        return json;
    }

    @Override
    public JsonElement visitSquare(Square node, Void context) {
        JsonObject json = instantiation(node);
        json.add("size", numbers(node.getSize()));
        json.addProperty("center", node.isCenter());
        return json;
    }

    @Override
    public JsonElement visitCircle(Circle node, Void context) {
        JsonObject json = instantiation(node);
        json.addProperty("radius", node.getRadius());
        return json;
    }

    @Override
    public JsonElement visitCsgOperation(CsgOperation node, Void context) {
        JsonObject json = instantiation(node);
        json.addProperty("operation", node.getOperation().getModuleName());
        return json;
    }

    // ============ 控制流 ============

    @Override
    public JsonElement visitIf(IfNode node, Void context) {
        JsonObject json = base(node);
        json.add("condition", node(node.getCondition()));
        json.add("then", nodes(node.getThenBranch()));
        if (node.hasElse()) {
            json.add("else", nodes(node.getElseBranch()));
        }
        return json;
    }

    @Override
    public JsonElement visitForLoop(ForLoop node, Void context) {
        JsonObject json = base(node);
        json.add("variables", forClauses(node.getVariables()));
        json.add("body", nodes(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitLet(Let node, Void context) {
        JsonObject json = base(node);
        json.add("assignments", assignments(node.getAssignments()));
        json.add("body", nodes(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitEach(Each node, Void context) {
        JsonObject json = base(node);
        json.add("expression", node(node.getExpression()));
        return json;
    }

    @Override
    public JsonElement visitAssign(Assign node, Void context) {
        JsonObject json = base(node);
        JsonObject assignments = new JsonObject();
        for (Assignment assignment : node.getAssignments()) {
            assignments.add(assignment.getVariable(), node(assignment.getValue()));
        }
        json.add("assignments", assignments);
        json.add("body", nodes(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitEchoStatement(EchoStatement node, Void context) {
        JsonObject json = base(node);
        json.add("arguments", arguments(node.getArgs()));
        json.add("children", nodes(node.getChildren()));
        return json;
    }

    @Override
    public JsonElement visitAssertStatement(AssertStatement node, Void context) {
        JsonObject json = base(node);
        json.add("condition", node(node.getCondition()));
        if (node.getMessage() != null) {
            json.add("message", node(node.getMessage()));
        }
        json.add("children", nodes(node.getChildren()));
        return json;
    }

    // ============ 表达式 ============

    @Override
    public JsonElement visitLiteral(Literal node, Void context) {
        JsonObject json = base(node);
        json.addProperty("literalKind", node.getLiteralKind().name().toLowerCase(Locale.ROOT));
        Object value = node.getValue();
        if (value instanceof Double) {
            json.addProperty("value", (Double) value);
        } else if (value instanceof Boolean) {
            json.addProperty("value", (Boolean) value);
        } else if (value != null) {
            json.addProperty("value", value.toString());
        } else {
            json.add("value", JsonNull.INSTANCE);
        }
        return json;
    }

    @Override
    public JsonElement visitIdentifier(Identifier node, Void context) {
        JsonObject json = base(node);
        json.addProperty("name", node.getName());
        return json;
    }

    @Override
    public JsonElement visitVariable(Variable node, Void context) {
        JsonObject json = base(node);
        json.addProperty("name", node.getName());
        return json;
    }

    @Override
    public JsonElement visitUnaryExpr(UnaryExpr node, Void context) {
        JsonObject json = base(node);
        json.addProperty("operator", node.getOperator().toSourceString());
        json.add("operand", node(node.getOperand()));
        return json;
    }

    @Override
    public JsonElement visitBinaryExpr(BinaryExpr node, Void context) {
        JsonObject json = base(node);
        json.addProperty("operator", node.getOperator().toSourceString());
        json.add("left", node(node.getLeft()));
        json.add("right", node(node.getRight()));
        return json;
    }

    @Override
    public JsonElement visitConditionalExpr(ConditionalExpr node, Void context) {
        JsonObject json = base(node);
        json.add("condition", node(node.getCondition()));
        json.add("then", node(node.getThenExpr()));
        json.add("else", node(node.getElseExpr()));
        return json;
    }

    @Override
    public JsonElement visitRangeExpr(RangeExpr node, Void context) {
        JsonObject json = base(node);
        json.add("start", node(node.getStart()));
        json.add("end", node(node.getEnd()));
        json.add("step", node(node.getStep()));
        json.addProperty("explicitStep", node.hasExplicitStep());
        return json;
    }

    @Override
    public JsonElement visitVectorExpr(VectorExpr node, Void context) {
        JsonObject json = base(node);
        json.add("elements", nodes(node.getElements()));
        return json;
    }

    @Override
    public JsonElement visitListComprehension(ListComprehension node, Void context) {
        JsonObject json = base(node);
        json.add("for", forClauses(node.getForClauses()));
        if (node.getIfClause() != null) {
            json.add("if", node(node.getIfClause()));
        }
        json.add("element", node(node.getElement()));
        return json;
    }

    @Override
    public JsonElement visitLetExpr(LetExpr node, Void context) {
        JsonObject json = base(node);
        json.add("assignments", assignments(node.getAssignments()));
        json.add("body", node(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitFunctionLiteral(FunctionLiteral node, Void context) {
        JsonObject json = base(node);
        json.add("parameters", parameters(node.getParameters()));
        json.add("body", node(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitCallExpr(CallExpr node, Void context) {
        JsonObject json = base(node);
        json.add("callee", node(node.getCallee()));
        json.add("arguments", arguments(node.getArgs()));
        return json;
    }

    @Override
    public JsonElement visitIndexExpr(IndexExpr node, Void context) {
        JsonObject json = base(node);
        json.add("array", node(node.getArray()));
        json.add("index", node(node.getIndex()));
        return json;
    }

    @Override
    public JsonElement visitMemberExpr(MemberExpr node, Void context) {
        JsonObject json = base(node);
        json.add("object", node(node.getObject()));
        json.addProperty("property", node.getProperty());
        return json;
    }

    @Override
    public JsonElement visitEchoExpr(EchoExpr node, Void context) {
        JsonObject json = base(node);
        json.add("arguments", arguments(node.getArgs()));
        if (node.getBody() != null) {
            json.add("body", node(node.getBody()));
        }
        return json;
    }

    @Override
    public JsonElement visitAssertExpr(AssertExpr node, Void context) {
        JsonObject json = base(node);
        json.add("condition", node(node.getCondition()));
        if (node.getMessage() != null) {
            json.add("message", node(node.getMessage()));
        }
        if (node.getBody() != null) {
            json.add("body", node(node.getBody()));
        }
        return json;
    }

    @Override
    public JsonElement visitErrorNode(ErrorNode node, Void context) {
        JsonObject json = base(node);
        json.addProperty("code", node.getCode().getId());
        json.addProperty("message", node.getMessage());
        if (node.getOriginalNodeType() != null) {
            json.addProperty("originalNodeType", node.getOriginalNodeType());
        }
        if (node.getCstText() != null) {
            json.addProperty("cstText", node.getCstText());
        }
        return json;
    }
}
