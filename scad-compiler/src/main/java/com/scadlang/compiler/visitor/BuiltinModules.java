package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.decl.ModuleParameter;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.geometry.*;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.ModuleInstantiation;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.extract.ArgumentBinder;
import com.scadlang.compiler.extract.BoundArguments;
import com.scadlang.compiler.extract.ConstantFolder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内置模块表：签名与按名字特化
 *
 * <p>实参不是常量时，特化节点取默认值，原始实参仍保留在节点上。</p>
 */
public final class BuiltinModules {

    /**
     * 内置模块签名：形参顺序、每个形参可接受的值类型名与说明
     */
    public static final class Signature {
        private final String name;
        private final List<ModuleParameter> parameters;
        private final Map<String, Set<String>> acceptedTypes;
        private final String description;

        Signature(String name, String description, String... params) {
            this.name = name;
            this.description = description;
            List<ModuleParameter> list = new ArrayList<>();
            Map<String, Set<String>> types = new LinkedHashMap<>();
            for (String param : params) {
                // 形如 "size:number|vector"
                String[] parts = param.split(":");
                list.add(new ModuleParameter(parts[0], null, Location.UNKNOWN));
                types.put(parts[0], new LinkedHashSet<>(Arrays.asList(parts[1].split("\\|"))));
            }
            this.parameters = Collections.unmodifiableList(list);
            this.acceptedTypes = Collections.unmodifiableMap(types);
        }

        public String getName() {
            return name;
        }

        public List<ModuleParameter> getParameters() {
            return parameters;
        }

        /** 形参可接受的值类型名，按优先顺序排列；未知形参返回 null */
        public Set<String> getAcceptedTypes(String parameter) {
            return acceptedTypes.get(parameter);
        }

        public String getDescription() {
            return description;
        }

        /** 形如 {@code cube(size, center)} 的签名文本 */
        public String toDisplayString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(parameters.get(i).getName());
            }
            return sb.append(')').toString();
        }
    }

    private static final Map<String, Signature> SIGNATURES = new LinkedHashMap<>();

    static {
        register(new Signature("translate", "Translates children along vector v", "v:vector"));
        register(new Signature("rotate", "Rotates children by angle a about axis v, or by [x, y, z] degrees",
                "a:number|vector", "v:vector"));
        register(new Signature("scale", "Scales children by factor v", "v:number|vector"));
        register(new Signature("mirror", "Mirrors children on the plane through the origin with normal v",
                "v:vector"));
        register(new Signature("multmatrix", "Applies the 4x4 affine matrix m to children", "m:vector"));
        register(new Signature("color", "Colors children by name, hex string or RGBA vector",
                "c:string|vector", "alpha:number"));
        register(new Signature("offset", "Offsets 2D children by radius r or distance delta",
                "r:number", "delta:number", "chamfer:boolean"));
        register(new Signature("cube", "Creates a cube", "size:number|vector", "center:boolean"));
        register(new Signature("sphere", "Creates a sphere", "r:number", "d:number"));
        register(new Signature("cylinder", "Creates a cylinder or cone",
                "h:number", "r1:number", "r2:number", "center:boolean",
                "r:number", "d:number", "d1:number", "d2:number"));
        register(new Signature("square", "Creates a rectangle", "size:number|vector", "center:boolean"));
        register(new Signature("circle", "Creates a circle", "r:number", "d:number"));
        for (CsgOperator op : CsgOperator.values()) {
            register(new Signature(op.getModuleName(), "CSG " + op.getModuleName() + " of children"));
        }
    }

    private static void register(Signature signature) {
        SIGNATURES.put(signature.getName(), signature);
    }

    /**
     * 查找内置模块签名，非内置模块返回 null
     */
    public static Signature getSignature(String name) {
        return SIGNATURES.get(name);
    }

    public static Set<String> getNames() {
        return Collections.unmodifiableSet(SIGNATURES.keySet());
    }

    private final ArgumentBinder binder;

    public BuiltinModules(ArgumentBinder binder) {
        this.binder = binder;
    }

    /**
     * 生成实例化节点：内置模块特化为对应节点，其余为通用 {@link ModuleInstantiation}
     */
    public InstantiationNode instantiate(String name, Location location, List<Parameter> args,
                                         List<AstNode> children, String modifier) {
        Signature signature = SIGNATURES.get(name);
        if (signature == null) {
            binder.checkDuplicates(args);
            return new ModuleInstantiation(location, name, args, children, modifier);
        }
        BoundArguments bound = binder.bind(signature.getParameters(), args);
        switch (name) {
            case "translate":
                return new Translate(location, args, children, modifier, vector3(bound.get("v"), 0, new double[3]));
            case "mirror":
                return new Mirror(location, args, children, modifier,
                        vector3(bound.get("v"), 0, new double[]{1, 0, 0}));
            case "scale":
                return new Scale(location, args, children, modifier, scaleVector(bound.get("v")));
            case "rotate":
                return rotate(location, args, children, modifier, bound);
            case "multmatrix":
                return new Multmatrix(location, args, children, modifier, matrix(bound.get("m")));
            case "color":
                return color(location, args, children, modifier, bound);
            case "offset": {
                Double r = ConstantFolder.foldNumber(bound.get("r"));
                return new Offset(location, args, children, modifier, r,
                        number(bound.get("delta"), 0), bool(bound.get("chamfer"), false));
            }
            case "cube":
                return new Cube(location, args, children, modifier,
                        size(bound.get("size"), 3), bool(bound.get("center"), false));
            case "square":
                return new Square(location, args, children, modifier,
                        size(bound.get("size"), 2), bool(bound.get("center"), false));
            case "sphere":
                return new Sphere(location, args, children, modifier, radius(bound.get("r"), bound.get("d"), 1));
            case "circle":
                return new Circle(location, args, children, modifier, radius(bound.get("r"), bound.get("d"), 1));
            case "cylinder":
                return cylinder(location, args, children, modifier, bound);
            default:
                return new CsgOperation(location, args, children, modifier, CsgOperator.fromModuleName(name));
        }
    }

    private static Rotate rotate(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                                 BoundArguments bound) {
        Expression a = bound.get("a");
        double[] angles = ConstantFolder.foldVector(a);
        if (angles != null) {
            double[] padded = pad(angles, 3, 0);
            return new Rotate(location, args, children, modifier,
                    AngleSpec.ofVector(padded[0], padded[1], padded[2]), null);
        }
        return new Rotate(location, args, children, modifier, AngleSpec.ofScalar(number(a, 0)),
                vector3(bound.get("v"), 0, new double[]{0, 0, 1}));
    }

    private static Color color(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                               BoundArguments bound) {
        Expression c = bound.get("c");
        double alpha = number(bound.get("alpha"), 1);
        String name = ConstantFolder.foldString(c);
        if (name != null) {
            return new Color(location, args, children, modifier, name, null, alpha);
        }
        double[] rgb = ConstantFolder.foldVector(c);
        if (rgb != null && rgb.length >= 3) {
            double[] rgba = pad(rgb, 4, alpha);
            return new Color(location, args, children, modifier, null, rgba, rgba[3]);
        }
        return new Color(location, args, children, modifier, null, null, alpha);
    }

    private static Cylinder cylinder(Location location, List<Parameter> args, List<AstNode> children,
                                     String modifier, BoundArguments bound) {
        double base = radius(bound.get("r"), bound.get("d"), 1);
        double r1 = radius(bound.get("r1"), bound.get("d1"), base);
        double r2 = radius(bound.get("r2"), bound.get("d2"), base);
        return new Cylinder(location, args, children, modifier,
                number(bound.get("h"), 1), r1, r2, bool(bound.get("center"), false));
    }

    // ============ 参数归一化 ============

    /**
     * 三维向量：不足三个分量时以 fill 补齐；不是常量向量时返回默认值
     */
    static double[] vector3(Expression expr, double fill, double[] fallback) {
        double[] values = ConstantFolder.foldVector(expr);
        return values != null ? pad(values, 3, fill) : fallback;
    }

    static double[] scaleVector(Expression expr) {
        Double scalar = ConstantFolder.foldNumber(expr);
        if (scalar != null) {
            return new double[]{scalar, scalar, scalar};
        }
        return vector3(expr, 1, new double[]{1, 1, 1});
    }

    private static double[] size(Expression expr, int dimensions) {
        Double scalar = ConstantFolder.foldNumber(expr);
        double[] result = new double[dimensions];
        if (scalar != null) {
            Arrays.fill(result, scalar);
            return result;
        }
        double[] values = ConstantFolder.foldVector(expr);
        if (values != null) {
            return pad(values, dimensions, 1);
        }
        Arrays.fill(result, 1);
        return result;
    }

    private static double radius(Expression r, Expression d, double fallback) {
        Double radius = ConstantFolder.foldNumber(r);
        if (radius != null) {
            return radius;
        }
        Double diameter = ConstantFolder.foldNumber(d);
        return diameter != null ? diameter / 2 : fallback;
    }

    /**
     * 4x4 矩阵，缺失元素取单位矩阵
     */
    private static double[][] matrix(Expression expr) {
        double[][] m = new double[4][4];
        for (int i = 0; i < 4; i++) {
            m[i][i] = 1;
        }
        Object value = expr != null ? ConstantFolder.fold(expr) : null;
        if (!(value instanceof List)) {
            return m;
        }
        List<?> rows = (List<?>) value;
        for (int i = 0; i < Math.min(4, rows.size()); i++) {
            if (!(rows.get(i) instanceof List)) {
                continue;
            }
            List<?> row = (List<?>) rows.get(i);
            for (int j = 0; j < Math.min(4, row.size()); j++) {
                if (row.get(j) instanceof Double) {
                    m[i][j] = (Double) row.get(j);
                }
            }
        }
        return m;
    }

    private static double[] pad(double[] values, int length, double fill) {
        double[] result = new double[length];
        Arrays.fill(result, fill);
        System.arraycopy(values, 0, result, 0, Math.min(length, values.length));
        return result;
    }

    private static double number(Expression expr, double fallback) {
        Double value = ConstantFolder.foldNumber(expr);
        return value != null ? value : fallback;
    }

    private static boolean bool(Expression expr, boolean fallback) {
        Boolean value = ConstantFolder.foldBoolean(expr);
        return value != null ? value : fallback;
    }
}
