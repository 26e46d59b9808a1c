package com.scadlang.compiler.extract;

import com.scadlang.compiler.ast.decl.ModuleParameter;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.diagnostic.DiagnosticCollector;
import com.scadlang.compiler.diagnostic.ErrorCode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把调用实参绑定到形参
 *
 * <ol>
 *   <li>具名实参（含 {@code $} 特殊变量）按名字绑定；同名重复时后者覆盖前者并给出警告</li>
 *   <li>位置实参依声明顺序绑定到下一个尚未绑定的形参</li>
 *   <li>仍未绑定且有默认值的形参取默认值</li>
 * </ol>
 *
 * <p>未声明的具名实参不是错误，保留在结果中。</p>
 */
public class ArgumentBinder {

    private final DiagnosticCollector diagnostics;

    public ArgumentBinder(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    public BoundArguments bind(List<ModuleParameter> declared, List<Parameter> args) {
        checkDuplicates(args);
        List<String> targets = targets(declared, args);
        Map<String, Expression> bound = new HashMap<>();
        Map<String, Parameter> undeclared = new LinkedHashMap<>();
        List<Parameter> extras = new ArrayList<>();
        List<Parameter> surplus = new ArrayList<>();

        for (int i = 0; i < args.size(); i++) {
            Parameter arg = args.get(i);
            String target = targets.get(i);
            if (target == null) {
                surplus.add(arg);
                continue;
            }
            bound.put(target, arg.getValue());
            if (arg.isNamed() && !isDeclared(declared, target)) {
                undeclared.put(target, arg);
            }
        }

        Map<String, Expression> values = new LinkedHashMap<>();
        for (ModuleParameter parameter : declared) {
            if (bound.containsKey(parameter.getName())) {
                values.put(parameter.getName(), bound.get(parameter.getName()));
            } else if (parameter.hasDefault()) {
                values.put(parameter.getName(), parameter.getDefaultValue());
            }
        }
        for (Map.Entry<String, Parameter> entry : undeclared.entrySet()) {
            values.put(entry.getKey(), bound.get(entry.getKey()));
            extras.add(entry.getValue());
        }
        extras.addAll(surplus);
        return new BoundArguments(values, extras);
    }

    /**
     * 每个实参绑定到的形参名，与 {@code args} 一一对应
     *
     * <p>具名实参取自身名字；位置实参依次取下一个没有被具名实参占用的形参，形参用尽时为 null。</p>
     */
    public static List<String> targets(List<ModuleParameter> declared, List<Parameter> args) {
        Set<String> named = new HashSet<>();
        for (Parameter arg : args) {
            if (arg.isNamed()) {
                named.add(arg.getName());
            }
        }
        List<String> targets = new ArrayList<>(args.size());
        int next = 0;
        for (Parameter arg : args) {
            if (arg.isNamed()) {
                targets.add(arg.getName());
                continue;
            }
            while (next < declared.size() && named.contains(declared.get(next).getName())) {
                next++;
            }
            targets.add(next < declared.size() ? declared.get(next++).getName() : null);
        }
        return targets;
    }

    /**
     * 同名具名实参重复出现时记录警告
     */
    public void checkDuplicates(List<Parameter> args) {
        Set<String> seen = new HashSet<>();
        for (Parameter arg : args) {
            if (arg.isNamed() && !seen.add(arg.getName())) {
                diagnostics.warning(ErrorCode.DUPLICATE_ARGUMENT,
                        "Duplicate argument '" + arg.getName() + "', the last value is used", arg.getLocation());
            }
        }
    }

    private static boolean isDeclared(List<ModuleParameter> declared, String name) {
        for (ModuleParameter parameter : declared) {
            if (parameter.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
