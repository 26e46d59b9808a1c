package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Location;

import java.util.Collections;
import java.util.List;

/**
 * 模块实例化节点的公共部分：名字、实参、子节点与修饰符
 *
 * <p>内置变换、图元与 CSG 运算都是它的特化，原始实参始终保留。</p>
 */
public abstract class InstantiationNode extends AstNode {
    private final String name;
    private final List<Parameter> args;
    private final List<AstNode> children;
    private final String modifier;

    protected InstantiationNode(Location location, String name, List<Parameter> args,
                                List<AstNode> children, String modifier) {
        super(location);
        this.name = name;
        this.args = Collections.unmodifiableList(args);
        this.children = Collections.unmodifiableList(children);
        this.modifier = modifier;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getArgs() {
        return args;
    }

    public List<AstNode> getChildren() {
        return children;
    }

    /** 修饰符 {@code # ! % *}，没有时为 null */
    public String getModifier() {
        return modifier;
    }

    /**
     * 按名字查找实参，重复时取最后一个
     */
    public Parameter findArgument(String argName) {
        Parameter found = null;
        for (Parameter arg : args) {
            if (argName.equals(arg.getName())) {
                found = arg;
            }
        }
        return found;
    }
}
