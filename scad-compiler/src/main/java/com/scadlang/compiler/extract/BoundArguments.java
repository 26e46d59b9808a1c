package com.scadlang.compiler.extract;

import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 实参绑定结果
 */
public final class BoundArguments {
    private final Map<String, Expression> values;
    private final List<Parameter> extras;

    BoundArguments(Map<String, Expression> values, List<Parameter> extras) {
        this.values = Collections.unmodifiableMap(values);
        this.extras = Collections.unmodifiableList(extras);
    }

    /** 形参名到值的映射，按声明顺序；未声明的具名实参排在最后 */
    public Map<String, Expression> getValues() {
        return values;
    }

    public Expression get(String name) {
        return values.get(name);
    }

    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    /** 未被任何形参接收的实参（未声明的具名实参与多余的位置实参） */
    public List<Parameter> getExtras() {
        return extras;
    }
}
