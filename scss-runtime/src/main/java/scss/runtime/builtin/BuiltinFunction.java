package scss.runtime.builtin;

import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.parser.Parser;
import scss.runtime.ArityException;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 内建函数
 *
 * <p>一个内建函数可以有多个重载签名，调用时选择第一个与实参个数和命名参数相符的签名。
 * 签名用 Sass 语法书写，例如 {@code "$color, $amount"}、{@code "$numbers..."}。</p>
 */
public final class BuiltinFunction implements SassCallable {

    /**
     * 函数体
     *
     * <p>args 按签名形参顺序排列，缺省参数已求值；有可变参数时最后一项为 arglist。</p>
     */
    @FunctionalInterface
    public interface Body {
        SassValue apply(FunctionContext ctx, List<SassValue> args);
    }

    /** 签名加函数体 */
    public static final class Overload {
        private final ArgumentDeclaration signature;
        private final Body body;

        Overload(ArgumentDeclaration signature, Body body) {
            this.signature = signature;
            this.body = body;
        }

        public ArgumentDeclaration getSignature() {
            return signature;
        }

        public Body getBody() {
            return body;
        }
    }

    private final String name;
    private final List<Overload> overloads;

    private BuiltinFunction(String name, List<Overload> overloads) {
        this.name = name;
        this.overloads = Collections.unmodifiableList(overloads);
    }

    /** 单一签名 */
    public static BuiltinFunction create(String name, String signature, Body body) {
        List<Overload> overloads = new ArrayList<Overload>();
        overloads.add(new Overload(parseSignature(name, signature), body));
        return new BuiltinFunction(name, overloads);
    }

    public static Builder overloaded(String name) {
        return new Builder(name);
    }

    static ArgumentDeclaration parseSignature(String name, String signature) {
        return new Parser("(" + signature + ")", "sass:" + name).parseArgumentDeclaration();
    }

    /** 同一实现换一个名称（全局别名，如 {@code str-length}） */
    public BuiltinFunction withName(String newName) {
        return newName.equals(name) ? this : new BuiltinFunction(newName, overloads);
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Overload> getOverloads() {
        return overloads;
    }

    /**
     * 选择重载
     *
     * @throws ArityException 没有匹配的重载时，按最后一个签名报告原因
     */
    public Overload selectOverload(int positional, Set<String> named) {
        for (Overload overload : overloads) {
            if (ArgumentBinder.matches(overload.signature, positional, named)) {
                return overload;
            }
        }
        Overload last = overloads.get(overloads.size() - 1);
        ArgumentBinder.verify(last.signature, positional, named);
        // verify 对单签名总会抛出；多签名时可能按最后签名恰好通过
        throw new ArityException("No overload of " + name + "() matches the arguments.");
    }

    @Override
    public String toString() {
        return name + "()";
    }

    public static final class Builder {
        private final String name;
        private final List<Overload> overloads = new ArrayList<Overload>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder overload(String signature, Body body) {
            overloads.add(new Overload(parseSignature(name, signature), body));
            return this;
        }

        public BuiltinFunction build() {
            if (overloads.isEmpty()) {
                throw new IllegalStateException("No overloads for " + name);
            }
            return new BuiltinFunction(name, new ArrayList<Overload>(overloads));
        }
    }
}
