package work.lcod.ui.ast;

import java.util.List;
import java.util.Objects;

/**
 * Closed set of expressions shared by source programs and compiled output.
 *
 * <p>The compiled form reuses these records; a sound page-level compile never contains a {@link ParamRef}.</p>
 */
public sealed interface Expression extends PropValue {

    <R> R accept(Visitor<R> visitor);

    /** Wire tag written under the {@code expr} member. */
    String tag();

    static Literal nullLiteral() {
        return Literal.NULL;
    }

    static Literal literal(Object value) {
        return new Literal(value);
    }

    record Literal(Object value) implements Expression {
        static final Literal NULL = new Literal(null);

        public Literal {
            value = JsonValues.immutableCopy(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String tag() {
            return "lit";
        }
    }

    record StateRef(String name, String path) implements Expression {
        public StateRef {
            Objects.requireNonNull(name, "name");
        }

        public StateRef(String name) {
            this(name, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitState(this);
        }

        @Override
        public String tag() {
            return "state";
        }
    }

    record VarRef(String name, String path) implements Expression {
        public VarRef {
            Objects.requireNonNull(name, "name");
        }

        public VarRef(String name) {
            this(name, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public String tag() {
            return "var";
        }
    }

    record Binary(String op, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String tag() {
            return "bin";
        }
    }

    record Not(Expression operand) implements Expression {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String tag() {
            return "not";
        }
    }

    /** {@code cond}: written with {@code if}/{@code then}/{@code else} members. */
    record Conditional(Expression condition, Expression then, Expression otherwise) implements Expression {
        public Conditional {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }

        @Override
        public String tag() {
            return "cond";
        }
    }

    record PropertyGet(Expression base, String path) implements Expression {
        public PropertyGet {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(path, "path");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGet(this);
        }

        @Override
        public String tag() {
            return "get";
        }
    }

    record RouteRef(String name, RouteSource source) implements Expression {
        public RouteRef {
            Objects.requireNonNull(name, "name");
            source = source == null ? RouteSource.PARAM : source;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRoute(this);
        }

        @Override
        public String tag() {
            return "route";
        }
    }

    record ImportRef(String name, String path) implements Expression {
        public ImportRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }

        @Override
        public String tag() {
            return "import";
        }
    }

    record DataRef(String name, String path) implements Expression {
        public DataRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitData(this);
        }

        @Override
        public String tag() {
            return "data";
        }
    }

    record DomRef(String name) implements Expression {
        public DomRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRef(this);
        }

        @Override
        public String tag() {
            return "ref";
        }
    }

    record IndexGet(Expression base, Expression key) implements Expression {
        public IndexGet {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(key, "key");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }

        @Override
        public String tag() {
            return "index";
        }
    }

    record ParamRef(String name, String path) implements Expression {
        public ParamRef {
            Objects.requireNonNull(name, "name");
        }

        public ParamRef(String name) {
            this(name, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParam(this);
        }

        @Override
        public String tag() {
            return "param";
        }
    }

    /** Method call; a null target means a global helper. */
    record Call(Expression target, String method, List<Expression> args) implements Expression {
        public Call {
            Objects.requireNonNull(method, "method");
            args = JsonValues.listCopy(args);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String tag() {
            return "call";
        }
    }

    record Lambda(String param, String index, Expression body) implements Expression {
        public Lambda {
            Objects.requireNonNull(param, "param");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambda(this);
        }

        @Override
        public String tag() {
            return "lambda";
        }
    }

    record ArrayLiteral(List<Expression> elements) implements Expression {
        public ArrayLiteral {
            elements = JsonValues.listCopy(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }

        @Override
        public String tag() {
            return "array";
        }
    }

    record Concat(List<Expression> items) implements Expression {
        public Concat {
            items = JsonValues.listCopy(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConcat(this);
        }

        @Override
        public String tag() {
            return "concat";
        }
    }

    interface Visitor<R> {
        R visitLiteral(Literal expr);

        R visitState(StateRef expr);

        R visitVar(VarRef expr);

        R visitBinary(Binary expr);

        R visitNot(Not expr);

        R visitConditional(Conditional expr);

        R visitGet(PropertyGet expr);

        R visitRoute(RouteRef expr);

        R visitImport(ImportRef expr);

        R visitData(DataRef expr);

        R visitRef(DomRef expr);

        R visitIndex(IndexGet expr);

        R visitParam(ParamRef expr);

        R visitCall(Call expr);

        R visitLambda(Lambda expr);

        R visitArray(ArrayLiteral expr);

        R visitConcat(Concat expr);
    }
}
