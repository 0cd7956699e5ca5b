package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * A parsed C constant expression.
 *
 * @see CExpressionParser
 */
public abstract class CExpression {

    public interface Visitor<R> {

        R visitLiteral(@Nonnull Literal e) throws ConvertException;

        R visitIdentifier(@Nonnull Identifier e) throws ConvertException;

        R visitUnary(@Nonnull Unary e) throws ConvertException;

        R visitBinary(@Nonnull Binary e) throws ConvertException;

        R visitConditional(@Nonnull Conditional e) throws ConvertException;

        R visitCast(@Nonnull Cast e) throws ConvertException;

        R visitSizeOf(@Nonnull SizeOf e) throws ConvertException;

        R visitCall(@Nonnull Call e) throws ConvertException;
    }

    public abstract <R> R accept(@Nonnull Visitor<R> visitor) throws ConvertException;

    /* pp */ abstract void names(@Nonnull Set<String> out);

    /**
     * Returns the identifiers and called names in this expression, in
     * order of first appearance.
     */
    @Nonnull
    public Set<String> getNames() {
        Set<String> out = new LinkedHashSet<String>();
        names(out);
        return out;
    }

    public static class Literal extends CExpression {

        public enum Kind {
            INTEGER, FLOATING, CHARACTER, STRING
        }

        private final Kind kind;
        private final String text;
        private final Object value;

        public Literal(@Nonnull Kind kind, @Nonnull String text, @Nonnull Object value) {
            this.kind = kind;
            this.text = text;
            this.value = value;
        }

        @Nonnull
        public Kind getKind() {
            return kind;
        }

        /** The source spelling. */
        @Nonnull
        public String getText() {
            return text;
        }

        /** A Long, Double or String. */
        @Nonnull
        public Object getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitLiteral(this);
        }

        @Override
        void names(Set<String> out) {
        }

        @Override
        public String toString() {
            return text;
        }
    }

    public static class Identifier extends CExpression {

        private final String name;

        public Identifier(@Nonnull String name) {
            this.name = name;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitIdentifier(this);
        }

        @Override
        void names(Set<String> out) {
            out.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static class Unary extends CExpression {

        private final String op;
        private final CExpression operand;

        public Unary(@Nonnull String op, @Nonnull CExpression operand) {
            this.op = op;
            this.operand = operand;
        }

        @Nonnull
        public String getOp() {
            return op;
        }

        @Nonnull
        public CExpression getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitUnary(this);
        }

        @Override
        void names(Set<String> out) {
            operand.names(out);
        }

        @Override
        public String toString() {
            return "(" + op + operand + ")";
        }
    }

    public static class Binary extends CExpression {

        private final String op;
        private final CExpression left;
        private final CExpression right;

        public Binary(@Nonnull String op, @Nonnull CExpression left, @Nonnull CExpression right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Nonnull
        public String getOp() {
            return op;
        }

        @Nonnull
        public CExpression getLeft() {
            return left;
        }

        @Nonnull
        public CExpression getRight() {
            return right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitBinary(this);
        }

        @Override
        void names(Set<String> out) {
            left.names(out);
            right.names(out);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op + " " + right + ")";
        }
    }

    public static class Conditional extends CExpression {

        private final CExpression condition;
        private final CExpression ifTrue;
        private final CExpression ifFalse;

        public Conditional(@Nonnull CExpression condition, @Nonnull CExpression ifTrue, @Nonnull CExpression ifFalse) {
            this.condition = condition;
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        @Nonnull
        public CExpression getCondition() {
            return condition;
        }

        @Nonnull
        public CExpression getIfTrue() {
            return ifTrue;
        }

        @Nonnull
        public CExpression getIfFalse() {
            return ifFalse;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitConditional(this);
        }

        @Override
        void names(Set<String> out) {
            condition.names(out);
            ifTrue.names(out);
            ifFalse.names(out);
        }

        @Override
        public String toString() {
            return "(" + condition + " ? " + ifTrue + " : " + ifFalse + ")";
        }
    }

    public static class Cast extends CExpression {

        private final CType type;
        private final CExpression operand;

        public Cast(@Nonnull CType type, @Nonnull CExpression operand) {
            this.type = type;
            this.operand = operand;
        }

        @Nonnull
        public CType getType() {
            return type;
        }

        @Nonnull
        public CExpression getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitCast(this);
        }

        @Override
        void names(Set<String> out) {
            operand.names(out);
        }

        @Override
        public String toString() {
            return "((" + type + ") " + operand + ")";
        }
    }

    public static class SizeOf extends CExpression {

        private final CType type;

        public SizeOf(@Nonnull CType type) {
            this.type = type;
        }

        @Nonnull
        public CType getType() {
            return type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitSizeOf(this);
        }

        @Override
        void names(Set<String> out) {
        }

        @Override
        public String toString() {
            return "sizeof(" + type + ")";
        }
    }

    public static class Call extends CExpression {

        private final String name;
        private final List<CExpression> args;

        public Call(@Nonnull String name, @Nonnull List<CExpression> args) {
            this.name = name;
            this.args = Collections.unmodifiableList(new ArrayList<CExpression>(args));
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public List<CExpression> getArgs() {
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ConvertException {
            return visitor.visitCall(this);
        }

        @Override
        void names(Set<String> out) {
            out.add(name);
            for (CExpression arg : args)
                arg.names(out);
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder(name).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0)
                    buf.append(", ");
                buf.append(args.get(i));
            }
            return buf.append(')').toString();
        }
    }
}
