package org.simplelang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The operation applied by a {@link PostfixNode}.
 */
public sealed interface PostfixOperation {

    /** {@code x++} */
    record Increment() implements PostfixOperation {
        @Override
        public String toString() {
            return "++";
        }
    }

    /** {@code x--} */
    record Decrement() implements PostfixOperation {
        @Override
        public String toString() {
            return "--";
        }
    }

    /**
     * {@code x[index]}
     * @param index The index expression.
     */
    record Index(ExpressionNode index) implements PostfixOperation {
    }

    /**
     * {@code x(arguments)}
     * @param arguments The call arguments, possibly empty.
     */
    record Call(List<ExpressionNode> arguments) implements PostfixOperation {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }
}
