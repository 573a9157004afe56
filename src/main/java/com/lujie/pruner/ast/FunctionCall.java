package com.lujie.pruner.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class FunctionCall {
	private final Expression expression;
	private final List<Expression> arguments;

	public FunctionCall(Expression expression, Expression... arguments) {
		if (expression == null) {
			throw new IllegalArgumentException("function call without a callee expression");
		}
		this.expression = expression;
		this.arguments = Collections.unmodifiableList(Arrays.asList(arguments));
	}

	/**
	 * @return the expression evaluating to the called function.
	 */
	public Expression getExpression() {
		return expression;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(expression);
		sb.append("(");
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(arguments.get(i));
		}
		sb.append(")");
		return sb.toString();
	}
}
