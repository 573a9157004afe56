package com.lujie.pruner.ast;

/**
 * {@code receiver.memberName}, e.g. {@code super.f}, {@code L.f} or
 * {@code x.add} for a function attached to a type.
 */
public class MemberAccess extends Expression {
	private final Expression receiver;
	private final String memberName;

	public MemberAccess(Expression receiver, String memberName, Type type, VirtualLookup requiredLookup) {
		super(type, requiredLookup);
		if (receiver == null) {
			throw new IllegalArgumentException("member access without a receiver");
		}
		this.receiver = receiver;
		this.memberName = memberName;
	}

	public Expression getReceiver() {
		return receiver;
	}

	@Override
	public String toString() {
		return receiver + "." + memberName;
	}
}
