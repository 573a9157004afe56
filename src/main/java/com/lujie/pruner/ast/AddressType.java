package com.lujie.pruner.ast;

public class AddressType extends Type {
	private final boolean payable;

	public AddressType(boolean payable) {
		this.payable = payable;
	}

	@Override
	public Category getCategory() {
		return Category.ADDRESS;
	}

	@Override
	public int hashCode() {
		return payable ? 1231 : 1237;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return payable == ((AddressType) obj).payable;
	}

	@Override
	public String toString() {
		return payable ? "address payable" : "address";
	}
}
