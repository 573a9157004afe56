package com.lujie.pruner.ast;

/**
 * Type of an expression referring to a contract. When {@code isSuper} is set
 * this is the type of {@code super} used inside {@code contractDefinition}.
 */
public class ContractType extends Type {
	private final ContractDefinition contractDefinition;
	private final boolean isSuper;

	public ContractType(ContractDefinition contractDefinition, boolean isSuper) {
		if (contractDefinition == null) {
			throw new IllegalArgumentException("contract type without a contract");
		}
		this.contractDefinition = contractDefinition;
		this.isSuper = isSuper;
	}

	public static ContractType superOf(ContractDefinition contractDefinition) {
		return new ContractType(contractDefinition, true);
	}

	@Override
	public Category getCategory() {
		return Category.CONTRACT;
	}

	public ContractDefinition getContractDefinition() {
		return contractDefinition;
	}

	public boolean isSuper() {
		return isSuper;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + contractDefinition.hashCode();
		result = prime * result + (isSuper ? 1231 : 1237);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ContractType other = (ContractType) obj;
		return contractDefinition == other.contractDefinition && isSuper == other.isSuper;
	}

	@Override
	public String toString() {
		return (isSuper ? "super " : "contract ") + contractDefinition.getName();
	}
}
