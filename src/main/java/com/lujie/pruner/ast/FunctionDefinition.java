package com.lujie.pruner.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.ibm.wala.util.debug.Assertions;

/**
 * A function declared in a contract, library or interface, or a free
 * function when it has no contract. Definitions compare by identity.
 */
public class FunctionDefinition implements TopLevelDeclaration {
	private final String name;
	private final ContractDefinition contract;
	private final boolean implemented;
	private final List<Type> parameterTypes;

	FunctionDefinition(String name, ContractDefinition contract, boolean implemented, List<Type> parameterTypes) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("function without a name");
		}
		this.name = name;
		this.contract = contract;
		this.implemented = implemented;
		this.parameterTypes = Collections.unmodifiableList(parameterTypes);
	}

	public static FunctionDefinition free(String name, Type... parameterTypes) {
		return new FunctionDefinition(name, null, true, Arrays.asList(parameterTypes));
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the contract this function is declared in, null for a free
	 *         function.
	 */
	public ContractDefinition getContract() {
		return contract;
	}

	public boolean isFree() {
		return contract == null;
	}

	/**
	 * @return false if the function has no body and hence no control flow.
	 */
	public boolean isImplemented() {
		return implemented;
	}

	public boolean hasEqualParameterTypes(FunctionDefinition other) {
		return parameterTypes.equals(other.parameterTypes);
	}

	public FunctionDefinition resolveVirtual(ContractDefinition mostDerivedContract) {
		return resolveVirtual(mostDerivedContract, null);
	}

	/**
	 * Looks up the override of this function that is executed in
	 * {@code mostDerivedContract}. Free and library functions resolve to
	 * themselves.
	 *
	 * @param searchStart first contract of the linearization to consider, null
	 *                    to search the whole linearization.
	 */
	public FunctionDefinition resolveVirtual(ContractDefinition mostDerivedContract, ContractDefinition searchStart) {
		if (contract == null) {
			return this;
		}
		if (contract.isLibrary()) {
			// library functions cannot be overridden
			Assertions.productionAssertion(searchStart == null, "super lookup of library function " + this);
			return this;
		}
		boolean foundSearchStart = searchStart == null;
		for (ContractDefinition base : mostDerivedContract.getLinearizedBaseContracts()) {
			if (!foundSearchStart && base != searchStart) {
				continue;
			}
			foundSearchStart = true;
			for (FunctionDefinition function : base.definedFunctions(name)) {
				if (hasEqualParameterTypes(function)) {
					return function;
				}
			}
		}
		Assertions.UNREACHABLE("virtual function " + this + " not found in " + mostDerivedContract.getName());
		return null;
	}

	@Override
	public void accept(ASTVisitor visitor) {
		visitor.visit(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (contract != null) {
			sb.append(contract.getName());
			sb.append(".");
		}
		sb.append(name);
		sb.append("(");
		for (int i = 0; i < parameterTypes.size(); i++) {
			if (i > 0) {
				sb.append(",");
			}
			sb.append(parameterTypes.get(i));
		}
		sb.append(")");
		return sb.toString();
	}
}
