package com.lujie.pruner.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.ibm.wala.util.debug.Assertions;

public class ContractDefinition implements TopLevelDeclaration {
	public enum ContractKind {
		CONTRACT, INTERFACE, LIBRARY
	}

	private final String name;
	private final ContractKind kind;
	private final List<FunctionDefinition> definedFunctions = new ArrayList<FunctionDefinition>();
	private List<ContractDefinition> linearizedBaseContracts;

	public ContractDefinition(String name, ContractKind kind) {
		this.name = name;
		this.kind = kind;
		this.linearizedBaseContracts = Collections.singletonList(this);
	}

	public String getName() {
		return name;
	}

	public boolean isLibrary() {
		return kind == ContractKind.LIBRARY;
	}

	public FunctionDefinition addFunction(String functionName, Type... parameterTypes) {
		return addFunction(functionName, kind != ContractKind.INTERFACE, parameterTypes);
	}

	public FunctionDefinition addUnimplementedFunction(String functionName, Type... parameterTypes) {
		return addFunction(functionName, false, parameterTypes);
	}

	private FunctionDefinition addFunction(String functionName, boolean implemented, Type... parameterTypes) {
		FunctionDefinition function = new FunctionDefinition(functionName, this, implemented,
				Arrays.asList(parameterTypes));
		definedFunctions.add(function);
		return function;
	}

	public List<FunctionDefinition> definedFunctions() {
		return Collections.unmodifiableList(definedFunctions);
	}

	public List<FunctionDefinition> definedFunctions(String functionName) {
		List<FunctionDefinition> ret = new ArrayList<FunctionDefinition>();
		for (FunctionDefinition function : definedFunctions) {
			if (function.getName().equals(functionName)) {
				ret.add(function);
			}
		}
		return ret;
	}

	/**
	 * @return this contract followed by its bases, most derived first.
	 */
	public List<ContractDefinition> getLinearizedBaseContracts() {
		return linearizedBaseContracts;
	}

	public void setLinearizedBaseContracts(ContractDefinition... bases) {
		if (bases.length == 0 || bases[0] != this) {
			throw new IllegalArgumentException("linearization of " + name + " must start with " + name);
		}
		Set<ContractDefinition> seen = new HashSet<ContractDefinition>();
		for (ContractDefinition base : bases) {
			if (!seen.add(base)) {
				throw new IllegalArgumentException("contract " + base.getName() + " occurs twice in linearization of " + name);
			}
		}
		this.linearizedBaseContracts = Collections.unmodifiableList(Arrays.asList(bases));
	}

	/**
	 * @return the contract following this one in the linearization of
	 *         {@code mostDerivedContract}, null if this is the last one.
	 */
	public ContractDefinition superContract(ContractDefinition mostDerivedContract) {
		List<ContractDefinition> hierarchy = mostDerivedContract.getLinearizedBaseContracts();
		int index = hierarchy.indexOf(this);
		Assertions.productionAssertion(index >= 0,
				"base " + name + " not found in inheritance hierarchy of " + mostDerivedContract.getName());
		if (index + 1 == hierarchy.size()) {
			return null;
		}
		return hierarchy.get(index + 1);
	}

	@Override
	public void accept(ASTVisitor visitor) {
		visitor.visit(this);
	}

	@Override
	public String toString() {
		return kind.name().toLowerCase() + " " + name;
	}
}
