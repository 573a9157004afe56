package com.lujie.pruner;

import com.ibm.wala.util.debug.Assertions;
import com.lujie.pruner.ast.ContractDefinition;
import com.lujie.pruner.ast.ContractType;
import com.lujie.pruner.ast.Expression;
import com.lujie.pruner.ast.FunctionDefinition;
import com.lujie.pruner.ast.MemberAccess;
import com.lujie.pruner.ast.Type;
import com.lujie.pruner.ast.VirtualLookup;

/**
 * Resolves the function actually executed by a call, using the calling
 * contract, the unresolved function definition and the call expression.
 */
public class ResolveFunction {
	private final FunctionDefinition unresolvedFunctionDefinition;
	private final ContractDefinition contract;

	/**
	 * @param unresolvedFunctionDefinition function referenced by the call.
	 * @param contract                     contract from which the function is
	 *                                     called, null inside free functions.
	 */
	public ResolveFunction(FunctionDefinition unresolvedFunctionDefinition, ContractDefinition contract) {
		this.unresolvedFunctionDefinition = unresolvedFunctionDefinition;
		this.contract = contract;
	}

	/**
	 * @param expression callee expression of the call.
	 * @return the function definition that will actually be called.
	 */
	public FunctionDefinition resolve(Expression expression) {
		VirtualLookup requiredLookup = expression.getRequiredLookup();
		Assertions.productionAssertion(requiredLookup != null, "no lookup kind annotated on " + expression);
		FunctionDefinition functionDefinition = null;
		switch (requiredLookup) {
		case STATIC:
			functionDefinition = unresolvedFunctionDefinition;
			break;
		case VIRTUAL:
			functionDefinition = resolveVirtual();
			break;
		case SUPER:
			functionDefinition = resolveSuper(expression);
			break;
		}
		Assertions.productionAssertion(functionDefinition != null, "could not resolve " + expression);
		return functionDefinition;
	}

	private FunctionDefinition resolveVirtual() {
		if (unresolvedFunctionDefinition.isFree() || unresolvedFunctionDefinition.getContract().isLibrary()) {
			return unresolvedFunctionDefinition;
		}
		Assertions.productionAssertion(contract != null,
				"virtual call to " + unresolvedFunctionDefinition + " outside of a contract");
		return unresolvedFunctionDefinition.resolveVirtual(contract);
	}

	private FunctionDefinition resolveSuper(Expression expression) {
		Assertions.productionAssertion(expression instanceof MemberAccess, "super lookup on " + expression);
		Assertions.productionAssertion(contract != null, "super call " + expression + " outside of a contract");
		Type receiverType = ((MemberAccess) expression).getReceiver().getType();
		switch (receiverType.getCategory()) {
		case CONTRACT:
			ContractType contractType = (ContractType) receiverType;
			Assertions.productionAssertion(contractType.isSuper(), "receiver of " + expression + " is not super");
			ContractDefinition superContract = contractType.getContractDefinition().superContract(contract);
			Assertions.productionAssertion(superContract != null,
					"no base follows " + contractType.getContractDefinition().getName() + " in " + contract.getName());
			return unresolvedFunctionDefinition.resolveVirtual(contract, superContract);
		case INTEGER:
		case BOOL:
		case ADDRESS:
		case FIXED_BYTES:
		case BYTES:
		case FUNCTION:
			Assertions.UNREACHABLE("super lookup on a receiver of type " + receiverType);
		}
		return null;
	}
}
