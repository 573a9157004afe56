package com.lujie.pruner;

import com.lujie.pruner.ast.ContractDefinition;
import com.lujie.pruner.ast.FunctionDefinition;

public class Util {
	/**
	 * @return "Contract#function", or "#function" for a free function.
	 */
	public static String getSimpleFunctionToString(FunctionDefinition function, ContractDefinition contract) {
		StringBuilder sb = new StringBuilder();
		if (contract != null) {
			sb.append(contract.getName());
		}
		sb.append("#");
		sb.append(function.getName());
		return sb.toString();
	}
}
