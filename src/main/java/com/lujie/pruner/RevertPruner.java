package com.lujie.pruner;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.ibm.wala.util.collections.HashMapFactory;
import com.ibm.wala.util.collections.Pair;
import com.ibm.wala.util.debug.Assertions;
import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.lujie.pruner.ast.ASTVisitor;
import com.lujie.pruner.ast.ContractDefinition;
import com.lujie.pruner.ast.FunctionCall;
import com.lujie.pruner.ast.FunctionDefinition;
import com.lujie.pruner.ast.FunctionType;
import com.lujie.pruner.ast.SourceUnit;
import com.lujie.pruner.ast.Type;
import com.lujie.pruner.cfg.CfgNode;
import com.lujie.pruner.cfg.ControlFlowGraph;
import com.lujie.pruner.cfg.FunctionFlow;

/**
 * Analyses all function flows and removes the exits of CFG nodes that make
 * function calls which always revert.
 *
 * The first pass does not follow recursive loops, calls into a function
 * whose analysis is still running are classified {@link RevertState#PENDING}.
 * A second pass treats everything left pending as an infinite recursion.
 */
public class RevertPruner {
	private final ControlFlowGraph cfg;
	private final PrunerOptions options;
	// insertion ordered, so the second pass is deterministic
	private final Map<Pair<ContractDefinition, FunctionDefinition>, FunctionRevert> functionReverts = HashMapFactory
			.make();
	private MutableIntSet prunedNodes = new BitVectorIntSet();

	private static class FunctionRevert {
		/** last node of the function's own traversal that made a pending call */
		CfgNode node = null;
		RevertState state = RevertState.PENDING;
	}

	private interface RevertStateHandler {
		/**
		 * @return false to stop processing the node.
		 */
		boolean onRevertState(RevertState state, CfgNode node, FunctionFlow flow);
	}

	public RevertPruner(ControlFlowGraph cfg) {
		this(cfg, PrunerOptions.defaults());
	}

	public RevertPruner(ControlFlowGraph cfg, PrunerOptions options) {
		this.cfg = cfg;
		this.options = options;
	}

	public void run(SourceUnit sourceUnit) {
		long startTime = System.currentTimeMillis();
		functionReverts.clear();
		prunedNodes = new BitVectorIntSet();
		if (options.verbose) {
			System.out.println("start to prune reverting paths");
		}
		sourceUnit.accept(new ASTVisitor() {
			// analyze all member functions of the contract, including the
			// inherited and overridden ones
			@Override
			public void visit(ContractDefinition contract) {
				for (ContractDefinition base : contract.getLinearizedBaseContracts()) {
					for (FunctionDefinition function : base.definedFunctions()) {
						removeRevertingPaths(function, contract);
					}
				}
			}

			@Override
			public void visit(FunctionDefinition function) {
				if (function.isFree()) {
					removeRevertingPaths(function, null);
				}
			}
		});
		removePendingPaths();
		if (options.verbose) {
			System.out.println("Pruned " + prunedNodes.size() + " nodes after reverting calls");
			System.out.println("Time spent on pruning reverting paths " + (System.currentTimeMillis() - startTime) + "ms");
		}
	}

	/**
	 * @return the classification of {@code function} called from
	 *         {@code contract} after {@link #run}, null if it was never
	 *         analysed.
	 */
	public RevertState revertState(FunctionDefinition function, ContractDefinition contract) {
		FunctionRevert functionRevert = functionReverts.get(getNormalizedKey(function, contract));
		return functionRevert == null ? null : functionRevert.state;
	}

	/**
	 * @return the number of nodes whose exits were replaced by the last run.
	 */
	public int getPrunedNodeCount() {
		return prunedNodes.size();
	}

	/**
	 * Anything still pending after the first pass is an infinite recursive
	 * loop.
	 */
	private void removePendingPaths() {
		List<Entry<Pair<ContractDefinition, FunctionDefinition>, FunctionRevert>> entries = new ArrayList<Entry<Pair<ContractDefinition, FunctionDefinition>, FunctionRevert>>(
				functionReverts.entrySet());
		for (Entry<Pair<ContractDefinition, FunctionDefinition>, FunctionRevert> entry : entries) {
			Pair<ContractDefinition, FunctionDefinition> key = entry.getKey();
			FunctionRevert functionRevert = entry.getValue();
			CfgNode node = functionRevert.node;
			if (node != null) {
				FunctionFlow functionFlow = cfg.functionFlow(key.snd, key.fst);
				for (FunctionCall functionCall : node.getFunctionCalls()) {
					switch (checkForReverts(functionCall, key.fst)) {
					case ALL_PATHS_REVERT:
					case PENDING:
						truncate(node, functionFlow);
						break;
					case HAS_NON_REVERTING_PATH:
						break;
					}
				}
			}
			if (functionRevert.state == RevertState.PENDING) {
				if (options.verbose) {
					System.out.println("unresolved recursion through " + Util.getSimpleFunctionToString(key.snd, key.fst));
				}
				functionRevert.state = RevertState.ALL_PATHS_REVERT;
			}
		}
	}

	/**
	 * Removes the exits of nodes with reverting function calls. Nodes making
	 * pending calls are remembered for the second pass.
	 */
	private void removeRevertingPaths(FunctionDefinition function, ContractDefinition contract) {
		if (!function.isImplemented()) {
			return;
		}
		FunctionFlow functionFlow = cfg.functionFlow(function, contract);
		final FunctionRevert functionRevert = findOrCreate(getNormalizedKey(function, contract));
		functionRevert.state = RevertState.PENDING;

		traverseFunctionFlow(function, contract, functionFlow, (state, node, flow) -> {
			if (state == RevertState.ALL_PATHS_REVERT) {
				truncate(node, flow);
			} else if (state == RevertState.PENDING) {
				functionRevert.node = node;
			}
			return true;
		});
	}

	/**
	 * Recursively analyzes a function call for reverts without resolving
	 * recursive loops.
	 *
	 * @param contract contract from which the call is made.
	 */
	private RevertState checkForReverts(FunctionCall functionCall, ContractDefinition contract) {
		Type calleeType = functionCall.getExpression().getType();
		Assertions.productionAssertion(calleeType.getCategory() == Type.Category.FUNCTION,
				"callee of " + functionCall + " has type " + calleeType);
		FunctionType functionType = (FunctionType) calleeType;
		if (!functionType.hasDeclaration()) {
			return RevertState.HAS_NON_REVERTING_PATH;
		}

		FunctionDefinition functionDefinition = new ResolveFunction(functionType.getDeclaration(), contract)
				.resolve(functionCall.getExpression());
		Pair<ContractDefinition, FunctionDefinition> revertMapKey = getNormalizedKey(functionDefinition, contract);
		FunctionRevert reverts = functionReverts.get(revertMapKey);
		if (reverts != null) {
			return reverts.state;
		}

		final FunctionRevert functionRevert = findOrCreate(revertMapKey);
		if (!functionDefinition.isImplemented()) {
			// unknown code may return
			functionRevert.state = RevertState.HAS_NON_REVERTING_PATH;
			return functionRevert.state;
		}
		functionRevert.state = RevertState.ALL_PATHS_REVERT;

		FunctionFlow functionFlow = cfg.functionFlow(functionDefinition, revertMapKey.fst);
		return traverseFunctionFlow(functionDefinition, contract, functionFlow, (state, node, flow) -> {
			if (state == RevertState.ALL_PATHS_REVERT) {
				return false;
			} else if (state == RevertState.PENDING) {
				// a later non-pending exit sets it to HAS_NON_REVERTING_PATH
				functionRevert.state = RevertState.PENDING;
			}
			return true;
		});
	}

	/**
	 * Breadth-first traversal of a function flow that classifies every call
	 * on the way.
	 *
	 * @param contract      contract that called the function.
	 * @param onRevertState invoked for every classified call.
	 * @return the revert state of the function.
	 */
	private RevertState traverseFunctionFlow(FunctionDefinition function, ContractDefinition contract,
			FunctionFlow flow, RevertStateHandler onRevertState) {
		FunctionRevert functionRevert = functionReverts.get(getNormalizedKey(function, contract));

		// nodes reached from a pending call, to detect non-pending exits
		MutableIntSet pendingNodes = new BitVectorIntSet();
		MutableIntSet visited = new BitVectorIntSet();
		LinkedList<CfgNode> worklist = new LinkedList<CfgNode>();
		worklist.add(cfg.getNode(flow.getEntry()));
		visited.add(flow.getEntry());

		nodes: while (!worklist.isEmpty()) {
			CfgNode node = worklist.removeFirst();
			boolean pending = pendingNodes.contains(node.getIndex());

			if (node.getIndex() == flow.getExit()) {
				if (!pending) {
					functionRevert.state = RevertState.HAS_NON_REVERTING_PATH;
				}
				continue;
			}

			for (FunctionCall functionCall : node.getFunctionCalls()) {
				RevertState reverts = checkForReverts(functionCall, contract);
				if (!onRevertState.onRevertState(reverts, node, flow)) {
					continue nodes;
				}
				if (reverts == RevertState.PENDING) {
					pending = true;
					pendingNodes.add(node.getIndex());
				}
			}

			for (int exit : node.getExits()) {
				if (visited.add(exit)) {
					worklist.add(cfg.getNode(exit));
				}
				if (pending) {
					pendingNodes.add(exit);
				}
			}
		}
		return functionRevert.state;
	}

	private void truncate(CfgNode node, FunctionFlow flow) {
		if (cfg.truncateToRevert(node, flow)) {
			prunedNodes.add(node.getIndex());
		}
	}

	private FunctionRevert findOrCreate(Pair<ContractDefinition, FunctionDefinition> key) {
		FunctionRevert functionRevert = functionReverts.get(key);
		if (functionRevert == null) {
			functionRevert = new FunctionRevert();
			functionReverts.put(key, functionRevert);
		}
		return functionRevert;
	}

	/**
	 * Free functions are keyed without a contract and library functions with
	 * their library, since neither is subject to override resolution.
	 */
	private static Pair<ContractDefinition, FunctionDefinition> getNormalizedKey(FunctionDefinition function,
			ContractDefinition contract) {
		ContractDefinition keyContract = contract;
		if (function.isFree()) {
			keyContract = null;
		} else if (function.getContract().isLibrary()) {
			keyContract = function.getContract();
		}
		return Pair.make(keyContract, function);
	}
}
