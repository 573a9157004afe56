package com.lujie.pruner.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.ibm.wala.util.debug.UnimplementedError;
import com.lujie.pruner.ast.ContractDefinition.ContractKind;

class ContractDefinitionTest {

	@Test
	void linearizationDefaultsToItself() {
		ContractDefinition a = new ContractDefinition("A", ContractKind.CONTRACT);
		assertEquals(Collections.singletonList(a), a.getLinearizedBaseContracts());
		assertNull(a.superContract(a));
	}

	@Test
	void linearizationMustStartWithTheContract() {
		ContractDefinition a = new ContractDefinition("A", ContractKind.CONTRACT);
		ContractDefinition b = new ContractDefinition("B", ContractKind.CONTRACT);
		assertThrows(IllegalArgumentException.class, () -> b.setLinearizedBaseContracts(a, b));
		assertThrows(IllegalArgumentException.class, () -> b.setLinearizedBaseContracts());
		assertThrows(IllegalArgumentException.class, () -> b.setLinearizedBaseContracts(b, a, a));
	}

	@Test
	void superContractFollowsTheMostDerivedLinearization() {
		ContractDefinition a = new ContractDefinition("A", ContractKind.CONTRACT);
		ContractDefinition b = new ContractDefinition("B", ContractKind.CONTRACT);
		ContractDefinition c = new ContractDefinition("C", ContractKind.CONTRACT);
		ContractDefinition d = new ContractDefinition("D", ContractKind.CONTRACT);
		b.setLinearizedBaseContracts(b, a);
		d.setLinearizedBaseContracts(d, c, b, a);
		assertEquals(Arrays.asList(d, c, b, a), d.getLinearizedBaseContracts());
		assertSame(a, b.superContract(b));
		assertSame(a, b.superContract(d));
		assertSame(b, c.superContract(d));
		assertNull(a.superContract(d));
		assertThrows(UnimplementedError.class, () -> c.superContract(b));
	}

	@Test
	void definedFunctionsKeepDeclarationOrder() {
		ContractDefinition a = new ContractDefinition("A", ContractKind.CONTRACT);
		FunctionDefinition f = a.addFunction("f");
		FunctionDefinition g = a.addFunction("g", new BoolType());
		FunctionDefinition f2 = a.addFunction("f", IntegerType.uint256());
		assertEquals(Arrays.asList(f, g, f2), a.definedFunctions());
		assertEquals(Arrays.asList(f, f2), a.definedFunctions("f"));
		assertTrue(a.definedFunctions("h").isEmpty());
		assertSame(a, f.getContract());
		assertFalse(f.isFree());
	}

	@Test
	void interfaceFunctionsHaveNoBody() {
		ContractDefinition i = new ContractDefinition("I", ContractKind.INTERFACE);
		ContractDefinition a = new ContractDefinition("A", ContractKind.CONTRACT);
		assertFalse(i.addFunction("f").isImplemented());
		assertFalse(a.addUnimplementedFunction("g").isImplemented());
		assertTrue(a.addFunction("h").isImplemented());
		assertFalse(i.isLibrary());
		assertTrue(new ContractDefinition("L", ContractKind.LIBRARY).isLibrary());
	}

	@Test
	void sourceUnitOnlyTakesTopLevelDeclarations() {
		ContractDefinition a = new ContractDefinition("A", ContractKind.CONTRACT);
		FunctionDefinition member = a.addFunction("f");
		FunctionDefinition free = FunctionDefinition.free("g");
		SourceUnit sourceUnit = new SourceUnit().add(a).add(free);
		assertEquals(Arrays.asList(a, free), sourceUnit.getDeclarations());
		assertThrows(IllegalArgumentException.class, () -> sourceUnit.add(member));
	}
}
