package naytive.build;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BuildStateTest {
	@Test
	void includesAreRegisteredOnceInOrder() {
		BuildState state = new BuildState();
		assertTrue(state.addInclude("#include <string>"));
		assertTrue(state.addInclude("#include <iostream>"));
		assertFalse(state.addInclude("#include <string>"));

		assertEquals(List.of("#include <string>", "#include <iostream>"), List.copyOf(state.includes()));
	}

	@Test
	void firstHelperDefinitionWins() {
		BuildState state = new BuildState();
		assertTrue(state.addHelper("str_split", "first"));
		assertFalse(state.addHelper("str_split", "second"));

		assertTrue(state.hasHelper("str_split"));
		assertEquals("first", state.helpers().get("str_split"));
	}

	@Test
	void rawImportsAreDeduplicated() {
		BuildState state = new BuildState();
		state.addRawImport("#include \"./a.h\"");
		state.addRawImport("#include \"./a.h\"");
		assertEquals(1, state.rawImports().size());
	}

	@Test
	void viewsAreReadOnly() {
		BuildState state = new BuildState();
		assertThrows(UnsupportedOperationException.class, () -> state.includes().add("#include <x>"));
	}
}
