package naytive.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TypeMapperTest {
	private final TypeMapper types = new TypeMapper();

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"number | int",
			"string | std::string",
			"boolean | bool",
			"void | void",
			"any | auto",
			"uint | unsigned int",
			"longlong | long long",
			"ulonglong | unsigned long long",
			"longdouble | long double",
			"number[] | std::vector<int>",
			"string[][] | std::vector<std::vector<std::string>>",
			"array<int, 3> | std::array<int, 3>",
			"vector<string> | std::vector<std::string>",
			"pointer<char> | char*",
			"Point | Point",
	})
	void mapsSourceTypes(String source, String expected) {
		assertEquals(expected, types.map(source));
	}

	@Test
	void missingAnnotationIsInferred() {
		assertEquals("auto", types.map(null));
		assertEquals("auto", types.map("  "));
	}

	@Test
	void unknownGenericPassesThrough() {
		assertEquals("Map<string, int>", types.map("Map<string, int>"));
		assertEquals("array<int>", types.map("array<int>"));
	}
}
