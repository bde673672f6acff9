package naytive;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GoldenCompileTest extends NaytiveLoggingConfig {
	@Test
	void compilesSampleToExpectedCpp() throws Exception {
		Path sourcePath = Path.of("src", "test", "resources", "golden", "sample.ts");
		Path expectedPath = Path.of("src", "test", "resources", "golden", "sample.cpp");

		String source = Files.readString(sourcePath);
		String expected = Files.readString(expectedPath);
		String actual = new Compiler().compile(source, sourcePath);

		assertEquals(normalize(expected), normalize(actual));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
