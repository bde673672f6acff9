package naytive.transform;

/**
 * Include directives registered by the rules.
 */
public final class Includes {
	public static final String IOSTREAM = system("iostream");
	public static final String IOMANIP = system("iomanip");
	public static final String STRING = system("string");
	public static final String VECTOR = system("vector");
	public static final String SSTREAM = system("sstream");
	public static final String TYPEINFO = system("typeinfo");

	private Includes() {
	}

	public static String system(String header) {
		return "#include <" + header + ">";
	}

	public static String quoted(String path) {
		return "#include \"" + path + "\"";
	}
}
