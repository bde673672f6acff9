package naytive.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps source type annotations to C++ type names.
 *
 * Besides the TypeScript primitives this understands the Naytive builtin
 * types ({@code int}, {@code uint}, {@code longlong}, ...) and a few generic
 * forms: {@code T[]}, {@code array<T, N>}, {@code vector<T>} and
 * {@code pointer<T>}. Anything else is assumed to be a user type and passes
 * through unchanged.
 */
public final class TypeMapper {
	public static final String INFERRED = "auto";

	private static final Map<String, String> NAMED = Map.ofEntries(
			Map.entry("number", "int"),
			Map.entry("string", "std::string"),
			Map.entry("boolean", "bool"),
			Map.entry("void", "void"),
			Map.entry("any", INFERRED),
			Map.entry("unknown", INFERRED),
			Map.entry("int", "int"),
			Map.entry("char", "char"),
			Map.entry("float", "float"),
			Map.entry("double", "double"),
			Map.entry("long", "long"),
			Map.entry("short", "short"),
			Map.entry("longlong", "long long"),
			Map.entry("uint", "unsigned int"),
			Map.entry("ushort", "unsigned short"),
			Map.entry("ulong", "unsigned long"),
			Map.entry("ulonglong", "unsigned long long"),
			Map.entry("longdouble", "long double"));

	public String map(String sourceType) {
		if (sourceType == null || sourceType.isBlank()) {
			return INFERRED;
		}

		String type = sourceType.trim();
		if (type.endsWith("[]")) {
			return "std::vector<" + map(type.substring(0, type.length() - 2)) + ">";
		}

		int lt = type.indexOf('<');
		if (lt > 0 && type.endsWith(">")) {
			String base = type.substring(0, lt).trim();
			List<String> args = splitTypeArguments(type.substring(lt + 1, type.length() - 1));
			String mapped = switch (base) {
				case "array" -> args.size() == 2 ? "std::array<" + map(args.get(0)) + ", " + args.get(1) + ">" : null;
				case "vector" -> args.size() == 1 ? "std::vector<" + map(args.get(0)) + ">" : null;
				case "pointer" -> args.size() == 1 ? map(args.get(0)) + "*" : null;
				default -> null;
			};
			return mapped != null ? mapped : type;
		}

		return NAMED.getOrDefault(type, type);
	}

	private static List<String> splitTypeArguments(String text) {
		List<String> args = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '<') {
				depth++;
			} else if (c == '>') {
				depth--;
			} else if (c == ',' && depth == 0) {
				args.add(text.substring(start, i).trim());
				start = i + 1;
			}
		}
		args.add(text.substring(start).trim());
		return args;
	}
}
