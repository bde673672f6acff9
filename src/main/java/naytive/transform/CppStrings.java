package naytive.transform;

/**
 * C++ string literal quoting.
 */
public final class CppStrings {
	private CppStrings() {
	}

	public static String quote(String text) {
		StringBuilder out = new StringBuilder(text.length() + 2);
		out.append('"');
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '"' -> out.append("\\\"");
				case '\\' -> out.append("\\\\");
				case '\n' -> out.append("\\n");
				case '\r' -> out.append("\\r");
				case '\t' -> out.append("\\t");
				case '\b' -> out.append("\\b");
				case '\f' -> out.append("\\f");
				default -> {
					if (c < 0x20) {
						// octal escapes stop after three digits, hex ones do not
						out.append(String.format("\\%03o", (int) c));
					} else {
						out.append(c);
					}
				}
			}
		}
		return out.append('"').toString();
	}
}
