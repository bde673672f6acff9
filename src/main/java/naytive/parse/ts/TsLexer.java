package naytive.parse.ts;

import naytive.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Tiny lexer for the TypeScript subset understood by the compiler.
 *
 * Notes:
 * - Skips whitespace, // line comments and /* block comments *\/.
 * - A template literal is kept as one TEMPLATE token including its backticks;
 * the parser splits it into segments and re-parses the embedded expressions.
 * - Regular expression literals are not supported.
 */
public final class TsLexer {
	private static final List<String> THREE_CHAR = List.of("===", "!==");
	private static final List<String> TWO_CHAR = List.of(
			"=>", "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=");

	public List<TsToken> lex(String input) {
		return lex(input, 0);
	}

	/**
	 * Lexes {@code input} reporting spans shifted by {@code base}; used when
	 * re-lexing the inside of a template placeholder.
	 */
	public List<TsToken> lex(String input, int base) {
		List<TsToken> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '/') {
					i = consumeLineComment(input, i);
					continue;
				}
				if (n == '*') {
					i = consumeBlockComment(input, i);
					continue;
				}
			}

			if (c == '"' || c == '\'') {
				int start = i;
				i = consumeQuoted(input, i, c);
				tokens.add(token(TsTokenType.STRING, input, start, i, base));
				continue;
			}

			if (c == '`') {
				int start = i;
				i = consumeTemplate(input, i);
				tokens.add(token(TsTokenType.TEMPLATE, input, start, i, base));
				continue;
			}

			if (isIdentifierStart(c)) {
				int start = i;
				i++;
				while (i < input.length() && isIdentifierPart(input.charAt(i))) {
					i++;
				}
				tokens.add(token(TsTokenType.IDENT, input, start, i, base));
				continue;
			}

			if (Character.isDigit(c)) {
				int start = i;
				i = consumeNumber(input, i);
				tokens.add(token(TsTokenType.NUMBER, input, start, i, base));
				continue;
			}

			String symbol = matchSymbol(input, i);
			int start = i;
			i += symbol.length();
			tokens.add(token(TsTokenType.SYMBOL, input, start, i, base));
		}

		tokens.add(new TsToken(TsTokenType.EOF, "", new SourceSpan(base + input.length(), base + input.length())));
		return tokens;
	}

	private static TsToken token(TsTokenType type, String input, int start, int end, int base) {
		return new TsToken(type, input.substring(start, end), new SourceSpan(base + start, base + end));
	}

	private static String matchSymbol(String input, int i) {
		for (String candidate : THREE_CHAR) {
			if (input.startsWith(candidate, i)) {
				return candidate;
			}
		}
		for (String candidate : TWO_CHAR) {
			if (input.startsWith(candidate, i)) {
				return candidate;
			}
		}
		return String.valueOf(input.charAt(i));
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_' || c == '$';
	}

	private static boolean isIdentifierPart(char c) {
		return isIdentifierStart(c) || Character.isDigit(c);
	}

	private static int consumeNumber(String input, int start) {
		int i = start;
		while (i < input.length() && Character.isDigit(input.charAt(i))) {
			i++;
		}
		if (i + 1 < input.length() && input.charAt(i) == '.' && Character.isDigit(input.charAt(i + 1))) {
			i++;
			while (i < input.length() && Character.isDigit(input.charAt(i))) {
				i++;
			}
		}
		return i;
	}

	private static int consumeLineComment(String input, int start) {
		int i = start + 2;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\n') {
				return i + 1;
			}
			i++;
		}
		return i;
	}

	private static int consumeBlockComment(String input, int start) {
		int i = start + 2;
		while (i < input.length()) {
			if (input.charAt(i) == '*' && i + 1 < input.length() && input.charAt(i + 1) == '/') {
				return i + 2;
			}
			i++;
		}
		throw new TsParseException("Unterminated block comment", start);
	}

	private static int consumeQuoted(String input, int start, char quote) {
		int i = start + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				i = Math.min(i + 2, input.length());
				continue;
			}
			if (c == quote) {
				return i + 1;
			}
			if (c == '\n') {
				break;
			}
			i++;
		}
		throw new TsParseException("Unterminated string literal", start);
	}

	private static int consumeTemplate(String input, int start) {
		int i = start + 1;
		int depth = 0;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				i = Math.min(i + 2, input.length());
				continue;
			}
			if (depth == 0 && c == '`') {
				return i + 1;
			}
			if (c == '$' && i + 1 < input.length() && input.charAt(i + 1) == '{') {
				depth++;
				i += 2;
				continue;
			}
			if (depth > 0 && c == '{') {
				depth++;
			} else if (depth > 0 && c == '}') {
				depth--;
			} else if (depth > 0 && (c == '"' || c == '\'')) {
				i = consumeQuoted(input, i, c);
				continue;
			}
			i++;
		}
		throw new TsParseException("Unterminated template literal", start);
	}
}
