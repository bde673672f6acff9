package naytive.parse.ts;

import naytive.ast.SourceSpan;
import naytive.ast.ts.ArrayLiteralExpression;
import naytive.ast.ts.ArrowFunction;
import naytive.ast.ts.BinaryExpression;
import naytive.ast.ts.Block;
import naytive.ast.ts.BooleanLiteral;
import naytive.ast.ts.CallExpression;
import naytive.ast.ts.DeclareStatement;
import naytive.ast.ts.ElementAccessExpression;
import naytive.ast.ts.ExpressionStatement;
import naytive.ast.ts.ForStatement;
import naytive.ast.ts.FunctionDeclaration;
import naytive.ast.ts.Identifier;
import naytive.ast.ts.IfStatement;
import naytive.ast.ts.ImportDeclaration;
import naytive.ast.ts.NoSubstitutionTemplateLiteral;
import naytive.ast.ts.NullLiteral;
import naytive.ast.ts.NumericLiteral;
import naytive.ast.ts.Parameter;
import naytive.ast.ts.ParenthesizedExpression;
import naytive.ast.ts.PostfixUnaryExpression;
import naytive.ast.ts.PrefixUnaryExpression;
import naytive.ast.ts.PropertyAccessExpression;
import naytive.ast.ts.ReturnStatement;
import naytive.ast.ts.SourceFile;
import naytive.ast.ts.StringLiteral;
import naytive.ast.ts.TemplateExpression;
import naytive.ast.ts.TsExpression;
import naytive.ast.ts.TsNode;
import naytive.ast.ts.TsStatement;
import naytive.ast.ts.TypeOfExpression;
import naytive.ast.ts.VariableDeclaration;
import naytive.ast.ts.VariableDeclarationList;
import naytive.ast.ts.VariableStatement;
import naytive.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the TypeScript subset supported by the compiler.
 *
 * Besides building the tree it attaches a resolved C++ type to every variable
 * declaration: the mapped annotation when there is one, otherwise a type read
 * off a literal initializer. No other inference happens here.
 */
public final class TsParser {
	private static final Set<String> DECLARATION_KEYWORDS = Set.of("const", "let", "var");
	private static final Set<String> ASSIGNMENT_OPS = Set.of("=", "+=", "-=", "*=", "/=", "%=");
	private static final Set<String> EQUALITY_OPS = Set.of("==", "!=", "===", "!==");
	private static final Set<String> RELATIONAL_OPS = Set.of("<", ">", "<=", ">=");
	private static final Set<String> ADDITIVE_OPS = Set.of("+", "-");
	private static final Set<String> MULTIPLICATIVE_OPS = Set.of("*", "/", "%");
	private static final Set<String> PREFIX_OPS = Set.of("!", "-", "+", "++", "--");

	private final TypeMapper types;

	public TsParser() {
		this(new TypeMapper());
	}

	public TsParser(TypeMapper types) {
		this.types = types;
	}

	public SourceFile parse(String source) {
		Cursor c = new Cursor(new TsLexer().lex(source));
		List<TsStatement> statements = new ArrayList<>();
		while (!c.isAtEnd()) {
			statements.add(parseStatement(c));
		}
		return new SourceFile(statements, new SourceSpan(0, source.length()));
	}

	/**
	 * Parses a standalone expression whose text starts at {@code offset} of the
	 * enclosing source.
	 */
	public TsExpression parseExpression(String text, int offset) {
		Cursor c = new Cursor(new TsLexer().lex(text, offset));
		TsExpression expression = parseAssignment(c);
		if (!c.isAtEnd()) {
			throw unexpected(c.peek());
		}
		return expression;
	}

	private TsStatement parseStatement(Cursor c) {
		if (c.peekIsIdent("export")) {
			c.next();
		}
		if (c.peekIsIdent("import")) {
			return parseImport(c);
		}
		if (c.peekIsIdent("declare")) {
			TsToken start = c.next();
			VariableStatement declaration = parseVariableStatement(c);
			return new DeclareStatement(declaration, SourceSpan.between(start.span(), declaration.span()));
		}
		if (c.peekIsDeclarationKeyword()) {
			return parseVariableStatement(c);
		}
		if (c.peekIsIdent("function")) {
			return parseFunction(c);
		}
		if (c.peekIsIdent("if")) {
			return parseIf(c);
		}
		if (c.peekIsIdent("for")) {
			return parseFor(c);
		}
		if (c.peekIsIdent("return")) {
			TsToken start = c.next();
			TsExpression value = null;
			if (!c.peekIsSymbol(";") && !c.peekIsSymbol("}") && !c.isAtEnd()) {
				value = parseAssignment(c);
			}
			SourceSpan end = value == null ? start.span() : value.span();
			end = consumeOptionalSemicolon(c, end);
			return new ReturnStatement(value, SourceSpan.between(start.span(), end));
		}
		if (c.peekIsSymbol("{")) {
			return parseBlock(c);
		}

		TsExpression expression = parseAssignment(c);
		SourceSpan end = consumeOptionalSemicolon(c, expression.span());
		return new ExpressionStatement(expression, SourceSpan.between(expression.span(), end));
	}

	private ImportDeclaration parseImport(Cursor c) {
		TsToken start = c.expectIdent("import");
		List<String> names = new ArrayList<>();

		if (c.peekIsSymbol("{")) {
			c.next();
			while (!c.peekIsSymbol("}")) {
				TsToken name = c.expect(TsTokenType.IDENT, "imported name");
				// import { a as b }: the local binding is what the module sees
				if (c.peekIsIdent("as")) {
					c.next();
					name = c.expect(TsTokenType.IDENT, "import alias");
				}
				names.add(name.lexeme());
				if (!c.peekIsSymbol(",")) {
					break;
				}
				c.next();
			}
			c.expectSymbol("}");
			c.expectIdent("from");
		} else if (c.peek().type() == TsTokenType.IDENT) {
			names.add(c.next().lexeme());
			c.expectIdent("from");
		}

		TsToken specifier = c.expect(TsTokenType.STRING, "module specifier");
		SourceSpan end = consumeOptionalSemicolon(c, specifier.span());
		return new ImportDeclaration(unquote(specifier.lexeme()), names, SourceSpan.between(start.span(), end));
	}

	private VariableStatement parseVariableStatement(Cursor c) {
		VariableDeclarationList list = parseDeclarationList(c);
		SourceSpan end = consumeOptionalSemicolon(c, list.span());
		return new VariableStatement(list, SourceSpan.between(list.span(), end));
	}

	private VariableDeclarationList parseDeclarationList(Cursor c) {
		TsToken keyword = c.next();
		List<VariableDeclaration> declarations = new ArrayList<>();
		while (true) {
			declarations.add(parseDeclarator(c));
			if (!c.peekIsSymbol(",")) {
				break;
			}
			c.next();
		}
		VariableDeclaration last = declarations.get(declarations.size() - 1);
		return new VariableDeclarationList(keyword.lexeme(), declarations,
				SourceSpan.between(keyword.span(), last.span()));
	}

	private VariableDeclaration parseDeclarator(Cursor c) {
		TsToken name = c.expect(TsTokenType.IDENT, "variable name");
		String annotation = null;
		if (c.peekIsSymbol(":")) {
			c.next();
			annotation = parseType(c);
		}

		TsExpression initializer = null;
		if (c.peekIsSymbol("=")) {
			c.next();
			initializer = parseAssignment(c);
		}

		SourceSpan end = initializer == null ? c.previous().span() : initializer.span();
		String resolved = annotation != null ? types.map(annotation) : inferType(initializer);
		return new VariableDeclaration(name.lexeme(), annotation, initializer, resolved,
				SourceSpan.between(name.span(), end));
	}

	private String inferType(TsExpression initializer) {
		if (initializer instanceof NumericLiteral number) {
			return number.text().contains(".") ? "double" : "int";
		}
		if (initializer instanceof StringLiteral || initializer instanceof TemplateExpression
				|| initializer instanceof NoSubstitutionTemplateLiteral) {
			return "std::string";
		}
		if (initializer instanceof BooleanLiteral) {
			return "bool";
		}
		if (initializer instanceof ArrayLiteralExpression array && !array.elements().isEmpty()) {
			// element type; the declaration rule turns the name into name[]
			return inferType(array.elements().get(0));
		}
		return null;
	}

	private FunctionDeclaration parseFunction(Cursor c) {
		TsToken start = c.expectIdent("function");
		TsToken name = c.expect(TsTokenType.IDENT, "function name");
		List<Parameter> parameters = parseParameters(c);
		String returnType = null;
		if (c.peekIsSymbol(":")) {
			c.next();
			returnType = parseType(c);
		}
		Block body = parseBlock(c);
		return new FunctionDeclaration(name.lexeme(), parameters, returnType, body,
				SourceSpan.between(start.span(), body.span()));
	}

	private List<Parameter> parseParameters(Cursor c) {
		c.expectSymbol("(");
		List<Parameter> parameters = new ArrayList<>();
		while (!c.peekIsSymbol(")")) {
			TsToken name = c.expect(TsTokenType.IDENT, "parameter name");
			String annotation = null;
			if (c.peekIsSymbol(":")) {
				c.next();
				annotation = parseType(c);
			}
			parameters.add(new Parameter(name.lexeme(), annotation,
					SourceSpan.between(name.span(), c.previous().span())));
			if (!c.peekIsSymbol(",")) {
				break;
			}
			c.next();
		}
		c.expectSymbol(")");
		return parameters;
	}

	/**
	 * Reads a type annotation back into text: {@code int}, {@code number[]},
	 * {@code array<int, 3>}.
	 */
	private String parseType(Cursor c) {
		StringBuilder text = new StringBuilder(c.expect(TsTokenType.IDENT, "type").lexeme());
		if (c.peekIsSymbol("<")) {
			text.append(c.next().lexeme());
			int depth = 1;
			while (depth > 0 && !c.isAtEnd()) {
				TsToken t = c.next();
				if (t.lexeme().equals("<")) {
					depth++;
				} else if (t.lexeme().equals(">")) {
					depth--;
				}
				text.append(t.lexeme());
				if (t.lexeme().equals(",")) {
					text.append(' ');
				}
			}
		}
		while (c.peekIsSymbol("[") && c.peekAheadIsSymbol(1, "]")) {
			c.next();
			c.next();
			text.append("[]");
		}
		return text.toString();
	}

	private Block parseBlock(Cursor c) {
		TsToken start = c.expectSymbol("{");
		List<TsStatement> statements = new ArrayList<>();
		while (!c.isAtEnd() && !c.peekIsSymbol("}")) {
			statements.add(parseStatement(c));
		}
		TsToken end = c.expectSymbol("}");
		return new Block(statements, SourceSpan.between(start.span(), end.span()));
	}

	private IfStatement parseIf(Cursor c) {
		TsToken start = c.expectIdent("if");
		c.expectSymbol("(");
		TsExpression condition = parseAssignment(c);
		c.expectSymbol(")");
		TsStatement thenStatement = parseStatement(c);
		TsStatement elseStatement = null;
		if (c.peekIsIdent("else")) {
			c.next();
			elseStatement = parseStatement(c);
		}
		TsStatement last = elseStatement == null ? thenStatement : elseStatement;
		return new IfStatement(condition, thenStatement, elseStatement, SourceSpan.between(start.span(), last.span()));
	}

	private ForStatement parseFor(Cursor c) {
		TsToken start = c.expectIdent("for");
		c.expectSymbol("(");

		TsNode initializer = null;
		if (c.peekIsDeclarationKeyword()) {
			initializer = parseDeclarationList(c);
		} else if (!c.peekIsSymbol(";")) {
			initializer = parseAssignment(c);
		}
		c.expectSymbol(";");

		TsExpression condition = c.peekIsSymbol(";") ? null : parseAssignment(c);
		c.expectSymbol(";");

		TsExpression incrementor = c.peekIsSymbol(")") ? null : parseAssignment(c);
		c.expectSymbol(")");

		TsStatement body = parseStatement(c);
		return new ForStatement(initializer, condition, incrementor, body, SourceSpan.between(start.span(), body.span()));
	}

	private TsExpression parseAssignment(Cursor c) {
		if (looksLikeArrow(c)) {
			return parseArrow(c);
		}

		TsExpression left = parseBinary(c, 0);
		if (c.peek().type() == TsTokenType.SYMBOL && ASSIGNMENT_OPS.contains(c.peek().lexeme())) {
			String op = c.next().lexeme();
			TsExpression right = parseAssignment(c);
			return new BinaryExpression(left, op, right, SourceSpan.between(left.span(), right.span()));
		}
		return left;
	}

	private static final List<Set<String>> BINARY_LEVELS = List.of(
			Set.of("||"),
			Set.of("&&"),
			EQUALITY_OPS,
			RELATIONAL_OPS,
			ADDITIVE_OPS,
			MULTIPLICATIVE_OPS);

	private TsExpression parseBinary(Cursor c, int level) {
		if (level == BINARY_LEVELS.size()) {
			return parseUnary(c);
		}
		TsExpression left = parseBinary(c, level + 1);
		while (c.peek().type() == TsTokenType.SYMBOL && BINARY_LEVELS.get(level).contains(c.peek().lexeme())) {
			String op = c.next().lexeme();
			TsExpression right = parseBinary(c, level + 1);
			left = new BinaryExpression(left, op, right, SourceSpan.between(left.span(), right.span()));
		}
		return left;
	}

	private TsExpression parseUnary(Cursor c) {
		TsToken t = c.peek();
		if (t.type() == TsTokenType.SYMBOL && PREFIX_OPS.contains(t.lexeme())) {
			c.next();
			TsExpression operand = parseUnary(c);
			return new PrefixUnaryExpression(t.lexeme(), operand, SourceSpan.between(t.span(), operand.span()));
		}
		if (c.peekIsIdent("typeof")) {
			c.next();
			TsExpression operand = parseUnary(c);
			return new TypeOfExpression(operand, SourceSpan.between(t.span(), operand.span()));
		}

		TsExpression expression = parseCallOrMember(c);
		if (c.peekIsSymbol("++") || c.peekIsSymbol("--")) {
			TsToken op = c.next();
			return new PostfixUnaryExpression(expression, op.lexeme(), SourceSpan.between(expression.span(), op.span()));
		}
		return expression;
	}

	private TsExpression parseCallOrMember(Cursor c) {
		TsExpression expression = parsePrimary(c);
		while (true) {
			if (c.peekIsSymbol(".")) {
				c.next();
				TsToken name = c.expect(TsTokenType.IDENT, "property name");
				expression = new PropertyAccessExpression(expression, name.lexeme(),
						SourceSpan.between(expression.span(), name.span()));
				continue;
			}
			if (c.peekIsSymbol("(")) {
				c.next();
				List<TsExpression> arguments = new ArrayList<>();
				while (!c.peekIsSymbol(")")) {
					arguments.add(parseAssignment(c));
					if (!c.peekIsSymbol(",")) {
						break;
					}
					c.next();
				}
				TsToken end = c.expectSymbol(")");
				expression = new CallExpression(expression, arguments, SourceSpan.between(expression.span(), end.span()));
				continue;
			}
			if (c.peekIsSymbol("[")) {
				c.next();
				TsExpression argument = parseAssignment(c);
				TsToken end = c.expectSymbol("]");
				expression = new ElementAccessExpression(expression, argument,
						SourceSpan.between(expression.span(), end.span()));
				continue;
			}
			return expression;
		}
	}

	private TsExpression parsePrimary(Cursor c) {
		TsToken t = c.next();
		return switch (t.type()) {
			case NUMBER -> new NumericLiteral(t.lexeme(), t.span());
			case STRING -> new StringLiteral(cook(unquote(t.lexeme())), t.span());
			case TEMPLATE -> parseTemplate(t);
			case IDENT -> switch (t.lexeme()) {
				case "true" -> new BooleanLiteral(true, t.span());
				case "false" -> new BooleanLiteral(false, t.span());
				case "null", "undefined" -> new NullLiteral(t.span());
				default -> new Identifier(t.lexeme(), t.span());
			};
			case SYMBOL -> parseGrouping(c, t);
			default -> throw unexpected(t);
		};
	}

	/**
	 * A parenthesized expression or an array literal; {@code open} is already consumed.
	 */
	private TsExpression parseGrouping(Cursor c, TsToken open) {
		if (open.lexeme().equals("(")) {
			TsExpression inner = parseAssignment(c);
			TsToken end = c.expectSymbol(")");
			return new ParenthesizedExpression(inner, SourceSpan.between(open.span(), end.span()));
		}
		if (open.lexeme().equals("[")) {
			List<TsExpression> elements = new ArrayList<>();
			while (!c.peekIsSymbol("]")) {
				elements.add(parseAssignment(c));
				if (!c.peekIsSymbol(",")) {
					break;
				}
				c.next();
			}
			TsToken end = c.expectSymbol("]");
			return new ArrayLiteralExpression(elements, SourceSpan.between(open.span(), end.span()));
		}
		throw unexpected(open);
	}

	private boolean looksLikeArrow(Cursor c) {
		if (c.peek().type() == TsTokenType.IDENT) {
			return c.peekAheadIsSymbol(1, "=>");
		}
		if (!c.peekIsSymbol("(")) {
			return false;
		}
		int close = c.matchingParen();
		if (close < 0) {
			return false;
		}
		TsToken after = c.at(close + 1);
		return after.type() == TsTokenType.SYMBOL && (after.lexeme().equals("=>") || after.lexeme().equals(":"));
	}

	private ArrowFunction parseArrow(Cursor c) {
		TsToken start = c.peek();
		List<Parameter> parameters;
		if (start.type() == TsTokenType.IDENT) {
			c.next();
			parameters = List.of(new Parameter(start.lexeme(), null, start.span()));
		} else {
			parameters = parseParameters(c);
		}

		String returnType = null;
		if (c.peekIsSymbol(":")) {
			c.next();
			returnType = parseType(c);
		}
		c.expectSymbol("=>");

		TsNode body = c.peekIsSymbol("{") ? parseBlock(c) : parseAssignment(c);
		return new ArrowFunction(parameters, returnType, body, SourceSpan.between(start.span(), body.span()));
	}

	private TsExpression parseTemplate(TsToken token) {
		String raw = token.lexeme().substring(1, token.lexeme().length() - 1);
		int base = token.span().startOffset() + 1;

		String head = null;
		List<TemplateExpression.Span> spans = new ArrayList<>();
		StringBuilder literal = new StringBuilder();
		TsExpression pending = null;

		int i = 0;
		while (i < raw.length()) {
			char ch = raw.charAt(i);
			if (ch == '\\' && i + 1 < raw.length()) {
				literal.append(ch).append(raw.charAt(i + 1));
				i += 2;
				continue;
			}
			if (ch == '$' && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
				int close = placeholderEnd(raw, i + 2);
				if (pending == null) {
					head = cook(literal.toString());
				} else {
					spans.add(new TemplateExpression.Span(pending, cook(literal.toString())));
				}
				literal.setLength(0);
				pending = parseExpression(raw.substring(i + 2, close), base + i + 2);
				i = close + 1;
				continue;
			}
			literal.append(ch);
			i++;
		}

		if (pending == null) {
			return new NoSubstitutionTemplateLiteral(cook(literal.toString()), token.span());
		}
		spans.add(new TemplateExpression.Span(pending, cook(literal.toString())));
		return new TemplateExpression(head, spans, token.span());
	}

	private static int placeholderEnd(String raw, int from) {
		int depth = 0;
		for (int i = from; i < raw.length(); i++) {
			char ch = raw.charAt(i);
			if (ch == '{') {
				depth++;
			} else if (ch == '}') {
				if (depth == 0) {
					return i;
				}
				depth--;
			} else if (ch == '"' || ch == '\'') {
				int j = i + 1;
				while (j < raw.length() && raw.charAt(j) != ch) {
					j += raw.charAt(j) == '\\' ? 2 : 1;
				}
				i = j;
			}
		}
		throw new TsParseException("Unterminated template placeholder", from);
	}

	private static SourceSpan consumeOptionalSemicolon(Cursor c, SourceSpan fallback) {
		if (c.peekIsSymbol(";")) {
			return c.next().span();
		}
		return fallback;
	}

	private static String unquote(String lexeme) {
		return lexeme.substring(1, lexeme.length() - 1);
	}

	/**
	 * Resolves JavaScript escape sequences.
	 */
	static String cook(String raw) {
		StringBuilder out = new StringBuilder(raw.length());
		for (int i = 0; i < raw.length(); i++) {
			char ch = raw.charAt(i);
			if (ch != '\\' || i + 1 == raw.length()) {
				out.append(ch);
				continue;
			}
			char next = raw.charAt(++i);
			switch (next) {
				case 'n' -> out.append('\n');
				case 't' -> out.append('\t');
				case 'r' -> out.append('\r');
				case '0' -> out.append('\0');
				case 'u' -> {
					if (i + 4 < raw.length()) {
						out.append((char) Integer.parseInt(raw.substring(i + 1, i + 5), 16));
						i += 4;
					} else {
						out.append(next);
					}
				}
				default -> out.append(next);
			}
		}
		return out.toString();
	}

	private static TsParseException unexpected(TsToken t) {
		if (t.type() == TsTokenType.EOF) {
			return new TsParseException("Unexpected end of input", t.span().startOffset());
		}
		return new TsParseException("Unexpected " + t.type() + " '" + t.lexeme() + "'", t.span().startOffset());
	}

	private static final class Cursor {
		private final List<TsToken> tokens;
		private int pos;

		Cursor(List<TsToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == TsTokenType.EOF;
		}

		TsToken peek() {
			return tokens.get(pos);
		}

		TsToken at(int index) {
			return tokens.get(Math.min(index, tokens.size() - 1));
		}

		TsToken previous() {
			return tokens.get(Math.max(0, pos - 1));
		}

		TsToken next() {
			TsToken t = tokens.get(pos);
			if (t.type() != TsTokenType.EOF) {
				pos++;
			}
			return t;
		}

		boolean peekIsIdent(String lexeme) {
			TsToken t = peek();
			return t.type() == TsTokenType.IDENT && t.lexeme().equals(lexeme);
		}

		boolean peekIsSymbol(String lexeme) {
			return isSymbol(peek(), lexeme);
		}

		boolean peekAheadIsSymbol(int distance, String lexeme) {
			return isSymbol(at(pos + distance), lexeme);
		}

		boolean peekIsDeclarationKeyword() {
			TsToken t = peek();
			return t.type() == TsTokenType.IDENT && DECLARATION_KEYWORDS.contains(t.lexeme());
		}

		/**
		 * Index of the ')' closing the '(' at the cursor, or -1.
		 */
		int matchingParen() {
			int depth = 0;
			for (int i = pos; i < tokens.size(); i++) {
				TsToken t = tokens.get(i);
				if (isSymbol(t, "(")) {
					depth++;
				} else if (isSymbol(t, ")")) {
					depth--;
					if (depth == 0) {
						return i;
					}
				}
			}
			return -1;
		}

		TsToken expectIdent(String lexeme) {
			TsToken t = expect(TsTokenType.IDENT, "'" + lexeme + "'");
			if (!t.lexeme().equals(lexeme)) {
				throw new TsParseException("Expected " + lexeme + " but got " + t.lexeme(), t.span().startOffset());
			}
			return t;
		}

		TsToken expectSymbol(String lexeme) {
			TsToken t = next();
			if (!isSymbol(t, lexeme)) {
				throw new TsParseException("Expected symbol " + lexeme + " but got " + t.type() + "(" + t.lexeme() + ")",
						t.span().startOffset());
			}
			return t;
		}

		TsToken expect(TsTokenType type, String what) {
			TsToken t = next();
			if (t.type() != type) {
				throw new TsParseException("Expected " + what + " but got " + t.type() + "(" + t.lexeme() + ")",
						t.span().startOffset());
			}
			return t;
		}

		private static boolean isSymbol(TsToken t, String lexeme) {
			return t.type() == TsTokenType.SYMBOL && t.lexeme().equals(lexeme);
		}
	}
}
