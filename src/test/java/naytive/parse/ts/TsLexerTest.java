package naytive.parse.ts;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TsLexerTest {
	private static String lexemes(String input) {
		return new TsLexer().lex(input).stream()
				.filter(t -> t.type() != TsTokenType.EOF)
				.map(TsToken::lexeme)
				.collect(Collectors.joining("|"));
	}

	@Test
	void skipsLineAndBlockCommentsButNotInsideStrings() {
		String input = "let x = 1; // line\n" +
				"/* block */ const y=2;\n" +
				"const s = \"/* not a comment */\"; // trailing\n";

		assertEquals("let|x|=|1|;|const|y|=|2|;|const|s|=|\"/* not a comment */\"|;", lexemes(input));
	}

	@Test
	void prefersLongestOperator() {
		assertEquals("a|===|b|!==|c|=>|d|+=|1|++", lexemes("a === b !== c => d += 1++"));
	}

	@Test
	void templateIsOneTokenIncludingPlaceholders() {
		List<TsToken> tokens = new TsLexer().lex("`a ${ {x: 1}.x } b` + 1");
		assertEquals(TsTokenType.TEMPLATE, tokens.get(0).type());
		assertEquals("`a ${ {x: 1}.x } b`", tokens.get(0).lexeme());
		assertEquals("+", tokens.get(1).lexeme());
	}

	@Test
	void decimalNumbersAndIdentifiers() {
		assertEquals("$el|=|3.25|+|_x1|.|y", lexemes("$el = 3.25 + _x1.y"));
	}

	@Test
	void spansAreShiftedByBase() {
		TsToken token = new TsLexer().lex("name", 10).get(0);
		assertEquals(10, token.span().startOffset());
		assertEquals(14, token.span().endOffset());
	}

	@Test
	void unterminatedStringIsRejected() {
		TsParseException ex = assertThrows(TsParseException.class, () -> new TsLexer().lex("let s = 'abc\n"));
		assertEquals(8, ex.offset());
	}

	@Test
	void unterminatedTemplateIsRejected() {
		assertThrows(TsParseException.class, () -> new TsLexer().lex("`abc"));
	}
}
