package naytive.parse.ts;

import naytive.ast.SourceSpan;

public record TsToken(TsTokenType type, String lexeme, SourceSpan span) {
}
