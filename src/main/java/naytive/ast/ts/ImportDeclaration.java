package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

/**
 * {@code import { a, b } from "./module";} or {@code import "./lib/math.h";}
 *
 * The specifier is stored without its quotes.
 */
public record ImportDeclaration(String moduleSpecifier, List<String> namedImports, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.IMPORT_DECLARATION;
	}
}
