package naytive.ast.ts;

/**
 * Discriminant of every source node. The dispatch table is keyed by this enum.
 */
public enum NodeKind {
	SOURCE_FILE,
	IMPORT_DECLARATION,
	DECLARE_STATEMENT,
	VARIABLE_STATEMENT,
	VARIABLE_DECLARATION_LIST,
	VARIABLE_DECLARATION,
	FUNCTION_DECLARATION,
	PARAMETER,
	ARROW_FUNCTION,
	BLOCK,
	IF_STATEMENT,
	FOR_STATEMENT,
	EXPRESSION_STATEMENT,
	RETURN_STATEMENT,
	BINARY_EXPRESSION,
	CALL_EXPRESSION,
	PROPERTY_ACCESS_EXPRESSION,
	ELEMENT_ACCESS_EXPRESSION,
	TEMPLATE_EXPRESSION,
	NO_SUBSTITUTION_TEMPLATE_LITERAL,
	STRING_LITERAL,
	NUMERIC_LITERAL,
	BOOLEAN_LITERAL,
	NULL_LITERAL,
	IDENTIFIER,
	ARRAY_LITERAL_EXPRESSION,
	TYPE_OF_EXPRESSION,
	PREFIX_UNARY_EXPRESSION,
	POSTFIX_UNARY_EXPRESSION,
	PARENTHESIZED_EXPRESSION
}
