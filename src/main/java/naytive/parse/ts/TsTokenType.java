package naytive.parse.ts;

public enum TsTokenType {
	IDENT,
	NUMBER,
	STRING,
	TEMPLATE,
	SYMBOL,
	EOF
}
