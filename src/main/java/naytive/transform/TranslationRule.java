package naytive.transform;

import naytive.ast.ts.TsNode;

/**
 * Lowers one node to a C++ fragment. The only side effects allowed are
 * registrations in the translator's {@link naytive.build.BuildState}.
 */
@FunctionalInterface
public interface TranslationRule {
	String apply(TsNode node, SourceContext ctx, Translator translator);

	@FunctionalInterface
	interface Typed<N extends TsNode> {
		String apply(N node, SourceContext ctx, Translator translator);
	}

	static <N extends TsNode> TranslationRule of(Class<N> type, Typed<N> rule) {
		return (node, ctx, translator) -> rule.apply(type.cast(node), ctx, translator);
	}
}
