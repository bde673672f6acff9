package naytive.transform;

import naytive.ast.ts.Identifier;
import naytive.ast.ts.PropertyAccessExpression;
import naytive.ast.ts.TsExpression;

import java.util.Optional;

/**
 * Dot-joined identifier path of a callee, e.g. {@code std.cout}. Callees that
 * are not plain identifier chains have no qualified name.
 */
public final class QualifiedName {
	private QualifiedName() {
	}

	public static Optional<String> of(TsExpression callee) {
		if (callee instanceof Identifier id) {
			return Optional.of(id.text());
		}
		if (callee instanceof PropertyAccessExpression access) {
			return of(access.expression()).map(receiver -> receiver + "." + access.name());
		}
		return Optional.empty();
	}
}
