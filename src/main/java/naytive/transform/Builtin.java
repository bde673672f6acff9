package naytive.transform;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Library calls recognised by their qualified name.
 */
public enum Builtin {
	STD_COUT("std.cout", Role.PRINT),
	CONSOLE_LOG("console.log", Role.PRINT),
	MEMORY_POINTER("memory.pointer", Role.ADDRESS_OF),
	MEMORY_DEREFERENCE("memory.dereference", Role.DEREFERENCE),
	STD_CIN("std.cin", Role.READ),
	ALERT("alert", Role.READ);

	public enum Role {
		PRINT,
		ADDRESS_OF,
		DEREFERENCE,
		/** Console input; only meaningful as an initializer or assignment source. */
		READ
	}

	private static final Map<String, Builtin> BY_NAME = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(Builtin::qualifiedName, Function.identity()));

	private final String qualifiedName;
	private final Role role;

	Builtin(String qualifiedName, Role role) {
		this.qualifiedName = qualifiedName;
		this.role = role;
	}

	public String qualifiedName() {
		return qualifiedName;
	}

	public Role role() {
		return role;
	}

	public static Optional<Builtin> resolve(String qualifiedName) {
		return Optional.ofNullable(BY_NAME.get(qualifiedName));
	}
}
