package naytive.build;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Deduplicating registries filled while one compilation run translates its
 * modules: include directives, synthesized helper functions and raw imports.
 *
 * Insertion order is preserved everywhere. Repeated registrations are no-ops;
 * for helpers the first definition registered under a name wins.
 */
public final class BuildState {
	private static final Logger LOG = Logger.getLogger(BuildState.class.getName());

	private final Set<String> includes = new LinkedHashSet<>();
	private final Map<String, String> helpers = new LinkedHashMap<>();
	private final Set<String> rawImports = new LinkedHashSet<>();

	/**
	 * @return true when the directive was not registered before
	 */
	public boolean addInclude(String directive) {
		boolean added = includes.add(directive);
		if (added) {
			LOG.fine(() -> "include " + directive);
		}
		return added;
	}

	public boolean addRawImport(String directive) {
		boolean added = rawImports.add(directive);
		if (added) {
			LOG.fine(() -> "raw import " + directive);
		}
		return added;
	}

	public boolean addHelper(String name, String definition) {
		if (helpers.containsKey(name)) {
			return false;
		}
		helpers.put(name, definition);
		LOG.fine(() -> "helper " + name);
		return true;
	}

	public boolean hasHelper(String name) {
		return helpers.containsKey(name);
	}

	public Set<String> includes() {
		return Collections.unmodifiableSet(includes);
	}

	public Map<String, String> helpers() {
		return Collections.unmodifiableMap(helpers);
	}

	public Set<String> rawImports() {
		return Collections.unmodifiableSet(rawImports);
	}
}
