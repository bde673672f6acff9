package naytive;

import org.junit.jupiter.api.BeforeAll;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for compiler tests that configures logging.
 *
 * The level comes from the {@code java.util.logging.ConsoleHandler.level}
 * system property, INFO by default.
 */
public abstract class NaytiveLoggingConfig {
	@BeforeAll
	public static void configureLogging() {
		String levelStr = System.getProperty("java.util.logging.ConsoleHandler.level", "INFO");
		Level level = Level.parse(levelStr);

		Logger rootLogger = Logger.getLogger("");
		rootLogger.setLevel(level);
		for (Handler handler : rootLogger.getHandlers()) {
			if (handler instanceof ConsoleHandler) {
				handler.setLevel(level);
			}
		}

		Logger.getLogger("naytive").setLevel(level);
	}
}
