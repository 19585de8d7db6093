package org.springaicommunity.harvester;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables such as {@code API_KEY_1} and {@code CX_1}. A
 * {@code .env} file in the working directory wins over the process environment, and a
 * {@code .env} file in the user's home directory is consulted last. Both files are read
 * once per process.
 *
 * <p>
 * Only configuration code (credential loading, the CLI) calls this class; the harvesting
 * pipeline receives its credentials through constructors.
 */
public final class EnvironmentSupport {

	private static final Dotenv WORKING_DIR_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return WORKING_DIR_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if it is not defined anywhere
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIR_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

}
