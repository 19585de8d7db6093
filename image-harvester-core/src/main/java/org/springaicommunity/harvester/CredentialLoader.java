package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Builds the credential pool from environment variables.
 *
 * <p>
 * Numbered pairs {@code API_KEY_1}/{@code CX_1}, {@code API_KEY_2}/{@code CX_2}, ... are
 * read in order until the first pair with a missing or blank half. If no numbered pair
 * exists, the single pair {@code API_KEY}/{@code CX} is used instead.
 */
public class CredentialLoader {

	private static final Logger logger = LoggerFactory.getLogger(CredentialLoader.class);

	static final String KEY_VARIABLE = "API_KEY";

	static final String SCOPE_VARIABLE = "CX";

	private final Function<String, @Nullable String> environment;

	/**
	 * @param environment variable lookup, usually {@code EnvironmentSupport::get}
	 */
	public CredentialLoader(Function<String, @Nullable String> environment) {
		this.environment = environment;
	}

	/**
	 * Read every configured credential.
	 * @return the credentials in pool order, possibly empty
	 */
	public List<Credential> load() {
		List<Credential> credentials = new ArrayList<>();
		for (int ordinal = 1;; ordinal++) {
			String key = environment.apply(KEY_VARIABLE + "_" + ordinal);
			String scope = environment.apply(SCOPE_VARIABLE + "_" + ordinal);
			if (isBlank(key) || isBlank(scope)) {
				break;
			}
			credentials.add(new Credential(key.trim(), scope.trim()));
		}

		if (credentials.isEmpty()) {
			String key = environment.apply(KEY_VARIABLE);
			String scope = environment.apply(SCOPE_VARIABLE);
			if (!isBlank(key) && !isBlank(scope)) {
				credentials.add(new Credential(key.trim(), scope.trim()));
			}
		}

		logger.debug("Loaded {} credential(s)", credentials.size());
		return credentials;
	}

	/**
	 * Read every configured credential, failing if there is none.
	 * @return a non-empty credential list
	 * @throws IllegalStateException if no credential pair is configured
	 */
	public List<Credential> loadRequired() {
		List<Credential> credentials = load();
		if (credentials.isEmpty()) {
			throw new IllegalStateException("No API credentials configured. Set API_KEY_1 and CX_1 (plus API_KEY_2/CX_2, "
					+ "... for rotation), or API_KEY and CX, in the environment or a .env file");
		}
		return credentials;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
