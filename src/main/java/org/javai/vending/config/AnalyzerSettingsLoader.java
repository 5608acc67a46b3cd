package org.javai.vending.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link AnalyzerSettings} from YAML.
 * <p>
 * Expected layout; every key is optional and falls back to {@link AnalyzerSettings#DEFAULTS}:
 *
 * <pre>
 * vending:
 *   max-depth: 3
 *   purchase-price: 3
 *   purchase-quota: 3
 *   coin-value: 1
 *   final-balance: reset   # or carry
 * </pre>
 */
public class AnalyzerSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(AnalyzerSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/vending-analyzer.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load settings from the bundled classpath resource, or the defaults if it is absent.
	 */
	public AnalyzerSettings loadDefault() {
		ClassLoader loader = AnalyzerSettingsLoader.class.getClassLoader();
		try (InputStream is = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using built-in defaults", DEFAULT_RESOURCE);
				return AnalyzerSettings.DEFAULTS;
			}
			return load(is);
		} catch (AnalyzerConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerConfigException("Failed to read settings resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public AnalyzerSettings load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (AnalyzerConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerConfigException("Failed to read settings from path: " + path, e);
		}
	}

	public AnalyzerSettings load(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildSettings(data);
		} catch (AnalyzerConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerConfigException("Failed to read settings from input stream", e);
		}
	}

	public AnalyzerSettings load(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildSettings(data);
		} catch (AnalyzerConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerConfigException("Failed to read settings from reader", e);
		}
	}

	public AnalyzerSettings loadString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildSettings(data);
		} catch (AnalyzerConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerConfigException("Failed to read settings from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private AnalyzerSettings buildSettings(Map<String, Object> data) {
		if (data == null || !(data.get("vending") instanceof Map)) {
			return AnalyzerSettings.DEFAULTS;
		}
		Map<String, Object> section = (Map<String, Object>) data.get("vending");
		AnalyzerSettings defaults = AnalyzerSettings.DEFAULTS;

		try {
			Object policyObj = section.get("final-balance");
			FinalBalancePolicy policy = policyObj != null
					? FinalBalancePolicy.fromKey(String.valueOf(policyObj))
					: defaults.finalBalancePolicy();
			return new AnalyzerSettings(
					intValue(section, "max-depth", defaults.maxDepth()),
					intValue(section, "purchase-price", defaults.purchasePrice()),
					intValue(section, "purchase-quota", defaults.purchaseQuota()),
					intValue(section, "coin-value", defaults.coinValue()),
					policy
			);
		} catch (IllegalArgumentException e) {
			throw new AnalyzerConfigException("Invalid analyzer settings: " + e.getMessage(), e);
		}
	}

	private int intValue(Map<String, Object> section, String key, int defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		} catch (NumberFormatException e) {
			throw new AnalyzerConfigException("Setting '" + key + "' must be an integer, was '" + value + "'", e);
		}
	}
}
