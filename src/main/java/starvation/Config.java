package starvation;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Analysis options, read from {@code starvation.properties} on the classpath and
 * overridden by {@code -Dstarvation.<key>=<value>} system properties.
 */
public final class Config {
	public static final String RESOURCE = "starvation.properties";
	public static final String PREFIX = "starvation.";

	private final Properties prop;

	private Config(Properties prop) {
		this.prop = prop;
	}

	public static Config load() {
		Properties prop = new Properties();
		try (InputStream in = Config.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in != null) prop.load(in);
		} catch (IOException ex) {
			throw new UncheckedIOException("Cannot read " + RESOURCE, ex);
		}
		for (String name : System.getProperties().stringPropertyNames()) {
			if (name.startsWith(PREFIX)) {
				prop.setProperty(name.substring(PREFIX.length()), System.getProperty(name));
			}
		}
		return new Config(prop);
	}

	public static Config fromProperties(Properties properties) {
		Properties prop = new Properties();
		prop.putAll(properties);
		return new Config(prop);
	}

	public static Config defaults() {
		return fromProperties(new Properties());
	}

	public String getProperty(String key) {
		return prop.getProperty(key);
	}

	public String getProperty(String key, String defaultValue) {
		return prop.getProperty(key, defaultValue).trim();
	}

	// keep one report per line and problem kind
	public boolean isDeduplicate() {
		return Boolean.parseBoolean(getProperty("deduplicate", "true"));
	}

	// times one CFG node may be processed before the procedure's summary is given up
	public int getMaxIterations() {
		return getInt("max_iterations", 10000);
	}

	public int getThreads() {
		return Math.max(1, getInt("threads", 1));
	}

	public String getOutputDir() {
		return getProperty("output_dir", "output/");
	}

	public boolean isPrintBodies() {
		return Boolean.parseBoolean(getProperty("print_bodies", "false"));
	}

	/* "pkg.Class.method" entries whose calls are not analyzed */
	public List<String> getSkipMethods() {
		List<String> out = new ArrayList<>();
		for (String sp : getProperty("skip_methods", "").split(",")) {
			sp = sp.trim();
			if (!sp.isEmpty()) out.add(sp);
		}
		return out;
	}

	private int getInt(String key, int defaultValue) {
		String v = getProperty(key, Integer.toString(defaultValue));
		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Option " + key + " expects an integer, got '" + v + "'", e);
		}
	}
}
