package edu.upf.taln.centrality.core.resources;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import edu.upf.taln.centrality.core.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Reads ranking options from a properties file. Recognized keys:
 *      katz.alpha, katz.tolerance, katz.max_iterations, katz.normalized, katz.method
 * Keys not present in the file keep the defaults of {@link Options}.
 */
public class KatzProperties
{
	public static final String ALPHA = "katz.alpha";
	public static final String TOLERANCE = "katz.tolerance";
	public static final String MAX_ITERATIONS = "katz.max_iterations";
	public static final String NORMALIZED = "katz.normalized";
	public static final String METHOD = "katz.method";

	private final Options options;
	private final static Logger log = LogManager.getLogger();

	public KatzProperties(Path properties_file)
	{
		Properties prop = new Properties();
		try (FileInputStream input = new FileInputStream(properties_file.toFile()))
		{
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties from " + properties_file);
			throw new UncheckedIOException(e);
		}
		options = parse(prop);
	}

	public KatzProperties(Properties prop)
	{
		options = parse(prop);
	}

	// Loads a properties file from the classpath
	public static KatzProperties fromResource(String name)
	{
		try (InputStream input = KatzProperties.class.getClassLoader().getResourceAsStream(name))
		{
			if (input == null)
				throw new IllegalArgumentException("Cannot find resource " + name);
			Properties prop = new Properties();
			prop.load(input);
			return new KatzProperties(prop);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties resource " + name);
			throw new UncheckedIOException(e);
		}
	}

	// Returns a copy, callers are free to modify it
	public Options getOptions()
	{
		return new Options(options);
	}

	private static Options parse(Properties prop)
	{
		final Options o = new Options();
		o.alpha = parseDouble(prop, ALPHA, o.alpha);
		o.tolerance = parseDouble(prop, TOLERANCE, o.tolerance);
		o.max_iterations = parseInt(prop, MAX_ITERATIONS, o.max_iterations);
		o.normalized = parseBoolean(prop, NORMALIZED, o.normalized);

		final String method = prop.getProperty(METHOD);
		if (method != null)
		{
			final Optional<Options.Method> m = Enums.getIfPresent(Options.Method.class, method.trim());
			if (!m.isPresent())
				throw new IllegalArgumentException(METHOD + ": " + method + " is not a valid method");
			o.method = m.get();
		}

		log.debug(o);
		return o;
	}

	private static double parseDouble(Properties prop, String key, double default_value)
	{
		final String value = prop.getProperty(key);
		if (value == null)
			return default_value;
		try
		{
			return Double.parseDouble(value.trim());
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(key + ": " + value + " is not a valid number", e);
		}
	}

	private static int parseInt(Properties prop, String key, int default_value)
	{
		final String value = prop.getProperty(key);
		if (value == null)
			return default_value;
		try
		{
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(key + ": " + value + " is not a valid integer", e);
		}
	}

	private static boolean parseBoolean(Properties prop, String key, boolean default_value)
	{
		final String value = prop.getProperty(key);
		if (value == null)
			return default_value;
		final String v = value.trim().toLowerCase();
		if (!v.equals("true") && !v.equals("false"))
			throw new IllegalArgumentException(key + ": " + value + " is not a valid boolean");
		return Boolean.parseBoolean(v);
	}
}
