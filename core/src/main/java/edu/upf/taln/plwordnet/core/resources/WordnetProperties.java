package edu.upf.taln.plwordnet.core.resources;

import edu.upf.taln.plwordnet.core.io.WordnetReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public class WordnetProperties
{
	public static final String FILE_PROPERTY = "wn.file";
	public static final String LOG_STEP_PROPERTY = "wn.log.step";

	private final Path wordnetPath;
	private final int logStep;

	private final static Logger log = LogManager.getLogger();

	public WordnetProperties(Path properties_file)
	{
		Properties prop = new Properties();
		try (FileInputStream input = new FileInputStream(properties_file.toFile()))
		{
			prop.load(input);
		}
		catch (Exception ex)
		{
			log.error("Failed to load properties from " + properties_file + ": " + ex);
		}

		wordnetPath = checkValidFile(prop.getProperty(FILE_PROPERTY));
		logStep = checkPositive(prop.getProperty(LOG_STEP_PROPERTY), WordnetReader.DEFAULT_LOG_STEP);
	}

	// Null if not set
	public Path getWordnetPath()
	{
		return wordnetPath;
	}

	public int getLogStep()
	{
		return logStep;
	}

	private Path checkValidFile(String value)
	{
		if (value == null || value.isEmpty())
			return null;

		Path path = Paths.get(value);
		if (!Files.exists(path) || !Files.isRegularFile(path))
		{
			throw new RuntimeException(value + " is not a valid path");
		}
		return path;
	}

	private int checkPositive(String value, int default_value)
	{
		if (value == null || value.isBlank())
			return default_value;

		try
		{
			final int n = Integer.parseInt(value.trim());
			if (n < 1)
				throw new RuntimeException(value + " is not a positive integer");
			return n;
		}
		catch (NumberFormatException e)
		{
			throw new RuntimeException(value + " is not a positive integer", e);
		}
	}
}
