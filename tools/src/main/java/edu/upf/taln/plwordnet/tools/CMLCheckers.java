package edu.upf.taln.plwordnet.tools;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import com.ibm.icu.util.ULocale;
import edu.upf.taln.plwordnet.core.structures.Language;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class ULocaleConverter implements IStringConverter<ULocale>
	{
		@Override
		public ULocale convert(String value) { return new ULocale(value); }
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class UnsignedIdConverter implements IStringConverter<Long>
	{
		@Override
		public Long convert(String value) { return Long.parseUnsignedLong(value); }
	}

	public static class UnsignedId implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				Long.parseUnsignedLong(value);
			}
			catch (NumberFormatException e)
			{
				throw new ParameterException("Parameter " + name + " is not an unsigned id: " + value);
			}
		}
	}

	// Only languages present in plWordNet are accepted
	public static class LanguageValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (Language.forCode(value).isEmpty())
				throw new ParameterException("Unsupported language code " + name + " = " + value);
		}
	}
}
