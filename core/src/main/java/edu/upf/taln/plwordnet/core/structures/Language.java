package edu.upf.taln.plwordnet.core.structures;

import com.ibm.icu.util.ULocale;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Optional;

/**
 * Language of lexical units and synsets in plWordNet.
 * English entries are those imported from Princeton WordNet, marked with a " pwn" suffix in their POS tag.
 */
public enum Language
{
	PL("Polish", new ULocale("pl")),
	EN("English", ULocale.ENGLISH);

	public static final String PWN_SUFFIX = " pwn";

	private final String name;
	private final ULocale locale;

	Language(String name, ULocale locale)
	{
		this.name = name;
		this.locale = locale;
	}

	public String getName() { return name; }
	public ULocale getLocale() { return locale; }

	public static Language fromPos(String pos)
	{
		return StringUtils.endsWith(pos, PWN_SUFFIX) ? EN : PL;
	}

	public static Optional<Language> forLocale(ULocale locale)
	{
		if (locale == null)
			return Optional.empty();

		return Arrays.stream(values())
				.filter(l -> l.locale.getLanguage().equals(locale.getLanguage()))
				.findFirst();
	}

	public static Optional<Language> forCode(String code)
	{
		if (StringUtils.isBlank(code))
			return Optional.empty();
		return forLocale(new ULocale(code.trim()));
	}

	@Override
	public String toString()
	{
		return name;
	}
}
