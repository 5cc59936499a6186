package edu.upf.taln.plwordnet.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.base.Stopwatch;
import com.ibm.icu.util.ULocale;
import edu.upf.taln.plwordnet.core.PlWordnet;
import edu.upf.taln.plwordnet.core.io.WordnetParseException;
import edu.upf.taln.plwordnet.core.io.WordnetReader;
import edu.upf.taln.plwordnet.core.resources.WordnetProperties;
import edu.upf.taln.plwordnet.core.structures.Language;
import edu.upf.taln.plwordnet.core.views.LexicalUnitView;
import edu.upf.taln.plwordnet.core.views.RelationTypeView;
import edu.upf.taln.plwordnet.core.views.SynsetView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

public class Driver
{
	private static final String stats_command = "stats";
	private static final String synset_command = "synset";
	private static final String lexical_unit_command = "lexical-unit";
	private static final String relations_command = "relations";
	private static final String languages_command = "languages";
	private final static Logger log = LogManager.getLogger();

	private static abstract class BaseCommand
	{
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path properties;
		@Parameter(names = {"-i", "-input"}, description = "Path to plWordNet XML file, overrides wn.file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path input;
	}

	@Parameters(commandDescription = "Print metadata and entity counts")
	private static class StatsCommand extends BaseCommand
	{
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Print the members of a synset")
	private static class SynsetCommand extends BaseCommand
	{
		@Parameter(names = {"-id"}, description = "Synset id", arity = 1, required = true,
				converter = CMLCheckers.UnsignedIdConverter.class, validateWith = CMLCheckers.UnsignedId.class)
		private long id;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Print a lexical unit")
	private static class LexicalUnitCommand extends BaseCommand
	{
		@Parameter(names = {"-id"}, description = "Lexical unit id", arity = 1, required = true,
				converter = CMLCheckers.UnsignedIdConverter.class, validateWith = CMLCheckers.UnsignedId.class)
		private long id;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Count the edges of a relation type")
	private static class RelationsCommand extends BaseCommand
	{
		@Parameter(names = {"-id"}, description = "Relation type id", arity = 1, required = true,
				converter = CMLCheckers.UnsignedIdConverter.class, validateWith = CMLCheckers.UnsignedId.class)
		private long id;
		@Parameter(names = {"-lexical"}, description = "If set, lexical relations are counted instead of synset relations")
		private boolean lexical = false;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Count Polish and English synsets")
	private static class LanguagesCommand extends BaseCommand
	{
		@Parameter(names = {"-l", "-language"}, description = "Language code, pl or en. Both are counted if not set", arity = 1,
				converter = CMLCheckers.ULocaleConverter.class, validateWith = CMLCheckers.LanguageValidator.class)
		private ULocale language;
	}

	public static void main(String[] args) throws Exception
	{
		run(args, System.out);
	}

	public static void run(String[] args, PrintStream out) throws Exception
	{
		StatsCommand stats = new StatsCommand();
		SynsetCommand synset = new SynsetCommand();
		LexicalUnitCommand lexicalUnit = new LexicalUnitCommand();
		RelationsCommand relations = new RelationsCommand();
		LanguagesCommand languages = new LanguagesCommand();

		JCommander jc = new JCommander();
		jc.addCommand(stats_command, stats);
		jc.addCommand(synset_command, synset);
		jc.addCommand(lexical_unit_command, lexicalUnit);
		jc.addCommand(relations_command, relations);
		jc.addCommand(languages_command, languages);
		jc.parse(args);

		final String command = jc.getParsedCommand();
		if (command == null)
		{
			jc.usage();
			return;
		}

		log.info("Running \n\t" + String.join("\n\t", args));
		final Stopwatch timer = Stopwatch.createStarted();

		switch (command)
		{
			case stats_command:
			{
				PlWordnet wn = load(stats);
				out.println(wn.getMetadata());
				break;
			}
			case synset_command:
			{
				PlWordnet wn = load(synset);
				Optional<SynsetView> view = wn.getSynset(synset.id);
				if (view.isPresent())
					out.println("synset " + Long.toUnsignedString(synset.id) + " [" + view.get().getLanguage() + "]: " +
							view.get().toSimple());
				else
					out.println("synset " + Long.toUnsignedString(synset.id) + " not found");
				break;
			}
			case lexical_unit_command:
			{
				PlWordnet wn = load(lexicalUnit);
				Optional<LexicalUnitView> view = wn.getLexicalUnit(lexicalUnit.id);
				if (view.isPresent())
				{
					LexicalUnitView u = view.get();
					out.println("lexical unit " + Long.toUnsignedString(u.getId()) + ": " + u.getName() + " " + u.getVariant() + " (" +
							u.getPos() + ", " + u.getDomain() + ") [" + u.getLanguage() + "]");
				}
				else
					out.println("lexical unit " + Long.toUnsignedString(lexicalUnit.id) + " not found");
				break;
			}
			case relations_command:
			{
				PlWordnet wn = load(relations);
				final String name = wn.getRelationType(relations.id)
						.map(RelationTypeView::getName)
						.orElse("undeclared");
				final long count = relations.lexical ?
						wn.lexicalRelationsByType(relations.id).count() :
						wn.synsetRelationsByType(relations.id).count();
				out.println("relation type " + Long.toUnsignedString(relations.id) + " (" + name + "): " + count +
						(relations.lexical ? " lexical relations" : " synset relations"));
				break;
			}
			case languages_command:
			{
				PlWordnet wn = load(languages);
				final List<Language> selected = languages.language == null ?
						Arrays.asList(Language.values()) :
						Language.forLocale(languages.language).stream().collect(toList());
				for (Language language : selected)
				{
					out.println(language + ": " + wn.filterSynsetsByLanguage(language).count() + " synsets");
				}
				break;
			}
			default:
				jc.usage();
				break;
		}

		log.info("Done in " + timer.stop());
	}

	private static PlWordnet load(BaseCommand command) throws WordnetParseException
	{
		final WordnetProperties properties = command.properties != null ? new WordnetProperties(command.properties) : null;
		Path file = command.input;
		if (file == null && properties != null)
			file = properties.getWordnetPath();
		if (file == null)
			throw new ParameterException("No input file, use -input or set " + WordnetProperties.FILE_PROPERTY +
					" in the properties file");

		final WordnetReader reader = properties != null ? new WordnetReader(properties) : new WordnetReader();
		return reader.read(file);
	}
}
