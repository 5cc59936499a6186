package edu.upf.taln.plwordnet.core.io;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import edu.upf.taln.plwordnet.core.PlWordnet;
import edu.upf.taln.plwordnet.core.structures.RelationType;
import edu.upf.taln.plwordnet.core.structures.Synset;

import static edu.upf.taln.plwordnet.core.io.ElementBindings.*;

/**
 * Turns a flat sequence of parse events into wordnet entities in a single forward pass.
 * Each call to {@link #step} takes the current context and one event, adds whatever the event completes to the store
 * and returns the next context. Member ids and relation endpoints are stored raw, nothing is resolved here.
 * Container entities (synsets, relation types) enter the store when their element closes.
 */
public class WordnetStateMachine
{
	private static final Splitter unit_ids_splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
	private PlWordnet.Builder store = null; // created by the root element

	public boolean hasRoot()
	{
		return store != null;
	}

	public ParsingContext step(ParsingContext context, ParseEvent event) throws WordnetParseException
	{
		switch (event.getType())
		{
			case Start:
				return onElement(context, event, false);
			case Empty:
				return onElement(context, event, true);
			case Text:
				return onText(context, event);
			case End:
				return onEnd(context, event);
			default:
				return context;
		}
	}

	/**
	 * Closes the document. A container still open at this point is committed as it is.
	 */
	public PlWordnet finish(ParsingContext context) throws WordnetParseException
	{
		if (store == null)
			throw WordnetParseException.missingRoot();

		switch (context.getType())
		{
			case InsideSynset:
				store.addSynset(context.getSynset().build());
				break;
			case InsideRelationType:
				store.addRelationType(context.getRelationType().build());
				break;
			default:
				break;
		}

		return store.build();
	}

	private ParsingContext onElement(ParsingContext context, ParseEvent event, boolean empty) throws WordnetParseException
	{
		final String tag = event.getTag();
		if (TAG_ROOT.equals(tag))
		{
			if (store != null)
				throw WordnetParseException.unexpectedElement(tag, event.getPosition());
			store = ROOT.bind(event);
			return context;
		}

		if (store == null)
			throw WordnetParseException.unexpectedElement(tag, event.getPosition());

		switch (tag)
		{
			case TAG_LEXICAL_UNIT:
				store.addLexicalUnit(LEXICAL_UNIT.bind(event).build());
				return context;
			case TAG_SYNSET:
			{
				if (!context.isIdle())
					throw WordnetParseException.unexpectedElement(tag, event.getPosition());
				final Synset.Builder synset = SYNSET.bind(event);
				if (empty)
				{
					store.addSynset(synset.build());
					return context;
				}
				return ParsingContext.insideSynset(synset);
			}
			case TAG_RELATION_TYPE:
			{
				if (!context.isIdle())
					throw WordnetParseException.unexpectedElement(tag, event.getPosition());
				final RelationType.Builder type = RELATION_TYPE.bind(event);
				if (empty)
				{
					store.addRelationType(type.build());
					return context;
				}
				return ParsingContext.insideRelationType(type);
			}
			case TAG_RELATION_TYPE_TEST:
				if (context.getType() != ParsingContext.Type.InsideRelationType)
					throw WordnetParseException.unexpectedElement(tag, event.getPosition());
				context.getRelationType().addTest(RELATION_TYPE_TEST.bind(event).build());
				return context;
			case TAG_LEXICAL_RELATION:
				store.addLexicalRelation(LEXICAL_RELATION.bind(event).build());
				return context;
			case TAG_SYNSET_RELATION:
				store.addSynsetRelation(SYNSET_RELATION.bind(event).build());
				return context;
			case TAG_UNIT_ID:
				return context;
			default:
				throw WordnetParseException.unexpectedElement(tag, event.getPosition());
		}
	}

	// Only text inside a synset carries data: whitespace-separated lexical unit ids
	private ParsingContext onText(ParsingContext context, ParseEvent event) throws WordnetParseException
	{
		if (context.getType() != ParsingContext.Type.InsideSynset)
			return context;

		final Synset.Builder synset = context.getSynset();
		for (String token : unit_ids_splitter.split(event.getText()))
		{
			try
			{
				synset.addLexicalUnit(FieldType.parseId(token));
			}
			catch (NumberFormatException e)
			{
				throw WordnetParseException.invalidAttributeValue(TAG_SYNSET, TAG_UNIT_ID, token, event.getPosition());
			}
		}
		return context;
	}

	private ParsingContext onEnd(ParsingContext context, ParseEvent event)
	{
		final String tag = event.getTag();
		if (TAG_SYNSET.equals(tag) && context.getType() == ParsingContext.Type.InsideSynset)
		{
			store.addSynset(context.getSynset().build());
			return ParsingContext.idle();
		}
		if (TAG_RELATION_TYPE.equals(tag) && context.getType() == ParsingContext.Type.InsideRelationType)
		{
			store.addRelationType(context.getRelationType().build());
			return ParsingContext.idle();
		}
		return context;
	}
}
