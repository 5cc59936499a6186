package edu.upf.taln.plwordnet.core.io;

import edu.upf.taln.plwordnet.core.PlWordnet;
import edu.upf.taln.plwordnet.core.structures.*;

import java.util.function.Supplier;

/**
 * Element names of the plWordNet XML format and the attribute tables used to bind each of them.
 */
public final class ElementBindings
{
	public static final String TAG_ROOT = "array-list";
	public static final String TAG_LEXICAL_UNIT = "lexical-unit";
	public static final String TAG_SYNSET = "synset";
	public static final String TAG_RELATION_TYPE = "relationtypes";
	public static final String TAG_RELATION_TYPE_TEST = "test";
	public static final String TAG_LEXICAL_RELATION = "lexicalrelations";
	public static final String TAG_SYNSET_RELATION = "synsetrelations";
	public static final String TAG_UNIT_ID = "unit-id";

	public static final AttributeBinder<PlWordnet.Builder> ROOT =
			AttributeBinder.forElement(TAG_ROOT, PlWordnet.Builder::new)
					.text("owner", PlWordnet.Builder::owner)
					.text("date", PlWordnet.Builder::date)
					.text("version", PlWordnet.Builder::version)
					.build();

	// language is derived from pos when the unit is built, it is not an attribute
	public static final AttributeBinder<LexicalUnit.Builder> LEXICAL_UNIT =
			AttributeBinder.forElement(TAG_LEXICAL_UNIT, LexicalUnit.Builder::new)
					.id("id", LexicalUnit.Builder::id)
					.text("name", LexicalUnit.Builder::name)
					.text("pos", LexicalUnit.Builder::pos)
					.integer("tagcount", LexicalUnit.Builder::tagcount)
					.text("domain", LexicalUnit.Builder::domain)
					.text("desc", LexicalUnit.Builder::desc)
					.text("workstate", LexicalUnit.Builder::workstate)
					.text("source", LexicalUnit.Builder::source)
					.integer("variant", LexicalUnit.Builder::variant)
					.build();

	public static final AttributeBinder<Synset.Builder> SYNSET =
			AttributeBinder.forElement(TAG_SYNSET, Synset.Builder::new)
					.id("id", Synset.Builder::id)
					.text("workstate", Synset.Builder::workstate)
					.integer("split", Synset.Builder::split)
					.text("owner", Synset.Builder::owner)
					.text("definition", Synset.Builder::definition)
					.text("desc", Synset.Builder::desc)
					.bool("abstract", Synset.Builder::isAbstract)
					.build();

	public static final AttributeBinder<RelationType.Builder> RELATION_TYPE =
			AttributeBinder.forElement(TAG_RELATION_TYPE, RelationType.Builder::new)
					.id("id", RelationType.Builder::id)
					.text("type", RelationType.Builder::type)
					.id("reverse", RelationType.Builder::reverse)
					.text("name", RelationType.Builder::name)
					.text("description", RelationType.Builder::description)
					.text("posstr", RelationType.Builder::posstr)
					.text("display", RelationType.Builder::display)
					.text("shortcut", RelationType.Builder::shortcut)
					.bool("autoreverse", RelationType.Builder::autoreverse)
					.text("pwn", RelationType.Builder::pwn)
					.build();

	public static final AttributeBinder<RelationTypeTest.Builder> RELATION_TYPE_TEST =
			AttributeBinder.forElement(TAG_RELATION_TYPE_TEST, RelationTypeTest.Builder::new)
					.text("text", RelationTypeTest.Builder::text)
					.text("pos", RelationTypeTest.Builder::pos)
					.build();

	public static final AttributeBinder<LexicalRelation.Builder> LEXICAL_RELATION =
			relation(TAG_LEXICAL_RELATION, LexicalRelation.Builder::new);

	public static final AttributeBinder<SynsetRelation.Builder> SYNSET_RELATION =
			relation(TAG_SYNSET_RELATION, SynsetRelation.Builder::new);

	private ElementBindings() { }

	private static <B extends Relation.Builder<?>> AttributeBinder<B> relation(String tag, Supplier<B> factory)
	{
		return AttributeBinder.forElement(tag, factory)
				.id("parent", Relation.Builder::parent)
				.id("child", Relation.Builder::child)
				.id("relation", Relation.Builder::relation)
				.bool("valid", Relation.Builder::valid)
				.text("owner", Relation.Builder::owner)
				.build();
	}
}
