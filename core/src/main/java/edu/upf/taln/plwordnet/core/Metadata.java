package edu.upf.taln.plwordnet.core;

/**
 * Document metadata and entity counts of a loaded wordnet.
 */
public final class Metadata
{
	private final String owner;
	private final String date;
	private final String version;
	private final int lexical_units;
	private final int synsets;
	private final int relation_types;
	private final int lexical_relations;
	private final int synset_relations;

	public Metadata(String owner, String date, String version, int lexical_units, int synsets, int relation_types,
	                int lexical_relations, int synset_relations)
	{
		this.owner = owner;
		this.date = date;
		this.version = version;
		this.lexical_units = lexical_units;
		this.synsets = synsets;
		this.relation_types = relation_types;
		this.lexical_relations = lexical_relations;
		this.synset_relations = synset_relations;
	}

	public String getOwner() { return owner; }
	public String getDate() { return date; }
	public String getVersion() { return version; }
	public int getNumLexicalUnits() { return lexical_units; }
	public int getNumSynsets() { return synsets; }
	public int getNumRelationTypes() { return relation_types; }
	public int getNumLexicalRelations() { return lexical_relations; }
	public int getNumSynsetRelations() { return synset_relations; }

	public String toSummary()
	{
		return lexical_units + " lexical units, " + synsets + " synsets, " + relation_types + " relation types, " +
				lexical_relations + " lexical relations and " + synset_relations + " synset relations";
	}

	@Override
	public String toString()
	{
		return "owner:\t\t\t" + owner + "\n" +
				"date:\t\t\t" + date + "\n" +
				"version:\t\t" + version + "\n" +
				"lexical units:\t\t" + lexical_units + "\n" +
				"synsets:\t\t" + synsets + "\n" +
				"relation types:\t\t" + relation_types + "\n" +
				"lexical relations:\t" + lexical_relations + "\n" +
				"synset relations:\t" + synset_relations;
	}
}
