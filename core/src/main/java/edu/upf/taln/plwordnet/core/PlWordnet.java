package edu.upf.taln.plwordnet.core;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.upf.taln.plwordnet.core.io.WordnetParseException;
import edu.upf.taln.plwordnet.core.io.WordnetReader;
import edu.upf.taln.plwordnet.core.structures.*;
import edu.upf.taln.plwordnet.core.views.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

/**
 * The plWordNet lexical resource: lexical units, synsets, relation types and the two relation edge lists.
 *
 * Instances are built once by {@link WordnetReader} and never change afterwards, so they can be shared between
 * threads without locking. Maps iterate in document order. Views are assembled on every call from the stored
 * entities. They reference the stored strings rather than copying them, and ids that do not resolve are left out
 * of them.
 */
public final class PlWordnet
{
	private final String owner;
	private final String date;
	private final String version;
	private final ImmutableMap<Long, LexicalUnit> lexical_units;
	private final ImmutableMap<Long, Synset> synsets;
	private final ImmutableMap<Long, RelationType> relation_types;
	private final ImmutableList<LexicalRelation> lexical_relations;
	private final ImmutableList<SynsetRelation> synset_relations;
	private final static Joiner simple_joiner = Joiner.on(',');
	private final static Logger log = LogManager.getLogger();

	private PlWordnet(Builder b)
	{
		this.owner = b.owner;
		this.date = b.date;
		this.version = b.version;
		this.lexical_units = ImmutableMap.copyOf(b.lexical_units);
		this.synsets = ImmutableMap.copyOf(b.synsets);
		this.relation_types = ImmutableMap.copyOf(b.relation_types);
		this.lexical_relations = b.lexical_relations.build();
		this.synset_relations = b.synset_relations.build();
	}

	public static PlWordnet fromFile(Path file) throws WordnetParseException
	{
		return new WordnetReader().read(file);
	}

	public String getOwner() { return owner; }
	public String getDate() { return date; }
	public String getVersion() { return version; }

	// Stored entities
	public ImmutableMap<Long, LexicalUnit> getLexicalUnitsMap() { return lexical_units; }
	public ImmutableMap<Long, Synset> getSynsetsMap() { return synsets; }
	public ImmutableMap<Long, RelationType> getRelationTypesMap() { return relation_types; }
	public ImmutableList<LexicalRelation> getLexicalRelations() { return lexical_relations; }
	public ImmutableList<SynsetRelation> getSynsetRelations() { return synset_relations; }

	public Metadata getMetadata()
	{
		return new Metadata(owner, date, version, lexical_units.size(), synsets.size(), relation_types.size(),
				lexical_relations.size(), synset_relations.size());
	}

	public Optional<LexicalUnitView> getLexicalUnit(long id)
	{
		return Optional.ofNullable(lexical_units.get(id)).map(this::lexicalUnitView);
	}

	public Optional<SynsetView> getSynset(long id)
	{
		return Optional.ofNullable(synsets.get(id)).map(this::synsetView);
	}

	public Optional<RelationTypeView> getRelationType(long id)
	{
		return Optional.ofNullable(relation_types.get(id)).map(this::relationTypeView);
	}

	public Stream<LexicalUnitView> getLexicalUnitsStream()
	{
		return lexical_units.values().stream().map(this::lexicalUnitView);
	}

	public Stream<SynsetView> getSynsetsStream()
	{
		return synsets.values().stream().map(this::synsetView);
	}

	public Stream<RelationTypeView> getRelationTypesStream()
	{
		return relation_types.values().stream().map(this::relationTypeView);
	}

	public Stream<LexicalRelationView> getLexicalRelationsStream()
	{
		return lexical_relations.stream().map(this::lexicalRelationView);
	}

	public Stream<SynsetRelationView> getSynsetRelationsStream()
	{
		return synset_relations.stream().map(this::synsetRelationView);
	}

	/**
	 * Partitions synsets by language. A synset is Polish iff all its resolved members are Polish lexical units,
	 * English otherwise. This differs from {@link SynsetView#getLanguage()}, which only looks at the first member.
	 */
	public Stream<SynsetView> filterSynsetsByLanguage(Language language)
	{
		return synsets.values().stream()
				.filter(s -> getSynsetLanguage(s) == language)
				.map(this::synsetView);
	}

	public Language getSynsetLanguage(Synset synset)
	{
		final boolean all_polish = resolveMembers(synset).stream()
				.allMatch(u -> u.getLanguage() == Language.PL);
		return all_polish ? Language.PL : Language.EN;
	}

	// Edges of the given relation type, in document order
	public Stream<SynsetRelation> synsetRelationsByType(long relation_id)
	{
		return synset_relations.stream().filter(r -> r.getRelation() == relation_id);
	}

	public Stream<LexicalRelation> lexicalRelationsByType(long relation_id)
	{
		return lexical_relations.stream().filter(r -> r.getRelation() == relation_id);
	}

	// Empty for an unknown synset
	public Stream<LexicalUnitView> lexicalUnitsForSynset(long id)
	{
		final Synset synset = synsets.get(id);
		if (synset == null)
			return Stream.empty();
		return resolveMembers(synset).stream().map(this::lexicalUnitView);
	}

	public Stream<LexicalUnitView> lexicalUnitsForSynsets(Collection<Long> ids)
	{
		return ids.stream().flatMap(this::lexicalUnitsForSynset);
	}

	/**
	 * Comma-separated names of the resolved members of a synset. Empty for an unknown synset.
	 */
	public String synsetToSimple(long id)
	{
		return getSynset(id).map(SynsetView::toSimple).orElse("");
	}

	/**
	 * Per-synset renderings joined with commas, in the iteration order of ids. Empty renderings are skipped.
	 */
	public String synsetsToSimple(Collection<Long> ids)
	{
		return simple_joiner.join(ids.stream()
				.map(this::synsetToSimple)
				.filter(s -> !s.isEmpty())
				.iterator());
	}

	public LexicalUnitView lexicalUnitView(LexicalUnit unit)
	{
		return new LexicalUnitView(unit);
	}

	public SynsetView synsetView(Synset synset)
	{
		final List<LexicalUnitView> members = resolveMembers(synset).stream()
				.map(this::lexicalUnitView)
				.collect(toList());
		return new SynsetView(synset, members);
	}

	public RelationTypeView relationTypeView(RelationType type)
	{
		return new RelationTypeView(type);
	}

	public LexicalRelationView lexicalRelationView(LexicalRelation relation)
	{
		return new LexicalRelationView(
				getLexicalUnit(relation.getParent()).orElse(null),
				getLexicalUnit(relation.getChild()).orElse(null),
				getRelationType(relation.getRelation()).orElse(null),
				relation.isValid(), relation.getOwner());
	}

	public SynsetRelationView synsetRelationView(SynsetRelation relation)
	{
		return new SynsetRelationView(
				getSynset(relation.getParent()).orElse(null),
				getSynset(relation.getChild()).orElse(null),
				getRelationType(relation.getRelation()).orElse(null),
				relation.isValid(), relation.getOwner());
	}

	private List<LexicalUnit> resolveMembers(Synset synset)
	{
		return synset.getLexicalUnitIds().stream()
				.mapToObj(lexical_units::get)
				.filter(Objects::nonNull)
				.collect(toList());
	}

	@Override
	public String toString()
	{
		return "plWordNet " + version + " (" + date + ")";
	}

	/**
	 * Mutable store filled while a document is parsed. A record whose id is already present replaces the earlier
	 * one and keeps its position.
	 */
	public static class Builder
	{
		private String owner = "";
		private String date = "";
		private String version = "";
		private final Map<Long, LexicalUnit> lexical_units = new LinkedHashMap<>();
		private final Map<Long, Synset> synsets = new LinkedHashMap<>();
		private final Map<Long, RelationType> relation_types = new LinkedHashMap<>();
		private final ImmutableList.Builder<LexicalRelation> lexical_relations = ImmutableList.builder();
		private final ImmutableList.Builder<SynsetRelation> synset_relations = ImmutableList.builder();

		public Builder owner(String owner) { this.owner = owner; return this; }
		public Builder date(String date) { this.date = date; return this; }
		public Builder version(String version) { this.version = version; return this; }

		public Builder addLexicalUnit(LexicalUnit unit)
		{
			if (lexical_units.put(unit.getId(), unit) != null)
				log.warn("Duplicate lexical unit id " + Long.toUnsignedString(unit.getId()));
			return this;
		}

		public Builder addSynset(Synset synset)
		{
			if (synsets.put(synset.getId(), synset) != null)
				log.warn("Duplicate synset id " + Long.toUnsignedString(synset.getId()));
			return this;
		}

		public Builder addRelationType(RelationType type)
		{
			if (relation_types.put(type.getId(), type) != null)
				log.warn("Duplicate relation type id " + Long.toUnsignedString(type.getId()));
			return this;
		}

		public Builder addLexicalRelation(LexicalRelation relation) { lexical_relations.add(relation); return this; }
		public Builder addSynsetRelation(SynsetRelation relation) { synset_relations.add(relation); return this; }

		public PlWordnet build()
		{
			return new PlWordnet(this);
		}
	}
}
