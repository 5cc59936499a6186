package edu.upf.taln.plwordnet.core.io;

import edu.upf.taln.plwordnet.core.structures.RelationType;
import edu.upf.taln.plwordnet.core.structures.Synset;

/**
 * Container currently open for nested content. At most one container is open at a time: synsets receive member ids
 * from text content, relation types receive test elements.
 * Instances are immutable. A transition replaces the context, it never changes it.
 */
public final class ParsingContext
{
	public enum Type {Idle, InsideSynset, InsideRelationType}

	private static final ParsingContext IDLE = new ParsingContext(Type.Idle, null, null);

	private final Type type;
	private final Synset.Builder synset;
	private final RelationType.Builder relation_type;

	private ParsingContext(Type type, Synset.Builder synset, RelationType.Builder relation_type)
	{
		this.type = type;
		this.synset = synset;
		this.relation_type = relation_type;
	}

	public static ParsingContext idle() { return IDLE; }
	public static ParsingContext insideSynset(Synset.Builder synset) { return new ParsingContext(Type.InsideSynset, synset, null); }
	public static ParsingContext insideRelationType(RelationType.Builder type) { return new ParsingContext(Type.InsideRelationType, null, type); }

	public Type getType() { return type; }
	public boolean isIdle() { return type == Type.Idle; }

	public Synset.Builder getSynset()
	{
		if (type != Type.InsideSynset)
			throw new IllegalStateException("No synset open in context " + this);
		return synset;
	}

	public RelationType.Builder getRelationType()
	{
		if (type != Type.InsideRelationType)
			throw new IllegalStateException("No relation type open in context " + this);
		return relation_type;
	}

	// Id of the open container, 0 when idle
	public long getId()
	{
		switch (type)
		{
			case InsideSynset:
				return synset.getId();
			case InsideRelationType:
				return relation_type.getId();
			default:
				return 0;
		}
	}

	@Override
	public String toString()
	{
		return isIdle() ? "Idle" : type + "(" + Long.toUnsignedString(getId()) + ")";
	}
}
