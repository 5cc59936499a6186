package edu.upf.taln.plwordnet.core.structures;

import com.google.common.primitives.ImmutableLongArray;

import java.util.Objects;

/**
 * A set of synonymous lexical units sharing a definition.
 * Members are kept as raw lexical unit ids in document order, duplicates included. They may not resolve.
 */
public final class Synset
{
	private final long id;
	private final String workstate;
	private final int split;
	private final String owner;
	private final String definition;
	private final String desc;
	private final boolean isAbstract;
	private final ImmutableLongArray lexical_units;

	private Synset(Builder b)
	{
		this.id = b.id;
		this.workstate = b.workstate;
		this.split = b.split;
		this.owner = b.owner;
		this.definition = b.definition;
		this.desc = b.desc;
		this.isAbstract = b.isAbstract;
		this.lexical_units = b.lexical_units.build();
	}

	public long getId() { return id; }
	public String getWorkstate() { return workstate; }
	public int getSplit() { return split; }
	public String getOwner() { return owner; }
	public String getDefinition() { return definition; }
	public String getDescription() { return desc; }
	public boolean isAbstract() { return isAbstract; }
	public ImmutableLongArray getLexicalUnitIds() { return lexical_units; }

	@Override
	public String toString()
	{
		return Long.toUnsignedString(id) + "_" + lexical_units;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Synset other = (Synset) o;
		return id == other.id && split == other.split && isAbstract == other.isAbstract &&
				workstate.equals(other.workstate) && owner.equals(other.owner) &&
				definition.equals(other.definition) && desc.equals(other.desc) &&
				lexical_units.equals(other.lexical_units);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, lexical_units);
	}

	public static class Builder
	{
		private long id = 0;
		private String workstate = "";
		private int split = 0;
		private String owner = "";
		private String definition = "";
		private String desc = "";
		private boolean isAbstract = false;
		private final ImmutableLongArray.Builder lexical_units = ImmutableLongArray.builder();

		public Builder id(long id) { this.id = id; return this; }
		public Builder workstate(String workstate) { this.workstate = workstate; return this; }
		public Builder split(int split) { this.split = split; return this; }
		public Builder owner(String owner) { this.owner = owner; return this; }
		public Builder definition(String definition) { this.definition = definition; return this; }
		public Builder desc(String desc) { this.desc = desc; return this; }
		public Builder isAbstract(boolean isAbstract) { this.isAbstract = isAbstract; return this; }
		public Builder addLexicalUnit(long lexical_unit_id) { lexical_units.add(lexical_unit_id); return this; }

		public long getId() { return id; }

		public Synset build()
		{
			return new Synset(this);
		}
	}
}
