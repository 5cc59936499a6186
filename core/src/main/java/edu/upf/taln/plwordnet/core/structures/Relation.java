package edu.upf.taln.plwordnet.core.structures;

import java.util.Objects;

/**
 * Directed, typed edge between two entities of the same kind.
 * Ids are stored raw and resolved lazily, so any of them may be dangling.
 */
public abstract class Relation
{
	private final long parent;
	private final long child;
	private final long relation; // id of the relation type
	private final boolean valid;
	private final String owner;

	protected Relation(Builder<?> b)
	{
		this.parent = b.parent;
		this.child = b.child;
		this.relation = b.relation;
		this.valid = b.valid;
		this.owner = b.owner;
	}

	public long getParent() { return parent; }
	public long getChild() { return child; }
	public long getRelation() { return relation; }
	public boolean isValid() { return valid; }
	public String getOwner() { return owner; }

	@Override
	public String toString()
	{
		return Long.toUnsignedString(parent) + "-" + Long.toUnsignedString(relation) + "->" + Long.toUnsignedString(child);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Relation other = (Relation) o;
		return parent == other.parent && child == other.child && relation == other.relation &&
				valid == other.valid && owner.equals(other.owner);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(parent, child, relation, valid, owner);
	}

	public abstract static class Builder<R extends Relation>
	{
		private long parent = 0;
		private long child = 0;
		private long relation = 0;
		private boolean valid = false;
		private String owner = "";

		public Builder<R> parent(long parent) { this.parent = parent; return this; }
		public Builder<R> child(long child) { this.child = child; return this; }
		public Builder<R> relation(long relation) { this.relation = relation; return this; }
		public Builder<R> valid(boolean valid) { this.valid = valid; return this; }
		public Builder<R> owner(String owner) { this.owner = owner; return this; }

		public abstract R build();
	}
}
