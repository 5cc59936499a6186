package edu.upf.taln.plwordnet.core.views;

import java.util.Objects;
import java.util.Optional;

/**
 * Edge with its endpoints and relation type resolved. An endpoint or type is empty when its id is dangling.
 *
 * @param <V> view type of the endpoints
 */
public abstract class RelationView<V>
{
	private final V parent;
	private final V child;
	private final RelationTypeView relation;
	private final boolean valid;
	private final String owner;

	protected RelationView(V parent, V child, RelationTypeView relation, boolean valid, String owner)
	{
		this.parent = parent;
		this.child = child;
		this.relation = relation;
		this.valid = valid;
		this.owner = owner;
	}

	public Optional<V> getParent() { return Optional.ofNullable(parent); }
	public Optional<V> getChild() { return Optional.ofNullable(child); }
	public Optional<RelationTypeView> getRelation() { return Optional.ofNullable(relation); }
	public boolean isValid() { return valid; }
	public String getOwner() { return owner; }

	@Override
	public String toString()
	{
		return parent + "-" + relation + "->" + child;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RelationView<?> other = (RelationView<?>) o;
		return valid == other.valid && Objects.equals(parent, other.parent) && Objects.equals(child, other.child) &&
				Objects.equals(relation, other.relation) && owner.equals(other.owner);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(parent, child, relation, valid, owner);
	}
}
