package edu.upf.taln.plwordnet.core.views;

import edu.upf.taln.plwordnet.core.structures.RelationType;

/**
 * Field mirror of a relation type. Substitution tests are not exposed here, use the stored
 * {@link RelationType} for those.
 */
public final class RelationTypeView
{
	private final RelationType type;

	public RelationTypeView(RelationType type)
	{
		this.type = type;
	}

	public long getId() { return type.getId(); }
	public String getType() { return type.getType(); }
	public long getReverse() { return type.getReverse(); }
	public String getName() { return type.getName(); }
	public String getDescription() { return type.getDescription(); }
	public String getPosStr() { return type.getPosStr(); }
	public String getDisplay() { return type.getDisplay(); }
	public String getShortcut() { return type.getShortcut(); }
	public boolean isAutoReverse() { return type.isAutoReverse(); }
	public String getPwn() { return type.getPwn(); }

	@Override
	public String toString()
	{
		return type.toString();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return type.equals(((RelationTypeView) o).type);
	}

	@Override
	public int hashCode()
	{
		return type.hashCode();
	}
}
