package edu.upf.taln.plwordnet.core.views;

import edu.upf.taln.plwordnet.core.structures.Language;
import edu.upf.taln.plwordnet.core.structures.LexicalUnit;

/**
 * Read-only projection of a lexical unit. Holds a reference to the stored unit, strings are not copied.
 */
public final class LexicalUnitView
{
	private final LexicalUnit unit;

	public LexicalUnitView(LexicalUnit unit)
	{
		this.unit = unit;
	}

	public long getId() { return unit.getId(); }
	public String getName() { return unit.getName(); }
	public String getPos() { return unit.getPos(); }
	public int getTagCount() { return unit.getTagCount(); }
	public String getDomain() { return unit.getDomain(); }
	public String getDescription() { return unit.getDescription(); }
	public String getWorkstate() { return unit.getWorkstate(); }
	public String getSource() { return unit.getSource(); }
	public int getVariant() { return unit.getVariant(); }

	// Recomputed from pos, agrees with the language stored in the unit
	public Language getLanguage()
	{
		return Language.fromPos(unit.getPos());
	}

	public String toSimple()
	{
		return unit.getName();
	}

	@Override
	public String toString()
	{
		return unit.toString();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return unit.equals(((LexicalUnitView) o).unit);
	}

	@Override
	public int hashCode()
	{
		return unit.hashCode();
	}
}
