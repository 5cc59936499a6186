package edu.upf.taln.plwordnet.core.views;

public final class LexicalRelationView extends RelationView<LexicalUnitView>
{
	public LexicalRelationView(LexicalUnitView parent, LexicalUnitView child, RelationTypeView relation, boolean valid, String owner)
	{
		super(parent, child, relation, valid, owner);
	}
}
