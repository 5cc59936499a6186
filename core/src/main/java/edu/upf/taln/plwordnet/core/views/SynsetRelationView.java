package edu.upf.taln.plwordnet.core.views;

public final class SynsetRelationView extends RelationView<SynsetView>
{
	public SynsetRelationView(SynsetView parent, SynsetView child, RelationTypeView relation, boolean valid, String owner)
	{
		super(parent, child, relation, valid, owner);
	}
}
