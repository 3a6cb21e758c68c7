package edu.upf.taln.daide.amr.structures;

public final class Relation
{
	private final String role; // without leading colon
	private final Filler filler;

	public Relation(String role, Filler filler)
	{
		this.role = role;
		this.filler = filler;
	}

	public String getRole() { return role; }
	public Filler getFiller() { return filler; }

	@Override
	public String toString()
	{
		return ":" + role + " " + filler;
	}
}
