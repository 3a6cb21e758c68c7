package edu.upf.taln.daide.core.english;

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * English text generated for a DAIDE expression, together with what kind of text it is.
 */
public final class Gloss
{
	public enum Syntax {PHRASE, CLAUSE}
	public enum Semantics {NONE, COAST}

	private final String text;
	private final Syntax syntax;
	private final Semantics semantics;

	public Gloss(String text, Syntax syntax, Semantics semantics)
	{
		this.text = text;
		this.syntax = syntax;
		this.semantics = semantics;
	}

	public static Gloss phrase(String text) { return new Gloss(text, Syntax.PHRASE, Semantics.NONE); }
	public static Gloss clause(String text) { return new Gloss(text, Syntax.CLAUSE, Semantics.NONE); }
	public static Gloss coast(String text) { return new Gloss(text, Syntax.PHRASE, Semantics.COAST); }

	public String getText() { return text; }
	public Syntax getSyntax() { return syntax; }
	public Semantics getSemantics() { return semantics; }
	public boolean isClause() { return syntax == Syntax.CLAUSE; }
	public boolean isCoast() { return semantics == Semantics.COAST; }
	public boolean isEmpty() { return text.isEmpty(); }

	/**
	 * @return the text, capitalized and ending with a period if it is a full clause
	 */
	public String toSentence()
	{
		return isClause() ? StringUtils.capitalize(text) + "." : text;
	}

	@Override
	public String toString() { return text; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Gloss gloss = (Gloss) o;
		return text.equals(gloss.text) && syntax == gloss.syntax && semantics == gloss.semantics;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(text, syntax, semantics);
	}
}
