package edu.upf.taln.daide.amr.patterns;

import java.util.List;
import java.util.Optional;

/**
 * An element of an AMR pattern: a literal concept, a variable slot such as $unit(army|fleet), or a nested pattern.
 */
public final class PatternTerm
{
	public enum Type {LITERAL, SLOT, PATTERN}

	private final Type type;
	private final String text; // literal concept or slot name
	private final List<String> alternatives; // admissible concepts of a slot, empty if unconstrained
	private final AMRPattern pattern;

	private PatternTerm(Type type, String text, List<String> alternatives, AMRPattern pattern)
	{
		this.type = type;
		this.text = text;
		this.alternatives = alternatives;
		this.pattern = pattern;
	}

	public static PatternTerm literal(String concept) { return new PatternTerm(Type.LITERAL, concept, List.of(), null); }
	public static PatternTerm slot(String name, List<String> alternatives) { return new PatternTerm(Type.SLOT, name, List.copyOf(alternatives), null); }
	public static PatternTerm pattern(AMRPattern pattern) { return new PatternTerm(Type.PATTERN, null, List.of(), pattern); }

	public Type getType() { return type; }
	public boolean isLiteral() { return type == Type.LITERAL; }
	public boolean isSlot() { return type == Type.SLOT; }
	public boolean isPattern() { return type == Type.PATTERN; }
	public String getText() { return text; }
	public List<String> getAlternatives() { return alternatives; }
	public Optional<AMRPattern> getPattern() { return Optional.ofNullable(pattern); }

	/**
	 * @return true if the concept is admitted by this slot's alternatives, or if it has none
	 */
	public boolean admits(String concept)
	{
		return alternatives.isEmpty() || alternatives.contains(concept);
	}

	@Override
	public String toString()
	{
		switch (type)
		{
			case LITERAL:
				return text;
			case SLOT:
				return "$" + text + (alternatives.isEmpty() ? "" : "(" + String.join("|", alternatives) + ")");
			default:
				return pattern.toString();
		}
	}
}
