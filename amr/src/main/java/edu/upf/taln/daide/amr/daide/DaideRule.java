package edu.upf.taln.daide.amr.daide;

import edu.upf.taln.daide.amr.patterns.AMRPattern;
import edu.upf.taln.daide.amr.patterns.DaideTemplate;
import edu.upf.taln.daide.amr.structures.AMRNode;

import java.util.function.Predicate;

/**
 * An AMR pattern paired with the DAIDE template produced for nodes matching it. Rules may add a condition on the
 * matched node that patterns cannot express, such as the concepts of its ancestors.
 */
public final class DaideRule
{
	private final AMRPattern pattern;
	private final DaideTemplate template;
	private final Predicate<AMRNode> condition;

	public DaideRule(String pattern, String template)
	{
		this(pattern, template, n -> true);
	}

	public DaideRule(String pattern, String template, Predicate<AMRNode> condition)
	{
		this.pattern = AMRPattern.parse(pattern);
		this.template = new DaideTemplate(template);
		this.condition = condition;
	}

	public AMRPattern getPattern() { return pattern; }
	public DaideTemplate getTemplate() { return template; }
	public boolean accepts(AMRNode node) { return condition.test(node); }

	@Override
	public String toString()
	{
		return pattern + " -> " + template;
	}
}
