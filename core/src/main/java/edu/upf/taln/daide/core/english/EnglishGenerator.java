package edu.upf.taln.daide.core.english;

import com.google.common.base.Preconditions;
import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.daide.DaideTree;
import edu.upf.taln.daide.core.resources.LexicalResources;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;

import java.util.List;
import java.util.Optional;

/**
 * Glosses DAIDE trees in English. Lists are dispatched on their shape to the first rule that accepts them,
 * tokens are replaced by the names of the powers, locations and unit types they stand for.
 */
public class EnglishGenerator
{
	@FunctionalInterface
	private interface GlossRule
	{
		Optional<Gloss> apply(DaideTree tree, Form form, int depth);
	}

	private final LexicalResources resources;
	private final int max_depth;
	private final List<GlossRule> rules; // order matters

	public EnglishGenerator(LexicalResources resources, Options options)
	{
		this.resources = resources;
		this.max_depth = options.max_depth;
		this.rules = List.of(
				this::list,
				this::move,
				this::hold,
				this::support,
				this::name,
				this::unit,
				this::coast,
				this::submission,
				this::proposal,
				this::alliance);
	}

	/**
	 * @return English sentence or phrase for the tree, capitalized and ending in a period if it is a full clause
	 */
	public String toEnglish(DaideTree tree)
	{
		return generate(tree).toSentence();
	}

	public Gloss generate(DaideTree tree)
	{
		return generate(tree, Form.NONE);
	}

	public Gloss generate(DaideTree tree, Form form)
	{
		Preconditions.checkNotNull(tree);
		return generate(tree, form, 0);
	}

	private Gloss generate(DaideTree tree, Form form, int depth)
	{
		DepthLimitExceededException.check(depth, max_depth, "English generation");
		if (tree.isLeaf())
			return Gloss.phrase(token(tree.getToken()));

		for (GlossRule rule : rules)
		{
			final Optional<Gloss> gloss = rule.apply(tree, form, depth);
			if (gloss.isPresent())
				return gloss.get();
		}
		return generic(tree, depth);
	}

	private String text(DaideTree tree, Form form, int depth)
	{
		return generate(tree, form, depth + 1).getText();
	}

	// the north coast of Spain, the English fleet in the North Sea
	private String token(String token)
	{
		final Optional<String> location = resources.getLocationName(token);
		if (location.isPresent())
			return resources.usesDefiniteArticle(location.get()) ? "the " + location.get() : location.get();
		return resources.getName(token).orElse(token);
	}

	// England, France and Russia
	private Optional<Gloss> list(DaideTree tree, Form form, int depth)
	{
		if (form != Form.N_LIST)
			return Optional.empty();

		final StringBuilder b = new StringBuilder();
		final int n = tree.size();
		for (int i = 0; i < n; ++i)
		{
			b.append(text(tree.get(i), Form.N, depth));
			if (i < n - 2)
				b.append(", ");
			else if (i == n - 2)
				b.append(" and ");
		}
		return Optional.of(Gloss.phrase(b.toString()));
	}

	private Optional<Gloss> move(DaideTree tree, Form form, int depth)
	{
		if (tree.size() != 3 || !tree.hasToken(1, "MTO"))
			return Optional.empty();

		final String unit = text(tree.get(0), Form.NONE, depth);
		final String destination = text(tree.get(2), Form.NONE, depth);
		final String verb = form == Form.ORDER ? "shall move to" : "moved to";
		return Optional.of(Gloss.clause(unit + " " + verb + " " + destination));
	}

	private Optional<Gloss> hold(DaideTree tree, Form form, int depth)
	{
		if (tree.size() != 2 || !tree.hasToken(1, "HLD"))
			return Optional.empty();

		final String unit = text(tree.get(0), Form.NONE, depth);
		final String verb = form == Form.ORDER ? "shall remain in place" : "remained in place";
		return Optional.of(Gloss.clause(unit + " " + verb));
	}

	private Optional<Gloss> support(DaideTree tree, Form form, int depth)
	{
		if ((tree.size() != 3 && tree.size() != 5) || !tree.hasToken(1, "SUP"))
			return Optional.empty();

		final String supporter = text(tree.get(0), Form.NONE, depth);
		String supported = text(tree.get(2), Form.NONE, depth);
		if (tree.size() == 5 && tree.isLeafAt(3))
		{
			if (tree.hasToken(3, "MTO"))
				supported += " moving to " + text(tree.get(4), Form.NONE, depth);
			else
				supported += " " + text(tree.get(3), Form.NONE, depth) + " " + text(tree.get(4), Form.NONE, depth);
		}
		final String verb = form == Form.ORDER ? "shall support" : "supported";
		return Optional.of(Gloss.clause(supporter + " " + verb + " " + supported));
	}

	private Optional<Gloss> name(DaideTree tree, Form form, int depth)
	{
		if (tree.size() != 1 || !tree.isLeafAt(0))
			return Optional.empty();

		final String id = tree.get(0).getToken();
		final Optional<String> name = resources.getPowerName(id);
		if (name.isPresent())
			return name.map(Gloss::phrase);
		return resources.getLocationName(id).map(Gloss::phrase);
	}

	// the English army in Liverpool
	private Optional<Gloss> unit(DaideTree tree, Form form, int depth)
	{
		if (tree.size() != 3 || !tree.isLeafAt(0) || !tree.isLeafAt(1))
			return Optional.empty();

		final Optional<String> power = resources.getPowerName(tree.get(0).getToken());
		final Optional<String> unit_type = resources.getUnitTypeName(tree.get(1).getToken());
		if (power.isEmpty() || unit_type.isEmpty())
			return Optional.empty();

		final Gloss location = generate(tree.get(2), Form.NONE, depth + 1);
		if (location.isEmpty())
			return Optional.empty();

		final String pertainym = resources.getPertainym(power.get()).orElse(power.get());
		final String preposition = location.isCoast() ? "on" : "in";
		return Optional.of(Gloss.phrase("the " + pertainym + " " + unit_type.get() + " " + preposition + " " + location.getText()));
	}

	// the south coast of Spain
	private Optional<Gloss> coast(DaideTree tree, Form form, int depth)
	{
		if (tree.size() != 2 || !tree.isLeafAt(0) || !tree.isLeafAt(1))
			return Optional.empty();

		final Optional<String> province = resources.getProvinceName(tree.get(0).getToken());
		final Optional<String> coast = resources.getCoastName(tree.get(1).getToken());
		if (province.isEmpty() || coast.isEmpty())
			return Optional.empty();

		final String article = resources.usesDefiniteArticle(province.get()) ? "the " : "";
		return Optional.of(Gloss.coast("the " + coast.get() + " of " + article + province.get()));
	}

	private Optional<Gloss> submission(DaideTree tree, Form form, int depth)
	{
		if (tree.size() < 2 || !tree.hasToken(0, "SUB"))
			return Optional.empty();

		if (tree.size() == 2)
			return Optional.of(Gloss.clause("we submit the following order: " + text(tree.get(1), Form.ORDER, depth)));

		final StringBuilder b = new StringBuilder("we submit the following orders:");
		final int n = tree.size();
		for (int i = 1; i < n; ++i)
		{
			b.append(" (").append(i).append(") ").append(text(tree.get(i), Form.ORDER, depth));
			if (i < n - 2)
				b.append(";");
			else if (i < n - 1)
				b.append("; and");
		}
		return Optional.of(Gloss.clause(b.toString()));
	}

	private Optional<Gloss> proposal(DaideTree tree, Form form, int depth)
	{
		if (tree.size() < 2 || !tree.hasToken(0, "PRP"))
			return Optional.empty();

		return Optional.of(Gloss.clause("we propose " + text(tree.get(1), Form.COMPL, depth)));
	}

	// ALY (allies) VSS (enemies), also accepted without the VSS token
	private Optional<Gloss> alliance(DaideTree tree, Form form, int depth)
	{
		if (!tree.hasToken(0, "ALY"))
			return Optional.empty();

		final int enemies_index = tree.hasToken(2, "VSS") ? 3 : 2;
		final String allies = tree.size() >= 2 ? text(tree.get(1), Form.N_LIST, depth) : "";
		final String enemies = tree.size() > enemies_index ? text(tree.get(enemies_index), Form.N_LIST, depth) : "";
		final String against = enemies.isEmpty() ? "" : " against " + enemies;

		if (allies.isEmpty())
			return Optional.of(Gloss.phrase("an alliance"));
		if (form == Form.COMPL || form == Form.N)
			return Optional.of(Gloss.phrase("an alliance between " + allies + against));
		return Optional.of(Gloss.clause(allies + " are allies" + against));
	}

	private Gloss generic(DaideTree tree, int depth)
	{
		final StringBuilder b = new StringBuilder();
		for (DaideTree child : tree.getChildren())
		{
			if (b.length() > 0)
				b.append(' ');
			b.append(text(child, Form.NONE, depth));
		}
		return Gloss.phrase(depth > 0 ? "(" + b + ")" : b.toString());
	}
}
