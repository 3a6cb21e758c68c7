package edu.upf.taln.daide.amr.io;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import edu.upf.taln.daide.amr.structures.AMRGraph;
import edu.upf.taln.daide.amr.structures.AMRNode;
import edu.upf.taln.daide.amr.structures.Filler;
import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.utils.SlotValues;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads AMR graphs in Penman notation, each optionally preceded by comment lines carrying its id and sentence:
 * <pre>
 * # ::id 1 ::snt Italy holds.
 * (h / hold-03
 *       :ARG1 (c / country :name (n / name :op1 "Italy")))
 * </pre>
 * Reentrant variables, including those used before the node they refer to is defined, are linked to their nodes.
 * Malformed input is reported in the errors of the graph and read on a best-effort basis.
 */
public class AMRReader
{
	private static final Pattern comment = Pattern.compile("\\s*(#[^\\n]*)(?:\\n|$)");
	private static final Pattern node_start = Pattern.compile("\\s*\\(([a-z]\\d*)\\s*/\\s*([a-z][a-z0-9]*(?:-[a-z0-9]+)*)");
	private static final Pattern role = Pattern.compile("\\s*:([a-z][a-z0-9]*(?:-[a-z0-9]+)*)", Pattern.CASE_INSENSITIVE);
	private static final Pattern open = Pattern.compile("\\s*\\(");
	private static final Pattern quoted = Pattern.compile("\\s*\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)\"", Pattern.DOTALL);
	private static final Pattern variable = Pattern.compile("\\s*([a-z]\\d*+)(?![A-Za-z0-9_-])");
	private static final Pattern unquoted = Pattern.compile("\\s*([^\\s()]+)");
	private static final Pattern close = Pattern.compile("\\s*\\)");
	private static final Pattern non_blank = Pattern.compile("\\s*\\S");
	private final int max_nesting;
	private final static Logger log = LogManager.getLogger();

	public AMRReader()
	{
		this(new Options());
	}

	public AMRReader(Options options)
	{
		this.max_nesting = options.amr_max_nesting;
	}

	public List<AMRGraph> read(String amr_bank)
	{
		return read(amr_bank, 0);
	}

	/**
	 * Reads consecutive AMRs until only whitespace is left. Reading stops early if some text remains which does not
	 * start with an AMR node.
	 * @param max_graphs maximum number of graphs to read, no limit if zero or negative
	 */
	public List<AMRGraph> read(String amr_bank, int max_graphs)
	{
		Preconditions.checkNotNull(amr_bank);
		log.info("Reading AMR graphs");
		final Stopwatch timer = Stopwatch.createStarted();

		final List<AMRGraph> graphs = new ArrayList<>();
		int offset = 0;
		while (lookingAt(non_blank, amr_bank, offset) && (max_graphs <= 0 || graphs.size() < max_graphs))
		{
			final Optional<AMRGraph> graph = parse(amr_bank, offset);
			if (graph.isEmpty())
			{
				log.error("Cannot read AMR at offset " + offset + ", skipping rest of input: " + excerpt(amr_bank, offset));
				break;
			}

			final AMRGraph g = graph.get();
			g.getErrors().forEach(e -> log.debug(g.getId().orElse("AMR " + (graphs.size() + 1)) + ": " + e));
			graphs.add(g);
			offset = g.getEnd();
		}

		log.info("Read " + graphs.size() + " AMR graphs in " + timer.stop());
		return graphs;
	}

	public Optional<AMRGraph> parse(String text)
	{
		return parse(text, 0);
	}

	/**
	 * Parses a single AMR, with its leading comment lines, starting at the given offset.
	 * @return the graph, or nothing if no AMR node starts after the comments
	 */
	public Optional<AMRGraph> parse(String text, int offset)
	{
		Preconditions.checkNotNull(text);
		Preconditions.checkArgument(offset >= 0 && offset <= text.length(), "Invalid offset " + offset);

		final ParseState state = new ParseState(text, offset);
		state.readComments();
		final int start = state.pos;
		final Optional<AMRNode> root = state.readNode(0);
		if (root.isEmpty())
			return Optional.empty();
		state.resolveOrphans();

		final String amr_text = text.substring(start, state.pos).trim();
		return Optional.of(new AMRGraph(state.id, state.sentence, amr_text, root.get(), state.variables,
				state.orphans, state.errors, state.pos));
	}

	private static boolean lookingAt(Pattern p, String text, int offset)
	{
		final Matcher m = p.matcher(text);
		m.region(offset, text.length());
		return m.lookingAt();
	}

	private static String excerpt(String text, int offset)
	{
		final String rest = text.substring(offset, Math.min(text.length(), offset + 200));
		return StringUtils.abbreviate(StringUtils.normalizeSpace(rest), 60);
	}

	// State of the parse of a single AMR
	private class ParseState
	{
		private final String text;
		private int pos;
		private String id = null;
		private String sentence = null;
		private final Map<String, AMRNode> variables = new LinkedHashMap<>();
		private final ListMultimap<String, Pair<AMRNode, Integer>> orphans =
				MultimapBuilder.linkedHashKeys().arrayListValues().build();
		private final List<String> errors = new ArrayList<>();

		ParseState(String text, int pos)
		{
			this.text = text;
			this.pos = pos;
		}

		private Matcher match(Pattern p)
		{
			final Matcher m = p.matcher(text);
			m.region(pos, text.length());
			return m.lookingAt() ? m : null;
		}

		void readComments()
		{
			Matcher m;
			while ((m = match(comment)) != null)
			{
				final String line = m.group(1).trim();
				pos = m.end();

				final Optional<String> snt = SlotValues.getNonEmpty(line, "snt");
				if (snt.isPresent())
					sentence = snt.get();
				else
					SlotValues.getNonEmpty(line, "id").ifPresent(i -> id = i);
			}

			while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
				++pos;
		}

		Optional<AMRNode> readNode(int level)
		{
			Matcher m = match(node_start);
			if (m == null)
				return Optional.empty();
			pos = m.end();

			final AMRNode node = new AMRNode(m.group(1), m.group(2));
			if (variables.containsKey(node.getVariable()))
				errors.add("Variable " + node.getVariable() + " defined more than once");
			variables.put(node.getVariable(), node);

			while ((m = match(role)) != null)
			{
				final String r = m.group(1);
				pos = m.end();

				if (match(open) != null)
				{
					if (level >= max_nesting)
					{
						errors.add("Skipping AMR nested deeper than " + max_nesting + " levels at: " + excerpt(text, pos));
						skipBalanced();
						continue;
					}

					final Optional<AMRNode> child = readNode(level + 1);
					if (child.isEmpty())
					{
						errors.add("Unexpected non-AMR: " + excerpt(text, pos));
						return Optional.of(node);
					}
					node.addRelation(r, Filler.node(child.get()));
				}
				else if ((m = match(quoted)) != null)
				{
					pos = m.end();
					node.addRelation(r, Filler.quoted(m.group(1)));
				}
				else if ((m = match(variable)) != null)
				{
					pos = m.end();
					final String v = m.group(1);
					final AMRNode referenced = variables.get(v);
					if (referenced != null)
						node.addRelation(r, Filler.node(referenced));
					else
					{
						final int index = node.addRelation(r, Filler.placeholder(v));
						orphans.put(v, Pair.of(node, index));
					}
				}
				else if ((m = match(unquoted)) != null)
				{
					pos = m.end();
					node.addRelation(r, Filler.unquoted(m.group(1)));
				}
				else
				{
					errors.add("Unexpected :" + r + " arg: " + excerpt(text, pos));
					return Optional.of(node);
				}
			}

			if ((m = match(close)) != null)
				pos = m.end();
			else
				errors.add("Inserting missing ) at: " + (id != null ? id : excerpt(text, pos)));

			return Optional.of(node);
		}

		// Moves past the parenthesized expression starting at the current position
		private void skipBalanced()
		{
			int depth = 0;
			boolean in_quotes = false;
			for (int i = pos; i < text.length(); ++i)
			{
				final char c = text.charAt(i);
				if (in_quotes)
				{
					if (c == '\\')
						++i;
					else if (c == '"')
						in_quotes = false;
				}
				else if (c == '"')
					in_quotes = true;
				else if (c == '(')
					++depth;
				else if (c == ')' && --depth == 0)
				{
					pos = i + 1;
					return;
				}
			}
			pos = text.length();
		}

		void resolveOrphans()
		{
			for (String v : orphans.keySet())
			{
				final AMRNode node = variables.get(v);
				if (node != null)
					orphans.get(v).forEach(p -> p.getLeft().resolve(p.getRight(), node));
				else
				{
					final String error = "Can't resolve orphan reference " + v + (id != null ? " in " + id : "");
					log.warn(error);
					errors.add(error);
				}
			}
		}
	}
}
