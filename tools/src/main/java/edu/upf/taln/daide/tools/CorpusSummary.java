package edu.upf.taln.daide.tools;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statistics over the DAIDE translations of an AMR bank, reported in developer mode.
 */
public class CorpusSummary
{
	// Extended concepts that DAIDE cannot express yet; items containing them are hidden in developer mode
	public static final Set<String> restricted_concepts = ImmutableSet.of("attack-01", "betray-01", "defend-01",
			"dislodge-01", "expect-01", "fear-01", "gain-02", "lie-08", "lose-02", "possible-01", "prevent-01",
			"threaten-01", "trust-01", "warn-01");
	private static final Pattern extended_concept = Pattern.compile("[a-z]\\S*-\\d\\d\\b");
	private static final Pattern underspecified_unit = Pattern.compile("\\((?:army|fleet) :(?:mod|location) [A-Z]{3}\\)");
	private static final Pattern lowercase = Pattern.compile("[a-z]");

	private int num_amrs = 0;
	private int num_empty = 0;
	private int num_unproblematic = 0;
	private int num_underspecified = 0;
	private int num_restricted = 0;
	private int num_extended = 0;
	private final Multiset<String> restricted_counts = TreeMultiset.create();
	private final Multiset<String> extended_counts = TreeMultiset.create();
	private final List<String> failed_ids = new ArrayList<>();
	private String last_id = null;

	private final static Logger log = LogManager.getLogger();

	/**
	 * Registers an AMR that could not be processed because it exceeded the maximum depth.
	 */
	public void addFailure(String id)
	{
		++num_amrs;
		last_id = id;
		failed_ids.add(id);
	}

	/**
	 * Registers an empty AMR.
	 * @return false, as empty AMRs are not shown in developer mode
	 */
	public boolean addEmpty(String id)
	{
		++num_amrs;
		last_id = id;
		++num_empty;
		++num_unproblematic;
		return false;
	}

	/**
	 * Registers the DAIDE translation of an AMR.
	 * @return true if the item should be shown in developer mode
	 */
	public boolean add(String id, String daide)
	{
		++num_amrs;
		last_id = id;
		boolean show = true;
		boolean problematic = false;

		final List<String> concepts = new ArrayList<>();
		final Matcher m = extended_concept.matcher(daide);
		while (m.find())
			concepts.add(m.group());

		if (!concepts.isEmpty())
		{
			problematic = true;
			if (concepts.stream().anyMatch(restricted_concepts::contains))
			{
				++num_restricted;
				concepts.stream()
						.filter(restricted_concepts::contains)
						.forEach(restricted_counts::add);
				show = false;
			}
			else
			{
				++num_extended;
				extended_counts.addAll(concepts);
			}
		}

		if (daide.contains("(unit ") || underspecified_unit.matcher(daide).find())
		{
			++num_underspecified;
			problematic = true;
			show = false;
		}

		if (lowercase.matcher(daide).find())
			problematic = true;
		if (!problematic)
			++num_unproblematic;

		return show;
	}

	public int getNumAMRs() { return num_amrs; }
	public int getNumEmpty() { return num_empty; }
	public int getNumUnproblematic() { return num_unproblematic; }
	public int getNumUnderspecified() { return num_underspecified; }
	public int getNumWithRestrictedConcepts() { return num_restricted; }
	public int getNumWithOtherExtendedConcepts() { return num_extended; }
	public Multiset<String> getRestrictedConceptCounts() { return restricted_counts; }
	public Multiset<String> getExtendedConceptCounts() { return extended_counts; }
	public List<String> getFailedIds() { return failed_ids; }
	public Optional<String> getLastId() { return Optional.ofNullable(last_id); }

	public String getSummary()
	{
		return "Summary: " + num_amrs + " AMRs; " + num_empty + " empty AMRs; " + num_unproblematic + " unproblematic; " +
				num_underspecified + " underspecified units; " + num_restricted + "/" + num_extended +
				" AMRs with extended concept\nLast snt-id: " + getLastId().orElse("");
	}

	/**
	 * Logs ids of failed AMRs and per-concept counts.
	 */
	public void logDetails()
	{
		if (!failed_ids.isEmpty())
			log.error("Maximum depth exceeded for " + failed_ids);
		restricted_counts.entrySet().forEach(e -> log.info("  Extended concept " + e.getElement() + " (" + e.getCount() + ")"));
		extended_counts.entrySet().forEach(e -> log.info("  Extended concept " + e.getElement() + " (" + e.getCount() + ")"));
	}
}
