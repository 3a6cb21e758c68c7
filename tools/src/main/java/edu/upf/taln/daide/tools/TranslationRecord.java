package edu.upf.taln.daide.tools;

import com.google.gson.JsonObject;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Result of translating one AMR into DAIDE, written as a text block and as a line of the JSON-lines output.
 */
public class TranslationRecord
{
	private final String id; // null if the AMR has no ::id
	private final String snt; // null if the AMR has no ::snt
	private final String amr;
	private final String daide;
	private final Coverage coverage;
	private final List<String> errors;
	private final boolean shown; // false if the item is hidden in developer mode

	public TranslationRecord(String id, String snt, String amr, String daide, List<String> errors, boolean shown)
	{
		this.id = id;
		this.snt = snt;
		this.amr = amr;
		this.daide = daide;
		this.coverage = Coverage.of(daide);
		this.errors = List.copyOf(errors);
		this.shown = shown;
	}

	public String getId() { return id; }
	public String getSentence() { return snt; }
	public String getAMR() { return amr; }
	public String getDaide() { return daide; }
	public Coverage getCoverage() { return coverage; }
	public List<String> getErrors() { return errors; }
	public boolean isShown() { return shown; }

	/**
	 * @return text block with the id, sentence, errors, AMR and DAIDE of this item, ending with a blank line
	 */
	public String toBlock()
	{
		final StringBuilder b = new StringBuilder();
		b.append("# ::id ").append(StringUtils.defaultString(id)).append('\n');
		b.append("# ::snt ").append(StringUtils.defaultString(snt)).append('\n');
		errors.forEach(e -> b.append("# ::error ").append(e).append('\n'));
		b.append("AMR:\n").append(amr).append('\n');
		switch (coverage)
		{
			case FULL:
				b.append("DAIDE: ").append(daide).append('\n');
				break;
			case PARTIAL:
				b.append("PARTIAL-DAIDE: ").append(daide).append('\n');
				break;
			default:
				b.append("NO-DAIDE\n");
		}
		return b.append('\n').toString();
	}

	/**
	 * JSON record with fields id, snt, amr, daide-status and daide. A missing id or sentence is null,
	 * daide is left out when empty. Serialize with nulls enabled to keep them.
	 */
	public JsonObject toJson()
	{
		final JsonObject json = new JsonObject();
		json.addProperty("id", id);
		json.addProperty("snt", snt);
		json.addProperty("amr", amr);
		json.addProperty("daide-status", coverage.getLabel());
		if (!daide.isEmpty())
			json.addProperty("daide", daide);
		return json;
	}
}
