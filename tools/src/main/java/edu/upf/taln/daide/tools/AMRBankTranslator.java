package edu.upf.taln.daide.tools;

import com.google.common.base.Stopwatch;
import edu.upf.taln.daide.amr.daide.AMRToDaide;
import edu.upf.taln.daide.amr.io.AMRWriter;
import edu.upf.taln.daide.amr.structures.AMRGraph;
import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.resources.LexicalResources;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a list of AMRs read from a bank into DAIDE records, collecting a corpus summary on the way.
 * Items exceeding the maximum depth, or the stack, are logged and skipped.
 */
public class AMRBankTranslator
{
	public static final String empty_amr = "(a / amr-empty)";
	private final AMRWriter writer;
	private final AMRToDaide translator;
	private final boolean developer_mode;
	private final CorpusSummary summary = new CorpusSummary();

	private final static Logger log = LogManager.getLogger();

	public AMRBankTranslator(LexicalResources resources, Options options, boolean developer_mode)
	{
		this.writer = new AMRWriter(options);
		this.translator = new AMRToDaide(resources, options);
		this.developer_mode = developer_mode;
	}

	public List<TranslationRecord> translate(List<AMRGraph> graphs)
	{
		Stopwatch timer = Stopwatch.createStarted();
		final List<TranslationRecord> records = new ArrayList<>();
		for (AMRGraph graph : graphs)
		{
			final String id = graph.getId().orElse(null);
			final String snt = graph.getSentence().orElse(null);
			try
			{
				final String printed = writer.write(graph.getRoot());
				final String daide;
				final boolean show;
				if (printed.equals(empty_amr))
				{
					daide = "";
					show = summary.addEmpty(id);
				}
				else
				{
					daide = translator.translate(graph);
					show = summary.add(id, daide);
				}
				records.add(new TranslationRecord(id, snt, graph.getText(), daide, graph.getErrors(),
						!developer_mode || show));
			}
			catch (DepthLimitExceededException | StackOverflowError e)
			{
				log.error("Cannot translate AMR " + id + ": " + e);
				summary.addFailure(id);
			}
		}
		log.info("Translated " + records.size() + " out of " + graphs.size() + " AMRs in " + timer.stop());
		return records;
	}

	public CorpusSummary getSummary() { return summary; }
}
