package edu.upf.taln.daide.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import edu.upf.taln.daide.amr.io.AMRReader;
import edu.upf.taln.daide.amr.io.AMRWriter;
import edu.upf.taln.daide.amr.structures.AMRGraph;
import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.resources.LexicalResources;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;
import edu.upf.taln.daide.core.utils.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.stream.Collectors.joining;

public class Driver
{
	private final static String printed_suffix = ".canonical.amr";
	private final static Logger log = LogManager.getLogger();
	private static final String amr2daide_command = "amr2daide";
	private static final String daide2english_command = "daide2english";
	private static final String print_amr_command = "print_amr";

	private void amr2daide(Path amr_bank_file, Path output, Path json_output, int max, boolean developer_mode,
	                       LexicalResources resources, Options options) throws IOException
	{
		log.info("Running from " + amr_bank_file);
		final String amr_bank = FileUtils.readTextFile(amr_bank_file);
		final AMRReader reader = new AMRReader(options);
		final List<AMRGraph> graphs = reader.read(amr_bank, max);

		final AMRBankTranslator translator = new AMRBankTranslator(resources, options, developer_mode);
		final List<TranslationRecord> records = translator.translate(graphs);

		final StringBuilder text = new StringBuilder();
		if (json_output == null || output != null)
		{
			records.stream()
					.filter(TranslationRecord::isShown)
					.map(TranslationRecord::toBlock)
					.forEach(text::append);
		}
		if (developer_mode)
		{
			text.append(translator.getSummary().getSummary()).append('\n');
			translator.getSummary().logDetails();
		}
		writeOutput(text.toString(), output);

		if (json_output != null)
		{
			final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
			final String jsonl = records.stream()
					.map(TranslationRecord::toJson)
					.map(gson::toJson)
					.map(l -> l + "\n")
					.collect(joining());
			FileUtils.writeTextToFile(json_output, jsonl);
			log.info("JSON records written to " + json_output);
		}
	}

	private void daide2english(Path daide_file, Path output, LexicalResources resources, Options options)
			throws IOException
	{
		log.info("Running from " + daide_file);
		final String text = FileUtils.readTextFile(daide_file);
		final DaideGlosser glosser = new DaideGlosser(resources, options);
		writeOutput(glosser.glossLines(text), output);
	}

	private void print_amr(Path amr_bank_file, Path output, Options options) throws IOException
	{
		log.info("Running from " + amr_bank_file);
		final String amr_bank = FileUtils.readTextFile(amr_bank_file);
		final AMRReader reader = new AMRReader(options);
		final List<AMRGraph> graphs = reader.read(amr_bank);
		final AMRWriter writer = new AMRWriter(options);

		// AMRs too deep to print are left out
		final List<AMRGraph> printable = graphs.stream()
				.filter(g ->
				{
					try
					{
						writer.write(g.getRoot());
						return true;
					}
					catch (DepthLimitExceededException | StackOverflowError e)
					{
						log.error("Cannot print AMR " + g.getId().orElse("") + ": " + e);
						return false;
					}
				})
				.collect(Collectors.toList());

		if (output == null)
			output = FileUtils.createOutputPath(amr_bank_file, amr_bank_file.toAbsolutePath().getParent(),
					"." + FilenameUtils.getExtension(amr_bank_file.toFile().getName()), printed_suffix);
		FileUtils.writeTextToFile(output, writer.write(printable));
		log.info("AMRs written to " + output);
	}

	private static void writeOutput(String text, Path output) throws IOException
	{
		if (output != null)
			FileUtils.writeTextToFile(output, text);
		else
		{
			System.out.print(text);
			System.out.flush();
		}
	}

	private static LexicalResources loadResources(Path resources_file, DaideProperties properties) throws IOException
	{
		if (resources_file != null)
			return LexicalResources.load(resources_file);
		if (properties.getResourcesPath().isPresent())
			return LexicalResources.load(properties.getResourcesPath().get());
		return LexicalResources.loadDefault();
	}

	private static DaideProperties loadProperties(Path properties_file) throws IOException
	{
		return properties_file != null ? new DaideProperties(properties_file) : new DaideProperties();
	}

	@Parameters(commandDescription = "Translate a file of AMRs into DAIDE")
	private static class AMR2DaideCommand
	{
		@Parameter(names = {"-i", "-input"}, description = "Input text-based AMR file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path inputFile;
		@Parameter(names = {"-o", "-output"}, description = "Output file, defaults to standard output", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path outputFile;
		@Parameter(names = {"-j", "-json"}, description = "JSON-lines output file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path jsonFile;
		@Parameter(names = {"-m", "-max"}, description = "Maximum number of AMRs to translate", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		private int max = 0;
		@Parameter(names = {"-d", "-developer_mode"}, description = "Hide empty and problematic items and print a summary")
		private boolean developer_mode = false;
		@Parameter(names = {"-r", "-resources"}, description = "Lexical resources file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path resourcesFile;
		@Parameter(names = {"-p", "-properties"}, description = "Properties file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path propertiesFile;
	}

	@Parameters(commandDescription = "Gloss DAIDE expressions in English, one expression per line")
	private static class Daide2EnglishCommand
	{
		@Parameter(names = {"-i", "-input"}, description = "Input DAIDE file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path inputFile;
		@Parameter(names = {"-o", "-output"}, description = "Output file, defaults to standard output", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path outputFile;
		@Parameter(names = {"-r", "-resources"}, description = "Lexical resources file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path resourcesFile;
		@Parameter(names = {"-p", "-properties"}, description = "Properties file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path propertiesFile;
	}

	@Parameters(commandDescription = "Print AMRs in canonical form")
	private static class PrintAMRCommand
	{
		@Parameter(names = {"-i", "-input"}, description = "Input text-based AMR file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path inputFile;
		@Parameter(names = {"-o", "-output"}, description = "Output file, defaults to the input file name with suffix " + printed_suffix,
				arity = 1, converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path outputFile;
		@Parameter(names = {"-p", "-properties"}, description = "Properties file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path propertiesFile;
	}

	public static void main(String[] args) throws IOException
	{
		AMR2DaideCommand amr2daide = new AMR2DaideCommand();
		Daide2EnglishCommand daide2english = new Daide2EnglishCommand();
		PrintAMRCommand print_amr = new PrintAMRCommand();

		JCommander jc = new JCommander();
		jc.addCommand(amr2daide_command, amr2daide);
		jc.addCommand(daide2english_command, daide2english);
		jc.addCommand(print_amr_command, print_amr);

		try
		{
			jc.parse(args);
		}
		catch (ParameterException e)
		{
			log.error(e.getMessage());
			jc.usage();
			return;
		}

		if (jc.getParsedCommand() == null)
		{
			log.error("No command given");
			jc.usage();
			return;
		}

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		Date date = new Date();
		log.info(dateFormat.format(date) + " running " + String.join(" ", args));

		Driver driver = new Driver();
		if (jc.getParsedCommand().equals(amr2daide_command))
		{
			final DaideProperties properties = loadProperties(amr2daide.propertiesFile);
			final LexicalResources resources = loadResources(amr2daide.resourcesFile, properties);
			driver.amr2daide(amr2daide.inputFile, amr2daide.outputFile, amr2daide.jsonFile, amr2daide.max,
					amr2daide.developer_mode, resources, properties.createOptions());
		}
		else if (jc.getParsedCommand().equals(daide2english_command))
		{
			final DaideProperties properties = loadProperties(daide2english.propertiesFile);
			final LexicalResources resources = loadResources(daide2english.resourcesFile, properties);
			driver.daide2english(daide2english.inputFile, daide2english.outputFile, resources, properties.createOptions());
		}
		else if (jc.getParsedCommand().equals(print_amr_command))
		{
			final DaideProperties properties = loadProperties(print_amr.propertiesFile);
			driver.print_amr(print_amr.inputFile, print_amr.outputFile, properties.createOptions());
		}
	}
}
