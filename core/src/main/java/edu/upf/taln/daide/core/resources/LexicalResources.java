package edu.upf.taln.daide.core.resources;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import edu.upf.taln.daide.core.utils.FileUtils;
import edu.upf.taln.daide.core.utils.SlotValues;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;
import java.util.*;

/**
 * Id/name tables for the powers, provinces, seas, unit types and coasts of the Diplomacy board, together with
 * pertainyms ("England" -> "English") and the names that take a definite article ("the North Sea").
 * <p>
 * Read-only once built, so a single instance can be shared between items processed concurrently.
 */
public final class LexicalResources
{
	public static final String DEFAULT_RESOURCE = "diplomacy-resources.txt";

	private final Map<String, String> power_names;
	private final Map<String, String> province_names;
	private final Map<String, String> sea_names;
	private final Map<String, String> unit_type_names;
	private final Map<String, String> coast_names;
	private final Map<String, String> pertainyms;
	private final Set<String> definite_article_names;
	private final Map<String, String> name_to_id; // used when translating AMR to DAIDE
	private final Map<String, String> to_name; // used when glossing DAIDE in English
	private final static Logger log = LogManager.getLogger();

	private LexicalResources(Builder b)
	{
		power_names = ImmutableMap.copyOf(b.power_names);
		province_names = ImmutableMap.copyOf(b.province_names);
		sea_names = ImmutableMap.copyOf(b.sea_names);
		unit_type_names = ImmutableMap.copyOf(b.unit_type_names);
		coast_names = ImmutableMap.copyOf(b.coast_names);
		pertainyms = ImmutableMap.copyOf(b.pertainyms);
		definite_article_names = ImmutableSet.copyOf(b.definite_article_names);
		name_to_id = ImmutableMap.copyOf(b.name_to_id);
		to_name = ImmutableMap.copyOf(b.to_name);
	}

	/**
	 * Loads the resources bundled with this library.
	 */
	public static LexicalResources loadDefault() throws IOException
	{
		final URL url = Resources.getResource(LexicalResources.class, "/" + DEFAULT_RESOURCE);
		return read(Resources.toString(url, Charsets.UTF_8));
	}

	public static LexicalResources load(Path file) throws IOException
	{
		log.info("Loading lexical resources from " + file);
		return read(FileUtils.readTextFile(file));
	}

	/**
	 * Builds the tables from the contents of a resource file. Each line starts with a "::field" marker, e.g.
	 * <pre>::sea-id NTH ::sea-name North Sea ::sea-alt-names German Ocean</pre>
	 * Lines of unknown kinds are ignored.
	 */
	public static LexicalResources read(String contents)
	{
		Preconditions.checkNotNull(contents, "No resource contents");
		final Stopwatch timer = Stopwatch.createStarted();
		final Builder b = new Builder();
		contents.lines().forEach(b::addLine);
		final LexicalResources resources = new LexicalResources(b);
		log.debug("Lexical resources read in " + timer.stop() + ": " + resources);
		return resources;
	}

	public Optional<String> getPowerName(String id) { return Optional.ofNullable(power_names.get(id)); }
	public Optional<String> getProvinceName(String id) { return Optional.ofNullable(province_names.get(id)); }
	public Optional<String> getSeaName(String id) { return Optional.ofNullable(sea_names.get(id)); }
	public Optional<String> getUnitTypeName(String id) { return Optional.ofNullable(unit_type_names.get(id)); }
	public Optional<String> getCoastName(String id) { return Optional.ofNullable(coast_names.get(id)); }
	public Optional<String> getPertainym(String name) { return Optional.ofNullable(pertainyms.get(name)); }
	public boolean usesDefiniteArticle(String name) { return definite_article_names.contains(name); }

	/**
	 * @return id of a power, province, sea, unit type or coast given one of its names
	 */
	public Optional<String> getId(String name) { return Optional.ofNullable(name_to_id.get(name)); }

	/**
	 * @return name for an id of any kind, or the country name for a pertainym
	 */
	public Optional<String> getName(String id_or_name) { return Optional.ofNullable(to_name.get(id_or_name)); }

	/**
	 * @return name of a province or sea
	 */
	public Optional<String> getLocationName(String id)
	{
		final String province = province_names.get(id);
		return province != null ? Optional.of(province) : getSeaName(id);
	}

	@Override
	public String toString()
	{
		return power_names.size() + " powers, " + province_names.size() + " provinces, " + sea_names.size() +
				" seas, " + unit_type_names.size() + " unit types, " + coast_names.size() + " coasts, " +
				pertainyms.size() + " pertainyms";
	}

	private static class Builder
	{
		private final Map<String, String> power_names = new HashMap<>();
		private final Map<String, String> province_names = new HashMap<>();
		private final Map<String, String> sea_names = new HashMap<>();
		private final Map<String, String> unit_type_names = new HashMap<>();
		private final Map<String, String> coast_names = new HashMap<>();
		private final Map<String, String> pertainyms = new HashMap<>();
		private final Set<String> definite_article_names = new HashSet<>();
		private final Map<String, String> name_to_id = new HashMap<>();
		private final Map<String, String> to_name = new HashMap<>();

		void addLine(String line)
		{
			if (line.startsWith("::power-id "))
				addEntry(line, "power-id", "power-name", power_names, true);
			else if (line.startsWith("::province-id "))
				addEntry(line, "province-id", "province-name", province_names, true);
			else if (line.startsWith("::sea-id "))
			{
				addEntry(line, "sea-id", "sea-name", sea_names, true)
						.ifPresent(id -> {
							definite_article_names.add(sea_names.get(id));
							addAlternativeNames(line, "sea-alt-names", id);
						});
			}
			else if (line.startsWith("::unit-type-id "))
				addEntry(line, "unit-type-id", "unit-type-name", unit_type_names, true);
			else if (line.startsWith("::coast-id "))
			{
				// coasts are looked up by their alternative names only
				addEntry(line, "coast-id", "coast-name", coast_names, false)
						.ifPresent(id -> addAlternativeNames(line, "coast-alt-names", id));
			}
			else if (line.startsWith("::name "))
			{
				final Optional<String> name = SlotValues.getNonEmpty(line, "name");
				final Optional<String> pertainym = SlotValues.getNonEmpty(line, "pertainym");
				if (name.isPresent() && pertainym.isPresent())
				{
					pertainyms.put(name.get(), pertainym.get());
					to_name.put(pertainym.get(), name.get());
				}
			}
		}

		private Optional<String> addEntry(String line, String id_slot, String name_slot, Map<String, String> names,
		                                  boolean reverse)
		{
			final Optional<String> id = SlotValues.getNonEmpty(line, id_slot);
			final Optional<String> name = SlotValues.getNonEmpty(line, name_slot);
			if (id.isEmpty() || name.isEmpty())
			{
				log.warn("Ignoring incomplete resource line: " + line);
				return Optional.empty();
			}

			names.put(id.get(), name.get());
			to_name.put(id.get(), name.get());
			if (reverse)
				name_to_id.put(name.get(), id.get());
			return id;
		}

		private void addAlternativeNames(String line, String slot, String id)
		{
			SlotValues.getNonEmpty(line, slot).ifPresent(alt_names ->
					Arrays.stream(alt_names.split("[,;]\\s*"))
							.map(String::trim)
							.filter(n -> !n.isEmpty())
							.forEach(n -> name_to_id.put(n, id)));
		}
	}
}
