package in.folioledger.service.ingest.section;

import in.folioledger.service.ingest.RowError;
import in.folioledger.service.ingest.csv.CsvLines;
import in.folioledger.service.ingest.csv.HeaderIndex;
import in.folioledger.service.ingest.csv.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions a multi-section statement into named sections.
 *
 * Every line is {@code Section,Discriminator,cells...}. A {@code Header} line sets the
 * column names for the following {@code Data} lines of its section; a section may declare
 * several headers (one per asset class, for instance). Marker rows are consumed and never
 * returned. Row order within a section is preserved, sections are returned in first-seen
 * order.
 */
public final class SectionSplitter {
    private static final Logger log = LoggerFactory.getLogger(SectionSplitter.class);

    private static final String HEADER = "Header";
    private static final String DATA = "Data";
    private static final Set<String> MARKERS = Set.of("Total", "SubTotal", "Notes", "MetaInfo");

    public Map<String, List<SectionRow>> split(List<SourceLine> lines) {
        return split(lines, null, new ArrayList<>());
    }

    /**
     * @param sourceName used in row errors
     * @param errors     receives lines that could not be tokenized
     */
    public Map<String, List<SectionRow>> split(List<SourceLine> lines, String sourceName, List<RowError> errors) {
        Map<String, List<SectionRow>> sections = new LinkedHashMap<>();
        Map<String, HeaderIndex> headers = new LinkedHashMap<>();

        for (SourceLine line : lines) {
            List<String> cells;
            try {
                cells = CsvLines.split(line.text());
            } catch (IllegalArgumentException e) {
                errors.add(new RowError(sourceName, null, line.number(), e.getMessage(), line.text()));
                continue;
            }
            if (cells.size() < 2 || cells.get(0).isEmpty()) {
                continue;
            }

            String section = cells.get(0);
            String discriminator = cells.get(1);
            List<String> rest = cells.subList(2, cells.size());

            if (HEADER.equals(discriminator)) {
                headers.put(section, new HeaderIndex(rest));
                sections.computeIfAbsent(section, k -> new ArrayList<>());
            } else if (DATA.equals(discriminator)) {
                HeaderIndex header = headers.get(section);
                if (header == null) {
                    log.debug("Data row before any header in section '{}' at line {}", section, line.number());
                    errors.add(new RowError(sourceName, section, line.number(),
                        "data row without a preceding header", line.text()));
                    continue;
                }
                sections.computeIfAbsent(section, k -> new ArrayList<>())
                    .add(new SectionRow(section, header, rest, line.number(), line.text()));
            } else if (!MARKERS.contains(discriminator)) {
                log.debug("Unknown row discriminator '{}' in section '{}' at line {}", discriminator, section, line.number());
            }
        }
        return sections;
    }
}
