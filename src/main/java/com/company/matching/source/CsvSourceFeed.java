package com.company.matching.source;

import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.WebMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads registry entities and web mentions from two CSV exports of the staging tables.
 *
 * <p>The first line of each file is a header naming the columns, using the staging column
 * names ({@code abn}, {@code entity_name_norm}, ... and {@code commoncrawl_id},
 * {@code company_name_norm}, ...). Column order is free and missing columns read as empty.
 * Fields may be quoted; embedded quotes are doubled and a quoted field may span lines.
 * Rows without a key are skipped.</p>
 */
public class CsvSourceFeed implements SourceFeed {
    private static final Logger log = LoggerFactory.getLogger(CsvSourceFeed.class);

    private final Path registryFile;
    private final Path webFile;

    public CsvSourceFeed(Path registryFile, Path webFile) {
        this.registryFile = Objects.requireNonNull(registryFile, "registryFile is required");
        this.webFile = Objects.requireNonNull(webFile, "webFile is required");
    }

    @Override
    public SourceData load() {
        try (Reader registryReader = Files.newBufferedReader(registryFile, StandardCharsets.UTF_8);
             Reader webReader = Files.newBufferedReader(webFile, StandardCharsets.UTF_8)) {
            return read(registryReader, webReader);
        } catch (IOException e) {
            throw new SourceFeedException("Failed to read CSV source files: " + e.getMessage(), e);
        }
    }

    /**
     * Reads both collections from already-open readers.
     */
    public static SourceData read(Reader registryReader, Reader webReader) throws IOException {
        List<RegistryEntity> registryEntities = readRows(registryReader, "abn", CsvSourceFeed::toRegistryEntity);
        List<WebMention> webMentions = readRows(webReader, "commoncrawl_id", CsvSourceFeed::toWebMention);
        log.info("source.loaded registryEntities={} webMentions={} format=csv",
                registryEntities.size(), webMentions.size());
        return new SourceData(registryEntities, webMentions);
    }

    private static <T> List<T> readRows(Reader reader, String keyColumn,
                                        Function<Map<String, String>, T> mapper) throws IOException {
        List<T> rows = new ArrayList<>();
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        String header = readRecord(br, 1);
        if (header == null) {
            return rows;
        }
        List<String> columns = parseLine(stripBom(header));

        long lineNumber = 1 + lineBreaks(header);
        String record;
        while ((record = readRecord(br, lineNumber + 1)) != null) {
            long recordLine = lineNumber + 1;
            lineNumber += 1 + lineBreaks(record);
            if (record.isBlank()) {
                continue;
            }
            List<String> values = parseLine(record);
            Map<String, String> row = new HashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i).trim(), i < values.size() ? values.get(i) : "");
            }
            if (row.getOrDefault(keyColumn, "").isBlank()) {
                log.warn("csv.skipped line={} reason=missing {}", recordLine, keyColumn);
                continue;
            }
            rows.add(mapper.apply(row));
        }
        return rows;
    }

    /**
     * Reads one logical record, joining physical lines while a quoted field is open.
     *
     * @throws SourceFeedException if the input ends inside a quoted field
     */
    static String readRecord(BufferedReader reader, long firstLine) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        StringBuilder record = new StringBuilder(line);
        while (hasOpenQuote(record)) {
            String next = reader.readLine();
            if (next == null) {
                throw new SourceFeedException("Unterminated quoted field in record starting at line " + firstLine);
            }
            record.append('\n').append(next);
        }
        return record.toString();
    }

    // doubled quotes count twice, so an odd count means a field is still open
    private static boolean hasOpenQuote(CharSequence text) {
        int quotes = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') {
                quotes++;
            }
        }
        return quotes % 2 != 0;
    }

    private static long lineBreaks(String record) {
        return record.chars().filter(c -> c == '\n').count();
    }

    private static RegistryEntity toRegistryEntity(Map<String, String> row) {
        return RegistryEntity.builder()
                .registryNumber(row.get("abn").trim())
                .nameNorm(row.get("entity_name_norm"))
                .nameRaw(row.get("entity_name_raw"))
                .entityType(row.get("entity_type"))
                .entityStatus(row.get("entity_status"))
                .addressFull(row.get("address_full"))
                .suburb(row.get("suburb"))
                .postcode(row.get("postcode"))
                .state(row.get("state"))
                .startDateRaw(row.get("start_date_raw"))
                .build();
    }

    private static WebMention toWebMention(Map<String, String> row) {
        return WebMention.builder()
                .id(row.get("commoncrawl_id").trim())
                .crawlId(row.get("crawl_id"))
                .url(row.get("url"))
                .domain(row.get("domain"))
                .tld(row.get("tld"))
                .htmlTitle(row.get("html_title"))
                .nameRaw(row.get("company_name_raw"))
                .nameNorm(row.get("company_name_norm"))
                .industry(row.get("industry"))
                .fetchedAt(row.get("fetched_at"))
                .build();
    }

    /**
     * Splits one CSV record into fields, honouring quotes and doubled quotes.
     */
    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static String stripBom(String header) {
        return header.startsWith("\uFEFF") ? header.substring(1) : header;
    }
}
