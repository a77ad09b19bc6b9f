package com.delta.notifier.source;

import com.delta.notifier.model.Entry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Extracts listing entries from the first table of the document that has a company
 * column. Accepts both raw HTML tables and GitHub pipe tables.
 */
@Component
public class ListingTableParser {
    private static final Logger log = LoggerFactory.getLogger(ListingTableParser.class);
    private static final Pattern FOOTNOTE_PATTERN = Pattern.compile("\\[[^\\]]+\\]");
    private static final String CONTINUATION_MARK = "\u21B3";
    private static final List<DateTimeFormatter> DATED_FORMATS = List.of(
        formatter("MMM d, yyyy"),
        formatter("MMMM d, yyyy"),
        formatter("MMM d yyyy"),
        formatter("yyyy-MM-dd"),
        formatter("M/d/yyyy")
    );
    private static final List<DateTimeFormatter> UNDATED_FORMATS = List.of(
        formatter("MMM d"),
        formatter("MMMM d")
    );

    private final Clock clock;

    public ListingTableParser(Clock clock) {
        this.clock = clock;
    }

    public List<Entry> parse(String document, String baseUri) throws EntryFetchException {
        if (document == null || document.isBlank()) {
            throw new EntryFetchException(EntryFetchException.Kind.PARSE_FAILURE, "listing document is empty");
        }
        String html = document.contains("<table") ? document : MarkdownTables.toHtml(document);
        Document parsed = Jsoup.parse(html, baseUri == null ? "" : baseUri);

        Element table = findListingTable(parsed);
        if (table == null) {
            throw new EntryFetchException(EntryFetchException.Kind.PARSE_FAILURE, "no listing table found in document");
        }

        List<String> headers = readHeaders(table);
        Integer companyIndex = findHeaderIndex(headers, "company");
        Integer roleIndex = findHeaderIndex(headers, "role", "position", "title");
        Integer locationIndex = findHeaderIndex(headers, "location");
        Integer applicationIndex = findHeaderIndex(headers, "application");
        Integer dateIndex = findHeaderIndex(headers, "date posted", "date");

        List<Entry> entries = new ArrayList<>();
        String previousCompany = null;
        String previousCompanyLink = null;
        int skipped = 0;
        Elements rows = table.select("tbody tr");
        if (rows.isEmpty()) {
            rows = table.select("tr");
        }
        for (Element row : rows) {
            Elements cells = row.select("td");
            if (cells.isEmpty()) {
                continue;
            }
            if (cells.size() != headers.size()) {
                skipped++;
                continue;
            }

            Element companyCell = cells.get(companyIndex);
            String company = readCompanyName(companyCell);
            String companyLink = readCompanyLink(companyCell);
            if (CONTINUATION_MARK.equals(company)) {
                company = previousCompany;
                companyLink = companyLink != null ? companyLink : previousCompanyLink;
            }
            if (company == null) {
                skipped++;
                continue;
            }
            previousCompany = company;
            previousCompanyLink = companyLink;

            Map<String, String> extras = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                if (isMapped(i, companyIndex, roleIndex, locationIndex, applicationIndex, dateIndex)) {
                    continue;
                }
                String value = normalizeText(cells.get(i).text());
                if (value != null && !headers.get(i).isEmpty()) {
                    extras.put(headers.get(i), value);
                }
            }

            entries.add(new Entry(
                company,
                normalizeText(readCell(cells, roleIndex)),
                readLocation(cellAt(cells, locationIndex)),
                companyLink,
                readFirstHref(cellAt(cells, applicationIndex)),
                parseDate(readCell(cells, dateIndex)),
                extras
            ));
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed listing rows", skipped);
        }
        return entries;
    }

    private Element findListingTable(Document document) {
        for (Element table : document.select("table")) {
            if (findHeaderIndex(readHeaders(table), "company") != null) {
                return table;
            }
        }
        return null;
    }

    private List<String> readHeaders(Element table) {
        List<String> headers = new ArrayList<>();
        Element headerRow = table.selectFirst("tr:has(th)");
        if (headerRow == null) {
            return headers;
        }
        for (Element th : headerRow.select("th")) {
            headers.add(normalizeHeader(th.text()));
        }
        return headers;
    }

    private Integer findHeaderIndex(List<String> headers, String... names) {
        for (String name : names) {
            for (int i = 0; i < headers.size(); i++) {
                String header = headers.get(i);
                if (header.equals(name) || header.contains(name)) {
                    return i;
                }
            }
        }
        return null;
    }

    private boolean isMapped(int index, Integer... mapped) {
        for (Integer candidate : mapped) {
            if (candidate != null && candidate == index) {
                return true;
            }
        }
        return false;
    }

    private String readCompanyName(Element cell) {
        Element nameTag = cell.selectFirst("a");
        if (nameTag == null) {
            nameTag = cell.selectFirst("strong");
        }
        if (nameTag == null || nameTag.text().isBlank()) {
            nameTag = cell;
        }
        return normalizeText(nameTag.text());
    }

    private String readCompanyLink(Element cell) {
        return readFirstHref(cell);
    }

    private String readFirstHref(Element cell) {
        if (cell == null) {
            return null;
        }
        Element link = cell.selectFirst("a[href]");
        if (link == null) {
            return null;
        }
        String href = link.attr("abs:href");
        if (href.isBlank()) {
            href = link.attr("href");
        }
        return href.isBlank() ? null : href.trim();
    }

    private String readLocation(Element cell) {
        if (cell == null) {
            return null;
        }
        Element copy = cell.clone();
        copy.select("br").after(", ");
        return normalizeText(copy.text().replaceAll("\\s*,(\\s*,)*\\s*", ", "));
    }

    private Element cellAt(Elements cells, Integer index) {
        if (index == null || index < 0 || index >= cells.size()) {
            return null;
        }
        return cells.get(index);
    }

    private String readCell(Elements cells, Integer index) {
        Element cell = cellAt(cells, index);
        return cell == null ? null : cell.text();
    }

    LocalDate parseDate(String raw) {
        String value = normalizeText(raw);
        if (value == null) {
            return null;
        }
        for (DateTimeFormatter format : DATED_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        for (DateTimeFormatter format : UNDATED_FORMATS) {
            try {
                return MonthDay.parse(value, format).atYear(Year.now(clock).getValue());
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return null;
    }

    private String normalizeHeader(String value) {
        if (value == null) {
            return "";
        }
        return value
            .replace('\u00A0', ' ')
            .trim()
            .replaceAll("\\s+", " ")
            .toLowerCase(Locale.ROOT);
    }

    private String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace('\u00A0', ' ').trim();
        cleaned = FOOTNOTE_PATTERN.matcher(cleaned).replaceAll("").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.US);
    }
}
