package com.delta.notifier.source;

import com.delta.notifier.model.Entry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListingTableParserTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    private final ListingTableParser parser = new ListingTableParser(CLOCK);

    @Test
    void parsesPipeTableWithContinuationRows() throws Exception {
        String markdown = """
            # Summer 2025 Internships

            Some intro text.

            | Company | Role | Location | Application/Link | Date Posted |
            | ------- | ---- | -------- | ---------------- | ----------- |
            | **[Acme](https://acme.example)** | Software Intern | NYC, NY | <a href="https://apply.acme.example/1"><img src="apply.png" alt="Apply"></a> | Jan 05 |
            | ↳ | Data Intern | Remote | <a href="https://apply.acme.example/2">Apply</a> | Jan 06 |
            | Beta Corp | ML Intern | SF<br>Seattle | | 2025-01-07 |
            | broken | row |
            """;

        List<Entry> entries = parser.parse(markdown, "https://listings.example/README.md");

        assertThat(entries).hasSize(3);
        Entry acme = entries.get(0);
        assertThat(acme.organization()).isEqualTo("Acme");
        assertThat(acme.role()).isEqualTo("Software Intern");
        assertThat(acme.location()).isEqualTo("NYC, NY");
        assertThat(acme.link()).isEqualTo("https://acme.example");
        assertThat(acme.applicationLink()).isEqualTo("https://apply.acme.example/1");
        assertThat(acme.postedDate()).isEqualTo(LocalDate.of(2025, 1, 5));

        Entry continuation = entries.get(1);
        assertThat(continuation.organization()).isEqualTo("Acme");
        assertThat(continuation.link()).isEqualTo("https://acme.example");
        assertThat(continuation.role()).isEqualTo("Data Intern");
        assertThat(continuation.applicationLink()).isEqualTo("https://apply.acme.example/2");

        Entry beta = entries.get(2);
        assertThat(beta.organization()).isEqualTo("Beta Corp");
        assertThat(beta.location()).isEqualTo("SF, Seattle");
        assertThat(beta.link()).isNull();
        assertThat(beta.applicationLink()).isNull();
        assertThat(beta.postedDate()).isEqualTo(LocalDate.of(2025, 1, 7));
    }

    @Test
    void parsesHtmlTableAndKeepsUnmappedColumns() throws Exception {
        String html = """
            <h2>Other table</h2>
            <table><tr><th>Name</th><th>Notes</th></tr><tr><td>x</td><td>y</td></tr></table>
            <table>
              <thead><tr><th>Company</th><th>Role</th><th>Location</th><th>Salary</th><th>Date Posted</th></tr></thead>
              <tbody>
                <tr><td><strong><a href="/c/gamma">Gamma</a></strong></td><td>Backend Intern</td><td>Austin, TX</td><td>$40/hr</td><td>Feb 3, 2025</td></tr>
                <tr><td></td><td>Orphan Role</td><td>Nowhere</td><td>-</td><td>Feb 4, 2025</td></tr>
              </tbody>
            </table>
            """;

        List<Entry> entries = parser.parse(html, "https://listings.example/readme");

        assertThat(entries).hasSize(1);
        Entry gamma = entries.get(0);
        assertThat(gamma.organization()).isEqualTo("Gamma");
        assertThat(gamma.link()).isEqualTo("https://listings.example/c/gamma");
        assertThat(gamma.postedDate()).isEqualTo(LocalDate.of(2025, 2, 3));
        assertThat(gamma.extraFields()).isEqualTo(Map.of("salary", "$40/hr"));
        assertThat(gamma.identity()).isEqualTo("GammaBackend Intern");
    }

    @Test
    void documentWithoutListingTableIsParseFailure() {
        assertThatThrownBy(() -> parser.parse("# Nothing here\n\njust prose", null))
            .isInstanceOf(EntryFetchException.class)
            .satisfies(e -> assertThat(((EntryFetchException) e).getKind())
                .isEqualTo(EntryFetchException.Kind.PARSE_FAILURE));
        assertThatThrownBy(() -> parser.parse("  ", null))
            .isInstanceOf(EntryFetchException.class);
    }

    @Test
    void unparseableDatesBecomeNull() {
        assertThat(parser.parseDate("sometime soon")).isNull();
        assertThat(parser.parseDate(null)).isNull();
        assertThat(parser.parseDate("March 9, 2024")).isEqualTo(LocalDate.of(2024, 3, 9));
        assertThat(parser.parseDate("12/31/2024")).isEqualTo(LocalDate.of(2024, 12, 31));
    }
}
