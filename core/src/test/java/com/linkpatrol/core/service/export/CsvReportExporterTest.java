package com.linkpatrol.core.service.export;

import com.linkpatrol.core.model.LinkIssue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvReportExporterTest {

    @TempDir
    Path tmp;

    @Test
    void writes_header_and_rows_with_rfc4180_quoting() throws Exception {
        StringWriter w = new StringWriter();
        new CsvReportExporter().write(w, ExportFixtures.sample());

        String[] lines = w.toString().split("\r\n");
        assertThat(lines[0]).isEqualTo("Source Page,Link URL,Anchor Text,Issue Type,Status Code,Redirect To,Error");
        assertThat(lines[1]).isEqualTo("https://b.test/,/missing,\"Missing, \"\"quoted\"\"\",BROKEN,404,,");
        assertThat(lines[2]).isEqualTo("https://a.test/,/old,Old,REDIRECT,301,https://a.test/new,");
        assertThat(lines[3]).isEqualTo("https://b.test/,https://down.test/,Down,ERROR,N/A,,Connection Error");
    }

    @Test
    void export_creates_timestamped_file_under_reports() throws Exception {
        Instant at = Instant.parse("2024-03-01T10:15:30Z");

        Path out = new CsvReportExporter().export(tmp, ExportFixtures.sample(), at);

        assertThat(out.getParent()).isEqualTo(tmp.resolve("reports"));
        assertThat(out.getFileName().toString())
                .isEqualTo("link_check_results_" + ReportNaming.timestamp(at) + ".csv")
                .matches("link_check_results_\\d{8}_\\d{6}\\.csv");
        assertThat(Files.readString(out, StandardCharsets.UTF_8)).startsWith("Source Page,");
    }

    @Test
    void empty_list_still_has_header() throws Exception {
        StringWriter w = new StringWriter();
        new CsvReportExporter().write(w, List.<LinkIssue>of());
        assertThat(w.toString()).isEqualTo(String.join(",", CsvReportExporter.HEADER) + "\r\n");
    }

    @Test
    void escape_quotes_only_when_needed() {
        assertThat(CsvReportExporter.escape("plain")).isEqualTo("plain");
        assertThat(CsvReportExporter.escape("a\nb")).isEqualTo("\"a\nb\"");
        assertThat(CsvReportExporter.escape(null)).isEmpty();
    }
}
