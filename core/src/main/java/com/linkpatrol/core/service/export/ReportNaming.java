package com.linkpatrol.core.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());

    public static final String PREFIX = "link_check_results_";

    public static Path reportsDir(Path baseDir) {
        return (baseDir == null ? Paths.get("out") : baseDir).resolve("reports");
    }

    public static String timestamp(Instant at) {
        return TS_FMT.format(at == null ? Instant.now() : at);
    }

    public static Path csvPath(Path baseDir, Instant at)  { return reportsDir(baseDir).resolve(PREFIX + timestamp(at) + ".csv"); }
    public static Path jsonPath(Path baseDir, Instant at) { return reportsDir(baseDir).resolve(PREFIX + timestamp(at) + ".json"); }
}
