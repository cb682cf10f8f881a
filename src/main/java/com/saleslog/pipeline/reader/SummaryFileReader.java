package com.saleslog.pipeline.reader;

import com.saleslog.pipeline.model.SummaryLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Read side of the summary directory, for consumers such as dashboards. Files are selected by
 * the {@code yyyyMMdd} date in the first eight characters of their name and parsed with the
 * three-column {@code date|product|total} schema.
 */
@Component
public class SummaryFileReader {

    private static final Logger log = LoggerFactory.getLogger(SummaryFileReader.class);

    private static final String SUMMARY_GLOB = "*.txt";
    private static final int DATE_PREFIX_LENGTH = 8;
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern FIELD_SPLITTER = Pattern.compile("\\|");

    /**
     * Returns the lines of every summary file dated within {@code [from, to]}, ordered by file name
     * and then by position in the file.
     */
    public List<SummaryLine> read(Path outputRoot, LocalDate from, LocalDate to) throws IOException {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after end " + to);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(outputRoot, SUMMARY_GLOB)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                LocalDate fileDate = fileDate(entry);
                if (fileDate != null && !fileDate.isBefore(from) && !fileDate.isAfter(to)) {
                    files.add(entry);
                }
            }
        }
        Collections.sort(files);

        List<SummaryLine> lines = new ArrayList<>();
        for (Path file : files) {
            readFile(file, lines);
        }
        return lines;
    }

    private LocalDate fileDate(Path file) {
        String name = file.getFileName().toString();
        if (name.length() < DATE_PREFIX_LENGTH) {
            log.warn("Ignoring {}: name does not start with a yyyyMMdd date", file);
            return null;
        }
        try {
            return LocalDate.parse(name.substring(0, DATE_PREFIX_LENGTH), FILE_DATE);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring {}: name does not start with a yyyyMMdd date", file);
            return null;
        }
    }

    private void readFile(Path file, List<SummaryLine> into) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                SummaryLine parsed = parseLine(line);
                if (parsed == null) {
                    log.warn("Skipping malformed summary line {}:{}: {}", file, lineNumber, line);
                } else {
                    into.add(parsed);
                }
            }
        }
    }

    static SummaryLine parseLine(String line) {
        String[] fields = FIELD_SPLITTER.split(line, -1);
        if (fields.length != 3) {
            return null;
        }
        try {
            return new SummaryLine(fields[0], fields[1], Double.parseDouble(fields[2]));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
