package com.phasegate.core.persistence;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phasegate.core.model.AuditLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the audit trail as CSV for spreadsheet-based review.
 * The export is a derived copy; the JSON trail stays authoritative.
 */
public class AuditCsvExporter {

    private static final Logger log = LoggerFactory.getLogger(AuditCsvExporter.class);

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public AuditCsvExporter() {
        this.csvMapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        this.schema = csvMapper.schemaFor(AuditLogEntry.class).withHeader();
    }

    public String toCsv(List<AuditLogEntry> entries) {
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
            writer.writeAll(entries);
        } catch (IOException e) {
            throw new PersistenceException("Failed to render audit trail as CSV", e);
        }
        return out.toString();
    }

    /**
     * Exports {@code entries} to {@code target}, replacing any previous export.
     *
     * @return number of rows written, excluding the header
     */
    public int export(List<AuditLogEntry> entries, Path target) {
        try {
            AtomicFiles.write(target, toCsv(entries));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write audit CSV to " + target, e);
        }
        log.info("Exported {} audit entries to {}", entries.size(), target);
        return entries.size();
    }
}
