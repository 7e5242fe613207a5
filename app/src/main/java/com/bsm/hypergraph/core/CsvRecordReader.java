package com.bsm.hypergraph.core;

import com.bsm.hypergraph.graph.Entity;
import com.bsm.hypergraph.graph.EntityType;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads change rows, incidents and entity catalogs from CSV files.
 *
 * The first line is a header; columns are matched by name, case-insensitively,
 * so their order does not matter and unknown columns are ignored. Fields may be
 * quoted with double quotes, with "" standing for a literal quote. A quoted
 * field may span several lines.
 */
public class CsvRecordReader {

    public List<ChangeRecord> readChanges(Path file) throws IOException {
        List<ChangeRecord> records = new ArrayList<>();
        for (Map<String, String> row : readRows(file)) {
            records.add(new ChangeRecord(
                    row.get("changenumber"),
                    row.get("createdat"),
                    row.get("risk"),
                    row.get("changetype"),
                    row.get("assignmentgroupid"),
                    row.get("assignmentgroup"),
                    row.get("businessserviceid"),
                    row.get("businessservice"),
                    row.get("entityid"),
                    row.get("entitytype"),
                    row.get("entityname"),
                    row.get("entityclass")));
        }
        return records;
    }

    public List<IncidentRecord> readIncidents(Path file) throws IOException {
        List<IncidentRecord> incidents = new ArrayList<>();
        for (Map<String, String> row : readRows(file)) {
            incidents.add(new IncidentRecord(
                    row.get("number"),
                    parsePriority(row.get("priority")),
                    row.get("affectedciid"),
                    row.get("affectedciname"),
                    row.get("businessserviceid"),
                    row.get("businessservicename"),
                    row.get("createdat"),
                    row.get("resolvedat"),
                    row.get("assignmentgroup")));
        }
        return incidents;
    }

    /**
     * Entity catalog with columns type, id, name and className. Rows with an
     * unknown type or a blank id are skipped.
     */
    public List<Entity> readCatalog(Path file) throws IOException {
        List<Entity> entities = new ArrayList<>();
        for (Map<String, String> row : readRows(file)) {
            EntityType type = EntityType.fromId(row.get("type"));
            String id = row.get("id");
            if (type == null || ChangeRecord.isBlank(id))
                continue;
            entities.add(Entity.of(type, id.trim(), row.get("name"), row.get("classname")));
        }
        return entities;
    }

    List<Map<String, String>> readRows(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    List<Map<String, String>> parseText(String text) throws IOException {
        return parse(new StringReader(text));
    }

    private List<Map<String, String>> parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);

        List<String> header = nextRecord(reader);
        if (header == null) {
            return List.of();
        }
        List<String> columns = new ArrayList<>();
        for (String name : header) {
            // Strip a UTF-8 byte order mark from the first column
            columns.add(name.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT));
        }

        List<Map<String, String>> rows = new ArrayList<>();
        List<String> fields;
        while ((fields = nextRecord(reader)) != null) {
            if (fields.size() == 1 && fields.get(0).isBlank())
                continue;
            Map<String, String> row = new HashMap<>();
            for (int i = 0; i < columns.size() && i < fields.size(); i++) {
                String value = fields.get(i);
                row.put(columns.get(i), value.isEmpty() ? null : value);
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Next logical record, joining physical lines while a quote is open; null at end of input.
     */
    private List<String> nextRecord(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null)
            return null;

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;

        while (true) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quoted) {
                    if (c == '"') {
                        if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                            field.append('"');
                            i++;
                        } else {
                            quoted = false;
                        }
                    } else {
                        field.append(c);
                    }
                } else if (c == '"') {
                    quoted = true;
                } else if (c == ',') {
                    fields.add(field.toString());
                    field.setLength(0);
                } else {
                    field.append(c);
                }
            }
            if (!quoted)
                break;
            String next = reader.readLine();
            if (next == null)
                break;
            field.append('\n');
            line = next;
        }
        fields.add(field.toString());
        return fields;
    }

    private static Integer parsePriority(String value) {
        if (ChangeRecord.isBlank(value))
            return null;
        String s = value.trim();
        // ServiceNow style "2 - High"
        int space = s.indexOf(' ');
        if (space > 0)
            s = s.substring(0, space);
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
