package com.domainmodel.analyzer.result;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.util.FileWriteUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes {@link AnalysisDocument} as JSON. Map keys are written in
 * sorted order and lines end with {@code \n} on every platform.
 */
public class AnalysisDocumentSerializer {

    private static final Logger log = LoggerFactory.getLogger(AnalysisDocumentSerializer.class);

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public AnalysisDocumentSerializer() {
        this(true);
    }

    public AnalysisDocumentSerializer(boolean prettyPrint) {
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        if (prettyPrint) {
            DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                    .withObjectIndenter(new DefaultIndenter("  ", "\n"))
                    .withArrayIndenter(new DefaultIndenter("  ", "\n"));
            this.writer = objectMapper.writer(printer);
        } else {
            this.writer = objectMapper.writer();
        }
    }

    /**
     * @throws AnalysisOutputException with {@link IssueKind#SERIALIZATION_ERROR}
     */
    public String toJson(AnalysisDocument document) {
        try {
            return writer.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new AnalysisOutputException(IssueKind.SERIALIZATION_ERROR,
                    "Failed to serialize analysis document: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws AnalysisOutputException with {@link IssueKind#SERIALIZATION_ERROR} or
     *         {@link IssueKind#OUTPUT_WRITE_ERROR}
     */
    public void write(AnalysisDocument document, Path file) {
        String json = toJson(document);
        try {
            FileWriteUtil.safeWriteString(file, json);
            log.debug("Wrote analysis document to {} ({} chars)", file, json.length());
        } catch (IOException e) {
            throw new AnalysisOutputException(IssueKind.OUTPUT_WRITE_ERROR,
                    "Failed to write analysis document to " + file + ": " + e.getMessage(), e);
        }
    }

    public AnalysisDocument fromJson(String json) throws IOException {
        AnalysisDocument document = objectMapper.readValue(json, AnalysisDocument.class);
        if (document == null) {
            throw new IOException("Empty analysis document");
        }
        return document;
    }

    public AnalysisDocument read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public AnalysisDocument read(InputStream in) throws IOException {
        AnalysisDocument document = objectMapper.readValue(in, AnalysisDocument.class);
        if (document == null) {
            throw new IOException("Empty analysis document");
        }
        return document;
    }
}
