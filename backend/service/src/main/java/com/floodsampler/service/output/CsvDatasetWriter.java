package com.floodsampler.service.output;

import com.floodsampler.core.model.Sample;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class CsvDatasetWriter {
    private static final Logger LOGGER = Logger.getLogger(CsvDatasetWriter.class.getName());
    public static final String HEADER = "lat,lon,timestamp,label,provenance";

    public void write(Path file, List<Sample> samples) {
        Path absolute = file.toAbsolutePath();
        Path parent = absolute.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(parent);
            tmp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                writer.write(HEADER);
                writer.write("\n");
                for (Sample sample : samples) {
                    writer.write(row(sample));
                    writer.write("\n");
                }
            }
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.info("Wrote " + samples.size() + " samples to " + absolute);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing dataset to " + file, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    LOGGER.log(Level.FINE, "Unable to remove temp file " + tmp, e);
                }
            }
        }
    }

    static String row(Sample sample) {
        return sample.location().lat()
                + "," + sample.location().lon()
                + "," + sample.timestamp()
                + "," + sample.label().value()
                + "," + escape(sample.provenance());
    }

    static String escape(String field) {
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }
}
