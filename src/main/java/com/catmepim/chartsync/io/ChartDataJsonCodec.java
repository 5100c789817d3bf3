package com.catmepim.chartsync.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.model.ChartData;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of {@link ChartData} and of operation results for the command line.
 *
 * <pre>
 * {"categories":["Q1","Q2"],"series":[{"name":"Sales","values":[1.5,2.0]}],"chartTitle":"Revenue"}
 * </pre>
 */
public class ChartDataJsonCodec {

    private static final Logger logger = LoggerFactory.getLogger(ChartDataJsonCodec.class);

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public ChartDataJsonCodec(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = new ObjectMapper();
        // Output goes to caller-owned streams such as System.out
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * @throws IOException if the file cannot be read or is not valid chart data JSON
     */
    public ChartData read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            ChartData data = read(in);
            logger.debug("Read chart data from {}: {} categories, {} series",
                    file, data.getCategories().size(), data.getSeries().size());
            return data;
        }
    }

    public ChartData read(InputStream in) throws IOException {
        ChartData data = mapper.readValue(in, ChartData.class);
        if (data == null) {
            throw new IOException("Chart data JSON is empty");
        }
        return data;
    }

    /**
     * Serializes any result object (chart data, update result, counts wrapped in a map).
     */
    public String toJson(Object value) throws IOException {
        if (prettyPrint) {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        }
        return mapper.writeValueAsString(value);
    }

    public void write(Object value, OutputStream out) throws IOException {
        if (prettyPrint) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, value);
        } else {
            mapper.writeValue(out, value);
        }
        out.flush();
    }
}
