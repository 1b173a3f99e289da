package com.telereplay.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telereplay.core.archive.ArchiveClient;
import com.telereplay.core.archive.ArchiveException;
import com.telereplay.core.archive.SeriesNotFoundException;
import com.telereplay.core.model.Row;
import com.telereplay.core.model.RowSchema;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Archive client for an InfluxDB 1.x compatible HTTP query API.
 *
 * API Endpoint: GET /query?db=...&q=...
 *
 * Before the first select of a series its field keys are queried; a series
 * without field keys does not exist and is reported as
 * {@link SeriesNotFoundException}. Existing series are remembered.
 */
public class InfluxArchiveClient implements ArchiveClient {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxArchiveClient.class);
    private static final String TIME_COLUMN = "time";

    private final HttpUrl queryUrl;
    private final String database;
    private final String authorization;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Set<String> knownSeries = ConcurrentHashMap.newKeySet();

    public InfluxArchiveClient(String baseUrl, String database, String username, String password,
                               OkHttpClient client, ObjectMapper mapper) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid archive URL: " + baseUrl);
        }
        this.queryUrl = base.newBuilder().addPathSegment("query").build();
        this.database = database;
        this.authorization = username != null && !username.isEmpty()
            ? Credentials.basic(username, password != null ? password : "")
            : null;
        this.client = client;
        this.mapper = mapper;
    }

    public InfluxArchiveClient(String baseUrl, String database, String username, String password) {
        this(baseUrl, database, username, password, HttpClientFactory.getClient(), HttpClientFactory.getMapper());
    }

    public InfluxArchiveClient(String baseUrl, String database) {
        this(baseUrl, database, null, null);
    }

    @Override
    public List<Row> selectTimeSeries(String seriesName, List<String> fields, Instant start, Instant end)
            throws ArchiveException {
        ensureSeriesExists(seriesName);

        String query = "SELECT " + selectClause(fields)
            + " FROM " + quote(seriesName)
            + " WHERE time >= '" + DateTimeFormatter.ISO_INSTANT.format(start) + "'"
            + " AND time < '" + DateTimeFormatter.ISO_INSTANT.format(end) + "'";

        JsonNode series = firstSeries(execute(query), query);
        if (series == null) {
            return List.of();
        }
        return parseRows(seriesName, series);
    }

    private void ensureSeriesExists(String seriesName) throws ArchiveException {
        if (knownSeries.contains(seriesName)) {
            return;
        }
        String query = "SHOW FIELD KEYS FROM " + quote(seriesName);
        JsonNode series = firstSeries(execute(query), query);
        if (series == null || !series.path("values").elements().hasNext()) {
            throw new SeriesNotFoundException(seriesName);
        }
        LOG.debug("Series {} has {} fields", seriesName, series.path("values").size());
        knownSeries.add(seriesName);
    }

    private JsonNode execute(String query) throws ArchiveException {
        HttpUrl url = queryUrl.newBuilder()
            .addQueryParameter("db", database)
            .addQueryParameter("q", query)
            .build();

        Request.Builder builder = new Request.Builder().url(url).get();
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }

        LOG.debug("Archive query: {}", query);
        try (Response response = client.newCall(builder.build()).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new ArchiveException("Archive API error: " + response.code() + " "
                    + response.message() + " - " + errorMessage(body));
            }
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ArchiveException("Malformed archive response for query: " + query, e);
        } catch (ArchiveException e) {
            throw e;
        } catch (IOException e) {
            throw new ArchiveException("Archive request failed: " + e.getMessage(), e);
        }
    }

    private String errorMessage(String body) {
        try {
            JsonNode error = mapper.readTree(body).path("error");
            return error.isTextual() ? error.asText() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    /**
     * First series of the first statement result, or null if the statement returned none.
     */
    private static JsonNode firstSeries(JsonNode root, String query) throws ArchiveException {
        if (root == null || root.has("error")) {
            throw new ArchiveException("Archive error: " + (root == null ? "empty response" : root.get("error").asText()));
        }
        JsonNode result = root.path("results").path(0);
        if (result.has("error")) {
            throw new ArchiveException("Archive error for query " + query + ": " + result.get("error").asText());
        }
        if (result.path("partial").asBoolean(false)) {
            LOG.warn("Archive returned partial result for query: {}", query);
        }
        JsonNode series = result.path("series");
        return series.isArray() && series.size() > 0 ? series.get(0) : null;
    }

    private List<Row> parseRows(String seriesName, JsonNode series) throws ArchiveException {
        List<String> columns = new ArrayList<>();
        for (JsonNode column : series.path("columns")) {
            columns.add(column.asText());
        }

        RowSchema schema;
        try {
            schema = RowSchema.fromColumns(columns, TIME_COLUMN);
        } catch (IllegalArgumentException e) {
            throw new ArchiveException("Unexpected columns for " + seriesName + ": " + e.getMessage(), e);
        }

        int timeColumn = schema.getTimeColumn();
        List<Row> rows = new ArrayList<>();
        for (JsonNode record : series.path("values")) {
            List<Object> values = new ArrayList<>(record.size());
            for (JsonNode value : record) {
                values.add(toValue(value));
            }
            Instant time = parseTime(record.get(timeColumn));
            try {
                rows.add(schema.toRow(time, values));
            } catch (IllegalArgumentException e) {
                throw new ArchiveException("Malformed record for " + seriesName + " at " + time
                    + ": " + e.getMessage(), e);
            }
        }
        return rows;
    }

    private static Instant parseTime(JsonNode node) throws ArchiveException {
        if (node == null || node.isNull()) {
            throw new ArchiveException("Archive record without time");
        }
        if (node.isIntegralNumber()) {
            // epoch nanoseconds
            return Instant.ofEpochSecond(0, node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (RuntimeException e) {
            throw new ArchiveException("Invalid archive timestamp: " + node.asText(), e);
        }
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isIntegralNumber()) return node.asLong();
        if (node.isNumber()) return node.asDouble();
        if (node.isBoolean()) return node.asBoolean();
        return node.asText();
    }

    private static String selectClause(List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return "*";
        }
        return fields.stream().map(InfluxArchiveClient::quote).collect(Collectors.joining(", "));
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
