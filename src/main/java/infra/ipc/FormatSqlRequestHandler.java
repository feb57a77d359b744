package infra.ipc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import domain.format.FormatOptions;
import domain.format.KeywordCase;
import domain.format.KeywordCaseNormalizer;
import domain.format.SqlFormatter;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * JSON request/response adapter between an editor front end and the formatter.
 *
 * <p>Routes:
 * <ul>
 *   <li>{@code formatSQL}: {@code {"sql": "...", "options": {...}}} &rarr; {@code {"success":true,"data":{"sql":"..."}}}</li>
 *   <li>{@code uppercaseKeywords}: {@code {"sql": "..."}} &rarr; same response shape</li>
 * </ul>
 * Failures never throw; they are returned as {@code {"success":false,"error":"..."}}.
 *
 * <p>Recognized option keys: indentSize, useTab, keywordCase (upper/lower/unchanged),
 * breakBeforeComma, breakAfterComma, maxLineLength. Missing keys keep the defaults.</p>
 */
public final class FormatSqlRequestHandler {

    public static final String METHOD_FORMAT_SQL = "formatSQL";
    public static final String METHOD_UPPERCASE_KEYWORDS = "uppercaseKeywords";

    private static final String MISSING_SQL = "Missing sql field";

    private final Gson gson = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private final SqlFormatter formatter;
    private final KeywordCaseNormalizer normalizer;
    private final Map<String, Function<String, String>> routes = new HashMap<>();

    public FormatSqlRequestHandler(SqlFormatter formatter) {
        this.formatter = (formatter == null) ? new SqlFormatter() : formatter;
        this.normalizer = new KeywordCaseNormalizer(this.formatter.getVocabulary());
        routes.put(METHOD_FORMAT_SQL, this::formatSql);
        routes.put(METHOD_UPPERCASE_KEYWORDS, this::uppercaseKeywords);
    }

    /** Dispatches a request by method name. */
    public String handle(String method, String params) {
        Function<String, String> route = (method == null) ? null : routes.get(method);
        if (route == null) {
            return errorResponse("Unknown method: " + method);
        }
        return route.apply(params);
    }

    public String formatSql(String params) {
        try {
            JsonObject req = parseObject(params);
            String sql = sqlField(req);
            if (sql == null) return errorResponse(MISSING_SQL);

            FormatOptions options = readOptions(req.get("options"));
            return sqlResponse(formatter.format(sql, options));
        } catch (RuntimeException e) {
            return errorResponse(e.getMessage());
        }
    }

    public String uppercaseKeywords(String params) {
        try {
            JsonObject req = parseObject(params);
            String sql = sqlField(req);
            if (sql == null) return errorResponse(MISSING_SQL);
            return sqlResponse(normalizer.uppercaseKeywords(sql));
        } catch (RuntimeException e) {
            return errorResponse(e.getMessage());
        }
    }

    static FormatOptions readOptions(JsonElement raw) {
        if (raw == null || !raw.isJsonObject()) return FormatOptions.defaults();
        JsonObject o = raw.getAsJsonObject();
        FormatOptions d = FormatOptions.defaults();

        return FormatOptions.builder()
                .indentSize(intValue(o, "indentSize", d.getIndentSize()))
                .useTab(boolValue(o, "useTab", d.isUseTab()))
                .keywordCase(KeywordCase.parse(stringValue(o, "keywordCase"), d.getKeywordCase()))
                .breakBeforeComma(boolValue(o, "breakBeforeComma", d.isBreakBeforeComma()))
                .breakAfterComma(boolValue(o, "breakAfterComma", d.isBreakAfterComma()))
                .maxLineLength(intValue(o, "maxLineLength", d.getMaxLineLength()))
                .build();
    }

    private JsonObject parseObject(String params) {
        if (params == null || params.isBlank()) {
            throw new IllegalArgumentException("Empty request");
        }
        JsonElement el;
        try {
            el = JsonParser.parseString(params);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
        }
        if (el == null || !el.isJsonObject()) {
            throw new IllegalArgumentException("Request must be a JSON object");
        }
        return el.getAsJsonObject();
    }

    private static String sqlField(JsonObject req) {
        JsonElement el = req.get("sql");
        if (el == null || !el.isJsonPrimitive() || !el.getAsJsonPrimitive().isString()) return null;
        return el.getAsString();
    }

    private static int intValue(JsonObject o, String key, int def) {
        JsonElement el = o.get(key);
        if (el == null || !el.isJsonPrimitive()) return def;
        JsonPrimitive p = el.getAsJsonPrimitive();
        if (p.isNumber()) return p.getAsInt();
        if (p.isString()) {
            try {
                return Integer.parseInt(p.getAsString().trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    private static boolean boolValue(JsonObject o, String key, boolean def) {
        JsonElement el = o.get(key);
        if (el == null || !el.isJsonPrimitive()) return def;
        JsonPrimitive p = el.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean();
        if (p.isString()) {
            String v = p.getAsString().trim();
            if (v.equalsIgnoreCase("true")) return true;
            if (v.equalsIgnoreCase("false")) return false;
        }
        return def;
    }

    private static String stringValue(JsonObject o, String key) {
        JsonElement el = o.get(key);
        if (el == null || !el.isJsonPrimitive()) return null;
        return el.getAsString();
    }

    private String sqlResponse(String sql) {
        JsonObject data = new JsonObject();
        data.addProperty("sql", sql);

        JsonObject res = new JsonObject();
        res.addProperty("success", true);
        res.add("data", data);
        return gson.toJson(res);
    }

    private String errorResponse(String message) {
        JsonObject res = new JsonObject();
        res.addProperty("success", false);
        res.addProperty("error", message == null ? "" : message);
        return gson.toJson(res);
    }
}
